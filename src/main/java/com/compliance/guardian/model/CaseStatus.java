package com.compliance.guardian.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Investigation case states and the transitions allowed between them.
 * CLOSED and FALSE_POSITIVE are terminal.
 */
public enum CaseStatus {
    OPEN,
    UNDER_REVIEW,
    ESCALATED,
    CLOSED,
    FALSE_POSITIVE;

    private static final Map<CaseStatus, Set<CaseStatus>> ALLOWED = new EnumMap<>(CaseStatus.class);

    static {
        ALLOWED.put(OPEN, Collections.unmodifiableSet(EnumSet.of(UNDER_REVIEW, ESCALATED, FALSE_POSITIVE)));
        ALLOWED.put(UNDER_REVIEW, Collections.unmodifiableSet(EnumSet.of(ESCALATED, CLOSED, FALSE_POSITIVE)));
        ALLOWED.put(ESCALATED, Collections.unmodifiableSet(EnumSet.of(CLOSED)));
        ALLOWED.put(CLOSED, Collections.unmodifiableSet(EnumSet.noneOf(CaseStatus.class)));
        ALLOWED.put(FALSE_POSITIVE, Collections.unmodifiableSet(EnumSet.noneOf(CaseStatus.class)));
    }

    /**
     * Case-insensitive lookup, independent of the default locale.
     *
     * @throws IllegalArgumentException for blank or unknown names
     */
    public static CaseStatus parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("status is blank");
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }

    public Set<CaseStatus> allowedTargets() {
        return ALLOWED.get(this);
    }

    public boolean canTransitionTo(CaseStatus target) {
        return target != null && ALLOWED.get(this).contains(target);
    }

    public boolean isTerminal() {
        return ALLOWED.get(this).isEmpty();
    }
}
