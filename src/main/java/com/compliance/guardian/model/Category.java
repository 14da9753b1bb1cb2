package com.compliance.guardian.model;

import java.util.Locale;
import java.util.Map;

/**
 * Closed set of classification outcomes. The declaration order doubles as the
 * tie-break order when two classes have the same posterior.
 */
public enum Category {
    BENIGN,
    NEEDS_REVIEW,
    POLICY_VIOLATION,
    UNKNOWN;

    // Labels seen in imported outcome columns and in admin rule values
    private static final Map<String, Category> ALIASES = Map.ofEntries(
            Map.entry("benign", BENIGN),
            Map.entry("cleared", BENIGN),
            Map.entry("clean", BENIGN),
            Map.entry("safe", BENIGN),
            Map.entry("false_positive", BENIGN),
            Map.entry("needs_review", NEEDS_REVIEW),
            Map.entry("review", NEEDS_REVIEW),
            Map.entry("under_review", NEEDS_REVIEW),
            Map.entry("pending_review", NEEDS_REVIEW),
            Map.entry("suspicious", NEEDS_REVIEW),
            Map.entry("policy_violation", POLICY_VIOLATION),
            Map.entry("violation", POLICY_VIOLATION),
            Map.entry("escalated", POLICY_VIOLATION),
            Map.entry("confirmed", POLICY_VIOLATION),
            Map.entry("unknown", UNKNOWN));

    /**
     * Resolve a free-form label ("Policy Violation", "needs-review", "CLEARED") to a category.
     *
     * @return the category, or null when the label is absent or not recognized
     */
    public static Category fromLabel(String label) {
        if (label == null) return null;
        String key = label.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        if (key.isEmpty()) return null;
        return ALIASES.get(key);
    }
}
