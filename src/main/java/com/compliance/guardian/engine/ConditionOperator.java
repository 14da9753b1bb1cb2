package com.compliance.guardian.engine;

import java.util.Locale;

public enum ConditionOperator {
    EQUALS,
    NOT_EQUALS,
    CONTAINS,
    NOT_CONTAINS,
    STARTS_WITH,
    ENDS_WITH,
    MATCHES,
    IN,
    GREATER_THAN,
    LESS_THAN;

    public static ConditionOperator parse(String raw) throws MalformedRuleException {
        if (raw == null || raw.isBlank()) {
            throw new MalformedRuleException("condition operator is missing");
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new MalformedRuleException("unknown condition operator '" + raw + "'");
        }
    }

    /**
     * Negated operators hold when no element of a list field matches.
     */
    public boolean isNegated() {
        return this == NOT_EQUALS || this == NOT_CONTAINS;
    }

    public boolean isNumeric() {
        return this == GREATER_THAN || this == LESS_THAN;
    }
}
