package com.compliance.guardian.engine;

/**
 * A stored rule cannot be evaluated as written (unknown field or operator, bad
 * regex, non-numeric threshold, unknown target category). The engine treats the
 * rule as non-matching.
 */
public class MalformedRuleException extends Exception {

    public MalformedRuleException(String message) {
        super(message);
    }

    public MalformedRuleException(String message, Throwable cause) {
        super(message, cause);
    }
}
