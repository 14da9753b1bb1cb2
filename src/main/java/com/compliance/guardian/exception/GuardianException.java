package com.compliance.guardian.exception;

/**
 * Base type for domain failures surfaced to callers.
 */
public class GuardianException extends RuntimeException {

    public GuardianException(String message) {
        super(message);
    }

    public GuardianException(String message, Throwable cause) {
        super(message, cause);
    }
}
