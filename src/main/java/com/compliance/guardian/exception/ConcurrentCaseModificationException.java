package com.compliance.guardian.exception;

/**
 * The case changed since the caller read it. Re-read and retry.
 */
public class ConcurrentCaseModificationException extends GuardianException {

    private final int expectedVersion;
    private final int actualVersion;

    public ConcurrentCaseModificationException(String caseId, int expectedVersion, int actualVersion) {
        super("Case " + caseId + " was modified concurrently: expected version "
                + expectedVersion + " but found " + actualVersion);
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public int getExpectedVersion() {
        return expectedVersion;
    }

    public int getActualVersion() {
        return actualVersion;
    }
}
