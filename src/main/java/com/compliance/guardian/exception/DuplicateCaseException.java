package com.compliance.guardian.exception;

public class DuplicateCaseException extends GuardianException {

    private final String emailId;
    private final String existingCaseId;

    public DuplicateCaseException(String emailId, String existingCaseId) {
        super("Email " + emailId + " already has case " + existingCaseId);
        this.emailId = emailId;
        this.existingCaseId = existingCaseId;
    }

    public String getEmailId() {
        return emailId;
    }

    public String getExistingCaseId() {
        return existingCaseId;
    }
}
