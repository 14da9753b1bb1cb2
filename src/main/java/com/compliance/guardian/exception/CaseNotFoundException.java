package com.compliance.guardian.exception;

public class CaseNotFoundException extends GuardianException {

    public CaseNotFoundException(String caseId) {
        super("Case not found: " + caseId);
    }
}
