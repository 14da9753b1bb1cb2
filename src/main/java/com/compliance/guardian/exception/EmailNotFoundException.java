package com.compliance.guardian.exception;

public class EmailNotFoundException extends GuardianException {

    public EmailNotFoundException(String emailId) {
        super("Email not found: " + emailId);
    }
}
