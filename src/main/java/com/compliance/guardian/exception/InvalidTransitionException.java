package com.compliance.guardian.exception;

import com.compliance.guardian.model.CaseStatus;

public class InvalidTransitionException extends GuardianException {

    private final CaseStatus from;
    private final CaseStatus to;

    public InvalidTransitionException(String caseId, CaseStatus from, CaseStatus to) {
        super("Case " + caseId + " cannot move from " + from + " to " + to);
        this.from = from;
        this.to = to;
    }

    public CaseStatus getFrom() {
        return from;
    }

    public CaseStatus getTo() {
        return to;
    }
}
