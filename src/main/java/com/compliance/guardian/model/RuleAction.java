package com.compliance.guardian.model;

public enum RuleAction {
    FLAG_SENDER,
    FORCE_CATEGORY,
    CREATE_CASE,
    IGNORE
}
