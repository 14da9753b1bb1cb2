package com.compliance.guardian.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One change of investigator. Kept apart from the audit trail, which only
 * records status transitions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CaseAssignment {
    private String actor;
    private String previousAssignee;
    private String assignee;
    private CaseStatus status;
    private long timestamp;
}
