package com.compliance.guardian.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One audit trail entry. fromStatus is null for the creation entry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CaseTransition {
    private String actor;
    private CaseStatus fromStatus;
    private CaseStatus toStatus;
    private long timestamp;
    private String reason;
}
