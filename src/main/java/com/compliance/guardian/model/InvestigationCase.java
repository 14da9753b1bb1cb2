package com.compliance.guardian.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Investigation case opened for a risky email")
public class InvestigationCase {

    @Schema(description = "Unique case identifier")
    private String caseId;

    @Schema(description = "Email under investigation")
    private String emailId;

    @Schema(description = "Current lifecycle state", example = "OPEN")
    private CaseStatus status;

    @Schema(description = "Investigator the case is assigned to", example = "j.doe")
    private String assignedTo;

    @Schema(description = "Why the case was opened", example = "Risk score 0.93 (POLICY_VIOLATION)")
    private String escalationReason;

    private long createdAt;

    private long updatedAt;

    @Schema(description = "Optimistic-lock version, starts at 1 and grows with every write", example = "1")
    private int version;

    private String resolutionNotes;

    @Schema(description = "Status transitions only, oldest first")
    @Builder.Default
    private List<CaseTransition> auditTrail = new ArrayList<>();

    @Schema(description = "Investigator assignments, oldest first")
    @Builder.Default
    private List<CaseAssignment> assignmentHistory = new ArrayList<>();
}
