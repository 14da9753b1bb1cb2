package com.compliance.guardian.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CaseStatusUpdateRequest {
    @Schema(example = "UNDER_REVIEW")
    private String targetStatus;
    @Schema(description = "Version the caller last read", example = "1")
    private Integer expectedVersion;
    @Schema(example = "j.doe")
    private String actor;
    private String reason;
    @Schema(description = "Stored when the target status is terminal")
    private String resolutionNotes;
}
