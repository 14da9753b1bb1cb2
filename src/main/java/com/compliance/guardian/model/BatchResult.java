package com.compliance.guardian.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Outcome of importing one batch of rows")
public class BatchResult {
    private String batchId;
    @Schema(description = "Rows received", example = "3")
    private int totalRows;
    @Schema(description = "Emails persisted", example = "2")
    private int imported;
    private int classified;
    @Schema(description = "Emails whose sender ended up flagged", example = "1")
    private int flagged;
    private int casesCreated;
    @Schema(description = "Rows skipped during normalization or processing", example = "1")
    private int skipped;
    @Builder.Default
    private List<SkipReason> skipReasons = new ArrayList<>();
}
