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
@Schema(description = "Sender registry entry")
public class FlaggedSender {

    @Schema(description = "Normalized (lower-case) sender address", example = "trader@example.com")
    private String sender;

    private String reason;

    private long flaggedAt;

    private String flaggedBy;

    @Builder.Default
    private boolean active = true;

    private long unflaggedAt;

    private String unflaggedBy;

    @Schema(description = "How many times the sender has been flagged", example = "1")
    private int flagCount;
}
