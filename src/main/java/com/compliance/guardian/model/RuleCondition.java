package com.compliance.guardian.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single predicate of an admin rule. Kept as raw strings so a malformed
 * condition can be stored and reported instead of rejected at load time.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RuleCondition {

    @Schema(description = "Email field to test", example = "SUBJECT")
    private String field;

    @Schema(description = "Comparison operator", example = "CONTAINS")
    private String operator;

    @Schema(description = "Value to compare against", example = "confidential")
    private String value;
}
