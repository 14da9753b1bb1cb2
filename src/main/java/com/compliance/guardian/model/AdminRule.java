package com.compliance.guardian.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Administrator rule applied after classification")
public class AdminRule {

    // Evaluation order: lower priority first, rule id breaks ties
    public static final Comparator<AdminRule> EVALUATION_ORDER =
            Comparator.comparingInt(AdminRule::getPriority)
                    .thenComparing(AdminRule::getRuleId, Comparator.nullsLast(Comparator.naturalOrder()));

    @Schema(description = "Unique rule identifier", example = "RULE-CONFIDENTIAL")
    private String ruleId;

    @Schema(description = "Rule display name", example = "Confidential keyword to external domain")
    private String name;

    private String description;

    @Schema(description = "Conditions, all of which must hold")
    @Builder.Default
    private List<RuleCondition> conditions = new ArrayList<>();

    @Schema(description = "Effect when the rule matches", example = "CREATE_CASE")
    private RuleAction action;

    @Schema(description = "Target category for FORCE_CATEGORY", example = "POLICY_VIOLATION")
    private String actionValue;

    @Schema(description = "Lower values are evaluated first", example = "10")
    private int priority;

    @Builder.Default
    private boolean enabled = true;

    private long createdAt;

    private long updatedAt;
}
