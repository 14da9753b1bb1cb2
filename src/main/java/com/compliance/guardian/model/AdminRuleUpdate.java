package com.compliance.guardian.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Partial update of an admin rule. Absent fields keep their stored value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Fields to change on an admin rule; omitted fields are left as they are")
public class AdminRuleUpdate {
    private String name;
    private String description;
    private List<RuleCondition> conditions;
    private RuleAction action;
    private String actionValue;

    @Schema(example = "10")
    private Integer priority;

    private Boolean enabled;
}
