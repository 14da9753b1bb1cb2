package com.compliance.guardian.controller;

import com.compliance.guardian.model.AdminRule;
import com.compliance.guardian.model.AdminRuleUpdate;
import com.compliance.guardian.service.AdminRuleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/rules")
@Tag(name = "Rules", description = "Manage admin rules applied after classification")
public class RuleController {

    private final AdminRuleService ruleService;

    public RuleController(AdminRuleService ruleService) {
        this.ruleService = ruleService;
    }

    @Operation(summary = "List all admin rules",
            description = "Returns all rules in evaluation order (priority, then rule id), including disabled ones.")
    @GetMapping
    public ResponseEntity<List<AdminRule>> listRules() {
        return ResponseEntity.ok(ruleService.getAllRules());
    }

    @Operation(summary = "Get a specific rule by ID")
    @GetMapping("/{ruleId}")
    public ResponseEntity<AdminRule> getRule(
            @Parameter(description = "Rule ID", example = "RULE-CONFIDENTIAL")
            @PathVariable String ruleId) {
        AdminRule rule = ruleService.getRule(ruleId);
        if (rule == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(rule);
    }

    @Operation(summary = "Create a new admin rule",
            description = "Conditions are stored as written. A rule whose conditions cannot be evaluated " +
                    "is skipped at evaluation time and logged.")
    @PostMapping
    public ResponseEntity<AdminRule> createRule(@RequestBody AdminRule rule) {
        if (rule.getName() == null || rule.getAction() == null) {
            return ResponseEntity.badRequest().build();
        }
        AdminRule created = ruleService.createRule(rule);
        return ResponseEntity.ok(created);
    }

    @Operation(summary = "Update an existing rule",
            description = "Only the fields present in the body are changed; omitted fields keep their value.")
    @PutMapping("/{ruleId}")
    public ResponseEntity<AdminRule> updateRule(
            @Parameter(description = "Rule ID", example = "RULE-CONFIDENTIAL")
            @PathVariable String ruleId,
            @RequestBody AdminRuleUpdate update) {
        AdminRule result = ruleService.updateRule(ruleId, update);
        if (result == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "Delete a rule")
    @DeleteMapping("/{ruleId}")
    public ResponseEntity<Void> deleteRule(
            @Parameter(description = "Rule ID", example = "RULE-CONFIDENTIAL")
            @PathVariable String ruleId) {
        boolean deleted = ruleService.deleteRule(ruleId);
        if (!deleted) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }
}
