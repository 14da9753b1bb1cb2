package com.compliance.guardian.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Net effect of all matching admin rules on one email.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RuleOutcome {
    private Category category;
    private boolean categoryForced;
    private boolean flagged;
    private boolean escalate;
    @Builder.Default
    private List<String> matchedRuleIds = new ArrayList<>();
    @Builder.Default
    private List<String> reasons = new ArrayList<>();
}
