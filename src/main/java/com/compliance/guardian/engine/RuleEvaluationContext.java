package com.compliance.guardian.engine;

import com.compliance.guardian.model.Category;
import com.compliance.guardian.model.Email;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Running state while the admin rules for one email are evaluated. Action
 * handlers mutate it in priority order; conditions of later rules see the
 * effects of earlier ones.
 */
@Data
@Builder
public class RuleEvaluationContext {
    private final Email email;

    // Classifier output, possibly overridden by a FORCE_CATEGORY rule
    private double riskScore;
    private Category category;
    private boolean categoryForced;

    // Registry state of the sender when the snapshot was taken
    private final boolean senderFlagged;

    private boolean flagged;
    private boolean escalate;

    @Builder.Default
    private List<String> matchedRuleIds = new ArrayList<>();

    @Builder.Default
    private List<String> reasons = new ArrayList<>();
}
