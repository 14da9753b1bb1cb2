package com.compliance.guardian.engine;

import com.compliance.guardian.model.AdminRule;
import com.compliance.guardian.model.RuleAction;

/**
 * Applies the effect of a matched admin rule. One implementation per RuleAction.
 */
public interface RuleActionHandler {

    RuleAction getSupportedAction();

    /**
     * Apply the rule's effect to the evaluation state.
     *
     * @return a short human-readable description of what changed, recorded in the outcome
     * @throws MalformedRuleException if the rule's action value cannot be applied
     */
    String apply(AdminRule rule, RuleEvaluationContext context) throws MalformedRuleException;

    /**
     * Whether evaluation stops after this action fires.
     */
    default boolean haltsEvaluation() {
        return false;
    }
}
