package com.compliance.guardian.engine.actions;

import com.compliance.guardian.engine.MalformedRuleException;
import com.compliance.guardian.engine.RuleActionHandler;
import com.compliance.guardian.engine.RuleEvaluationContext;
import com.compliance.guardian.model.AdminRule;
import com.compliance.guardian.model.Category;
import com.compliance.guardian.model.RuleAction;
import org.springframework.stereotype.Component;

/**
 * Overrides the classifier's category. Rules run in priority order and the first
 * override wins, so a later FORCE_CATEGORY rule leaves the category alone.
 */
@Component
public class ForceCategoryActionHandler implements RuleActionHandler {

    @Override
    public RuleAction getSupportedAction() {
        return RuleAction.FORCE_CATEGORY;
    }

    @Override
    public String apply(AdminRule rule, RuleEvaluationContext context) throws MalformedRuleException {
        Category target = Category.fromLabel(rule.getActionValue());
        if (target == null) {
            throw new MalformedRuleException("unknown target category '" + rule.getActionValue() + "'");
        }
        if (context.isCategoryForced()) {
            return "category already forced to " + context.getCategory() + ", " + target + " ignored";
        }
        Category previous = context.getCategory();
        context.setCategory(target);
        context.setCategoryForced(true);
        return "category " + previous + " -> " + target;
    }
}
