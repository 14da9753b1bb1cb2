package com.compliance.guardian.engine.actions;

import com.compliance.guardian.engine.RuleActionHandler;
import com.compliance.guardian.engine.RuleEvaluationContext;
import com.compliance.guardian.model.AdminRule;
import com.compliance.guardian.model.RuleAction;
import org.springframework.stereotype.Component;

/**
 * Records the match without changing anything.
 */
@Component
public class IgnoreActionHandler implements RuleActionHandler {

    @Override
    public RuleAction getSupportedAction() {
        return RuleAction.IGNORE;
    }

    @Override
    public String apply(AdminRule rule, RuleEvaluationContext context) {
        return "no action";
    }
}
