package com.compliance.guardian.engine.actions;

import com.compliance.guardian.engine.RuleActionHandler;
import com.compliance.guardian.engine.RuleEvaluationContext;
import com.compliance.guardian.model.AdminRule;
import com.compliance.guardian.model.RuleAction;
import org.springframework.stereotype.Component;

@Component
public class CreateCaseActionHandler implements RuleActionHandler {

    @Override
    public RuleAction getSupportedAction() {
        return RuleAction.CREATE_CASE;
    }

    @Override
    public String apply(AdminRule rule, RuleEvaluationContext context) {
        context.setEscalate(true);
        return "escalated for investigation";
    }

    @Override
    public boolean haltsEvaluation() {
        return true;
    }
}
