package com.compliance.guardian.engine.actions;

import com.compliance.guardian.engine.RuleActionHandler;
import com.compliance.guardian.engine.RuleEvaluationContext;
import com.compliance.guardian.model.AdminRule;
import com.compliance.guardian.model.RuleAction;
import org.springframework.stereotype.Component;

/**
 * Marks the email as coming from a flagged sender. The sender registry itself is
 * only changed through explicit flag/unflag calls.
 */
@Component
public class FlagSenderActionHandler implements RuleActionHandler {

    @Override
    public RuleAction getSupportedAction() {
        return RuleAction.FLAG_SENDER;
    }

    @Override
    public String apply(AdminRule rule, RuleEvaluationContext context) {
        context.setFlagged(true);
        return "sender flagged";
    }
}
