package com.compliance.guardian.engine;

import com.compliance.guardian.config.MetricsConfig;
import com.compliance.guardian.model.AdminRule;
import com.compliance.guardian.model.Classification;
import com.compliance.guardian.model.Email;
import com.compliance.guardian.model.RuleAction;
import com.compliance.guardian.model.RuleCondition;
import com.compliance.guardian.model.RuleOutcome;
import com.compliance.guardian.model.SenderRegistrySnapshot;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Applies admin rules to a classified email in priority order.
 * Each RuleAction is handled by a registered RuleActionHandler.
 */
@Component
public class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private final Map<RuleAction, RuleActionHandler> handlerMap;
    private final ConditionMatcher conditionMatcher;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public RuleEngine(List<RuleActionHandler> handlers, ConditionMatcher conditionMatcher,
                      Tracer tracer, MetricsConfig metricsConfig) {
        this.handlerMap = new EnumMap<>(RuleAction.class);
        this.conditionMatcher = conditionMatcher;
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        // Auto-register all action handler implementations
        for (RuleActionHandler handler : handlers) {
            handlerMap.put(handler.getSupportedAction(), handler);
            log.info("Registered rule action handler: {} -> {}",
                    handler.getSupportedAction(), handler.getClass().getSimpleName());
        }
    }

    /**
     * Evaluate the rules against an email that has already been classified.
     *
     * @param email          the email under evaluation (not modified)
     * @param classification classifier output the rules start from
     * @param rules          rules to apply; disabled ones are skipped
     * @param registry       sender registry snapshot for the whole batch
     * @return the accumulated effect of all matching rules
     */
    @Observed(name = "rules.evaluate", contextualName = "evaluate-admin-rules")
    public RuleOutcome evaluate(Email email, Classification classification,
                                List<AdminRule> rules, SenderRegistrySnapshot registry) {
        boolean senderFlagged = registry.isActive(email.getSender());
        RuleEvaluationContext context = RuleEvaluationContext.builder()
                .email(email)
                .riskScore(classification.getRiskScore())
                .category(classification.getCategory())
                .senderFlagged(senderFlagged)
                .flagged(senderFlagged)
                .build();

        List<AdminRule> ordered = rules.stream()
                .filter(AdminRule::isEnabled)
                .sorted(AdminRule.EVALUATION_ORDER)
                .toList();

        for (AdminRule rule : ordered) {
            RuleActionHandler handler = rule.getAction() != null ? handlerMap.get(rule.getAction()) : null;
            if (handler == null) {
                log.warn("No action handler registered for action: {}, rule: {}",
                        rule.getAction(), rule.getRuleId());
                continue;
            }

            Span ruleSpan = tracer.nextSpan()
                    .name("rule.evaluate." + rule.getAction())
                    .tag("rule.id", String.valueOf(rule.getRuleId()))
                    .tag("rule.priority", String.valueOf(rule.getPriority()))
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(ruleSpan)) {
                boolean matched = conditionsMatch(rule, context);
                ruleSpan.tag("rule.matched", String.valueOf(matched));
                if (!matched) {
                    continue;
                }

                String effect = handler.apply(rule, context);
                context.getMatchedRuleIds().add(rule.getRuleId());
                context.getReasons().add(rule.getRuleId() + " (" + rule.getName() + "): " + effect);
                metricsConfig.recordRuleTriggered(rule.getAction().name());
                log.debug("Rule matched: {} for email {}: {}", rule.getRuleId(), email.getEmailId(), effect);

                if (handler.haltsEvaluation()) {
                    log.debug("Rule {} stopped evaluation for email {}", rule.getRuleId(), email.getEmailId());
                    break;
                }
            } catch (MalformedRuleException e) {
                ruleSpan.error(e);
                metricsConfig.recordMalformedRule(String.valueOf(rule.getRuleId()));
                log.warn("Skipping malformed rule {} for email {}: {}",
                        rule.getRuleId(), email.getEmailId(), e.getMessage());
            } finally {
                ruleSpan.end();
            }
        }

        return RuleOutcome.builder()
                .category(context.getCategory())
                .categoryForced(context.isCategoryForced())
                .flagged(context.isFlagged())
                .escalate(context.isEscalate())
                .matchedRuleIds(new ArrayList<>(context.getMatchedRuleIds()))
                .reasons(new ArrayList<>(context.getReasons()))
                .build();
    }

    /**
     * Conditions are ANDed. A rule without conditions never matches.
     */
    private boolean conditionsMatch(AdminRule rule, RuleEvaluationContext context) throws MalformedRuleException {
        List<RuleCondition> conditions = rule.getConditions();
        if (conditions == null || conditions.isEmpty()) {
            return false;
        }
        for (RuleCondition condition : conditions) {
            if (!conditionMatcher.matches(condition, context)) {
                return false;
            }
        }
        return true;
    }
}
