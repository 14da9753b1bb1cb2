package com.compliance.guardian.engine;

import com.compliance.guardian.model.Category;
import com.compliance.guardian.model.RuleCondition;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates a single rule condition against the current evaluation state.
 * String comparisons are case-insensitive. A list field matches when any element
 * matches, and a negated operator holds when no element matches.
 */
@Component
public class ConditionMatcher {

    public boolean matches(RuleCondition condition, RuleEvaluationContext context) throws MalformedRuleException {
        if (condition == null) {
            throw new MalformedRuleException("condition is null");
        }
        RuleField field = RuleField.parse(condition.getField());
        ConditionOperator operator = ConditionOperator.parse(condition.getOperator());
        String expected = condition.getValue();
        if (expected == null) {
            throw new MalformedRuleException("condition on " + field + " has no value");
        }
        if (field == RuleField.CATEGORY && (operator == ConditionOperator.EQUALS
                || operator == ConditionOperator.NOT_EQUALS || operator == ConditionOperator.IN)) {
            expected = canonicalCategories(expected, operator);
        }

        List<String> actual = field.extract(context);

        if (operator.isNumeric()) {
            return compareNumeric(actual, expected, operator);
        }

        Matcher test = compile(operator, expected);
        if (operator.isNegated()) {
            for (String value : actual) {
                if (!test.holds(value)) return false;
            }
            return true;
        }
        for (String value : actual) {
            if (test.holds(value)) return true;
        }
        return false;
    }

    @FunctionalInterface
    private interface Matcher {
        boolean holds(String value);
    }

    private Matcher compile(ConditionOperator operator, String expected) throws MalformedRuleException {
        String needle = expected.toLowerCase(Locale.ROOT);
        switch (operator) {
            case EQUALS:
                return value -> value.equalsIgnoreCase(expected);
            case NOT_EQUALS:
                return value -> !value.equalsIgnoreCase(expected);
            case CONTAINS:
                return value -> value.toLowerCase(Locale.ROOT).contains(needle);
            case NOT_CONTAINS:
                return value -> !value.toLowerCase(Locale.ROOT).contains(needle);
            case STARTS_WITH:
                return value -> value.toLowerCase(Locale.ROOT).startsWith(needle);
            case ENDS_WITH:
                return value -> value.toLowerCase(Locale.ROOT).endsWith(needle);
            case MATCHES:
                try {
                    Pattern pattern = Pattern.compile(expected, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
                    return value -> pattern.matcher(value).find();
                } catch (PatternSyntaxException e) {
                    throw new MalformedRuleException("invalid regex '" + expected + "'", e);
                }
            case IN:
                Set<String> options = new HashSet<>();
                for (String option : expected.split(",")) {
                    String trimmed = option.trim().toLowerCase(Locale.ROOT);
                    if (!trimmed.isEmpty()) options.add(trimmed);
                }
                return value -> options.contains(value.trim().toLowerCase(Locale.ROOT));
            default:
                throw new MalformedRuleException("operator " + operator + " does not apply to text");
        }
    }

    private boolean compareNumeric(List<String> actual, String expected, ConditionOperator operator)
            throws MalformedRuleException {
        double threshold;
        try {
            threshold = Double.parseDouble(expected.trim());
        } catch (NumberFormatException e) {
            throw new MalformedRuleException("non-numeric value '" + expected + "' for " + operator, e);
        }

        for (String value : actual) {
            double number;
            try {
                number = Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                // a non-numeric field value simply does not satisfy the comparison
                continue;
            }
            boolean holds = operator == ConditionOperator.GREATER_THAN ? number > threshold : number < threshold;
            if (holds) return true;
        }
        return false;
    }

    /**
     * Rewrite category labels ("policy violation", "cleared") to enum names so they
     * compare equal to the evaluated category.
     */
    private String canonicalCategories(String expected, ConditionOperator operator) throws MalformedRuleException {
        if (operator != ConditionOperator.IN) {
            return canonicalCategory(expected);
        }
        StringBuilder joined = new StringBuilder();
        for (String option : expected.split(",")) {
            if (option.isBlank()) continue;
            if (joined.length() > 0) joined.append(',');
            joined.append(canonicalCategory(option));
        }
        return joined.toString();
    }

    private String canonicalCategory(String label) throws MalformedRuleException {
        Category category = Category.fromLabel(label);
        if (category == null) {
            throw new MalformedRuleException("unknown category '" + label + "'");
        }
        return category.name();
    }
}
