package com.compliance.guardian.engine;

import com.compliance.guardian.model.Email;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Email attributes an admin rule condition can test. List-valued fields yield
 * one value per element; absent values yield an empty list.
 */
public enum RuleField {
    SENDER,
    SENDER_DOMAIN,
    SUBJECT,
    BODY,
    TEXT,
    RECIPIENTS,
    ATTACHMENTS,
    DEPARTMENT,
    BUSINESS_UNIT,
    CATEGORY,
    RISK_SCORE,
    SENDER_FLAGGED;

    public static RuleField parse(String raw) throws MalformedRuleException {
        if (raw == null || raw.isBlank()) {
            throw new MalformedRuleException("condition field is missing");
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new MalformedRuleException("unknown condition field '" + raw + "'");
        }
    }

    public List<String> extract(RuleEvaluationContext context) {
        Email email = context.getEmail();
        return switch (this) {
            case SENDER -> single(email.getSender());
            case SENDER_DOMAIN -> single(email.getSenderDomain());
            case SUBJECT -> single(email.getSubject());
            case BODY -> single(email.getBody());
            case TEXT -> single(email.getText());
            case RECIPIENTS -> nonNull(email.getRecipients());
            case ATTACHMENTS -> nonNull(email.getAttachments());
            case DEPARTMENT -> single(email.getDepartment());
            case BUSINESS_UNIT -> single(email.getBusinessUnit());
            case CATEGORY -> single(context.getCategory() != null ? context.getCategory().name() : null);
            case RISK_SCORE -> single(String.valueOf(context.getRiskScore()));
            case SENDER_FLAGGED -> single(String.valueOf(context.isSenderFlagged()));
        };
    }

    private static List<String> single(String value) {
        return value == null ? List.of() : List.of(value);
    }

    private static List<String> nonNull(List<String> values) {
        if (values == null) return List.of();
        List<String> result = new ArrayList<>(values.size());
        for (String v : values) {
            if (v != null) result.add(v);
        }
        return result;
    }
}
