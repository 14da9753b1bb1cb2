package com.compliance.guardian.engine.heuristic;

import com.compliance.guardian.config.GuardianProperties;
import com.compliance.guardian.model.Category;
import com.compliance.guardian.model.Email;
import com.compliance.guardian.model.HeuristicAssessment;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Scores an email from configured keyword lists, its sender domain and its
 * attachment names. Used in place of the classifier until a model is trained.
 *
 * <p>Points: +riskKeywordPoints per distinct risk keyword, -exclusionKeywordPoints per
 * exclusion keyword occurrence, +personalDomainPoints for personal mail domains,
 * -trustedDomainPoints for trusted suffixes, +riskyAttachmentPoints when any attachment
 * has a risky extension (otherwise +attachmentPoints for having attachments).
 * The score is {@code points / saturationPoints} clamped to [0, 1].
 * Automated and no-reply mail is whitelisted with score 0 and category BENIGN.
 */
@Component
public class KeywordRiskAnalyzer {

    private final GuardianProperties.Heuristics config;
    private final Pattern riskPattern;
    private final Pattern exclusionPattern;

    public KeywordRiskAnalyzer(GuardianProperties properties) {
        this.config = properties.getHeuristics();
        this.riskPattern = keywordPattern(config.getRiskKeywords());
        this.exclusionPattern = keywordPattern(config.getExclusionKeywords());
    }

    public HeuristicAssessment assess(Email email) {
        String sender = lower(email.getSender());
        String subject = lower(email.getSubject());

        String whitelistReason = whitelistReason(sender, subject);
        if (whitelistReason != null) {
            return HeuristicAssessment.builder()
                    .points(0)
                    .riskScore(0.0)
                    .category(Category.BENIGN)
                    .whitelisted(true)
                    .riskFactors(new ArrayList<>(List.of(whitelistReason)))
                    .build();
        }

        String text = email.getText() + " " + String.join(" ", email.getAttachments());
        List<String> factors = new ArrayList<>();
        int points = 0;

        int exclusions = 0;
        if (exclusionPattern != null) {
            Matcher m = exclusionPattern.matcher(text);
            while (m.find()) {
                exclusions++;
            }
        }
        if (exclusions > 0) {
            points -= exclusions * config.getExclusionKeywordPoints();
            factors.add("exclusion_keywords:" + exclusions);
        }

        Set<String> riskMatches = new LinkedHashSet<>();
        if (riskPattern != null) {
            Matcher m = riskPattern.matcher(text);
            while (m.find()) {
                riskMatches.add(m.group().toLowerCase(Locale.ROOT));
            }
        }
        if (!riskMatches.isEmpty()) {
            points += riskMatches.size() * config.getRiskKeywordPoints();
            riskMatches.forEach(k -> factors.add("keyword:" + k));
        }

        String domain = lower(email.getSenderDomain());
        if (!domain.isEmpty()) {
            if (config.getPersonalDomains().stream().anyMatch(d -> domainMatches(domain, d))) {
                points += config.getPersonalDomainPoints();
                factors.add("personal_email_domain");
            }
            if (config.getTrustedDomainSuffixes().stream().anyMatch(s -> domain.endsWith(lower(s)))) {
                points -= config.getTrustedDomainPoints();
                factors.add("trusted_domain");
            }
        }

        List<String> attachments = email.getAttachments() != null ? email.getAttachments() : List.of();
        if (!attachments.isEmpty()) {
            boolean risky = attachments.stream()
                    .map(KeywordRiskAnalyzer::lower)
                    .anyMatch(name -> config.getRiskyExtensions().stream().anyMatch(ext -> name.endsWith(lower(ext))));
            if (risky) {
                points += config.getRiskyAttachmentPoints();
                factors.add("risky_attachments");
            } else {
                points += config.getAttachmentPoints();
                factors.add("has_attachments");
            }
        }

        double score = Math.max(0.0, Math.min(1.0, (double) points / config.getSaturationPoints()));
        return HeuristicAssessment.builder()
                .points(points)
                .riskScore(score)
                .category(categoryFor(points))
                .whitelisted(false)
                .riskFactors(factors)
                .build();
    }

    private Category categoryFor(int points) {
        if (points >= config.getViolationPoints()) return Category.POLICY_VIOLATION;
        if (points >= config.getReviewPoints()) return Category.NEEDS_REVIEW;
        if (points < 0) return Category.BENIGN;
        return Category.UNKNOWN;
    }

    private String whitelistReason(String sender, String subject) {
        String domain = sender.contains("@") ? sender.substring(sender.lastIndexOf('@') + 1) : "";
        for (String d : config.getWhitelistDomains()) {
            if (!domain.isEmpty() && domainMatches(domain, d)) {
                return "whitelisted_domain:" + lower(d);
            }
        }
        for (String indicator : config.getAutomatedIndicators()) {
            String i = lower(indicator);
            if (!i.isEmpty() && (subject.contains(i) || sender.contains(i))) {
                return "automated:" + i;
            }
        }
        return null;
    }

    private static boolean domainMatches(String domain, String configured) {
        String c = lower(configured);
        return domain.equals(c) || domain.endsWith("." + c);
    }

    private static Pattern keywordPattern(List<String> keywords) {
        if (keywords == null || keywords.isEmpty()) return null;
        String alternation = keywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .map(String::trim)
                // longer phrases first so "policy violation" wins over "violation"
                .sorted(Comparator.comparingInt(String::length).reversed())
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        if (alternation.isEmpty()) return null;
        return Pattern.compile("\\b(?:" + alternation + ")\\b", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private static String lower(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
