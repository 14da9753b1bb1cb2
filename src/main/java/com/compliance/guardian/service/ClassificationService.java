package com.compliance.guardian.service;

import com.compliance.guardian.config.GuardianProperties;
import com.compliance.guardian.config.MetricsConfig;
import com.compliance.guardian.engine.classifier.ClassifierModel;
import com.compliance.guardian.engine.classifier.TextTokenizer;
import com.compliance.guardian.engine.heuristic.KeywordRiskAnalyzer;
import com.compliance.guardian.model.Category;
import com.compliance.guardian.model.Classification;
import com.compliance.guardian.model.Email;
import com.compliance.guardian.model.HeuristicAssessment;
import com.compliance.guardian.model.SenderRegistrySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Scores emails against a classifier snapshot. The result depends only on the
 * email text, the snapshot and the registry snapshot, so any number of threads
 * may call it concurrently.
 */
@Service
public class ClassificationService {

    private static final Logger log = LoggerFactory.getLogger(ClassificationService.class);

    private final GuardianProperties properties;
    private final KeywordRiskAnalyzer keywordRiskAnalyzer;
    private final MetricsConfig metricsConfig;

    public ClassificationService(GuardianProperties properties,
                                 KeywordRiskAnalyzer keywordRiskAnalyzer,
                                 MetricsConfig metricsConfig) {
        this.properties = properties;
        this.keywordRiskAnalyzer = keywordRiskAnalyzer;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Classify one email.
     *
     * @param email    the email to score (not modified)
     * @param model    the classifier snapshot, or null when none has been trained yet,
     *                 in which case the keyword heuristic scores the email
     * @param registry active flagged senders
     * @return risk score in [0, 1] with its category; never throws for a missing model
     */
    public Classification classify(Email email, ClassifierModel model, SenderRegistrySnapshot registry) {
        double riskScore;
        Category category;
        boolean fallback;

        if (model == null) {
            HeuristicAssessment assessment = keywordRiskAnalyzer.assess(email);
            riskScore = assessment.getRiskScore();
            category = assessment.getCategory();
            fallback = true;
            log.debug("No model, heuristic scored email {} at {} points: {}",
                    email.getEmailId(), assessment.getPoints(), assessment.getRiskFactors());
        } else {
            Map<Category, Double> posteriors = model.predictProbabilities(TextTokenizer.tokenize(email.getText()));
            riskScore = posteriors.getOrDefault(Category.POLICY_VIOLATION, 0.0)
                    + properties.getReviewWeight() * posteriors.getOrDefault(Category.NEEDS_REVIEW, 0.0);
            category = mostProbable(posteriors);
            fallback = false;
        }

        // Mail from a flagged sender is never scored as harmless
        if (registry != null && registry.isActive(email.getSender())) {
            riskScore = Math.max(riskScore, properties.getFlaggedSenderFloor());
            if (category == Category.BENIGN || category == Category.UNKNOWN) {
                category = Category.NEEDS_REVIEW;
            }
        }

        riskScore = Math.round(clamp(riskScore) * 10000.0) / 10000.0;

        metricsConfig.recordClassification(category.name(), fallback, riskScore);
        log.debug("Classified email {}: score={}, category={}, model={}",
                email.getEmailId(), riskScore, category, model != null ? model.getVersion() : "none");

        return Classification.builder()
                .riskScore(riskScore)
                .category(category)
                .modelVersion(model != null ? model.getVersion() : null)
                .fallback(fallback)
                .build();
    }

    // EnumMap iterates in declaration order, so ties go to the earlier category
    private static Category mostProbable(Map<Category, Double> posteriors) {
        Category best = Category.UNKNOWN;
        double bestProbability = -1.0;
        for (Map.Entry<Category, Double> entry : posteriors.entrySet()) {
            if (entry.getValue() > bestProbability) {
                best = entry.getKey();
                bestProbability = entry.getValue();
            }
        }
        return best;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
