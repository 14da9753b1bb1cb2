package com.compliance.guardian.service;

import com.compliance.guardian.config.GuardianProperties;
import com.compliance.guardian.config.MetricsConfig;
import com.compliance.guardian.engine.RuleEngine;
import com.compliance.guardian.engine.classifier.ClassifierModel;
import com.compliance.guardian.engine.classifier.ClassifierModelHolder;
import com.compliance.guardian.exception.DuplicateCaseException;
import com.compliance.guardian.model.AdminRule;
import com.compliance.guardian.model.BatchResult;
import com.compliance.guardian.model.Category;
import com.compliance.guardian.model.Classification;
import com.compliance.guardian.model.Email;
import com.compliance.guardian.model.NormalizedBatch;
import com.compliance.guardian.model.NormalizedRow;
import com.compliance.guardian.model.ReclassifyResult;
import com.compliance.guardian.model.RuleOutcome;
import com.compliance.guardian.model.SenderRegistrySnapshot;
import com.compliance.guardian.model.SkipReason;
import com.compliance.guardian.repository.EmailRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Main orchestrator for email imports and reclassification.
 *
 * Flow per email:
 * 1. Classify against the model snapshot taken at the start of the run
 * 2. Apply admin rules (category override, sender flag, escalation)
 * 3. Persist the email with its score and category
 * 4. Open an investigation case when the email escalates
 */
@Service
public class EmailPipelineService {

    private static final Logger log = LoggerFactory.getLogger(EmailPipelineService.class);

    private final EmailNormalizer normalizer;
    private final ClassificationService classificationService;
    private final ClassifierModelHolder modelHolder;
    private final ModelTrainingService trainingService;
    private final RuleEngine ruleEngine;
    private final AdminRuleService adminRuleService;
    private final SenderRegistryService senderRegistryService;
    private final CaseLifecycleService caseLifecycleService;
    private final EmailRepository emailRepository;
    private final GuardianProperties properties;
    private final MetricsConfig metricsConfig;

    public EmailPipelineService(EmailNormalizer normalizer,
                                ClassificationService classificationService,
                                ClassifierModelHolder modelHolder,
                                ModelTrainingService trainingService,
                                RuleEngine ruleEngine,
                                AdminRuleService adminRuleService,
                                SenderRegistryService senderRegistryService,
                                CaseLifecycleService caseLifecycleService,
                                EmailRepository emailRepository,
                                GuardianProperties properties,
                                MetricsConfig metricsConfig) {
        this.normalizer = normalizer;
        this.classificationService = classificationService;
        this.modelHolder = modelHolder;
        this.trainingService = trainingService;
        this.ruleEngine = ruleEngine;
        this.adminRuleService = adminRuleService;
        this.senderRegistryService = senderRegistryService;
        this.caseLifecycleService = caseLifecycleService;
        this.emailRepository = emailRepository;
        this.properties = properties;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Import a batch of raw rows. A batch-level rejection propagates before anything
     * is stored; failures on individual emails are logged and reported as skipped.
     */
    @Observed(name = "pipeline.process_batch", contextualName = "process-email-batch")
    public BatchResult processBatch(List<Map<String, String>> rows, String actor) {
        NormalizedBatch batch = normalizer.normalize(rows);
        String batchId = UUID.randomUUID().toString();
        String caseActor = actor != null ? actor : properties.getSystemActor();

        // One consistent view of model, rules and registry for the whole batch
        ClassifierModel model = modelHolder.current().orElse(null);
        List<AdminRule> rules = adminRuleService.getActiveRulesSorted();
        SenderRegistrySnapshot registry = senderRegistryService.snapshot();

        List<SkipReason> skipReasons = new ArrayList<>(batch.report().getSkipReasons());
        int imported = 0;
        int flagged = 0;
        int casesCreated = 0;

        for (NormalizedRow row : batch.rows()) {
            Email email = row.email();
            email.setBatchId(batchId);

            Verdict verdict;
            try {
                verdict = score(email, model, rules, registry);
                emailRepository.save(email);
            } catch (RuntimeException e) {
                log.error("Failed to process row {} of batch {}", row.rowNumber(), batchId, e);
                skipReasons.add(new SkipReason(row.rowNumber(), "processing failed: " + e.getMessage()));
                continue;
            }

            imported++;
            if (email.isFlagged()) flagged++;

            if (verdict.escalate()) {
                try {
                    caseLifecycleService.createCase(email, verdict.reason(email), caseActor);
                    casesCreated++;
                } catch (RuntimeException e) {
                    // The email is stored; the next reclassification will retry the case
                    log.error("Failed to open case for email {} in batch {}", email.getEmailId(), batchId, e);
                }
            }
        }

        int skipped = skipReasons.size();
        metricsConfig.recordImport(imported, skipped);
        log.info("Batch {} processed: {} rows, {} imported, {} flagged, {} cases, {} skipped (model {})",
                batchId, batch.report().getTotalRows(), imported, flagged, casesCreated, skipped,
                model != null ? model.getVersion() : "none");

        return BatchResult.builder()
                .batchId(batchId)
                .totalRows(batch.report().getTotalRows())
                .imported(imported)
                .classified(imported)
                .flagged(flagged)
                .casesCreated(casesCreated)
                .skipped(skipped)
                .skipReasons(skipReasons)
                .build();
    }

    /**
     * Re-run classification and rules over every stored email with the current
     * model, rules and registry. With unchanged inputs this changes nothing.
     */
    @Observed(name = "pipeline.reclassify_all", contextualName = "reclassify-all-emails")
    public ReclassifyResult reclassifyAll(String actor) {
        String caseActor = actor != null ? actor : properties.getSystemActor();
        ClassifierModel model = modelHolder.current().orElse(null);
        List<AdminRule> rules = adminRuleService.getActiveRulesSorted();
        SenderRegistrySnapshot registry = senderRegistryService.snapshot();

        int evaluated = 0;
        int changed = 0;
        int casesCreated = 0;
        int reopened = 0;

        for (Email email : emailRepository.findAll()) {
            try {
                Double previousScore = email.getRiskScore();
                Category previousCategory = email.getPredictedCategory();
                boolean previousFlag = email.isFlagged();

                Verdict verdict = score(email, model, rules, registry);
                evaluated++;

                if (!Objects.equals(previousScore, email.getRiskScore())
                        || previousCategory != email.getPredictedCategory()
                        || previousFlag != email.isFlagged()) {
                    emailRepository.updateClassification(email);
                    changed++;
                }

                if (!verdict.escalate()) continue;

                if (email.getCaseId() == null) {
                    caseLifecycleService.createCase(email, verdict.reason(email), caseActor);
                    casesCreated++;
                } else if (caseLifecycleService.canReopen(email)) {
                    caseLifecycleService.reopenAfterFalsePositive(email,
                            "Re-opened after reclassification: " + verdict.reason(email), caseActor);
                    reopened++;
                }
            } catch (DuplicateCaseException e) {
                log.warn("Skipped case creation for email {}: {}", email.getEmailId(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("Failed to reclassify email {}", email.getEmailId(), e);
            }
        }

        log.info("Reclassified {} emails with model {}: {} changed, {} cases created, {} re-opened",
                evaluated, model != null ? model.getVersion() : "none", changed, casesCreated, reopened);

        return ReclassifyResult.builder()
                .evaluated(evaluated)
                .changed(changed)
                .casesCreated(casesCreated)
                .reopened(reopened)
                .modelVersion(model != null ? model.getVersion() : null)
                .build();
    }

    /**
     * Retrain from labeled history, publish the new model, then reclassify everything.
     */
    public ReclassifyResult retrainAndReclassify(String actor) {
        trainingService.retrainFromHistory();
        return reclassifyAll(actor);
    }

    /**
     * Classify the email and apply rules to it in place.
     */
    private Verdict score(Email email, ClassifierModel model, List<AdminRule> rules,
                          SenderRegistrySnapshot registry) {
        Classification classification = classificationService.classify(email, model, registry);
        RuleOutcome outcome = ruleEngine.evaluate(email, classification, rules, registry);

        email.applyClassification(classification.getRiskScore(), outcome.getCategory());
        email.setFlagged(outcome.isFlagged());

        boolean escalate;
        if (outcome.isEscalate()) {
            escalate = true;
        } else if (outcome.isCategoryForced() && outcome.getCategory() == Category.POLICY_VIOLATION) {
            escalate = true;
        } else if (outcome.getCategory() == Category.BENIGN) {
            // a benign verdict (typically forced by an allow-list rule) suppresses score escalation
            escalate = false;
        } else {
            escalate = classification.getRiskScore() >= properties.getEscalationThreshold();
        }
        return new Verdict(escalate, outcome.getMatchedRuleIds());
    }

    private record Verdict(boolean escalate, List<String> matchedRuleIds) {

        String reason(Email email) {
            String text = String.format(Locale.ROOT, "Risk score %.2f (%s)",
                    email.getRiskScore(), email.getPredictedCategory());
            if (email.isFlagged()) {
                text += ", sender flagged";
            }
            if (!matchedRuleIds.isEmpty()) {
                text += ", rules " + String.join(", ", matchedRuleIds);
            }
            return text;
        }
    }
}
