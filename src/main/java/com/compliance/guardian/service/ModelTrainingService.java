package com.compliance.guardian.service;

import com.compliance.guardian.config.GuardianProperties;
import com.compliance.guardian.config.MetricsConfig;
import com.compliance.guardian.engine.classifier.ClassifierModel;
import com.compliance.guardian.engine.classifier.ClassifierModelHolder;
import com.compliance.guardian.engine.classifier.NaiveBayesTrainer;
import com.compliance.guardian.exception.ModelTrainingException;
import com.compliance.guardian.model.CaseStatus;
import com.compliance.guardian.model.Category;
import com.compliance.guardian.model.Email;
import com.compliance.guardian.model.InvestigationCase;
import com.compliance.guardian.model.LabeledText;
import com.compliance.guardian.repository.CaseRepository;
import com.compliance.guardian.repository.ClassifierModelRepository;
import com.compliance.guardian.repository.EmailRepository;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

@Service
public class ModelTrainingService {

    private static final Logger log = LoggerFactory.getLogger(ModelTrainingService.class);

    private final EmailRepository emailRepository;
    private final CaseRepository caseRepository;
    private final ClassifierModelRepository modelRepository;
    private final ClassifierModelHolder modelHolder;
    private final GuardianProperties properties;
    private final MetricsConfig metricsConfig;

    public ModelTrainingService(EmailRepository emailRepository,
                                CaseRepository caseRepository,
                                ClassifierModelRepository modelRepository,
                                ClassifierModelHolder modelHolder,
                                GuardianProperties properties,
                                MetricsConfig metricsConfig) {
        this.emailRepository = emailRepository;
        this.caseRepository = caseRepository;
        this.modelRepository = modelRepository;
        this.modelHolder = modelHolder;
        this.properties = properties;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void loadActiveModel() {
        if (!properties.getClassifier().isLoadOnStartup()) {
            return;
        }
        try {
            ClassifierModel model = modelRepository.loadActive();
            if (model == null) {
                log.info("No persisted classifier model, classification falls back until one is trained");
                return;
            }
            modelHolder.publish(model);
            log.info("Loaded classifier model {} ({} terms, {} samples)",
                    model.getVersion(), model.getVocabularySize(), model.getTrainingSamples());
        } catch (Exception e) {
            log.error("Failed to load persisted classifier model", e);
        }
    }

    /**
     * Train a model from the given samples, validate it, persist it and make it active.
     * On validation failure the active model is left untouched.
     *
     * @throws ModelTrainingException if the samples cannot produce a usable model
     */
    public ClassifierModel retrain(List<LabeledText> samples) {
        GuardianProperties.Classifier config = properties.getClassifier();

        List<LabeledText> usable = new ArrayList<>();
        if (samples != null) {
            for (LabeledText sample : samples) {
                if (sample != null && sample.label() != null && sample.label() != Category.UNKNOWN) {
                    usable.add(sample);
                }
            }
        }

        if (usable.size() < config.getMinTrainingSamples()) {
            throw new ModelTrainingException("Need at least " + config.getMinTrainingSamples()
                    + " labeled samples, got " + usable.size());
        }

        Set<Category> labels = EnumSet.noneOf(Category.class);
        usable.forEach(s -> labels.add(s.label()));
        if (labels.size() < 2) {
            throw new ModelTrainingException("Need samples from at least 2 categories, got " + labels);
        }

        long trainedAt = System.currentTimeMillis();
        String version = "nb-" + trainedAt + "-" + UUID.randomUUID().toString().substring(0, 8);
        ClassifierModel model = NaiveBayesTrainer.train(usable, config.getSmoothingAlpha(),
                config.getMaxFeatures(), version, trainedAt);

        if (model.getVocabularySize() < config.getMinVocabularySize()) {
            throw new ModelTrainingException("Vocabulary too small: " + model.getVocabularySize()
                    + " terms, need " + config.getMinVocabularySize());
        }

        if (!modelRepository.save(model)) {
            log.warn("Classifier model {} could not be persisted, it stays active in memory only", version);
        }
        ClassifierModel previous = modelHolder.publish(model);
        metricsConfig.recordModelPublished(model.getVocabularySize(), model.getTrainingSamples());

        log.info("Published classifier model {} (previous {}): {} samples, {} terms, classes {}",
                version, previous != null ? previous.getVersion() : "none",
                model.getTrainingSamples(), model.getVocabularySize(), model.getClasses());
        return model;
    }

    public ClassifierModel retrainFromHistory() {
        return retrain(collectTrainingData());
    }

    /**
     * Labeled samples from investigation outcomes and imported category hints.
     * A resolved case overrides the hint of the email it investigated.
     */
    public List<LabeledText> collectTrainingData() {
        Map<String, Category> caseLabels = new HashMap<>();
        List<InvestigationCase> cases = new ArrayList<>(caseRepository.findAll());
        // Later cases win when an email was re-opened
        cases.sort(Comparator.comparingLong(InvestigationCase::getCreatedAt));
        for (InvestigationCase c : cases) {
            if (c.getStatus() == CaseStatus.CLOSED) {
                caseLabels.put(c.getEmailId(), Category.POLICY_VIOLATION);
            } else if (c.getStatus() == CaseStatus.FALSE_POSITIVE) {
                caseLabels.put(c.getEmailId(), Category.BENIGN);
            }
        }

        List<Email> emails = new ArrayList<>(emailRepository.findAll());
        emails.sort(Comparator.comparingLong(Email::getImportedAt).thenComparing(Email::getEmailId));

        List<LabeledText> samples = new ArrayList<>();
        int fromCases = 0;
        for (Email email : emails) {
            Category label = caseLabels.get(email.getEmailId());
            if (label != null) {
                fromCases++;
            } else {
                label = Category.fromLabel(email.getCategoryHint());
            }
            if (label != null && label != Category.UNKNOWN) {
                samples.add(new LabeledText(email.getText(), label));
            }
        }

        log.info("Collected {} training samples ({} from resolved cases)", samples.size(), fromCases);
        return samples;
    }
}
