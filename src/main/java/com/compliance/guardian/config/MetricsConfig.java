package com.compliance.guardian.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger activeFlaggedSenders;
    private final AtomicInteger modelVocabularySize;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.activeFlaggedSenders = registry.gauge("senders.flagged.active", new AtomicInteger(0));
        this.modelVocabularySize = registry.gauge("classifier.model.vocabulary", new AtomicInteger(0));
    }

    public void recordImport(int accepted, int skipped) {
        Counter.builder("ingestion.rows")
                .tag("result", "accepted")
                .register(registry)
                .increment(accepted);
        Counter.builder("ingestion.rows")
                .tag("result", "skipped")
                .register(registry)
                .increment(skipped);
    }

    public void recordClassification(String category, boolean fallback, double riskScore) {
        Counter.builder("classification.count")
                .tag("category", category)
                .tag("fallback", String.valueOf(fallback))
                .register(registry)
                .increment();

        DistributionSummary.builder("classification.risk_score")
                .tag("category", category)
                .register(registry)
                .record(riskScore);
    }

    public void recordRuleTriggered(String action) {
        Counter.builder("rule.triggered.count")
                .tag("action", action)
                .register(registry)
                .increment();
    }

    public void recordMalformedRule(String ruleId) {
        Counter.builder("rule.malformed.count")
                .tag("rule_id", ruleId)
                .register(registry)
                .increment();
    }

    public void recordCaseCreated(boolean reopened) {
        Counter.builder("case.created.count")
                .tag("reopened", String.valueOf(reopened))
                .register(registry)
                .increment();
    }

    public void recordCaseTransition(String from, String to) {
        Counter.builder("case.transition.count")
                .tag("from", from)
                .tag("to", to)
                .register(registry)
                .increment();
    }

    public void recordCaseConflict() {
        Counter.builder("case.conflict.count")
                .register(registry)
                .increment();
    }

    public void recordModelPublished(int vocabularySize, int trainingSamples) {
        Counter.builder("classifier.model.published")
                .register(registry)
                .increment();
        DistributionSummary.builder("classifier.model.training_samples")
                .register(registry)
                .record(trainingSamples);
        modelVocabularySize.set(vocabularySize);
    }

    public void updateActiveFlaggedSenders(int count) {
        activeFlaggedSenders.set(count);
    }
}
