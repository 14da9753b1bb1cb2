package com.compliance.guardian.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "guardian")
public class GuardianProperties {

    // Risk score at or above which a non-benign email gets an investigation case.
    private double escalationThreshold = 0.7;

    // Minimum risk score for mail from an actively flagged sender.
    private double flaggedSenderFloor = 0.8;

    // Share of P(NEEDS_REVIEW) that counts towards the risk score.
    private double reviewWeight = 0.5;

    // Actor recorded when the pipeline itself opens or re-opens a case.
    private String systemActor = "system";

    private Classifier classifier = new Classifier();

    private Ingestion ingestion = new Ingestion();

    private Cache cache = new Cache();

    private Heuristics heuristics = new Heuristics();

    @Data
    public static class Classifier {
        // Additive (Laplace/Lidstone) smoothing for naive Bayes.
        private double smoothingAlpha = 0.1;
        // Vocabulary is capped to the most document-frequent terms.
        private int maxFeatures = 5000;
        private int minVocabularySize = 10;
        private int minTrainingSamples = 10;
        // Load the persisted model snapshot when the service starts.
        private boolean loadOnStartup = true;
    }

    @Data
    public static class Ingestion {
        // Zone used for timestamps without an offset and for dashboard day buckets.
        private String zoneId = "UTC";
        // Cell values treated as absent (compared case-insensitively after trim).
        private List<String> nullMarkers = List.of("-", "null", "none", "n/a", "na", "nan");
    }

    @Data
    public static class Cache {
        // How often (in seconds) to refresh the in-memory admin rule cache from Aerospike.
        private int ruleRefreshSeconds = 60;
        // How often (in seconds) to refresh the in-memory active sender set.
        private int senderRefreshSeconds = 60;
    }

    /**
     * Keyword and attachment scoring used while no classifier model is active.
     */
    @Data
    public static class Heuristics {
        private List<String> riskKeywords = List.of(
                "confidential", "classified", "restricted", "sensitive", "proprietary",
                "trade secret", "merger", "acquisition", "insider", "lawsuit", "legal action",
                "subpoena", "investigation", "fraud", "breach", "violation", "compliance",
                "password", "credential", "login", "access key", "api key", "token",
                "vulnerability", "exploit", "malware", "phishing", "ransomware",
                "termination", "resignation", "dismissal", "harassment", "discrimination",
                "grievance", "complaint", "misconduct", "policy violation",
                "personal data", "pii", "gdpr", "hipaa", "sox", "customer data",
                "financial records", "bank account", "social security", "credit card");
        private List<String> exclusionKeywords = List.of(
                "automated", "no-reply", "noreply", "do not reply", "system notification",
                "newsletter", "marketing", "promotional", "advertisement", "unsubscribe",
                "out of office", "auto-reply", "vacation", "away message",
                "meeting invite", "calendar", "reminder", "thank you", "congratulations",
                "welcome", "birthday", "holiday", "lunch", "coffee", "social event");
        // Sender domains whose mail is cleared outright.
        private List<String> whitelistDomains = List.of(
                "noreply.com", "no-reply.com", "donotreply.com", "notification.com", "alerts.com", "system.com");
        // Substrings of sender or subject that mark automated mail.
        private List<String> automatedIndicators = List.of(
                "automated", "no-reply", "system notification", "out of office", "auto-reply", "delivery status");
        private List<String> personalDomains = List.of("gmail.com", "yahoo.com", "hotmail.com", "outlook.com");
        private List<String> trustedDomainSuffixes = List.of(".gov", ".edu");
        private List<String> riskyExtensions = List.of(".exe", ".zip", ".rar", ".bat", ".scr", ".com");
        private int riskKeywordPoints = 20;
        private int exclusionKeywordPoints = 10;
        private int personalDomainPoints = 15;
        private int trustedDomainPoints = 5;
        private int riskyAttachmentPoints = 30;
        private int attachmentPoints = 5;
        // Point totals at which the category becomes NEEDS_REVIEW and POLICY_VIOLATION.
        private int reviewPoints = 20;
        private int violationPoints = 60;
        // Points that map to a risk score of 1.0.
        private int saturationPoints = 80;
    }
}
