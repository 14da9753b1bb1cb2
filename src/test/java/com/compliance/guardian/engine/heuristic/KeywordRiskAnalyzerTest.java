package com.compliance.guardian.engine.heuristic;

import com.compliance.guardian.config.GuardianProperties;
import com.compliance.guardian.model.Category;
import com.compliance.guardian.model.Email;
import com.compliance.guardian.model.HeuristicAssessment;
import com.compliance.guardian.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordRiskAnalyzerTest {

    private GuardianProperties properties;
    private KeywordRiskAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        properties = new GuardianProperties();
        analyzer = new KeywordRiskAnalyzer(properties);
    }

    @Test
    void distinctRiskKeywords_countOnceEach() {
        Email email = TestDataFactory.createEmail("E1", "a@example.com",
                "CONFIDENTIAL", "confidential insider report, confidential again");

        HeuristicAssessment result = analyzer.assess(email);

        assertThat(result.getPoints()).isEqualTo(40);
        assertThat(result.getRiskScore()).isEqualTo(0.5);
        assertThat(result.getCategory()).isEqualTo(Category.NEEDS_REVIEW);
        assertThat(result.getRiskFactors()).containsExactly("keyword:confidential", "keyword:insider");
    }

    @Test
    void keywordsMatchWholeWordsOnly() {
        Email email = TestDataFactory.createEmail("E1", "a@example.com", "Tokens", "breaches of the loginpage");

        HeuristicAssessment result = analyzer.assess(email);

        assertThat(result.getPoints()).isZero();
        assertThat(result.getCategory()).isEqualTo(Category.UNKNOWN);
    }

    @Test
    void multiWordPhrase_matchedAsOneKeyword() {
        Email email = TestDataFactory.createEmail("E1", "a@example.com", "Policy violation", "see below");

        assertThat(analyzer.assess(email).getRiskFactors()).containsExactly("keyword:policy violation");
    }

    @Test
    void exclusionKeywords_subtractPerOccurrence_andCanMakeBenign() {
        Email email = TestDataFactory.createEmail("E1", "a@example.com",
                "Lunch and coffee", "holiday lunch reminder");

        HeuristicAssessment result = analyzer.assess(email);

        assertThat(result.getPoints()).isEqualTo(-50);
        assertThat(result.getRiskScore()).isZero();
        assertThat(result.getCategory()).isEqualTo(Category.BENIGN);
    }

    @Test
    void riskyAttachmentAndPersonalDomain_reachPolicyViolation() {
        Email email = TestDataFactory.createEmail("E1", "someone@Gmail.com", "Fraud evidence", "see file");
        email.setAttachments(List.of("Payload.EXE"));

        HeuristicAssessment result = analyzer.assess(email);

        // fraud (20) + personal domain (15) + risky attachment (30)
        assertThat(result.getPoints()).isEqualTo(65);
        assertThat(result.getCategory()).isEqualTo(Category.POLICY_VIOLATION);
        assertThat(result.getRiskScore()).isEqualTo(65.0 / 80.0);
        assertThat(result.getRiskFactors()).contains("personal_email_domain", "risky_attachments");
    }

    @Test
    void harmlessAttachment_addsSmallAmount() {
        Email email = TestDataFactory.createEmail("E1", "a@example.com", "Notes", "attached");
        email.setAttachments(List.of("notes.pdf"));

        HeuristicAssessment result = analyzer.assess(email);

        assertThat(result.getPoints()).isEqualTo(5);
        assertThat(result.getRiskFactors()).containsExactly("has_attachments");
    }

    @Test
    void trustedDomain_reducesPoints() {
        Email email = TestDataFactory.createEmail("E1", "clerk@court.gov", "Subpoena", "attached");

        assertThat(analyzer.assess(email).getPoints()).isEqualTo(15);
    }

    @Test
    void automatedMail_isWhitelistedEvenWithRiskKeywords() {
        Email email = TestDataFactory.createEmail("E1", "alerts@bank.example",
                "Automated notice: password expiry", "your password expires soon");

        HeuristicAssessment result = analyzer.assess(email);

        assertThat(result.isWhitelisted()).isTrue();
        assertThat(result.getCategory()).isEqualTo(Category.BENIGN);
        assertThat(result.getRiskScore()).isZero();
        assertThat(result.getRiskFactors()).containsExactly("automated:automated");
    }

    @Test
    void whitelistedDomain_matchesSubdomainsButNotLookalikes() {
        Email exact = TestDataFactory.createEmail("E1", "bot@mail.noreply.com", "Fraud", "x");
        Email lookalike = TestDataFactory.createEmail("E2", "bot@notnoreply.com", "Fraud", "x");

        assertThat(analyzer.assess(exact).isWhitelisted()).isTrue();
        assertThat(analyzer.assess(lookalike).isWhitelisted()).isFalse();
    }

    @Test
    void configuredKeywordsAndWeights_areHonoured() {
        properties.getHeuristics().setRiskKeywords(List.of("project falcon"));
        properties.getHeuristics().setRiskKeywordPoints(80);
        analyzer = new KeywordRiskAnalyzer(properties);

        Email email = TestDataFactory.createEmail("E1", "a@example.com", "Project Falcon", "confidential");

        HeuristicAssessment result = analyzer.assess(email);

        assertThat(result.getPoints()).isEqualTo(80);
        assertThat(result.getRiskScore()).isEqualTo(1.0);
    }
}
