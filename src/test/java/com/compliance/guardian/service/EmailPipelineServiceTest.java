package com.compliance.guardian.service;

import com.compliance.guardian.config.GuardianProperties;
import com.compliance.guardian.config.MetricsConfig;
import com.compliance.guardian.engine.ConditionMatcher;
import com.compliance.guardian.engine.RuleEngine;
import com.compliance.guardian.engine.actions.CreateCaseActionHandler;
import com.compliance.guardian.engine.actions.FlagSenderActionHandler;
import com.compliance.guardian.engine.actions.ForceCategoryActionHandler;
import com.compliance.guardian.engine.actions.IgnoreActionHandler;
import com.compliance.guardian.engine.classifier.ClassifierModelHolder;
import com.compliance.guardian.engine.classifier.NaiveBayesTrainer;
import com.compliance.guardian.engine.heuristic.KeywordRiskAnalyzer;
import com.compliance.guardian.exception.BatchRejectedException;
import com.compliance.guardian.exception.DuplicateCaseException;
import com.compliance.guardian.model.*;
import com.compliance.guardian.repository.EmailRepository;
import com.compliance.guardian.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.compliance.guardian.testutil.TestDataFactory.condition;
import static com.compliance.guardian.testutil.TestDataFactory.createRule;
import static com.compliance.guardian.testutil.TestDataFactory.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EmailPipelineServiceTest {

    private static final String VIOLATION_BODY = "send the confidential insider details to my personal account";
    private static final String BENIGN_BODY = "team lunch friday at noon in the cafeteria";

    @Mock private ModelTrainingService trainingService;
    @Mock private AdminRuleService adminRuleService;
    @Mock private SenderRegistryService senderRegistryService;
    @Mock private CaseLifecycleService caseLifecycleService;
    @Mock private EmailRepository emailRepository;

    private ClassifierModelHolder modelHolder;
    private EmailPipelineService service;

    @BeforeEach
    void setUp() {
        GuardianProperties properties = new GuardianProperties();
        MetricsConfig metricsConfig = new MetricsConfig(new SimpleMeterRegistry());
        modelHolder = new ClassifierModelHolder();
        modelHolder.publish(NaiveBayesTrainer.train(TestDataFactory.trainingCorpus(), 0.1, 5000, "nb-test", 1L));

        RuleEngine ruleEngine = new RuleEngine(List.of(new FlagSenderActionHandler(),
                new ForceCategoryActionHandler(), new CreateCaseActionHandler(), new IgnoreActionHandler()),
                new ConditionMatcher(), Tracer.NOOP, metricsConfig);

        service = new EmailPipelineService(new EmailNormalizer(properties),
                new ClassificationService(properties, new KeywordRiskAnalyzer(properties), metricsConfig),
                modelHolder, trainingService, ruleEngine,
                adminRuleService, senderRegistryService, caseLifecycleService, emailRepository,
                properties, metricsConfig);

        lenient().when(adminRuleService.getActiveRulesSorted()).thenReturn(List.of());
        lenient().when(senderRegistryService.snapshot()).thenReturn(SenderRegistrySnapshot.empty());
    }

    @Test
    void processBatch_policyViolationEndToEnd_opensOneCase() {
        when(caseLifecycleService.createCase(any(Email.class), anyString(), eq("analyst1")))
                .thenAnswer(inv -> TestDataFactory.createCase("C1", ((Email) inv.getArgument(0)).getEmailId(),
                        CaseStatus.OPEN, 1));

        List<Map<String, String>> rows = List.of(
                row("leaker@example.com", "Confidential", VIOLATION_BODY),
                row("", "Hello", "no sender"),
                row("colleague@example.com", "Lunch", BENIGN_BODY));

        BatchResult result = service.processBatch(rows, "analyst1");

        assertThat(result.getTotalRows()).isEqualTo(3);
        assertThat(result.getImported()).isEqualTo(2);
        assertThat(result.getClassified()).isEqualTo(2);
        assertThat(result.getSkipped()).isEqualTo(1);
        assertThat(result.getSkipReasons().get(0).getRowNumber()).isEqualTo(2);
        assertThat(result.getCasesCreated()).isEqualTo(1);

        ArgumentCaptor<Email> saved = ArgumentCaptor.forClass(Email.class);
        verify(emailRepository, times(2)).save(saved.capture());
        Email violation = saved.getAllValues().get(0);
        Email benign = saved.getAllValues().get(1);
        assertThat(violation.getPredictedCategory()).isEqualTo(Category.POLICY_VIOLATION);
        assertThat(violation.getRiskScore()).isGreaterThanOrEqualTo(0.7);
        assertThat(violation.getBatchId()).isEqualTo(result.getBatchId());
        assertThat(benign.getPredictedCategory()).isEqualTo(Category.BENIGN);

        ArgumentCaptor<String> reason = ArgumentCaptor.forClass(String.class);
        verify(caseLifecycleService).createCase(same(violation), reason.capture(), eq("analyst1"));
        assertThat(reason.getValue()).startsWith("Risk score 0.").contains("(POLICY_VIOLATION)");
    }

    @Test
    void processBatch_emailIsStoredBeforeCaseIsOpened() {
        List<Map<String, String>> rows = List.of(row("leaker@example.com", "Confidential", VIOLATION_BODY));

        service.processBatch(rows, null);

        InOrder order = inOrder(emailRepository, caseLifecycleService);
        order.verify(emailRepository).save(any(Email.class));
        order.verify(caseLifecycleService).createCase(any(Email.class), anyString(), eq("system"));
    }

    @Test
    void processBatch_missingColumns_propagatesWithoutStoringAnything() {
        List<Map<String, String>> rows = List.of(Map.of("from", "a@example.com"));

        assertThatThrownBy(() -> service.processBatch(rows, "ops")).isInstanceOf(BatchRejectedException.class);
        verifyNoInteractions(emailRepository, caseLifecycleService);
    }

    @Test
    void processBatch_withoutModel_storesHeuristicScoreBelowThresholdAndOpensNoCase() {
        modelHolder = new ClassifierModelHolder();
        service = rebuildWith(modelHolder);

        BatchResult result = service.processBatch(List.of(row("a@example.com", "Confidential", VIOLATION_BODY)), "ops");

        ArgumentCaptor<Email> saved = ArgumentCaptor.forClass(Email.class);
        verify(emailRepository).save(saved.capture());
        // "confidential" and "insider" give 40 heuristic points, half of saturation
        assertThat(saved.getValue().getPredictedCategory()).isEqualTo(Category.NEEDS_REVIEW);
        assertThat(saved.getValue().getRiskScore()).isEqualTo(0.5);
        assertThat(result.getCasesCreated()).isZero();
        verifyNoInteractions(caseLifecycleService);
    }

    @Test
    void processBatch_forcedPolicyViolation_escalatesLowScoreEmail() {
        when(adminRuleService.getActiveRulesSorted()).thenReturn(List.of(
                createRule("OFFSHORE", 1, RuleAction.FORCE_CATEGORY, "POLICY_VIOLATION",
                        condition("TEXT", "CONTAINS", "cafeteria"))));

        BatchResult result = service.processBatch(List.of(row("a@example.com", "Lunch", BENIGN_BODY)), "ops");

        assertThat(result.getCasesCreated()).isEqualTo(1);
        ArgumentCaptor<Email> email = ArgumentCaptor.forClass(Email.class);
        verify(caseLifecycleService).createCase(email.capture(), contains("rules OFFSHORE"), eq("ops"));
        assertThat(email.getValue().getPredictedCategory()).isEqualTo(Category.POLICY_VIOLATION);
        assertThat(email.getValue().getRiskScore()).isLessThan(0.3);
    }

    @Test
    void processBatch_forcedBenign_suppressesScoreEscalation() {
        when(adminRuleService.getActiveRulesSorted()).thenReturn(List.of(
                createRule("ALLOW", 1, RuleAction.FORCE_CATEGORY, "BENIGN",
                        condition("SENDER_DOMAIN", "EQUALS", "legal.example.com"))));

        BatchResult result = service.processBatch(
                List.of(row("counsel@legal.example.com", "Confidential", VIOLATION_BODY)), "ops");

        assertThat(result.getCasesCreated()).isZero();
        verifyNoInteractions(caseLifecycleService);
    }

    @Test
    void processBatch_flaggedSender_isCountedAndEscalated() {
        when(senderRegistryService.snapshot()).thenReturn(new SenderRegistrySnapshot(Set.of("watch@example.com")));

        BatchResult result = service.processBatch(List.of(row("Watch@Example.com", "Lunch", BENIGN_BODY)), "ops");

        assertThat(result.getFlagged()).isEqualTo(1);
        assertThat(result.getCasesCreated()).isEqualTo(1);
        verify(caseLifecycleService).createCase(any(Email.class), contains("sender flagged"), eq("ops"));
    }

    @Test
    void processBatch_storeFailure_skipsRowAndContinues() {
        doThrow(new IllegalStateException("timeout")).doNothing().when(emailRepository).save(any(Email.class));

        BatchResult result = service.processBatch(List.of(
                row("a@example.com", "Lunch", BENIGN_BODY),
                row("b@example.com", "Lunch", BENIGN_BODY)), "ops");

        assertThat(result.getImported()).isEqualTo(1);
        assertThat(result.getSkipped()).isEqualTo(1);
        assertThat(result.getSkipReasons().get(0).getRowNumber()).isEqualTo(1);
        assertThat(result.getSkipReasons().get(0).getReason()).startsWith("processing failed");
    }

    @Test
    void processBatch_caseCreationFailure_keepsEmailImported() {
        when(caseLifecycleService.createCase(any(Email.class), anyString(), anyString()))
                .thenThrow(new IllegalStateException("store down"));

        BatchResult result = service.processBatch(List.of(row("a@example.com", "Confidential", VIOLATION_BODY)), "ops");

        assertThat(result.getImported()).isEqualTo(1);
        assertThat(result.getCasesCreated()).isZero();
        assertThat(result.getSkipped()).isZero();
    }

    @Test
    void reclassifyAll_secondRunWithSameInputsChangesNothing() {
        List<Email> stored = new ArrayList<>(List.of(
                TestDataFactory.createEmail("E1", "a@example.com", "Confidential", VIOLATION_BODY),
                TestDataFactory.createEmail("E2", "b@example.com", "Lunch", BENIGN_BODY)));
        when(emailRepository.findAll()).thenReturn(stored);
        when(caseLifecycleService.createCase(any(Email.class), anyString(), anyString())).thenAnswer(inv -> {
            Email email = inv.getArgument(0);
            email.setCaseId("C-" + email.getEmailId());
            return TestDataFactory.createCase("C-" + email.getEmailId(), email.getEmailId(), CaseStatus.OPEN, 1);
        });

        ReclassifyResult first = service.reclassifyAll("ops");
        Map<String, Double> scores = new HashMap<>();
        stored.forEach(e -> scores.put(e.getEmailId(), e.getRiskScore()));

        ReclassifyResult second = service.reclassifyAll("ops");

        assertThat(first.getEvaluated()).isEqualTo(2);
        assertThat(first.getChanged()).isEqualTo(2);
        assertThat(first.getCasesCreated()).isEqualTo(1);
        assertThat(first.getModelVersion()).isEqualTo("nb-test");
        assertThat(second.getChanged()).isZero();
        assertThat(second.getCasesCreated()).isZero();
        assertThat(second.getReopened()).isZero();
        stored.forEach(e -> assertThat(e.getRiskScore()).isEqualTo(scores.get(e.getEmailId())));
        verify(emailRepository, times(2)).updateClassification(any(Email.class));
        verify(caseLifecycleService, times(1)).createCase(any(Email.class), anyString(), anyString());
    }

    @Test
    void reclassifyAll_falsePositiveCase_isReopened() {
        Email email = TestDataFactory.createEmail("E1", "a@example.com", "Confidential", VIOLATION_BODY);
        email.setCaseId("C-OLD");
        when(emailRepository.findAll()).thenReturn(List.of(email));
        when(caseLifecycleService.canReopen(email)).thenReturn(true);

        ReclassifyResult result = service.reclassifyAll("ops");

        assertThat(result.getReopened()).isEqualTo(1);
        verify(caseLifecycleService).reopenAfterFalsePositive(same(email), startsWith("Re-opened"), eq("ops"));
        verify(caseLifecycleService, never()).createCase(any(Email.class), anyString(), anyString());
    }

    @Test
    void reclassifyAll_duplicateCaseRace_isSkippedNotFatal() {
        Email racing = TestDataFactory.createEmail("E1", "a@example.com", "Confidential", VIOLATION_BODY);
        Email other = TestDataFactory.createEmail("E2", "b@example.com", "Secret", VIOLATION_BODY);
        when(emailRepository.findAll()).thenReturn(List.of(racing, other));
        when(caseLifecycleService.createCase(same(racing), anyString(), anyString()))
                .thenThrow(new DuplicateCaseException("E1", "C-OTHER"));
        when(caseLifecycleService.createCase(same(other), anyString(), anyString()))
                .thenReturn(TestDataFactory.createCase("C2", "E2", CaseStatus.OPEN, 1));

        ReclassifyResult result = service.reclassifyAll("ops");

        assertThat(result.getEvaluated()).isEqualTo(2);
        assertThat(result.getCasesCreated()).isEqualTo(1);
    }

    @Test
    void retrainAndReclassify_trainsBeforeReclassifying() {
        when(emailRepository.findAll()).thenReturn(List.of());

        service.retrainAndReclassify("ops");

        InOrder order = inOrder(trainingService, emailRepository);
        order.verify(trainingService).retrainFromHistory();
        order.verify(emailRepository).findAll();
    }

    private EmailPipelineService rebuildWith(ClassifierModelHolder holder) {
        GuardianProperties properties = new GuardianProperties();
        MetricsConfig metricsConfig = new MetricsConfig(new SimpleMeterRegistry());
        RuleEngine ruleEngine = new RuleEngine(List.of(new CreateCaseActionHandler()),
                new ConditionMatcher(), Tracer.NOOP, metricsConfig);
        return new EmailPipelineService(new EmailNormalizer(properties),
                new ClassificationService(properties, new KeywordRiskAnalyzer(properties), metricsConfig),
                holder, trainingService, ruleEngine,
                adminRuleService, senderRegistryService, caseLifecycleService, emailRepository,
                properties, metricsConfig);
    }
}
