package com.compliance.guardian.service;

import com.compliance.guardian.config.MetricsConfig;
import com.compliance.guardian.exception.CaseNotFoundException;
import com.compliance.guardian.exception.ConcurrentCaseModificationException;
import com.compliance.guardian.exception.DuplicateCaseException;
import com.compliance.guardian.exception.EmailNotFoundException;
import com.compliance.guardian.exception.InvalidTransitionException;
import com.compliance.guardian.model.*;
import com.compliance.guardian.repository.CaseRepository;
import com.compliance.guardian.repository.EmailRepository;
import com.compliance.guardian.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CaseLifecycleServiceTest {

    @Mock private CaseRepository caseRepository;
    @Mock private EmailRepository emailRepository;
    @Mock private MetricsConfig metricsConfig;

    private CaseLifecycleService service;

    @BeforeEach
    void setUp() {
        service = new CaseLifecycleService(caseRepository, emailRepository, metricsConfig);
    }

    @Test
    void createCase_opensCaseAtVersionOneAndLinksEmail() {
        Email email = TestDataFactory.createClassifiedEmail("E1", 0.91, Category.POLICY_VIOLATION);
        when(emailRepository.linkCase(eq("E1"), isNull(), anyString(), isNull())).thenReturn(true);

        InvestigationCase created = service.createCase(email, "Risk score 0.91 (POLICY_VIOLATION)", "system");

        assertThat(created.getStatus()).isEqualTo(CaseStatus.OPEN);
        assertThat(created.getVersion()).isEqualTo(1);
        assertThat(created.getEmailId()).isEqualTo("E1");
        assertThat(created.getAuditTrail()).hasSize(1);
        CaseTransition entry = created.getAuditTrail().get(0);
        assertThat(entry.getFromStatus()).isNull();
        assertThat(entry.getToStatus()).isEqualTo(CaseStatus.OPEN);
        assertThat(entry.getActor()).isEqualTo("system");
        assertThat(email.getCaseId()).isEqualTo(created.getCaseId());
        verify(caseRepository).create(created);
        verify(metricsConfig).recordCaseCreated(false);
    }

    @Test
    void createCase_emailAlreadyLinked_throwsDuplicate() {
        Email email = TestDataFactory.createClassifiedEmail("E1", 0.91, Category.POLICY_VIOLATION);
        email.setCaseId("C-EXISTING");

        assertThatThrownBy(() -> service.createCase(email, "reason", "ops"))
                .isInstanceOf(DuplicateCaseException.class)
                .hasMessageContaining("C-EXISTING");
        verifyNoInteractions(caseRepository);
    }

    @Test
    void createCase_lostLinkRace_throwsDuplicateWithWinner() {
        Email email = TestDataFactory.createClassifiedEmail("E1", 0.91, Category.POLICY_VIOLATION);
        Email latest = TestDataFactory.createClassifiedEmail("E1", 0.91, Category.POLICY_VIOLATION);
        latest.setCaseId("C-WINNER");
        when(emailRepository.linkCase(eq("E1"), isNull(), anyString(), isNull())).thenReturn(false);
        when(emailRepository.findById("E1")).thenReturn(latest);

        assertThatThrownBy(() -> service.createCase(email, "reason", "ops"))
                .isInstanceOf(DuplicateCaseException.class)
                .satisfies(e -> assertThat(((DuplicateCaseException) e).getExistingCaseId()).isEqualTo("C-WINNER"));
        verify(caseRepository, never()).create(any());
    }

    @Test
    void createCase_storeFailure_releasesEmailLink() {
        Email email = TestDataFactory.createClassifiedEmail("E1", 0.91, Category.POLICY_VIOLATION);
        when(emailRepository.linkCase(any(), any(), any(), any())).thenReturn(true);
        doThrow(new IllegalStateException("store down")).when(caseRepository).create(any());

        assertThatThrownBy(() -> service.createCase(email, "reason", "ops"))
                .isInstanceOf(IllegalStateException.class);
        ArgumentCaptor<String> caseId = ArgumentCaptor.forClass(String.class);
        verify(emailRepository).linkCase(eq("E1"), isNull(), caseId.capture(), isNull());
        verify(emailRepository).linkCase("E1", caseId.getValue(), null, null);
        assertThat(email.getCaseId()).isNull();
    }

    @Test
    void createCase_byId_unknownEmail_throws() {
        when(emailRepository.findById("MISSING")).thenReturn(null);

        assertThatThrownBy(() -> service.createCase("MISSING", "reason", "ops"))
                .isInstanceOf(EmailNotFoundException.class);
    }

    @Test
    void transition_validWalk_appendsAuditEntriesAndBumpsVersion() {
        AtomicReference<InvestigationCase> stored = storeInMemory(
                TestDataFactory.createCase("C1", "E1", CaseStatus.OPEN, 1));

        InvestigationCase review = service.transition("C1", 1, CaseStatus.UNDER_REVIEW, "alice", "triage", null);
        InvestigationCase closed = service.transition("C1", 2, CaseStatus.CLOSED, "bob", "confirmed",
                "Reported to compliance officer");

        assertThat(review.getVersion()).isEqualTo(2);
        assertThat(closed.getVersion()).isEqualTo(3);
        assertThat(closed.getStatus()).isEqualTo(CaseStatus.CLOSED);
        assertThat(closed.getResolutionNotes()).isEqualTo("Reported to compliance officer");
        assertThat(stored.get().getAuditTrail()).extracting(CaseTransition::getToStatus)
                .containsExactly(CaseStatus.OPEN, CaseStatus.UNDER_REVIEW, CaseStatus.CLOSED);
        assertThat(stored.get().getAuditTrail()).extracting(CaseTransition::getActor)
                .containsExactly("system", "alice", "bob");
        verify(metricsConfig).recordCaseTransition("UNDER_REVIEW", "CLOSED");
    }

    @Test
    void transition_escalatedToUnderReview_isRejectedAndNothingWritten() {
        when(caseRepository.findById("C1"))
                .thenReturn(TestDataFactory.createCase("C1", "E1", CaseStatus.ESCALATED, 3));

        assertThatThrownBy(() -> service.transition("C1", 3, CaseStatus.UNDER_REVIEW, "alice", null, null))
                .isInstanceOf(InvalidTransitionException.class)
                .satisfies(e -> {
                    InvalidTransitionException ex = (InvalidTransitionException) e;
                    assertThat(ex.getFrom()).isEqualTo(CaseStatus.ESCALATED);
                    assertThat(ex.getTo()).isEqualTo(CaseStatus.UNDER_REVIEW);
                });
        verify(caseRepository, never()).replace(any(), anyInt());
    }

    @Test
    void transition_fromTerminalState_isRejected() {
        when(caseRepository.findById("C1"))
                .thenReturn(TestDataFactory.createCase("C1", "E1", CaseStatus.FALSE_POSITIVE, 2));

        assertThatThrownBy(() -> service.transition("C1", 2, CaseStatus.OPEN, "alice", null, null))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void transition_staleVersion_throwsConcurrentModification() {
        when(caseRepository.findById("C1"))
                .thenReturn(TestDataFactory.createCase("C1", "E1", CaseStatus.UNDER_REVIEW, 2));

        assertThatThrownBy(() -> service.transition("C1", 1, CaseStatus.CLOSED, "alice", null, null))
                .isInstanceOf(ConcurrentCaseModificationException.class)
                .satisfies(e -> assertThat(((ConcurrentCaseModificationException) e).getActualVersion()).isEqualTo(2));
        verify(caseRepository, never()).replace(any(), anyInt());
        verify(metricsConfig).recordCaseConflict();
    }

    @Test
    void transition_unknownCase_throwsNotFound() {
        when(caseRepository.findById("NOPE")).thenReturn(null);

        assertThatThrownBy(() -> service.transition("NOPE", 1, CaseStatus.CLOSED, "alice", null, null))
                .isInstanceOf(CaseNotFoundException.class);
    }

    @Test
    void transition_concurrentWritersAtSameVersion_exactlyOneWins() throws Exception {
        AtomicReference<InvestigationCase> stored = storeInMemory(
                TestDataFactory.createCase("C1", "E1", CaseStatus.OPEN, 1));
        CyclicBarrier bothRead = new CyclicBarrier(2);
        // Hold both writers at the store until each has passed its version check
        doAnswer(inv -> {
            bothRead.await(5, TimeUnit.SECONDS);
            return compareAndSet(stored, inv.getArgument(0), inv.getArgument(1));
        }).when(caseRepository).replace(any(InvestigationCase.class), anyInt());

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Callable<Object> escalate = () -> attempt(CaseStatus.ESCALATED, "alice");
            Callable<Object> dismiss = () -> attempt(CaseStatus.FALSE_POSITIVE, "bob");
            Future<Object> first = pool.submit(escalate);
            Future<Object> second = pool.submit(dismiss);

            List<Object> results = List.of(first.get(10, TimeUnit.SECONDS), second.get(10, TimeUnit.SECONDS));

            assertThat(results).filteredOn(r -> r instanceof InvestigationCase).hasSize(1);
            assertThat(results).filteredOn(r -> r instanceof ConcurrentCaseModificationException).hasSize(1);
        } finally {
            pool.shutdownNow();
        }

        assertThat(stored.get().getVersion()).isEqualTo(2);
        assertThat(stored.get().getAuditTrail()).hasSize(2);
    }

    @Test
    void assign_recordsAssignmentHistoryWithoutTouchingAuditTrail() {
        AtomicReference<InvestigationCase> stored = storeInMemory(
                TestDataFactory.createCase("C1", "E1", CaseStatus.UNDER_REVIEW, 2));

        InvestigationCase updated = service.assign("C1", 2, "carol", "lead");

        assertThat(updated.getAssignedTo()).isEqualTo("carol");
        assertThat(updated.getStatus()).isEqualTo(CaseStatus.UNDER_REVIEW);
        assertThat(updated.getVersion()).isEqualTo(3);
        assertThat(stored.get().getAuditTrail()).hasSize(1);
        assertThat(stored.get().getAssignmentHistory()).singleElement().satisfies(entry -> {
            assertThat(entry.getActor()).isEqualTo("lead");
            assertThat(entry.getPreviousAssignee()).isNull();
            assertThat(entry.getAssignee()).isEqualTo("carol");
            assertThat(entry.getStatus()).isEqualTo(CaseStatus.UNDER_REVIEW);
        });
    }

    @Test
    void auditTrail_ofAssignedCase_isValidWalkOfTransitionMatrix() {
        AtomicReference<InvestigationCase> stored = storeInMemory(
                TestDataFactory.createCase("C1", "E1", CaseStatus.OPEN, 1));

        service.transition("C1", 1, CaseStatus.UNDER_REVIEW, "alice", "triage", null);
        service.assign("C1", 2, "carol", "lead");
        service.assign("C1", 3, "dave", "lead");
        service.transition("C1", 4, CaseStatus.ESCALATED, "dave", "needs legal", null);

        List<CaseTransition> trail = stored.get().getAuditTrail();
        assertThat(trail.get(0).getFromStatus()).isNull();
        assertThat(trail.get(0).getToStatus()).isEqualTo(CaseStatus.OPEN);
        for (int i = 1; i < trail.size(); i++) {
            CaseTransition entry = trail.get(i);
            assertThat(entry.getFromStatus()).isEqualTo(trail.get(i - 1).getToStatus());
            assertThat(entry.getFromStatus().canTransitionTo(entry.getToStatus()))
                    .as("%s -> %s", entry.getFromStatus(), entry.getToStatus())
                    .isTrue();
        }
        assertThat(stored.get().getAssignmentHistory()).extracting(CaseAssignment::getPreviousAssignee)
                .containsExactly(null, "carol");
        assertThat(stored.get().getAssignedTo()).isEqualTo("dave");
    }

    @Test
    void reopen_afterFalsePositive_onlyOnce() {
        Email email = TestDataFactory.createClassifiedEmail("E1", 0.95, Category.POLICY_VIOLATION);
        email.setCaseId("C1");
        when(caseRepository.findById("C1"))
                .thenReturn(TestDataFactory.createCase("C1", "E1", CaseStatus.FALSE_POSITIVE, 2));
        when(emailRepository.linkCase(eq("E1"), eq("C1"), anyString(), eq("C1"))).thenReturn(true);

        assertThat(service.canReopen(email)).isTrue();
        InvestigationCase reopened = service.reopenAfterFalsePositive(email, "new evidence", "system");

        assertThat(reopened.getStatus()).isEqualTo(CaseStatus.OPEN);
        assertThat(reopened.getCaseId()).isNotEqualTo("C1");
        assertThat(email.getCaseId()).isEqualTo(reopened.getCaseId());
        assertThat(email.getReopenedFromCaseId()).isEqualTo("C1");
        verify(metricsConfig).recordCaseCreated(true);

        assertThat(service.canReopen(email)).isFalse();
        assertThatThrownBy(() -> service.reopenAfterFalsePositive(email, "again", "system"))
                .isInstanceOf(DuplicateCaseException.class);
    }

    @Test
    void canReopen_openCase_isFalse() {
        Email email = TestDataFactory.createClassifiedEmail("E1", 0.95, Category.POLICY_VIOLATION);
        email.setCaseId("C1");
        when(caseRepository.findById("C1"))
                .thenReturn(TestDataFactory.createCase("C1", "E1", CaseStatus.OPEN, 1));

        assertThat(service.canReopen(email)).isFalse();
    }

    @Test
    void getCase_missing_throwsNotFound() {
        when(caseRepository.findById("NOPE")).thenReturn(null);

        assertThatThrownBy(() -> service.getCase("NOPE")).isInstanceOf(CaseNotFoundException.class);
    }

    private Object attempt(CaseStatus target, String actor) {
        try {
            return service.transition("C1", 1, target, actor, null, null);
        } catch (RuntimeException e) {
            return e;
        }
    }

    /**
     * Back the case repository mock with a single record whose version behaves
     * like the store's generation counter.
     */
    private AtomicReference<InvestigationCase> storeInMemory(InvestigationCase initial) {
        AtomicReference<InvestigationCase> stored = new AtomicReference<>(initial);
        lenient().when(caseRepository.findById(initial.getCaseId()))
                .thenAnswer(inv -> copy(stored.get()));
        lenient().when(caseRepository.replace(any(InvestigationCase.class), anyInt()))
                .thenAnswer(inv -> compareAndSet(stored, inv.getArgument(0), inv.getArgument(1)));
        return stored;
    }

    private static boolean compareAndSet(AtomicReference<InvestigationCase> stored,
                                         InvestigationCase updated, int expectedVersion) {
        synchronized (stored) {
            if (stored.get().getVersion() != expectedVersion) {
                return false;
            }
            stored.set(copy(updated).toBuilder().version(expectedVersion + 1).build());
            return true;
        }
    }

    private static InvestigationCase copy(InvestigationCase c) {
        return c.toBuilder()
                .auditTrail(new ArrayList<>(c.getAuditTrail()))
                .assignmentHistory(new ArrayList<>(c.getAssignmentHistory()))
                .build();
    }
}
