package com.compliance.guardian.service;

import com.compliance.guardian.config.MetricsConfig;
import com.compliance.guardian.exception.CaseNotFoundException;
import com.compliance.guardian.exception.ConcurrentCaseModificationException;
import com.compliance.guardian.exception.DuplicateCaseException;
import com.compliance.guardian.exception.EmailNotFoundException;
import com.compliance.guardian.exception.InvalidTransitionException;
import com.compliance.guardian.model.CaseAssignment;
import com.compliance.guardian.model.CaseStatus;
import com.compliance.guardian.model.CaseTransition;
import com.compliance.guardian.model.Email;
import com.compliance.guardian.model.InvestigationCase;
import com.compliance.guardian.model.PagedResponse;
import com.compliance.guardian.repository.CaseRepository;
import com.compliance.guardian.repository.EmailRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Creates investigation cases and moves them through their lifecycle.
 *
 * <p>Every write is a compare-and-set on the record generation: the email's case
 * link when a case is opened, and the case record itself on transitions and
 * assignment. Callers holding a stale version get
 * {@link ConcurrentCaseModificationException} and must re-read.
 */
@Service
public class CaseLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(CaseLifecycleService.class);

    private final CaseRepository caseRepository;
    private final EmailRepository emailRepository;
    private final MetricsConfig metricsConfig;

    public CaseLifecycleService(CaseRepository caseRepository,
                                EmailRepository emailRepository,
                                MetricsConfig metricsConfig) {
        this.caseRepository = caseRepository;
        this.emailRepository = emailRepository;
        this.metricsConfig = metricsConfig;
    }

    public InvestigationCase createCase(String emailId, String reason, String actor) {
        Email email = emailRepository.findById(emailId);
        if (email == null) {
            throw new EmailNotFoundException(emailId);
        }
        return createCase(email, reason, actor);
    }

    /**
     * Open a case for an email that has none.
     *
     * @throws DuplicateCaseException if the email already has a case, including one
     *                                linked concurrently by another caller
     */
    public InvestigationCase createCase(Email email, String reason, String actor) {
        if (email.getCaseId() != null) {
            throw new DuplicateCaseException(email.getEmailId(), email.getCaseId());
        }
        return openCase(email, null, reason, actor, email.getReopenedFromCaseId());
    }

    /**
     * Whether the email's current case was closed as a false positive and the
     * email has not been re-opened before.
     */
    public boolean canReopen(Email email) {
        if (email.getCaseId() == null || email.getReopenedFromCaseId() != null) {
            return false;
        }
        InvestigationCase current = caseRepository.findById(email.getCaseId());
        return current != null && current.getStatus() == CaseStatus.FALSE_POSITIVE;
    }

    /**
     * Replace a FALSE_POSITIVE case with a fresh OPEN one. Allowed once per email.
     *
     * @throws DuplicateCaseException if the email cannot be re-opened
     */
    public InvestigationCase reopenAfterFalsePositive(Email email, String reason, String actor) {
        if (!canReopen(email)) {
            throw new DuplicateCaseException(email.getEmailId(), email.getCaseId());
        }
        String previousCaseId = email.getCaseId();
        return openCase(email, previousCaseId, reason, actor, previousCaseId);
    }

    /**
     * Move a case to {@code target}.
     *
     * @param expectedVersion the version the caller last read
     * @param resolutionNotes stored only when {@code target} is terminal
     */
    public InvestigationCase transition(String caseId, int expectedVersion, CaseStatus target,
                                        String actor, String reason, String resolutionNotes) {
        InvestigationCase current = loadAtVersion(caseId, expectedVersion);

        CaseStatus from = current.getStatus();
        if (!from.canTransitionTo(target)) {
            throw new InvalidTransitionException(caseId, from, target);
        }

        long now = System.currentTimeMillis();
        List<CaseTransition> trail = new ArrayList<>(current.getAuditTrail());
        trail.add(CaseTransition.builder()
                .actor(actor)
                .fromStatus(from)
                .toStatus(target)
                .timestamp(now)
                .reason(reason)
                .build());

        InvestigationCase updated = current.toBuilder()
                .status(target)
                .updatedAt(now)
                .version(expectedVersion + 1)
                .auditTrail(trail)
                .resolutionNotes(target.isTerminal() && resolutionNotes != null
                        ? resolutionNotes : current.getResolutionNotes())
                .build();

        write(updated, expectedVersion);
        metricsConfig.recordCaseTransition(from.name(), target.name());
        log.info("Case {} moved {} -> {} by {} (version {})", caseId, from, target, actor, updated.getVersion());
        return updated;
    }

    /**
     * Assign a case without changing its status. Recorded in the assignment history;
     * the audit trail is left to status transitions.
     */
    public InvestigationCase assign(String caseId, int expectedVersion, String assignee, String actor) {
        InvestigationCase current = loadAtVersion(caseId, expectedVersion);

        long now = System.currentTimeMillis();
        List<CaseAssignment> history = new ArrayList<>(current.getAssignmentHistory());
        history.add(CaseAssignment.builder()
                .actor(actor)
                .previousAssignee(current.getAssignedTo())
                .assignee(assignee)
                .status(current.getStatus())
                .timestamp(now)
                .build());

        InvestigationCase updated = current.toBuilder()
                .assignedTo(assignee)
                .updatedAt(now)
                .version(expectedVersion + 1)
                .assignmentHistory(history)
                .build();

        write(updated, expectedVersion);
        log.info("Case {} assigned to {} by {}", caseId, assignee, actor);
        return updated;
    }

    public InvestigationCase getCase(String caseId) {
        InvestigationCase c = caseRepository.findById(caseId);
        if (c == null) {
            throw new CaseNotFoundException(caseId);
        }
        return c;
    }

    public PagedResponse<InvestigationCase> listCases(CaseStatus status, String emailId, int limit, Long before) {
        return caseRepository.findByFilters(status, emailId, limit, before);
    }

    private InvestigationCase openCase(Email email, String expectedCaseId, String reason,
                                       String actor, String reopenedFromCaseId) {
        long now = System.currentTimeMillis();
        String caseId = UUID.randomUUID().toString();

        List<CaseTransition> trail = new ArrayList<>();
        trail.add(CaseTransition.builder()
                .actor(actor)
                .fromStatus(null)
                .toStatus(CaseStatus.OPEN)
                .timestamp(now)
                .reason(reason)
                .build());

        InvestigationCase created = InvestigationCase.builder()
                .caseId(caseId)
                .emailId(email.getEmailId())
                .status(CaseStatus.OPEN)
                .escalationReason(reason)
                .createdAt(now)
                .updatedAt(now)
                .version(1)
                .auditTrail(trail)
                .build();

        // Claim the email first so at most one creator ever writes a case record
        if (!emailRepository.linkCase(email.getEmailId(), expectedCaseId, caseId, reopenedFromCaseId)) {
            Email latest = emailRepository.findById(email.getEmailId());
            if (latest == null) {
                throw new EmailNotFoundException(email.getEmailId());
            }
            log.warn("Case creation for email {} lost to existing case {}", email.getEmailId(), latest.getCaseId());
            throw new DuplicateCaseException(email.getEmailId(), latest.getCaseId());
        }

        try {
            caseRepository.create(created);
        } catch (RuntimeException e) {
            log.error("Failed to store case {} for email {}, releasing the link", caseId, email.getEmailId(), e);
            emailRepository.linkCase(email.getEmailId(), caseId, expectedCaseId, email.getReopenedFromCaseId());
            throw e;
        }

        email.setCaseId(caseId);
        email.setReopenedFromCaseId(reopenedFromCaseId);
        metricsConfig.recordCaseCreated(expectedCaseId != null);
        log.info("Opened case {} for email {} by {}{}", caseId, email.getEmailId(), actor,
                expectedCaseId != null ? " (replacing false positive " + expectedCaseId + ")" : "");
        return created;
    }

    private InvestigationCase loadAtVersion(String caseId, int expectedVersion) {
        InvestigationCase current = caseRepository.findById(caseId);
        if (current == null) {
            throw new CaseNotFoundException(caseId);
        }
        if (current.getVersion() != expectedVersion) {
            metricsConfig.recordCaseConflict();
            throw new ConcurrentCaseModificationException(caseId, expectedVersion, current.getVersion());
        }
        return current;
    }

    private void write(InvestigationCase updated, int expectedVersion) {
        if (!caseRepository.replace(updated, expectedVersion)) {
            metricsConfig.recordCaseConflict();
            InvestigationCase latest = caseRepository.findById(updated.getCaseId());
            int actual = latest != null ? latest.getVersion() : -1;
            log.warn("Concurrent write on case {}: expected version {}, now {}",
                    updated.getCaseId(), expectedVersion, actual);
            throw new ConcurrentCaseModificationException(updated.getCaseId(), expectedVersion, actual);
        }
    }
}
