package com.compliance.guardian.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.compliance.guardian.config.AerospikeConfig;
import com.compliance.guardian.model.CaseAssignment;
import com.compliance.guardian.model.CaseStatus;
import com.compliance.guardian.model.CaseTransition;
import com.compliance.guardian.model.InvestigationCase;
import com.compliance.guardian.model.PagedResponse;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Investigation cases. The case version is the Aerospike record generation, so
 * every write is a compare-and-set and the status change and its audit entry
 * land in the same put.
 */
@Repository
public class CaseRepository {

    private static final Logger log = LoggerFactory.getLogger(CaseRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public CaseRepository(AerospikeClient client,
                          @Qualifier("aerospikeNamespace") String namespace,
                          @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                          @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Insert a new case. Fails if a record with the same id already exists.
     */
    public void create(InvestigationCase investigationCase) {
        Key key = new Key(namespace, AerospikeConfig.SET_CASES, investigationCase.getCaseId());
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.recordExistsAction = RecordExistsAction.CREATE_ONLY;

        client.put(policy, key, toBins(investigationCase));
    }

    /**
     * Overwrite the case only if its stored version still equals {@code expectedVersion}.
     *
     * @return false when another writer got there first
     */
    public boolean replace(InvestigationCase investigationCase, int expectedVersion) {
        Key key = new Key(namespace, AerospikeConfig.SET_CASES, investigationCase.getCaseId());
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
        policy.generation = expectedVersion;
        policy.recordExistsAction = RecordExistsAction.UPDATE_ONLY;

        try {
            client.put(policy, key, toBins(investigationCase));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.GENERATION_ERROR) {
                log.debug("Generation mismatch writing case {} at version {}",
                        investigationCase.getCaseId(), expectedVersion);
                return false;
            }
            throw e;
        }
    }

    public InvestigationCase findById(String caseId) {
        Key key = new Key(namespace, AerospikeConfig.SET_CASES, caseId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    public List<InvestigationCase> findAll() {
        List<InvestigationCase> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_CASES,
                (key, record) -> {
                    try {
                        InvestigationCase c = mapRecord(record);
                        synchronized (results) {
                            results.add(c);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read case record: {}", e.getMessage());
                    }
                });
        return results;
    }

    public PagedResponse<InvestigationCase> findByFilters(CaseStatus status, String emailId,
                                                          int limit, Long before) {
        List<InvestigationCase> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_CASES,
                (key, record) -> {
                    try {
                        if (status != null && !status.name().equals(record.getString("status"))) return;
                        if (emailId != null && !emailId.isEmpty()
                                && !emailId.equals(record.getString("emailId"))) return;
                        long createdAt = record.getLong("createdAt");
                        if (before != null && createdAt >= before) return;

                        InvestigationCase c = mapRecord(record);
                        synchronized (results) {
                            results.add(c);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to filter case record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(InvestigationCase::getCreatedAt).reversed());
        boolean hasMore = results.size() > limit;
        List<InvestigationCase> page = hasMore ? new ArrayList<>(results.subList(0, limit)) : results;
        String nextCursor = hasMore ? String.valueOf(page.get(page.size() - 1).getCreatedAt()) : null;
        return new PagedResponse<>(page, hasMore, nextCursor);
    }

    private Bin[] toBins(InvestigationCase c) {
        return new Bin[] {
                new Bin("caseId", c.getCaseId()),
                new Bin("emailId", c.getEmailId()),
                new Bin("status", c.getStatus().name()),
                new Bin("assignedTo", c.getAssignedTo() != null ? c.getAssignedTo() : ""),
                new Bin("escReason", c.getEscalationReason() != null ? c.getEscalationReason() : ""),
                new Bin("createdAt", c.getCreatedAt()),
                new Bin("updatedAt", c.getUpdatedAt()),
                new Bin("resNotes", c.getResolutionNotes() != null ? c.getResolutionNotes() : ""),
                new Bin("auditTrail", serializeJson(c.getAuditTrail())),
                new Bin("assignments", serializeJson(c.getAssignmentHistory()))
        };
    }

    private InvestigationCase mapRecord(Record record) {
        return InvestigationCase.builder()
                .caseId(record.getString("caseId"))
                .emailId(record.getString("emailId"))
                .status(CaseStatus.valueOf(record.getString("status")))
                .assignedTo(emptyToNull(record.getString("assignedTo")))
                .escalationReason(emptyToNull(record.getString("escReason")))
                .createdAt(record.getLong("createdAt"))
                .updatedAt(record.getLong("updatedAt"))
                .resolutionNotes(emptyToNull(record.getString("resNotes")))
                .auditTrail(deserializeList(record.getString("auditTrail"),
                        new TypeReference<List<CaseTransition>>() {}))
                .assignmentHistory(deserializeList(record.getString("assignments"),
                        new TypeReference<List<CaseAssignment>>() {}))
                .version(record.generation)
                .build();
    }

    private String serializeJson(List<?> entries) {
        try {
            return objectMapper.writeValueAsString(entries != null ? entries : List.of());
        } catch (Exception e) {
            throw new IllegalStateException("Unable to serialize case history", e);
        }
    }

    private <T> List<T> deserializeList(String json, TypeReference<List<T>> type) {
        if (json == null || json.isEmpty()) return new ArrayList<>();
        try {
            return objectMapper.readValue(json, type);
        } catch (Exception e) {
            log.warn("Unreadable case history: {}", e.getMessage());
            return new ArrayList<>();
        }
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
