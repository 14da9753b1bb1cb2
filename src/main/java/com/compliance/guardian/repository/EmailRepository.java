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
import com.compliance.guardian.model.Category;
import com.compliance.guardian.model.Email;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

@Repository
public class EmailRepository {

    private static final Logger log = LoggerFactory.getLogger(EmailRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public EmailRepository(AerospikeClient client,
                           @Qualifier("aerospikeNamespace") String namespace,
                           @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                           @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    public void save(Email email) {
        Key key = new Key(namespace, AerospikeConfig.SET_EMAILS, email.getEmailId());

        client.put(writePolicy, key,
                new Bin("emailId", email.getEmailId()),
                new Bin("sender", nullToEmpty(email.getSender())),
                new Bin("subject", nullToEmpty(email.getSubject())),
                new Bin("body", nullToEmpty(email.getBody())),
                new Bin("recipients", serializeList(email.getRecipients())),
                new Bin("attachments", serializeList(email.getAttachments())),
                new Bin("department", nullToEmpty(email.getDepartment())),
                new Bin("businessUnit", nullToEmpty(email.getBusinessUnit())),
                new Bin("categoryHint", nullToEmpty(email.getCategoryHint())),
                new Bin("receivedAt", email.getReceivedAt()),
                new Bin("importedAt", email.getImportedAt()),
                new Bin("batchId", nullToEmpty(email.getBatchId())),
                scoreBin(email),
                categoryBin(email),
                new Bin("flagged", email.isFlagged()),
                new Bin("caseId", nullToEmpty(email.getCaseId())),
                new Bin("reopenedFrom", nullToEmpty(email.getReopenedFromCaseId())));
    }

    public Email findById(String emailId) {
        Key key = new Key(namespace, AerospikeConfig.SET_EMAILS, emailId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    public List<Email> findAll() {
        List<Email> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_EMAILS,
                (key, record) -> {
                    try {
                        Email email = mapRecord(record);
                        synchronized (results) {
                            results.add(email);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read email record: {}", e.getMessage());
                    }
                });
        return results;
    }

    /**
     * Rewrite only the classification bins. Case links are left alone so a
     * reclassification never clobbers a concurrent case creation.
     */
    public void updateClassification(Email email) {
        Key key = new Key(namespace, AerospikeConfig.SET_EMAILS, email.getEmailId());
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.recordExistsAction = RecordExistsAction.UPDATE_ONLY;

        client.put(policy, key,
                scoreBin(email),
                categoryBin(email),
                new Bin("flagged", email.isFlagged()));
    }

    /**
     * Compare-and-set of the email's case link. Succeeds only when the stored
     * case id still equals {@code expectedCaseId} and nobody wrote the record in between.
     *
     * @return true if the link was written, false if the email is missing or the link changed
     */
    public boolean linkCase(String emailId, String expectedCaseId, String newCaseId, String reopenedFromCaseId) {
        Key key = new Key(namespace, AerospikeConfig.SET_EMAILS, emailId);
        Record record = client.get(readPolicy, key);
        if (record == null) return false;

        String currentCaseId = emptyToNull(record.getString("caseId"));
        if (!Objects.equals(currentCaseId, expectedCaseId)) {
            log.debug("Email {} is linked to case {}, expected {}", emailId, currentCaseId, expectedCaseId);
            return false;
        }

        WritePolicy policy = new WritePolicy(writePolicy);
        policy.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
        policy.generation = record.generation;
        policy.recordExistsAction = RecordExistsAction.UPDATE_ONLY;

        try {
            client.put(policy, key,
                    new Bin("caseId", nullToEmpty(newCaseId)),
                    new Bin("reopenedFrom", nullToEmpty(reopenedFromCaseId)));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.GENERATION_ERROR) {
                log.debug("Lost case link race on email {}", emailId);
                return false;
            }
            throw e;
        }
    }

    private Email mapRecord(Record record) {
        Email email = Email.builder()
                .emailId(record.getString("emailId"))
                .sender(emptyToNull(record.getString("sender")))
                .subject(emptyToNull(record.getString("subject")))
                .body(nullToEmpty(record.getString("body")))
                .recipients(deserializeList(record.getString("recipients")))
                .attachments(deserializeList(record.getString("attachments")))
                .department(emptyToNull(record.getString("department")))
                .businessUnit(emptyToNull(record.getString("businessUnit")))
                .categoryHint(emptyToNull(record.getString("categoryHint")))
                .receivedAt(record.getLong("receivedAt"))
                .importedAt(record.getLong("importedAt"))
                .batchId(emptyToNull(record.getString("batchId")))
                .flagged(record.getBoolean("flagged"))
                .caseId(emptyToNull(record.getString("caseId")))
                .reopenedFromCaseId(emptyToNull(record.getString("reopenedFrom")))
                .build();

        String category = emptyToNull(record.getString("category"));
        if (category != null && record.getValue("riskScore") != null) {
            email.applyClassification(record.getDouble("riskScore"), Category.valueOf(category));
        }
        return email;
    }

    private static Bin scoreBin(Email email) {
        return email.getRiskScore() != null
                ? new Bin("riskScore", email.getRiskScore().doubleValue())
                : Bin.asNull("riskScore");
    }

    private static Bin categoryBin(Email email) {
        return new Bin("category", email.getPredictedCategory() != null
                ? email.getPredictedCategory().name() : "");
    }

    private String serializeList(List<String> list) {
        try {
            return objectMapper.writeValueAsString(list != null ? list : Collections.emptyList());
        } catch (Exception e) {
            return "[]";
        }
    }

    private List<String> deserializeList(String json) {
        if (json == null || json.isEmpty()) return new ArrayList<>();
        try {
            return objectMapper.readValue(json, new TypeReference<List<String>>() {});
        } catch (Exception e) {
            return new ArrayList<>();
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
