package com.compliance.guardian.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.compliance.guardian.config.AerospikeConfig;
import com.compliance.guardian.engine.classifier.ClassifierModel;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

/**
 * Persists the active classifier snapshot as an opaque JSON blob.
 */
@Repository
public class ClassifierModelRepository {

    private static final Logger log = LoggerFactory.getLogger(ClassifierModelRepository.class);

    static final String ACTIVE_KEY = "active";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public ClassifierModelRepository(AerospikeClient client,
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
     * @return true if the snapshot was stored
     */
    public boolean save(ClassifierModel model) {
        try {
            String modelJson = objectMapper.writeValueAsString(model);
            Key key = new Key(namespace, AerospikeConfig.SET_CLASSIFIER_MODELS, ACTIVE_KEY);

            client.put(writePolicy, key,
                    new Bin("version", model.getVersion()),
                    new Bin("modelJson", modelJson),
                    new Bin("vocabSize", model.getVocabularySize()),
                    new Bin("classCount", model.getClasses().size()),
                    new Bin("trainedAt", model.getTrainedAt()),
                    new Bin("trainSamples", model.getTrainingSamples()));

            log.info("Saved classifier model {}: {} terms, {} samples",
                    model.getVersion(), model.getVocabularySize(), model.getTrainingSamples());
            return true;
        } catch (Exception e) {
            log.error("Failed to save classifier model {}", model.getVersion(), e);
            return false;
        }
    }

    public ClassifierModel loadActive() {
        Key key = new Key(namespace, AerospikeConfig.SET_CLASSIFIER_MODELS, ACTIVE_KEY);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;

        try {
            return objectMapper.readValue(record.getString("modelJson"), ClassifierModel.class);
        } catch (Exception e) {
            log.error("Failed to load classifier model", e);
            return null;
        }
    }
}
