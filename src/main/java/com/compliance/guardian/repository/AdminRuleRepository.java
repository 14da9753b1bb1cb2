package com.compliance.guardian.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.compliance.guardian.config.AerospikeConfig;
import com.compliance.guardian.model.AdminRule;
import com.compliance.guardian.model.RuleAction;
import com.compliance.guardian.model.RuleCondition;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

@Repository
public class AdminRuleRepository {

    private static final Logger log = LoggerFactory.getLogger(AdminRuleRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    // In-memory cache of all rules in evaluation order, refreshed periodically
    private final AtomicReference<List<AdminRule>> cachedRules = new AtomicReference<>(List.of());

    public AdminRuleRepository(AerospikeClient client,
                               @Qualifier("aerospikeNamespace") String namespace,
                               @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                               @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    public void startCacheRefresh(int intervalSeconds) {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "admin-rule-cache-refresh");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::refreshCache, 0, intervalSeconds, TimeUnit.SECONDS);
    }

    public void refreshCache() {
        try {
            List<AdminRule> allRules = scanAllRules();
            allRules.sort(AdminRule.EVALUATION_ORDER);
            cachedRules.set(List.copyOf(allRules));
            log.debug("Admin rule cache refreshed, {} rules loaded", allRules.size());
        } catch (Exception e) {
            log.error("Failed to refresh admin rule cache", e);
        }
    }

    /**
     * Enabled rules in evaluation order, from the in-memory cache.
     */
    public List<AdminRule> getActiveRules() {
        return cachedRules.get().stream()
                .filter(AdminRule::isEnabled)
                .toList();
    }

    public List<AdminRule> getAllRulesCached() {
        return cachedRules.get();
    }

    public List<AdminRule> findAll() {
        List<AdminRule> rules = scanAllRules();
        rules.sort(AdminRule.EVALUATION_ORDER);
        return rules;
    }

    public AdminRule findById(String ruleId) {
        Key key = new Key(namespace, AerospikeConfig.SET_ADMIN_RULES, ruleId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecordToRule(ruleId, record);
    }

    public void save(AdminRule rule) {
        Key key = new Key(namespace, AerospikeConfig.SET_ADMIN_RULES, rule.getRuleId());

        client.put(writePolicy, key,
                new Bin("ruleId", rule.getRuleId()),
                new Bin("name", rule.getName()),
                new Bin("description", rule.getDescription() != null ? rule.getDescription() : ""),
                new Bin("conditions", serializeConditions(rule.getConditions())),
                new Bin("action", rule.getAction().name()),
                new Bin("actionValue", rule.getActionValue() != null ? rule.getActionValue() : ""),
                new Bin("priority", rule.getPriority()),
                new Bin("enabled", rule.isEnabled()),
                new Bin("createdAt", rule.getCreatedAt()),
                new Bin("updatedAt", rule.getUpdatedAt()));

        // Immediately refresh cache after save
        refreshCache();
    }

    public boolean delete(String ruleId) {
        Key key = new Key(namespace, AerospikeConfig.SET_ADMIN_RULES, ruleId);
        boolean deleted = client.delete(writePolicy, key);
        if (deleted) {
            refreshCache();
        }
        return deleted;
    }

    private List<AdminRule> scanAllRules() {
        List<AdminRule> rules = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ADMIN_RULES,
                (key, record) -> {
                    try {
                        String ruleId = record.getString("ruleId");
                        if (ruleId != null) {
                            AdminRule rule = mapRecordToRule(ruleId, record);
                            synchronized (rules) {
                                rules.add(rule);
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to deserialize admin rule record: {}", e.getMessage());
                    }
                });
        return rules;
    }

    private AdminRule mapRecordToRule(String ruleId, Record record) {
        String description = record.getString("description");
        String actionValue = record.getString("actionValue");
        return AdminRule.builder()
                .ruleId(ruleId)
                .name(record.getString("name"))
                .description(description == null || description.isEmpty() ? null : description)
                .conditions(deserializeConditions(record.getString("conditions")))
                .action(RuleAction.valueOf(record.getString("action")))
                .actionValue(actionValue == null || actionValue.isEmpty() ? null : actionValue)
                .priority(record.getInt("priority"))
                .enabled(record.getBoolean("enabled"))
                .createdAt(record.getLong("createdAt"))
                .updatedAt(record.getLong("updatedAt"))
                .build();
    }

    private String serializeConditions(List<RuleCondition> conditions) {
        try {
            return objectMapper.writeValueAsString(conditions != null ? conditions : List.of());
        } catch (Exception e) {
            return "[]";
        }
    }

    private List<RuleCondition> deserializeConditions(String json) {
        if (json == null || json.isEmpty()) return new ArrayList<>();
        try {
            return objectMapper.readValue(json, new TypeReference<List<RuleCondition>>() {});
        } catch (Exception e) {
            return new ArrayList<>();
        }
    }
}
