package com.compliance.guardian.service;

import com.compliance.guardian.config.GuardianProperties;
import com.compliance.guardian.model.AdminRule;
import com.compliance.guardian.model.AdminRuleUpdate;
import com.compliance.guardian.repository.AdminRuleRepository;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Service layer for managing admin rules.
 * Handles CRUD operations and initializes the rule cache on startup.
 */
@Service
public class AdminRuleService {

    private static final Logger log = LoggerFactory.getLogger(AdminRuleService.class);

    private final AdminRuleRepository ruleRepository;
    private final GuardianProperties properties;

    public AdminRuleService(AdminRuleRepository ruleRepository, GuardianProperties properties) {
        this.ruleRepository = ruleRepository;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        ruleRepository.startCacheRefresh(properties.getCache().getRuleRefreshSeconds());
    }

    public List<AdminRule> getAllRules() {
        return ruleRepository.getAllRulesCached();
    }

    /**
     * Enabled rules sorted by (priority, ruleId).
     */
    public List<AdminRule> getActiveRulesSorted() {
        return ruleRepository.getActiveRules();
    }

    public AdminRule getRule(String ruleId) {
        return ruleRepository.findById(ruleId);
    }

    public AdminRule createRule(AdminRule rule) {
        if (rule.getRuleId() == null || rule.getRuleId().isEmpty()) {
            rule.setRuleId(UUID.randomUUID().toString());
        }
        long now = System.currentTimeMillis();
        rule.setCreatedAt(now);
        rule.setUpdatedAt(now);
        ruleRepository.save(rule);
        log.info("Created admin rule {} ({}), action={}, priority={}",
                rule.getRuleId(), rule.getName(), rule.getAction(), rule.getPriority());
        return rule;
    }

    /**
     * Merge the fields present in {@code update} into the stored rule.
     *
     * @return the merged rule, or null when no rule has that id
     */
    public AdminRule updateRule(String ruleId, AdminRuleUpdate update) {
        AdminRule existing = ruleRepository.findById(ruleId);
        if (existing == null) {
            return null;
        }

        if (update.getName() != null) existing.setName(update.getName());
        if (update.getDescription() != null) existing.setDescription(update.getDescription());
        if (update.getConditions() != null && !update.getConditions().isEmpty()) {
            existing.setConditions(update.getConditions());
        }
        if (update.getAction() != null) existing.setAction(update.getAction());
        if (update.getActionValue() != null) existing.setActionValue(update.getActionValue());
        if (update.getPriority() != null) existing.setPriority(update.getPriority());
        if (update.getEnabled() != null) existing.setEnabled(update.getEnabled());
        existing.setUpdatedAt(System.currentTimeMillis());

        ruleRepository.save(existing);
        log.info("Updated admin rule {}", ruleId);
        return existing;
    }

    public boolean deleteRule(String ruleId) {
        boolean deleted = ruleRepository.delete(ruleId);
        if (deleted) {
            log.info("Deleted admin rule {}", ruleId);
        }
        return deleted;
    }
}
