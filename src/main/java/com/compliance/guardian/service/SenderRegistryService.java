package com.compliance.guardian.service;

import com.compliance.guardian.config.GuardianProperties;
import com.compliance.guardian.config.MetricsConfig;
import com.compliance.guardian.model.FlaggedSender;
import com.compliance.guardian.model.SenderRegistrySnapshot;
import com.compliance.guardian.repository.FlaggedSenderRepository;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;

/**
 * Flagged sender registry. Lookups read the repository's in-memory set of active
 * senders; writes go to Aerospike and then update that set.
 */
@Service
public class SenderRegistryService {

    private static final Logger log = LoggerFactory.getLogger(SenderRegistryService.class);

    private final FlaggedSenderRepository senderRepository;
    private final GuardianProperties properties;
    private final MetricsConfig metricsConfig;

    public SenderRegistryService(FlaggedSenderRepository senderRepository,
                                 GuardianProperties properties,
                                 MetricsConfig metricsConfig) {
        this.senderRepository = senderRepository;
        this.properties = properties;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        senderRepository.startCacheRefresh(properties.getCache().getSenderRefreshSeconds());
    }

    /**
     * Flag a sender, or refresh the reason and actor of an existing active flag.
     * One record per sender; {@code flagCount} grows each time an inactive or new
     * sender becomes active.
     */
    public FlaggedSender flag(String sender, String reason, String actor) {
        String key = requireKey(sender);
        long now = System.currentTimeMillis();

        FlaggedSender existing = senderRepository.findBySender(key);
        boolean wasActive = existing != null && existing.isActive();
        FlaggedSender record = existing != null
                ? existing
                : FlaggedSender.builder().sender(key).flagCount(0).build();

        record.setActive(true);
        record.setReason(reason);
        record.setFlaggedBy(actor);
        record.setFlaggedAt(now);
        record.setUnflaggedAt(0);
        record.setUnflaggedBy(null);
        if (!wasActive) {
            record.setFlagCount(record.getFlagCount() + 1);
        }

        senderRepository.save(record);
        metricsConfig.updateActiveFlaggedSenders(senderRepository.getActiveSenders().size());
        log.info("Sender {} flagged by {} ({}): {}", key, actor, wasActive ? "refreshed" : "activated", reason);
        return record;
    }

    /**
     * Deactivate a flag. The record is kept for audit.
     *
     * @return false if the sender had no active flag
     */
    public boolean unflag(String sender, String actor) {
        String key = requireKey(sender);
        FlaggedSender record = senderRepository.findBySender(key);
        if (record == null || !record.isActive()) {
            log.debug("Unflag of {} ignored, no active flag", key);
            return false;
        }

        record.setActive(false);
        record.setUnflaggedAt(System.currentTimeMillis());
        record.setUnflaggedBy(actor);
        senderRepository.save(record);
        metricsConfig.updateActiveFlaggedSenders(senderRepository.getActiveSenders().size());
        log.info("Sender {} unflagged by {}", key, actor);
        return true;
    }

    public boolean isActive(String sender) {
        String key = SenderRegistrySnapshot.normalize(sender);
        return key != null && senderRepository.getActiveSenders().contains(key);
    }

    public SenderRegistrySnapshot snapshot() {
        return new SenderRegistrySnapshot(senderRepository.getActiveSenders());
    }

    public FlaggedSender get(String sender) {
        String key = SenderRegistrySnapshot.normalize(sender);
        return key != null ? senderRepository.findBySender(key) : null;
    }

    public List<FlaggedSender> list(boolean activeOnly) {
        return senderRepository.findAll().stream()
                .filter(s -> !activeOnly || s.isActive())
                .sorted(Comparator.comparing(FlaggedSender::getSender))
                .toList();
    }

    private static String requireKey(String sender) {
        String key = SenderRegistrySnapshot.normalize(sender);
        if (key == null) {
            throw new IllegalArgumentException("sender is required");
        }
        return key;
    }
}
