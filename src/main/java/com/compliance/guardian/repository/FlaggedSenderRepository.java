package com.compliance.guardian.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.compliance.guardian.config.AerospikeConfig;
import com.compliance.guardian.model.FlaggedSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

@Repository
public class FlaggedSenderRepository {

    private static final Logger log = LoggerFactory.getLogger(FlaggedSenderRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    // Active sender keys, swapped as a whole so readers never see a partial set
    private final AtomicReference<Set<String>> activeSenders = new AtomicReference<>(Set.of());

    public FlaggedSenderRepository(AerospikeClient client,
                                   @Qualifier("aerospikeNamespace") String namespace,
                                   @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                   @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public void startCacheRefresh(int intervalSeconds) {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "sender-cache-refresh");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::refreshCache, 0, intervalSeconds, TimeUnit.SECONDS);
    }

    public void refreshCache() {
        try {
            Set<String> active = new HashSet<>();
            for (FlaggedSender sender : findAll()) {
                if (sender.isActive()) {
                    active.add(sender.getSender());
                }
            }
            activeSenders.set(Set.copyOf(active));
            log.debug("Sender cache refreshed, {} active senders", active.size());
        } catch (Exception e) {
            log.error("Failed to refresh sender cache", e);
        }
    }

    /**
     * Immutable set of active sender keys from the in-memory cache.
     */
    public Set<String> getActiveSenders() {
        return activeSenders.get();
    }

    public FlaggedSender findBySender(String sender) {
        Key key = new Key(namespace, AerospikeConfig.SET_FLAGGED_SENDERS, sender);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    public List<FlaggedSender> findAll() {
        List<FlaggedSender> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_FLAGGED_SENDERS,
                (key, record) -> {
                    try {
                        FlaggedSender sender = mapRecord(record);
                        synchronized (results) {
                            results.add(sender);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read flagged sender record: {}", e.getMessage());
                    }
                });
        return results;
    }

    public void save(FlaggedSender sender) {
        Key key = new Key(namespace, AerospikeConfig.SET_FLAGGED_SENDERS, sender.getSender());

        client.put(writePolicy, key,
                new Bin("sender", sender.getSender()),
                new Bin("reason", sender.getReason() != null ? sender.getReason() : ""),
                new Bin("flaggedAt", sender.getFlaggedAt()),
                new Bin("flaggedBy", sender.getFlaggedBy() != null ? sender.getFlaggedBy() : ""),
                new Bin("active", sender.isActive()),
                new Bin("unflaggedAt", sender.getUnflaggedAt()),
                new Bin("unflaggedBy", sender.getUnflaggedBy() != null ? sender.getUnflaggedBy() : ""),
                new Bin("flagCount", sender.getFlagCount()));

        // Apply the write to the cache right away; the periodic refresh reconciles the rest
        activeSenders.updateAndGet(current -> {
            Set<String> next = new HashSet<>(current);
            if (sender.isActive()) {
                next.add(sender.getSender());
            } else {
                next.remove(sender.getSender());
            }
            return Set.copyOf(next);
        });
    }

    private FlaggedSender mapRecord(Record record) {
        String flaggedBy = record.getString("flaggedBy");
        String unflaggedBy = record.getString("unflaggedBy");
        String reason = record.getString("reason");
        return FlaggedSender.builder()
                .sender(record.getString("sender"))
                .reason(reason == null || reason.isEmpty() ? null : reason)
                .flaggedAt(record.getLong("flaggedAt"))
                .flaggedBy(flaggedBy == null || flaggedBy.isEmpty() ? null : flaggedBy)
                .active(record.getBoolean("active"))
                .unflaggedAt(record.getLong("unflaggedAt"))
                .unflaggedBy(unflaggedBy == null || unflaggedBy.isEmpty() ? null : unflaggedBy)
                .flagCount(record.getInt("flagCount"))
                .build();
    }
}
