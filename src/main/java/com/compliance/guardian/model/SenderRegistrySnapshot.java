package com.compliance.guardian.model;

import java.util.Locale;
import java.util.Set;

/**
 * Immutable view of the active flagged senders, taken once per batch.
 */
public record SenderRegistrySnapshot(Set<String> activeSenders) {

    public SenderRegistrySnapshot {
        activeSenders = activeSenders == null ? Set.of() : Set.copyOf(activeSenders);
    }

    public static SenderRegistrySnapshot empty() {
        return new SenderRegistrySnapshot(Set.of());
    }

    public boolean isActive(String sender) {
        String key = normalize(sender);
        return key != null && activeSenders.contains(key);
    }

    public int size() {
        return activeSenders.size();
    }

    /**
     * Registry key for a sender address: trimmed and lower-cased, null when blank.
     */
    public static String normalize(String sender) {
        if (sender == null) return null;
        String key = sender.trim().toLowerCase(Locale.ROOT);
        return key.isEmpty() ? null : key;
    }
}
