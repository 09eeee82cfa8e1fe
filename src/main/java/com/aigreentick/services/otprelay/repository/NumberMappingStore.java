package com.aigreentick.services.otprelay.repository;

import java.util.List;
import java.util.Map;

/**
 * Durable store of normalized phone number → Telegram chat id.
 *
 * Keys are unique and the last allocation wins. Entries are never deleted.
 * Readers work from {@link #snapshot()}; only {@link #put} and {@link #save}
 * mutate state. Storage and lock failures are logged and absorbed by the
 * implementation, so callers are never blocked by the backing medium.
 */
public interface NumberMappingStore {

    /**
     * Read the persisted mappings. Missing or unreadable state yields an empty map.
     */
    Map<String, Long> load();

    /**
     * Replace the persisted mappings with {@code mappings}.
     */
    void save(Map<String, Long> mappings);

    /**
     * Atomic read-modify-write of a single key.
     */
    void put(String normalizedNumber, long subscriberId);

    /**
     * Current in-memory mappings in insertion order. Unmodifiable.
     */
    Map<String, Long> snapshot();

    default List<String> numbersOwnedBy(long subscriberId) {
        return snapshot().entrySet().stream()
                .filter(entry -> entry.getValue() == subscriberId)
                .map(Map.Entry::getKey)
                .toList();
    }
}
