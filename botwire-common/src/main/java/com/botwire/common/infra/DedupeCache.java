package com.botwire.common.infra;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Remembers recently seen keys for a TTL window, bounded in size.
 * Used to drop update ids redelivered by the platform.
 * Thread-safe via synchronization.
 */
public class DedupeCache {

    private final long ttlMs;
    private final int maxSize;
    private final LongSupplier clock;
    // insertion order == first-seen order, oldest first
    private final LinkedHashMap<String, Long> seenAt = new LinkedHashMap<>(64);

    public DedupeCache(long ttlMs, int maxSize) {
        this(ttlMs, maxSize, System::currentTimeMillis);
    }

    public DedupeCache(long ttlMs, int maxSize, LongSupplier clock) {
        this.ttlMs = Math.max(0, ttlMs);
        this.maxSize = Math.max(1, maxSize);
        this.clock = clock;
    }

    /**
     * Record {@code key} and report whether it was already present and unexpired.
     * A null or empty key is never a duplicate.
     */
    public synchronized boolean isDuplicate(String key) {
        if (key == null || key.isEmpty()) {
            return false;
        }
        long now = clock.getAsLong();
        evictExpired(now);

        Long firstSeen = seenAt.get(key);
        if (firstSeen != null) {
            return true;
        }
        seenAt.put(key, now);
        while (seenAt.size() > maxSize) {
            Iterator<String> oldest = seenAt.keySet().iterator();
            oldest.next();
            oldest.remove();
        }
        return false;
    }

    private void evictExpired(long now) {
        if (ttlMs <= 0) {
            return;
        }
        Iterator<Map.Entry<String, Long>> it = seenAt.entrySet().iterator();
        while (it.hasNext()) {
            if (now - it.next().getValue() >= ttlMs) {
                it.remove();
            } else {
                break;
            }
        }
    }

    public synchronized void clear() {
        seenAt.clear();
    }

    public synchronized int size() {
        return seenAt.size();
    }
}
