package com.copytrader.oms;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bounded, insertion-ordered set of identifiers with a per-entry time-to-live.
 *
 * <p>Every access through {@link #checkAndRecord(String)} (re)inserts the id at the tail
 * with a fresh expiry, so entries stay ordered by expiry time. Expired entries are
 * purged from the head on each access; when the set is full the oldest entry goes first.
 *
 * <p>Thread-safe via intrinsic locking.
 */
public class ExpiringIdSet {

    private final String name;
    private final long ttlMillis;
    private final int maxSize;
    private final Clock clock;

    /** id -> expiry epoch millis, in insertion order. */
    private final LinkedHashMap<String, Long> entries = new LinkedHashMap<>();

    public ExpiringIdSet(String name, Duration ttl, int maxSize, Clock clock) {
        if (maxSize < 1) {
            throw new IllegalArgumentException(name + ": maxSize must be at least 1");
        }
        this.name = name;
        this.ttlMillis = ttl.toMillis();
        this.maxSize = maxSize;
        this.clock = clock;
    }

    /**
     * Records the id and reports whether it was already present and unexpired.
     * A hit refreshes the entry's expiry and moves it to the tail.
     *
     * @return true if the id had been seen within its time-to-live
     */
    public synchronized boolean checkAndRecord(String id) {
        long now = clock.millis();
        purgeExpired(now);
        boolean seen = entries.remove(id) != null;
        entries.put(id, now + ttlMillis);
        while (entries.size() > maxSize) {
            Iterator<String> eldest = entries.keySet().iterator();
            eldest.next();
            eldest.remove();
        }
        return seen;
    }

    public synchronized boolean contains(String id) {
        Long expiry = entries.get(id);
        return expiry != null && expiry > clock.millis();
    }

    public synchronized int size() {
        purgeExpired(clock.millis());
        return entries.size();
    }

    public String getName() {
        return name;
    }

    private void purgeExpired(long now) {
        Iterator<Map.Entry<String, Long>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            if (it.next().getValue() > now) {
                break;
            }
            it.remove();
        }
    }
}
