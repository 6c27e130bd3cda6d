package com.pubsub.engine.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate view of a consumer group's pending entries list.
 */
public class PendingSummary {

    private static final PendingSummary EMPTY = new PendingSummary(0, null, null, Map.of(), 0);

    private final long totalPending;
    private final String minEntryId;
    private final String maxEntryId;
    private final Map<String, Long> consumers;
    private final long oldestIdleMs;

    public PendingSummary(long totalPending, String minEntryId, String maxEntryId,
                          Map<String, Long> consumers, long oldestIdleMs) {
        this.totalPending = totalPending;
        this.minEntryId = minEntryId;
        this.maxEntryId = maxEntryId;
        this.consumers = Collections.unmodifiableMap(new LinkedHashMap<>(consumers));
        this.oldestIdleMs = oldestIdleMs;
    }

    public static PendingSummary empty() {
        return EMPTY;
    }

    public long getTotalPending() {
        return totalPending;
    }

    public String getMinEntryId() {
        return minEntryId;
    }

    public String getMaxEntryId() {
        return maxEntryId;
    }

    /**
     * Pending count per consumer name.
     */
    public Map<String, Long> getConsumers() {
        return consumers;
    }

    public long getOldestIdleMs() {
        return oldestIdleMs;
    }

    @Override
    public String toString() {
        return "PendingSummary{total=" + totalPending
                + ", min=" + minEntryId
                + ", max=" + maxEntryId
                + ", consumers=" + consumers
                + ", oldestIdleMs=" + oldestIdleMs + "}";
    }
}
