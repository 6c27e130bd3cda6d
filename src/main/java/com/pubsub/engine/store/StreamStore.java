package com.pubsub.engine.store;

import java.util.List;
import java.util.Optional;

/**
 * Stream store primitives used by the delivery engine.
 * <p>
 * Every method takes the <em>base</em> stream name and group name; implementations resolve
 * them through {@link StreamNames}. Claim operations ({@link #readNext}, {@link #claimStuck})
 * are atomic at the store level, so two consumers never receive the same entry from one call.
 */
public interface StreamStore {

    /**
     * Whether the consumer group exists. Store errors count as "no".
     */
    boolean groupExists(String stream, String group);

    /**
     * Creates the group at the stream tail, creating the stream if needed.
     * Calling it for an existing group is a no-op.
     */
    void createGroup(String stream, String group);

    /**
     * Destroys the consumer group and its pending entries list.
     */
    void deleteGroup(String stream, String group);

    /**
     * Appends a single-field entry.
     * @return stream entry id
     */
    String publish(String stream, String eventName, String payload);

    /**
     * Claims entries never delivered to the group before and advances its cursor.
     */
    List<StreamEntry> readNext(String stream, String group, String consumer);

    /**
     * Reassigns up to {@code count} pending entries idle for at least {@code minIdleTimeMs}
     * to {@code consumer}, oldest first, bumping their delivery counts.
     */
    List<StreamEntry> claimStuck(String stream, String group, String consumer, long minIdleTimeMs, int count);

    /**
     * Delivery count of a pending entry, or 0 if it is not pending.
     */
    int retryCount(String stream, String group, String entryId);

    /**
     * Removes the entry from the pending entries list.
     * @throws AckMismatchException if the store did not acknowledge exactly one entry
     */
    void ack(String stream, String group, String entryId);

    /**
     * Returns a summary of pending entries (count, id range, per-consumer counts, oldest idle age).
     */
    PendingSummary pendingSummary(String stream, String group);

    /**
     * Reads the first entry of the stream without going through a consumer group.
     */
    Optional<StreamEntry> readOne(String stream);

    /**
     * Drops every entry of the stream for all readers.
     * @return number of entries removed
     */
    long truncate(String stream);
}
