package com.pubsub.engine.store;

import com.pubsub.engine.config.PubSubConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Typed;
import jakarta.inject.Inject;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * In-process stream store with Redis Streams semantics: per-group cursors, pending entries
 * lists with delivery counts, and idle-time based reclamation.
 * <p>
 * All operations are {@code synchronized}, which gives the same one-consumer-per-claim
 * guarantee the Redis commands give. Used for {@code app.pubsub.store.mode=in-memory} and tests.
 */
@ApplicationScoped
@Typed(InMemoryStreamStore.class)
public class InMemoryStreamStore implements StreamStore {

    private final Clock clock;
    private final StreamNames names;
    private final int readCount;

    private final Map<String, StreamState> streams = new LinkedHashMap<>();

    @Inject
    public InMemoryStreamStore(PubSubConfig config) {
        this(config, Clock.systemUTC());
    }

    public InMemoryStreamStore(PubSubConfig config, Clock clock) {
        this.clock = clock;
        this.names = new StreamNames(config.getSuffix());
        this.readCount = config.getReadCount();
    }

    @Override
    public synchronized boolean groupExists(String stream, String group) {
        StreamState state = streams.get(names.stream(stream));
        return state != null && state.groups.containsKey(names.group(stream, group));
    }

    @Override
    public synchronized void createGroup(String stream, String group) {
        StreamState state = streams.computeIfAbsent(names.stream(stream), k -> new StreamState());
        state.groups.computeIfAbsent(names.group(stream, group), k -> new GroupState(state.lastId()));
    }

    @Override
    public synchronized void deleteGroup(String stream, String group) {
        StreamState state = streams.get(names.stream(stream));
        if (state != null) {
            state.groups.remove(names.group(stream, group));
        }
    }

    @Override
    public synchronized String publish(String stream, String eventName, String payload) {
        StreamState state = streams.computeIfAbsent(names.stream(stream), k -> new StreamState());
        EntryId id = state.nextId(clock.millis());
        state.entries.put(id, new StreamEntry(id.toString(), eventName, payload));
        return id.toString();
    }

    @Override
    public synchronized List<StreamEntry> readNext(String stream, String group, String consumer) {
        GroupState groupState = requireGroup(stream, group);
        StreamState state = streams.get(names.stream(stream));
        long now = clock.millis();
        List<StreamEntry> result = new ArrayList<>();
        for (Map.Entry<EntryId, StreamEntry> e : state.entries.tailMap(groupState.cursor, false).entrySet()) {
            if (readCount > 0 && result.size() >= readCount) {
                break;
            }
            groupState.pending.put(e.getKey(), new PendingRecord(consumer, now));
            groupState.cursor = e.getKey();
            result.add(e.getValue());
        }
        return result;
    }

    @Override
    public synchronized List<StreamEntry> claimStuck(String stream, String group, String consumer,
                                                     long minIdleTimeMs, int count) {
        GroupState groupState = requireGroup(stream, group);
        StreamState state = streams.get(names.stream(stream));
        long now = clock.millis();
        List<StreamEntry> result = new ArrayList<>();
        Iterator<Map.Entry<EntryId, PendingRecord>> it = groupState.pending.entrySet().iterator();
        while (it.hasNext() && result.size() < count) {
            Map.Entry<EntryId, PendingRecord> e = it.next();
            PendingRecord record = e.getValue();
            if (now - record.lastDeliveredAt < minIdleTimeMs) {
                continue;
            }
            StreamEntry entry = state.entries.get(e.getKey());
            if (entry == null) {
                // Entry trimmed away: drop it from the PEL like XAUTOCLAIM does.
                it.remove();
                continue;
            }
            record.consumer = consumer;
            record.deliveryCount++;
            record.lastDeliveredAt = now;
            result.add(entry);
        }
        return result;
    }

    @Override
    public synchronized int retryCount(String stream, String group, String entryId) {
        GroupState groupState = group(stream, group);
        if (groupState == null) {
            return 0;
        }
        PendingRecord record = groupState.pending.get(EntryId.parse(entryId));
        return record != null ? record.deliveryCount : 0;
    }

    @Override
    public synchronized void ack(String stream, String group, String entryId) {
        GroupState groupState = group(stream, group);
        int removed = groupState != null && groupState.pending.remove(EntryId.parse(entryId)) != null ? 1 : 0;
        if (removed != 1) {
            throw new AckMismatchException(names.stream(stream), names.group(stream, group), entryId, removed);
        }
    }

    @Override
    public synchronized PendingSummary pendingSummary(String stream, String group) {
        GroupState groupState = group(stream, group);
        if (groupState == null || groupState.pending.isEmpty()) {
            return PendingSummary.empty();
        }
        Map<String, Long> consumers = new LinkedHashMap<>();
        for (PendingRecord record : groupState.pending.values()) {
            consumers.merge(record.consumer, 1L, Long::sum);
        }
        long oldestIdleMs = clock.millis() - groupState.pending.firstEntry().getValue().lastDeliveredAt;
        return new PendingSummary(
                groupState.pending.size(),
                groupState.pending.firstKey().toString(),
                groupState.pending.lastKey().toString(),
                consumers,
                oldestIdleMs);
    }

    @Override
    public synchronized Optional<StreamEntry> readOne(String stream) {
        StreamState state = streams.get(names.stream(stream));
        if (state == null || state.entries.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(state.entries.firstEntry().getValue());
    }

    @Override
    public synchronized long truncate(String stream) {
        StreamState state = streams.get(names.stream(stream));
        if (state == null) {
            return 0;
        }
        int removed = state.entries.size();
        state.entries.clear();
        return removed;
    }

    /**
     * Number of entries currently held by the stream.
     */
    public synchronized int length(String stream) {
        StreamState state = streams.get(names.stream(stream));
        return state != null ? state.entries.size() : 0;
    }

    /**
     * Every entry currently held by the stream, oldest first.
     */
    public synchronized List<StreamEntry> entries(String stream) {
        StreamState state = streams.get(names.stream(stream));
        return state != null ? new ArrayList<>(state.entries.values()) : List.of();
    }

    private GroupState group(String stream, String group) {
        StreamState state = streams.get(names.stream(stream));
        return state != null ? state.groups.get(names.group(stream, group)) : null;
    }

    private GroupState requireGroup(String stream, String group) {
        GroupState groupState = group(stream, group);
        if (groupState == null) {
            throw new StreamStoreException("NOGROUP No such key '" + names.stream(stream)
                    + "' or consumer group '" + names.group(stream, group) + "'");
        }
        return groupState;
    }

    private static final class StreamState {
        private final TreeMap<EntryId, StreamEntry> entries = new TreeMap<>();
        private final Map<String, GroupState> groups = new LinkedHashMap<>();
        private EntryId last = EntryId.ZERO;

        EntryId nextId(long millis) {
            last = millis > last.millis ? new EntryId(millis, 0) : new EntryId(last.millis, last.sequence + 1);
            return last;
        }

        EntryId lastId() {
            return last;
        }
    }

    private static final class GroupState {
        private final TreeMap<EntryId, PendingRecord> pending = new TreeMap<>();
        private EntryId cursor;

        GroupState(EntryId cursor) {
            this.cursor = cursor;
        }
    }

    private static final class PendingRecord {
        private String consumer;
        private int deliveryCount = 1;
        private long lastDeliveredAt;

        PendingRecord(String consumer, long lastDeliveredAt) {
            this.consumer = consumer;
            this.lastDeliveredAt = lastDeliveredAt;
        }
    }

    private static final class EntryId implements Comparable<EntryId> {
        static final EntryId ZERO = new EntryId(0, 0);

        private final long millis;
        private final long sequence;

        EntryId(long millis, long sequence) {
            this.millis = millis;
            this.sequence = sequence;
        }

        static EntryId parse(String id) {
            int dash = id.indexOf('-');
            if (dash < 0) {
                return new EntryId(Long.parseLong(id), 0);
            }
            return new EntryId(Long.parseLong(id.substring(0, dash)), Long.parseLong(id.substring(dash + 1)));
        }

        @Override
        public int compareTo(EntryId other) {
            int byMillis = Long.compare(millis, other.millis);
            return byMillis != 0 ? byMillis : Long.compare(sequence, other.sequence);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof EntryId)) {
                return false;
            }
            EntryId that = (EntryId) o;
            return millis == that.millis && sequence == that.sequence;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(millis) * 31 + Long.hashCode(sequence);
        }

        @Override
        public String toString() {
            return millis + "-" + sequence;
        }
    }
}
