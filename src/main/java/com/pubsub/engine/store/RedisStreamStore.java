package com.pubsub.engine.store;

import com.pubsub.engine.config.PubSubConfig;
import com.pubsub.engine.util.DeliveryMetrics;
import io.vertx.mutiny.redis.client.RedisAPI;
import io.vertx.mutiny.redis.client.Response;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Typed;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Redis Streams implementation of the stream store.
 * <p>
 * Each method is a single round trip bounded by {@code app.pubsub.redis-timeout-seconds}.
 * Replies are parsed in their RESP2 array shape.
 */
@ApplicationScoped
@Typed(RedisStreamStore.class)
public class RedisStreamStore implements StreamStore {

    private static final Logger LOG = Logger.getLogger(RedisStreamStore.class);

    @Inject
    RedisAPI redisAPI;

    @Inject
    PubSubConfig config;

    @Inject
    DeliveryMetrics metrics;

    private StreamNames names;
    private Duration timeout;

    @PostConstruct
    void init() {
        names = new StreamNames(config.getSuffix());
        timeout = Duration.ofSeconds(config.getRedisTimeoutSeconds());
    }

    @Override
    public boolean groupExists(String stream, String group) {
        String key = names.stream(stream);
        String groupName = names.group(stream, group);
        try {
            Response groups = redisAPI.xinfo(List.of("GROUPS", key))
                    .await().atMost(timeout);
            if (groups == null) {
                return false;
            }
            for (int i = 0; i < groups.size(); i++) {
                if (groupName.equals(fieldValue(groups.get(i), "name"))) {
                    return true;
                }
            }
            return false;
        } catch (Exception e) {
            LOG.debugf(e, "Seems group %s doesn't exist on %s", groupName, key);
            return false;
        }
    }

    @Override
    public void createGroup(String stream, String group) {
        String key = names.stream(stream);
        String groupName = names.group(stream, group);
        try {
            redisAPI.xgroup(List.of("CREATE", key, groupName, "$", "MKSTREAM"))
                    .await().atMost(timeout);
            LOG.infof("Created Redis Stream group: %s on %s", groupName, key);
        } catch (Exception e) {
            if (e.getMessage() != null && e.getMessage().contains("BUSYGROUP")) {
                LOG.debugf("Redis group already exists: %s", groupName);
                return;
            }
            throw new StreamStoreException("Failed to create Redis Stream group " + groupName + " on " + key, e);
        }
    }

    @Override
    public void deleteGroup(String stream, String group) {
        String key = names.stream(stream);
        String groupName = names.group(stream, group);
        try {
            redisAPI.xgroup(List.of("DESTROY", key, groupName))
                    .await().atMost(timeout);
            LOG.infof("Destroyed Redis Stream group: %s on %s", groupName, key);
        } catch (Exception e) {
            throw new StreamStoreException("Failed to destroy Redis Stream group " + groupName + " on " + key, e);
        }
    }

    @Override
    public String publish(String stream, String eventName, String payload) {
        String key = names.stream(stream);
        try {
            List<String> args = new ArrayList<>(7);
            args.add(key);
            if (config.getMaxLength() > 0) {
                args.add("MAXLEN");
                args.add("~");
                args.add(String.valueOf(config.getMaxLength()));
            }
            args.add("*");
            args.add(eventName);
            args.add(payload);

            Response response = redisAPI.xadd(args)
                    .await().atMost(timeout);
            String id = response != null ? response.toString() : null;

            if (metrics != null) {
                metrics.incrementPublished();
            }
            return id;
        } catch (Exception e) {
            if (metrics != null) {
                metrics.incrementPublishFailure();
            }
            throw new StreamStoreException("Failed to append to Redis Stream " + key, e);
        }
    }

    @Override
    public List<StreamEntry> readNext(String stream, String group, String consumer) {
        String key = names.stream(stream);
        List<String> args = new ArrayList<>();
        args.add("GROUP");
        args.add(names.group(stream, group));
        args.add(consumer);
        if (config.getReadCount() > 0) {
            args.add("COUNT");
            args.add(String.valueOf(config.getReadCount()));
        }
        args.add("STREAMS");
        args.add(key);
        args.add(">");

        Response resp;
        try {
            resp = redisAPI.xreadgroup(args)
                    .await().atMost(timeout);
        } catch (Exception e) {
            throw new StreamStoreException("Failed to read from Redis Stream " + key, e);
        }
        if (resp == null) {
            return Collections.emptyList();
        }
        return parseStreamsReply(resp);
    }

    @Override
    public List<StreamEntry> claimStuck(String stream, String group, String consumer, long minIdleTimeMs, int count) {
        String key = names.stream(stream);
        List<String> args = new ArrayList<>(7);
        args.add(key);
        args.add(names.group(stream, group));
        args.add(consumer);
        args.add(String.valueOf(minIdleTimeMs));
        args.add("0-0");
        args.add("COUNT");
        args.add(String.valueOf(count));

        Response resp;
        try {
            resp = redisAPI.xautoclaim(args)
                    .await().atMost(timeout);
        } catch (Exception e) {
            throw new StreamStoreException("Failed to claim pending entries on " + key, e);
        }
        // [next-cursor, [entries...], (deleted ids, Redis 7+)]
        if (resp == null || resp.size() < 2) {
            return Collections.emptyList();
        }
        Response messages = resp.get(1);
        if (messages == null) {
            return Collections.emptyList();
        }
        return parseEntries(messages);
    }

    @Override
    public int retryCount(String stream, String group, String entryId) {
        String key = names.stream(stream);
        Response resp;
        try {
            resp = redisAPI.xpending(List.of(key, names.group(stream, group), entryId, entryId, "1"))
                    .await().atMost(timeout);
        } catch (Exception e) {
            throw new StreamStoreException("Failed to read delivery count of " + entryId + " on " + key, e);
        }
        // [[id, consumer, idle-ms, delivery-count]]
        if (resp == null || resp.size() == 0) {
            return 0;
        }
        Response first = resp.get(0);
        if (first == null || first.size() < 4) {
            return 0;
        }
        return (int) parseLong(first.get(3), 0);
    }

    @Override
    public void ack(String stream, String group, String entryId) {
        String key = names.stream(stream);
        String groupName = names.group(stream, group);
        Response resp;
        try {
            resp = redisAPI.xack(List.of(key, groupName, entryId))
                    .await().atMost(timeout);
        } catch (Exception e) {
            throw new StreamStoreException("Failed to ack entry " + entryId + " on " + key, e);
        }
        long acknowledged = parseLong(resp, 0);
        if (acknowledged != 1) {
            throw new AckMismatchException(key, groupName, entryId, acknowledged);
        }
    }

    @Override
    public PendingSummary pendingSummary(String stream, String group) {
        String key = names.stream(stream);
        String groupName = names.group(stream, group);
        try {
            // [count, min-id, max-id, [[consumer, count]...]]
            Response resp = redisAPI.xpending(List.of(key, groupName))
                    .await().atMost(timeout);
            if (resp == null || resp.size() == 0) {
                return PendingSummary.empty();
            }
            long totalPending = parseLong(resp.get(0), 0);
            if (totalPending == 0) {
                return PendingSummary.empty();
            }
            String minId = resp.size() > 1 ? asString(resp.get(1)) : null;
            String maxId = resp.size() > 2 ? asString(resp.get(2)) : null;
            Map<String, Long> consumers = new LinkedHashMap<>();
            Response consumerList = resp.size() > 3 ? resp.get(3) : null;
            if (consumerList != null) {
                for (int i = 0; i < consumerList.size(); i++) {
                    Response pair = consumerList.get(i);
                    if (pair != null && pair.size() >= 2) {
                        consumers.put(pair.get(0).toString(), parseLong(pair.get(1), 0));
                    }
                }
            }

            long oldestIdleMs = 0;
            Response detail = redisAPI.xpending(List.of(key, groupName, "-", "+", "1"))
                    .await().atMost(timeout);
            if (detail != null && detail.size() > 0) {
                Response first = detail.get(0);
                if (first != null && first.size() >= 3) {
                    oldestIdleMs = parseLong(first.get(2), 0);
                }
            }
            return new PendingSummary(totalPending, minId, maxId, consumers, oldestIdleMs);
        } catch (Exception e) {
            LOG.debugf(e, "Failed to read pending summary for %s on %s", groupName, key);
            return PendingSummary.empty();
        }
    }

    @Override
    public Optional<StreamEntry> readOne(String stream) {
        String key = names.stream(stream);
        Response resp;
        try {
            resp = redisAPI.xread(List.of("COUNT", "1", "STREAMS", key, "0"))
                    .await().atMost(timeout);
        } catch (Exception e) {
            throw new StreamStoreException("Failed to read from Redis Stream " + key, e);
        }
        if (resp == null) {
            return Optional.empty();
        }
        return parseStreamsReply(resp).stream().findFirst();
    }

    @Override
    public long truncate(String stream) {
        String key = names.stream(stream);
        try {
            Response resp = redisAPI.xtrim(List.of(key, "MAXLEN", "0"))
                    .await().atMost(timeout);
            return parseLong(resp, 0);
        } catch (Exception e) {
            throw new StreamStoreException("Failed to truncate Redis Stream " + key, e);
        }
    }

    private List<StreamEntry> parseStreamsReply(Response resp) {
        List<StreamEntry> entries = new ArrayList<>();
        // Response structure: [[stream, [[id, [field, value]], ...]]]
        for (int i = 0; i < resp.size(); i++) {
            Response streamResp = resp.get(i);
            if (streamResp == null || streamResp.size() < 2) {
                continue;
            }
            Response messages = streamResp.get(1);
            if (messages != null) {
                entries.addAll(parseEntries(messages));
            }
        }
        return entries;
    }

    private List<StreamEntry> parseEntries(Response messages) {
        List<StreamEntry> entries = new ArrayList<>();
        for (int j = 0; j < messages.size(); j++) {
            Response message = messages.get(j);
            if (message == null || message.size() < 2) {
                continue;
            }
            String id = message.get(0).toString();
            Response fields = message.get(1);
            if (fields == null || fields.size() < 2) {
                // Claimed id whose entry has been trimmed from the stream.
                LOG.debugf("Skipping entry %s without fields", id);
                continue;
            }
            Response fieldName = fields.get(0);
            Response value = fields.get(1);
            if (fieldName == null) {
                continue;
            }
            String payload = value != null ? value.toString(StandardCharsets.UTF_8) : null;
            entries.add(new StreamEntry(id, fieldName.toString(), payload));
        }
        return entries;
    }

    private String fieldValue(Response pairs, String name) {
        if (pairs == null) {
            return null;
        }
        for (int k = 0; k + 1 < pairs.size(); k += 2) {
            Response fieldName = pairs.get(k);
            if (fieldName != null && name.equals(fieldName.toString())) {
                return asString(pairs.get(k + 1));
            }
        }
        return null;
    }

    private String asString(Response response) {
        return response != null ? response.toString() : null;
    }

    private long parseLong(Response response, long fallback) {
        if (response == null) {
            return fallback;
        }
        try {
            return Long.parseLong(response.toString());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
