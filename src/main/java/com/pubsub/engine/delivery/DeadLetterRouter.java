package com.pubsub.engine.delivery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pubsub.engine.config.PubSubConfig;
import com.pubsub.engine.store.StreamEntry;
import com.pubsub.engine.store.StreamStore;
import com.pubsub.engine.store.StreamStoreException;
import com.pubsub.engine.util.AlertLogger;
import com.pubsub.engine.util.DeliveryMetrics;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Moves an entry that exhausted its retries to the dead-letter stream.
 * <p>
 * The DLQ entry's field is the origin stream name; its value is the JSON pair
 * {@code [id, {eventName: payload}]}. The original is acked only after the DLQ publish succeeded.
 */
@ApplicationScoped
public class DeadLetterRouter {

    private final StreamStore store;
    private final PubSubConfig config;
    private final ObjectMapper objectMapper;
    private final DeliveryMetrics metrics;

    @Inject
    public DeadLetterRouter(StreamStore store, PubSubConfig config, ObjectMapper objectMapper, DeliveryMetrics metrics) {
        this.store = store;
        this.config = config;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    /**
     * @return id of the DLQ entry
     */
    public String route(String stream, StreamEntry entry, int deliveries) {
        String group = config.getGroupName();
        AlertLogger.deadLettered(stream, group, entry.getId(), deliveries, config.getDlqStream());

        String dlqId = store.publish(config.getDlqStream(), stream, serialize(entry));
        store.ack(stream, group, entry.getId());
        metrics.incrementDeadLettered();
        return dlqId;
    }

    String serialize(StreamEntry entry) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(entry.getEventName(), entry.getPayload());
        try {
            return objectMapper.writeValueAsString(List.of(entry.getId(), fields));
        } catch (JsonProcessingException e) {
            throw new StreamStoreException("Failed to serialize dead letter for " + entry.getId(), e);
        }
    }
}
