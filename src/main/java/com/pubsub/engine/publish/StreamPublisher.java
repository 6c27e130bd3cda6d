package com.pubsub.engine.publish;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pubsub.engine.store.StreamStore;
import org.jboss.logging.Logger;

import java.util.Objects;

/**
 * {@link Publisher} bound to a default stream. Obtain instances from {@link PublisherFactory}.
 */
public class StreamPublisher implements Publisher {

    private static final Logger LOG = Logger.getLogger(StreamPublisher.class);

    private final StreamStore store;
    private final ObjectMapper objectMapper;
    private final String streamName;

    public StreamPublisher(StreamStore store, ObjectMapper objectMapper, String streamName) {
        this.store = Objects.requireNonNull(store, "store");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.streamName = Objects.requireNonNull(streamName, "streamName");
    }

    @Override
    public String publish(String eventName, Object data) {
        return publish(eventName, data, null);
    }

    @Override
    public String publish(String eventName, Object data, String stream) {
        String target = stream != null ? stream : streamName;
        String payload = toJson(eventName, data);
        LOG.infof("Publishing to stream %s: %s: %s", target, eventName, payload);
        return store.publish(target, eventName, payload);
    }

    @Override
    public String streamName() {
        return streamName;
    }

    private String toJson(String eventName, Object data) {
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new PublishException("Failed to serialize payload of event " + eventName, e);
        }
    }
}
