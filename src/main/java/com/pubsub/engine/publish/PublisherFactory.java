package com.pubsub.engine.publish;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pubsub.engine.store.StreamStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.Locale;

/**
 * Creates {@link Publisher}s bound to a default stream.
 */
@ApplicationScoped
public class PublisherFactory {

    private final StreamStore store;
    private final ObjectMapper objectMapper;

    @Inject
    public PublisherFactory(StreamStore store, ObjectMapper objectMapper) {
        this.store = store;
        this.objectMapper = objectMapper;
    }

    public Publisher forStream(String streamName) {
        return new StreamPublisher(store, objectMapper, streamName);
    }

    /**
     * Publisher whose default stream is the lower-cased simple name of {@code owner}.
     */
    public Publisher forType(Class<?> owner) {
        return forStream(owner.getSimpleName().toLowerCase(Locale.ROOT));
    }
}
