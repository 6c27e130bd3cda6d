package com.pubsub.engine.listener;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * A listener type bound to its stream, with the factory used to create one instance per message.
 */
public class ListenerRegistration {

    private final String stream;
    private final String listenerName;
    private final Supplier<? extends StreamListener> factory;

    public ListenerRegistration(String stream, String listenerName, Supplier<? extends StreamListener> factory) {
        this.stream = Objects.requireNonNull(stream, "stream");
        this.listenerName = Objects.requireNonNull(listenerName, "listenerName");
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    public String getStream() {
        return stream;
    }

    public String getListenerName() {
        return listenerName;
    }

    public StreamListener newListener() {
        return factory.get();
    }

    @Override
    public String toString() {
        return listenerName + "@" + stream;
    }
}
