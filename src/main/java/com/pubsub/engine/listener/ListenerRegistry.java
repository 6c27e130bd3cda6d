package com.pubsub.engine.listener;

import com.pubsub.engine.config.PubSubConfig;
import com.pubsub.engine.store.StreamStore;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Any;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Registry of all listeners in the application, grouped as {@code stream -> [listeners]}.
 * <p>
 * Registration is append-only. Every {@link #snapshot()} makes sure each stream's consumer
 * group exists and creates missing ones at the stream tail, so subscribing never replays
 * history and a group lost on the store (restart without persistence, {@code XGROUP DESTROY})
 * is recreated on the next poll.
 */
@ApplicationScoped
public class ListenerRegistry {

    private static final Logger LOG = Logger.getLogger(ListenerRegistry.class);

    private final StreamStore store;
    private final PubSubConfig config;

    private final List<ListenerRegistration> registrations = new CopyOnWriteArrayList<>();

    @Inject
    @Any
    Instance<ListenerModule> modules;

    @Inject
    public ListenerRegistry(StreamStore store, PubSubConfig config) {
        this.store = store;
        this.config = config;
    }

    @PostConstruct
    void init() {
        for (ListenerModule module : modules) {
            LOG.debugf("Registering listeners from %s", module.getClass().getName());
            module.register(this);
        }
        LOG.infof("Listener registry initialized with %d listener(s)", registrations.size());
    }

    /**
     * Registers a listener type whose home stream is declared by the listener itself.
     */
    public ListenerRegistration register(Supplier<? extends StreamListener> factory) {
        StreamListener sample = factory.get();
        return register(sample.streamName(), sample.getClass().getSimpleName(), factory);
    }

    public ListenerRegistration register(String stream, String listenerName, Supplier<? extends StreamListener> factory) {
        ListenerRegistration registration = new ListenerRegistration(stream, listenerName, factory);
        registrations.add(registration);
        LOG.debugf("Assigned stream %s - listener %s", stream, listenerName);
        return registration;
    }

    public List<ListenerRegistration> registrations() {
        return Collections.unmodifiableList(registrations);
    }

    /**
     * Current {@code stream -> listeners} view in registration order, recomputed on each call.
     * <p>
     * Streams whose consumer group cannot be ensured right now are left out and retried on
     * the next call.
     */
    public Map<String, List<ListenerRegistration>> snapshot() {
        Map<String, List<ListenerRegistration>> byStream = new LinkedHashMap<>();
        for (ListenerRegistration registration : registrations) {
            byStream.computeIfAbsent(registration.getStream(), k -> new ArrayList<>()).add(registration);
        }
        byStream.keySet().removeIf(stream -> !ensureSubscribed(stream));
        return byStream;
    }

    private boolean ensureSubscribed(String stream) {
        try {
            createAndSubscribeToStream(stream);
            return true;
        } catch (Exception e) {
            LOG.warnf(e, "Could not ensure consumer group %s for stream %s, will retry", config.getGroupName(), stream);
            return false;
        }
    }

    /**
     * Creates the consumer group (and the stream) unless it already exists.
     *
     * @return true if a group was created
     */
    boolean createAndSubscribeToStream(String stream) {
        String group = config.getGroupName();
        if (store.groupExists(stream, group)) {
            return false;
        }
        LOG.infof("Creating listener group %s for stream %s", group, stream);
        store.createGroup(stream, group);
        return true;
    }
}
