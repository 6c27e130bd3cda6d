package com.pubsub.engine.store;

import com.pubsub.engine.config.PubSubConfig;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Optional;

/**
 * Facade that selects the active StreamStore implementation based on configuration.
 * It is the only {@link StreamStore} bean the rest of the application sees.
 */
@ApplicationScoped
public class StreamStoreFacade implements StreamStore {

    private static final Logger LOG = Logger.getLogger(StreamStoreFacade.class);

    @Inject
    PubSubConfig config;

    @Inject
    RedisStreamStore redisStore;

    @Inject
    InMemoryStreamStore inMemoryStore;

    @PostConstruct
    void init() {
        LOG.infof("Stream store mode: %s", config.isInMemory() ? PubSubConfig.MODE_IN_MEMORY : PubSubConfig.MODE_REDIS);
    }

    private StreamStore delegate() {
        if (config.isInMemory()) {
            return inMemoryStore;
        }
        return redisStore;
    }

    @Override
    public boolean groupExists(String stream, String group) {
        return delegate().groupExists(stream, group);
    }

    @Override
    public void createGroup(String stream, String group) {
        delegate().createGroup(stream, group);
    }

    @Override
    public void deleteGroup(String stream, String group) {
        delegate().deleteGroup(stream, group);
    }

    @Override
    public String publish(String stream, String eventName, String payload) {
        return delegate().publish(stream, eventName, payload);
    }

    @Override
    public List<StreamEntry> readNext(String stream, String group, String consumer) {
        return delegate().readNext(stream, group, consumer);
    }

    @Override
    public List<StreamEntry> claimStuck(String stream, String group, String consumer, long minIdleTimeMs, int count) {
        return delegate().claimStuck(stream, group, consumer, minIdleTimeMs, count);
    }

    @Override
    public int retryCount(String stream, String group, String entryId) {
        return delegate().retryCount(stream, group, entryId);
    }

    @Override
    public void ack(String stream, String group, String entryId) {
        delegate().ack(stream, group, entryId);
    }

    @Override
    public PendingSummary pendingSummary(String stream, String group) {
        return delegate().pendingSummary(stream, group);
    }

    @Override
    public Optional<StreamEntry> readOne(String stream) {
        return delegate().readOne(stream);
    }

    @Override
    public long truncate(String stream) {
        return delegate().truncate(stream);
    }
}
