package com.pubsub.engine.worker;

import com.pubsub.engine.delivery.DeliveryEngine;
import com.pubsub.engine.listener.ListenerRegistration;
import com.pubsub.engine.listener.ListenerRegistry;
import com.pubsub.engine.util.DeliveryMetrics;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Map;

/**
 * One poll loop participant with its own consumer identity.
 * <p>
 * Each tick takes a fresh registry snapshot and runs a delivery cycle for every stream.
 * A failure on one stream, {@link Error}s included, is logged and does not keep the other
 * streams from being polled. A tick never throws into the scheduler, which would cancel the
 * worker's periodic task.
 */
public class StreamWorker {

    private static final Logger LOG = Logger.getLogger(StreamWorker.class);

    private final String workerId;
    private final String consumerName;
    private final ListenerRegistry registry;
    private final DeliveryEngine engine;
    private final DeliveryMetrics metrics;

    public StreamWorker(String workerId, String consumerName, ListenerRegistry registry,
                        DeliveryEngine engine, DeliveryMetrics metrics) {
        this.workerId = workerId;
        this.consumerName = consumerName;
        this.registry = registry;
        this.engine = engine;
        this.metrics = metrics;
    }

    public String getWorkerId() {
        return workerId;
    }

    public String getConsumerName() {
        return consumerName;
    }

    /**
     * Entry point for the scheduler; never throws.
     */
    void safeTick() {
        try {
            tick();
        } catch (Throwable e) {
            metrics.incrementPollError();
            LOG.errorf(e, "Worker %s poll failed", workerId);
        }
    }

    /**
     * Polls every registered stream once.
     *
     * @return number of entries acknowledged across all streams
     */
    public int tick() {
        metrics.incrementPollTick();
        int acked = 0;
        for (Map.Entry<String, List<ListenerRegistration>> e : registry.snapshot().entrySet()) {
            acked += pollStream(e.getKey(), e.getValue());
        }
        return acked;
    }

    private int pollStream(String stream, List<ListenerRegistration> listeners) {
        try {
            return engine.pollStream(stream, listeners, consumerName);
        } catch (Throwable e) {
            metrics.incrementPollError();
            LOG.errorf(e, "Worker %s failed to poll stream %s", workerId, stream);
            return 0;
        }
    }
}
