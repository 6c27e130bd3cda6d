package com.pubsub.engine.util;

import jakarta.enterprise.context.ApplicationScoped;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Lightweight in-process counters for delivery observability.
 * <p>
 * Exposed via {@code /v1/manage/metrics}. DLQ growth and listener failures are the
 * signals operators watch; PEL size comes from the pending summary endpoint.
 */
@ApplicationScoped
public class DeliveryMetrics {

    private final AtomicLong publishedTotal = new AtomicLong();
    private final AtomicLong publishFailureTotal = new AtomicLong();
    private final AtomicLong deliveredTotal = new AtomicLong();
    private final AtomicLong ackedTotal = new AtomicLong();
    private final AtomicLong listenerFailureTotal = new AtomicLong();
    private final AtomicLong reclaimedTotal = new AtomicLong();
    private final AtomicLong deadLetteredTotal = new AtomicLong();
    private final AtomicLong pollErrorTotal = new AtomicLong();
    private final AtomicLong pollTickTotal = new AtomicLong();

    public void incrementPublished() {
        publishedTotal.incrementAndGet();
    }

    public void incrementPublishFailure() {
        publishFailureTotal.incrementAndGet();
    }

    public void incrementDelivered() {
        deliveredTotal.incrementAndGet();
    }

    public void incrementAcked() {
        ackedTotal.incrementAndGet();
    }

    public void incrementListenerFailure() {
        listenerFailureTotal.incrementAndGet();
    }

    public void incrementReclaimed() {
        reclaimedTotal.incrementAndGet();
    }

    public void incrementDeadLettered() {
        deadLetteredTotal.incrementAndGet();
    }

    public void incrementPollError() {
        pollErrorTotal.incrementAndGet();
    }

    public void incrementPollTick() {
        pollTickTotal.incrementAndGet();
    }

    public long getDeadLetteredTotal() {
        return deadLetteredTotal.get();
    }

    public long getAckedTotal() {
        return ackedTotal.get();
    }

    public long getListenerFailureTotal() {
        return listenerFailureTotal.get();
    }

    public long getPollErrorTotal() {
        return pollErrorTotal.get();
    }

    public Map<String, Long> snapshot() {
        Map<String, Long> m = new LinkedHashMap<>();
        m.put("published_total", publishedTotal.get());
        m.put("publish_failure_total", publishFailureTotal.get());
        m.put("delivered_total", deliveredTotal.get());
        m.put("acked_total", ackedTotal.get());
        m.put("listener_failure_total", listenerFailureTotal.get());
        m.put("reclaimed_total", reclaimedTotal.get());
        m.put("dead_lettered_total", deadLetteredTotal.get());
        m.put("poll_error_total", pollErrorTotal.get());
        m.put("poll_tick_total", pollTickTotal.get());
        return m;
    }
}
