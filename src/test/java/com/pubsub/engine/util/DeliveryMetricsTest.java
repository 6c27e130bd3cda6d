package com.pubsub.engine.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DeliveryMetricsTest {

    @Test
    void snapshotStartsAtZeroWithStableKeys() {
        DeliveryMetrics metrics = new DeliveryMetrics();

        assertThat(metrics.snapshot()).containsOnlyKeys(
                "published_total", "publish_failure_total", "delivered_total", "acked_total",
                "listener_failure_total", "reclaimed_total", "dead_lettered_total",
                "poll_error_total", "poll_tick_total");
        assertThat(metrics.snapshot().values()).allMatch(v -> v == 0L);
    }

    @Test
    void countersIncrementIndependently() {
        DeliveryMetrics metrics = new DeliveryMetrics();

        metrics.incrementReclaimed();
        metrics.incrementReclaimed();
        metrics.incrementDeadLettered();

        assertThat(metrics.snapshot())
                .containsEntry("reclaimed_total", 2L)
                .containsEntry("dead_lettered_total", 1L)
                .containsEntry("acked_total", 0L);
    }
}
