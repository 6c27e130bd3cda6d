package com.pubsub.engine.resource;

import com.pubsub.engine.config.PubSubConfig;
import com.pubsub.engine.listener.ListenerRegistration;
import com.pubsub.engine.listener.ListenerRegistry;
import com.pubsub.engine.store.PendingSummary;
import com.pubsub.engine.store.StreamStore;
import com.pubsub.engine.util.DeliveryMetrics;
import com.pubsub.engine.worker.WorkerPool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ManagementResourceTest {

    @Mock
    StreamStore store;

    @Mock
    ListenerRegistry registry;

    @Mock
    WorkerPool workerPool;

    private DeliveryMetrics metrics;
    private ManagementResource resource;

    @BeforeEach
    void setUp() {
        PubSubConfig config = new PubSubConfig();
        config.setGroupName("workers");
        metrics = new DeliveryMetrics();
        resource = new ManagementResource();
        resource.store = store;
        resource.config = config;
        resource.metrics = metrics;
        resource.registry = registry;
        resource.workerPool = workerPool;
    }

    @Test
    void metricsReturnsCounterSnapshot() {
        metrics.incrementDeadLettered();
        metrics.incrementAcked();

        Map<String, Long> body = resource.metrics();

        assertThat(body).containsEntry("dead_lettered_total", 1L).containsEntry("acked_total", 1L);
    }

    @Test
    void pendingUsesConfiguredGroup() {
        PendingSummary summary = new PendingSummary(2, "1-0", "2-0", Map.of("host-1", 2L), 500);
        when(store.pendingSummary("orders", "workers")).thenReturn(summary);

        assertThat(resource.pending("orders")).isSameAs(summary);
    }

    @Test
    @SuppressWarnings("unchecked")
    void listenersGroupsNamesByStream() {
        when(registry.registrations()).thenReturn(List.of(
                new ListenerRegistration("orders", "OrderListener", () -> null),
                new ListenerRegistration("orders", "BillingListener", () -> null),
                new ListenerRegistration("users", "UserListener", () -> null)));
        when(workerPool.isRunning()).thenReturn(true);
        when(workerPool.getWorkers()).thenReturn(List.of());

        Map<String, Object> body = resource.listeners();

        assertThat(body).containsEntry("group", "workers").containsEntry("workersRunning", true);
        Map<String, List<String>> streams = (Map<String, List<String>>) body.get("streams");
        assertThat(streams.get("orders")).containsExactly("OrderListener", "BillingListener");
        assertThat(streams.get("users")).containsExactly("UserListener");
    }
}
