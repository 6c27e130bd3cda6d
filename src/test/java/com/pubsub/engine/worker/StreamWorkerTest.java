package com.pubsub.engine.worker;

import com.pubsub.engine.delivery.DeliveryEngine;
import com.pubsub.engine.listener.ListenerRegistration;
import com.pubsub.engine.listener.ListenerRegistry;
import com.pubsub.engine.store.StreamStoreException;
import com.pubsub.engine.util.DeliveryMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StreamWorkerTest {

    @Mock
    ListenerRegistry registry;

    @Mock
    DeliveryEngine engine;

    private DeliveryMetrics metrics;
    private StreamWorker worker;

    private final List<ListenerRegistration> orderListeners = List.of(mock(ListenerRegistration.class));
    private final List<ListenerRegistration> userListeners = List.of(mock(ListenerRegistration.class));

    @BeforeEach
    void setUp() {
        metrics = new DeliveryMetrics();
        worker = new StreamWorker("1", "host-1", registry, engine, metrics);
    }

    @Test
    void pollsEveryStreamWithOwnConsumerName() {
        when(registry.snapshot()).thenReturn(snapshot());
        when(engine.pollStream("orders", orderListeners, "host-1")).thenReturn(2);
        when(engine.pollStream("users", userListeners, "host-1")).thenReturn(1);

        assertThat(worker.tick()).isEqualTo(3);
        assertThat(metrics.snapshot()).containsEntry("poll_tick_total", 1L);
    }

    @Test
    void failingStreamDoesNotBlockOtherStreams() {
        when(registry.snapshot()).thenReturn(snapshot());
        when(engine.pollStream("orders", orderListeners, "host-1"))
                .thenThrow(new StreamStoreException("NOGROUP"));
        when(engine.pollStream("users", userListeners, "host-1")).thenReturn(1);

        assertThat(worker.tick()).isEqualTo(1);

        verify(engine).pollStream("users", userListeners, "host-1");
        assertThat(metrics.getPollErrorTotal()).isEqualTo(1);
    }

    @Test
    void errorOnOneStreamDoesNotSkipTheRest() {
        when(registry.snapshot()).thenReturn(snapshot());
        when(engine.pollStream("orders", orderListeners, "host-1"))
                .thenThrow(new StackOverflowError());
        when(engine.pollStream("users", userListeners, "host-1")).thenReturn(1);

        assertThat(worker.tick()).isEqualTo(1);

        verify(engine).pollStream("users", userListeners, "host-1");
        assertThat(metrics.getPollErrorTotal()).isEqualTo(1);
    }

    @Test
    void safeTickSurvivesErrors() {
        when(registry.snapshot()).thenThrow(new NoClassDefFoundError("com/acme/Missing"));

        assertThatCode(worker::safeTick).doesNotThrowAnyException();
        assertThat(metrics.getPollErrorTotal()).isEqualTo(1);
    }

    @Test
    void safeTickNeverThrows() {
        when(registry.snapshot()).thenThrow(new IllegalStateException("registry broken"));

        assertThatCode(worker::safeTick).doesNotThrowAnyException();
        assertThat(metrics.getPollErrorTotal()).isEqualTo(1);
    }

    private Map<String, List<ListenerRegistration>> snapshot() {
        Map<String, List<ListenerRegistration>> snapshot = new LinkedHashMap<>();
        snapshot.put("orders", orderListeners);
        snapshot.put("users", userListeners);
        return snapshot;
    }
}
