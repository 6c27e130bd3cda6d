package com.pubsub.engine.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pubsub.engine.config.PubSubConfig;
import com.pubsub.engine.delivery.DeadLetterRouter;
import com.pubsub.engine.delivery.DeliveryEngine;
import com.pubsub.engine.delivery.Dispatcher;
import com.pubsub.engine.delivery.LoggingDeliveryErrorHandler;
import com.pubsub.engine.listener.EventListener;
import com.pubsub.engine.listener.ListenerRegistry;
import com.pubsub.engine.publish.Publisher;
import com.pubsub.engine.publish.PublisherFactory;
import com.pubsub.engine.store.InMemoryStreamStore;
import com.pubsub.engine.testing.MutableClock;
import com.pubsub.engine.util.DeliveryMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Publisher, registry, engine and worker wired together over the in-memory store.
 */
class PublishAndConsumeFlowTest {

    static final List<Integer> PLACED = new CopyOnWriteArrayList<>();
    static final List<Integer> AUDITED = new CopyOnWriteArrayList<>();

    public static class OrderPlaced {
        public int id;
    }

    static class OrderListener extends EventListener {
        OrderListener() {
            super("orders");
            on("order_placed", OrderPlaced.class, e -> PLACED.add(e.id));
        }
    }

    static class AuditListener extends EventListener {
        AuditListener() {
            super("orders");
            on("order_placed", node -> AUDITED.add(node.get("id").asInt()));
        }
    }

    static class ExplodingPaymentListener extends EventListener {
        ExplodingPaymentListener() {
            super("payments");
            on("payment_taken", node -> {
                throw new StackOverflowError("recursive handler");
            });
        }
    }

    private PubSubConfig config;
    private MutableClock clock;
    private InMemoryStreamStore store;
    private ListenerRegistry registry;
    private Publisher publisher;
    private DeliveryMetrics metrics;
    private DeliveryEngine engine;

    @BeforeEach
    void setUp() {
        PLACED.clear();
        AUDITED.clear();
        config = new PubSubConfig();
        config.setGroupName("shop");
        config.setSuffix("test");
        clock = new MutableClock(1_700_000_000_000L);
        store = new InMemoryStreamStore(config, clock);
        metrics = new DeliveryMetrics();
        ObjectMapper objectMapper = new ObjectMapper();
        engine = new DeliveryEngine(store, config,
                new DeadLetterRouter(store, config, objectMapper, metrics),
                new Dispatcher(new LoggingDeliveryErrorHandler(), metrics, objectMapper),
                metrics);
        registry = new ListenerRegistry(store, config);
        registry.register(OrderListener::new);
        registry.register(AuditListener::new);
        publisher = new PublisherFactory(store, objectMapper).forStream("orders");
    }

    @Test
    void publishedEventReachesEveryListenerOnce() {
        StreamWorker worker = new StreamWorker("1", "host-1", registry, engine, metrics);
        worker.tick();

        publisher.publish("order_placed", Map.of("id", 42));
        assertThat(worker.tick()).isEqualTo(1);
        assertThat(worker.tick()).isZero();

        assertThat(PLACED).containsExactly(42);
        assertThat(AUDITED).containsExactly(42);
        assertThat(store.pendingSummary("orders", "shop").getTotalPending()).isZero();
    }

    @Test
    void eventsPublishedBeforeSubscriptionAreNotReplayed() {
        publisher.publish("order_placed", Map.of("id", 1));
        StreamWorker worker = new StreamWorker("1", "host-1", registry, engine, metrics);

        worker.tick();
        publisher.publish("order_placed", Map.of("id", 2));
        worker.tick();

        assertThat(PLACED).containsExactly(2);
    }

    @Test
    void workersShareTheGroupSoEachEntryIsHandledOnce() {
        StreamWorker first = new StreamWorker("1", "host-1", registry, engine, metrics);
        StreamWorker second = new StreamWorker("2", "host-2", registry, engine, metrics);
        first.tick();

        publisher.publish("order_placed", Map.of("id", 1));
        publisher.publish("order_placed", Map.of("id", 2));
        first.tick();
        second.tick();

        assertThat(PLACED).containsExactly(1, 2);
    }

    @Test
    void listenerThrowingErrorDoesNotStopOtherStreams() {
        ListenerRegistry mixed = new ListenerRegistry(store, config);
        mixed.register(ExplodingPaymentListener::new);
        mixed.register(OrderListener::new);
        StreamWorker worker = new StreamWorker("1", "host-1", mixed, engine, metrics);
        worker.safeTick();

        new PublisherFactory(store, new ObjectMapper()).forStream("payments")
                .publish("payment_taken", Map.of("id", 7));
        publisher.publish("order_placed", Map.of("id", 42));
        worker.safeTick();

        assertThat(PLACED).containsExactly(42);
        assertThat(store.pendingSummary("payments", "shop").getTotalPending()).isEqualTo(1);
        assertThat(store.pendingSummary("orders", "shop").getTotalPending()).isZero();
        assertThat(metrics.getListenerFailureTotal()).isEqualTo(1);
    }

    @Test
    void groupDeletedBetweenTicksIsRecreated() {
        StreamWorker worker = new StreamWorker("1", "host-1", registry, engine, metrics);
        worker.tick();

        store.deleteGroup("orders", "shop");
        worker.tick();
        assertThat(store.groupExists("orders", "shop")).isTrue();

        publisher.publish("order_placed", Map.of("id", 42));
        worker.tick();
        worker.tick();

        assertThat(PLACED).containsExactly(42);
        assertThat(AUDITED).containsExactly(42);
    }
}
