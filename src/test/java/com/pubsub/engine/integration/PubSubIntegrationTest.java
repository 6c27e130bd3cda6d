package com.pubsub.engine.integration;

import com.pubsub.engine.delivery.DeliveryEngine;
import com.pubsub.engine.listener.ListenerRegistry;
import com.pubsub.engine.publish.PublisherFactory;
import com.pubsub.engine.util.DeliveryMetrics;
import com.pubsub.engine.worker.StreamWorker;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static io.restassured.RestAssured.given;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.notNullValue;

/**
 * Full CDI wiring over the in-memory store, plus the management endpoints.
 */
@QuarkusTest
class PubSubIntegrationTest {

    @Inject
    PublisherFactory publisherFactory;

    @Inject
    ListenerRegistry registry;

    @Inject
    DeliveryEngine engine;

    @Inject
    DeliveryMetrics metrics;

    @Test
    void testPublishedEventIsDeliveredToModuleListener() {
        StreamWorker worker = new StreamWorker("it", "it-host-1", registry, engine, metrics);
        worker.tick();

        publisherFactory.forStream("inventory").publish("stock_reserved", Map.of("sku", "A-1", "quantity", 3));
        worker.tick();

        assertThat(InventoryListenerModule.RESERVED).contains("A-1x3");
    }

    @Test
    void testListenersEndpointShowsRegisteredModules() {
        given()
        .when()
            .get("/v1/manage/listeners")
        .then()
            .statusCode(200)
            .body("group", equalTo("test-group"))
            .body("workersRunning", equalTo(false))
            .body("streams.inventory", hasItem("InventoryListener"));
    }

    @Test
    void testMetricsEndpoint() {
        given()
        .when()
            .get("/v1/manage/metrics")
        .then()
            .statusCode(200)
            .body("dead_lettered_total", notNullValue())
            .body("poll_tick_total", notNullValue());
    }

    @Test
    void testPendingEndpointForUnknownStream() {
        given()
        .when()
            .get("/v1/manage/streams/unknown/pending")
        .then()
            .statusCode(200)
            .body("totalPending", equalTo(0));
    }
}
