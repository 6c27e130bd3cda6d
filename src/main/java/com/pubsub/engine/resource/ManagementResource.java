package com.pubsub.engine.resource;

import com.pubsub.engine.config.PubSubConfig;
import com.pubsub.engine.listener.ListenerRegistration;
import com.pubsub.engine.listener.ListenerRegistry;
import com.pubsub.engine.store.PendingSummary;
import com.pubsub.engine.store.StreamStore;
import com.pubsub.engine.util.DeliveryMetrics;
import com.pubsub.engine.worker.WorkerPool;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operational view of the delivery engine.
 *
 * <p>The two signals to watch are the dead-letter counter and the size of each
 * stream's pending entries list: a listener that keeps failing shows up as a growing
 * PEL until its messages are dead-lettered.
 */
@Path("/v1/manage")
@Produces(MediaType.APPLICATION_JSON)
@Tag(name = "Management", description = "Delivery metrics and pending entries")
public class ManagementResource {

    @Inject
    StreamStore store;

    @Inject
    PubSubConfig config;

    @Inject
    DeliveryMetrics metrics;

    @Inject
    ListenerRegistry registry;

    @Inject
    WorkerPool workerPool;

    @GET
    @Path("/metrics")
    @Operation(summary = "Delivery counters")
    public Map<String, Long> metrics() {
        return metrics.snapshot();
    }

    @GET
    @Path("/streams/{stream}/pending")
    @Operation(summary = "Pending entries summary of a stream's consumer group")
    public PendingSummary pending(@PathParam("stream") String stream) {
        return store.pendingSummary(stream, config.getGroupName());
    }

    @GET
    @Path("/listeners")
    @Operation(summary = "Registered listeners per stream and worker status")
    public Map<String, Object> listeners() {
        Map<String, List<String>> byStream = new LinkedHashMap<>();
        for (ListenerRegistration registration : registry.registrations()) {
            byStream.computeIfAbsent(registration.getStream(), k -> new ArrayList<>())
                    .add(registration.getListenerName());
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("group", config.getGroupName());
        body.put("workersRunning", workerPool.isRunning());
        body.put("workers", workerPool.getWorkers().size());
        body.put("streams", byStream);
        return body;
    }
}
