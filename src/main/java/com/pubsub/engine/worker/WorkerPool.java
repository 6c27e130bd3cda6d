package com.pubsub.engine.worker;

import com.pubsub.engine.config.PubSubConfig;
import com.pubsub.engine.delivery.DeliveryEngine;
import com.pubsub.engine.listener.ListenerRegistry;
import com.pubsub.engine.store.StreamNames;
import com.pubsub.engine.util.DeliveryMetrics;
import io.quarkus.runtime.StartupEvent;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the configured number of {@link StreamWorker}s on a fixed poll interval.
 * <p>
 * Configuration:
 * <ul>
 *   <li>app.pubsub.worker.enabled: start polling at application startup (default: true)</li>
 *   <li>app.pubsub.threads: number of concurrent workers (default: 1)</li>
 *   <li>app.pubsub.poll-interval-ms: delay between two ticks of a worker (default: 1000)</li>
 * </ul>
 * Stopping lets in-flight ticks finish; no new tick starts afterwards.
 */
@ApplicationScoped
public class WorkerPool {

    private static final Logger LOG = Logger.getLogger(WorkerPool.class);

    static final long SHUTDOWN_GRACE_SECONDS = 30;

    private final PubSubConfig config;
    private final ListenerRegistry registry;
    private final DeliveryEngine engine;
    private final DeliveryMetrics metrics;

    private final List<StreamWorker> workers = new ArrayList<>();
    private ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    @Inject
    public WorkerPool(PubSubConfig config, ListenerRegistry registry, DeliveryEngine engine, DeliveryMetrics metrics) {
        this.config = config;
        this.registry = registry;
        this.engine = engine;
        this.metrics = metrics;
    }

    void onStart(@Observes StartupEvent event) {
        start();
    }

    public synchronized void start() {
        if (!config.isWorkerEnabled()) {
            LOG.info("Stream workers are disabled via configuration");
            return;
        }
        if (running) {
            return;
        }

        int threads = Math.max(1, config.getThreads());
        long interval = config.getPollIntervalMs();
        LOG.infof("Starting %d stream worker(s) (poll interval: %dms)", threads, interval);

        AtomicInteger threadIndex = new AtomicInteger();
        scheduler = Executors.newScheduledThreadPool(threads, r -> {
            Thread thread = new Thread(r, "pubsub-worker-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        workers.clear();
        for (int i = 1; i <= threads; i++) {
            String workerId = String.valueOf(i);
            StreamWorker worker = new StreamWorker(workerId, StreamNames.localConsumer(workerId), registry, engine, metrics);
            workers.add(worker);
            scheduler.scheduleWithFixedDelay(worker::safeTick, 0, interval, TimeUnit.MILLISECONDS);
            LOG.infof("Stream worker %s polling as consumer %s", workerId, worker.getConsumerName());
        }
        running = true;
    }

    @PreDestroy
    public synchronized void stop() {
        if (!running) {
            return;
        }

        LOG.info("Stopping stream workers...");
        running = false;

        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                LOG.warnf("Stream workers did not finish within %ds, forcing shutdown", SHUTDOWN_GRACE_SECONDS);
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }

        LOG.info("Stream workers stopped");
    }

    public boolean isRunning() {
        return running;
    }

    public List<StreamWorker> getWorkers() {
        return Collections.unmodifiableList(workers);
    }
}
