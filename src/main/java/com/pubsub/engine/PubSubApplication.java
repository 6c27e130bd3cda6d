package com.pubsub.engine;

import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import org.jboss.logging.Logger;

/**
 * Main application class.
 * <p>
 * Stream workers start on {@link StartupEvent} and drain in-flight deliveries on shutdown;
 * anything not acknowledged by then is redelivered after restart.
 */
@QuarkusMain
public class PubSubApplication implements QuarkusApplication {

    private static final Logger LOG = Logger.getLogger(PubSubApplication.class);

    public static void main(String[] args) {
        Quarkus.run(PubSubApplication.class, args);
    }

    @Override
    public int run(String... args) throws Exception {
        LOG.info("Redis Streams pub/sub engine running");
        Quarkus.waitForExit();
        return 0;
    }
}

/**
 * Lifecycle observer for application startup and shutdown events.
 */
@ApplicationScoped
class ApplicationLifecycleObserver {

    private static final Logger LOG = Logger.getLogger(ApplicationLifecycleObserver.class);

    void onStart(@Observes StartupEvent event) {
        LOG.info("Redis Streams pub/sub engine started");
    }

    void onShutdown(@Observes ShutdownEvent event) {
        LOG.info("Shutdown signal received");
    }
}
