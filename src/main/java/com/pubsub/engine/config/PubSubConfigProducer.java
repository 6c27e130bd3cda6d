package com.pubsub.engine.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.Optional;

/**
 * Reads the {@code app.pubsub.*} properties and exposes them as a single {@link PubSubConfig}.
 */
@ApplicationScoped
public class PubSubConfigProducer {

    private static final Logger LOG = Logger.getLogger(PubSubConfigProducer.class);

    @ConfigProperty(name = "app.pubsub.group-name", defaultValue = "pubsub")
    String groupName;

    @ConfigProperty(name = "app.pubsub.suffix")
    Optional<String> suffix;

    @ConfigProperty(name = "app.pubsub.threads", defaultValue = "1")
    int threads;

    @ConfigProperty(name = "app.pubsub.min-idle-time-ms", defaultValue = "60000")
    long minIdleTimeMs;

    @ConfigProperty(name = "app.pubsub.max-retries", defaultValue = "5")
    int maxRetries;

    @ConfigProperty(name = "app.pubsub.dlq-stream", defaultValue = "pubsub-dlq")
    String dlqStream;

    @ConfigProperty(name = "app.pubsub.poll-interval-ms", defaultValue = "1000")
    long pollIntervalMs;

    @ConfigProperty(name = "app.pubsub.worker.enabled", defaultValue = "true")
    boolean workerEnabled;

    @ConfigProperty(name = "app.pubsub.store.mode", defaultValue = "redis")
    String storeMode;

    @ConfigProperty(name = "app.pubsub.read-count", defaultValue = "0")
    int readCount;

    @ConfigProperty(name = "app.pubsub.max-length", defaultValue = "0")
    long maxLength;

    @ConfigProperty(name = "app.pubsub.redis-timeout-seconds", defaultValue = "5")
    int redisTimeoutSeconds;

    @Produces
    @Singleton
    PubSubConfig pubSubConfig() {
        PubSubConfig config = new PubSubConfig();
        config.setGroupName(groupName);
        config.setSuffix(suffix.orElse(null));
        config.setThreads(Math.max(1, threads));
        config.setMinIdleTimeMs(minIdleTimeMs);
        config.setMaxRetries(maxRetries);
        config.setDlqStream(dlqStream);
        config.setPollIntervalMs(pollIntervalMs);
        config.setWorkerEnabled(workerEnabled);
        config.setStoreMode(storeMode);
        config.setReadCount(readCount);
        config.setMaxLength(maxLength);
        config.setRedisTimeoutSeconds(redisTimeoutSeconds);
        LOG.infof("Pub/sub configuration: %s", config);
        return config;
    }
}
