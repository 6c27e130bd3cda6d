package com.pubsub.engine.config;

import java.util.Optional;

/**
 * Settings shared by the store adapter, delivery engine and poll loop.
 * <p>
 * Built once at startup by {@link PubSubConfigProducer} and injected wherever it
 * is needed. Tests construct it directly and override the defaults they care about.
 */
public class PubSubConfig {

    public static final String MODE_REDIS = "redis";
    public static final String MODE_IN_MEMORY = "in-memory";

    private String groupName = "pubsub";
    private String suffix;
    private int threads = 1;
    private long minIdleTimeMs = 60_000L;
    private int maxRetries = 5;
    private String dlqStream = "pubsub-dlq";
    private long pollIntervalMs = 1_000L;
    private boolean workerEnabled = true;
    private String storeMode = MODE_REDIS;
    private int readCount;
    private long maxLength;
    private int redisTimeoutSeconds = 5;

    public String getGroupName() {
        return groupName;
    }

    public void setGroupName(String groupName) {
        this.groupName = groupName;
    }

    /**
     * Suffix appended to every stream name for environment isolation, if any.
     */
    public Optional<String> getSuffix() {
        return Optional.ofNullable(suffix).map(String::trim).filter(s -> !s.isEmpty());
    }

    public void setSuffix(String suffix) {
        this.suffix = suffix;
    }

    public int getThreads() {
        return threads;
    }

    public void setThreads(int threads) {
        this.threads = threads;
    }

    public long getMinIdleTimeMs() {
        return minIdleTimeMs;
    }

    public void setMinIdleTimeMs(long minIdleTimeMs) {
        this.minIdleTimeMs = minIdleTimeMs;
    }

    /**
     * Number of deliveries tolerated before a stuck entry is moved to the dead-letter stream.
     * The check is strictly greater-than.
     */
    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public String getDlqStream() {
        return dlqStream;
    }

    public void setDlqStream(String dlqStream) {
        this.dlqStream = dlqStream;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    public boolean isWorkerEnabled() {
        return workerEnabled;
    }

    public void setWorkerEnabled(boolean workerEnabled) {
        this.workerEnabled = workerEnabled;
    }

    public String getStoreMode() {
        return storeMode;
    }

    public void setStoreMode(String storeMode) {
        this.storeMode = storeMode;
    }

    public boolean isInMemory() {
        return MODE_IN_MEMORY.equalsIgnoreCase(storeMode);
    }

    /**
     * COUNT passed to XREADGROUP; 0 leaves the batch size to the store.
     */
    public int getReadCount() {
        return readCount;
    }

    public void setReadCount(int readCount) {
        this.readCount = readCount;
    }

    /**
     * Approximate MAXLEN applied on publish; 0 keeps streams unbounded.
     */
    public long getMaxLength() {
        return maxLength;
    }

    public void setMaxLength(long maxLength) {
        this.maxLength = maxLength;
    }

    public int getRedisTimeoutSeconds() {
        return redisTimeoutSeconds;
    }

    public void setRedisTimeoutSeconds(int redisTimeoutSeconds) {
        this.redisTimeoutSeconds = redisTimeoutSeconds;
    }

    @Override
    public String toString() {
        return "PubSubConfig{group=" + groupName
                + ", suffix=" + getSuffix().orElse("<none>")
                + ", threads=" + threads
                + ", minIdleTimeMs=" + minIdleTimeMs
                + ", maxRetries=" + maxRetries
                + ", dlqStream=" + dlqStream
                + ", pollIntervalMs=" + pollIntervalMs
                + ", storeMode=" + storeMode + "}";
    }
}
