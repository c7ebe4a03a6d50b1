package com.batonsystems.config;

import java.time.Duration;

/**
 * Configuration for a single producer/consumer pipeline run.
 * Every setter returns this instance so settings can be chained.
 */
public class PipelineConfig {
    // Default values for pipeline configuration
    public static final int DEFAULT_QUEUE_CAPACITY = 10;
    public static final int DEFAULT_CONSUMER_COUNT = 1;
    public static final boolean DEFAULT_FAIR_LOCK = false;
    public static final String DEFAULT_THREAD_NAME_PREFIX = "pipeline";
    public static final boolean DEFAULT_DAEMON_THREADS = false;

    private int queueCapacity;
    private Duration putTimeout;
    private Duration getTimeout;
    private int consumerCount;
    private boolean fairLock;
    private String threadNamePrefix;
    private boolean daemonThreads;

    /**
     * Creates a new PipelineConfig with default values. Both timeouts default to
     * null, which blocks indefinitely.
     */
    public PipelineConfig() {
        this.queueCapacity = DEFAULT_QUEUE_CAPACITY;
        this.consumerCount = DEFAULT_CONSUMER_COUNT;
        this.fairLock = DEFAULT_FAIR_LOCK;
        this.threadNamePrefix = DEFAULT_THREAD_NAME_PREFIX;
        this.daemonThreads = DEFAULT_DAEMON_THREADS;
    }

    /**
     * Sets the capacity of the queue between producer and consumers.
     *
     * @param queueCapacity The queue capacity
     * @return This PipelineConfig instance
     */
    public PipelineConfig setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
        return this;
    }

    /**
     * Gets the capacity of the queue between producer and consumers.
     *
     * @return The queue capacity
     */
    public int getQueueCapacity() {
        return queueCapacity;
    }

    /**
     * Sets how long the producer waits for room before giving up on an item.
     * Does not apply to end-of-stream delivery, which always blocks.
     *
     * @param putTimeout The timeout, or null to block indefinitely
     * @return This PipelineConfig instance
     */
    public PipelineConfig setPutTimeout(Duration putTimeout) {
        this.putTimeout = putTimeout;
        return this;
    }

    /**
     * Gets the producer's per-item put timeout.
     *
     * @return The timeout, or null if puts block indefinitely
     */
    public Duration getPutTimeout() {
        return putTimeout;
    }

    /**
     * Sets how long a consumer waits for the next item before giving up.
     *
     * @param getTimeout The timeout, or null to block indefinitely
     * @return This PipelineConfig instance
     */
    public PipelineConfig setGetTimeout(Duration getTimeout) {
        this.getTimeout = getTimeout;
        return this;
    }

    /**
     * Gets the consumers' get timeout.
     *
     * @return The timeout, or null if gets block indefinitely
     */
    public Duration getGetTimeout() {
        return getTimeout;
    }

    /**
     * Sets the number of consumers draining the queue. The producer emits one
     * end-of-stream marker per consumer.
     *
     * @param consumerCount The number of consumers
     * @return This PipelineConfig instance
     */
    public PipelineConfig setConsumerCount(int consumerCount) {
        this.consumerCount = consumerCount;
        return this;
    }

    public int getConsumerCount() {
        return consumerCount;
    }

    /**
     * Sets whether the queue lock grants access to the longest-waiting thread.
     *
     * @param fairLock true for a fair lock
     * @return This PipelineConfig instance
     */
    public PipelineConfig setFairLock(boolean fairLock) {
        this.fairLock = fairLock;
        return this;
    }

    public boolean isFairLock() {
        return fairLock;
    }

    /**
     * Sets the prefix used to name producer and consumer threads.
     *
     * @param threadNamePrefix The thread name prefix
     * @return This PipelineConfig instance
     */
    public PipelineConfig setThreadNamePrefix(String threadNamePrefix) {
        this.threadNamePrefix = threadNamePrefix;
        return this;
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public PipelineConfig setDaemonThreads(boolean daemonThreads) {
        this.daemonThreads = daemonThreads;
        return this;
    }

    public boolean isDaemonThreads() {
        return daemonThreads;
    }

    /**
     * Checks that every setting can be honoured.
     *
     * @return This PipelineConfig instance
     * @throws InvalidConfigurationException if a setting is out of range
     */
    public PipelineConfig validate() {
        InvalidConfigurationException.requirePositive("queueCapacity", queueCapacity);
        InvalidConfigurationException.requirePositive("consumerCount", consumerCount);
        requireNonNegative("putTimeout", putTimeout);
        requireNonNegative("getTimeout", getTimeout);
        if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
            throw new InvalidConfigurationException("threadNamePrefix", "threadNamePrefix must not be blank");
        }
        return this;
    }

    private static void requireNonNegative(String setting, Duration timeout) {
        if (timeout != null && timeout.isNegative()) {
            throw new InvalidConfigurationException(setting, setting + " must not be negative, was " + timeout);
        }
    }

    @Override
    public String toString() {
        return "PipelineConfig{" +
                "queueCapacity=" + queueCapacity +
                ", putTimeout=" + putTimeout +
                ", getTimeout=" + getTimeout +
                ", consumerCount=" + consumerCount +
                ", fairLock=" + fairLock +
                ", threadNamePrefix='" + threadNamePrefix + '\'' +
                ", daemonThreads=" + daemonThreads +
                '}';
    }
}
