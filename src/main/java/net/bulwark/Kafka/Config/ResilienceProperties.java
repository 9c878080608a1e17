package net.bulwark.Kafka.Config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the resilience layer.
 * These properties can be configured in application.properties with the prefix "bulwark.kafka".
 * Annotation attributes on a listener override them per listener.
 */
@ConfigurationProperties(prefix = "bulwark.kafka")
public class ResilienceProperties {

    /**
     * Deliveries allowed to fail before a message is dead-lettered.
     * Default: 3
     */
    private int maxRetries = 3;

    /**
     * How long a processed event id is remembered.
     * Default: 1h
     */
    private Duration dedupTtl = Duration.ofHours(1);

    /**
     * Maximum number of remembered event ids.
     * Default: 10000
     */
    private int dedupMaxSize = 10_000;

    private Duration backoffInitial = Duration.ofMillis(100);

    private Duration backoffMax = Duration.ofSeconds(30);

    private double backoffMultiplier = 2.0;

    /**
     * Default dead-letter topic.
     */
    private String deadLetterDestination = "dlq";

    /**
     * Written into dead-letter envelopes and the dlqService header.
     */
    private String serviceName = "bulwark-worker";

    /**
     * In-process retries of one delivery before failing it (0 = a single call).
     */
    private int inlineRetries = 0;

    /**
     * How long a publish waits for the broker ack.
     */
    private Duration publishTimeout = Duration.ofSeconds(10);

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getDedupTtl() {
        return dedupTtl;
    }

    public void setDedupTtl(Duration dedupTtl) {
        this.dedupTtl = dedupTtl;
    }

    public int getDedupMaxSize() {
        return dedupMaxSize;
    }

    public void setDedupMaxSize(int dedupMaxSize) {
        this.dedupMaxSize = dedupMaxSize;
    }

    public Duration getBackoffInitial() {
        return backoffInitial;
    }

    public void setBackoffInitial(Duration backoffInitial) {
        this.backoffInitial = backoffInitial;
    }

    public Duration getBackoffMax() {
        return backoffMax;
    }

    public void setBackoffMax(Duration backoffMax) {
        this.backoffMax = backoffMax;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public void setBackoffMultiplier(double backoffMultiplier) {
        this.backoffMultiplier = backoffMultiplier;
    }

    public String getDeadLetterDestination() {
        return deadLetterDestination;
    }

    public void setDeadLetterDestination(String deadLetterDestination) {
        this.deadLetterDestination = deadLetterDestination;
    }

    public String getServiceName() {
        return serviceName;
    }

    public void setServiceName(String serviceName) {
        this.serviceName = serviceName;
    }

    public int getInlineRetries() {
        return inlineRetries;
    }

    public void setInlineRetries(int inlineRetries) {
        this.inlineRetries = inlineRetries;
    }

    public Duration getPublishTimeout() {
        return publishTimeout;
    }

    public void setPublishTimeout(Duration publishTimeout) {
        this.publishTimeout = publishTimeout;
    }
}
