package io.herald4j.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for scheduler behavior.
 */
@ConfigurationProperties(prefix = "herald")
public class SchedulerProperties {
    private Duration tickInterval = Duration.ofSeconds(1);
    private int deliveryConcurrency = 4;
    private int recoveryRetries = 3;
    private Duration recoveryRetryDelay = Duration.ofSeconds(2);
    private int maxDeliveryRetries = 3; // one-shot jobs only
    private Duration deliveryRetryDelay = Duration.ofSeconds(10);
    private Duration shutdownTimeout = Duration.ofSeconds(10);
    private Duration conversationTtl = Duration.ofMinutes(15);
    private boolean ensureIndexesOnStartup = false;

    public Duration getTickInterval() {
        return tickInterval;
    }

    public void setTickInterval(Duration tickInterval) {
        this.tickInterval = tickInterval;
    }

    public int getDeliveryConcurrency() {
        return deliveryConcurrency;
    }

    public void setDeliveryConcurrency(int deliveryConcurrency) {
        this.deliveryConcurrency = deliveryConcurrency;
    }

    public int getRecoveryRetries() {
        return recoveryRetries;
    }

    public void setRecoveryRetries(int recoveryRetries) {
        this.recoveryRetries = recoveryRetries;
    }

    public Duration getRecoveryRetryDelay() {
        return recoveryRetryDelay;
    }

    public void setRecoveryRetryDelay(Duration recoveryRetryDelay) {
        this.recoveryRetryDelay = recoveryRetryDelay;
    }

    public int getMaxDeliveryRetries() {
        return maxDeliveryRetries;
    }

    public void setMaxDeliveryRetries(int maxDeliveryRetries) {
        this.maxDeliveryRetries = maxDeliveryRetries;
    }

    public Duration getDeliveryRetryDelay() {
        return deliveryRetryDelay;
    }

    public void setDeliveryRetryDelay(Duration deliveryRetryDelay) {
        this.deliveryRetryDelay = deliveryRetryDelay;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public Duration getConversationTtl() {
        return conversationTtl;
    }

    public void setConversationTtl(Duration conversationTtl) {
        this.conversationTtl = conversationTtl;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }
}
