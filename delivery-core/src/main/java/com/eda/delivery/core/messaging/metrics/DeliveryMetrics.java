package com.eda.delivery.core.messaging.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;

/**
 * Delivery outcome counters, tagged by base queue name.
 */
@RequiredArgsConstructor
public class DeliveryMetrics {

    public static final String PUBLISHED = "messaging.published";
    public static final String ACKED = "messaging.acked";
    public static final String RETRIED = "messaging.retried";
    public static final String DEAD_LETTERED = "messaging.dead_lettered";
    public static final String REJECTED = "messaging.rejected";
    public static final String REPUBLISH_FAILED = "messaging.republish_failed";

    private static final String QUEUE_TAG = "queue";

    private final MeterRegistry registry;

    public void published(String queueName) {
        increment(PUBLISHED, queueName);
    }

    public void acked(String queueName) {
        increment(ACKED, queueName);
    }

    public void retried(String queueName) {
        increment(RETRIED, queueName);
    }

    public void deadLettered(String queueName) {
        increment(DEAD_LETTERED, queueName);
    }

    /** Poison messages: rejected without a retry attempt. */
    public void rejected(String queueName) {
        increment(REJECTED, queueName);
    }

    public void republishFailed(String queueName) {
        increment(REPUBLISH_FAILED, queueName);
    }

    public double count(String name, String queueName) {
        return registry.counter(name, QUEUE_TAG, queueName).count();
    }

    private void increment(String name, String queueName) {
        registry.counter(name, QUEUE_TAG, queueName).increment();
    }
}
