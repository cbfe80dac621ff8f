package com.eda.delivery.core.messaging.consumer;

import com.rabbitmq.client.Channel;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The active subscription for one queue name. The consumer tag changes when the
 * subscription is re-issued after a recovery.
 */
@Getter
public class ConsumerRegistration {

    private final String queueName;
    private final Class<?> payloadType;
    private final DeliveryHandler<?> deliveryHandler;
    private final Instant registeredAt = Instant.now();
    private volatile String consumerTag;

    @Getter(AccessLevel.NONE)
    private volatile Channel channel;

    @Getter(AccessLevel.NONE)
    private final AtomicBoolean cancelled = new AtomicBoolean();

    ConsumerRegistration(String queueName, Class<?> payloadType, DeliveryHandler<?> deliveryHandler) {
        this.queueName = queueName;
        this.payloadType = payloadType;
        this.deliveryHandler = deliveryHandler;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @return true on the first call only
     */
    boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    void updateSubscription(Channel channel, String consumerTag) {
        this.channel = channel;
        this.consumerTag = consumerTag;
    }

    boolean isSubscribedOn(Channel candidate) {
        return candidate != null && channel == candidate;
    }
}
