package com.eda.delivery.core.messaging;

import com.eda.delivery.core.messaging.consumer.AsyncMessageHandler;
import com.eda.delivery.core.messaging.consumer.ConsumerRegistration;
import com.eda.delivery.core.messaging.consumer.MessageHandler;

import java.time.Duration;

/**
 * Application-facing API for reliable publish and consume over RabbitMQ.
 *
 * Delivery guarantees:
 * - At-least-once: handlers must be idempotent, a message can be delivered again after a crash or recovery
 * - A handler returning false or throwing is retried up to max-retry-attempts times, then dead-lettered
 * - A body that cannot be deserialized is dead-lettered immediately
 * - Retried messages go to the back of the queue, so order is only kept for first deliveries
 */
public interface MessageQueueService {

    /**
     * Publish a payload to a durable queue, declaring the queue if needed.
     *
     * @return the message id
     */
    String publish(Object message, String queueName);

    /**
     * Publish a payload that becomes visible on {@code queueName} after {@code delay}.
     * All delayed publishes to one queue must use the same delay.
     *
     * @return the message id
     */
    String publish(Object message, String queueName, Duration delay);

    <T> ConsumerRegistration startConsuming(String queueName, Class<T> messageType, MessageHandler<T> handler);

    <T> ConsumerRegistration startConsumingAsync(String queueName, Class<T> messageType, AsyncMessageHandler<T> handler);

    /**
     * @return true if a consumer was registered for the queue
     */
    boolean stopConsuming(String queueName);
}
