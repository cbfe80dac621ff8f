package com.eda.delivery.core.messaging.publisher;

import com.eda.delivery.common.observability.MessageMdcContext;
import com.eda.delivery.core.config.DeliveryProperties;
import com.eda.delivery.core.connection.ConnectionManager;
import com.eda.delivery.core.messaging.codec.JsonPayloadCodec;
import com.eda.delivery.core.messaging.consumer.InboundDelivery;
import com.eda.delivery.core.messaging.metrics.DeliveryMetrics;
import com.eda.delivery.core.topology.QueueNames;
import com.eda.delivery.core.topology.QueueTopology;
import com.eda.delivery.core.topology.TopologyBuilder;
import com.eda.delivery.core.topology.TopologyOptions;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.util.Assert;

import java.time.Duration;

/**
 * Publishes payloads to durable queues.
 *
 * Routing:
 * - Direct: default exchange, routing key = queue name
 * - Delayed: {@code <queue>.delayed} exchange; the TTL queue dead-letters into the queue when the delay expires
 * - Retry: default exchange, routing key = queue name, original message id and type, incremented {@code x-retry-count}
 *
 * Every message is persistent and carries a message id, a timestamp (seconds), its type tag
 * and content type {@code application/json}.
 *
 * With publisher confirms enabled, a publish returns only once the broker has confirmed it.
 * A broker nack or a confirm timeout surfaces as an {@link AmqpException}.
 */
@RequiredArgsConstructor
@Slf4j
public class MessagePublisher {

    private final ConnectionManager connectionManager;
    private final TopologyBuilder topologyBuilder;
    private final JsonPayloadCodec codec;
    private final DeliveryProperties properties;
    private final DeliveryMetrics metrics;

    /**
     * @return the message id assigned to the published message
     */
    public String publish(Object payload, String queueName) {
        return publish(payload, queueName, null);
    }

    /**
     * @param delay how long the message waits before it reaches {@code queueName}; {@code null} for none
     * @return the message id assigned to the published message
     * @throws IllegalArgumentException if the delay is zero, negative or too long for a TTL
     * @throws org.springframework.amqp.support.converter.MessageConversionException if the payload cannot be serialized
     */
    public String publish(Object payload, String queueName, Duration delay) {
        Assert.notNull(payload, "payload must not be null");
        Assert.hasText(queueName, "queueName must not be empty");

        TopologyOptions options = TopologyOptions.from(properties).withDelay(delay);
        byte[] body = codec.serialize(payload);
        OutboundMessage message = OutboundMessage.create(body, codec.typeTag(payload), delay);

        send(message, queueName, options);
        return message.messageId();
    }

    /**
     * Publishes a failed delivery back to the tail of its queue.
     */
    public void republish(InboundDelivery delivery, int retryCount) {
        OutboundMessage message = OutboundMessage.retryOf(delivery, retryCount);
        send(message, delivery.queueName(), TopologyOptions.from(properties));
    }

    private void send(OutboundMessage message, String queueName, TopologyOptions options) {
        QueueTopology topology = topologyBuilder.ensureTopology(queueName, options);

        String exchange = message.isDelayed() ? topology.delayedExchange() : QueueNames.DEFAULT_EXCHANGE;
        String routingKey = message.isDelayed() ? topology.delayedQueue() : queueName;
        AMQP.BasicProperties amqpProperties = message.toProperties();

        try (MessageMdcContext mdc = MessageMdcContext.forPublish(queueName, amqpProperties, message.retryCount())) {
            try {
                connectionManager.execute(channel -> {
                    channel.basicPublish(exchange, routingKey, amqpProperties, message.body());
                    if (properties.isEnablePublisherConfirms()) {
                        awaitConfirm(channel, message);
                    }
                    return null;
                });
            } catch (AmqpException e) {
                log.error("PUBLISH_FAILED: exchange='{}', routingKey={}", exchange, routingKey, e);
                throw e;
            }

            metrics.published(queueName);
            if (message.isDelayed()) {
                log.info("MESSAGE_PUBLISHED: type={}, delayMs={}", message.typeTag(), message.delay().toMillis());
            } else {
                log.info("MESSAGE_PUBLISHED: type={}", message.typeTag());
            }
        }
    }

    private void awaitConfirm(Channel channel, OutboundMessage message) throws Exception {
        boolean confirmed;
        try {
            confirmed = channel.waitForConfirms(properties.getPublishTimeout().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AmqpException("Interrupted while waiting for publisher confirm of " + message.messageId(), e);
        }
        if (!confirmed) {
            throw new AmqpException("Broker rejected message " + message.messageId());
        }
    }
}
