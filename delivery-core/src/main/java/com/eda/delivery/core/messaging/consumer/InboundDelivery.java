package com.eda.delivery.core.messaging.consumer;

import com.eda.delivery.core.messaging.retry.RetryHeaders;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Envelope;

/**
 * One message handed to a consumer. The delivery tag is only meaningful on {@code channel},
 * so settling it anywhere else is skipped.
 */
public record InboundDelivery(
        Channel channel,
        String queueName,
        long deliveryTag,
        boolean redelivered,
        byte[] body,
        String messageId,
        String typeTag,
        int retryCount,
        AMQP.BasicProperties properties
) {

    public static InboundDelivery from(Channel channel, String queueName, Envelope envelope,
                                       AMQP.BasicProperties properties, byte[] body) {
        return new InboundDelivery(
                channel,
                queueName,
                envelope.getDeliveryTag(),
                envelope.isRedeliver(),
                body,
                properties != null ? properties.getMessageId() : null,
                properties != null ? properties.getType() : null,
                RetryHeaders.retryCount(properties),
                properties
        );
    }
}
