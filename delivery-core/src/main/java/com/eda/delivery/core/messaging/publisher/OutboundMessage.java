package com.eda.delivery.core.messaging.publisher;

import com.eda.delivery.core.messaging.codec.JsonPayloadCodec;
import com.eda.delivery.core.messaging.consumer.InboundDelivery;
import com.eda.delivery.core.messaging.retry.RetryHeaders;
import com.rabbitmq.client.AMQP;

import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable message about to be published. Created per publish call and discarded afterwards.
 *
 * @param retryCount 0 for a fresh publish; the {@code x-retry-count} header is only written when positive
 */
public record OutboundMessage(
        byte[] body,
        String typeTag,
        String messageId,
        String correlationId,
        Instant timestamp,
        boolean persistent,
        Duration delay,
        int retryCount,
        Map<String, Object> headers
) {

    private static final int PERSISTENT = 2;
    private static final int TRANSIENT = 1;

    public static OutboundMessage create(byte[] body, String typeTag, Duration delay) {
        return new OutboundMessage(
                body,
                typeTag,
                UUID.randomUUID().toString(),
                null,
                Instant.now(),
                true,
                delay,
                0,
                Map.of()
        );
    }

    /**
     * Re-publication of a failed delivery: same body, type, message id and headers,
     * fresh timestamp, incremented retry count.
     */
    public static OutboundMessage retryOf(InboundDelivery delivery, int retryCount) {
        AMQP.BasicProperties original = delivery.properties();
        String messageId = delivery.messageId() != null ? delivery.messageId() : UUID.randomUUID().toString();
        String typeTag = delivery.typeTag() != null ? delivery.typeTag() : "Unknown";
        return new OutboundMessage(
                delivery.body(),
                typeTag,
                messageId,
                original != null ? original.getCorrelationId() : null,
                Instant.now(),
                true,
                null,
                retryCount,
                original != null && original.getHeaders() != null ? original.getHeaders() : Map.of()
        );
    }

    public boolean isDelayed() {
        return delay != null;
    }

    public AMQP.BasicProperties toProperties() {
        Map<String, Object> outgoingHeaders = retryCount > 0
                ? RetryHeaders.withRetryCount(headers, retryCount)
                : (headers.isEmpty() ? null : headers);

        return new AMQP.BasicProperties.Builder()
                .contentType(JsonPayloadCodec.CONTENT_TYPE)
                .deliveryMode(persistent ? PERSISTENT : TRANSIENT)
                .messageId(messageId)
                .correlationId(correlationId)
                .timestamp(Date.from(timestamp))
                .type(typeTag)
                .headers(outgoingHeaders)
                .build();
    }
}
