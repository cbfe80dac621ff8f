package com.eda.delivery.common.observability;

import com.rabbitmq.client.AMQP;
import org.slf4j.MDC;

import java.util.Map;

/**
 * Auto-closeable context for populating MDC from a RabbitMQ delivery.
 * Use with try-with-resources so the MDC of the dispatch thread is restored after processing.
 *
 * Example:
 * <pre>
 * try (MessageMdcContext mdc = MessageMdcContext.of("orders", properties, deliveryTag, retryCount)) {
 *     log.info("EVENT_RECEIVED"); // Will include MDC fields
 * }
 * </pre>
 *
 * Unlike a plain {@code MDC.clear()}, closing restores whatever was in the MDC before,
 * so nested contexts (an async completion running on the dispatch thread) do not wipe
 * the outer one.
 */
public class MessageMdcContext implements AutoCloseable {

    private static final String CORRELATION_HEADER = "correlationId";

    private final Map<String, String> previous;

    private MessageMdcContext(String queueName, AMQP.BasicProperties props, long deliveryTag, int retryCount) {
        this.previous = MDC.getCopyOfContextMap();

        MDC.put(MdcKeys.QUEUE, queueName);
        MDC.put(MdcKeys.RETRY_COUNT, Integer.toString(retryCount));
        if (deliveryTag >= 0) {
            MDC.put(MdcKeys.DELIVERY_TAG, Long.toString(deliveryTag));
        }
        if (props == null) {
            return;
        }

        if (props.getMessageId() != null) {
            MDC.put(MdcKeys.MESSAGE_ID, props.getMessageId());
        }
        if (props.getType() != null) {
            MDC.put(MdcKeys.MESSAGE_TYPE, props.getType());
        }

        // Correlation ID (from property or header)
        String correlationId = props.getCorrelationId();
        if ((correlationId == null || correlationId.isBlank()) && props.getHeaders() != null) {
            Object header = props.getHeaders().get(CORRELATION_HEADER);
            correlationId = header != null ? header.toString() : null;
        }
        if (correlationId != null && !correlationId.isBlank()) {
            MDC.put(MdcKeys.CORRELATION_ID, correlationId);
        }
    }

    /**
     * Create MDC context for a received delivery.
     *
     * @param queueName   queue the delivery came from
     * @param props       AMQP properties of the delivery, may be null
     * @param deliveryTag broker delivery tag
     * @param retryCount  retry count already decoded from the headers
     */
    public static MessageMdcContext of(String queueName, AMQP.BasicProperties props, long deliveryTag, int retryCount) {
        return new MessageMdcContext(queueName, props, deliveryTag, retryCount);
    }

    /**
     * Create MDC context for an outgoing message (no delivery tag).
     */
    public static MessageMdcContext forPublish(String queueName, AMQP.BasicProperties props, int retryCount) {
        return new MessageMdcContext(queueName, props, -1, retryCount);
    }

    @Override
    public void close() {
        if (previous == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(previous);
        }
    }
}
