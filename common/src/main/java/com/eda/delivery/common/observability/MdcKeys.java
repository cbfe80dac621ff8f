package com.eda.delivery.common.observability;

/**
 * Constants for MDC (Mapped Diagnostic Context) keys.
 * Used for structured logging of every publish and delivery.
 */
public final class MdcKeys {
    public static final String CORRELATION_ID = "correlationId";
    public static final String MESSAGE_ID = "messageId";
    public static final String MESSAGE_TYPE = "messageType";
    public static final String QUEUE = "queue";
    public static final String RETRY_COUNT = "retryCount";
    public static final String DELIVERY_TAG = "deliveryTag";

    private MdcKeys() {
        throw new UnsupportedOperationException("Utility class");
    }
}
