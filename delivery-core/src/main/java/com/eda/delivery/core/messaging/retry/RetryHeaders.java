package com.eda.delivery.core.messaging.retry;

import com.rabbitmq.client.AMQP;

import java.util.HashMap;
import java.util.Map;

/**
 * Reads and writes the {@code x-retry-count} header.
 *
 * The retry count lives only in the message. A message moved between queues by anything
 * other than this subsystem keeps whatever header it had, or none (count 0).
 */
public final class RetryHeaders {

    public static final String RETRY_COUNT = "x-retry-count";

    private RetryHeaders() {
        // Prevent instantiation
    }

    /**
     * Retry count of a delivery; absent, negative or unreadable values count as 0.
     * Other clients may send the header as any integer width or as a (long) string.
     */
    public static int retryCount(AMQP.BasicProperties properties) {
        if (properties == null || properties.getHeaders() == null) {
            return 0;
        }
        Object value = properties.getHeaders().get(RETRY_COUNT);
        if (value == null) {
            return 0;
        }
        if (value instanceof Number number) {
            return Math.max(0, number.intValue());
        }
        try {
            return Math.max(0, Integer.parseInt(value.toString().trim()));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /**
     * Copy of {@code headers} with the retry count set.
     */
    public static Map<String, Object> withRetryCount(Map<String, Object> headers, int retryCount) {
        Map<String, Object> copy = headers != null ? new HashMap<>(headers) : new HashMap<>();
        copy.put(RETRY_COUNT, retryCount);
        return copy;
    }
}
