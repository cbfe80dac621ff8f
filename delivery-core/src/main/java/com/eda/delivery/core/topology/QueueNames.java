package com.eda.delivery.core.topology;

/**
 * Naming convention for everything derived from a base queue name {@code Q}:
 * <ul>
 *   <li>{@code Q.dlx} - dead letter exchange (direct)</li>
 *   <li>{@code Q.dlq} - dead letter queue, bound to {@code Q.dlx} with routing key {@code Q.dlq}</li>
 *   <li>{@code Q.delayed} - delayed exchange (direct) and delayed queue of the same name</li>
 * </ul>
 */
public final class QueueNames {

    public static final String DEAD_LETTER_EXCHANGE_SUFFIX = ".dlx";
    public static final String DEAD_LETTER_QUEUE_SUFFIX = ".dlq";
    public static final String DELAYED_SUFFIX = ".delayed";

    /** The broker's default (nameless) exchange. */
    public static final String DEFAULT_EXCHANGE = "";

    private QueueNames() {
        // Prevent instantiation
    }

    public static String deadLetterExchange(String queueName) {
        return queueName + DEAD_LETTER_EXCHANGE_SUFFIX;
    }

    public static String deadLetterQueue(String queueName) {
        return queueName + DEAD_LETTER_QUEUE_SUFFIX;
    }

    public static String delayedExchange(String queueName) {
        return queueName + DELAYED_SUFFIX;
    }

    public static String delayedQueue(String queueName) {
        return queueName + DELAYED_SUFFIX;
    }
}
