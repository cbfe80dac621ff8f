package com.eda.delivery.core.topology;

import java.time.Duration;

/**
 * Declared topology of one base queue. Dead-letter and delayed members are null when not declared.
 */
public record QueueTopology(
        String queueName,
        boolean durable,
        String deadLetterExchange,
        String deadLetterQueue,
        String delayedExchange,
        String delayedQueue,
        Duration delay
) {

    static QueueTopology of(String queueName, boolean durable, boolean deadLetter) {
        return new QueueTopology(
                queueName,
                durable,
                deadLetter ? QueueNames.deadLetterExchange(queueName) : null,
                deadLetter ? QueueNames.deadLetterQueue(queueName) : null,
                null,
                null,
                null
        );
    }

    QueueTopology withDelayed(Duration ttl) {
        return new QueueTopology(
                queueName,
                durable,
                deadLetterExchange,
                deadLetterQueue,
                QueueNames.delayedExchange(queueName),
                QueueNames.delayedQueue(queueName),
                ttl
        );
    }

    public boolean hasDeadLetter() {
        return deadLetterExchange != null;
    }

    public boolean isDelayed() {
        return delayedQueue != null;
    }
}
