package com.eda.delivery.core.messaging.exception;

import lombok.Getter;
import org.springframework.amqp.AmqpIllegalStateException;

/**
 * Thrown by {@code startConsuming} when the queue already has an active registration.
 * A queue never has two consumers from this subsystem at the same time.
 */
@Getter
public class ConsumerAlreadyRegisteredException extends AmqpIllegalStateException {

    private final String queueName;
    private final String consumerTag;

    public ConsumerAlreadyRegisteredException(String queueName, String consumerTag) {
        super("Queue '" + queueName + "' already has an active consumer (tag " + consumerTag + ")");
        this.queueName = queueName;
        this.consumerTag = consumerTag;
    }
}
