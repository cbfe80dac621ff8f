package com.eda.delivery.core.messaging.exception;

import lombok.Getter;
import org.springframework.amqp.AmqpException;

/**
 * Thrown when a queue or exchange would be (re)declared with arguments that differ from
 * the ones it already has.
 *
 * This is a CONFIGURATION error, not a transient failure:
 * - the same queue name requested with different durability or dead-letter settings
 * - a delayed queue requested with a different delay than the one it was declared with
 * - the broker refusing a declaration with 406 PRECONDITION_FAILED
 *
 * Retrying won't fix it; the queue has to be deleted or the caller's options corrected.
 */
@Getter
public class TopologyConfigurationException extends AmqpException {

    private final String queueName;

    public TopologyConfigurationException(String queueName, String message) {
        super("Topology conflict for queue '" + queueName + "': " + message);
        this.queueName = queueName;
    }

    public TopologyConfigurationException(String queueName, String message, Throwable cause) {
        super("Topology conflict for queue '" + queueName + "': " + message, cause);
        this.queueName = queueName;
    }
}
