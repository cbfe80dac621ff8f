package com.eda.delivery.core.messaging.consumer;

/**
 * Application callback for one message.
 *
 * @param <T> payload type the message body is deserialized into
 */
@FunctionalInterface
public interface MessageHandler<T> {

    /**
     * @return true if the message was processed; false or an exception sends it to retry
     */
    boolean handle(T message) throws Exception;
}
