package com.eda.delivery.core.messaging.consumer;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Application callback that completes later. The delivery is settled only when the returned
 * stage completes: {@code true} acks, {@code false} or exceptional completion goes to retry.
 *
 * @param <T> payload type the message body is deserialized into
 */
@FunctionalInterface
public interface AsyncMessageHandler<T> {

    CompletionStage<Boolean> handle(T message) throws Exception;

    static <T> AsyncMessageHandler<T> from(MessageHandler<T> handler) {
        return message -> CompletableFuture.completedFuture(handler.handle(message));
    }
}
