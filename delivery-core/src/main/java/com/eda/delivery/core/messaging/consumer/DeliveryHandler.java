package com.eda.delivery.core.messaging.consumer;

import com.eda.delivery.common.observability.MessageMdcContext;
import com.eda.delivery.core.messaging.codec.JsonPayloadCodec;
import com.eda.delivery.core.messaging.metrics.DeliveryMetrics;
import com.eda.delivery.core.messaging.retry.RetryCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.support.converter.MessageConversionException;

import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

/**
 * Processes one delivery for a registered consumer.
 *
 * Flow:
 * 1. Delivery after cancellation: nack with requeue, handler not invoked
 * 2. Deserialize the JSON body; unreadable or JSON null is a poison message: nack without requeue, no retry
 * 3. Invoke the handler and wait for its result
 * 4. true: ack; false, exception or failed future: {@link RetryCoordinator}
 *
 * Every path ends in exactly one ack or nack.
 *
 * @param <T> payload type
 */
@RequiredArgsConstructor
@Slf4j
public class DeliveryHandler<T> {

    private final Class<T> payloadType;
    private final AsyncMessageHandler<T> handler;
    private final JsonPayloadCodec codec;
    private final DeliveryAcknowledger acknowledger;
    private final RetryCoordinator retryCoordinator;
    private final DeliveryMetrics metrics;

    public void onDelivery(ConsumerRegistration registration, InboundDelivery delivery) {
        try (MessageMdcContext mdc = mdcContext(delivery)) {
            log.info("EVENT_RECEIVED: type={}, redelivered={}", delivery.typeTag(), delivery.redelivered());

            if (registration.isCancelled()) {
                log.info("DELIVERY_REQUEUED: consumer was cancelled before processing");
                acknowledger.reject(delivery, true);
                return;
            }

            T payload;
            try {
                payload = codec.deserialize(delivery.body(), payloadType);
            } catch (MessageConversionException e) {
                log.error("POISON_MESSAGE: cannot read body as {}, rejecting without retry",
                        payloadType.getSimpleName(), e);
                if (acknowledger.reject(delivery, false)) {
                    metrics.rejected(delivery.queueName());
                }
                return;
            }

            CompletionStage<Boolean> outcome;
            try {
                outcome = handler.handle(payload);
            } catch (Exception e) {
                log.error("HANDLER_FAILED: {}", e.getMessage(), e);
                retryCoordinator.handleFailure(delivery, describe(e));
                return;
            }

            if (outcome == null) {
                log.error("HANDLER_FAILED: handler returned no result");
                retryCoordinator.handleFailure(delivery, "Handler returned no result");
                return;
            }

            outcome.whenComplete((success, error) -> complete(delivery, success, error));
        }
    }

    private void complete(InboundDelivery delivery, Boolean success, Throwable error) {
        try (MessageMdcContext mdc = mdcContext(delivery)) {
            if (error != null) {
                Throwable cause = unwrap(error);
                log.error("HANDLER_FAILED: {}", cause.getMessage(), cause);
                retryCoordinator.handleFailure(delivery, describe(cause));
            } else if (Boolean.TRUE.equals(success)) {
                if (acknowledger.ack(delivery)) {
                    metrics.acked(delivery.queueName());
                    log.info("MESSAGE_ACKED");
                }
            } else {
                log.warn("HANDLER_REJECTED: handler reported failure");
                retryCoordinator.handleFailure(delivery, "Handler returned false");
            }
        } catch (RuntimeException e) {
            // Settlement failures are already logged by the acknowledger; anything else lands here
            log.error("Unexpected error while settling delivery: deliveryTag={}", delivery.deliveryTag(), e);
        }
    }

    private static MessageMdcContext mdcContext(InboundDelivery delivery) {
        return MessageMdcContext.of(delivery.queueName(), delivery.properties(),
                delivery.deliveryTag(), delivery.retryCount());
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable error) {
        return error.getClass().getSimpleName() + ": " + error.getMessage();
    }
}
