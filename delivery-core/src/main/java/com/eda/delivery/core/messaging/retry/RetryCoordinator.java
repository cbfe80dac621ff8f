package com.eda.delivery.core.messaging.retry;

import com.eda.delivery.core.config.DeliveryProperties;
import com.eda.delivery.core.messaging.consumer.DeliveryAcknowledger;
import com.eda.delivery.core.messaging.consumer.InboundDelivery;
import com.eda.delivery.core.messaging.metrics.DeliveryMetrics;
import com.eda.delivery.core.messaging.publisher.MessagePublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;

import java.time.Instant;
import java.util.Map;

/**
 * Decides what happens to a delivery whose handler did not succeed.
 *
 * - retryCount < max-retry-attempts: the delivery is acked and a copy with
 *   {@code x-retry-count + 1} is published to the queue tail after {@code retry-delay}
 * - otherwise: nack without requeue, so the broker moves it to {@code <queue>.dlq}
 *
 * The superseded delivery is acked rather than nacked: the main queue carries dead-letter
 * arguments, so a nack would put a second copy into the DLQ. If the ack fails the broker
 * still holds the original and will redeliver it, so no copy is scheduled.
 *
 * The delay runs on the retry scheduler, never on the delivery thread. Retried messages
 * re-enter at the tail and may overtake or fall behind later messages.
 * A failed re-publish loses the message from the retry path; it is logged and counted.
 */
@RequiredArgsConstructor
@Slf4j
public class RetryCoordinator {

    private final MessagePublisher publisher;
    private final DeliveryAcknowledger acknowledger;
    private final TaskScheduler taskScheduler;
    private final DeliveryProperties properties;
    private final DeliveryMetrics metrics;

    public void handleFailure(InboundDelivery delivery, String reason) {
        int retryCount = delivery.retryCount();
        int maxAttempts = properties.getMaxRetryAttempts();

        if (retryCount < maxAttempts) {
            scheduleRetry(delivery, retryCount + 1, maxAttempts, reason);
        } else {
            deadLetter(delivery, maxAttempts, reason);
        }
    }

    private void scheduleRetry(InboundDelivery delivery, int nextRetryCount, int maxAttempts, String reason) {
        long delayMs = properties.getRetryDelay().toMillis();
        if (!acknowledger.ack(delivery)) {
            log.warn("RETRY_ABORTED: delivery could not be settled, broker will redeliver it. reason={}", reason);
            return;
        }

        log.warn("RETRY_SCHEDULED: attempt {}/{} in {}ms, reason={}", nextRetryCount, maxAttempts, delayMs, reason);
        metrics.retried(delivery.queueName());

        Map<String, String> mdcContext = MDC.getCopyOfContextMap();
        try {
            taskScheduler.schedule(
                    () -> republish(delivery, nextRetryCount, mdcContext),
                    Instant.now().plus(properties.getRetryDelay()));
        } catch (TaskRejectedException e) {
            log.error("RETRY_REPUBLISH_FAILED: retry scheduler rejected the task, message dropped from retry path", e);
            metrics.republishFailed(delivery.queueName());
        }
    }

    void republish(InboundDelivery delivery, int retryCount, Map<String, String> mdcContext) {
        if (mdcContext != null) {
            MDC.setContextMap(mdcContext);
        }
        try {
            publisher.republish(delivery, retryCount);
            log.info("RETRY_PUBLISHED: retryCount={}", retryCount);
        } catch (RuntimeException e) {
            log.error("RETRY_REPUBLISH_FAILED: message dropped from retry path, retryCount={}", retryCount, e);
            metrics.republishFailed(delivery.queueName());
        } finally {
            MDC.clear();
        }
    }

    private void deadLetter(InboundDelivery delivery, int maxAttempts, String reason) {
        boolean settled = acknowledger.reject(delivery, false);
        if (!settled) {
            return;
        }
        metrics.deadLettered(delivery.queueName());
        if (properties.isEnableDeadLetterQueue()) {
            log.error("DEAD_LETTERED: retries exhausted ({}/{}), reason={}", delivery.retryCount(), maxAttempts, reason);
        } else {
            log.error("MESSAGE_DISCARDED: retries exhausted ({}/{}) and no dead-letter queue, reason={}",
                    delivery.retryCount(), maxAttempts, reason);
        }
    }
}
