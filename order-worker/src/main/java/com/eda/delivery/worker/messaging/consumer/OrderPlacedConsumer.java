package com.eda.delivery.worker.messaging.consumer;

import com.eda.delivery.core.messaging.consumer.MessageHandler;
import com.eda.delivery.worker.event.OrderPlacedEvent;
import com.eda.delivery.worker.messaging.exception.OrderValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Handler for OrderPlaced events on the {@code orders} queue.
 *
 * Message Flow:
 * 1. Skip orders already in the ledger (duplicate delivery)
 * 2. Validate the order
 * 3. Record it as accepted
 *
 * Error Handling:
 * - Business validation failure (including a missing orderId) => recorded as rejected, acked, NOT retried
 * - Technical failure => returns false, the delivery subsystem retries and finally dead-letters
 *
 * Message identity, MDC context and acknowledgements are handled by the delivery subsystem.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderPlacedConsumer implements MessageHandler<OrderPlacedEvent> {

    private static final Set<String> SUPPORTED_CURRENCIES = Set.of("EUR", "USD", "GBP");

    private final OrderLedger ledger;

    @Override
    public boolean handle(OrderPlacedEvent order) {
        if (order.orderId() == null) {
            // Retrying cannot supply the missing id
            log.warn("BUSINESS_VALIDATION_FAILED: OrderPlaced event without orderId");
            ledger.rejectUnidentified();
            return true;
        }
        if (ledger.isProcessed(order.orderId())) {
            log.info("EVENT_SKIPPED_IDEMPOTENT: orderId={}", order.orderId());
            return true;
        }

        try {
            validate(order);
            ledger.accept(order);
            log.info("EVENT_PROCESSED: orderId={}, result=ACCEPTED", order.orderId());
            return true;

        } catch (OrderValidationException e) {
            log.warn("BUSINESS_VALIDATION_FAILED: orderId={}, reason={}", order.orderId(), e.getReason());
            ledger.reject(order);
            return true;

        } catch (RuntimeException e) {
            log.error("TECHNICAL_FAILURE: orderId={}", order.orderId(), e);
            return false;
        }
    }

    private void validate(OrderPlacedEvent order) {
        if (order.customerId() == null || order.customerId().isBlank()) {
            throw new OrderValidationException("customerId is required");
        }
        if (order.amount() == null || order.amount().compareTo(BigDecimal.ZERO) <= 0) {
            throw new OrderValidationException("amount must be positive, was %s", order.amount());
        }
        if (order.currency() == null || !SUPPORTED_CURRENCIES.contains(order.currency())) {
            throw new OrderValidationException("unsupported currency '%s'", order.currency());
        }
    }
}
