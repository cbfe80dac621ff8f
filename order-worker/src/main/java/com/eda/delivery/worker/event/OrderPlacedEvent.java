package com.eda.delivery.worker.event;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Event published when a customer places an order.
 *
 * Consumed by: Order Worker (queue {@code orders})
 */
public record OrderPlacedEvent(
    UUID orderId,
    String customerId,
    BigDecimal amount,
    String currency,
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant placedAt
) {

    public static OrderPlacedEvent create(String customerId, BigDecimal amount, String currency) {
        return new OrderPlacedEvent(UUID.randomUUID(), customerId, amount, currency, Instant.now());
    }
}
