package com.eda.delivery.worker.messaging.exception;

import lombok.Getter;

/**
 * Exception thrown when an order breaks a business rule.
 *
 * Key Difference:
 * - OrderValidationException => DON'T RETRY (the order itself is invalid, retrying won't fix it)
 * - Any other exception => RETRY (transient technical failure)
 */
@Getter
public class OrderValidationException extends RuntimeException {

    private final String reason;

    public OrderValidationException(String reason) {
        super("Order validation failed: " + reason);
        this.reason = reason;
    }

    public OrderValidationException(String reason, Object... args) {
        super(String.format("Order validation failed: " + reason, args));
        this.reason = String.format(reason, args);
    }
}
