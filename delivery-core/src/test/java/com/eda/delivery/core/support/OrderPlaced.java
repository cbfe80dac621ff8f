package com.eda.delivery.core.support;

/**
 * Sample payload for tests.
 */
public record OrderPlaced(String orderId, int quantity) {
}
