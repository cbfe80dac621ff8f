package com.eda.delivery.worker.messaging.consumer;

import com.eda.delivery.worker.event.OrderPlacedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

class OrderPlacedConsumerTest {

    private OrderLedger ledger;
    private OrderPlacedConsumer consumer;

    @BeforeEach
    void setUp() {
        ledger = new OrderLedger();
        consumer = new OrderPlacedConsumer(ledger);
    }

    @Test
    void validOrderIsAccepted() {
        OrderPlacedEvent order = OrderPlacedEvent.create("customer-1", new BigDecimal("19.90"), "EUR");

        assertThat(consumer.handle(order)).isTrue();
        assertThat(ledger.outcomeOf(order.orderId())).contains(OrderLedger.Outcome.ACCEPTED);
    }

    @Test
    void invalidOrderIsRejectedWithoutRetry() {
        OrderPlacedEvent order = OrderPlacedEvent.create("customer-1", BigDecimal.ZERO, "EUR");

        assertThat(consumer.handle(order)).isTrue();
        assertThat(ledger.outcomeOf(order.orderId())).contains(OrderLedger.Outcome.REJECTED);
    }

    @Test
    void unsupportedCurrencyIsRejected() {
        OrderPlacedEvent order = OrderPlacedEvent.create("customer-1", BigDecimal.TEN, "XYZ");

        assertThat(consumer.handle(order)).isTrue();
        assertThat(ledger.outcomeOf(order.orderId())).contains(OrderLedger.Outcome.REJECTED);
    }

    @Test
    void duplicateDeliveryIsSkipped() {
        OrderLedger spyLedger = spy(new OrderLedger());
        OrderPlacedConsumer idempotentConsumer = new OrderPlacedConsumer(spyLedger);
        OrderPlacedEvent order = OrderPlacedEvent.create("customer-1", BigDecimal.TEN, "USD");

        idempotentConsumer.handle(order);
        assertThat(idempotentConsumer.handle(order)).isTrue();

        verify(spyLedger, times(1)).accept(order);
    }

    @Test
    void orderWithoutIdIsRejectedWithoutRetry() {
        OrderPlacedEvent order = new OrderPlacedEvent(null, "customer-1", BigDecimal.TEN, "EUR", Instant.now());

        assertThat(consumer.handle(order)).isTrue();
        assertThat(ledger.unidentifiedRejections()).isEqualTo(1);
    }

    @Test
    void ledgerFailureTriggersRetry() {
        OrderLedger failingLedger = mock(OrderLedger.class);
        doThrow(new IllegalStateException("ledger unavailable")).when(failingLedger).accept(any());
        OrderPlacedConsumer failingConsumer = new OrderPlacedConsumer(failingLedger);

        OrderPlacedEvent order = new OrderPlacedEvent(UUID.randomUUID(), "customer-1", BigDecimal.ONE, "GBP", Instant.now());

        assertThat(failingConsumer.handle(order)).isFalse();
    }
}
