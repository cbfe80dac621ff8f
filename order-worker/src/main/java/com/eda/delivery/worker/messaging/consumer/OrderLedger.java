package com.eda.delivery.worker.messaging.consumer;

import com.eda.delivery.worker.event.OrderPlacedEvent;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory record of accepted and rejected orders, keyed by order id.
 * Doubles as the idempotency store for redelivered messages.
 *
 * Demo store only: entries are never evicted and nothing survives a restart.
 */
@Component
public class OrderLedger {

    public enum Outcome { ACCEPTED, REJECTED }

    private final Map<UUID, Outcome> outcomes = new ConcurrentHashMap<>();
    private final AtomicLong unidentifiedRejections = new AtomicLong();

    public boolean isProcessed(UUID orderId) {
        return outcomes.containsKey(orderId);
    }

    public void accept(OrderPlacedEvent order) {
        outcomes.put(order.orderId(), Outcome.ACCEPTED);
    }

    public void reject(OrderPlacedEvent order) {
        outcomes.put(order.orderId(), Outcome.REJECTED);
    }

    /**
     * Count a rejected order that carried no id and so cannot be keyed.
     */
    public void rejectUnidentified() {
        unidentifiedRejections.incrementAndGet();
    }

    public long unidentifiedRejections() {
        return unidentifiedRejections.get();
    }

    public Optional<Outcome> outcomeOf(UUID orderId) {
        return Optional.ofNullable(outcomes.get(orderId));
    }
}
