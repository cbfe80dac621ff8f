package com.eda.delivery.worker.config;

/**
 * Queue names consumed by the Order Worker.
 */
public final class WorkerQueues {

    public static final String ORDERS = "orders";

    private WorkerQueues() {
        // Prevent instantiation
    }
}
