package com.eda.delivery.core.connection;

import com.eda.delivery.core.config.DeliveryProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;

/**
 * Verifies the broker is usable by declaring and deleting a temporary server-named queue
 * on the managed channel.
 */
@RequiredArgsConstructor
@Slf4j
public class BrokerHealthProbe {

    private final ConnectionManager connectionManager;
    private final DeliveryProperties properties;

    public BrokerHealth check() {
        if (!connectionManager.isOpen()) {
            return BrokerHealth.down("RabbitMQ connection could not be established.");
        }
        try {
            connectionManager.execute(channel -> {
                String probeQueue = channel.queueDeclare().getQueue();
                channel.queueDelete(probeQueue);
                return null;
            });
            return BrokerHealth.up("RabbitMQ is healthy. Connected to "
                    + properties.getHost() + ":" + properties.getPort());
        } catch (AmqpException e) {
            log.warn("RabbitMQ health check failed", e);
            return BrokerHealth.down("RabbitMQ health check failed: " + e.getMessage());
        }
    }

    public record BrokerHealth(boolean healthy, String detail) {

        static BrokerHealth up(String detail) {
            return new BrokerHealth(true, detail);
        }

        static BrokerHealth down(String detail) {
            return new BrokerHealth(false, detail);
        }
    }
}
