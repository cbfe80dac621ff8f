package com.eda.delivery.core.messaging.consumer;

import com.eda.delivery.core.connection.ConnectionManager;
import com.rabbitmq.client.Channel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;

/**
 * Settles deliveries on the managed channel.
 *
 * A delivery tag belongs to the channel it arrived on. If that channel has since been
 * replaced the broker has already requeued the message, so settling is skipped: acking an
 * unknown tag would make the broker close the new channel as well.
 */
@RequiredArgsConstructor
@Slf4j
public class DeliveryAcknowledger {

    private final ConnectionManager connectionManager;

    /**
     * @return true if the ack reached the broker
     */
    public boolean ack(InboundDelivery delivery) {
        return settle(delivery, "ack", channel -> channel.basicAck(delivery.deliveryTag(), false));
    }

    /**
     * Negative acknowledgement. Without requeue the broker dead-letters the message when
     * the queue has a dead-letter exchange, and drops it otherwise.
     *
     * @return true if the nack reached the broker
     */
    public boolean reject(InboundDelivery delivery, boolean requeue) {
        return settle(delivery, requeue ? "nack(requeue)" : "nack",
                channel -> channel.basicNack(delivery.deliveryTag(), false, requeue));
    }

    private boolean settle(InboundDelivery delivery, String operation, Settlement settlement) {
        try {
            return connectionManager.execute(channel -> {
                if (delivery.channel() != null && delivery.channel() != channel) {
                    log.warn("DELIVERY_STALE: skipping {} for deliveryTag={}, its channel was replaced",
                            operation, delivery.deliveryTag());
                    return false;
                }
                settlement.apply(channel);
                return true;
            });
        } catch (AmqpException e) {
            log.error("SETTLE_FAILED: {} for deliveryTag={} did not reach the broker",
                    operation, delivery.deliveryTag(), e);
            return false;
        }
    }

    @FunctionalInterface
    private interface Settlement {
        void apply(Channel channel) throws Exception;
    }
}
