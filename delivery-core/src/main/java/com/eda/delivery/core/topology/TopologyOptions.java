package com.eda.delivery.core.topology;

import com.eda.delivery.core.config.DeliveryProperties;

import java.time.Duration;

/**
 * What to declare for a queue: durability, dead-lettering and an optional fixed delay.
 *
 * @param durable          declare the main queue durable
 * @param enableDeadLetter declare {@code Q.dlx}/{@code Q.dlq} and point the main queue at them
 * @param delay            declare {@code Q.delayed} with this TTL; null for none
 */
public record TopologyOptions(boolean durable, boolean enableDeadLetter, Duration delay) {

    public TopologyOptions {
        if (delay != null) {
            if (delay.isNegative() || delay.toMillis() < 1) {
                throw new IllegalArgumentException("delay must be at least 1ms: " + delay);
            }
            if (delay.toMillis() > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("delay exceeds the maximum queue TTL: " + delay);
            }
        }
    }

    public static TopologyOptions from(DeliveryProperties properties) {
        return new TopologyOptions(properties.isDurableQueues(), properties.isEnableDeadLetterQueue(), null);
    }

    public TopologyOptions withDelay(Duration newDelay) {
        return new TopologyOptions(durable, enableDeadLetter, newDelay);
    }

    public boolean isDelayed() {
        return delay != null;
    }
}
