package com.eda.delivery.core.topology;

import com.eda.delivery.core.connection.ConnectionManager;
import com.eda.delivery.core.messaging.exception.TopologyConfigurationException;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ShutdownSignalException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Declarable;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.Exchange;
import org.springframework.amqp.core.ExchangeBuilder;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.util.Assert;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Declares queues, exchanges and bindings for a base queue name.
 *
 * Topology for queue {@code Q}:
 * - Q (main queue) - x-dead-letter-exchange=Q.dlx, x-dead-letter-routing-key=Q.dlq
 * - Q.dlx (direct exchange) + Q.dlq (durable queue), bound with routing key Q.dlq
 * - Q.delayed (direct exchange) + Q.delayed (durable queue), declared lazily on the first
 *   delayed publish: x-message-ttl=delay, x-dead-letter-exchange="" (default exchange),
 *   x-dead-letter-routing-key=Q. Expired messages are dead-lettered by the broker into Q.
 *
 * Declarations are cached per queue name. A request whose options differ from what was already
 * declared fails with {@link TopologyConfigurationException} instead of reaching the broker,
 * and a 406 PRECONDITION_FAILED from the broker is surfaced the same way.
 */
@RequiredArgsConstructor
@Slf4j
public class TopologyBuilder {

    private final ConnectionManager connectionManager;
    private final ConcurrentMap<String, QueueTopology> declared = new ConcurrentHashMap<>();

    /**
     * Make sure the topology for {@code queueName} exists on the broker.
     *
     * @return the declared topology, including delayed members when a delay is requested
     * @throws TopologyConfigurationException if the queue exists with different arguments
     */
    public QueueTopology ensureTopology(String queueName, TopologyOptions options) {
        Assert.hasText(queueName, "queueName must not be empty");
        Assert.notNull(options, "options must not be null");

        QueueTopology topology = ensureQueue(queueName, options);
        if (!options.isDelayed()) {
            return topology;
        }
        return ensureDelayed(topology, options.delay());
    }

    public Optional<QueueTopology> getDeclared(String queueName) {
        return Optional.ofNullable(declared.get(queueName));
    }

    /**
     * Forget everything declared so far; the next request re-declares.
     * Called after the connection or channel was recovered.
     */
    public void invalidate() {
        declared.clear();
        log.debug("Topology cache invalidated");
    }

    // ============================================================
    // Main queue + dead letter
    // ============================================================

    private QueueTopology ensureQueue(String queueName, TopologyOptions options) {
        QueueTopology existing = declared.get(queueName);
        if (existing != null) {
            assertCompatible(existing, options);
            return existing;
        }

        List<Declarable> declarables = new ArrayList<>();
        QueueBuilder mainQueue = options.durable()
                ? QueueBuilder.durable(queueName)
                : QueueBuilder.nonDurable(queueName);

        if (options.enableDeadLetter()) {
            String dlxName = QueueNames.deadLetterExchange(queueName);
            String dlqName = QueueNames.deadLetterQueue(queueName);

            DirectExchange deadLetterExchange = ExchangeBuilder
                    .directExchange(dlxName)
                    .durable(true)
                    .build();
            Queue deadLetterQueue = QueueBuilder
                    .durable(dlqName)
                    .build();
            Binding deadLetterBinding = BindingBuilder
                    .bind(deadLetterQueue)
                    .to(deadLetterExchange)
                    .with(dlqName);

            declarables.add(deadLetterExchange);
            declarables.add(deadLetterQueue);
            declarables.add(deadLetterBinding);

            mainQueue.deadLetterExchange(dlxName)
                    .deadLetterRoutingKey(dlqName);
        }
        declarables.add(mainQueue.build());

        declare(queueName, declarables);

        QueueTopology topology = QueueTopology.of(queueName, options.durable(), options.enableDeadLetter());
        QueueTopology raced = declared.putIfAbsent(queueName, topology);
        if (raced != null) {
            assertCompatible(raced, options);
            return raced;
        }

        log.info("TOPOLOGY_DECLARED: queue={}, durable={}, deadLetterQueue={}",
                queueName, options.durable(), topology.deadLetterQueue());
        return topology;
    }

    private void assertCompatible(QueueTopology existing, TopologyOptions requested) {
        if (existing.durable() != requested.durable()
                || existing.hasDeadLetter() != requested.enableDeadLetter()) {
            throw new TopologyConfigurationException(existing.queueName(), String.format(
                    "declared with durable=%s, deadLetter=%s but requested durable=%s, deadLetter=%s",
                    existing.durable(), existing.hasDeadLetter(),
                    requested.durable(), requested.enableDeadLetter()));
        }
    }

    // ============================================================
    // Delayed exchange + queue
    // ============================================================

    private QueueTopology ensureDelayed(QueueTopology topology, Duration delay) {
        String queueName = topology.queueName();
        if (topology.isDelayed()) {
            assertSameDelay(topology, delay);
            return topology;
        }

        String delayedName = QueueNames.delayedQueue(queueName);

        DirectExchange delayedExchange = ExchangeBuilder
                .directExchange(QueueNames.delayedExchange(queueName))
                .durable(true)
                .build();
        Queue delayedQueue = QueueBuilder
                .durable(delayedName)
                .ttl((int) delay.toMillis())
                .deadLetterExchange(QueueNames.DEFAULT_EXCHANGE)
                .deadLetterRoutingKey(queueName)
                .build();
        Binding delayedBinding = BindingBuilder
                .bind(delayedQueue)
                .to(delayedExchange)
                .with(delayedName);

        declare(queueName, List.of(delayedExchange, delayedQueue, delayedBinding));

        // The entry may have been invalidated or extended by another thread meanwhile
        QueueTopology stored = declared.compute(queueName, (name, current) -> {
            if (current == null) {
                return topology.withDelayed(delay);
            }
            return current.isDelayed() ? current : current.withDelayed(delay);
        });
        assertSameDelay(stored, delay);

        log.info("TOPOLOGY_DECLARED: delayedQueue={}, ttlMs={}, target={}",
                delayedName, delay.toMillis(), queueName);
        return stored;
    }

    /**
     * The broker only sees whole milliseconds, so delays are compared at that precision.
     */
    private static void assertSameDelay(QueueTopology topology, Duration delay) {
        if (topology.delay().toMillis() != delay.toMillis()) {
            throw new TopologyConfigurationException(topology.queueName(), String.format(
                    "delayed queue %s declared with x-message-ttl=%dms but requested %dms",
                    topology.delayedQueue(), topology.delay().toMillis(), delay.toMillis()));
        }
    }

    // ============================================================
    // Broker calls
    // ============================================================

    private void declare(String queueName, List<Declarable> declarables) {
        try {
            connectionManager.execute(channel -> {
                for (Declarable declarable : declarables) {
                    apply(channel, declarable);
                }
                return null;
            });
        } catch (AmqpException e) {
            if (isPreconditionFailed(e)) {
                log.error("TOPOLOGY_CONFLICT: queue={}", queueName, e);
                throw new TopologyConfigurationException(queueName,
                        "broker rejected declaration with 406 PRECONDITION_FAILED", e);
            }
            throw e;
        }
    }

    private static void apply(Channel channel, Declarable declarable) throws IOException {
        if (declarable instanceof Exchange exchange) {
            channel.exchangeDeclare(exchange.getName(), exchange.getType(),
                    exchange.isDurable(), exchange.isAutoDelete(), exchange.getArguments());
        } else if (declarable instanceof Queue queue) {
            channel.queueDeclare(queue.getName(), queue.isDurable(),
                    queue.isExclusive(), queue.isAutoDelete(), queue.getArguments());
        } else if (declarable instanceof Binding binding) {
            channel.queueBind(binding.getDestination(), binding.getExchange(),
                    binding.getRoutingKey(), binding.getArguments());
        } else {
            throw new IllegalArgumentException("Unsupported declarable: " + declarable.getClass());
        }
    }

    static boolean isPreconditionFailed(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof ShutdownSignalException signal
                    && signal.getReason() instanceof AMQP.Channel.Close close) {
                return close.getReplyCode() == AMQP.PRECONDITION_FAILED;
            }
        }
        return false;
    }
}
