package com.eda.delivery.core.messaging.consumer;

import com.eda.delivery.core.config.DeliveryProperties;
import com.eda.delivery.core.connection.ChannelRecoveryListener;
import com.eda.delivery.core.connection.ConnectionManager;
import com.eda.delivery.core.messaging.codec.JsonPayloadCodec;
import com.eda.delivery.core.messaging.exception.ConsumerAlreadyRegisteredException;
import com.eda.delivery.core.messaging.exception.TopologyConfigurationException;
import com.eda.delivery.core.messaging.metrics.DeliveryMetrics;
import com.eda.delivery.core.messaging.retry.RetryCoordinator;
import com.eda.delivery.core.topology.TopologyBuilder;
import com.eda.delivery.core.topology.TopologyOptions;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.util.Assert;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tracks the single active consumer per queue name.
 *
 * Key Features:
 * - startConsuming declares the queue topology (dead-letter per configuration), applies the
 *   prefetch limit and subscribes with manual acknowledgements
 * - A second startConsuming for a queue that already has a consumer is refused
 * - stopConsuming cancels the broker consumer; handlers already running finish and settle normally
 * - After connection recovery or a channel replacement every registration is subscribed again;
 *   a registration whose queue now conflicts with the broker's declaration is dropped
 * - A broker-initiated cancel (queue deleted) drops the registration
 *
 * Start, stop and re-subscription are serialized by one registry lock. The registry lock is
 * always taken before the channel lock.
 */
@RequiredArgsConstructor
@Slf4j
public class ConsumerRegistry implements ChannelRecoveryListener {

    private static final int MAX_RECOVERY_PASSES = 3;

    private final ConnectionManager connectionManager;
    private final TopologyBuilder topologyBuilder;
    private final JsonPayloadCodec codec;
    private final DeliveryAcknowledger acknowledger;
    private final RetryCoordinator retryCoordinator;
    private final DeliveryProperties properties;
    private final DeliveryMetrics metrics;

    private final ConcurrentMap<String, ConsumerRegistration> registrations = new ConcurrentHashMap<>();
    private final ReentrantLock registryLock = new ReentrantLock();

    // Guarded by registryLock
    private boolean recovering;
    private boolean recoveryRequested;

    // ============================================================
    // Registration
    // ============================================================

    /**
     * @throws ConsumerAlreadyRegisteredException if {@code queueName} already has a consumer
     */
    public <T> ConsumerRegistration startConsuming(String queueName, Class<T> payloadType, MessageHandler<T> handler) {
        Assert.notNull(handler, "handler must not be null");
        return startConsumingAsync(queueName, payloadType, AsyncMessageHandler.from(handler));
    }

    /**
     * Like {@link #startConsuming}, for handlers that complete asynchronously.
     *
     * @throws ConsumerAlreadyRegisteredException if {@code queueName} already has a consumer
     */
    public <T> ConsumerRegistration startConsumingAsync(String queueName, Class<T> payloadType,
                                                        AsyncMessageHandler<T> handler) {
        Assert.hasText(queueName, "queueName must not be empty");
        Assert.notNull(payloadType, "payloadType must not be null");
        Assert.notNull(handler, "handler must not be null");

        registryLock.lock();
        try {
            ConsumerRegistration existing = registrations.get(queueName);
            if (existing != null) {
                log.warn("CONSUMER_ALREADY_REGISTERED: queue={}, consumerTag={}", queueName, existing.getConsumerTag());
                throw new ConsumerAlreadyRegisteredException(queueName, existing.getConsumerTag());
            }

            DeliveryHandler<T> deliveryHandler = new DeliveryHandler<>(
                    payloadType, handler, codec, acknowledger, retryCoordinator, metrics);
            ConsumerRegistration registration = new ConsumerRegistration(queueName, payloadType, deliveryHandler);

            subscribe(registration);
            registrations.put(queueName, registration);

            log.info("CONSUMER_STARTED: queue={}, consumerTag={}, prefetch={}",
                    queueName, registration.getConsumerTag(), properties.getPrefetchCount());
            return registration;
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * Cancel the consumer for {@code queueName}. Does nothing if there is none.
     *
     * @return true if a consumer was stopped
     */
    public boolean stopConsuming(String queueName) {
        registryLock.lock();
        try {
            ConsumerRegistration registration = registrations.remove(queueName);
            if (registration == null) {
                log.debug("No consumer registered for queue={}", queueName);
                return false;
            }
            registration.cancel();

            try {
                connectionManager.execute(channel -> {
                    channel.basicCancel(registration.getConsumerTag());
                    return null;
                });
                log.info("CONSUMER_STOPPED: queue={}, consumerTag={}", queueName, registration.getConsumerTag());
            } catch (AmqpException e) {
                // The broker drops consumers of a closed channel on its own
                log.error("Error cancelling consumer: queue={}, consumerTag={}",
                        queueName, registration.getConsumerTag(), e);
            }
            return true;
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * Stop every consumer. Used on shutdown, before the connection is closed.
     */
    public void stopAll() {
        List.copyOf(registrations.keySet()).forEach(this::stopConsuming);
    }

    public boolean isConsuming(String queueName) {
        return registrations.containsKey(queueName);
    }

    public Set<String> activeQueues() {
        return new TreeSet<>(registrations.keySet());
    }

    public Optional<ConsumerRegistration> getRegistration(String queueName) {
        return Optional.ofNullable(registrations.get(queueName));
    }

    // ============================================================
    // Recovery
    // ============================================================

    @Override
    public void onChannelRecovered(Reason reason) {
        registryLock.lock();
        try {
            if (recovering) {
                // A re-subscription in this pass replaced the channel; handled once the pass ends
                recoveryRequested = true;
                log.debug("Channel replaced during re-subscription, another pass queued: reason={}", reason);
                return;
            }
            recovering = true;
            try {
                int pass = 0;
                do {
                    recoveryRequested = false;
                    pass++;
                    resubscribeAll(reason, pass);
                } while (recoveryRequested && pass < MAX_RECOVERY_PASSES);

                if (recoveryRequested) {
                    log.error("CONSUMER_RECOVERY_ABANDONED: channel kept failing after {} passes, queues={}",
                            pass, activeQueues());
                }
            } finally {
                recovering = false;
                recoveryRequested = false;
            }
        } finally {
            registryLock.unlock();
        }
    }

    private void resubscribeAll(Reason reason, int pass) {
        topologyBuilder.invalidate();
        if (registrations.isEmpty()) {
            return;
        }
        log.info("Re-subscribing {} consumer(s) after {}, pass={}", registrations.size(), reason, pass);
        // Later passes follow a channel replacement; subscriptions already made on the new channel are live
        Channel current = pass > 1 ? connectionManager.getChannel() : null;
        for (ConsumerRegistration registration : registrations.values()) {
            if (registration.isCancelled() || registration.isSubscribedOn(current)) {
                continue;
            }
            try {
                subscribe(registration);
                log.info("CONSUMER_RESUBSCRIBED: queue={}, consumerTag={}",
                        registration.getQueueName(), registration.getConsumerTag());
            } catch (TopologyConfigurationException e) {
                // The queue now exists with other arguments; this registration can never subscribe again
                registrations.remove(registration.getQueueName(), registration);
                registration.cancel();
                log.error("CONSUMER_DROPPED_TOPOLOGY_CONFLICT: queue={}, reason={}",
                        registration.getQueueName(), e.getMessage());
            } catch (AmqpException e) {
                log.error("CONSUMER_RESUBSCRIBE_FAILED: queue={}", registration.getQueueName(), e);
            }
        }
    }

    private void subscribe(ConsumerRegistration registration) {
        String queueName = registration.getQueueName();
        topologyBuilder.ensureTopology(queueName, TopologyOptions.from(properties));

        connectionManager.execute(channel -> {
            channel.basicQos(properties.getPrefetchCount(), false);
            String consumerTag = channel.basicConsume(queueName, false, new RegistrationConsumer(channel, registration));
            registration.updateSubscription(channel, consumerTag);
            return consumerTag;
        });
    }

    // ============================================================
    // Broker callbacks
    // ============================================================

    private class RegistrationConsumer extends DefaultConsumer {

        private final ConsumerRegistration registration;

        RegistrationConsumer(Channel channel, ConsumerRegistration registration) {
            super(channel);
            this.registration = registration;
        }

        @Override
        public void handleDelivery(String consumerTag, Envelope envelope,
                                   AMQP.BasicProperties properties, byte[] body) {
            InboundDelivery delivery = InboundDelivery.from(
                    getChannel(), registration.getQueueName(), envelope, properties, body);
            try {
                registration.getDeliveryHandler().onDelivery(registration, delivery);
            } catch (RuntimeException e) {
                // An exception escaping here would make the client close the shared channel
                log.error("Unexpected error handling delivery: queue={}, deliveryTag={}",
                        registration.getQueueName(), envelope.getDeliveryTag(), e);
                acknowledger.reject(delivery, false);
            }
        }

        @Override
        public void handleCancel(String consumerTag) {
            if (registrations.remove(registration.getQueueName(), registration)) {
                registration.cancel();
            }
            log.warn("CONSUMER_CANCELLED_BY_BROKER: queue={}, consumerTag={}",
                    registration.getQueueName(), consumerTag);
        }

        @Override
        public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
            log.debug("Consumer channel shut down: queue={}, consumerTag={}, reason={}",
                    registration.getQueueName(), consumerTag, sig.getMessage());
        }
    }
}
