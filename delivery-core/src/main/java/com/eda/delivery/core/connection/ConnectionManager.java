package com.eda.delivery.core.connection;

import com.eda.delivery.core.config.DeliveryProperties;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.Recoverable;
import com.rabbitmq.client.RecoveryListener;
import com.rabbitmq.client.ShutdownSignalException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.amqp.AmqpIllegalStateException;
import org.springframework.amqp.AmqpResourceNotAvailableException;
import org.springframework.amqp.rabbit.core.ChannelCallback;
import org.springframework.amqp.rabbit.support.RabbitExceptionTranslator;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the single broker connection and the single channel shared by publishing,
 * topology declaration and acknowledgements.
 *
 * Key Features:
 * - Automatic connection recovery (client-side) with a bounded recovery interval
 * - Topology recovery disabled: consumers are re-subscribed by {@link ChannelRecoveryListener}s
 * - Single-writer discipline: every channel operation runs through {@link #execute(ChannelCallback)}
 *   under one lock; delivery callbacks arrive on the client's own dispatch threads
 * - Replacement channel when a channel-level error (e.g. 406 on a conflicting declare) closed it
 * - Deterministic shutdown: channel first, then connection
 */
@Slf4j
public class ConnectionManager implements RecoveryListener, AutoCloseable {

    private final ConnectionFactory connectionFactory;
    private final DeliveryProperties properties;
    private final ReentrantLock channelLock = new ReentrantLock();
    private final List<ChannelRecoveryListener> recoveryListeners = new CopyOnWriteArrayList<>();

    private volatile Connection connection;
    private volatile Channel channel;
    private volatile boolean closed;
    private boolean channelReplaced;

    public ConnectionManager(ConnectionFactory connectionFactory, DeliveryProperties properties) {
        this.connectionFactory = connectionFactory;
        this.properties = properties;
    }

    /**
     * Build the client connection factory from configuration.
     */
    public static ConnectionFactory createConnectionFactory(DeliveryProperties properties) {
        ConnectionFactory factory = new ConnectionFactory();
        factory.setHost(properties.getHost());
        factory.setPort(properties.getPort());
        factory.setUsername(properties.getUsername());
        factory.setPassword(properties.getPassword());
        factory.setVirtualHost(properties.getVirtualHost());
        factory.setConnectionTimeout((int) properties.getConnectionTimeout().toMillis());
        factory.setRequestedHeartbeat((int) properties.getRequestedHeartbeat().toSeconds());
        factory.setAutomaticRecoveryEnabled(properties.isAutomaticRecovery());
        factory.setNetworkRecoveryInterval(properties.getNetworkRecoveryInterval().toMillis());
        factory.setTopologyRecoveryEnabled(false);
        return factory;
    }

    // ============================================================
    // Lifecycle
    // ============================================================

    /**
     * Open the connection and the shared channel. Idempotent while the connection is open.
     *
     * @throws AmqpConnectException if the broker is unreachable or refuses the credentials
     */
    public void connect() {
        channelLock.lock();
        try {
            assertNotClosed();
            if (connection != null && connection.isOpen()) {
                return;
            }

            log.info("Connecting to RabbitMQ: host={}, port={}, virtualHost={}",
                    properties.getHost(), properties.getPort(), properties.getVirtualHost());

            connection = connectionFactory.newConnection(properties.getConnectionName());
            if (connection instanceof Recoverable recoverable) {
                recoverable.addRecoveryListener(this);
            }
            channel = openChannel(connection);

            log.info("RabbitMQ connection established: publisherConfirms={}, automaticRecovery={}",
                    properties.isEnablePublisherConfirms(), properties.isAutomaticRecovery());

        } catch (IOException | TimeoutException e) {
            log.error("Failed to establish RabbitMQ connection: host={}, port={}",
                    properties.getHost(), properties.getPort(), e);
            throw new AmqpConnectException(
                    "Failed to connect to RabbitMQ at " + properties.getHost() + ":" + properties.getPort(), e);
        } finally {
            channelLock.unlock();
        }
    }

    /**
     * Close channel then connection. Safe to call more than once.
     */
    @Override
    public void close() {
        channelLock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;

            if (channel != null && channel.isOpen()) {
                try {
                    channel.close();
                } catch (IOException | TimeoutException e) {
                    log.warn("Error closing RabbitMQ channel", e);
                }
            }
            if (connection != null && connection.isOpen()) {
                try {
                    connection.close();
                } catch (IOException e) {
                    log.warn("Error closing RabbitMQ connection", e);
                }
            }
            log.info("RabbitMQ connection closed");
        } finally {
            channelLock.unlock();
        }
    }

    public boolean isOpen() {
        Connection current = connection;
        return !closed && current != null && current.isOpen();
    }

    public void addRecoveryListener(ChannelRecoveryListener listener) {
        recoveryListeners.add(listener);
    }

    // ============================================================
    // Channel access
    // ============================================================

    /**
     * Current shared channel, opening a replacement if the previous one was closed.
     * Callers must not use the returned channel for writes outside {@link #execute}.
     */
    public Channel getChannel() {
        return execute(ch -> ch);
    }

    /**
     * Run a callback against the shared channel while holding the channel lock.
     * Checked client exceptions and shutdown signals are translated into the
     * {@link org.springframework.amqp.AmqpException} hierarchy; other runtime exceptions pass through.
     */
    public <T> T execute(ChannelCallback<T> callback) {
        boolean notify = false;
        channelLock.lock();
        try {
            Channel current = currentChannel();
            try {
                return callback.doInRabbit(current);
            } catch (ShutdownSignalException e) {
                throw RabbitExceptionTranslator.convertRabbitAccessException(e);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw RabbitExceptionTranslator.convertRabbitAccessException(e);
            } finally {
                if (!current.isOpen()) {
                    reopenChannelAfterFailure();
                }
            }
        } finally {
            // Listeners run after the outermost release so they never wait on the lock
            // while another thread holds a lock they need.
            if (channelLock.getHoldCount() == 1 && channelReplaced) {
                channelReplaced = false;
                notify = true;
            }
            channelLock.unlock();
            if (notify) {
                notifyListeners(ChannelRecoveryListener.Reason.CHANNEL_REPLACED);
            }
        }
    }

    private Channel currentChannel() {
        assertNotClosed();
        if (connection == null) {
            throw new AmqpIllegalStateException("RabbitMQ connection not initialized; call connect() first");
        }
        Channel current = channel;
        if (current != null && current.isOpen()) {
            return current;
        }
        if (!connection.isOpen()) {
            throw new AmqpConnectException("RabbitMQ connection is not open (recovery may be in progress)", null);
        }
        try {
            channel = openChannel(connection);
            channelReplaced = true;
            log.warn("CHANNEL_REPLACED: previous channel was closed");
            return channel;
        } catch (IOException e) {
            throw RabbitExceptionTranslator.convertRabbitAccessException(e);
        }
    }

    private void reopenChannelAfterFailure() {
        if (closed || connection == null || !connection.isOpen()) {
            return;
        }
        try {
            channel = openChannel(connection);
            channelReplaced = true;
            log.warn("CHANNEL_REPLACED: channel closed by broker, opened a new one");
        } catch (IOException | RuntimeException e) {
            log.error("Failed to reopen RabbitMQ channel", e);
        }
    }

    private Channel openChannel(Connection conn) throws IOException {
        Channel opened = conn.createChannel();
        if (opened == null) {
            throw new AmqpResourceNotAvailableException("The channel limit of the RabbitMQ connection was reached");
        }
        if (properties.isEnablePublisherConfirms()) {
            opened.confirmSelect();
        }
        return opened;
    }

    private void assertNotClosed() {
        if (closed) {
            throw new AmqpIllegalStateException("ConnectionManager is closed");
        }
    }

    // ============================================================
    // Recovery
    // ============================================================

    @Override
    public void handleRecoveryStarted(Recoverable recoverable) {
        log.warn("RabbitMQ connection lost, automatic recovery started");
    }

    @Override
    public void handleRecovery(Recoverable recoverable) {
        log.info("RabbitMQ connection recovered");
        notifyListeners(ChannelRecoveryListener.Reason.CONNECTION_RECOVERED);
    }

    private void notifyListeners(ChannelRecoveryListener.Reason reason) {
        for (ChannelRecoveryListener listener : recoveryListeners) {
            try {
                listener.onChannelRecovered(reason);
            } catch (RuntimeException e) {
                log.error("Recovery listener failed: reason={}", reason, e);
            }
        }
    }
}
