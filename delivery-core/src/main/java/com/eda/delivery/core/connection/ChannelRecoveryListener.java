package com.eda.delivery.core.connection;

/**
 * Callback fired by {@link ConnectionManager} after the shared channel became usable again.
 * Broker-side consumers and topology are not restored by the client; listeners re-assert them.
 */
@FunctionalInterface
public interface ChannelRecoveryListener {

    enum Reason {
        /** The client recovered the connection (and its channel) after a network failure. */
        CONNECTION_RECOVERED,
        /** The channel was closed by a channel-level error and a new one was opened. */
        CHANNEL_REPLACED
    }

    /**
     * Invoked without the channel lock held, so implementations may call back into the manager.
     */
    void onChannelRecovered(Reason reason);
}
