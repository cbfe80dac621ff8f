package com.eda.delivery.core.support;

import com.eda.delivery.core.connection.ConnectionManager;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ShutdownSignalException;
import org.springframework.amqp.rabbit.core.ChannelCallback;
import org.springframework.amqp.rabbit.support.RabbitExceptionTranslator;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * Test helpers for components that talk to the broker through a mocked {@link ConnectionManager}.
 */
public final class ChannelStubs {

    private ChannelStubs() {
    }

    /**
     * Make {@code connectionManager.execute} run callbacks on {@code channel}, translating
     * checked exceptions the way the real manager does.
     */
    public static void executeOn(ConnectionManager connectionManager, Channel channel) {
        when(connectionManager.execute(any())).thenAnswer(invocation -> {
            ChannelCallback<?> callback = invocation.getArgument(0);
            try {
                return callback.doInRabbit(channel);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw RabbitExceptionTranslator.convertRabbitAccessException(e);
            }
        });
    }

    /**
     * The shutdown signal a channel-level 406 produces.
     */
    public static ShutdownSignalException preconditionFailed(Channel channel, String text) {
        AMQP.Channel.Close close = new AMQP.Channel.Close.Builder()
                .replyCode(AMQP.PRECONDITION_FAILED)
                .replyText("PRECONDITION_FAILED - " + text)
                .classId(50)
                .methodId(10)
                .build();
        return new ShutdownSignalException(false, false, close, channel);
    }
}
