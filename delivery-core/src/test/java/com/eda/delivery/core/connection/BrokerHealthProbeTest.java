package com.eda.delivery.core.connection;

import com.eda.delivery.core.config.DeliveryProperties;
import com.eda.delivery.core.support.ChannelStubs;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

class BrokerHealthProbeTest {

    private ConnectionManager connectionManager;
    private Channel channel;
    private BrokerHealthProbe probe;

    @BeforeEach
    void setUp() {
        connectionManager = mock(ConnectionManager.class);
        channel = mock(Channel.class);
        ChannelStubs.executeOn(connectionManager, channel);
        probe = new BrokerHealthProbe(connectionManager, new DeliveryProperties());
    }

    @Test
    void downWhenConnectionIsNotOpen() {
        when(connectionManager.isOpen()).thenReturn(false);

        BrokerHealthProbe.BrokerHealth health = probe.check();

        assertThat(health.healthy()).isFalse();
        verifyNoInteractions(channel);
    }

    @Test
    void upWhenTemporaryQueueCanBeDeclaredAndDeleted() throws IOException {
        when(connectionManager.isOpen()).thenReturn(true);
        AMQP.Queue.DeclareOk declareOk = mock(AMQP.Queue.DeclareOk.class);
        when(declareOk.getQueue()).thenReturn("amq.gen-probe");
        when(channel.queueDeclare()).thenReturn(declareOk);

        BrokerHealthProbe.BrokerHealth health = probe.check();

        assertThat(health.healthy()).isTrue();
        assertThat(health.detail()).contains("localhost:5672");
        verify(channel).queueDelete("amq.gen-probe");
    }

    @Test
    void downWhenBrokerRefusesDeclaration() throws IOException {
        when(connectionManager.isOpen()).thenReturn(true);
        when(channel.queueDeclare()).thenThrow(new IOException("access refused"));

        BrokerHealthProbe.BrokerHealth health = probe.check();

        assertThat(health.healthy()).isFalse();
        assertThat(health.detail()).startsWith("RabbitMQ health check failed");
    }
}
