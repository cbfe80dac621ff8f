package com.eda.delivery.core.topology;

import com.eda.delivery.core.connection.ConnectionManager;
import com.eda.delivery.core.messaging.exception.TopologyConfigurationException;
import com.eda.delivery.core.support.ChannelStubs;
import com.rabbitmq.client.Channel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.amqp.AmqpIOException;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class TopologyBuilderTest {

    private static final TopologyOptions DEAD_LETTER = new TopologyOptions(true, true, null);

    private ConnectionManager connectionManager;
    private Channel channel;
    private TopologyBuilder builder;

    @BeforeEach
    void setUp() {
        connectionManager = mock(ConnectionManager.class);
        channel = mock(Channel.class);
        ChannelStubs.executeOn(connectionManager, channel);
        builder = new TopologyBuilder(connectionManager);
    }

    @Test
    void declaresDeadLetterExchangeAndQueueBeforeMainQueue() throws IOException {
        QueueTopology topology = builder.ensureTopology("orders", DEAD_LETTER);

        InOrder inOrder = inOrder(channel);
        inOrder.verify(channel).exchangeDeclare(eq("orders.dlx"), eq("direct"), eq(true), eq(false), any());
        inOrder.verify(channel).queueDeclare(eq("orders.dlq"), eq(true), eq(false), eq(false), any());
        inOrder.verify(channel).queueBind(eq("orders.dlq"), eq("orders.dlx"), eq("orders.dlq"), any());
        inOrder.verify(channel).queueDeclare("orders", true, false, false, Map.of(
                "x-dead-letter-exchange", "orders.dlx",
                "x-dead-letter-routing-key", "orders.dlq"));

        assertThat(topology.deadLetterExchange()).isEqualTo("orders.dlx");
        assertThat(topology.deadLetterQueue()).isEqualTo("orders.dlq");
        assertThat(topology.isDelayed()).isFalse();
    }

    @Test
    void secondRequestWithSameOptionsDoesNotTouchBroker() throws IOException {
        builder.ensureTopology("orders", DEAD_LETTER);
        builder.ensureTopology("orders", DEAD_LETTER);

        verify(channel, times(1)).queueDeclare(eq("orders"), anyBoolean(), anyBoolean(), anyBoolean(), any());
        verify(connectionManager, times(1)).execute(any());
    }

    @Test
    void withoutDeadLetterOnlyMainQueueIsDeclared() throws IOException {
        QueueTopology topology = builder.ensureTopology("audit", new TopologyOptions(false, false, null));

        verify(channel, never()).exchangeDeclare(anyString(), anyString(), anyBoolean(), anyBoolean(), any());
        verify(channel).queueDeclare("audit", false, false, false, Map.of());
        assertThat(topology.hasDeadLetter()).isFalse();
        assertThat(topology.durable()).isFalse();
    }

    @Test
    void delayDeclaresTtlQueueThatDeadLettersIntoMainQueue() throws IOException {
        QueueTopology topology = builder.ensureTopology("orders", DEAD_LETTER.withDelay(Duration.ofSeconds(5)));

        InOrder inOrder = inOrder(channel);
        inOrder.verify(channel).queueDeclare(eq("orders"), eq(true), eq(false), eq(false), any());
        inOrder.verify(channel).exchangeDeclare(eq("orders.delayed"), eq("direct"), eq(true), eq(false), any());
        inOrder.verify(channel).queueDeclare("orders.delayed", true, false, false, Map.of(
                "x-message-ttl", 5000,
                "x-dead-letter-exchange", "",
                "x-dead-letter-routing-key", "orders"));
        inOrder.verify(channel).queueBind(eq("orders.delayed"), eq("orders.delayed"), eq("orders.delayed"), any());

        assertThat(topology.delayedExchange()).isEqualTo("orders.delayed");
        assertThat(topology.delay()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void differentDelayForDeclaredDelayedQueueIsRejectedLocally() throws IOException {
        builder.ensureTopology("orders", DEAD_LETTER.withDelay(Duration.ofSeconds(5)));
        clearInvocations(channel);

        assertThatThrownBy(() -> builder.ensureTopology("orders", DEAD_LETTER.withDelay(Duration.ofSeconds(10))))
                .isInstanceOf(TopologyConfigurationException.class)
                .hasMessageContaining("orders.delayed");

        verifyNoInteractions(channel);
    }

    @Test
    void sameDelayIsIdempotent() {
        QueueTopology first = builder.ensureTopology("orders", DEAD_LETTER.withDelay(Duration.ofSeconds(5)));
        QueueTopology second = builder.ensureTopology("orders", DEAD_LETTER.withDelay(Duration.ofSeconds(5)));

        assertThat(second).isEqualTo(first);
        verify(connectionManager, times(2)).execute(any());
    }

    @Test
    void delaysEqualAtMillisecondPrecisionAreTheSameDeclaration() {
        QueueTopology first = builder.ensureTopology("orders", DEAD_LETTER.withDelay(Duration.ofMillis(2000)));
        QueueTopology second = builder.ensureTopology("orders",
                DEAD_LETTER.withDelay(Duration.ofMillis(2000).plusNanos(500_000)));

        assertThat(second).isEqualTo(first);
        verify(connectionManager, times(2)).execute(any());
    }

    @Test
    void delayedTopologyIsCachedWhenInvalidatedDuringDeclaration() throws IOException {
        builder.ensureTopology("orders", DEAD_LETTER);
        doAnswer(invocation -> {
            builder.invalidate();
            return null;
        }).when(channel).queueBind(eq("orders.delayed"), anyString(), anyString(), any());

        builder.ensureTopology("orders", DEAD_LETTER.withDelay(Duration.ofSeconds(5)));

        assertThat(builder.getDeclared("orders"))
                .hasValueSatisfying(topology -> assertThat(topology.delay()).isEqualTo(Duration.ofSeconds(5)));

        clearInvocations(channel);
        builder.ensureTopology("orders", DEAD_LETTER.withDelay(Duration.ofSeconds(5)));
        verifyNoInteractions(channel);
    }

    @Test
    void conflictingDurabilityIsRejectedLocally() {
        builder.ensureTopology("orders", DEAD_LETTER);

        assertThatThrownBy(() -> builder.ensureTopology("orders", new TopologyOptions(false, true, null)))
                .isInstanceOfSatisfying(TopologyConfigurationException.class,
                        e -> assertThat(e.getQueueName()).isEqualTo("orders"));
    }

    @Test
    void brokerPreconditionFailedBecomesConfigurationError() throws IOException {
        when(channel.queueDeclare(eq("legacy"), anyBoolean(), anyBoolean(), anyBoolean(), any()))
                .thenThrow(new IOException(ChannelStubs.preconditionFailed(channel, "inequivalent arg 'durable'")));

        assertThatThrownBy(() -> builder.ensureTopology("legacy", new TopologyOptions(true, false, null)))
                .isInstanceOf(TopologyConfigurationException.class)
                .hasMessageContaining("406");

        assertThat(builder.getDeclared("legacy")).isEmpty();
    }

    @Test
    void otherBrokerFailuresPropagateUnchanged() throws IOException {
        when(channel.queueDeclare(eq("orders"), anyBoolean(), anyBoolean(), anyBoolean(), any()))
                .thenThrow(new IOException("connection reset"));

        assertThatThrownBy(() -> builder.ensureTopology("orders", new TopologyOptions(true, false, null)))
                .isInstanceOf(AmqpIOException.class);
    }

    @Test
    void invalidateForcesRedeclaration() throws IOException {
        builder.ensureTopology("orders", DEAD_LETTER);
        builder.invalidate();
        builder.ensureTopology("orders", DEAD_LETTER);

        verify(channel, times(2)).queueDeclare(eq("orders"), anyBoolean(), anyBoolean(), anyBoolean(), any());
    }

    @Test
    void rejectsInvalidDelays() {
        assertThatThrownBy(() -> DEAD_LETTER.withDelay(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DEAD_LETTER.withDelay(Duration.ofMillis(-1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DEAD_LETTER.withDelay(Duration.ofNanos(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DEAD_LETTER.withDelay(Duration.ofMillis(Integer.MAX_VALUE + 1L)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
