package com.eda.delivery.core.config;

import com.eda.delivery.core.connection.ConnectionManager;
import com.eda.delivery.core.messaging.MessageQueueService;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

class DeliveryAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(DeliveryAutoConfiguration.class));

    @Test
    void disabledSubsystemCreatesNoBeans() {
        contextRunner
                .withPropertyValues("messaging.rabbitmq.enabled=false")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).doesNotHaveBean(ConnectionManager.class);
                    assertThat(context).doesNotHaveBean(MessageQueueService.class);
                });
    }

    @Test
    void invalidPropertiesFailStartup() {
        contextRunner
                .withPropertyValues("messaging.rabbitmq.prefetch-count=0")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure()).hasStackTraceContaining("prefetchCount");
                });
    }

    @Test
    void unreachableBrokerFailsStartup() {
        contextRunner
                .withPropertyValues(
                        "messaging.rabbitmq.host=127.0.0.1",
                        "messaging.rabbitmq.port=1",
                        "messaging.rabbitmq.connection-timeout=2s")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure()).hasStackTraceContaining("Failed to connect to RabbitMQ");
                });
    }
}
