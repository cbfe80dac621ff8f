package com.eda.delivery.core.config;

import com.eda.delivery.core.connection.BrokerHealthProbe;
import com.eda.delivery.core.connection.ConnectionManager;
import com.eda.delivery.core.messaging.MessageQueueService;
import com.eda.delivery.core.messaging.RabbitMessageQueueService;
import com.eda.delivery.core.messaging.codec.JsonPayloadCodec;
import com.eda.delivery.core.messaging.consumer.ConsumerRegistry;
import com.eda.delivery.core.messaging.consumer.DeliveryAcknowledger;
import com.eda.delivery.core.messaging.metrics.DeliveryMetrics;
import com.eda.delivery.core.messaging.publisher.MessagePublisher;
import com.eda.delivery.core.messaging.retry.RetryCoordinator;
import com.eda.delivery.core.topology.TopologyBuilder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.rabbitmq.client.ConnectionFactory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Wires the delivery subsystem.
 *
 * Beans:
 * - ConnectionManager: connects on startup (fails fast if the broker is unreachable), closes on shutdown
 * - TopologyBuilder, MessagePublisher, ConsumerRegistry, RetryCoordinator
 * - MessageQueueService: the application-facing API
 * - BrokerHealthProbe
 *
 * The ConsumerRegistry is destroyed before the ConnectionManager, so consumers are cancelled
 * before the channel and connection close.
 */
@AutoConfiguration(after = JacksonAutoConfiguration.class)
@EnableConfigurationProperties(DeliveryProperties.class)
@ConditionalOnProperty(prefix = "messaging.rabbitmq", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class DeliveryAutoConfiguration {

    public static final String RETRY_SCHEDULER = "deliveryRetryScheduler";

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public JsonPayloadCodec jsonPayloadCodec(ObjectMapper objectMapper) {
        return new JsonPayloadCodec(objectMapper);
    }

    @Bean
    public DeliveryMetrics deliveryMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        return new DeliveryMetrics(meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
    }

    @Bean
    public ConnectionFactory deliveryRabbitConnectionFactory(DeliveryProperties properties) {
        return ConnectionManager.createConnectionFactory(properties);
    }

    @Bean(initMethod = "connect", destroyMethod = "close")
    public ConnectionManager connectionManager(
            @Qualifier("deliveryRabbitConnectionFactory") ConnectionFactory connectionFactory,
            DeliveryProperties properties) {
        return new ConnectionManager(connectionFactory, properties);
    }

    @Bean
    public TopologyBuilder topologyBuilder(ConnectionManager connectionManager) {
        return new TopologyBuilder(connectionManager);
    }

    @Bean
    public DeliveryAcknowledger deliveryAcknowledger(ConnectionManager connectionManager) {
        return new DeliveryAcknowledger(connectionManager);
    }

    @Bean
    public MessagePublisher messagePublisher(ConnectionManager connectionManager,
                                             TopologyBuilder topologyBuilder,
                                             JsonPayloadCodec codec,
                                             DeliveryProperties properties,
                                             DeliveryMetrics metrics) {
        return new MessagePublisher(connectionManager, topologyBuilder, codec, properties, metrics);
    }

    @Bean(name = RETRY_SCHEDULER)
    public ThreadPoolTaskScheduler deliveryRetryScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("delivery-retry-");
        return scheduler;
    }

    @Bean
    public RetryCoordinator retryCoordinator(MessagePublisher publisher,
                                             DeliveryAcknowledger acknowledger,
                                             @Qualifier(RETRY_SCHEDULER) TaskScheduler retryScheduler,
                                             DeliveryProperties properties,
                                             DeliveryMetrics metrics) {
        log.info("Retry policy: maxRetryAttempts={}, retryDelay={}, deadLetterQueue={}",
                properties.getMaxRetryAttempts(), properties.getRetryDelay(), properties.isEnableDeadLetterQueue());
        return new RetryCoordinator(publisher, acknowledger, retryScheduler, properties, metrics);
    }

    @Bean(destroyMethod = "stopAll")
    public ConsumerRegistry consumerRegistry(ConnectionManager connectionManager,
                                             TopologyBuilder topologyBuilder,
                                             JsonPayloadCodec codec,
                                             DeliveryAcknowledger acknowledger,
                                             RetryCoordinator retryCoordinator,
                                             DeliveryProperties properties,
                                             DeliveryMetrics metrics) {
        ConsumerRegistry registry = new ConsumerRegistry(
                connectionManager, topologyBuilder, codec, acknowledger, retryCoordinator, properties, metrics);
        connectionManager.addRecoveryListener(registry);
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean(MessageQueueService.class)
    public MessageQueueService messageQueueService(MessagePublisher publisher, ConsumerRegistry consumerRegistry) {
        return new RabbitMessageQueueService(publisher, consumerRegistry);
    }

    @Bean
    public BrokerHealthProbe brokerHealthProbe(ConnectionManager connectionManager, DeliveryProperties properties) {
        return new BrokerHealthProbe(connectionManager, properties);
    }
}
