package com.eda.delivery.core.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the RabbitMQ delivery subsystem.
 * Values can be overridden in application.yml under {@code messaging.rabbitmq}.
 */
@ConfigurationProperties(prefix = "messaging.rabbitmq")
@Validated
@Data
public class DeliveryProperties {

    /**
     * Enable/disable the whole subsystem.
     * Default: true
     */
    private boolean enabled = true;

    @NotBlank
    private String host = "localhost";

    @Min(1)
    @Max(65535)
    private int port = 5672;

    @NotBlank
    private String username = "guest";

    @NotNull
    private String password = "guest";

    @NotBlank
    private String virtualHost = "/";

    /**
     * Client-provided connection name, visible in the management UI.
     */
    private String connectionName = "reliable-delivery";

    /**
     * Number of re-publishes after the original delivery before a message is dead-lettered.
     * Default: 3 (so at most 4 deliveries in total)
     */
    @Min(0)
    private int maxRetryAttempts = 3;

    /**
     * Delay between a failed delivery and its re-publish.
     * Default: 5 seconds
     */
    @NotNull
    private Duration retryDelay = Duration.ofSeconds(5);

    /**
     * Enable dead-letter exchange/queue for consumed queues.
     * Default: true
     */
    private boolean enableDeadLetterQueue = true;

    /**
     * Declare main queues as durable.
     * Default: true
     */
    private boolean durableQueues = true;

    /**
     * TCP connection establishment timeout.
     * Default: 30 seconds
     */
    @NotNull
    private Duration connectionTimeout = Duration.ofSeconds(30);

    /**
     * Enable client automatic connection recovery.
     * Default: true
     */
    private boolean automaticRecovery = true;

    /**
     * Interval between automatic recovery attempts.
     * Default: 10 seconds
     */
    @NotNull
    private Duration networkRecoveryInterval = Duration.ofSeconds(10);

    @NotNull
    private Duration requestedHeartbeat = Duration.ofSeconds(60);

    /**
     * Maximum unacknowledged deliveries per consumer.
     * Default: 1 (strict per-queue processing order for fresh messages)
     */
    @Min(1)
    @Max(65535)
    private int prefetchCount = 1;

    /**
     * Wait for broker confirms after each publish.
     * Default: true
     */
    private boolean enablePublisherConfirms = true;

    /**
     * How long a publish waits for its broker confirm.
     * Default: 10 seconds
     */
    @NotNull
    private Duration publishTimeout = Duration.ofSeconds(10);
}
