package com.eda.delivery.core.support;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.amqp.RabbitAutoConfiguration;

/**
 * Minimal Boot application for integration tests; the delivery beans come from auto-configuration.
 */
@SpringBootApplication(exclude = RabbitAutoConfiguration.class)
public class DeliveryTestApplication {
}
