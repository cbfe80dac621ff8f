package com.eda.delivery.worker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.amqp.RabbitAutoConfiguration;

/**
 * Main application class for the Order Worker.
 *
 * RabbitAutoConfiguration is excluded: the broker connection is owned by the
 * delivery subsystem's ConnectionManager, not by a Spring AMQP CachingConnectionFactory.
 */
@SpringBootApplication(exclude = RabbitAutoConfiguration.class)
public class OrderWorkerApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrderWorkerApplication.class, args);
    }
}
