package com.eda.delivery.worker.messaging.consumer;

import com.eda.delivery.core.connection.BrokerHealthProbe;
import com.eda.delivery.core.messaging.MessageQueueService;
import com.eda.delivery.worker.config.WorkerQueues;
import com.eda.delivery.worker.event.OrderPlacedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Subscribes the order handler once the application context is ready.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderConsumerStarter implements ApplicationRunner {

    private final MessageQueueService messageQueueService;
    private final BrokerHealthProbe healthProbe;
    private final OrderPlacedConsumer orderPlacedConsumer;

    @Override
    public void run(ApplicationArguments args) {
        BrokerHealthProbe.BrokerHealth health = healthProbe.check();
        if (!health.healthy()) {
            log.warn("Broker not healthy at startup: {}", health.detail());
        }
        messageQueueService.startConsuming(WorkerQueues.ORDERS, OrderPlacedEvent.class, orderPlacedConsumer);
        log.info("Order worker consuming queue={}", WorkerQueues.ORDERS);
    }
}
