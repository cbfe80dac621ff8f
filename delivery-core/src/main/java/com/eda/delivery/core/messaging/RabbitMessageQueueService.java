package com.eda.delivery.core.messaging;

import com.eda.delivery.core.messaging.consumer.AsyncMessageHandler;
import com.eda.delivery.core.messaging.consumer.ConsumerRegistration;
import com.eda.delivery.core.messaging.consumer.ConsumerRegistry;
import com.eda.delivery.core.messaging.consumer.MessageHandler;
import com.eda.delivery.core.messaging.publisher.MessagePublisher;
import lombok.RequiredArgsConstructor;

import java.time.Duration;

@RequiredArgsConstructor
public class RabbitMessageQueueService implements MessageQueueService {

    private final MessagePublisher publisher;
    private final ConsumerRegistry consumerRegistry;

    @Override
    public String publish(Object message, String queueName) {
        return publisher.publish(message, queueName);
    }

    @Override
    public String publish(Object message, String queueName, Duration delay) {
        return publisher.publish(message, queueName, delay);
    }

    @Override
    public <T> ConsumerRegistration startConsuming(String queueName, Class<T> messageType, MessageHandler<T> handler) {
        return consumerRegistry.startConsuming(queueName, messageType, handler);
    }

    @Override
    public <T> ConsumerRegistration startConsumingAsync(String queueName, Class<T> messageType,
                                                        AsyncMessageHandler<T> handler) {
        return consumerRegistry.startConsumingAsync(queueName, messageType, handler);
    }

    @Override
    public boolean stopConsuming(String queueName) {
        return consumerRegistry.stopConsuming(queueName);
    }
}
