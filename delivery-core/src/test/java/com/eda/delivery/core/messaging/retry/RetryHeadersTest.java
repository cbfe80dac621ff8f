package com.eda.delivery.core.messaging.retry;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.impl.LongStringHelper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RetryHeadersTest {

    @Test
    void missingHeaderMeansFirstAttempt() {
        assertThat(RetryHeaders.retryCount(null)).isZero();
        assertThat(RetryHeaders.retryCount(new AMQP.BasicProperties())).isZero();
        assertThat(RetryHeaders.retryCount(withHeader("other", 4))).isZero();
    }

    @Test
    void acceptsAnyIntegerWidth() {
        assertThat(RetryHeaders.retryCount(withHeader(RetryHeaders.RETRY_COUNT, 2))).isEqualTo(2);
        assertThat(RetryHeaders.retryCount(withHeader(RetryHeaders.RETRY_COUNT, 3L))).isEqualTo(3);
        assertThat(RetryHeaders.retryCount(withHeader(RetryHeaders.RETRY_COUNT, (byte) 1))).isEqualTo(1);
    }

    @Test
    void acceptsNumericStrings() {
        assertThat(RetryHeaders.retryCount(withHeader(RetryHeaders.RETRY_COUNT, "2"))).isEqualTo(2);
        assertThat(RetryHeaders.retryCount(withHeader(RetryHeaders.RETRY_COUNT,
                LongStringHelper.asLongString("5")))).isEqualTo(5);
    }

    @Test
    void unreadableOrNegativeValuesCountAsZero() {
        assertThat(RetryHeaders.retryCount(withHeader(RetryHeaders.RETRY_COUNT, "many"))).isZero();
        assertThat(RetryHeaders.retryCount(withHeader(RetryHeaders.RETRY_COUNT, -4))).isZero();
    }

    @Test
    void withRetryCountKeepsOtherHeaders() {
        Map<String, Object> headers = RetryHeaders.withRetryCount(Map.of("correlationId", "c-1"), 2);

        assertThat(headers).containsEntry("correlationId", "c-1").containsEntry(RetryHeaders.RETRY_COUNT, 2);
    }

    private static AMQP.BasicProperties withHeader(String name, Object value) {
        return new AMQP.BasicProperties.Builder().headers(Map.of(name, value)).build();
    }
}
