package com.eda.delivery.core.messaging.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.amqp.support.converter.MessageConversionException;
import org.springframework.util.Assert;

import java.io.IOException;

/**
 * JSON payload serialization using the application's Jackson ObjectMapper.
 */
@RequiredArgsConstructor
public class JsonPayloadCodec {

    public static final String CONTENT_TYPE = "application/json";

    private final ObjectMapper objectMapper;

    /**
     * @throws MessageConversionException if the payload cannot be written as JSON
     */
    public byte[] serialize(Object payload) {
        Assert.notNull(payload, "payload must not be null");
        try {
            return objectMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new MessageConversionException(
                    "Failed to serialize payload of type " + payload.getClass().getName(), e);
        }
    }

    /**
     * @throws MessageConversionException if the body is not valid JSON for {@code type}, or is JSON null
     */
    public <T> T deserialize(byte[] body, Class<T> type) {
        if (body == null || body.length == 0) {
            throw new MessageConversionException("Message body is empty");
        }
        T value;
        try {
            value = objectMapper.readValue(body, type);
        } catch (IOException e) {
            throw new MessageConversionException(
                    "Failed to deserialize message body as " + type.getSimpleName(), e);
        }
        if (value == null) {
            throw new MessageConversionException("Message body is JSON null");
        }
        return value;
    }

    /**
     * Value of the AMQP {@code type} property for a payload: its simple class name.
     */
    public String typeTag(Object payload) {
        String simpleName = payload.getClass().getSimpleName();
        return simpleName.isEmpty() ? payload.getClass().getName() : simpleName;
    }
}
