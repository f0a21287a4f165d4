package org.burrow.rabbit.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Jackson-backed default serializer and deserializer.
 *
 * <pre>
 * MessageSerializer&lt;Order&gt; out = JsonCodec.serializer();
 * MessageDeserializer&lt;Order&gt; in = JsonCodec.deserializer(Order.class);
 * </pre>
 */
public final class JsonCodec {

    private static final ObjectMapper DEFAULT_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private JsonCodec() {
    }

    public static ObjectMapper defaultMapper() {
        return DEFAULT_MAPPER;
    }

    public static <T> MessageSerializer<T> serializer() {
        return serializer(DEFAULT_MAPPER);
    }

    public static <T> MessageSerializer<T> serializer(ObjectMapper objectMapper) {
        return payload -> {
            try {
                return objectMapper.writeValueAsBytes(payload);
            } catch (JsonProcessingException e) {
                throw new MessageSerializationException(
                        "Failed to serialize " + (payload == null ? "null" : payload.getClass().getSimpleName()), e);
            }
        };
    }

    public static <T> MessageDeserializer<T> deserializer(Class<T> type) {
        return deserializer(DEFAULT_MAPPER, type);
    }

    public static <T> MessageDeserializer<T> deserializer(ObjectMapper objectMapper, Class<T> type) {
        return body -> objectMapper.readValue(body, type);
    }

    public static <T> MessageDeserializer<T> deserializer(ObjectMapper objectMapper, TypeReference<T> type) {
        return body -> objectMapper.readValue(body, type);
    }
}
