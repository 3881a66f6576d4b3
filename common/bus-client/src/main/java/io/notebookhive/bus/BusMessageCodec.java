package io.notebookhive.bus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.util.Objects;
import org.springframework.amqp.core.Message;

/**
 * Serialises wire messages to JSON bodies and back.
 */
public final class BusMessageCodec {

    private final ObjectMapper mapper;

    public BusMessageCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper").copy()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public byte[] encode(Object message) {
        Objects.requireNonNull(message, "message");
        try {
            return mapper.writeValueAsBytes(message);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Cannot serialise " + message.getClass().getSimpleName(), ex);
        }
    }

    public <T> T decode(byte[] body, Class<T> type) {
        Objects.requireNonNull(type, "type");
        if (body == null || body.length == 0) {
            throw new MalformedMessageException("Empty " + type.getSimpleName() + " body", null);
        }
        try {
            T value = mapper.readValue(body, type);
            if (value == null) {
                throw new MalformedMessageException("Null " + type.getSimpleName() + " body", null);
            }
            return value;
        } catch (IOException | IllegalArgumentException ex) {
            throw new MalformedMessageException(
                "Cannot decode " + type.getSimpleName() + ": " + ex.getMessage(), ex);
        }
    }

    public <T> T decode(Message message, Class<T> type) {
        Objects.requireNonNull(message, "message");
        return decode(message.getBody(), type);
    }
}
