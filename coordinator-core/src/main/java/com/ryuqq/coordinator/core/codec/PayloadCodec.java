package com.ryuqq.coordinator.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ryuqq.coordinator.core.error.DecodeFailureException;
import com.ryuqq.coordinator.core.model.TypedPayload;

import java.io.IOException;

/**
 * Encodes domain messages into {@link TypedPayload}s and back.
 *
 * <p>Values are encoded as canonical JSON (properties and map keys sorted) so that
 * equal messages always produce equal bytes. The type URL carries the full name the
 * value's class is registered under in the {@link TypeRegistry}.</p>
 *
 * <p><strong>Forward Compatibility:</strong> unknown JSON properties are ignored when
 * decoding, so older readers accept messages from newer writers.</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public final class PayloadCodec {

    private final TypeRegistry registry;
    private final ObjectMapper mapper;

    /**
     * Creates a codec.
     *
     * @param registry the type registry
     * @throws IllegalArgumentException if registry is null
     */
    public PayloadCodec(TypeRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.registry = registry;
        this.mapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();
    }

    /**
     * Packs a message into a typed payload.
     *
     * @param message the message (its class must be registered)
     * @return the typed payload
     * @throws IllegalArgumentException if message is null or its type is not registered
     */
    public TypedPayload pack(Object message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        String typeName = registry.nameOf(message.getClass());
        try {
            return TypedPayload.ofType(typeName, mapper.writeValueAsBytes(message));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode " + typeName, e);
        }
    }

    /**
     * Unpacks a payload into the expected class.
     *
     * @param payload the typed payload
     * @param type the expected class
     * @param <T> message type
     * @return the decoded message
     * @throws DecodeFailureException if the bytes cannot be decoded into {@code type}
     */
    public <T> T unpack(TypedPayload payload, Class<T> type) {
        try {
            return mapper.readValue(payload.getValue(), type);
        } catch (JsonProcessingException e) {
            throw new DecodeFailureException(
                payload.getTypeUrl(),
                "Failed to decode " + payload.getTypeUrl() + " as " + type.getSimpleName() + ": " + e.getOriginalMessage(),
                e
            );
        } catch (IOException e) {
            throw new DecodeFailureException(payload.getTypeUrl(), "Failed to decode " + payload.getTypeUrl(), e);
        } catch (RuntimeException e) {
            throw new DecodeFailureException(payload.getTypeUrl(), "Failed to decode " + payload.getTypeUrl(), e);
        }
    }

    /**
     * Unpacks a payload using the class registered for its type name.
     *
     * @param payload the typed payload
     * @return the decoded message
     * @throws DecodeFailureException if the type is not registered or the bytes are malformed
     */
    public Object unpack(TypedPayload payload) {
        Class<?> type = registry.classFor(payload.getTypeName())
            .orElseThrow(() -> new DecodeFailureException(
                payload.getTypeUrl(), "Type not registered: " + payload.getTypeName(), null));
        return unpack(payload, type);
    }

    /**
     * Validates a payload before it is written.
     *
     * <p>Registered types must decode; unregistered types are only checked for well-formed JSON.</p>
     *
     * @param payload the typed payload
     * @throws DecodeFailureException if the payload is malformed
     */
    public void validate(TypedPayload payload) {
        if (registry.contains(payload.getTypeName())) {
            unpack(payload);
            return;
        }
        readTree(payload);
    }

    /**
     * Parses a payload into a JSON tree.
     *
     * @param payload the typed payload
     * @return the JSON tree
     * @throws DecodeFailureException if the bytes are not valid JSON
     */
    public JsonNode readTree(TypedPayload payload) {
        try {
            JsonNode node = mapper.readTree(payload.getValue());
            if (node == null || node.isMissingNode()) {
                throw new DecodeFailureException(payload.getTypeUrl(), "Empty payload: " + payload.getTypeUrl(), null);
            }
            return node;
        } catch (IOException e) {
            throw new DecodeFailureException(payload.getTypeUrl(), "Malformed payload: " + payload.getTypeUrl(), e);
        }
    }

    public TypeRegistry registry() {
        return registry;
    }

    public ObjectMapper mapper() {
        return mapper;
    }
}
