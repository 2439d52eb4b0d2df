package com.vigil.checkmodel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Optional;

/**
 * JSON-line serialization for {@link CheckResult} and the other persisted records.
 * <p>
 * One record per line, no pretty printing. {@code Instant} values are written as ISO 8601
 * strings via {@code JavaTimeModule}; unknown fields are ignored on read so older readers
 * tolerate newer writers.
 */
public final class CheckResultSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private CheckResultSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Serializes a result to a single JSON line (without the trailing newline).
     *
     * @throws RecordSerializationException if serialization fails
     */
    public static String serialize(CheckResult result) {
        return write(result, "result of check " + result.checkId());
    }

    /**
     * Deserializes one JSON line to a result.
     *
     * @throws RecordSerializationException if the line is malformed or violates record invariants
     */
    public static CheckResult deserialize(String line) {
        return read(line, CheckResult.class);
    }

    /**
     * Safely deserializes, returning empty on failure.
     */
    public static Optional<CheckResult> tryDeserialize(String line) {
        try {
            return Optional.of(deserialize(line));
        } catch (RecordSerializationException e) {
            return Optional.empty();
        }
    }

    /**
     * Serializes any persisted record type to a single JSON line.
     */
    public static String write(Object record, String description) {
        try {
            return MAPPER.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new RecordSerializationException("Failed to serialize " + description, e);
        }
    }

    /**
     * Deserializes a single JSON line to the given record type.
     */
    public static <T> T read(String line, Class<T> type) {
        try {
            return MAPPER.readValue(line, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new RecordSerializationException(
                    "Failed to deserialize " + type.getSimpleName() + " from: " + abbreviate(line), e);
        }
    }

    /** Returns the shared ObjectMapper (for advanced use). */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    private static String abbreviate(String line) {
        if (line == null) {
            return "null";
        }
        return line.length() <= 120 ? line : line.substring(0, 117) + "...";
    }

    /**
     * Exception thrown when record serialization/deserialization fails.
     */
    public static class RecordSerializationException extends RuntimeException {
        public RecordSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
