package com.moonscribe.rag.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.Optional;

/**
 * Jackson setup shared by the provider and Qdrant codecs and the audit columns.
 */
public final class Json {

    /** Lenient towards unknown fields in upstream responses. */
    public static final ObjectMapper MAPPER = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .build();

    /** Content after the first JSON value is an error, not ignored. */
    public static final ObjectReader STRICT_READER =
            MAPPER.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private Json() {}

    /**
     * Serializes a value for a JSON text column. Empty when the value cannot be written.
     */
    public static Optional<String> tryWrite(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(MAPPER.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}
