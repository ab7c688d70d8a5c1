package io.eventlog.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.eventlog.spi.JsonCodec;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link JsonCodec} backed by a Jackson {@link ObjectMapper}.
 *
 * <p>Objects decode to insertion-ordered maps, arrays to lists, integral numbers to
 * {@link Integer} or {@link Long}, and decimals to {@link Double}.
 */
public final class JacksonJsonCodec implements JsonCodec {
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public JacksonJsonCodec() {
        this(new ObjectMapper());
    }

    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public String toJson(Map<String, Object> value) {
        try {
            return mapper.writeValueAsString(value == null ? Map.of() : value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not JSON serializable: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public Map<String, Object> parseObject(String json) {
        if (json == null || json.isEmpty()) {
            throw new IllegalArgumentException("JSON text is empty");
        }
        try {
            LinkedHashMap<String, Object> value = mapper.readValue(json, MAP_TYPE);
            if (value == null) {
                throw new IllegalArgumentException("JSON text is null, expected an object");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed JSON object: " + e.getOriginalMessage(), e);
        }
    }
}
