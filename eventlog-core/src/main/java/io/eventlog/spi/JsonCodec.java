package io.eventlog.spi;

import java.util.Map;

/**
 * Converts structured payloads and snapshot state to and from JSON text.
 *
 * <p>Implementations must preserve {@code null} values and nested maps and lists.
 */
public interface JsonCodec {

    String toJson(Map<String, Object> value);

    /**
     * Parses a JSON object.
     *
     * @throws IllegalArgumentException if {@code json} is not a JSON object
     */
    Map<String, Object> parseObject(String json);
}
