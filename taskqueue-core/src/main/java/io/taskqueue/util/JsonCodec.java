package io.taskqueue.util;

import java.util.Map;

/**
 * Codec for message payloads: open {@code Map<String, Object>} objects to and from JSON.
 *
 * <p>The default implementation ({@link JacksonJsonCodec}) delegates to Jackson.
 * Implement this interface to plug in a differently configured mapper.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    /**
     * Returns the default singleton implementation.
     *
     * @return the default {@link JsonCodec}
     */
    static JsonCodec getDefault() {
        return JacksonJsonCodec.INSTANCE;
    }

    /**
     * Encodes a payload as a JSON object string.
     *
     * @param payload the payload to encode
     * @return JSON string (never {@code null})
     * @throws IllegalArgumentException if the payload contains values that cannot be encoded
     */
    String toJson(Map<String, Object> payload);

    /**
     * Parses a JSON object string into a payload map, preserving field order.
     *
     * @param json the JSON string to parse
     * @return parsed map (never {@code null}); empty for {@code null} or blank input
     * @throws IllegalArgumentException if the input is not a valid JSON object
     */
    Map<String, Object> parseObject(String json);
}
