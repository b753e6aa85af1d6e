package io.claylog.json;

import java.util.Map;

/**
 * Codec between log records ({@code Map<String, ?>}) and single-line JSON objects.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) is a lightweight,
 * zero-dependency encoder/decoder. Users who already have Jackson, Gson, or another
 * JSON library on the classpath can implement this interface and hand it to
 * {@link JsonLogEngine}.
 *
 * @see #getDefault()
 * @see DefaultJsonCodec
 */
public interface JsonCodec {

    /**
     * Returns the default singleton implementation.
     *
     * @return the default {@link JsonCodec}
     */
    static JsonCodec getDefault() {
        return DefaultJsonCodec.INSTANCE;
    }

    /**
     * Encodes a record as a JSON object string without line breaks.
     *
     * @param record fields to encode, in iteration order; a {@code null} key is written as {@code "null"}
     * @return JSON object text; {@code "{}"} for a null or empty map
     */
    String toJson(Map<String, ?> record);

    /**
     * Parses a JSON object. Nested objects become {@code Map}s, arrays {@code List}s,
     * integral numbers {@code Long}, other numbers {@code Double}.
     *
     * @param json JSON object text
     * @return parsed map (never {@code null}); empty for {@code null}, blank or {@code "null"} input
     * @throws IllegalArgumentException if the input is not a valid JSON object
     */
    Map<String, Object> parseObject(String json);
}
