package airbrake.util;

import java.util.Map;

/**
 * Codec between notice payloads and JSON text.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) has no dependencies. It encodes
 * maps, iterables, arrays, strings, numbers and booleans; any other value is written as its
 * {@code toString()}. Applications that already ship Jackson or Gson can implement this
 * interface and hand it to {@link airbrake.Notifier.Builder#jsonCodec(JsonCodec)}.
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
        return DefaultJsonCodec.INSTANCE;
    }

    /**
     * Encodes a value as JSON.
     *
     * @param value a map, iterable, array, string, number, boolean or {@code null}
     * @return JSON text (never {@code null}; a {@code null} value encodes as {@code "null"})
     * @throws IllegalArgumentException if a map contains a {@code null} key
     */
    String toJson(Object value);

    /**
     * Parses a JSON object. Nested objects become maps, arrays become lists, numbers become
     * {@link Long} or {@link Double}. Returns an empty map for {@code null}, blank or
     * {@code "null"} input.
     *
     * @param json the JSON text
     * @return parsed map (never {@code null})
     * @throws IllegalArgumentException if the input is not a JSON object
     */
    Map<String, Object> parseObject(String json);
}
