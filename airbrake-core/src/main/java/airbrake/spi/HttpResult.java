package airbrake.spi;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Raw response returned by a {@link Transport}. Header lookup is case-insensitive.
 *
 * @param statusCode HTTP status code
 * @param body       response body, {@code ""} when absent
 * @param headers    response headers (first value per name)
 */
public record HttpResult(int statusCode, String body, Map<String, String> headers) {

    public HttpResult {
        body = body == null ? "" : body;
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            copy.putAll(headers);
        }
        headers = Collections.unmodifiableMap(copy);
    }

    public HttpResult(int statusCode, String body) {
        this(statusCode, body, Map.of());
    }

    /**
     * Returns a header value, or {@code null} when absent.
     *
     * @param name header name, matched case-insensitively
     * @return the header value or {@code null}
     */
    public String header(String name) {
        return headers.get(Objects.requireNonNull(name, "name"));
    }
}
