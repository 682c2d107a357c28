package airbrake.http;

import airbrake.spi.HttpResult;
import airbrake.spi.Transport;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Blocking {@link Transport} built on {@link HttpClient}.
 *
 * <p>Each call sends one POST and waits for the full response, bounded by the request timeout.
 * Timeouts surface as {@link java.net.http.HttpTimeoutException}.
 */
public final class HttpClientTransport implements Transport {
    private final HttpClient client;
    private final Duration requestTimeout;

    public HttpClientTransport(Duration requestTimeout) {
        this(HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), requestTimeout);
    }

    public HttpClientTransport(HttpClient client, Duration requestTimeout) {
        this.client = Objects.requireNonNull(client, "client");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    @Override
    public HttpResult post(URI uri, String jsonPayload, Map<String, String> headers)
            throws IOException, InterruptedException {
        HttpRequest.Builder request = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofString(jsonPayload, StandardCharsets.UTF_8));
        headers.forEach(request::header);

        HttpResponse<String> response = client.send(request.build(),
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        return new HttpResult(response.statusCode(), response.body(), firstValues(response));
    }

    private static Map<String, String> firstValues(HttpResponse<?> response) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : response.headers().map().entrySet()) {
            if (!entry.getValue().isEmpty()) {
                headers.put(entry.getKey(), entry.getValue().get(0));
            }
        }
        return headers;
    }
}
