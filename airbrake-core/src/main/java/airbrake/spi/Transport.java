package airbrake.spi;

import java.io.IOException;
import java.net.URI;
import java.util.Map;

/**
 * Network hook used by {@link airbrake.send.SyncSender} to post encoded payloads.
 *
 * <p>Implementations perform exactly one request per call and never retry. I/O failures and
 * timeouts surface as {@link IOException}; the sender turns them into promise rejections.
 *
 * @see airbrake.http.HttpClientTransport
 */
@FunctionalInterface
public interface Transport {

    /**
     * Posts a JSON body.
     *
     * @param uri         destination
     * @param jsonPayload encoded payload
     * @param headers     request headers to send
     * @return the response status, body and headers
     * @throws IOException          on connection failure or timeout
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    HttpResult post(URI uri, String jsonPayload, Map<String, String> headers)
            throws IOException, InterruptedException;
}
