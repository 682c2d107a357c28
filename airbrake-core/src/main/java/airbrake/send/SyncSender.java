package airbrake.send;

import airbrake.AirbrakeConfig;
import airbrake.Notice;
import airbrake.NoticeResponse;
import airbrake.Promise;
import airbrake.spi.HttpResult;
import airbrake.spi.MetricsExporter;
import airbrake.spi.Transport;
import airbrake.util.JsonCodec;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Delivers notices on the calling thread.
 *
 * <p>Each call encodes the payload, posts it through the {@link Transport} and completes the
 * promise before returning. There is no retry. A {@code 429} response opens a rate-limit
 * window, read from the {@code X-RateLimit-Delay} header, during which every send is rejected
 * without touching the network.
 *
 * <p>This class is thread-safe; the {@link AsyncSender} workers share one instance.
 */
public final class SyncSender implements NoticeSender {
  static final String RATE_LIMITED = "IP is rate limited";
  static final String RATE_LIMIT_DELAY_HEADER = "X-RateLimit-Delay";

  private final AirbrakeConfig config;
  private final Transport transport;
  private final MetricsExporter metrics;
  private final JsonCodec jsonCodec;
  private final Clock clock;
  private final Logger logger;
  private final Map<String, String> headers;
  private final AtomicReference<Instant> rateLimitReset = new AtomicReference<>(Instant.EPOCH);

  public SyncSender(AirbrakeConfig config, Transport transport) {
    this(config, transport, MetricsExporter.NOOP, JsonCodec.getDefault(), Clock.systemUTC());
  }

  public SyncSender(AirbrakeConfig config, Transport transport, MetricsExporter metrics,
      JsonCodec jsonCodec, Clock clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
    this.jsonCodec = jsonCodec != null ? jsonCodec : JsonCodec.getDefault();
    this.clock = clock != null ? clock : Clock.systemUTC();
    this.logger = config.logger();
    Map<String, String> h = new LinkedHashMap<>();
    h.put("Authorization", "Bearer " + config.projectKey());
    h.put("Content-Type", "application/json");
    h.put("User-Agent", Notice.NOTIFIER_NAME + "/" + Notice.NOTIFIER_VERSION);
    this.headers = Map.copyOf(h);
  }

  @Override
  public Promise<NoticeResponse> send(Notice notice, Promise<NoticeResponse> promise) {
    Objects.requireNonNull(notice, "notice");
    Objects.requireNonNull(promise, "promise");
    if (notice.isIgnored()) {
      return promise.reject(notice + " was marked as ignored");
    }
    String json;
    try {
      json = notice.toJson(jsonCodec);
    } catch (RuntimeException e) {
      logger.log(Level.FINE, "**Airbrake: failed to encode " + notice, e);
      return fail(promise, "failed to encode notice: " + describe(e));
    }
    if (json == null) {
      metrics.incrementDeliveryFailure();
      return promise.reject("notice exceeds max size of " + Notice.MAX_NOTICE_SIZE + " bytes");
    }
    return post(json, promise, config.endpoint());
  }

  /**
   * Posts an arbitrary payload, such as a deploy record, to {@code endpoint}.
   *
   * @param payload the document to encode
   * @param promise completed with the outcome
   * @param endpoint destination URI
   * @return {@code promise}
   */
  public Promise<NoticeResponse> send(Map<String, ?> payload, Promise<NoticeResponse> promise,
      URI endpoint) {
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(promise, "promise");
    Objects.requireNonNull(endpoint, "endpoint");
    String json;
    try {
      json = jsonCodec.toJson(payload);
    } catch (RuntimeException e) {
      logger.log(Level.FINE, "**Airbrake: failed to encode payload for " + endpoint.getHost(), e);
      return fail(promise, "failed to encode payload: " + describe(e));
    }
    return post(json, promise, endpoint);
  }

  /**
   * Returns {@code true} while a {@code 429} response's delay has not yet elapsed.
   */
  public boolean isRateLimited() {
    return clock.instant().isBefore(rateLimitReset.get());
  }

  private Promise<NoticeResponse> post(String json, Promise<NoticeResponse> promise, URI endpoint) {
    if (isRateLimited()) {
      metrics.incrementDeliveryFailure();
      return promise.reject(RATE_LIMITED);
    }
    long start = System.nanoTime();
    HttpResult result;
    try {
      result = transport.post(endpoint, json, headers);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return fail(promise, "interrupted while sending to " + endpoint.getHost());
    } catch (IOException | RuntimeException e) {
      logger.log(Level.FINE, "**Airbrake: failed sending to " + endpoint.getHost(), e);
      return fail(promise, describe(e));
    } finally {
      metrics.recordDeliveryLatencyMs((System.nanoTime() - start) / 1_000_000);
    }
    return handle(result, promise);
  }

  private Promise<NoticeResponse> handle(HttpResult result, Promise<NoticeResponse> promise) {
    int status = result.statusCode();
    if (status == 200 || status == 201) {
      Map<String, Object> body;
      try {
        body = jsonCodec.parseObject(result.body());
      } catch (IllegalArgumentException e) {
        return fail(promise, "unparsable response body: " + e.getMessage());
      }
      Object id = body.get("id");
      Object url = body.get("url");
      metrics.incrementDeliverySuccess();
      logger.fine(() -> "**Airbrake: delivered, id=" + id);
      return promise.resolve(new NoticeResponse(
          id == null ? null : String.valueOf(id), url == null ? null : String.valueOf(url)));
    }
    if (status == 429) {
      openRateLimitWindow(result.header(RATE_LIMIT_DELAY_HEADER));
      return fail(promise, RATE_LIMITED);
    }
    return fail(promise, errorMessage(result));
  }

  private Promise<NoticeResponse> fail(Promise<NoticeResponse> promise, String reason) {
    metrics.incrementDeliveryFailure();
    logger.fine(() -> "**Airbrake: delivery rejected: " + reason);
    return promise.reject(reason);
  }

  private void openRateLimitWindow(String delayHeader) {
    if (delayHeader == null) {
      return;
    }
    try {
      long seconds = Long.parseLong(delayHeader.trim());
      if (seconds > 0) {
        rateLimitReset.set(clock.instant().plus(Duration.ofSeconds(seconds)));
      }
    } catch (NumberFormatException e) {
      logger.log(Level.FINE, "**Airbrake: ignoring malformed " + RATE_LIMIT_DELAY_HEADER
          + " header: " + delayHeader, e);
    }
  }

  private String errorMessage(HttpResult result) {
    try {
      Object message = jsonCodec.parseObject(result.body()).get("message");
      if (message != null) {
        return String.valueOf(message);
      }
    } catch (IllegalArgumentException e) {
      logger.log(Level.FINE, "**Airbrake: non-JSON error body from collector", e);
    }
    return "unexpected code (" + result.statusCode() + ")";
  }

  private static String describe(Exception e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getName();
  }
}
