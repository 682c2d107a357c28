package airbrake;

import airbrake.filter.FilterChain;
import airbrake.filter.KeysBlacklist;
import airbrake.filter.KeysWhitelist;
import airbrake.filter.NoticeFilter;
import airbrake.http.HttpClientTransport;
import airbrake.send.AsyncSender;
import airbrake.send.NoticeSender;
import airbrake.send.SyncSender;
import airbrake.spi.MetricsExporter;
import airbrake.spi.Transport;
import airbrake.util.JsonCodec;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for reporting errors to Airbrake.
 *
 * <p>A notifier turns a {@link Reportable} into a {@link Notice}, passes it through its
 * {@link FilterChain}, and hands it to a sender:
 * <ul>
 *   <li>{@link #notify(Throwable, Map)} queues the notice for background delivery and returns
 *       at once. When no async worker is running it delivers synchronously and logs a
 *       warning.</li>
 *   <li>{@link #notifySync(Throwable, Map)} delivers on the calling thread and returns the
 *       outcome.</li>
 * </ul>
 *
 * <p>Delivery problems (ignored environment, ignored notice, rate limiting, network errors,
 * error responses) never throw; they reject the returned {@link Promise}. Only an invalid
 * configuration ({@link ConfigurationException}) and building a notice after {@link #close()}
 * ({@link ClosedNotifierException}) are raised to the caller.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Notifier notifier = Notifier.builder(config).build()) {
 *   notifier.addFilter(notice -> notice.context().put("component", "billing"));
 *   notifier.notify(e, Map.of("orderId", orderId));
 * }
 * }</pre>
 */
public final class Notifier implements AutoCloseable {
  static final String LOG_LABEL = "**Airbrake:";

  private final AirbrakeConfig config;
  private final Logger logger;
  private final FilterChain filterChain;
  private final SyncSender syncSender;
  private final AsyncSender asyncSender;
  private final MetricsExporter metrics;
  private final Supplier<StackTraceElement[]> callStack;

  private Notifier(Builder builder) {
    this.config = Objects.requireNonNull(builder.config, "config");
    String error = config.validationErrorMessage();
    if (error != null) {
      throw new ConfigurationException(error);
    }
    this.logger = config.logger();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.callStack = builder.callStack != null
        ? builder.callStack : () -> Thread.currentThread().getStackTrace();

    this.filterChain = new FilterChain(logger);
    if (!config.blacklistKeys().isEmpty()) {
      filterChain.addFilter(new KeysBlacklist(config.blacklistKeys()));
    }
    if (!config.whitelistKeys().isEmpty()) {
      filterChain.addFilter(new KeysWhitelist(config.whitelistKeys()));
    }
    builder.filters.forEach(filterChain::addFilter);

    Transport transport = builder.transport != null
        ? builder.transport : new HttpClientTransport(config.timeout());
    this.syncSender = new SyncSender(config, transport, metrics,
        builder.jsonCodec, builder.clock);
    this.asyncSender = AsyncSender.builder()
        .syncSender(syncSender)
        .workerCount(config.workers())
        .queueCapacity(config.queueSize())
        .drainTimeoutMs(config.drainTimeout().toMillis())
        .metrics(metrics)
        .build()
        .start();
  }

  /**
   * Creates a notifier with the default transport and no metrics.
   *
   * @param config validated settings
   * @return a started notifier
   * @throws ConfigurationException if {@code config} is invalid
   */
  public static Notifier create(AirbrakeConfig config) {
    return builder(config).build();
  }

  public static Builder builder(AirbrakeConfig config) {
    return new Builder(config);
  }

  // -- async delivery

  public Promise<NoticeResponse> notify(Throwable exception) {
    return notify(Reportable.of(exception), Map.of());
  }

  public Promise<NoticeResponse> notify(Throwable exception, Map<String, ?> params) {
    return notify(Reportable.of(exception), params);
  }

  public Promise<NoticeResponse> notify(Notice notice, Map<String, ?> params) {
    return notify(Reportable.of(notice), params);
  }

  /**
   * Reports {@code reportable} in the background.
   *
   * <p>The returned promise may be ignored; it completes once the notice is delivered or
   * rejected.
   *
   * @param reportable what to report
   * @param params merged into the notice's {@link Notice#params()}
   * @return the delivery promise
   */
  public Promise<NoticeResponse> notify(Reportable reportable, Map<String, ?> params) {
    return sendNotice(reportable, params, true);
  }

  // -- sync delivery

  public Outcome<NoticeResponse> notifySync(Throwable exception) {
    return notifySync(Reportable.of(exception), Map.of());
  }

  public Outcome<NoticeResponse> notifySync(Throwable exception, Map<String, ?> params) {
    return notifySync(Reportable.of(exception), params);
  }

  public Outcome<NoticeResponse> notifySync(Notice notice, Map<String, ?> params) {
    return notifySync(Reportable.of(notice), params);
  }

  /**
   * Reports {@code reportable} on the calling thread and waits for the outcome.
   *
   * @param reportable what to report
   * @param params merged into the notice's {@link Notice#params()}
   * @return the terminal delivery outcome
   */
  public Outcome<NoticeResponse> notifySync(Reportable reportable, Map<String, ?> params) {
    return sendNotice(reportable, params, false).value();
  }

  // -- notice construction

  public Notice buildNotice(Throwable exception) {
    return buildNotice(Reportable.of(exception), Map.of());
  }

  public Notice buildNotice(Throwable exception, Map<String, ?> params) {
    return buildNotice(Reportable.of(exception), params);
  }

  public Notice buildNotice(Notice notice, Map<String, ?> params) {
    return buildNotice(Reportable.of(notice), params);
  }

  /**
   * Builds a notice without filtering or sending it.
   *
   * <p>A {@link Reportable.Prebuilt} notice gets {@code params} merged into its parameters,
   * later keys winning, and is otherwise returned unchanged. Any other input becomes a new
   * notice whose context carries the configured environment, root directory and app version.
   * A backtrace is synthesized from the caller's stack when the error has none.
   *
   * @param reportable what to report
   * @param params merged into the notice's parameters
   * @return the notice
   * @throws ClosedNotifierException if this notifier has been closed
   */
  public Notice buildNotice(Reportable reportable, Map<String, ?> params) {
    Objects.requireNonNull(reportable, "reportable");
    if (asyncSender.isClosed()) {
      throw new ClosedNotifierException(
          "attempted to build " + describe(reportable) + " with closed Airbrake instance");
    }
    if (reportable instanceof Reportable.Prebuilt prebuilt) {
      Notice notice = prebuilt.notice();
      putParams(notice, params);
      return notice;
    }

    Throwable exception;
    boolean synthesize;
    if (reportable instanceof Reportable.Failure failure) {
      exception = failure.error();
      synthesize = exception.getStackTrace().length == 0;
    } else {
      exception = new RuntimeException(String.valueOf(((Reportable.Message) reportable).value()));
      synthesize = true;
    }
    Notice notice = synthesize
        ? new Notice(exception, Backtrace.synthesize(callStack.get()))
        : new Notice(exception);
    putParams(notice, params);
    putIfNotNull(notice.context(), "environment", config.environment());
    putIfNotNull(notice.context(), "rootDirectory", config.rootDirectory());
    putIfNotNull(notice.context(), "version", config.appVersion());
    return notice;
  }

  // -- filters, deploys, lifecycle

  /**
   * Appends a filter stage run against every subsequent notice.
   *
   * @param filter the stage
   * @return this notifier
   */
  public Notifier addFilter(NoticeFilter filter) {
    filterChain.addFilter(filter);
    return this;
  }

  /**
   * Records a deploy. Always synchronous; the returned promise is already complete.
   *
   * <p>Typical keys are {@code environment}, {@code username}, {@code repository},
   * {@code revision} and {@code version}. A missing {@code environment} is taken from the
   * configuration.
   *
   * @param deployParams deploy attributes
   * @return the completed promise
   */
  public Promise<NoticeResponse> createDeploy(Map<String, ?> deployParams) {
    Map<String, Object> payload = new LinkedHashMap<>(deployParams);
    if (config.environment() != null) {
      payload.putIfAbsent("environment", config.environment());
    }
    return syncSender.send(payload, new Promise<>(), config.deployEndpoint());
  }

  /**
   * Closes the async pipeline, waiting up to the drain timeout for queued notices.
   * Idempotent. {@link #buildNotice} fails afterwards.
   */
  @Override
  public void close() {
    asyncSender.close();
  }

  public boolean isClosed() {
    return asyncSender.isClosed();
  }

  public AirbrakeConfig config() {
    return config;
  }

  /**
   * Returns the filter chain; stages may be added while the notifier is in use.
   */
  public FilterChain filterChain() {
    return filterChain;
  }

  private Promise<NoticeResponse> sendNotice(Reportable reportable, Map<String, ?> params,
      boolean async) {
    Promise<NoticeResponse> promise = new Promise<>();
    if (config.isIgnoredEnvironment()) {
      metrics.incrementNoticeIgnored();
      return promise.reject("The '" + config.environment() + "' environment is ignored");
    }

    Notice notice;
    try {
      notice = buildNotice(reportable, params);
    } catch (ClosedNotifierException e) {
      metrics.incrementNoticeDropped();
      return promise.reject(e.getMessage());
    } catch (RuntimeException e) {
      logger.log(Level.FINE, LOG_LABEL + " failed to build notice", e);
      return promise.reject("failed to build notice: "
          + (e.getMessage() != null ? e.getMessage() : e.getClass().getName()));
    }
    filterChain.refine(notice);
    if (notice.isIgnored()) {
      metrics.incrementNoticeIgnored();
      return promise.reject(notice + " was marked as ignored");
    }
    NoticeSender sender = async ? defaultSender() : syncSender;
    return sender.send(notice, promise);
  }

  private NoticeSender defaultSender() {
    if (asyncSender.hasWorkers()) {
      return asyncSender;
    }
    logger.warning(LOG_LABEL + " falling back to sync delivery because there are no "
        + "running async workers");
    metrics.incrementSyncFallback();
    return syncSender;
  }

  private static void putParams(Notice notice, Map<String, ?> params) {
    if (params != null) {
      notice.params().putAll(params);
    }
  }

  private static void putIfNotNull(Map<String, Object> map, String key, Object value) {
    if (value != null) {
      map.put(key, value);
    }
  }

  private static String describe(Reportable reportable) {
    if (reportable instanceof Reportable.Prebuilt prebuilt) {
      return prebuilt.notice().toString();
    }
    if (reportable instanceof Reportable.Failure failure) {
      return failure.error().toString();
    }
    return String.valueOf(((Reportable.Message) reportable).value());
  }

  /** Builder for {@link Notifier}. */
  public static final class Builder {
    private final AirbrakeConfig config;
    private Transport transport;
    private MetricsExporter metrics;
    private JsonCodec jsonCodec;
    private Clock clock;
    private Supplier<StackTraceElement[]> callStack;
    private final List<NoticeFilter> filters = new ArrayList<>();

    private Builder(AirbrakeConfig config) {
      this.config = config;
    }

    /**
     * Sets the transport used by both senders.
     *
     * <p>Optional. Defaults to {@link HttpClientTransport} with the configured timeout.
     *
     * @param transport the transport
     * @return this builder
     */
    public Builder transport(Transport transport) {
      this.transport = transport;
      return this;
    }

    /**
     * Sets the metrics exporter for queue and delivery counters.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    /**
     * Sets the clock used for rate-limit windows.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the source of the caller's stack used when an error carries no backtrace.
     *
     * <p>Optional. Defaults to {@code Thread.currentThread().getStackTrace()}.
     *
     * @param callStack supplies the current call stack
     * @return this builder
     */
    public Builder callStack(Supplier<StackTraceElement[]> callStack) {
      this.callStack = callStack;
      return this;
    }

    /**
     * Adds a filter stage, run after the key filters built from the configuration.
     *
     * @param filter the stage
     * @return this builder
     */
    public Builder filter(NoticeFilter filter) {
      filters.add(Objects.requireNonNull(filter, "filter"));
      return this;
    }

    /**
     * Validates the configuration and starts the notifier.
     *
     * @return a started notifier
     * @throws ConfigurationException if the configuration is invalid
     */
    public Notifier build() {
      return new Notifier(this);
    }
  }
}
