package airbrake;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Immutable notifier settings.
 *
 * <p>The builder accepts any values; semantic problems are reported by {@link #isValid()} and
 * {@link #validationErrorMessage()} so that {@link Notifier} can fail with a
 * {@link ConfigurationException} before any pipeline component is created.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * AirbrakeConfig config = AirbrakeConfig.builder()
 *     .projectId(113743)
 *     .projectKey("81bbff95d52f8856c770bb39e827f3f6")
 *     .environment("production")
 *     .ignoreEnvironments("test", "development")
 *     .blacklistKeys("password", "creditCard")
 *     .build();
 * }</pre>
 */
public final class AirbrakeConfig {
  public static final String DEFAULT_HOST = "https://api.airbrake.io";

  private final long projectId;
  private final String projectKey;
  private final String host;
  private final String environment;
  private final List<Pattern> ignoreEnvironments;
  private final List<Pattern> blacklistKeys;
  private final List<Pattern> whitelistKeys;
  private final String rootDirectory;
  private final String appVersion;
  private final int workers;
  private final int queueSize;
  private final Duration timeout;
  private final Duration drainTimeout;
  private final Logger logger;

  private AirbrakeConfig(Builder builder) {
    this.projectId = builder.projectId;
    this.projectKey = builder.projectKey;
    this.host = builder.host;
    this.environment = builder.environment;
    this.ignoreEnvironments = Collections.unmodifiableList(new ArrayList<>(builder.ignoreEnvironments));
    this.blacklistKeys = Collections.unmodifiableList(new ArrayList<>(builder.blacklistKeys));
    this.whitelistKeys = Collections.unmodifiableList(new ArrayList<>(builder.whitelistKeys));
    this.rootDirectory = builder.rootDirectory;
    this.appVersion = builder.appVersion;
    this.workers = builder.workers;
    this.queueSize = builder.queueSize;
    this.timeout = builder.timeout;
    this.drainTimeout = builder.drainTimeout;
    this.logger = builder.logger;
  }

  public static Builder builder() {
    return new Builder();
  }

  public long projectId() {
    return projectId;
  }

  public String projectKey() {
    return projectKey;
  }

  public String host() {
    return host;
  }

  public String environment() {
    return environment;
  }

  public List<Pattern> ignoreEnvironments() {
    return ignoreEnvironments;
  }

  public List<Pattern> blacklistKeys() {
    return blacklistKeys;
  }

  public List<Pattern> whitelistKeys() {
    return whitelistKeys;
  }

  public String rootDirectory() {
    return rootDirectory;
  }

  public String appVersion() {
    return appVersion;
  }

  public int workers() {
    return workers;
  }

  public int queueSize() {
    return queueSize;
  }

  public Duration timeout() {
    return timeout;
  }

  public Duration drainTimeout() {
    return drainTimeout;
  }

  /**
   * Returns the logging collaborator that receives operational messages.
   *
   * @return the logger
   */
  public Logger logger() {
    return logger;
  }

  public boolean isValid() {
    return validationErrorMessage() == null;
  }

  /**
   * Returns the first failed validation rule, or {@code null} when the config is valid.
   *
   * @return the error message or {@code null}
   */
  public String validationErrorMessage() {
    if (projectId <= 0) {
      return "projectId is required";
    }
    if (projectKey == null || projectKey.isBlank()) {
      return "projectKey is required";
    }
    if (!isHttpUrl(host)) {
      return "host must be an absolute http(s) URL, got: " + host;
    }
    if (workers < 0) {
      return "workers must be >= 0";
    }
    if (queueSize <= 0) {
      return "queueSize must be > 0";
    }
    if (timeout == null || timeout.isZero() || timeout.isNegative()) {
      return "timeout must be positive";
    }
    if (drainTimeout == null || drainTimeout.isNegative()) {
      return "drainTimeout must not be negative";
    }
    return null;
  }

  /**
   * Returns {@code true} if {@link #environment()} matches an ignored environment.
   *
   * @return whether notices from this environment are suppressed
   */
  public boolean isIgnoredEnvironment() {
    if (environment == null) {
      return false;
    }
    for (Pattern pattern : ignoreEnvironments) {
      if (pattern.matcher(environment).matches()) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns the notice endpoint {@code <host>/api/v3/projects/<projectId>/notices}.
   *
   * @return the endpoint URI
   */
  public URI endpoint() {
    return URI.create(baseUrl() + "/api/v3/projects/" + projectId + "/notices");
  }

  /**
   * Returns the deploy endpoint {@code <host>/api/v4/projects/<projectId>/deploys?key=<projectKey>}.
   *
   * @return the endpoint URI
   */
  public URI deployEndpoint() {
    return URI.create(baseUrl() + "/api/v4/projects/" + projectId + "/deploys?key=" + projectKey);
  }

  private String baseUrl() {
    String base = host;
    while (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return base;
  }

  private static boolean isHttpUrl(String value) {
    if (value == null || value.isBlank()) {
      return false;
    }
    try {
      URI uri = new URI(value);
      return uri.isAbsolute()
          && ("http".equalsIgnoreCase(uri.getScheme()) || "https".equalsIgnoreCase(uri.getScheme()))
          && uri.getHost() != null;
    } catch (URISyntaxException e) {
      return false;
    }
  }

  @Override
  public String toString() {
    return "AirbrakeConfig{projectId=" + projectId + ", host=" + host
        + ", environment=" + environment + ", workers=" + workers + ", queueSize=" + queueSize + '}';
  }

  /** Builder for {@link AirbrakeConfig}. */
  public static final class Builder {
    private long projectId;
    private String projectKey;
    private String host = DEFAULT_HOST;
    private String environment;
    private final List<Pattern> ignoreEnvironments = new ArrayList<>();
    private final List<Pattern> blacklistKeys = new ArrayList<>();
    private final List<Pattern> whitelistKeys = new ArrayList<>();
    private String rootDirectory;
    private String appVersion;
    private int workers = 1;
    private int queueSize = 100;
    private Duration timeout = Duration.ofSeconds(10);
    private Duration drainTimeout = Duration.ofSeconds(5);
    private Logger logger = Logger.getLogger("airbrake");

    private Builder() {}

    /**
     * Sets the project id shown in the Airbrake dashboard.
     *
     * <p><b>Required.</b> Must be positive.
     *
     * @param projectId the project id
     * @return this builder
     */
    public Builder projectId(long projectId) {
      this.projectId = projectId;
      return this;
    }

    /**
     * Sets the project API key.
     *
     * <p><b>Required.</b>
     *
     * @param projectKey the project key
     * @return this builder
     */
    public Builder projectKey(String projectKey) {
      this.projectKey = projectKey;
      return this;
    }

    /**
     * Sets the collector base URL.
     *
     * <p>Optional. Defaults to {@value AirbrakeConfig#DEFAULT_HOST}.
     *
     * @param host absolute http(s) URL
     * @return this builder
     */
    public Builder host(String host) {
      this.host = host;
      return this;
    }

    public Builder environment(String environment) {
      this.environment = environment;
      return this;
    }

    /**
     * Adds environment names whose notices are never sent. Names match exactly.
     *
     * @param environments environment names
     * @return this builder
     */
    public Builder ignoreEnvironments(String... environments) {
      for (String env : environments) {
        ignoreEnvironments.add(Pattern.compile(Pattern.quote(Objects.requireNonNull(env, "environment"))));
      }
      return this;
    }

    /**
     * Adds an environment pattern whose matches are never sent. The whole name must match.
     *
     * @param pattern environment pattern
     * @return this builder
     */
    public Builder ignoreEnvironment(Pattern pattern) {
      ignoreEnvironments.add(Objects.requireNonNull(pattern, "pattern"));
      return this;
    }

    /**
     * Adds keys whose values are replaced with {@code [Filtered]} before sending.
     *
     * @param keys exact key names
     * @return this builder
     */
    public Builder blacklistKeys(String... keys) {
      for (String key : keys) {
        blacklistKeys.add(exact(key));
      }
      return this;
    }

    public Builder blacklistKey(Pattern pattern) {
      blacklistKeys.add(Objects.requireNonNull(pattern, "pattern"));
      return this;
    }

    /**
     * Adds keys whose values are kept; every other value is replaced with {@code [Filtered]}.
     *
     * @param keys exact key names
     * @return this builder
     */
    public Builder whitelistKeys(String... keys) {
      for (String key : keys) {
        whitelistKeys.add(exact(key));
      }
      return this;
    }

    public Builder whitelistKey(Pattern pattern) {
      whitelistKeys.add(Objects.requireNonNull(pattern, "pattern"));
      return this;
    }

    public Builder rootDirectory(String rootDirectory) {
      this.rootDirectory = rootDirectory;
      return this;
    }

    public Builder appVersion(String appVersion) {
      this.appVersion = appVersion;
      return this;
    }

    /**
     * Sets the number of async delivery workers.
     *
     * <p>Optional. Defaults to {@code 1}. {@code 0} disables async delivery; {@code notify}
     * then delivers synchronously and logs a warning.
     *
     * @param workers worker count
     * @return this builder
     */
    public Builder workers(int workers) {
      this.workers = workers;
      return this;
    }

    /**
     * Sets the capacity of the async queue. A full queue blocks {@code notify} until a
     * worker frees a slot.
     *
     * <p>Optional. Defaults to {@code 100}.
     *
     * @param queueSize queue capacity
     * @return this builder
     */
    public Builder queueSize(int queueSize) {
      this.queueSize = queueSize;
      return this;
    }

    /**
     * Sets the per-request network timeout.
     *
     * <p>Optional. Defaults to 10 seconds.
     *
     * @param timeout request timeout
     * @return this builder
     */
    public Builder timeout(Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    /**
     * Sets how long {@link Notifier#close()} waits for queued notices to be delivered.
     *
     * <p>Optional. Defaults to 5 seconds. Notices still queued afterwards are rejected.
     *
     * @param drainTimeout drain timeout
     * @return this builder
     */
    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
      return this;
    }

    public Builder logger(Logger logger) {
      this.logger = Objects.requireNonNull(logger, "logger");
      return this;
    }

    public AirbrakeConfig build() {
      return new AirbrakeConfig(this);
    }

    private static Pattern exact(String key) {
      return Pattern.compile(Pattern.quote(Objects.requireNonNull(key, "key")));
    }
  }
}
