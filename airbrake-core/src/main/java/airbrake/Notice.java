package airbrake;

import airbrake.util.JsonCodec;
import airbrake.util.Truncator;
import com.github.f4b6a3.ulid.UlidCreator;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Mutable error report built from a captured exception plus caller-supplied parameters.
 *
 * <p>A notice is owned by the call that created it. Filters mutate it in place (redacting
 * {@link #params()}, {@link #session()}, {@link #environment()}, adding context) and may
 * {@linkplain #ignore() ignore} it. Senders only read it, and never deliver an ignored notice.
 *
 * <p>The {@link #errors()} list holds the captured error followed by at most two of its
 * causes.
 */
public final class Notice {
  private static final Logger logger = Logger.getLogger(Notice.class.getName());

  public static final String NOTIFIER_NAME = "airbrake-java";
  public static final String NOTIFIER_VERSION = "0.3.0";
  public static final String NOTIFIER_URL = "https://github.com/airbrake/airbrake-java";

  /** Upper bound of an encoded notice accepted by the collector. */
  public static final int MAX_NOTICE_SIZE = 64_000;
  static final int MAX_ERRORS = 3;
  static final int TRUNCATION_START = 10_000;
  static final int TRUNCATION_ATTEMPTS = 8;

  private final String id;
  private final Throwable exception;
  private final List<NoticeError> errors;
  private final Map<String, Object> context = new LinkedHashMap<>();
  private final Map<String, Object> environment = new LinkedHashMap<>();
  private final Map<String, Object> session = new LinkedHashMap<>();
  private final Map<String, Object> params = new LinkedHashMap<>();
  private volatile boolean ignored;

  /**
   * Creates a notice from an exception using its own stack trace.
   *
   * @param exception the captured error
   */
  public Notice(Throwable exception) {
    this(exception, null);
  }

  /**
   * Creates a notice, replacing the top-level backtrace when {@code backtrace} is non-null.
   */
  Notice(Throwable exception, List<StackFrame> backtrace) {
    this.id = UlidCreator.getMonotonicUlid().toString();
    this.exception = Objects.requireNonNull(exception, "exception");
    this.errors = new ArrayList<>(errorsOf(exception, backtrace));
    context.put("notifier", notifierInfo());
    context.put("os", System.getProperty("os.name") + " " + System.getProperty("os.version"));
    context.put("language", "java/" + System.getProperty("java.version"));
    String hostname = Hostname.VALUE;
    if (hostname != null) {
      context.put("hostname", hostname);
    }
    context.put("severity", "error");
  }

  private static List<NoticeError> errorsOf(Throwable exception, List<StackFrame> backtrace) {
    List<NoticeError> result = new ArrayList<>(MAX_ERRORS);
    Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    Throwable current = exception;
    while (current != null && result.size() < MAX_ERRORS && seen.add(current)) {
      List<StackFrame> frames = result.isEmpty() && backtrace != null
          ? new ArrayList<>(backtrace)
          : Backtrace.of(current.getStackTrace());
      result.add(new NoticeError(current.getClass().getName(), current.getMessage(), frames));
      current = current.getCause();
    }
    return result;
  }

  private static Map<String, Object> notifierInfo() {
    Map<String, Object> notifier = new LinkedHashMap<>();
    notifier.put("name", NOTIFIER_NAME);
    notifier.put("version", NOTIFIER_VERSION);
    notifier.put("url", NOTIFIER_URL);
    return notifier;
  }

  public String id() {
    return id;
  }

  /**
   * Returns the exception this notice was built from. For a
   * {@link Reportable.Message} input this is the wrapping {@link RuntimeException}.
   *
   * @return the captured exception
   */
  public Throwable exception() {
    return exception;
  }

  public List<NoticeError> errors() {
    return errors;
  }

  /**
   * Returns the backtrace of the top-level error.
   *
   * @return mutable list of frames
   */
  public List<StackFrame> backtrace() {
    return errors.get(0).backtrace();
  }

  public Map<String, Object> context() {
    return context;
  }

  public Map<String, Object> environment() {
    return environment;
  }

  public Map<String, Object> session() {
    return session;
  }

  public Map<String, Object> params() {
    return params;
  }

  /**
   * Marks this notice so that it is never delivered.
   */
  public void ignore() {
    this.ignored = true;
  }

  public boolean isIgnored() {
    return ignored;
  }

  /**
   * Returns the collector document: {@code errors}, {@code context}, {@code environment},
   * {@code session} and {@code params}.
   *
   * @return a fresh map; changes to it do not affect this notice
   */
  public Map<String, Object> toPayload() {
    List<Map<String, Object>> encodedErrors = new ArrayList<>(errors.size());
    for (NoticeError error : errors) {
      Map<String, Object> encoded = new LinkedHashMap<>();
      encoded.put("type", error.type());
      encoded.put("message", error.message());
      List<Map<String, Object>> frames = new ArrayList<>(error.backtrace().size());
      for (StackFrame frame : error.backtrace()) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("file", frame.file());
        f.put("line", frame.line());
        f.put("function", frame.function());
        frames.add(f);
      }
      encoded.put("backtrace", frames);
      encodedErrors.add(encoded);
    }
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("errors", encodedErrors);
    payload.put("context", new LinkedHashMap<>(context));
    payload.put("environment", new LinkedHashMap<>(environment));
    payload.put("session", new LinkedHashMap<>(session));
    payload.put("params", new LinkedHashMap<>(params));
    return payload;
  }

  /**
   * Encodes this notice, truncating oversized payloads.
   *
   * <p>If the encoded notice exceeds {@link #MAX_NOTICE_SIZE} bytes, string values and
   * collections are cut to a limit that halves on each of up to {@value #TRUNCATION_ATTEMPTS}
   * attempts. This notice itself is not modified.
   *
   * @param codec the JSON codec
   * @return the JSON document, or {@code null} if it cannot be made small enough
   */
  public String toJson(JsonCodec codec) {
    Map<String, Object> payload = toPayload();
    String json = codec.toJson(payload);
    int limit = TRUNCATION_START;
    for (int attempt = 0; attempt < TRUNCATION_ATTEMPTS && !fits(json); attempt++) {
      payload = new Truncator(limit).truncateMap(payload);
      json = codec.toJson(payload);
      limit = Math.max(1, limit / 2);
    }
    return fits(json) ? json : null;
  }

  private static boolean fits(String json) {
    return json.getBytes(StandardCharsets.UTF_8).length <= MAX_NOTICE_SIZE;
  }

  @Override
  public String toString() {
    NoticeError top = errors.get(0);
    return "Notice{id=" + id + ", type=" + top.type() + ", message=" + top.message()
        + (ignored ? ", ignored" : "") + '}';
  }

  private static final class Hostname {
    private static final String VALUE = lookup();

    private static String lookup() {
      String env = System.getenv("HOSTNAME");
      if (env != null && !env.isBlank()) {
        return env;
      }
      try {
        return InetAddress.getLocalHost().getHostName();
      } catch (UnknownHostException e) {
        logger.log(Level.FINE, "Hostname lookup failed; notices carry no hostname", e);
        return null;
      }
    }
  }
}
