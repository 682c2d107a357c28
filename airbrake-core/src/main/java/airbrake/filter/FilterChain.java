package airbrake.filter;

import airbrake.Notice;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Ordered list of {@link NoticeFilter} stages applied to each notice before delivery.
 *
 * <p>Every stage runs, in registration order, even after an earlier stage has ignored the
 * notice. A stage that throws is logged and skipped. Stages may be added while other threads
 * are refining notices; a refine pass sees the stages registered when it started.
 */
public final class FilterChain {
  private final List<NoticeFilter> filters = new CopyOnWriteArrayList<>();
  private final Logger logger;

  public FilterChain() {
    this(Logger.getLogger(FilterChain.class.getName()));
  }

  /**
   * Creates an empty chain that reports failing stages to {@code logger}.
   *
   * @param logger receives a warning for each stage that throws
   */
  public FilterChain(Logger logger) {
    this.logger = Objects.requireNonNull(logger, "logger");
  }

  /**
   * Appends a stage. The same stage may be added more than once and then runs once per
   * registration.
   *
   * @param filter the stage
   * @return this chain
   */
  public FilterChain addFilter(NoticeFilter filter) {
    filters.add(Objects.requireNonNull(filter, "filter"));
    return this;
  }

  /**
   * Runs every stage against {@code notice}.
   *
   * @param notice the notice to refine in place
   */
  public void refine(Notice notice) {
    Objects.requireNonNull(notice, "notice");
    for (NoticeFilter filter : filters) {
      try {
        filter.apply(notice);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "**Airbrake: filter " + filter.getClass().getName()
            + " failed on " + notice.id() + "; skipping it", e);
      }
    }
  }

  public List<NoticeFilter> filters() {
    return List.copyOf(filters);
  }

  public int size() {
    return filters.size();
  }
}
