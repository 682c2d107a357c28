package airbrake.filter;

import airbrake.Notice;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Base for stages that redact values by key in {@link Notice#params()},
 * {@link Notice#session()} and {@link Notice#environment()}.
 *
 * <p>Nested maps are replaced with filtered copies, so values supplied as immutable maps are
 * never mutated.
 */
public abstract class KeysFilter implements NoticeFilter {
  public static final String FILTERED = "[Filtered]";

  private final List<Pattern> patterns;

  protected KeysFilter(List<Pattern> patterns) {
    this.patterns = List.copyOf(Objects.requireNonNull(patterns, "patterns"));
  }

  public List<Pattern> patterns() {
    return patterns;
  }

  @Override
  public void apply(Notice notice) {
    if (patterns.isEmpty()) {
      return;
    }
    filterInPlace(notice.params());
    filterInPlace(notice.session());
    filterInPlace(notice.environment());
  }

  /**
   * Returns the value to store under {@code key}. Nested maps are handed to
   * {@link #filterNested(Map)} by implementations that descend into them.
   */
  protected abstract Object filterValue(String key, Object value);

  protected boolean matches(String key) {
    if (key == null) {
      return false;
    }
    for (Pattern pattern : patterns) {
      if (pattern.matcher(key).matches()) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns a filtered copy of a nested map.
   */
  protected final Map<String, Object> filterNested(Map<?, ?> map) {
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : new ArrayList<>(map.entrySet())) {
      String key = String.valueOf(entry.getKey());
      copy.put(key, filterValue(key, entry.getValue()));
    }
    return copy;
  }

  private void filterInPlace(Map<String, Object> map) {
    for (Map.Entry<String, Object> entry : map.entrySet()) {
      entry.setValue(filterValue(entry.getKey(), entry.getValue()));
    }
  }
}
