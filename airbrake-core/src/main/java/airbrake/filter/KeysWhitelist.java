package airbrake.filter;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Keeps the values of matching keys and replaces every other value with
 * {@value KeysFilter#FILTERED}. Nested maps are descended into rather than replaced, so a
 * whitelisted key keeps its value at any depth.
 */
public final class KeysWhitelist extends KeysFilter {

  public KeysWhitelist(List<Pattern> patterns) {
    super(patterns);
  }

  @Override
  protected Object filterValue(String key, Object value) {
    if (value instanceof Map<?, ?> nested) {
      return filterNested(nested);
    }
    return matches(key) ? value : FILTERED;
  }
}
