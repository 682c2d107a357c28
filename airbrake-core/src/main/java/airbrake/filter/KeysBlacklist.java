package airbrake.filter;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Replaces the value of every matching key with {@value KeysFilter#FILTERED}, at any depth.
 */
public final class KeysBlacklist extends KeysFilter {

  public KeysBlacklist(List<Pattern> patterns) {
    super(patterns);
  }

  @Override
  protected Object filterValue(String key, Object value) {
    if (matches(key)) {
      return FILTERED;
    }
    if (value instanceof Map<?, ?> nested) {
      return filterNested(nested);
    }
    return value;
  }
}
