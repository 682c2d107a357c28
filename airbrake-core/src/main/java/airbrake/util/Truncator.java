package airbrake.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Produces size-limited copies of payload values.
 *
 * <p>Strings longer than the limit are cut and suffixed with {@value #TRUNCATED}; maps and
 * collections keep at most {@code maxSize} entries. Values nested deeper than
 * {@value #MAX_DEPTH} levels and reference cycles are replaced with placeholders. The input is
 * never modified.
 */
public final class Truncator {
  public static final String TRUNCATED = "[Truncated]";
  static final String CIRCULAR = "[Circular]";
  static final int MAX_DEPTH = 8;

  private final int maxSize;

  public Truncator(int maxSize) {
    if (maxSize <= 0) {
      throw new IllegalArgumentException("maxSize must be > 0");
    }
    this.maxSize = maxSize;
  }

  public int maxSize() {
    return maxSize;
  }

  /**
   * Returns a truncated copy of {@code value}.
   *
   * @param value any payload value
   * @return the truncated copy
   */
  public Object truncate(Object value) {
    return truncate(value, 0, Collections.newSetFromMap(new IdentityHashMap<>()));
  }

  /**
   * Truncates every value of a map, keeping at most {@code maxSize} entries.
   *
   * @param map the map to copy
   * @return a new insertion-ordered map
   */
  public Map<String, Object> truncateMap(Map<String, ?> map) {
    @SuppressWarnings("unchecked")
    Map<String, Object> copy = (Map<String, Object>) truncate(map);
    return copy;
  }

  private Object truncate(Object value, int depth, Set<Object> seen) {
    if (value == null || value instanceof Number || value instanceof Boolean) {
      return value;
    }
    if (value instanceof String s) {
      return truncateString(s);
    }
    if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
      if (depth >= MAX_DEPTH) {
        return TRUNCATED;
      }
      if (!seen.add(value)) {
        return CIRCULAR;
      }
      try {
        return value instanceof Map<?, ?> map
            ? truncateEntries(map, depth, seen)
            : truncateElements((Collection<?>) value, depth, seen);
      } finally {
        seen.remove(value);
      }
    }
    return truncateString(value.toString());
  }

  private Map<String, Object> truncateEntries(Map<?, ?> map, int depth, Set<Object> seen) {
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      if (copy.size() >= maxSize) {
        break;
      }
      copy.put(String.valueOf(entry.getKey()), truncate(entry.getValue(), depth + 1, seen));
    }
    return copy;
  }

  private List<Object> truncateElements(Collection<?> collection, int depth, Set<Object> seen) {
    List<Object> copy = new ArrayList<>(Math.min(collection.size(), maxSize));
    for (Object element : collection) {
      if (copy.size() >= maxSize) {
        break;
      }
      copy.add(truncate(element, depth + 1, seen));
    }
    return copy;
  }

  private String truncateString(String s) {
    if (s.length() <= maxSize) {
      return s;
    }
    return s.substring(0, maxSize) + TRUNCATED;
  }
}
