package airbrake.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dependency-free JSON encoder/decoder used for notice and deploy payloads and for
 * parsing collector responses.
 *
 * <p>This is the default {@link JsonCodec} implementation, accessible via
 * {@link JsonCodec#getDefault()}.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  /**
   * {@inheritDoc}
   *
   * <p>A map, collection or array that contains itself is written as {@value Truncator#CIRCULAR}
   * at the point where it recurs.
   */
  @Override
  public String toJson(Object value) {
    StringBuilder sb = new StringBuilder();
    write(sb, value, Collections.newSetFromMap(new IdentityHashMap<>()));
    return sb.toString();
  }

  private void write(StringBuilder sb, Object value, Set<Object> path) {
    if (value == null) {
      sb.append("null");
    } else if (value instanceof String s) {
      sb.append('"').append(escape(s)).append('"');
    } else if (value instanceof Number n) {
      writeNumber(sb, n);
    } else if (value instanceof Boolean b) {
      sb.append(b.booleanValue());
    } else if (value instanceof Map<?, ?> || value instanceof Iterable<?> || value instanceof Object[]) {
      if (!path.add(value)) {
        sb.append('"').append(Truncator.CIRCULAR).append('"');
        return;
      }
      try {
        if (value instanceof Map<?, ?> map) {
          writeObject(sb, map, path);
        } else if (value instanceof Iterable<?> iterable) {
          writeArray(sb, iterable, path);
        } else {
          writeArray(sb, Arrays.asList((Object[]) value), path);
        }
      } finally {
        path.remove(value);
      }
    } else if (value instanceof int[] ints) {
      writeArray(sb, Arrays.stream(ints).boxed().toList(), path);
    } else if (value instanceof long[] longs) {
      writeArray(sb, Arrays.stream(longs).boxed().toList(), path);
    } else if (value instanceof double[] doubles) {
      writeArray(sb, Arrays.stream(doubles).boxed().toList(), path);
    } else {
      sb.append('"').append(escape(value.toString())).append('"');
    }
  }

  private void writeArray(StringBuilder sb, Iterable<?> elements, Set<Object> path) {
    sb.append('[');
    boolean first = true;
    for (Object element : elements) {
      if (!first) {
        sb.append(',');
      }
      first = false;
      write(sb, element, path);
    }
    sb.append(']');
  }

  private void writeObject(StringBuilder sb, Map<?, ?> map, Set<Object> path) {
    sb.append('{');
    boolean first = true;
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("JSON objects cannot contain null keys");
      }
      if (!first) {
        sb.append(',');
      }
      first = false;
      sb.append('"').append(escape(entry.getKey().toString())).append('"').append(':');
      write(sb, entry.getValue(), path);
    }
    sb.append('}');
  }

  private static void writeNumber(StringBuilder sb, Number n) {
    if (n instanceof Double d && (d.isNaN() || d.isInfinite())) {
      sb.append('"').append(d).append('"');
    } else if (n instanceof Float f && (f.isNaN() || f.isInfinite())) {
      sb.append('"').append(f).append('"');
    } else {
      sb.append(n);
    }
  }

  @Override
  public Map<String, Object> parseObject(String json) {
    if (json == null) {
      return Collections.emptyMap();
    }
    String trimmed = json.trim();
    if (trimmed.isEmpty() || "null".equals(trimmed)) {
      return Collections.emptyMap();
    }
    if (trimmed.charAt(0) != '{') {
      throw new IllegalArgumentException("Expected JSON object");
    }
    Parser parser = new Parser(trimmed);
    @SuppressWarnings("unchecked")
    Map<String, Object> result = (Map<String, Object>) parser.parseValue();
    parser.idx = skipWhitespace(trimmed, parser.idx);
    if (parser.idx != trimmed.length()) {
      throw new IllegalArgumentException("Unexpected trailing content after JSON object");
    }
    return result;
  }

  private static final class Parser {
    private final String input;
    private int idx;

    private Parser(String input) {
      this.input = input;
    }

    private Object parseValue() {
      idx = skipWhitespace(input, idx);
      if (idx >= input.length()) {
        throw new IllegalArgumentException("Unexpected end of JSON input");
      }
      char ch = input.charAt(idx);
      switch (ch) {
        case '{':
          return parseObject();
        case '[':
          return parseArray();
        case '"':
          ParseResult str = parseString(input, idx + 1);
          idx = str.nextIndex;
          return str.value;
        default:
          return parseLiteral();
      }
    }

    private Map<String, Object> parseObject() {
      idx++;
      Map<String, Object> result = new LinkedHashMap<>();
      while (true) {
        idx = skipWhitespace(input, idx);
        if (idx >= input.length()) {
          throw new IllegalArgumentException("Unexpected end of JSON object");
        }
        char ch = input.charAt(idx);
        if (ch == '}' && result.isEmpty()) {
          idx++;
          return result;
        }
        if (ch != '"') {
          throw new IllegalArgumentException("Expected string key");
        }
        ParseResult key = parseString(input, idx + 1);
        idx = skipWhitespace(input, key.nextIndex);
        if (idx >= input.length() || input.charAt(idx) != ':') {
          throw new IllegalArgumentException("Expected ':' after key");
        }
        idx++;
        result.put(key.value, parseValue());
        idx = skipWhitespace(input, idx);
        if (idx >= input.length()) {
          throw new IllegalArgumentException("Unexpected end of JSON object");
        }
        char next = input.charAt(idx++);
        if (next == '}') {
          return result;
        }
        if (next != ',') {
          throw new IllegalArgumentException("Expected ',' or '}'");
        }
      }
    }

    private List<Object> parseArray() {
      idx++;
      List<Object> result = new ArrayList<>();
      idx = skipWhitespace(input, idx);
      if (idx < input.length() && input.charAt(idx) == ']') {
        idx++;
        return result;
      }
      while (true) {
        result.add(parseValue());
        idx = skipWhitespace(input, idx);
        if (idx >= input.length()) {
          throw new IllegalArgumentException("Unexpected end of JSON array");
        }
        char next = input.charAt(idx++);
        if (next == ']') {
          return result;
        }
        if (next != ',') {
          throw new IllegalArgumentException("Expected ',' or ']'");
        }
      }
    }

    private Object parseLiteral() {
      int start = idx;
      while (idx < input.length()) {
        char c = input.charAt(idx);
        if (c == ',' || c == '}' || c == ']' || c == ' ' || c == '\t' || c == '\n' || c == '\r') {
          break;
        }
        idx++;
      }
      String token = input.substring(start, idx);
      switch (token) {
        case "null":
          return null;
        case "true":
          return Boolean.TRUE;
        case "false":
          return Boolean.FALSE;
        default:
          try {
            if (token.contains(".") || token.contains("e") || token.contains("E")) {
              return Double.parseDouble(token);
            }
            return Long.parseLong(token);
          } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Unexpected token: " + token, ex);
          }
      }
    }
  }

  private static int skipWhitespace(String input, int index) {
    int i = index;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
        break;
      }
      i++;
    }
    return i;
  }

  private static ParseResult parseString(String input, int startIndex) {
    StringBuilder sb = new StringBuilder();
    int i = startIndex;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c == '"') {
        return new ParseResult(sb.toString(), i + 1);
      }
      if (c == '\\') {
        if (i + 1 >= input.length()) {
          throw new IllegalArgumentException("Invalid escape sequence");
        }
        char next = input.charAt(i + 1);
        switch (next) {
          case '"':
          case '\\':
          case '/':
            sb.append(next);
            i += 2;
            break;
          case 'b':
            sb.append('\b');
            i += 2;
            break;
          case 'f':
            sb.append('\f');
            i += 2;
            break;
          case 'n':
            sb.append('\n');
            i += 2;
            break;
          case 'r':
            sb.append('\r');
            i += 2;
            break;
          case 't':
            sb.append('\t');
            i += 2;
            break;
          case 'u':
            if (i + 5 >= input.length()) {
              throw new IllegalArgumentException("Invalid unicode escape");
            }
            String hex = input.substring(i + 2, i + 6);
            try {
              sb.append((char) Integer.parseInt(hex, 16));
            } catch (NumberFormatException ex) {
              throw new IllegalArgumentException("Invalid unicode escape", ex);
            }
            i += 6;
            break;
          default:
            throw new IllegalArgumentException("Unsupported escape sequence: \\" + next);
        }
      } else {
        sb.append(c);
        i++;
      }
    }
    throw new IllegalArgumentException("Unterminated string");
  }

  private static String escape(String value) {
    StringBuilder sb = new StringBuilder(value.length() + 8);
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\b':
          sb.append("\\b");
          break;
        case '\f':
          sb.append("\\f");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        default:
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    return sb.toString();
  }

  private static final class ParseResult {
    private final String value;
    private final int nextIndex;

    private ParseResult(String value, int nextIndex) {
      this.value = value;
      this.nextIndex = nextIndex;
    }
  }
}
