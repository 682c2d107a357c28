package airbrake;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Conversions from JVM stack traces to notice backtraces.
 */
public final class Backtrace {
  static final Set<String> LIBRARY_PACKAGES = Set.of(
      "airbrake", "airbrake.filter", "airbrake.send", "airbrake.spi", "airbrake.http", "airbrake.util");

  private static final Predicate<StackTraceElement> INTERNAL = frame ->
      LIBRARY_PACKAGES.contains(packageOf(frame.getClassName()))
          || (frame.getClassName().equals(Thread.class.getName())
              && frame.getMethodName().equals("getStackTrace"));

  private Backtrace() {
  }

  public static List<StackFrame> of(StackTraceElement[] stackTrace) {
    List<StackFrame> frames = new ArrayList<>(stackTrace.length);
    for (StackTraceElement element : stackTrace) {
      frames.add(StackFrame.of(element));
    }
    return frames;
  }

  /**
   * Builds a backtrace for an error that carries none, from the current call stack.
   *
   * <p>Leading frames that belong to this library (and the {@code Thread.getStackTrace} frame)
   * are dropped so the first frame is the caller's. If nothing would remain, the untrimmed
   * stack is used instead.
   *
   * @param callStack the captured call stack, innermost first
   * @return the cleaned backtrace
   */
  public static List<StackFrame> synthesize(StackTraceElement[] callStack) {
    int start = 0;
    while (start < callStack.length && INTERNAL.test(callStack[start])) {
      start++;
    }
    if (start == callStack.length) {
      return of(callStack);
    }
    return of(Arrays.copyOfRange(callStack, start, callStack.length));
  }

  private static String packageOf(String className) {
    int dot = className.lastIndexOf('.');
    return dot < 0 ? "" : className.substring(0, dot);
  }
}
