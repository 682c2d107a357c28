package airbrake;

/**
 * One backtrace frame in the collector's format.
 *
 * @param file     source file name, {@code "<unknown>"} when the class carries no debug info
 * @param line     line number, {@code null} when unknown
 * @param function fully qualified method, e.g. {@code com.example.Orders.place}
 */
public record StackFrame(String file, Integer line, String function) {

    static final String UNKNOWN_FILE = "<unknown>";

    public static StackFrame of(StackTraceElement element) {
        String file = element.getFileName() == null ? UNKNOWN_FILE : element.getFileName();
        Integer line = element.getLineNumber() >= 0 ? element.getLineNumber() : null;
        return new StackFrame(file, line, element.getClassName() + "." + element.getMethodName());
    }
}
