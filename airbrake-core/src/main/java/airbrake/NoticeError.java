package airbrake;

import java.util.List;
import java.util.Objects;

/**
 * One entry of a notice's {@code errors} list: the captured error or one of its causes.
 *
 * <p>The backtrace list is mutable so filters can rewrite frames in place.
 *
 * @param type      exception class name
 * @param message   exception message, may be {@code null}
 * @param backtrace frames, innermost first
 */
public record NoticeError(String type, String message, List<StackFrame> backtrace) {

    public NoticeError {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(backtrace, "backtrace");
    }
}
