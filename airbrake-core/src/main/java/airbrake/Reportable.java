package airbrake;

import java.util.Objects;

/**
 * Input accepted by the capture API: either a raw error value or an already built
 * {@link Notice}.
 *
 * <ul>
 *   <li>{@link Failure}: a {@link Throwable}; its stack trace is used, or synthesized when empty.</li>
 *   <li>{@link Message}: any other value; reported as a {@link RuntimeException} carrying
 *       {@code String.valueOf(value)}.</li>
 *   <li>{@link Prebuilt}: a notice from an earlier {@link Notifier#buildNotice} call; params
 *       are merged into it and nothing else is rebuilt.</li>
 * </ul>
 */
public sealed interface Reportable permits Reportable.Failure, Reportable.Message, Reportable.Prebuilt {

    static Reportable of(Throwable error) {
        return new Failure(error);
    }

    static Reportable of(Notice notice) {
        return new Prebuilt(notice);
    }

    /**
     * Classifies an arbitrary value.
     *
     * @param value a {@link Notice}, a {@link Throwable} or any other value
     * @return the matching variant
     */
    static Reportable of(Object value) {
        if (value instanceof Notice notice) {
            return new Prebuilt(notice);
        }
        if (value instanceof Throwable error) {
            return new Failure(error);
        }
        return new Message(value);
    }

    record Failure(Throwable error) implements Reportable {
        public Failure {
            Objects.requireNonNull(error, "error");
        }
    }

    record Message(Object value) implements Reportable {
    }

    record Prebuilt(Notice notice) implements Reportable {
        public Prebuilt {
            Objects.requireNonNull(notice, "notice");
        }
    }
}
