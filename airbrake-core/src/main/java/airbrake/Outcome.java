package airbrake;

import java.util.Objects;

/**
 * Terminal state of a {@link Promise}.
 *
 * <ul>
 *   <li>{@link Resolved}: the remote endpoint accepted the payload.</li>
 *   <li>{@link Rejected}: the payload was suppressed locally (ignored environment, ignored
 *       notice, closed sender, rate limit) or the delivery failed.</li>
 * </ul>
 *
 * @param <T> type of the resolved value
 */
public sealed interface Outcome<T> permits Outcome.Resolved, Outcome.Rejected {

    static <T> Resolved<T> resolved(T value) {
        return new Resolved<>(value);
    }

    static <T> Rejected<T> rejected(String reason) {
        return new Rejected<>(reason);
    }

    default boolean isResolved() {
        return this instanceof Resolved;
    }

    default boolean isRejected() {
        return this instanceof Rejected;
    }

    /**
     * Delivery accepted.
     *
     * @param value the parsed response
     */
    record Resolved<T>(T value) implements Outcome<T> {
    }

    /**
     * Delivery suppressed or failed.
     *
     * @param reason human-readable description (never null)
     */
    record Rejected<T>(String reason) implements Outcome<T> {
        public Rejected {
            Objects.requireNonNull(reason, "reason");
        }
    }
}
