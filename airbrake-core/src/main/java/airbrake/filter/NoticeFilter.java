package airbrake.filter;

import airbrake.Notice;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * One stage of a {@link FilterChain}.
 *
 * <p>A stage receives every notice before delivery and may mutate any of its maps or mark it
 * {@linkplain Notice#ignore() ignored}. Stages run on the caller's thread; a stage that keeps
 * state across calls must synchronize it itself.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * notifier.addFilter(notice -> notice.context().put("component", "billing"));
 * notifier.addFilter(NoticeFilter.ignoreIf(notice ->
 *     notice.exception() instanceof java.util.concurrent.CancellationException));
 * }</pre>
 */
@FunctionalInterface
public interface NoticeFilter {

    /**
     * Inspects and optionally mutates the notice.
     *
     * @param notice the notice about to be delivered
     */
    void apply(Notice notice);

    /**
     * Creates a stage that ignores every notice matching {@code predicate}.
     */
    static NoticeFilter ignoreIf(Predicate<? super Notice> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return notice -> {
            if (predicate.test(notice)) {
                notice.ignore();
            }
        };
    }
}
