package airbrake.send;

import airbrake.Notice;
import airbrake.NoticeResponse;
import airbrake.Promise;

/**
 * Delivery strategy for a refined notice.
 *
 * <p>Implementations never throw for delivery failures; they complete {@code promise} instead.
 */
public interface NoticeSender {

    /**
     * Delivers {@code notice} and completes {@code promise} with the outcome, either before
     * returning or later from another thread.
     *
     * @param notice the notice to deliver; ignored notices are rejected without delivery
     * @param promise completed exactly once with the delivery outcome
     * @return {@code promise}
     */
    Promise<NoticeResponse> send(Notice notice, Promise<NoticeResponse> promise);
}
