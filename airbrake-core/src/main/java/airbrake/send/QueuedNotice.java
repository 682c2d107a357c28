package airbrake.send;

import airbrake.Notice;
import airbrake.NoticeResponse;
import airbrake.Promise;

import java.util.Objects;

/**
 * A notice waiting in the {@link AsyncSender} queue with the promise its worker completes.
 */
public record QueuedNotice(Notice notice, Promise<NoticeResponse> promise) {

    public QueuedNotice {
        Objects.requireNonNull(notice, "notice");
        Objects.requireNonNull(promise, "promise");
    }
}
