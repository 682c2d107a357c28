package airbrake;

/**
 * Thrown when a notice is built through a {@link Notifier} whose async pipeline has been
 * closed.
 */
public class ClosedNotifierException extends IllegalStateException {

    public ClosedNotifierException(String message) {
        super(message);
    }
}
