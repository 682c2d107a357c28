package airbrake;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-assignment handle for the outcome of a delivery.
 *
 * <p>A promise starts {@code PENDING} and moves exactly once to {@code RESOLVED} (with a
 * value) or {@code REJECTED} (with a reason). The first transition wins; later calls to
 * {@link #resolve} or {@link #reject} are ignored. Any thread may resolve the promise while
 * other threads wait on {@link #value()}.
 *
 * <p>Callbacks registered with {@link #then} and {@link #rescue} run once, on the thread that
 * completes the promise, or immediately on the registering thread if the promise is already
 * complete. Callback exceptions are logged and swallowed.
 *
 * @param <T> type of the resolved value
 */
public final class Promise<T> {
  private static final Logger logger = Logger.getLogger(Promise.class.getName());

  private enum State { PENDING, RESOLVED, REJECTED }

  private final Object lock = new Object();
  private State state = State.PENDING;
  private T value;
  private String reason;
  private final List<Consumer<? super T>> resolvedCallbacks = new ArrayList<>();
  private final List<Consumer<? super String>> rejectedCallbacks = new ArrayList<>();

  /**
   * Completes the promise with a value. No-op if already complete.
   *
   * @param value the value
   * @return this promise
   */
  public Promise<T> resolve(T value) {
    List<Consumer<? super T>> callbacks;
    synchronized (lock) {
      if (state != State.PENDING) {
        return this;
      }
      this.state = State.RESOLVED;
      this.value = value;
      callbacks = new ArrayList<>(resolvedCallbacks);
      resolvedCallbacks.clear();
      rejectedCallbacks.clear();
      lock.notifyAll();
    }
    callbacks.forEach(callback -> runCallback(callback, value));
    return this;
  }

  /**
   * Completes the promise with a rejection reason. No-op if already complete.
   *
   * @param reason why the delivery did not happen or failed
   * @return this promise
   */
  public Promise<T> reject(String reason) {
    Objects.requireNonNull(reason, "reason");
    List<Consumer<? super String>> callbacks;
    synchronized (lock) {
      if (state != State.PENDING) {
        return this;
      }
      this.state = State.REJECTED;
      this.reason = reason;
      callbacks = new ArrayList<>(rejectedCallbacks);
      resolvedCallbacks.clear();
      rejectedCallbacks.clear();
      lock.notifyAll();
    }
    callbacks.forEach(callback -> runCallback(callback, reason));
    return this;
  }

  /**
   * Registers a callback for the resolved value.
   *
   * @param callback invoked with the value once resolved
   * @return this promise
   */
  public Promise<T> then(Consumer<? super T> callback) {
    Objects.requireNonNull(callback, "callback");
    T resolved;
    synchronized (lock) {
      if (state == State.PENDING) {
        resolvedCallbacks.add(callback);
        return this;
      }
      if (state == State.REJECTED) {
        return this;
      }
      resolved = value;
    }
    runCallback(callback, resolved);
    return this;
  }

  /**
   * Registers a callback for the rejection reason.
   *
   * @param callback invoked with the reason once rejected
   * @return this promise
   */
  public Promise<T> rescue(Consumer<? super String> callback) {
    Objects.requireNonNull(callback, "callback");
    String rejected;
    synchronized (lock) {
      if (state == State.PENDING) {
        rejectedCallbacks.add(callback);
        return this;
      }
      if (state == State.RESOLVED) {
        return this;
      }
      rejected = reason;
    }
    runCallback(callback, rejected);
    return this;
  }

  /**
   * Blocks until the promise completes and returns its outcome.
   *
   * <p>If the waiting thread is interrupted, the interrupt flag is restored and a
   * {@link Outcome.Rejected} describing the interruption is returned; the promise itself
   * stays pending.
   *
   * @return the terminal outcome
   */
  public Outcome<T> value() {
    synchronized (lock) {
      while (state == State.PENDING) {
        try {
          lock.wait();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return Outcome.rejected("interrupted while waiting for delivery");
        }
      }
      return outcome();
    }
  }

  /**
   * Blocks up to {@code timeout} for the promise to complete.
   *
   * @param timeout maximum time to wait
   * @return the outcome, or empty if still pending after the timeout or on interrupt
   */
  public Optional<Outcome<T>> value(Duration timeout) {
    long deadline = System.nanoTime() + timeout.toNanos();
    synchronized (lock) {
      while (state == State.PENDING) {
        long remainingNanos = deadline - System.nanoTime();
        if (remainingNanos <= 0) {
          return Optional.empty();
        }
        try {
          TimeUnit.NANOSECONDS.timedWait(lock, remainingNanos);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return Optional.empty();
        }
      }
      return Optional.of(outcome());
    }
  }

  public boolean isPending() {
    synchronized (lock) {
      return state == State.PENDING;
    }
  }

  public boolean isResolved() {
    synchronized (lock) {
      return state == State.RESOLVED;
    }
  }

  public boolean isRejected() {
    synchronized (lock) {
      return state == State.REJECTED;
    }
  }

  private Outcome<T> outcome() {
    return state == State.RESOLVED ? Outcome.resolved(value) : Outcome.rejected(reason);
  }

  private static <V> void runCallback(Consumer<? super V> callback, V argument) {
    try {
      callback.accept(argument);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Promise callback failed", e);
    }
  }

  @Override
  public String toString() {
    synchronized (lock) {
      switch (state) {
        case RESOLVED:
          return "Promise{resolved=" + value + '}';
        case REJECTED:
          return "Promise{rejected=" + reason + '}';
        default:
          return "Promise{pending}";
      }
    }
  }
}
