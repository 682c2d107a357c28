package airbrake.send;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates the daemon threads of one {@link AsyncSender} and counts the worker loops running
 * on them.
 *
 * <p>Threads are named {@code airbrake-async-sender-<sender>-<n>}, where {@code <sender>}
 * numbers the async senders created in this JVM, so the workers of two notifiers can be told
 * apart in a thread dump. Daemon threads keep a notifier that was never closed from holding
 * the host JVM open.
 */
final class WorkerThreadFactory implements ThreadFactory {
  private static final Logger logger = Logger.getLogger(WorkerThreadFactory.class.getName());

  static final String NAME_PREFIX = "airbrake-async-sender-";
  private static final AtomicInteger SENDERS = new AtomicInteger(1);

  private final String prefix;
  private final AtomicInteger threads = new AtomicInteger(1);
  private final AtomicInteger liveWorkers = new AtomicInteger();

  WorkerThreadFactory() {
    this.prefix = NAME_PREFIX + SENDERS.getAndIncrement() + "-";
  }

  @Override
  public Thread newThread(Runnable runnable) {
    Thread thread = new Thread(runnable, prefix + threads.getAndIncrement());
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler((t, e) ->
        logger.log(Level.SEVERE, "**Airbrake: async worker " + t.getName() + " died", e));
    return thread;
  }

  /**
   * Wraps a worker loop so that it counts as live from this call until the loop returns.
   * Counting starts before the executor runs the task, so {@link #liveWorkers()} is positive
   * as soon as a sender has been started.
   */
  Runnable worker(Runnable loop) {
    liveWorkers.incrementAndGet();
    return () -> {
      try {
        loop.run();
      } finally {
        liveWorkers.decrementAndGet();
      }
    };
  }

  int liveWorkers() {
    return liveWorkers.get();
  }

  String prefix() {
    return prefix;
  }
}
