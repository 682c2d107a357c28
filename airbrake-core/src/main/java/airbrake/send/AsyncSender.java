package airbrake.send;

import airbrake.Notice;
import airbrake.NoticeResponse;
import airbrake.Promise;
import airbrake.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Background delivery through a bounded queue drained by a fixed pool of daemon workers.
 *
 * <p>Lifecycle: {@code NEW -> OPEN -> CLOSING -> CLOSED}. Notices may be queued while
 * {@code NEW} or {@code OPEN}, but only {@link #start()} launches the workers. A full queue
 * blocks {@link #send} until a worker frees a slot. {@link #close()} stops accepting work,
 * lets the workers drain the queue within the drain timeout, and rejects whatever is left, so
 * that every accepted promise reaches a terminal state.
 *
 * <p>Workers deliver through a shared {@link SyncSender}. Notices are delivered at most once;
 * with more than one worker, delivery order is not guaranteed.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class AsyncSender implements NoticeSender, AutoCloseable {
  private static final Logger logger = Logger.getLogger(AsyncSender.class.getName());

  static final String CLOSED_REASON = "AsyncSender is closed";
  private static final long QUEUE_POLL_TIMEOUT_MS = 50;

  /** Lifecycle states. */
  public enum State { NEW, OPEN, CLOSING, CLOSED }

  private final SyncSender syncSender;
  private final BlockingQueue<QueuedNotice> queue;
  private final ExecutorService workers;
  private final int workerCount;
  private final long drainTimeoutMs;
  private final MetricsExporter metrics;
  private final AtomicReference<State> state = new AtomicReference<>(State.NEW);
  private final WorkerThreadFactory threadFactory = new WorkerThreadFactory();

  private AsyncSender(Builder builder) {
    this.syncSender = Objects.requireNonNull(builder.syncSender, "syncSender");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    if (builder.workerCount < 0) {
      throw new IllegalArgumentException("workerCount must be >= 0");
    }
    if (builder.queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be > 0");
    }
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.workerCount = builder.workerCount;
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.queue = new ArrayBlockingQueue<>(builder.queueCapacity);
    this.workers = workerCount > 0
        ? Executors.newFixedThreadPool(workerCount, threadFactory)
        : null;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Launches the workers and opens the sender. Has no effect unless the sender is {@code NEW}.
   *
   * @return this sender
   */
  public AsyncSender start() {
    if (!state.compareAndSet(State.NEW, State.OPEN)) {
      return this;
    }
    if (workerCount == 0) {
      logger.warning("**Airbrake: workerCount=0: no async workers started; "
          + "notices will be delivered synchronously");
      return this;
    }
    for (int i = 0; i < workerCount; i++) {
      workers.execute(threadFactory.worker(this::workerLoop));
    }
    return this;
  }

  /**
   * Queues {@code notice} for background delivery, blocking while the queue is full.
   *
   * <p>The promise is rejected with {@value #CLOSED_REASON} if the sender is closing or
   * closed, including when it closes while this call waits for queue space.
   */
  @Override
  public Promise<NoticeResponse> send(Notice notice, Promise<NoticeResponse> promise) {
    QueuedNotice item = new QueuedNotice(notice, promise);
    try {
      while (true) {
        if (!isAccepting()) {
          return drop(promise);
        }
        if (queue.offer(item, QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
          break;
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      metrics.incrementNoticeDropped();
      return promise.reject("interrupted while queueing notice");
    }
    metrics.incrementNoticeEnqueued();
    metrics.recordQueueDepth(queue.size());
    // close() may have finished its final sweep between the state check and the offer
    if (state.get() == State.CLOSED && queue.remove(item)) {
      return drop(promise);
    }
    return promise;
  }

  /**
   * Returns {@code true} if at least one worker is running.
   */
  public boolean hasWorkers() {
    return threadFactory.liveWorkers() > 0;
  }

  /**
   * Returns {@code true} once {@link #close()} has been called.
   */
  public boolean isClosed() {
    State s = state.get();
    return s == State.CLOSING || s == State.CLOSED;
  }

  public State state() {
    return state.get();
  }

  public int queueSize() {
    return queue.size();
  }

  private boolean isAccepting() {
    State s = state.get();
    return s == State.NEW || s == State.OPEN;
  }

  private Promise<NoticeResponse> drop(Promise<NoticeResponse> promise) {
    metrics.incrementNoticeDropped();
    return promise.reject(CLOSED_REASON);
  }

  private void workerLoop() {
    while (!Thread.currentThread().isInterrupted()) {
      try {
        if (state.get() != State.OPEN && queue.isEmpty()) {
          break;
        }
        QueuedNotice item = queue.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        if (item == null) {
          continue;
        }
        metrics.recordQueueDepth(queue.size());
        deliver(item);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "**Airbrake: async sender loop error", t);
      }
    }
  }

  private void deliver(QueuedNotice item) {
    try {
      syncSender.send(item.notice(), item.promise());
    } catch (RuntimeException | Error e) {
      item.promise().reject(e.getMessage() != null ? e.getMessage() : e.getClass().getName());
      throw e;
    }
  }

  /**
   * Stops accepting notices, waits up to the drain timeout for queued notices to be
   * delivered, then stops the workers. Notices still queued afterwards are rejected.
   * Idempotent.
   */
  @Override
  public void close() {
    State previous = state.getAndUpdate(s -> s == State.CLOSED ? s : State.CLOSING);
    if (previous == State.CLOSING || previous == State.CLOSED) {
      return;
    }
    try {
      if (workers != null) {
        workers.shutdown();
        if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
          logger.log(Level.WARNING, "**Airbrake: drain timeout exceeded; forcing shutdown. "
              + "Notices remaining: " + queue.size());
          workers.shutdownNow();
          workers.awaitTermination(5, TimeUnit.SECONDS);
        }
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    } finally {
      state.set(State.CLOSED);
      rejectRemaining();
    }
  }

  private void rejectRemaining() {
    List<QueuedNotice> remaining = new ArrayList<>();
    queue.drainTo(remaining);
    for (QueuedNotice item : remaining) {
      drop(item.promise());
    }
    metrics.recordQueueDepth(queue.size());
  }

  /** Builder for {@link AsyncSender}. */
  public static final class Builder {
    private SyncSender syncSender;
    private int workerCount = 1;
    private int queueCapacity = 100;
    private long drainTimeoutMs = 5000;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the sender used by workers for the actual delivery.
     *
     * <p><b>Required.</b>
     *
     * @param syncSender the delivering sender
     * @return this builder
     */
    public Builder syncSender(SyncSender syncSender) {
      this.syncSender = syncSender;
      return this;
    }

    /**
     * Sets the number of worker threads.
     *
     * <p>Optional. Defaults to {@code 1}. {@code 0} starts no workers; {@link AsyncSender#hasWorkers()}
     * then stays {@code false}.
     *
     * @param workerCount number of workers
     * @return this builder
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Sets the queue capacity.
     *
     * <p>Optional. Defaults to {@code 100}.
     *
     * @param queueCapacity maximum queued notices
     * @return this builder
     */
    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public AsyncSender build() {
      return new AsyncSender(this);
    }
  }
}
