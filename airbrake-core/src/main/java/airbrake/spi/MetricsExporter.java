package airbrake.spi;

/**
 * Observability hook for exporting notifier counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. The {@code airbrake-micrometer}
 * module provides a Micrometer bridge.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of notices accepted onto the async queue.
     */
    void incrementNoticeEnqueued();

    /**
     * Increments the count of notices rejected by the async sender because it was closed
     * or interrupted before they could be queued or delivered.
     */
    void incrementNoticeDropped();

    /**
     * Increments the count of payloads accepted by the remote endpoint.
     */
    void incrementDeliverySuccess();

    /**
     * Increments the count of payloads that failed at transport level or were rejected remotely.
     */
    void incrementDeliveryFailure();

    /**
     * Increments the count of notices suppressed by an ignored environment or a filter.
     */
    default void incrementNoticeIgnored() {
    }

    /**
     * Increments the count of {@code notify} calls that fell back to synchronous delivery.
     */
    default void incrementSyncFallback() {
    }

    /**
     * Records the current depth of the async queue.
     *
     * @param depth number of queued notices
     */
    void recordQueueDepth(int depth);

    /**
     * Records the duration of one transport call.
     *
     * @param latencyMs latency in milliseconds (always non-negative)
     */
    default void recordDeliveryLatencyMs(long latencyMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementNoticeEnqueued() {
        }

        @Override
        public void incrementNoticeDropped() {
        }

        @Override
        public void incrementDeliverySuccess() {
        }

        @Override
        public void incrementDeliveryFailure() {
        }

        @Override
        public void recordQueueDepth(int depth) {
        }
    }
}
