package airbrake.micrometer;

import airbrake.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link MetricsExporter} that publishes notifier activity to a Micrometer {@link MeterRegistry}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code airbrake.notice.enqueued}: notices queued for async delivery</li>
 *   <li>{@code airbrake.notice.dropped}: notices rejected because the async sender was closed</li>
 *   <li>{@code airbrake.notice.ignored}: notices suppressed by environment or filters</li>
 *   <li>{@code airbrake.delivery.success}: notices and deploys accepted by the collector</li>
 *   <li>{@code airbrake.delivery.failure}: deliveries that failed or were refused</li>
 *   <li>{@code airbrake.fallback.sync}: {@code notify} calls delivered synchronously because
 *       no async worker was running</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code airbrake.queue.depth}: notices waiting in the async queue</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code airbrake.delivery.latency.ms}: time spent in the transport per request</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    public static final String DEFAULT_PREFIX = "airbrake";

    private final MeterRegistry registry;
    private final Counter noticeEnqueued;
    private final Counter noticeDropped;
    private final Counter noticeIgnored;
    private final Counter deliverySuccess;
    private final Counter deliveryFailure;
    private final Counter syncFallback;
    private final Gauge queueDepthGauge;
    private final DistributionSummary deliveryLatency;

    private final AtomicInteger queueDepth = new AtomicInteger();
    private volatile boolean closed;

    /**
     * Creates an exporter with the meter name prefix {@value #DEFAULT_PREFIX}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    /**
     * Creates an exporter with a custom meter name prefix, for applications running more
     * than one notifier.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "billing.airbrake"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.noticeEnqueued = Counter.builder(namePrefix + ".notice.enqueued")
                .description("Notices queued for async delivery")
                .register(registry);
        this.noticeDropped = Counter.builder(namePrefix + ".notice.dropped")
                .description("Notices rejected because the async sender was closed")
                .register(registry);
        this.noticeIgnored = Counter.builder(namePrefix + ".notice.ignored")
                .description("Notices suppressed by an ignored environment or a filter")
                .register(registry);
        this.deliverySuccess = Counter.builder(namePrefix + ".delivery.success")
                .description("Deliveries accepted by the collector")
                .register(registry);
        this.deliveryFailure = Counter.builder(namePrefix + ".delivery.failure")
                .description("Deliveries that failed or were refused")
                .register(registry);
        this.syncFallback = Counter.builder(namePrefix + ".fallback.sync")
                .description("Async notifications delivered synchronously for lack of workers")
                .register(registry);

        this.queueDepthGauge = Gauge.builder(namePrefix + ".queue.depth", queueDepth, AtomicInteger::get)
                .description("Notices waiting in the async queue")
                .register(registry);

        this.deliveryLatency = DistributionSummary.builder(namePrefix + ".delivery.latency.ms")
                .description("Transport time per delivery in milliseconds")
                .register(registry);
    }

    @Override
    public void incrementNoticeEnqueued() {
        if (closed) return;
        noticeEnqueued.increment();
    }

    @Override
    public void incrementNoticeDropped() {
        if (closed) return;
        noticeDropped.increment();
    }

    @Override
    public void incrementNoticeIgnored() {
        if (closed) return;
        noticeIgnored.increment();
    }

    @Override
    public void incrementDeliverySuccess() {
        if (closed) return;
        deliverySuccess.increment();
    }

    @Override
    public void incrementDeliveryFailure() {
        if (closed) return;
        deliveryFailure.increment();
    }

    @Override
    public void incrementSyncFallback() {
        if (closed) return;
        syncFallback.increment();
    }

    @Override
    public void recordQueueDepth(int depth) {
        if (closed) return;
        queueDepth.set(depth);
    }

    @Override
    public void recordDeliveryLatencyMs(long latencyMs) {
        if (closed) return;
        deliveryLatency.record(latencyMs);
    }

    /**
     * Removes every meter registered by this exporter from the registry, so that a closed
     * notifier leaves no stale gauge behind.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(noticeEnqueued, noticeDropped, noticeIgnored,
                deliverySuccess, deliveryFailure, syncFallback,
                queueDepthGauge, deliveryLatency)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
