package airbrake.micrometer;

import airbrake.AirbrakeConfig;
import airbrake.Notifier;
import airbrake.spi.HttpResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

    private SimpleMeterRegistry registry;
    private MicrometerMetricsExporter exporter;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        exporter = new MicrometerMetricsExporter(registry);
    }

    @Test
    void countsNoticeLifecycle() {
        exporter.incrementNoticeEnqueued();
        exporter.incrementNoticeEnqueued();
        exporter.incrementNoticeDropped();
        exporter.incrementNoticeIgnored();

        assertEquals(2.0, counter("airbrake.notice.enqueued").count());
        assertEquals(1.0, counter("airbrake.notice.dropped").count());
        assertEquals(1.0, counter("airbrake.notice.ignored").count());
    }

    @Test
    void countsDeliveries() {
        exporter.incrementDeliverySuccess();
        exporter.incrementDeliveryFailure();
        exporter.incrementDeliveryFailure();
        exporter.incrementSyncFallback();

        assertEquals(1.0, counter("airbrake.delivery.success").count());
        assertEquals(2.0, counter("airbrake.delivery.failure").count());
        assertEquals(1.0, counter("airbrake.fallback.sync").count());
    }

    @Test
    void tracksQueueDepthAndLatency() {
        exporter.recordQueueDepth(17);
        exporter.recordDeliveryLatencyMs(120);
        exporter.recordDeliveryLatencyMs(80);

        assertEquals(17.0, gauge("airbrake.queue.depth").value());
        DistributionSummary latency = registry.find("airbrake.delivery.latency.ms").summary();
        assertNotNull(latency);
        assertEquals(2, latency.count());
        assertEquals(200.0, latency.totalAmount());
    }

    @Test
    void customNamePrefix() {
        var custom = new MicrometerMetricsExporter(registry, "billing.airbrake");
        custom.incrementNoticeEnqueued();
        custom.recordQueueDepth(3);

        assertEquals(1.0, counter("billing.airbrake.notice.enqueued").count());
        assertEquals(3.0, gauge("billing.airbrake.queue.depth").value());
    }

    @Test
    void rejectsBadPrefix() {
        assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
        assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
        assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "airbrake."));
    }

    @Test
    void closeRemovesMetersAndStopsRecording() {
        exporter.close();
        exporter.incrementNoticeEnqueued();

        assertNull(registry.find("airbrake.notice.enqueued").counter());
        assertNull(registry.find("airbrake.queue.depth").gauge());
        assertTrue(registry.getMeters().isEmpty());
    }

    @Test
    void notifierReportsThroughExporter() {
        AirbrakeConfig config = AirbrakeConfig.builder()
                .projectId(1)
                .projectKey("key")
                .workers(0)
                .build();
        try (Notifier notifier = Notifier.builder(config)
                .transport((uri, body, headers) -> new HttpResult(201, "{\"id\":\"1\"}"))
                .metrics(exporter)
                .build()) {

            notifier.notify(new IllegalStateException("boom"));
            notifier.notifySync(new IllegalStateException("boom"));
        }

        assertEquals(1.0, counter("airbrake.fallback.sync").count());
        assertEquals(2.0, counter("airbrake.delivery.success").count());
        assertEquals(2, registry.find("airbrake.delivery.latency.ms").summary().count());
    }

    private Counter counter(String name) {
        Counter c = registry.find(name).counter();
        assertNotNull(c, "Counter not found: " + name);
        return c;
    }

    private Gauge gauge(String name) {
        Gauge g = registry.find(name).gauge();
        assertNotNull(g, "Gauge not found: " + name);
        return g;
    }
}
