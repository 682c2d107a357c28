package airbrake.spring.boot;

import airbrake.Notifier;
import airbrake.micrometer.MicrometerMetricsExporter;
import airbrake.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration;
import org.springframework.boot.actuate.autoconfigure.metrics.MetricsAutoConfiguration;
import org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AirbrakeMicrometerAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    AirbrakeMicrometerAutoConfiguration.class, AirbrakeAutoConfiguration.class))
            .withPropertyValues(
                    "airbrake.project-id=113743",
                    "airbrake.project-key=81bbff95d52f8856c770bb39e827f3f6",
                    "airbrake.async.workers=0");

    @Test
    void createsMicrometerExporterByDefault() {
        runner.withUserConfiguration(MeterRegistryConfig.class).run(ctx -> {
            assertTrue(ctx.containsBean("micrometerMetricsExporter"));
            assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
            assertNotNull(ctx.getBean(MeterRegistry.class).find("airbrake.notice.enqueued").counter());
        });
    }

    @Test
    void createsExporterWhenRegistryComesFromActuator() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(
                        MetricsAutoConfiguration.class,
                        SimpleMetricsExportAutoConfiguration.class,
                        CompositeMeterRegistryAutoConfiguration.class,
                        AirbrakeMicrometerAutoConfiguration.class,
                        AirbrakeAutoConfiguration.class))
                .withPropertyValues(
                        "airbrake.project-id=113743",
                        "airbrake.project-key=81bbff95d52f8856c770bb39e827f3f6",
                        "airbrake.async.workers=0")
                .run(ctx -> {
                    assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
                    assertNotNull(ctx.getBean(MeterRegistry.class).find("airbrake.delivery.failure").counter());
                });
    }

    @Test
    void respectsCustomNamePrefix() {
        runner.withUserConfiguration(MeterRegistryConfig.class)
                .withPropertyValues("airbrake.metrics.name-prefix=billing.airbrake")
                .run(ctx -> {
                    var registry = ctx.getBean(MeterRegistry.class);
                    assertNotNull(registry.find("billing.airbrake.delivery.success").counter());
                });
    }

    @Test
    void disabledWhenPropertyFalse() {
        runner.withUserConfiguration(MeterRegistryConfig.class)
                .withPropertyValues("airbrake.metrics.enabled=false")
                .run(ctx -> {
                    assertFalse(ctx.containsBean("micrometerMetricsExporter"));
                    assertNotNull(ctx.getBean(Notifier.class));
                });
    }

    @Test
    void skippedWithoutMeterRegistry() {
        runner.run(ctx -> {
            assertFalse(ctx.containsBean("micrometerMetricsExporter"));
            assertNotNull(ctx.getBean(Notifier.class));
        });
    }

    @Test
    void backsOffWhenCustomMetricsExporterPresent() {
        runner.withUserConfiguration(MeterRegistryConfig.class, CustomExporterConfig.class).run(ctx -> {
            var exporter = ctx.getBean(MetricsExporter.class);
            assertFalse(exporter instanceof MicrometerMetricsExporter);
        });
    }

    @Configuration
    static class MeterRegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration
    static class CustomExporterConfig {
        @Bean
        MetricsExporter customMetricsExporter() {
            return MetricsExporter.NOOP;
        }
    }
}
