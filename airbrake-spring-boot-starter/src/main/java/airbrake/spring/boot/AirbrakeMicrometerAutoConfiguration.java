package airbrake.spring.boot;

import airbrake.micrometer.MicrometerMetricsExporter;
import airbrake.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath, a
 * {@link MeterRegistry} bean exists and {@code airbrake.metrics.enabled} is true (default).
 * Runs after actuator's meter registry auto-configuration, so that its registry is visible to
 * the bean condition, and before {@link AirbrakeAutoConfiguration}, so that the notifier picks
 * the exporter up.
 */
@AutoConfiguration(before = AirbrakeAutoConfiguration.class,
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "airbrake.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(AirbrakeProperties.class)
public class AirbrakeMicrometerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(MetricsExporter.class)
    public MicrometerMetricsExporter micrometerMetricsExporter(
            MeterRegistry meterRegistry, AirbrakeProperties props) {
        return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
    }
}
