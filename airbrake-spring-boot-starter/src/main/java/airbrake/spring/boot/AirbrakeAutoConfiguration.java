package airbrake.spring.boot;

import airbrake.AirbrakeConfig;
import airbrake.Notifier;
import airbrake.filter.NoticeFilter;
import airbrake.spi.MetricsExporter;
import airbrake.spi.Transport;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the Airbrake notifier.
 *
 * <p>Builds an {@link AirbrakeConfig} from {@link AirbrakeProperties} and a started
 * {@link Notifier} that is closed with the context. A {@link Transport} or
 * {@link MetricsExporter} bean replaces the default, and every {@link NoticeFilter} bean is
 * registered in {@code @Order} order. An invalid configuration fails context startup with
 * {@link airbrake.ConfigurationException}.
 *
 * @see AirbrakeProperties
 * @see AirbrakeMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(Notifier.class)
@ConditionalOnProperty(prefix = "airbrake", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(AirbrakeProperties.class)
public class AirbrakeAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public AirbrakeConfig airbrakeConfig(AirbrakeProperties props) {
        return AirbrakeConfig.builder()
                .projectId(props.getProjectId())
                .projectKey(props.getProjectKey())
                .host(props.getHost())
                .environment(props.getEnvironment())
                .ignoreEnvironments(props.getIgnoreEnvironments().toArray(String[]::new))
                .blacklistKeys(props.getBlacklistKeys().toArray(String[]::new))
                .whitelistKeys(props.getWhitelistKeys().toArray(String[]::new))
                .rootDirectory(props.getRootDirectory())
                .appVersion(props.getAppVersion())
                .timeout(props.getTimeout())
                .workers(props.getAsync().getWorkers())
                .queueSize(props.getAsync().getQueueSize())
                .drainTimeout(props.getAsync().getDrainTimeout())
                .build();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public Notifier airbrakeNotifier(AirbrakeConfig config,
                                     ObjectProvider<Transport> transportProvider,
                                     ObjectProvider<MetricsExporter> metricsProvider,
                                     ObjectProvider<NoticeFilter> filterProvider) {
        Notifier.Builder builder = Notifier.builder(config)
                .transport(transportProvider.getIfAvailable())
                .metrics(metricsProvider.getIfAvailable());
        filterProvider.orderedStream().forEach(builder::filter);
        return builder.build();
    }
}
