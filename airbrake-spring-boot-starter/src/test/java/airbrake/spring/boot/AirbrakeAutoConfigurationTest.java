package airbrake.spring.boot;

import airbrake.AirbrakeConfig;
import airbrake.ConfigurationException;
import airbrake.NoticeResponse;
import airbrake.Notifier;
import airbrake.Outcome;
import airbrake.filter.NoticeFilter;
import airbrake.spi.HttpResult;
import airbrake.spi.Transport;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AirbrakeAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(AirbrakeAutoConfiguration.class));

    private static final String[] REQUIRED = {
            "airbrake.project-id=113743",
            "airbrake.project-key=81bbff95d52f8856c770bb39e827f3f6"
    };

    // ── Bean creation ───────────────────────────────────────────

    @Test
    void createsNotifierFromProperties() {
        runner.withPropertyValues(REQUIRED)
                .withPropertyValues(
                        "airbrake.environment=production",
                        "airbrake.ignore-environments=test,development",
                        "airbrake.blacklist-keys=password",
                        "airbrake.async.workers=2",
                        "airbrake.async.queue-size=10",
                        "airbrake.timeout=3s")
                .run(ctx -> {
                    assertNotNull(ctx.getBean(Notifier.class));
                    AirbrakeConfig config = ctx.getBean(AirbrakeConfig.class);
                    assertEquals(113743L, config.projectId());
                    assertEquals("production", config.environment());
                    assertEquals(2, config.ignoreEnvironments().size());
                    assertEquals(1, config.blacklistKeys().size());
                    assertEquals(2, config.workers());
                    assertEquals(10, config.queueSize());
                    assertEquals(Duration.ofSeconds(3), config.timeout());
                    assertFalse(config.isIgnoredEnvironment());
                });
    }

    @Test
    void failsStartupWhenProjectIdMissing() {
        runner.withPropertyValues("airbrake.project-key=abc").run(ctx -> {
            assertNotNull(ctx.getStartupFailure());
            Throwable root = ctx.getStartupFailure();
            while (root.getCause() != null) {
                root = root.getCause();
            }
            assertInstanceOf(ConfigurationException.class, root);
            assertEquals("projectId is required", root.getMessage());
        });
    }

    @Test
    void disabledWhenPropertyFalse() {
        runner.withPropertyValues(REQUIRED)
                .withPropertyValues("airbrake.enabled=false")
                .run(ctx -> {
                    assertFalse(ctx.containsBean("airbrakeNotifier"));
                    assertFalse(ctx.containsBean("airbrakeConfig"));
                });
    }

    @Test
    void closesNotifierWithContext() {
        Notifier[] holder = new Notifier[1];
        runner.withPropertyValues(REQUIRED).run(ctx -> holder[0] = ctx.getBean(Notifier.class));
        assertTrue(holder[0].isClosed());
    }

    // ── Collaborator beans ──────────────────────────────────────

    @Test
    void usesTransportBean() {
        runner.withPropertyValues(REQUIRED)
                .withPropertyValues("airbrake.async.workers=0")
                .withUserConfiguration(TransportConfig.class)
                .run(ctx -> {
                    Notifier notifier = ctx.getBean(Notifier.class);
                    Outcome<NoticeResponse> outcome = notifier.notifySync(new IllegalStateException("boom"));

                    Outcome.Resolved<NoticeResponse> resolved =
                            assertInstanceOf(Outcome.Resolved.class, outcome);
                    assertEquals("1", resolved.value().id());
                    assertEquals(1, ctx.getBean(CountingTransport.class).calls.get());
                });
    }

    @Test
    void registersNoticeFilterBeansInOrder() {
        runner.withPropertyValues(REQUIRED)
                .withPropertyValues("airbrake.async.workers=0")
                .withUserConfiguration(TransportConfig.class, FilterConfig.class)
                .run(ctx -> {
                    Notifier notifier = ctx.getBean(Notifier.class);
                    Outcome<NoticeResponse> outcome = notifier.notifySync(new IllegalStateException("boom"));

                    Outcome.Rejected<NoticeResponse> rejected =
                            assertInstanceOf(Outcome.Rejected.class, outcome);
                    assertTrue(rejected.reason().endsWith("was marked as ignored"));
                    assertEquals(List.of("first", "second"), ctx.getBean(FilterConfig.class).seen);
                    assertEquals(0, ctx.getBean(CountingTransport.class).calls.get());
                });
    }

    @Test
    void backsOffWhenNotifierBeanPresent() {
        runner.withUserConfiguration(CustomNotifierConfig.class).run(ctx -> {
            assertTrue(ctx.containsBean("customNotifier"));
            assertFalse(ctx.containsBean("airbrakeNotifier"));
        });
    }

    // ── Test configurations ─────────────────────────────────────

    static class CountingTransport implements Transport {
        final AtomicInteger calls = new AtomicInteger();

        @Override
        public HttpResult post(URI uri, String jsonPayload, Map<String, String> headers) {
            int n = calls.incrementAndGet();
            return new HttpResult(201, "{\"id\":\"" + n + "\",\"url\":\"https://airbrake.io/locate/" + n + "\"}");
        }
    }

    @Configuration
    static class TransportConfig {
        @Bean
        CountingTransport countingTransport() {
            return new CountingTransport();
        }
    }

    @Configuration
    static class FilterConfig {
        final List<String> seen = new CopyOnWriteArrayList<>();

        @Bean
        @Order(2)
        NoticeFilter secondFilter() {
            return notice -> {
                seen.add("second");
                notice.ignore();
            };
        }

        @Bean
        @Order(1)
        NoticeFilter firstFilter() {
            return notice -> seen.add("first");
        }
    }

    @Configuration
    static class CustomNotifierConfig {
        @Bean(destroyMethod = "close")
        Notifier customNotifier() {
            return Notifier.create(AirbrakeConfig.builder()
                    .projectId(1)
                    .projectKey("key")
                    .workers(0)
                    .build());
        }
    }
}
