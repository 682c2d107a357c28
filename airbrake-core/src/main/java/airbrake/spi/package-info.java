/**
 * Service-provider interfaces the notifier delegates to.
 *
 * <p>{@link airbrake.spi.Transport} performs the network call and
 * {@link airbrake.spi.MetricsExporter} receives counters and gauges. Both have default
 * implementations; replace them through {@link airbrake.Notifier.Builder}.
 */
package airbrake.spi;
