/**
 * Micrometer binding for the notifier's {@link airbrake.spi.MetricsExporter}.
 */
package airbrake.micrometer;
