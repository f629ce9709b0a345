/**
 * Micrometer bridge for exporting deployment metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link modeldeploy.micrometer.MicrometerMetricsExporter} implements the
 * {@link modeldeploy.spi.MetricsExporter} SPI using Micrometer counters, a timer and a
 * distribution summary.
 *
 * @see modeldeploy.micrometer.MicrometerMetricsExporter
 */
package modeldeploy.micrometer;
