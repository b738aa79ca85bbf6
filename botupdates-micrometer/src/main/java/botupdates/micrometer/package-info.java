/**
 * Micrometer bridge for exporting hub metrics to Prometheus, Grafana, and other backends.
 *
 * @see botupdates.micrometer.MicrometerMetricsExporter
 */
package botupdates.micrometer;
