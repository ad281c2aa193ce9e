/**
 * Micrometer bridge for exporting sync worker metrics to Prometheus, Grafana, and other backends.
 *
 * @see siorgsync.micrometer.MicrometerMetricsExporter
 */
package siorgsync.micrometer;
