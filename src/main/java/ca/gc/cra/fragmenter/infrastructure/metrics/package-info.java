/**
 * Metrics adapters implementing {@link ca.gc.cra.fragmenter.application.port.MetricsPort}.
 * <p>{@link ca.gc.cra.fragmenter.infrastructure.metrics.OpenTelemetryMetricsAdapter} maps dotted metric keys
 * onto lazily created OpenTelemetry counters and histograms; exporter selection follows the standard
 * {@code otel.*} system properties and {@code OTEL_*} environment variables.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.fragmenter.infrastructure.metrics;
