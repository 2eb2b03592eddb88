/**
 * <strong>Purpose:</strong> OpenTelemetry wiring for the simulator's histograms and request spans.
 * <p><strong>Concurrency:</strong> OpenTelemetry instruments are thread-safe; adapters hold no mutable state.</p>
 * <p><strong>Observability:</strong> Exporters default to {@code none}; enable with
 * {@code metricsExporter=otlp} / {@code tracesExporter=otlp} on the command line.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.aoaisim.infrastructure.telemetry;
