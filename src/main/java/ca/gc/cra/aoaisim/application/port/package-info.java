/**
 * <strong>Purpose:</strong> Ports defining the simulator pipeline's collaborators.
 * <p><strong>Pipeline role:</strong> Application layer; infrastructure adapters implement these interfaces.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 * <p><strong>Observability:</strong> {@link ca.gc.cra.aoaisim.application.port.MetricsPort} and
 * {@link ca.gc.cra.aoaisim.application.port.TracePort} are the only telemetry seams.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.aoaisim.application.port;
