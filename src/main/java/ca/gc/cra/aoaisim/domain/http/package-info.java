/**
 * <strong>Purpose:</strong> Transport-neutral HTTP request and response values.
 * <p><strong>Pipeline role:</strong> Domain layer; produced by the HTTP adapter and consumed by routing,
 * pipeline stages and response producers.</p>
 * <p><strong>Concurrency:</strong> Immutable records; safe to share across event loop threads.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.aoaisim.domain.http;
