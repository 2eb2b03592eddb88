/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and sanitize values before emission.
 * <p><strong>Concurrency:</strong> Stateless helpers.</p>
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.</p>
 * <p><strong>Security:</strong> {@link ca.gc.cra.aoaisim.logging.Logs#mask(String)} keeps API keys out of logs.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.aoaisim.logging;
