/**
 * Admission limiters registered under the {@code openai} and {@code docintelligence} limiter keys.
 *
 * @since 0.1.0
 */
package ca.gc.cra.aoaisim.infrastructure.limiter;
