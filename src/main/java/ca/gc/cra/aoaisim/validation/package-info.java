/**
 * <strong>Purpose:</strong> Input validation helpers for configuration and CLI values.
 * <p><strong>Concurrency:</strong> Stateless utilities.</p>
 * <p><strong>Security:</strong> Rejects control characters so header names and credentials read from the
 * environment cannot smuggle line breaks into upstream requests.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.aoaisim.validation;
