/**
 * Executor and thread factory helpers.
 *
 * @since 0.1.0
 */
package ca.gc.cra.aoaisim.infrastructure.exec;
