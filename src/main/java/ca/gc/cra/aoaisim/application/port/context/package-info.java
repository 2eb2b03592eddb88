/**
 * Per-request context shared by the pipeline stages of a single request.
 *
 * @since 0.1.0
 */
package ca.gc.cra.aoaisim.application.port.context;
