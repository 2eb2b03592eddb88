/**
 * Time source adapters.
 *
 * @since 0.1.0
 */
package ca.gc.cra.aoaisim.infrastructure.time;
