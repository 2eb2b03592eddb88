/**
 * Non-blocking delay scheduling for latency emulation.
 *
 * @since 0.1.0
 */
package ca.gc.cra.aoaisim.infrastructure.scheduling;
