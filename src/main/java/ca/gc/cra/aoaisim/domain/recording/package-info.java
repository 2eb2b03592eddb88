/**
 * Recorded upstream exchanges and the fingerprints used to match them in replay mode.
 *
 * @since 0.1.0
 */
package ca.gc.cra.aoaisim.domain.recording;
