/**
 * Record and replay support: upstream forwarding, YAML recording files and the handler that ties them to the
 * request pipeline.
 */
package ca.gc.cra.aoaisim.infrastructure.recording;
