/**
 * Configuration model, layered loading (defaults, YAML, environment, CLI) and the composition root.
 */
package ca.gc.cra.aoaisim.config;
