/**
 * Command-line entry points. {@link ca.gc.cra.aoaisim.api.Main} dispatches to
 * {@link ca.gc.cra.aoaisim.api.ServeCli}, which merges configuration and runs the simulator until shutdown.
 */
package ca.gc.cra.aoaisim.api;
