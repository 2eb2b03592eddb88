/** Netty HTTP listener for the simulator. */
package ca.gc.cra.aoaisim.infrastructure.http;
