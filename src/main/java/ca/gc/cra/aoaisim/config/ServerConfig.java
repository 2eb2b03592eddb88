package ca.gc.cra.aoaisim.config;

import ca.gc.cra.aoaisim.validation.Strings;

/**
 * HTTP listener settings.
 *
 * @param host bind address
 * @param port bind port; {@code 0} selects an ephemeral port
 * @param workerThreads Netty worker event loop threads
 * @param maxContentLength largest aggregated request body in bytes
 * @since 0.1.0
 */
public record ServerConfig(String host, int port, int workerThreads, int maxContentLength) {

  public ServerConfig {
    host = Strings.requireNonBlank("server.host", host);
  }
}
