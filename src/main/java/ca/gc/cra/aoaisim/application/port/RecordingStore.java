package ca.gc.cra.aoaisim.application.port;

import ca.gc.cra.aoaisim.domain.recording.RecordedExchange;
import java.io.IOException;
import java.util.List;

/**
 * Durable storage for recorded exchanges, grouped by request path.
 *
 * @since 0.1.0
 */
public interface RecordingStore {
  /**
   * Loads every stored exchange.
   *
   * @return exchanges in storage order
   * @throws IOException when the store cannot be read
   */
  List<RecordedExchange> loadAll() throws IOException;

  /**
   * Replaces the stored exchanges for one request path.
   *
   * @param path request path without query string
   * @param exchanges exchanges recorded for that path
   * @throws IOException when the store cannot be written
   */
  void write(String path, List<RecordedExchange> exchanges) throws IOException;
}
