package ca.gc.cra.aoaisim.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Record/replay persistence settings.
 *
 * @param directory directory holding one YAML file per recorded path
 * @param autosave persist after every recorded exchange
 * @param forwarders upstream targets in match order
 * @since 0.1.0
 */
public record RecordingConfig(Path directory, boolean autosave, List<ForwarderConfig> forwarders) {

  public RecordingConfig {
    Objects.requireNonNull(directory, "directory");
    forwarders = forwarders == null ? List.of() : List.copyOf(forwarders);
  }
}
