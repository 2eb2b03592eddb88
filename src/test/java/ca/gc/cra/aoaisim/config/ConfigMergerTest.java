package ca.gc.cra.aoaisim.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void precedenceIsDefaultsYamlEnvironmentCli() {
    Map<String, String> defaults = Map.of("server.port", "8000", "mode", "generate", "docIntelligence.rps", "15");
    Map<String, String> yaml = Map.of("server.port", "9000", "apiKey", "from-yaml", "docIntelligence.rps", "5");
    Map<String, String> env = Map.of("apiKey", "from-env", "docIntelligence.rps", "7");
    Map<String, String> cli = Map.of("docIntelligence.rps", "9");

    Map<String, String> merged =
        ConfigMerger.buildEffectiveConfig(Optional.of(yaml), env, cli, defaults, msg -> {});

    assertEquals("9000", merged.get("server.port"));
    assertEquals("from-env", merged.get("apiKey"));
    assertEquals("9", merged.get("docIntelligence.rps"));
    assertEquals("generate", merged.get("mode"));
  }

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> yaml = Map.of("apiKey", "k", "server.port", "9000");
    Map<String, String> cli = Map.of("server.port", "9100");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        Optional.of(yaml), Map.of(), cli, DefaultSettings.asFlatMap(), warnings::add);

    assertEquals("9100", merged.get("server.port"));
    assertEquals(List.of("CLI overrides YAML for key: server.port"), warnings);
  }

  @Test
  void missingApiKeyIsRejected() {
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            Optional.empty(), Map.of(), Map.of(), DefaultSettings.asFlatMap(), msg -> {}));
    assertTrue(ex.getMessage().contains("SIMULATOR_API_KEY"));
  }

  @Test
  void recordModeRequiresForwarder() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            Optional.empty(),
            Map.of("apiKey", "k", "mode", "record"),
            Map.of(),
            DefaultSettings.asFlatMap(),
            msg -> {}));
  }

  @Test
  void recordModeAcceptsEnvironmentForwarder() {
    Map<String, String> env = EnvironmentOverrides.from(Map.of(
        "SIMULATOR_API_KEY", "k",
        "SIMULATOR_MODE", "record",
        "AZURE_OPENAI_ENDPOINT", "https://example.openai.azure.com",
        "AZURE_OPENAI_KEY", "upstream")::get);

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        Optional.empty(), env, Map.of(), DefaultSettings.asFlatMap(), msg -> {});

    assertEquals(SimulatorMode.RECORD, SimulatorConfig.fromMap(merged).mode());
  }
}
