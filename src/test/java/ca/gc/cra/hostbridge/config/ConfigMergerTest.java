package ca.gc.cra.hostbridge.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("serve");
    Map<String, String> yaml = Map.of("port", "8100", "sceneName", "Arena");
    Map<String, String> cli = Map.of("port", "8200");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "serve",
        Optional.of(yaml),
        cli,
        defaults,
        warnings::add);

    assertEquals("8200", merged.get("port"));
    assertEquals("Arena", merged.get("sceneName"));
    assertEquals(List.of("CLI overrides YAML for key: port"), warnings);
  }

  @Test
  void cliTimeoutAliasReplacesYamlInvocationTimeout() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "serve",
        Optional.of(Map.of("invocationTimeoutMillis", "20000")),
        Map.of("timeoutMillis", "500"),
        DefaultsForMode.asFlatMap("serve"),
        msg -> {});

    assertFalse(merged.containsKey("invocationTimeoutMillis"));
    assertEquals(500L, BridgeConfig.fromMap(merged).invocationTimeoutMillis());
  }

  @Test
  void nonLoopbackHostIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "serve",
            Optional.empty(),
            Map.of("host", "0.0.0.0"),
            DefaultsForMode.asFlatMap("serve"),
            msg -> {}));
  }

  @Test
  void ephemeralPortOnlyForServe() {
    Map<String, String> serve = ConfigMerger.buildEffectiveConfig(
        "serve", Optional.empty(), Map.of("port", "0"), DefaultsForMode.asFlatMap("serve"), msg -> {});
    assertEquals("0", serve.get("port"));

    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "probe", Optional.empty(), Map.of("port", "0"), DefaultsForMode.asFlatMap("probe"), msg -> {}));
  }

  @Test
  void unknownExporterAndBatchModeAreRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "serve", Optional.empty(), Map.of("metricsExporter", "statsd"),
            DefaultsForMode.asFlatMap("serve"), msg -> {}));
    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "serve", Optional.empty(), Map.of("batchMode", "partial"),
            DefaultsForMode.asFlatMap("serve"), msg -> {}));
  }

  @Test
  void sendRequiresCommand() {
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "send", Optional.empty(), Map.of(), DefaultsForMode.asFlatMap("send"), msg -> {}));
    assertTrue(ex.getMessage().contains("command is required"));
  }
}
