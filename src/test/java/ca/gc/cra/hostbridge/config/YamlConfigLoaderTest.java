package ca.gc.cra.hostbridge.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndModeSections() throws IOException {
    Path yaml = tempDir.resolve("hostbridge.yaml");
    Files.writeString(yaml, """
        common:
          port: 7800
          metricsExporter: none
        serve:
          port: 7900
          batchMode: ATOMIC
        """);

    Optional<Map<String, String>> result = YamlConfigLoader.load(yaml, "serve");

    assertTrue(result.isPresent());
    Map<String, String> map = result.orElseThrow();
    assertEquals("7900", map.get("port"));
    assertEquals("none", map.get("metricsExporter"));
    assertEquals("ATOMIC", map.get("batchMode"));
  }

  @Test
  void otherModeSectionsAreIgnored() throws IOException {
    Path yaml = tempDir.resolve("modes.yaml");
    Files.writeString(yaml, """
        serve:
          sceneName: Arena
        send:
          command: ping
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "probe").orElseThrow();

    assertTrue(map.isEmpty());
  }

  @Test
  void loadFlattensNestedMaps() throws IOException {
    Path yaml = tempDir.resolve("nested.yaml");
    Files.writeString(yaml, """
        serve:
          otel:
            endpoint: http://localhost:4317
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "serve").orElseThrow();

    assertEquals("http://localhost:4317", map.get("otel.endpoint"));
  }

  @Test
  void missingFileReturnsEmpty() throws IOException {
    assertFalse(YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "serve").isPresent());
  }

  @Test
  void arraysAreRejected() throws IOException {
    Path yaml = tempDir.resolve("array.yaml");
    Files.writeString(yaml, """
        serve:
          sceneName:
            - A
            - B
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "serve"));
  }

  @Test
  void unknownSectionIsRejected() throws IOException {
    Path yaml = tempDir.resolve("typo.yaml");
    Files.writeString(yaml, """
        common:
          port: 7800
        serv:
          port: 7900
        """);

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.load(yaml, "serve"));

    assertEquals("Unknown configuration section: serv", ex.getMessage());
  }

  @Test
  void sectionNamesIgnoreCaseButMayNotRepeat() throws IOException {
    Path yaml = tempDir.resolve("case.yaml");
    Files.writeString(yaml, """
        Serve:
          port: 7900
        """);
    assertEquals("7900", YamlConfigLoader.load(yaml, "serve").orElseThrow().get("port"));

    Files.writeString(yaml, """
        Serve:
          port: 7900
        serve:
          port: 7901
        """);
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.load(yaml, "serve"));
    assertEquals("Duplicate configuration section: serve", ex.getMessage());
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "common"));
    assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "deploy"));
  }

  @Test
  void malformedYamlIsRejected() throws IOException {
    Path yaml = tempDir.resolve("broken.yaml");
    Files.writeString(yaml, "serve: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "serve"));
  }
}
