package com.exo.steel.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.StringReader;
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
    Path yaml = tempDir.resolve("steel.yaml");
    Files.writeString(yaml, """
        common:
          metrics:
            exporter: none
          verification:
            pinLength: 4
        live:
          metrics:
            exporter: otlp
        simulate:
          simulation:
            pin: "4321"
        """);

    Optional<Map<String, String>> live = YamlConfigLoader.load(yaml, RunMode.LIVE);

    assertTrue(live.isPresent());
    Map<String, String> map = live.orElseThrow();
    assertEquals("otlp", map.get("metrics.exporter"));
    assertEquals("4", map.get("verification.pinLength"));
    assertFalse(map.containsKey("simulation.pin"));

    Map<String, String> simulate = YamlConfigLoader.load(yaml, RunMode.SIMULATE).orElseThrow();
    assertEquals("none", simulate.get("metrics.exporter"));
    assertEquals("4321", simulate.get("simulation.pin"));
  }

  @Test
  void listsAreJoinedWithCommas() {
    Map<String, String> map = YamlConfigLoader.parse(new StringReader("""
        simulate:
          simulation:
            digits: [1, 2, 3, 4]
        """), "inline", RunMode.SIMULATE);

    assertEquals("1,2,3,4", map.get("simulation.digits"));
  }

  @Test
  void sectionNamesAreCaseInsensitive() {
    Map<String, String> map = YamlConfigLoader.parse(new StringReader("""
        Simulate:
          logging:
            verbose: true
        """), "inline", RunMode.SIMULATE);

    assertEquals("true", map.get("logging.verbose"));
  }

  @Test
  void emptyDocumentYieldsEmptyMap() {
    assertTrue(YamlConfigLoader.parse(new StringReader(""), "inline", RunMode.LIVE).isEmpty());
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    assertFalse(YamlConfigLoader.load(tempDir.resolve("missing.yaml"), RunMode.LIVE).isPresent());
  }

  @Test
  void invalidRootStructureThrows() throws IOException {
    Path yaml = tempDir.resolve("invalid.yaml");
    Files.writeString(yaml, """
        - live:
            metrics: none
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, RunMode.LIVE));
  }

  @Test
  void malformedYamlThrows() {
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.parse(
        new StringReader("common: [unclosed"), "inline", RunMode.LIVE));
  }

  @Test
  void nestedListsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.parse(new StringReader("""
        common:
          simulation:
            digits: [[1, 2]]
        """), "inline", RunMode.LIVE));
  }
}
