package com.onthegomap.buildingtiles.config;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class ArgumentsTest {

  @TempDir
  Path tmpDir;

  private Path writeConfig() throws IOException {
    Path path = tmpDir.resolve("server.properties");
    Files.writeString(path, """
      # utrecht buildings
      db=/data/utrecht.sqlite
      port=9000
      layer_name=panden
      """);
    return path;
  }

  @Test
  void testMissingKeyUsesDefault() {
    Arguments args = Arguments.of();
    assertEquals("buildings", args.getString("table", "table", "buildings"));
    assertEquals(8080, args.getInteger("port", "port", 8080));
    assertEquals(0.5, args.getDouble("map_opacity", "opacity", 0.5));
    assertNull(args.file("config", "config", null));
  }

  @Test
  void testEarlierSourceWins() {
    Arguments args = Arguments.of("port", "9000", "host", "0.0.0.0")
      .orElse(Arguments.of("port", "9999", "table", "panden"));

    assertEquals(9000, args.getInteger("port", "port", 8080));
    assertEquals("0.0.0.0", args.getString("host", "host", "127.0.0.1"));
    assertEquals("panden", args.getString("table", "table", "buildings"));
    assertEquals("buildings", args.getString("layer_name", "layer", "buildings"));
  }

  @Test
  void testReadsPropertiesFile() throws IOException {
    Arguments args = Arguments.fromConfigFile(writeConfig());

    assertEquals(Path.of("/data/utrecht.sqlite"), args.file("db", "db", null));
    assertEquals(9000, args.getInteger("port", "port", 8080));
    assertEquals(Map.of(
      "db", "/data/utrecht.sqlite",
      "port", "9000",
      "layer_name", "panden"
    ), args.toMap());
  }

  @Test
  void testMissingConfigFileFails() {
    Path missing = tmpDir.resolve("nope.properties");
    var error = assertThrows(IllegalArgumentException.class, () -> Arguments.fromConfigFile(missing));
    assertTrue(error.getMessage().contains("nope.properties"), error.getMessage());
  }

  @Test
  void testCommandLineOverridesConfigFile() throws IOException {
    Arguments args = Arguments.fromArgsOrConfigFile("config=" + writeConfig(), "--port=7000");

    assertEquals(7000, args.getInteger("port", "port", 8080));
    assertEquals("panden", args.getString("layer_name", "layer", "buildings"));
    assertEquals("127.0.0.1", args.getString("host", "host", "127.0.0.1"));
  }

  @Test
  void testNoConfigFile() {
    Arguments args = Arguments.fromArgsOrConfigFile("min_zoom=12");
    assertEquals(12, args.getInteger("min_zoom", "min zoom", 10));
    assertEquals(16, args.getInteger("max_zoom", "max zoom", 16));
  }

  @ParameterizedTest
  @CsvSource({
    "5, PT5S",
    "5s, PT5S",
    "250ms, PT0.25S",
    "2m, PT2M",
    "1h30m, PT1H30M",
    "0s, PT0S",
  })
  void testDurationFormats(String value, String expected) {
    assertEquals(Duration.parse(expected),
      Arguments.of("query_timeout", value).getDuration("query_timeout", "timeout", "1s"));
  }

  @Test
  void testDurationDefault() {
    assertEquals(Duration.ofSeconds(5), Arguments.of().getDuration("query_timeout", "timeout", "5s"));
  }

  @ParameterizedTest
  @ValueSource(strings = {"soon", "5 seconds", "-"})
  void testInvalidDuration(String value) {
    Arguments args = Arguments.of("query_timeout", value);
    assertThrows(IllegalArgumentException.class, () -> args.getDuration("query_timeout", "timeout", "1s"));
  }

  @Test
  void testInvalidNumberNamesTheKey() {
    var error = assertThrows(IllegalArgumentException.class,
      () -> Arguments.of("port", "http").getInteger("port", "port", 8080));
    assertEquals("Invalid value for port: http", error.getMessage());
    assertThrows(IllegalArgumentException.class,
      () -> Arguments.of("map_opacity", "half").getDouble("map_opacity", "opacity", 0.5));
  }

  @Test
  void testValuesAreTrimmed() {
    assertEquals(9000, Arguments.of("port", " 9000 ").getInteger("port", "port", 8080));
  }

  @Test
  void testThreadsHasAFloorOfTwo() {
    assertEquals(6, Arguments.of("threads", "6").threads());
    assertEquals(2, Arguments.of("threads", "1").threads());
    assertTrue(Arguments.of().threads() >= 2);
  }

  @ParameterizedTest
  @CsvSource({
    "true, true",
    "TRUE, true",
    "false, false",
    "yes, false",
  })
  void testBoolean(String value, boolean expected) {
    assertEquals(expected, Arguments.of("metrics", value).getBoolean("metrics", "metrics", !expected));
  }

  @Test
  void testStatsFollowMetricsFlag() {
    assertTrue(Arguments.of("metrics", "false").getStats().metricsText().isEmpty());
    try (var stats = Arguments.of().getStats()) {
      assertFalse(stats.metricsText().isEmpty());
    }
  }

  @Test
  void testFlagWithoutValueIsTrue() {
    assertTrue(Arguments.fromArgs("--metrics").getBoolean("metrics", "metrics", false));
  }

  @ParameterizedTest
  @ValueSource(strings = {"--min-zoom=12", "--min_zoom=12", "--MIN_ZOOM=12", "min.zoom=12", "-min-zoom=12"})
  void testKeySpellings(String arg) {
    assertEquals(12, Arguments.fromArgs(arg).getInteger("min_zoom", "min zoom", 10));
  }

  @Test
  void testSpaceSeparatedArgs() {
    Arguments args = Arguments.fromArgs("--db /data/nl.sqlite --port 9000 --metrics --public-url http://tiles".split(" "));

    assertEquals(Map.of(
      "db", "/data/nl.sqlite",
      "port", "9000",
      "metrics", "true",
      "public_url", "http://tiles"
    ), args.toMap());
  }

  @Test
  void testNoArgs() {
    assertEquals(Map.of(), Arguments.fromArgs().toMap());
  }

  @Test
  void testEnvironmentVariables() {
    Map<String, String> env = Map.of(
      "HOME", "/root",
      "BUILDINGTILESPORT", "1",
      "BUILDINGTILES_PORT", "9000",
      "BUILDINGTILES_MIN_ZOOM", "13"
    );
    Arguments args = Arguments.fromEnvironment(env::get, env::keySet);

    assertEquals(Map.of("port", "9000", "min_zoom", "13"), args.toMap());
    assertEquals(13, args.getInteger("min-zoom", "min zoom", 10));
  }

  @Test
  void testJvmProperties() {
    Map<String, String> properties = Map.of(
      "java.version", "17",
      "BUILDINGTILES_PORT", "9000",
      "buildingtiles.host", "0.0.0.0",
      "buildingtiles.layer_name", "panden"
    );
    Arguments args = Arguments.fromJvmProperties(properties::get, properties::keySet);

    assertEquals(Map.of("host", "0.0.0.0", "layer_name", "panden"), args.toMap());
    assertEquals("panden", args.getString("layer_name", "layer", "buildings"));
  }

  @Test
  void testJvmPropertiesBeforeEnvironment() {
    Map<String, String> env = Map.of("BUILDINGTILES_PORT", "9000", "BUILDINGTILES_HOST", "localhost");
    Map<String, String> jvm = Map.of("buildingtiles.host", "0.0.0.0");
    Arguments args = Arguments.fromJvmProperties(jvm::get, jvm::keySet)
      .orElse(Arguments.fromEnvironment(env::get, env::keySet));

    assertEquals(Map.of("host", "0.0.0.0", "port", "9000"), args.toMap());
  }
}
