package ca.gc.cra.meshgate.config;

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
  void serveSectionOverridesCommon() throws IOException {
    Path yaml = tempDir.resolve("meshgate.yaml");
    Files.writeString(yaml, """
        common:
          metricsExporter: none
          httpPort: 8000
        serve:
          radio: 192.168.1.50
          httpPort: 9090
        """);

    Optional<Map<String, String>> result = YamlConfigLoader.load(yaml, "serve");

    assertTrue(result.isPresent());
    Map<String, String> map = result.orElseThrow();
    assertEquals("none", map.get("metricsExporter"));
    assertEquals("192.168.1.50", map.get("radio"));
    assertEquals("9090", map.get("httpPort"));
  }

  @Test
  void nestedKeysAreFlattenedWithDots() throws IOException {
    Path yaml = tempDir.resolve("nested.yaml");
    Files.writeString(yaml, """
        serve:
          otel:
            endpoint: http://collector:4317
          httpHost:
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "SERVE").orElseThrow();

    assertEquals("http://collector:4317", map.get("otel.endpoint"));
    assertEquals("", map.get("httpHost"));
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");

    assertTrue(YamlConfigLoader.load(yaml, "serve").orElseThrow().isEmpty());
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    assertFalse(YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "serve").isPresent());
  }

  @Test
  void listRootIsRejected() throws IOException {
    Path yaml = tempDir.resolve("invalid.yaml");
    Files.writeString(yaml, """
        - serve:
            radio: gw
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "serve"));
  }

  @Test
  void arraysAreRejected() throws IOException {
    Path yaml = tempDir.resolve("array.yaml");
    Files.writeString(yaml, """
        serve:
          radio: [a, b]
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "serve"));
  }

  @Test
  void malformedYamlIsReportedAsInvalidArgument() throws IOException {
    Path yaml = tempDir.resolve("broken.yaml");
    Files.writeString(yaml, "serve: {radio: gw\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "serve"));
  }
}
