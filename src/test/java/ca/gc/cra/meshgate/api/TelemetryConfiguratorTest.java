package ca.gc.cra.meshgate.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TelemetryConfiguratorTest {

  @AfterEach
  void clearProperties() {
    System.clearProperty("otel.metrics.exporter");
    System.clearProperty("otel.exporter.otlp.endpoint");
    System.clearProperty("otel.resource.attributes");
  }

  @Test
  void copiesSettingsToSystemPropertiesAndConsumesKeys() {
    Map<String, String> args = new HashMap<>();
    args.put("metricsExporter", "OTLP");
    args.put("otelEndpoint", "http://collector:4317");
    args.put("otelResourceAttributes", "site=ottawa");
    args.put("radio", "gw");

    TelemetryConfigurator.configureMetrics(args);

    assertEquals("otlp", System.getProperty("otel.metrics.exporter"));
    assertEquals("http://collector:4317", System.getProperty("otel.exporter.otlp.endpoint"));
    assertEquals("site=ottawa", System.getProperty("otel.resource.attributes"));
    assertEquals(Map.of("radio", "gw"), args);
  }

  @Test
  void blankSettingsAreSkipped() {
    Map<String, String> args = new HashMap<>(Map.of("otelEndpoint", " "));

    TelemetryConfigurator.configureMetrics(args);

    assertFalse(args.containsKey("otelEndpoint"));
    assertEquals(null, System.getProperty("otel.exporter.otlp.endpoint"));
  }

  @Test
  void rejectsUnknownExporterAndBadEndpoint() {
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(new HashMap<>(Map.of("metricsExporter", "prometheus"))));
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(new HashMap<>(Map.of("otelEndpoint", "ftp://collector"))));
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(new HashMap<>(Map.of("otelEndpoint", "http://"))));
  }
}
