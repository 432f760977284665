package ca.gc.cra.tbfs.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TelemetryConfiguratorTest {
  private static final List<String> PROPERTIES = List.of(
      "otel.metrics.exporter",
      "otel.exporter.otlp.endpoint",
      "otel.resource.attributes",
      "otel.metric.export.interval");

  private final Map<String, String> saved = new HashMap<>();

  @BeforeEach
  void saveProperties() {
    for (String name : PROPERTIES) {
      saved.put(name, System.getProperty(name));
    }
  }

  @AfterEach
  void restoreProperties() {
    for (String name : PROPERTIES) {
      String value = saved.get(name);
      if (value == null) {
        System.clearProperty(name);
      } else {
        System.setProperty(name, value);
      }
    }
  }

  @Test
  void otlpSettingsBecomeSystemProperties() {
    boolean enabled = TelemetryConfigurator.configureMetrics(Map.of(
        "metricsExporter", "OTLP",
        "otelEndpoint", "http://collector:4317",
        "otelResourceAttributes", "deployment.environment=test",
        "otelExportIntervalMs", "5000"));

    assertTrue(enabled);
    assertEquals("otlp", System.getProperty("otel.metrics.exporter"));
    assertEquals("http://collector:4317", System.getProperty("otel.exporter.otlp.endpoint"));
    assertEquals("deployment.environment=test", System.getProperty("otel.resource.attributes"));
    assertEquals("5000", System.getProperty("otel.metric.export.interval"));
  }

  @Test
  void noneDisablesExport() {
    assertFalse(TelemetryConfigurator.configureMetrics(Map.of("metricsExporter", "none")));
  }

  @Test
  void invalidValuesAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(Map.of("metricsExporter", "prometheus")));
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(Map.of("otelEndpoint", "ftp://collector")));
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(Map.of("otelExportIntervalMs", "0")));
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(Map.of("otelExportIntervalMs", "soon")));
  }
}
