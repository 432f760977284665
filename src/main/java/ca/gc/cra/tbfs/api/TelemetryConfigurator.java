package ca.gc.cra.tbfs.api;

import ca.gc.cra.tbfs.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies telemetry settings from the effective configuration into the system properties read by the
 * OpenTelemetry bootstrap.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Applies {@code metricsExporter}, {@code otelEndpoint}, {@code otelResourceAttributes} and
   * {@code otelExportIntervalMs}; blank values leave the corresponding property untouched.
   *
   * @param effective merged configuration
   * @return {@code true} when metrics export is enabled
   * @throws IllegalArgumentException if a value is invalid
   */
  static boolean configureMetrics(Map<String, String> effective) {
    String exporter = value(effective, "metricsExporter").toLowerCase(Locale.ROOT);
    if (!exporter.isEmpty()) {
      if (!exporter.equals("otlp") && !exporter.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
      System.setProperty("otel.metrics.exporter", exporter);
    }
    String endpoint = value(effective, "otelEndpoint");
    if (!endpoint.isEmpty()) {
      validateEndpoint(endpoint);
      System.setProperty("otel.exporter.otlp.endpoint", endpoint);
    }
    String attributes = value(effective, "otelResourceAttributes");
    if (!attributes.isEmpty()) {
      Strings.requirePrintableAscii("otelResourceAttributes", attributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      System.setProperty("otel.resource.attributes", attributes);
    }
    String interval = value(effective, "otelExportIntervalMs");
    if (!interval.isEmpty()) {
      try {
        if (Long.parseLong(interval) <= 0) {
          throw new IllegalArgumentException("otelExportIntervalMs must be positive");
        }
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("otelExportIntervalMs must be an integer", ex);
      }
      System.setProperty("otel.metric.export.interval", interval);
    }
    boolean enabled = !"none".equals(System.getProperty("otel.metrics.exporter", "none"));
    log.debug("Metrics export {} (endpoint={})", enabled ? "enabled" : "disabled",
        System.getProperty("otel.exporter.otlp.endpoint", "<default>"));
    return enabled;
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }

  private static String value(Map<String, String> map, String key) {
    String raw = map == null ? null : map.get(key);
    return raw == null ? "" : raw.trim();
  }
}
