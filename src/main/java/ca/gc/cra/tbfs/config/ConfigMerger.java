package ca.gc.cra.tbfs.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > YAML > defaults.
   *
   * @param mode active command family
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    if (cli != null) {
      for (Map.Entry<String, String> entry : cli.entrySet()) {
        if (entry.getKey() == null || entry.getValue() == null) {
          continue;
        }
        if (yamlCopy.containsKey(entry.getKey()) && warn != null) {
          warn.accept("CLI overrides YAML for key: " + entry.getKey());
        }
        merged.put(entry.getKey(), entry.getValue());
      }
    }
    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    // Parsing the cluster section surfaces range and boolean errors before any command runs.
    ClusterConfig.fromMap(effective);
    if ("writetb".equalsIgnoreCase(mode.trim()) && trim(effective.get("in")).isEmpty()) {
      throw new IllegalArgumentException("writetb requires in=<local file>");
    }
    String limit = trim(effective.get("limit"));
    if (!limit.isEmpty()) {
      try {
        if (Long.parseLong(limit) < 0) {
          throw new IllegalArgumentException("limit must be >= 0 (was " + limit + ")");
        }
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("limit must be an integer (was '" + limit + "')", ex);
      }
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
