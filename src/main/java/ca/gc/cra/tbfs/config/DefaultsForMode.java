package ca.gc.cra.tbfs.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each TBFS command family.
 *
 * <p>Modes: {@code readtb}, {@code writetb} and {@code fs} (the filesystem verbs).</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the defaults for {@code mode} merged over the common defaults.
   *
   * @param mode command family
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException if the mode is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (mode.trim().toLowerCase(Locale.ROOT)) {
      case "readtb" -> Map.of("limit", "0", "out", "");
      case "writetb" -> Map.of("in", "");
      case "fs" -> Map.of();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    ClusterConfig cluster = ClusterConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("hadoopCommand", cluster.hadoopCommand());
    map.put("hadoopHome", "");
    map.put("streamingJar", "");
    map.put("javaMemoryMb", Integer.toString(cluster.javaMemoryMb()));
    map.put("readers", Integer.toString(cluster.readers()));
    map.put("ignoreLogs", Boolean.toString(cluster.ignoreLogs()));
    map.put("failOnAbnormalExit", Boolean.toString(cluster.failOnAbnormalExit()));
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }
}
