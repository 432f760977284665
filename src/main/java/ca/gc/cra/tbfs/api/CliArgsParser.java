package ca.gc.cra.tbfs.api;

import ca.gc.cra.tbfs.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} CLI arguments into a lookup map.
 *
 * <p>Keys in {@link #LIST_KEYS} may be repeated; their values are joined with commas so
 * {@code path=/a path=/b} equals {@code path=/a,/b}. Any other repeated key is an error. Stateless and
 * thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  /** Keys whose repeated occurrences accumulate. */
  public static final Set<String> LIST_KEYS = Set.of("path");

  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

  private CliArgsParser() {}

  /**
   * Converts arguments into a mutable map split on the first {@code '='}.
   *
   * @param args raw CLI arguments; {@code null} returns an empty map
   * @return mutable, insertion-ordered map
   * @throws IllegalArgumentException if an argument is malformed or a non-list key repeats
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      String arg = raw == null ? "" : raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      int idx = arg.indexOf('=');
      if (idx <= 0) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      String value = arg.substring(idx + 1).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      if (!value.isEmpty()) {
        Strings.requireNonBlank(key, value);
      }
      String previous = map.get(key);
      if (previous == null) {
        map.put(key, value);
      } else if (LIST_KEYS.contains(key)) {
        map.put(key, previous.isEmpty() ? value : previous + "," + value);
      } else {
        throw new IllegalArgumentException("argument " + key + " given more than once");
      }
    }
    return map;
  }
}
