package ca.gc.cra.tbfs.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Parsed command line split into positional words, {@code key=value} pairs and flags.
 *
 * <p>{@code tbfs readtb path=/data/out --verbose} yields positional {@code [readtb]}, pair
 * {@code path=/data/out} and flag {@code --verbose}.</p>
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final List<String> positional;
  private final List<String> keyValueArgs;
  private final Set<String> flags;

  private CliInput(List<String> positional, List<String> keyValueArgs, Set<String> flags) {
    this.positional = positional;
    this.keyValueArgs = keyValueArgs;
    this.flags = flags;
  }

  /**
   * Parses raw arguments.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed representation
   */
  public static CliInput parse(String[] args) {
    List<String> positional = new ArrayList<>();
    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args != null) {
      for (String raw : args) {
        String arg = raw == null ? "" : raw.trim();
        if (arg.isEmpty()) {
          continue;
        }
        String lower = arg.toLowerCase(Locale.ROOT);
        if (HELP_FLAGS.contains(lower)) {
          flags.add("--help");
        } else if (VERBOSE_FLAGS.contains(lower)) {
          flags.add("--verbose");
        } else if (arg.startsWith("-") && !arg.contains("=")) {
          flags.add(lower);
        } else if (arg.contains("=")) {
          kv.add(arg);
        } else {
          positional.add(arg);
        }
      }
    }
    return new CliInput(List.copyOf(positional), List.copyOf(kv), Set.copyOf(flags));
  }

  /**
   * Returns the first positional word, the subcommand for the dispatcher.
   *
   * @return command in lower case, if any
   */
  public Optional<String> command() {
    return positional.isEmpty() ? Optional.empty() : Optional.of(positional.get(0).toLowerCase(Locale.ROOT));
  }

  /**
   * Returns positional words after the first one.
   *
   * @return remaining positional words
   */
  public List<String> operands() {
    return positional.size() <= 1 ? List.of() : positional.subList(1, positional.size());
  }

  /**
   * Returns the {@code key=value} arguments.
   *
   * @return array copy suitable for {@link CliArgsParser#toMap(String[])}
   */
  public String[] keyValueArgs() {
    return keyValueArgs.toArray(String[]::new);
  }

  /**
   * Indicates whether a help flag was supplied.
   *
   * @return {@code true} if help output was requested
   */
  public boolean help() {
    return flags.contains("--help");
  }

  /**
   * Indicates whether verbose logging was requested.
   *
   * @return {@code true} when --verbose (or equivalent) was present
   */
  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Checks whether a flag such as {@code --dry-run} was provided.
   *
   * @param flag flag to query (case-insensitive)
   * @return {@code true} if the flag was supplied
   */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Rebuilds the argument vector without the subcommand, for delegation.
   *
   * @return arguments minus the first positional word
   */
  public String[] withoutCommand() {
    List<String> rebuilt = new ArrayList<>(operands());
    rebuilt.addAll(keyValueArgs);
    rebuilt.addAll(flags);
    return rebuilt.toArray(String[]::new);
  }
}
