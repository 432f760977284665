package ca.gc.cra.tbfs.api;

import ca.gc.cra.tbfs.logging.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * TBFS CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE =
      "usage: tbfs <readtb|writetb|ls|rmr|put|get|exists|isdir|isempty|abspath> [options]";
  private static final String HELP_TEXT = """
      TBFS: typed bytes datasets over the hadoop command-line client

      Usage:
        tbfs <command> [key=value...] [flags]

      Commands:
        readtb      Read typed bytes files as key<TAB>value lines (readtb --help for details)
        writetb     Write key<TAB>value lines into a typed bytes file
        ls          List a cluster path
        rmr         Remove a cluster path recursively
        put         Copy a local file to the cluster
        get         Copy a cluster file to the local disk
        exists      Test whether a path exists (also isdir, isempty)
        abspath     Resolve a path against the cluster home directory

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to subcommand
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first positional word is the subcommand)
   * @return exit code reported by the delegated command
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.command().isEmpty()) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String command = input.command().get();
    String[] delegateArgs = input.withoutCommand();
    return switch (command) {
      case "readtb" -> ReadCli.run(delegateArgs);
      case "writetb" -> WriteCli.run(delegateArgs);
      default -> {
        if (FsCli.VERBS.contains(command)) {
          yield FsCli.run(command, delegateArgs);
        }
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
