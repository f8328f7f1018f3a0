package ca.gc.cra.vigil.api;

import ca.gc.cra.vigil.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code vigil} CLI dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: vigil <levels|check> [key=value...]";
  private static final String HELP_TEXT = """
      Vigil assertion configuration tool

      Usage:
        vigil <command> [key=value...]

      Commands:
        levels   Show the severity order and which levels the threshold activates
        check    Validate assertion settings and print the effective values

      Settings:
        config=PATH          YAML file with an 'assertions' section
        level=NAME           Warning, Error, or NoAssertions (empty disables assertions)
        quitOnAssertion=BOOL Request process exit before raising error-level failures
        includeLocation=BOOL Prefix diagnostics with File.java:line
        metrics=MODE         none or otlp

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging
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
   * Dispatches a command and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments; the first non-flag token is the command
   * @return exit code
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled");
    }

    String[] remainder = input.arguments();
    if (remainder.length == 0) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = remainder[0].toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(remainder, 1, remainder.length);
    return switch (command) {
      case "levels" -> LevelsCli.run(delegateArgs);
      case "check" -> CheckCli.run(delegateArgs);
      default -> {
        log.error("Unknown command '{}'", remainder[0]);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
