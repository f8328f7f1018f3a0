package ca.gc.cra.vigil.api;

import ca.gc.cra.vigil.config.AssertionSettings;
import ca.gc.cra.vigil.domain.assertion.ConfigurationException;
import ca.gc.cra.vigil.domain.assertion.LevelPolicy;
import ca.gc.cra.vigil.domain.assertion.SeverityLevel;
import java.io.IOException;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code vigil levels}: prints the severity order and which site levels the resolved threshold activates.
 *
 * @since 0.1.0
 */
public final class LevelsCli {
  private static final Logger log = LoggerFactory.getLogger(LevelsCli.class);
  static final String USAGE = "usage: vigil levels [config=vigil.yaml] [level=Warning|Error|NoAssertions]";

  private LevelsCli() {}

  /**
   * Runs the command.
   *
   * @param args {@code key=value} arguments
   * @return exit code
   */
  public static ExitCode run(String[] args) {
    AssertionSettings settings;
    try {
      settings = CheckCli.resolve(CliArgsParser.toMap(args));
    } catch (ConfigurationException ex) {
      log.error("Invalid assertion configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid arguments: {}", ex.getMessage());
      CliPrinter.println(USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read assertion configuration", ex);
      return ExitCode.IO_ERROR;
    }

    SeverityLevel threshold = settings.threshold();
    CliPrinter.println("threshold: " + threshold.configName());
    for (SeverityLevel level : SeverityLevel.values()) {
      String state;
      if (!level.isSiteLevel()) {
        state = "threshold-only";
      } else {
        state = LevelPolicy.isActive(level, threshold) ? "active" : "elided";
      }
      CliPrinter.println(String.format(Locale.ROOT, "%-13s %d %s", level.configName(), level.ordinal(), state));
    }
    return ExitCode.SUCCESS;
  }
}
