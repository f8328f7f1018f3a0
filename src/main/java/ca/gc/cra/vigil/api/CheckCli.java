package ca.gc.cra.vigil.api;

import ca.gc.cra.vigil.config.AssertionSettings;
import ca.gc.cra.vigil.config.AssertionSettingsLoader;
import ca.gc.cra.vigil.domain.assertion.ConfigurationException;
import ca.gc.cra.vigil.validation.Strings;
import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code vigil check}: resolves assertion settings the way a host would and prints the effective values, failing
 * with {@link ExitCode#CONFIG_ERROR} when any value is malformed.
 *
 * @since 0.1.0
 */
public final class CheckCli {
  private static final Logger log = LoggerFactory.getLogger(CheckCli.class);
  static final String USAGE =
      "usage: vigil check [config=vigil.yaml] [level=Warning|Error|NoAssertions] [quitOnAssertion=true|false]"
          + " [includeLocation=true|false] [metrics=none|otlp]";

  private CheckCli() {}

  /**
   * Runs the command.
   *
   * @param args {@code key=value} arguments
   * @return exit code
   */
  public static ExitCode run(String[] args) {
    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(args);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid arguments: {}", ex.getMessage());
      CliPrinter.println(USAGE);
      return ExitCode.INVALID_ARGS;
    }

    AssertionSettings settings;
    try {
      settings = resolve(kv);
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

    for (Map.Entry<String, String> entry : settings.toMap().entrySet()) {
      CliPrinter.println(entry.getKey() + '=' + entry.getValue());
    }
    return ExitCode.SUCCESS;
  }

  /**
   * Resolves settings from CLI arguments; {@code config} names an optional YAML file.
   *
   * @param kv parsed arguments
   * @return effective settings
   * @throws IOException if the YAML file cannot be read
   * @throws ConfigurationException if a value is malformed
   */
  static AssertionSettings resolve(Map<String, String> kv) throws IOException {
    Map<String, String> overrides = new LinkedHashMap<>(kv);
    String config = overrides.remove("config");
    Path yaml = null;
    if (config != null) {
      try {
        yaml = Path.of(Strings.requireNonBlank("config", config));
      } catch (InvalidPathException ex) {
        throw new IllegalArgumentException("config is not a valid path: " + config, ex);
      }
    }
    AssertionSettings settings = AssertionSettingsLoader.load(yaml, overrides);
    log.debug("Resolved assertion settings {}", settings);
    return settings;
  }
}
