package ca.gc.cra.vigil.config;

import ca.gc.cra.vigil.domain.assertion.ConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Resolves {@link AssertionSettings} from build defaults, YAML, properties, and CLI overrides.
 * <p><strong>Why:</strong> Hosts that inject their own evaluator, and the {@code vigil check} command, need the same
 * precedence rules: CLI &gt; YAML &gt; build defaults.</p>
 * <p><strong>Thread-safety:</strong> Stateless and thread-safe.</p>
 * <p><strong>Observability:</strong> Warns on unknown keys and on CLI values that shadow YAML values.</p>
 *
 * @since 0.1.0
 */
public final class AssertionSettingsLoader {
  private static final Logger log = LoggerFactory.getLogger(AssertionSettingsLoader.class);

  private AssertionSettingsLoader() {}

  /**
   * Loads settings from an optional YAML file and CLI overrides on top of build defaults.
   *
   * @param yamlPath YAML file; {@code null} or missing files contribute nothing
   * @param overrides CLI {@code key=value} overrides; may be {@code null}
   * @return effective settings
   * @throws IOException if the YAML file exists but cannot be read
   * @throws ConfigurationException if any value is malformed
   */
  public static AssertionSettings load(Path yamlPath, Map<String, String> overrides) throws IOException {
    Optional<Map<String, String>> yaml =
        yamlPath == null ? Optional.empty() : YamlConfigLoader.load(yamlPath);
    if (yamlPath != null && yaml.isEmpty()) {
      log.warn("Assertion config {} not found; using build defaults", yamlPath);
    }
    return AssertionSettings.fromMap(
        merge(AssertionSettings.buildDefaults(), yaml, overrides));
  }

  /**
   * Reads settings from a properties stream on top of build defaults.
   *
   * @param in properties stream; not closed by this method
   * @return effective settings
   * @throws IOException if reading the stream fails
   * @throws ConfigurationException if any value is malformed
   */
  public static AssertionSettings fromProperties(InputStream in) throws IOException {
    Objects.requireNonNull(in, "in");
    Properties props = new Properties();
    props.load(in);
    Map<String, String> values = new LinkedHashMap<>();
    for (String name : props.stringPropertyNames()) {
      values.put(name, props.getProperty(name));
    }
    return AssertionSettings.fromMap(merge(AssertionSettings.buildDefaults(), Optional.of(values), Map.of()));
  }

  /**
   * Merges sources with precedence CLI &gt; YAML &gt; defaults.
   *
   * @param defaults lowest-precedence values
   * @param yaml optional file values
   * @param cli highest-precedence overrides; may be {@code null}
   * @return merged map
   */
  static Map<String, String> merge(
      Map<String, String> defaults, Optional<Map<String, String>> yaml, Map<String, String> cli) {
    Map<String, String> yamlValues = yaml.orElse(Map.of());
    Map<String, String> cliValues = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults);
    putKnown(merged, yamlValues, "YAML");
    for (Map.Entry<String, String> entry : cliValues.entrySet()) {
      String key = entry.getKey();
      if (yamlValues.containsKey(key) && !Objects.equals(yamlValues.get(key), entry.getValue())) {
        log.warn("CLI value for {} overrides YAML value", key);
      }
    }
    putKnown(merged, cliValues, "CLI");
    return merged;
  }

  private static void putKnown(Map<String, String> target, Map<String, String> source, String origin) {
    for (Map.Entry<String, String> entry : source.entrySet()) {
      if (!AssertionSettings.KNOWN_KEYS.contains(entry.getKey())) {
        log.warn("Ignoring unknown {} assertion setting '{}'", origin, entry.getKey());
        continue;
      }
      log.debug("{} sets {}={}", origin, entry.getKey(), entry.getValue());
      target.put(entry.getKey(), entry.getValue());
    }
  }
}
