package ca.gc.cra.vigil.config;

import ca.gc.cra.vigil.domain.assertion.ConfigurationException;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads assertion settings from a YAML document. Values under {@code assertions} override those under
 * {@code common}; both sections hold flat scalar settings.
 *
 * <pre>
 * common:
 *   metrics: none
 * assertions:
 *   level: Warning
 *   quitOnAssertion: false
 * </pre>
 */
public final class YamlConfigLoader {
  static final String COMMON_SECTION = "common";
  static final String ASSERTIONS_SECTION = "assertions";

  private YamlConfigLoader() {}

  /**
   * Loads the {@code common} and {@code assertions} sections.
   *
   * @param path YAML file location
   * @return settings keyed by name, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws ConfigurationException when the document is not a mapping of flat sections
   */
  public static Optional<Map<String, String>> load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new ConfigurationException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new ConfigurationException("YAML config at " + path + " must be a mapping of sections");
    }

    Map<String, String> settings = new LinkedHashMap<>();
    readSection(root, COMMON_SECTION, settings);
    readSection(root, ASSERTIONS_SECTION, settings);
    return Optional.of(settings);
  }

  private static void readSection(Map<?, ?> root, String name, Map<String, String> target) {
    if (!root.containsKey(name)) {
      return;
    }
    Object section = root.get(name);
    if (section == null) {
      return;
    }
    if (!(section instanceof Map<?, ?> entries)) {
      throw new ConfigurationException("YAML section '" + name + "' must be a mapping");
    }
    for (Map.Entry<?, ?> entry : entries.entrySet()) {
      String key = String.valueOf(entry.getKey());
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
        throw new ConfigurationException(
            "YAML setting '" + name + '.' + key + "' must be a scalar value");
      }
      target.put(key, value == null ? "" : value.toString());
    }
  }
}
