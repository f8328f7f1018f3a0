package ca.gc.cra.vigil.config;

import ca.gc.cra.vigil.domain.assertion.ConfigurationException;
import ca.gc.cra.vigil.domain.assertion.LevelPolicy;
import ca.gc.cra.vigil.domain.assertion.SeverityLevel;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Effective assertion configuration.
 *
 * @param threshold minimum active level; {@link SeverityLevel#NO_ASSERTIONS} disables every site
 * @param quitOnAssertion whether a failing error-level assertion requests host termination first
 * @param includeLocation whether diagnostics are prefixed with {@code File.java:line: }
 * @param metrics metrics exporter, {@code none} or {@code otlp}
 * @since 0.1.0
 */
public record AssertionSettings(
    SeverityLevel threshold, boolean quitOnAssertion, boolean includeLocation, String metrics) {

  /** Key holding the threshold name. */
  public static final String LEVEL = "level";
  /** Key holding the termination flag. */
  public static final String QUIT_ON_ASSERTION = "quitOnAssertion";
  /** Key holding the location-prefix flag. */
  public static final String INCLUDE_LOCATION = "includeLocation";
  /** Key holding the metrics exporter. */
  public static final String METRICS = "metrics";

  /** Prefix of the JVM system properties read by {@link #fromStartup()}, e.g. {@code -Dvigil.level=Warning}. */
  public static final String SYSTEM_PROPERTY_PREFIX = "vigil.";

  static final Set<String> KNOWN_KEYS = Set.of(LEVEL, QUIT_ON_ASSERTION, INCLUDE_LOCATION, METRICS);
  private static final Set<String> METRICS_EXPORTERS = Set.of("none", "otlp");

  public AssertionSettings {
    Objects.requireNonNull(threshold, "threshold");
    metrics = parseMetrics(metrics);
  }

  /**
   * Settings with every assertion disabled.
   *
   * @return disabled settings
   */
  public static AssertionSettings disabled() {
    return new AssertionSettings(SeverityLevel.NO_ASSERTIONS, false, false, "none");
  }

  /**
   * Settings baked into this artifact by the build.
   *
   * @return build-time settings
   * @throws ConfigurationException if a build property is malformed
   */
  public static AssertionSettings fromBuild() {
    return fromMap(buildDefaults());
  }

  /**
   * Build-time settings overridden by {@code vigil.<key>} JVM system properties. Read once by the process-wide
   * facade during class initialization.
   *
   * @return startup settings
   * @throws ConfigurationException if a build or system property value is malformed
   */
  public static AssertionSettings fromStartup() {
    return fromStartup(System.getProperties());
  }

  static AssertionSettings fromStartup(Properties system) {
    Objects.requireNonNull(system, "system");
    Map<String, String> values = new LinkedHashMap<>(buildDefaults());
    for (String key : KNOWN_KEYS) {
      String value = system.getProperty(SYSTEM_PROPERTY_PREFIX + key);
      if (value != null) {
        values.put(key, value);
      }
    }
    return fromMap(values);
  }

  /**
   * Raw build-time values keyed by setting name.
   *
   * @return immutable map of build values
   */
  public static Map<String, String> buildDefaults() {
    Map<String, String> values = new LinkedHashMap<>();
    values.put(LEVEL, BuildThreshold.LEVEL);
    values.put(QUIT_ON_ASSERTION, BuildThreshold.QUIT_ON_ASSERTION);
    values.put(INCLUDE_LOCATION, BuildThreshold.INCLUDE_LOCATION);
    values.put(METRICS, BuildThreshold.METRICS);
    return Map.copyOf(values);
  }

  /**
   * Builds settings from flat key/value pairs; absent keys take their disabled defaults.
   *
   * @param values configuration map; must not be {@code null}
   * @return parsed settings
   * @throws ConfigurationException if a value is malformed
   */
  public static AssertionSettings fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    SeverityLevel threshold = LevelPolicy.parse(values.get(LEVEL));
    boolean quit = parseBoolean(QUIT_ON_ASSERTION, values.get(QUIT_ON_ASSERTION));
    boolean location = parseBoolean(INCLUDE_LOCATION, values.get(INCLUDE_LOCATION));
    return new AssertionSettings(threshold, quit, location, values.get(METRICS));
  }

  /**
   * Renders the settings as the flat map accepted by {@link #fromMap(Map)}.
   *
   * @return ordered key/value view
   */
  public Map<String, String> toMap() {
    Map<String, String> values = new LinkedHashMap<>();
    values.put(LEVEL, threshold.configName());
    values.put(QUIT_ON_ASSERTION, Boolean.toString(quitOnAssertion));
    values.put(INCLUDE_LOCATION, Boolean.toString(includeLocation));
    values.put(METRICS, metrics);
    return values;
  }

  private static boolean parseBoolean(String key, String value) {
    if (value == null || value.isBlank()) {
      return false;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true" -> true;
      case "false" -> false;
      default -> throw new ConfigurationException(key + " must be true or false (was '" + value + "')");
    };
  }

  private static String parseMetrics(String value) {
    if (value == null || value.isBlank()) {
      return "none";
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    if (!METRICS_EXPORTERS.contains(normalized)) {
      throw new ConfigurationException(METRICS + " must be none or otlp (was '" + value + "')");
    }
    return normalized;
  }
}
