package ca.gc.cra.vigil.config;

/**
 * Assertion settings baked in at build time from the Maven properties {@code vigil.assert.level},
 * {@code vigil.assert.quit}, {@code vigil.assert.location}, and {@code vigil.assert.metrics}.
 *
 * <p>Generated by {@code templating-maven-plugin}; edit the template under {@code src/main/java-templates}.</p>
 *
 * @since 0.1.0
 */
public final class BuildThreshold {
  /** Threshold name; empty means {@code NoAssertions}. */
  public static final String LEVEL = "${vigil.assert.level}";
  /** Whether a failing error-level assertion requests JVM exit. */
  public static final String QUIT_ON_ASSERTION = "${vigil.assert.quit}";
  /** Whether diagnostics carry a {@code File.java:line: } prefix. */
  public static final String INCLUDE_LOCATION = "${vigil.assert.location}";
  /** Metrics exporter for the process-wide facade. */
  public static final String METRICS = "${vigil.assert.metrics}";

  private BuildThreshold() {}
}
