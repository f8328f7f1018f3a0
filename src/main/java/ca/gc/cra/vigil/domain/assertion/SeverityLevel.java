package ca.gc.cra.vigil.domain.assertion;

/**
 * <strong>What:</strong> Ordered severity of an assertion site, least to most severe.
 * <p><strong>Why:</strong> A single total order drives every activeness decision, so sites and thresholds
 * share one type.</p>
 * <p><strong>Role:</strong> Domain value used by {@link LevelPolicy}, the evaluator, and configuration.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 * <p><strong>Performance:</strong> Comparisons are ordinal based and constant time.</p>
 *
 * @implNote Declaration order is the severity order; do not reorder constants.
 * @since 0.1.0
 */
public enum SeverityLevel {
  /** Failure is logged and execution continues. */
  WARNING("Warning"),
  /** Failure raises an {@link AssertionFailure}. */
  ERROR("Error"),
  /** Threshold-only sentinel that disables every assertion site. */
  NO_ASSERTIONS("NoAssertions");

  private final String configName;

  SeverityLevel(String configName) {
    this.configName = configName;
  }

  /**
   * Returns the case-exact name accepted by configuration sources.
   *
   * @return configuration name such as {@code "Warning"}
   */
  public String configName() {
    return configName;
  }

  /**
   * Indicates whether this level may be declared by an assertion site.
   *
   * @return {@code false} only for {@link #NO_ASSERTIONS}
   */
  public boolean isSiteLevel() {
    return this != NO_ASSERTIONS;
  }

  @Override
  public String toString() {
    return configName;
  }
}
