package ca.gc.cra.vigil.domain.assertion;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * <strong>What:</strong> Ordering, parsing, and activeness rules for {@link SeverityLevel}.
 * <p><strong>Why:</strong> Keeps the decision "is this site compiled in" in one place so the facade,
 * injected evaluators, and configuration tooling agree.</p>
 * <p><strong>Role:</strong> Domain service; static helpers plus an immutable instance bound to one threshold.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Compare levels by declaration order ({@code Warning < Error < NoAssertions}).</li>
 *   <li>Parse case-exact level names, defaulting absent values to {@link SeverityLevel#NO_ASSERTIONS}.</li>
 *   <li>Reject {@link SeverityLevel#NO_ASSERTIONS} as a site level.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across threads.</p>
 * <p><strong>Performance:</strong> Per-level activeness is precomputed at construction.</p>
 *
 * @since 0.1.0
 */
public final class LevelPolicy {
  private static final String ACCEPTED_NAMES = Arrays.stream(SeverityLevel.values())
      .map(SeverityLevel::configName)
      .collect(Collectors.joining(", "));

  private final SeverityLevel threshold;
  private final Map<SeverityLevel, Boolean> active;

  private LevelPolicy(SeverityLevel threshold) {
    this.threshold = threshold;
    Map<SeverityLevel, Boolean> table = new EnumMap<>(SeverityLevel.class);
    for (SeverityLevel level : SeverityLevel.values()) {
      if (level.isSiteLevel()) {
        table.put(level, isActive(level, threshold));
      }
    }
    this.active = table;
  }

  /**
   * Creates a policy bound to the given threshold.
   *
   * @param threshold configured threshold; must not be {@code null}
   * @return immutable policy
   */
  public static LevelPolicy forThreshold(SeverityLevel threshold) {
    return new LevelPolicy(Objects.requireNonNull(threshold, "threshold"));
  }

  /**
   * Compares two levels under the severity order.
   *
   * @param a first level; must not be {@code null}
   * @param b second level; must not be {@code null}
   * @return negative, zero, or positive as {@code a} is less, equal, or more severe than {@code b}
   */
  public static int compare(SeverityLevel a, SeverityLevel b) {
    Objects.requireNonNull(a, "a");
    Objects.requireNonNull(b, "b");
    return Integer.compare(a.ordinal(), b.ordinal());
  }

  /**
   * Parses an optional level name.
   *
   * @param name configured name; empty optional or empty string selects {@link SeverityLevel#NO_ASSERTIONS}
   * @return parsed level
   * @throws ConfigurationException if the name is non-empty and matches no level exactly
   */
  public static SeverityLevel parse(Optional<String> name) {
    Objects.requireNonNull(name, "name");
    return parse(name.orElse(null));
  }

  /**
   * Parses a level name where {@code null} means absent.
   *
   * @param name configured name; {@code null} or {@code ""} selects {@link SeverityLevel#NO_ASSERTIONS}
   * @return parsed level
   * @throws ConfigurationException if the name is non-empty and matches no level exactly, whitespace included
   */
  public static SeverityLevel parse(String name) {
    if (name == null || name.isEmpty()) {
      return SeverityLevel.NO_ASSERTIONS;
    }
    for (SeverityLevel level : SeverityLevel.values()) {
      if (level.configName().equals(name)) {
        return level;
      }
    }
    throw new ConfigurationException(
        "Unknown assertion level '" + name + "' (expected one of " + ACCEPTED_NAMES + ")");
  }

  /**
   * Decides whether a site of {@code siteLevel} is active under {@code threshold}.
   *
   * @param siteLevel level declared by the site; must be {@link SeverityLevel#WARNING} or
   *     {@link SeverityLevel#ERROR}
   * @param threshold configured threshold
   * @return {@code true} when {@code siteLevel >= threshold}
   * @throws IllegalArgumentException if {@code siteLevel} is {@link SeverityLevel#NO_ASSERTIONS}
   */
  public static boolean isActive(SeverityLevel siteLevel, SeverityLevel threshold) {
    requireSiteLevel(siteLevel);
    return compare(siteLevel, Objects.requireNonNull(threshold, "threshold")) >= 0;
  }

  /**
   * Validates that a level may be declared by an assertion site.
   *
   * @param level candidate level
   * @return the same level for fluent call sites
   * @throws IllegalArgumentException if {@code level} is {@link SeverityLevel#NO_ASSERTIONS}
   */
  public static SeverityLevel requireSiteLevel(SeverityLevel level) {
    Objects.requireNonNull(level, "level");
    if (!level.isSiteLevel()) {
      throw new IllegalArgumentException(
          level.configName() + " is a threshold value and cannot be used as an assertion level");
    }
    return level;
  }

  /**
   * Returns the threshold this policy was built for.
   *
   * @return configured threshold
   */
  public SeverityLevel threshold() {
    return threshold;
  }

  /**
   * Instance form of {@link #isActive(SeverityLevel, SeverityLevel)} using the precomputed table.
   *
   * @param siteLevel level declared by the site
   * @return {@code true} when the site should be evaluated
   * @throws IllegalArgumentException if {@code siteLevel} is {@link SeverityLevel#NO_ASSERTIONS}
   */
  public boolean isActive(SeverityLevel siteLevel) {
    return active.get(requireSiteLevel(siteLevel));
  }

  @Override
  public String toString() {
    return "LevelPolicy[threshold=" + threshold.configName() + ']';
  }
}
