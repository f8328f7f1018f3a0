package ca.gc.cra.vigil.domain.assertion;

import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * One declared invariant check.
 *
 * <p>The condition and message are suppliers so nothing is computed for an inactive site, and the message is
 * computed only after the condition has evaluated to {@code false}.</p>
 *
 * @param level site level; never {@link SeverityLevel#NO_ASSERTIONS}
 * @param expression rendered condition text used in diagnostics
 * @param condition lazily evaluated condition
 * @param message optional lazily evaluated message; may be {@code null}
 * @param location explicit call-site location, or {@code null} to resolve it from the stack on failure
 * @since 0.1.0
 */
public record AssertionSite(
    SeverityLevel level,
    String expression,
    BooleanSupplier condition,
    Supplier<String> message,
    SourceLocation location) {

  public AssertionSite {
    LevelPolicy.requireSiteLevel(level);
    Objects.requireNonNull(expression, "expression");
    Objects.requireNonNull(condition, "condition");
  }

  /**
   * Creates a site without a message whose location is resolved on failure.
   *
   * @param level site level
   * @param expression rendered condition text
   * @param condition lazily evaluated condition
   * @return new site
   */
  public static AssertionSite of(SeverityLevel level, String expression, BooleanSupplier condition) {
    return new AssertionSite(level, expression, condition, null, null);
  }

  /**
   * Creates a site with a message whose location is resolved on failure.
   *
   * @param level site level
   * @param expression rendered condition text
   * @param condition lazily evaluated condition
   * @param message lazily evaluated message; may be {@code null}
   * @return new site
   */
  public static AssertionSite of(
      SeverityLevel level, String expression, BooleanSupplier condition, Supplier<String> message) {
    return new AssertionSite(level, expression, condition, message, null);
  }

  /**
   * Returns a copy of this site pinned to an explicit location.
   *
   * @param at call-site location
   * @return new site
   */
  public AssertionSite at(SourceLocation at) {
    return new AssertionSite(level, expression, condition, message, at);
  }
}
