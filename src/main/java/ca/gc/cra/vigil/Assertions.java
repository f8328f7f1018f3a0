package ca.gc.cra.vigil;

import ca.gc.cra.vigil.application.assertion.AssertionEvaluator;
import ca.gc.cra.vigil.config.AssertionSettings;
import ca.gc.cra.vigil.config.CompositionRoot;
import ca.gc.cra.vigil.domain.assertion.AssertionFailure;
import ca.gc.cra.vigil.domain.assertion.LevelPolicy;
import ca.gc.cra.vigil.domain.assertion.SeverityLevel;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * <strong>What:</strong> Process-wide assertion entry points bound to the threshold baked in at build time,
 * or to a {@code -Dvigil.level=...} override given when the JVM starts.
 * <p><strong>Why:</strong> Call sites should read like {@code assert}: one static call, no wiring.</p>
 * <p><strong>Role:</strong> Call-site surface over {@link AssertionEvaluator}.</p>
 * <p><strong>Thread-safety:</strong> All state is {@code static final} and written once during class
 * initialization.</p>
 * <p><strong>Performance:</strong> {@link #WARNINGS_ENABLED} and {@link #ERRORS_ENABLED} are constant after
 * class initialization, so the JIT folds an inactive site to nothing. Conditions and messages are lambdas that
 * an inactive site never invokes. Guard expensive lambda captures with the flags:
 * <pre>
 * if (Assertions.ERRORS_ENABLED) {
 *   Assertions.error("len &lt; cap", () -&gt; len &lt; cap, () -&gt; "bound check");
 * }
 * </pre>
 * <p><strong>Observability:</strong> Warnings are logged via SLF4J; errors raise {@link AssertionFailure}.</p>
 *
 * @implNote A malformed build-time or startup level fails class initialization, so a misconfigured process stops
 *     at startup.
 * @since 0.1.0
 */
public final class Assertions {
  /** Threshold in effect for this process. */
  public static final SeverityLevel THRESHOLD;
  /** {@code true} when warning-level sites are compiled in. */
  public static final boolean WARNINGS_ENABLED;
  /** {@code true} when error-level sites are compiled in. */
  public static final boolean ERRORS_ENABLED;

  private static final AssertionEvaluator EVALUATOR;

  static {
    AssertionSettings settings = AssertionSettings.fromStartup();
    THRESHOLD = settings.threshold();
    WARNINGS_ENABLED = LevelPolicy.isActive(SeverityLevel.WARNING, THRESHOLD);
    ERRORS_ENABLED = LevelPolicy.isActive(SeverityLevel.ERROR, THRESHOLD);
    EVALUATOR = CompositionRoot.processEvaluator(settings);
  }

  private Assertions() {}

  /**
   * Warning-level check without a message.
   *
   * @param expression rendered condition text
   * @param condition evaluated only when warnings are enabled
   */
  public static void warn(String expression, BooleanSupplier condition) {
    if (WARNINGS_ENABLED) {
      EVALUATOR.check(SeverityLevel.WARNING, expression, condition, null);
    }
  }

  /**
   * Warning-level check with a lazily built message.
   *
   * @param expression rendered condition text
   * @param condition evaluated only when warnings are enabled
   * @param message invoked only when the condition is {@code false}
   */
  public static void warn(String expression, BooleanSupplier condition, Supplier<String> message) {
    if (WARNINGS_ENABLED) {
      EVALUATOR.check(SeverityLevel.WARNING, expression, condition, message);
    }
  }

  /**
   * Error-level check without a message.
   *
   * @param expression rendered condition text
   * @param condition evaluated only when errors are enabled
   * @throws AssertionFailure if the condition is {@code false}
   */
  public static void error(String expression, BooleanSupplier condition) {
    if (ERRORS_ENABLED) {
      EVALUATOR.check(SeverityLevel.ERROR, expression, condition, null);
    }
  }

  /**
   * Error-level check with a lazily built message.
   *
   * @param expression rendered condition text
   * @param condition evaluated only when errors are enabled
   * @param message invoked only when the condition is {@code false}
   * @throws AssertionFailure if the condition is {@code false}
   */
  public static void error(String expression, BooleanSupplier condition, Supplier<String> message) {
    if (ERRORS_ENABLED) {
      EVALUATOR.check(SeverityLevel.ERROR, expression, condition, message);
    }
  }

  /**
   * Generic form taking the level as an argument. Prefer {@link #warn} and {@link #error}, which cannot be
   * called with {@link SeverityLevel#NO_ASSERTIONS}.
   *
   * @param level {@link SeverityLevel#WARNING} or {@link SeverityLevel#ERROR}
   * @param expression rendered condition text
   * @param condition evaluated only when {@code level} is enabled
   * @param message invoked only when the condition is {@code false}; may be {@code null}
   * @throws IllegalArgumentException if {@code level} is {@link SeverityLevel#NO_ASSERTIONS}, even when disabled
   * @throws AssertionFailure if an enabled error-level condition is {@code false}
   */
  public static void check(
      SeverityLevel level, String expression, BooleanSupplier condition, Supplier<String> message) {
    if (LevelPolicy.requireSiteLevel(level) == SeverityLevel.WARNING) {
      warn(expression, condition, message);
    } else {
      error(expression, condition, message);
    }
  }
}
