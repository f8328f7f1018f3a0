package ca.gc.cra.vigil.application.assertion;

import ca.gc.cra.vigil.application.port.ConsoleSinkPort;
import ca.gc.cra.vigil.application.port.HostTerminationPort;
import ca.gc.cra.vigil.application.port.MetricsPort;
import ca.gc.cra.vigil.domain.assertion.AssertionFailure;
import ca.gc.cra.vigil.domain.assertion.AssertionSite;
import ca.gc.cra.vigil.domain.assertion.Diagnostic;
import ca.gc.cra.vigil.domain.assertion.LevelPolicy;
import ca.gc.cra.vigil.domain.assertion.SeverityLevel;
import ca.gc.cra.vigil.domain.assertion.SourceLocation;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Evaluates assertion sites against a fixed {@link LevelPolicy} and performs the
 * level-specific failure action.
 * <p><strong>Why:</strong> Centralizes the warn-versus-abort contract so every call site fails the same way.</p>
 * <p><strong>Role:</strong> Application service; collaborators arrive through ports.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Skip inactive sites without touching their condition or message.</li>
 *   <li>Evaluate an active condition exactly once.</li>
 *   <li>On failure, emit warnings to the {@link ConsoleSinkPort} and continue, or raise
 *   {@link AssertionFailure} for errors, optionally requesting host termination first.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable after construction; safe for concurrent use provided the ports are.</p>
 * <p><strong>Performance:</strong> The success path is one table lookup and one condition call. Messages,
 * stack walks, and diagnostics are built only on failure.</p>
 * <p><strong>Observability:</strong> Counts {@code assert.warning.failed}, {@code assert.error.failed}, and
 * {@code assert.termination.requested} through {@link MetricsPort}.</p>
 *
 * @implNote The evaluator never catches {@link AssertionFailure}.
 * @since 0.1.0
 */
public final class AssertionEvaluator {
  private static final Logger log = LoggerFactory.getLogger(AssertionEvaluator.class);

  static final String WARNING_FAILED = "assert.warning.failed";
  static final String ERROR_FAILED = "assert.error.failed";
  static final String TERMINATION_REQUESTED = "assert.termination.requested";

  private final LevelPolicy policy;
  private final ConsoleSinkPort sink;
  private final HostTerminationPort termination;
  private final MetricsPort metrics;
  private final CallSiteLocator locator;
  private final boolean quitOnAssertion;
  private final boolean includeLocation;

  private AssertionEvaluator(Builder builder) {
    this.policy = LevelPolicy.forThreshold(builder.threshold);
    this.sink = builder.sink;
    this.termination = builder.termination;
    this.metrics = builder.metrics;
    this.locator = builder.locator;
    this.quitOnAssertion = builder.quitOnAssertion;
    this.includeLocation = builder.includeLocation;
  }

  /**
   * Starts building an evaluator. Defaults: threshold {@link SeverityLevel#NO_ASSERTIONS}, no-op ports,
   * no termination, no location prefix.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the policy this evaluator filters with.
   *
   * @return level policy
   */
  public LevelPolicy policy() {
    return policy;
  }

  /**
   * Indicates whether sites of the given level are evaluated.
   *
   * @param level site level
   * @return {@code true} when active
   * @throws IllegalArgumentException if {@code level} is {@link SeverityLevel#NO_ASSERTIONS}
   */
  public boolean isActive(SeverityLevel level) {
    return policy.isActive(level);
  }

  /**
   * Checks a condition without a user message.
   *
   * @param level site level; never {@link SeverityLevel#NO_ASSERTIONS}
   * @param expression rendered condition text
   * @param condition condition evaluated only when the level is active
   * @throws AssertionFailure if an active error-level condition is {@code false}
   */
  public void check(SeverityLevel level, String expression, BooleanSupplier condition) {
    check(level, expression, condition, null);
  }

  /**
   * Checks a condition with a lazily built user message.
   *
   * @param level site level; never {@link SeverityLevel#NO_ASSERTIONS}
   * @param expression rendered condition text
   * @param condition condition evaluated only when the level is active
   * @param message message supplier invoked only after the condition fails; may be {@code null}
   * @throws AssertionFailure if an active error-level condition is {@code false}
   */
  public void check(
      SeverityLevel level, String expression, BooleanSupplier condition, Supplier<String> message) {
    if (!policy.isActive(level)) {
      return;
    }
    Objects.requireNonNull(expression, "expression");
    if (Objects.requireNonNull(condition, "condition").getAsBoolean()) {
      return;
    }
    fail(level, expression, message, null);
  }

  /**
   * Evaluates a pre-built site.
   *
   * @param site assertion site; must not be {@code null}
   * @throws AssertionFailure if the site is active, error-level, and its condition is {@code false}
   */
  public void evaluate(AssertionSite site) {
    Objects.requireNonNull(site, "site");
    if (!policy.isActive(site.level())) {
      return;
    }
    if (site.condition().getAsBoolean()) {
      return;
    }
    fail(site.level(), site.expression(), site.message(), site.location());
  }

  private void fail(
      SeverityLevel level, String expression, Supplier<String> message, SourceLocation location) {
    SourceLocation where = location != null ? location : locator.locate();
    String userMessage = message == null ? null : message.get();
    Diagnostic diagnostic = new Diagnostic(expression, userMessage, where);
    String text = diagnostic.render(includeLocation);

    if (level == SeverityLevel.WARNING) {
      metrics.increment(WARNING_FAILED);
      sink.emit(text);
      return;
    }

    metrics.increment(ERROR_FAILED);
    AssertionFailure failure = new AssertionFailure(diagnostic, text);
    if (quitOnAssertion) {
      requestStop(failure);
    }
    throw failure;
  }

  private void requestStop(AssertionFailure failure) {
    metrics.increment(TERMINATION_REQUESTED);
    log.warn("Requesting host termination after failed assertion at {}", failure.location());
    try {
      termination.requestStop();
    } catch (RuntimeException ex) {
      log.error("Host termination request failed; propagating assertion failure", ex);
      failure.addSuppressed(ex);
    }
  }

  /** Builder for {@link AssertionEvaluator}. */
  public static final class Builder {
    private SeverityLevel threshold = SeverityLevel.NO_ASSERTIONS;
    private ConsoleSinkPort sink = ConsoleSinkPort.NO_OP;
    private HostTerminationPort termination = HostTerminationPort.NO_OP;
    private MetricsPort metrics = MetricsPort.NO_OP;
    private CallSiteLocator locator;
    private boolean quitOnAssertion;
    private boolean includeLocation;

    private Builder() {}

    /**
     * Sets the threshold.
     *
     * @param threshold minimum active level
     * @return this builder
     */
    public Builder threshold(SeverityLevel threshold) {
      this.threshold = Objects.requireNonNull(threshold, "threshold");
      return this;
    }

    /**
     * Sets the warning sink.
     *
     * @param sink console sink; {@code null} selects {@link ConsoleSinkPort#NO_OP}
     * @return this builder
     */
    public Builder sink(ConsoleSinkPort sink) {
      this.sink = sink == null ? ConsoleSinkPort.NO_OP : sink;
      return this;
    }

    /**
     * Sets the host termination hook.
     *
     * @param termination hook; {@code null} selects {@link HostTerminationPort#NO_OP}
     * @return this builder
     */
    public Builder termination(HostTerminationPort termination) {
      this.termination = termination == null ? HostTerminationPort.NO_OP : termination;
      return this;
    }

    /**
     * Sets the metrics port.
     *
     * @param metrics metrics adapter; {@code null} selects {@link MetricsPort#NO_OP}
     * @return this builder
     */
    public Builder metrics(MetricsPort metrics) {
      this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
      return this;
    }

    /**
     * Overrides the call-site locator.
     *
     * @param locator stack locator
     * @return this builder
     */
    public Builder locator(CallSiteLocator locator) {
      this.locator = Objects.requireNonNull(locator, "locator");
      return this;
    }

    /**
     * Whether a failing error-level assertion requests host termination before raising.
     *
     * @param quitOnAssertion termination flag
     * @return this builder
     */
    public Builder quitOnAssertion(boolean quitOnAssertion) {
      this.quitOnAssertion = quitOnAssertion;
      return this;
    }

    /**
     * Whether diagnostics are prefixed with {@code File.java:line: }.
     *
     * @param includeLocation location prefix flag
     * @return this builder
     */
    public Builder includeLocation(boolean includeLocation) {
      this.includeLocation = includeLocation;
      return this;
    }

    /**
     * Builds the evaluator.
     *
     * @return immutable evaluator
     */
    public AssertionEvaluator build() {
      if (locator == null) {
        locator = new CallSiteLocator();
      }
      return new AssertionEvaluator(this);
    }
  }
}
