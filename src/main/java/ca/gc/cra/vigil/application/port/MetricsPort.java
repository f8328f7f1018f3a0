package ca.gc.cra.vigil.application.port;

/**
 * <strong>What:</strong> Domain port abstracting assertion metrics emission.
 * <p><strong>Why:</strong> Lets the evaluator count failures without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} when disabled.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates.</p>
 * <p><strong>Performance:</strong> Calls should be non-blocking and amortized O(1).</p>
 * <p><strong>Observability:</strong> Defines the metric name contract ({@code assert.warning.failed},
 * {@code assert.error.failed}, {@code assert.termination.requested}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
@FunctionalInterface
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier; must not be {@code null}
   */
  void increment(String key);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = key -> {};
}
