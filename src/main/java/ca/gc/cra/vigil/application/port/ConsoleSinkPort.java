package ca.gc.cra.vigil.application.port;

/**
 * <strong>What:</strong> Outbound port receiving rendered warning diagnostics.
 * <p><strong>Why:</strong> The evaluator only needs an "emit text" capability; the host decides whether that is
 * SLF4J, a game console, or a test buffer.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent calls from any thread that reaches
 * an assertion site.</p>
 * <p><strong>Performance:</strong> Called only on the failure path.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.vigil.infrastructure.sink.Slf4jConsoleSinkAdapter
 */
@FunctionalInterface
public interface ConsoleSinkPort {
  /**
   * Emits one diagnostic.
   *
   * @param text rendered diagnostic; never {@code null}
   */
  void emit(String text);

  /** Sink that drops every diagnostic; useful for tests. */
  ConsoleSinkPort NO_OP = text -> {};
}
