package ca.gc.cra.vigil.application.port;

/**
 * <strong>What:</strong> Outbound port through which a failing error-level assertion asks the host to stop.
 * <p><strong>Why:</strong> Engines and servers stop differently (JVM exit, loop flag, supervisor signal); the
 * evaluator only issues the request.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe to call from any thread.</p>
 * <p><strong>Performance:</strong> Must not block; the request is fire-and-forget and never awaited.</p>
 *
 * @implNote The evaluator raises its failure whether or not the host honours the request.
 * @since 0.1.0
 */
@FunctionalInterface
public interface HostTerminationPort {
  /** Requests that the host stop as soon as it can. */
  void requestStop();

  /** Port that ignores stop requests. */
  HostTerminationPort NO_OP = () -> {};
}
