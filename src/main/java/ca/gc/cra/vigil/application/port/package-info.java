/**
 * <strong>Purpose:</strong> Outbound ports the assertion evaluator depends on: console sink, host termination,
 * and metrics.
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe.</p>
 * <p><strong>Performance:</strong> Ports are only touched on the failure path.</p>
 * <p><strong>Observability:</strong> Ports expose hooks for logging and metrics but do not prescribe implementations.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.vigil.application.port;
