/**
 * <strong>Purpose:</strong> OpenTelemetry-backed implementation of the metrics port.
 * <p><strong>Concurrency:</strong> Instrument caches use concurrent maps; safe for concurrent failures.</p>
 * <p><strong>Observability:</strong> Exports {@code assert.*} counters via OTLP when {@code metrics=otlp}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.vigil.infrastructure.metrics;
