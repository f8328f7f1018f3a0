/**
 * <strong>Purpose:</strong> Host termination adapters invoked when an error-level assertion fails with
 * quit-on-assertion enabled.
 * <p><strong>Concurrency:</strong> Adapters use atomics; requests never block the failing thread.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.vigil.infrastructure.host;
