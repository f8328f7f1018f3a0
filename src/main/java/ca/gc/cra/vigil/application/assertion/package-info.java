/**
 * Assertion evaluation use case: activeness filtering, condition evaluation, and failure actions.
 * <p><strong>Concurrency:</strong> Evaluators are immutable; sites run synchronously on the calling thread.</p>
 */
package ca.gc.cra.vigil.application.assertion;
