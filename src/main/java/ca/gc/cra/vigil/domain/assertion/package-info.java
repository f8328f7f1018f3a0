/**
 * <strong>Purpose:</strong> Assertion domain model: severity levels, the level policy, sites, and diagnostics.
 * <p><strong>Concurrency:</strong> All types are immutable and safe to share.
 * <p><strong>Performance:</strong> Diagnostics and failures are only built on the failure path.
 * <p><strong>Observability:</strong> No logging here; adapters report failures.
 *
 * @since 0.1.0
 */
package ca.gc.cra.vigil.domain.assertion;
