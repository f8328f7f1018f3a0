/**
 * Console sink adapters that deliver warning diagnostics to SLF4J.
 * <p><strong>Concurrency:</strong> Adapters are stateless and rely on the logging backend for thread-safety.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.vigil.infrastructure.sink;
