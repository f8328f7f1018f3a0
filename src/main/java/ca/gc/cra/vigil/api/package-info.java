/**
 * <strong>Purpose:</strong> {@code vigil} command-line tool for inspecting and validating assertion settings.
 * <p><strong>Concurrency:</strong> Single-threaded CLI entry points.</p>
 * <p><strong>Observability:</strong> Errors go to SLF4J; reports go to stdout via {@link ca.gc.cra.vigil.api.CliPrinter}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.vigil.api;
