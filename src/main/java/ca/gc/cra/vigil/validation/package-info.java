/**
 * <strong>Purpose:</strong> Validation helpers used during CLI parsing and configuration bootstrap.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Security:</strong> Rejects control characters in CLI keys and values.
 *
 * @since 0.1.0
 */
package ca.gc.cra.vigil.validation;
