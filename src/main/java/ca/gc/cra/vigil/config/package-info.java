/**
 * Assertion settings, their sources (build constants, YAML, properties, CLI), and composition root wiring.
 * <p><strong>Role:</strong> Bootstrap layer selecting sink, termination, and metrics adapters.</p>
 * <p><strong>Concurrency:</strong> Settings objects are immutable; safe to share.</p>
 * <p><strong>Errors:</strong> Malformed values raise {@link ca.gc.cra.vigil.domain.assertion.ConfigurationException}.</p>
 */
package ca.gc.cra.vigil.config;
