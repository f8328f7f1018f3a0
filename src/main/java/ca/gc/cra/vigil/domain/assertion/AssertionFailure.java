package ca.gc.cra.vigil.domain.assertion;

import java.util.Objects;

/**
 * Raised by a failing {@link SeverityLevel#ERROR} assertion.
 *
 * <p>Extends {@link AssertionError} so it travels through {@code catch (Exception)} blocks the same way a
 * failed Java {@code assert} does. The assertion library never catches it; the host decides the outcome.</p>
 *
 * @since 0.1.0
 */
public final class AssertionFailure extends AssertionError {
  private static final long serialVersionUID = 1L;

  private final Diagnostic diagnostic;

  /**
   * Creates a failure whose message is {@code text}.
   *
   * @param diagnostic structured failure data; must not be {@code null}
   * @param text rendered message, with or without a location prefix
   */
  public AssertionFailure(Diagnostic diagnostic, String text) {
    super(Objects.requireNonNull(text, "text"));
    this.diagnostic = Objects.requireNonNull(diagnostic, "diagnostic");
  }

  /**
   * Creates a failure rendered without a location prefix.
   *
   * @param diagnostic structured failure data; must not be {@code null}
   */
  public AssertionFailure(Diagnostic diagnostic) {
    this(diagnostic, Objects.requireNonNull(diagnostic, "diagnostic").render());
  }

  /**
   * Returns the structured diagnostic.
   *
   * @return diagnostic carried by this failure
   */
  public Diagnostic diagnostic() {
    return diagnostic;
  }

  /**
   * Returns the call site that raised this failure.
   *
   * @return source location, possibly {@link SourceLocation#UNKNOWN}
   */
  public SourceLocation location() {
    return diagnostic.location();
  }
}
