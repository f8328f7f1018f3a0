package ca.gc.cra.vigil.domain.assertion;

import java.io.Serializable;
import java.util.Objects;

/**
 * <strong>What:</strong> Failure text for an assertion whose condition evaluated to {@code false}.
 * <p><strong>Why:</strong> Consumers pattern-match on the rendered layout, so it is produced in exactly one place.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 * <p><strong>Performance:</strong> Built only on the failure path; the success path never allocates one.</p>
 *
 * @param expression rendered condition text, without surrounding parentheses
 * @param message optional user message; {@code null} or empty omits the message line
 * @param location call-site location
 * @since 0.1.0
 */
public record Diagnostic(String expression, String message, SourceLocation location) implements Serializable {
  static final String HEADER = "Failed assertion:";
  static final String MESSAGE_PREFIX = "\n\tMessage: ";
  static final String EXPRESSION_PREFIX = "\n\tExpression: (";

  public Diagnostic {
    Objects.requireNonNull(expression, "expression");
    location = Objects.requireNonNullElse(location, SourceLocation.UNKNOWN);
  }

  /**
   * Indicates whether a non-empty user message was supplied.
   *
   * @return {@code true} when the message line is rendered
   */
  public boolean hasMessage() {
    return message != null && !message.isEmpty();
  }

  /**
   * Renders the diagnostic without a location prefix.
   *
   * @return {@code "Failed assertion:[\n\tMessage: m]\n\tExpression: (e)"}
   */
  public String render() {
    StringBuilder text = new StringBuilder(HEADER.length() + expression.length() + 32);
    text.append(HEADER);
    if (hasMessage()) {
      text.append(MESSAGE_PREFIX).append(message);
    }
    return text.append(EXPRESSION_PREFIX).append(expression).append(')').toString();
  }

  /**
   * Renders the diagnostic prefixed with the call-site location, e.g. {@code "Inventory.java:42: Failed ..."}.
   *
   * @return location-prefixed text
   */
  public String renderWithLocation() {
    return location + ": " + render();
  }

  /**
   * Renders with or without the location prefix.
   *
   * @param includeLocation whether to prefix the call-site location
   * @return rendered text
   */
  public String render(boolean includeLocation) {
    return includeLocation ? renderWithLocation() : render();
  }
}
