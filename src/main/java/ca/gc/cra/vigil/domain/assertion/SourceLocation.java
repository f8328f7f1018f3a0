package ca.gc.cra.vigil.domain.assertion;

import java.io.Serializable;
import java.util.Objects;

/**
 * Call-site coordinates used only when rendering diagnostics.
 *
 * @param fileName source file name, e.g. {@code Inventory.java}
 * @param lineNumber 1-based line number; negative when unknown
 * @param className fully qualified declaring class name
 * @param methodName method containing the assertion
 * @since 0.1.0
 */
public record SourceLocation(String fileName, int lineNumber, String className, String methodName)
    implements Serializable {
  /** Placeholder used when no frame outside the assertion library could be found. */
  public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", -1, "<unknown>", "<unknown>");

  public SourceLocation {
    fileName = Objects.requireNonNullElse(fileName, "<unknown>");
    className = Objects.requireNonNullElse(className, "<unknown>");
    methodName = Objects.requireNonNullElse(methodName, "<unknown>");
  }

  /**
   * Indicates whether the location points at a real line.
   *
   * @return {@code true} when the line number is known
   */
  public boolean isKnown() {
    return lineNumber > 0;
  }

  /**
   * Renders {@code File.java:42}, or just the file name when the line is unknown.
   *
   * @return short location label used as a diagnostic prefix
   */
  @Override
  public String toString() {
    return isKnown() ? fileName + ':' + lineNumber : fileName;
  }
}
