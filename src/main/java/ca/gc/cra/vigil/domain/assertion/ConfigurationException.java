package ca.gc.cra.vigil.domain.assertion;

/**
 * Raised when assertion configuration is malformed, for example an unknown threshold name.
 *
 * <p>Extends {@link IllegalArgumentException} so configuration loaders and CLIs can treat it like any
 * other invalid input while still distinguishing it by type.</p>
 *
 * @since 0.1.0
 */
public class ConfigurationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a diagnostic message.
   *
   * @param message description of the invalid setting
   */
  public ConfigurationException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a diagnostic message and cause.
   *
   * @param message description of the invalid setting
   * @param cause underlying parsing failure
   */
  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
