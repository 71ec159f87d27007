package io.intellixity.seccerts.format;

/**
 * Base type for failures while converting a document between formats.
 * <p>
 * Conversions never mutate their input, so a failure leaves the source tree untouched.
 */
public class FormatException extends RuntimeException {
  public FormatException(String message) {
    super(message);
  }

  public FormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
