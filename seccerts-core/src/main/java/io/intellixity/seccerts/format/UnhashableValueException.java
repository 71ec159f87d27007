package io.intellixity.seccerts.format;

/**
 * Raised when an identity hash is requested for a value that does not have one.
 * <p>
 * Kept distinct from other failures so callers can fall back to unhashed handling.
 */
public final class UnhashableValueException extends FormatException {
  public UnhashableValueException(String message) {
    super(message);
  }
}
