package io.intellixity.seccerts.registry;

import io.intellixity.seccerts.format.FormatException;

/** Raised by {@link ComplexType#decode} when required fields are absent or malformed. */
public final class ComplexTypeDecodeException extends FormatException {
  public ComplexTypeDecodeException(String message) {
    super(message);
  }

  public ComplexTypeDecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
