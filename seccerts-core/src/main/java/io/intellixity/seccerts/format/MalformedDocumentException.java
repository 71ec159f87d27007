package io.intellixity.seccerts.format;

/** Raised when a tagged mapping or a reserved key does not have the expected structure. */
public final class MalformedDocumentException extends FormatException {
  public MalformedDocumentException(String message) {
    super(message);
  }

  public MalformedDocumentException(String message, Throwable cause) {
    super(message, cause);
  }
}
