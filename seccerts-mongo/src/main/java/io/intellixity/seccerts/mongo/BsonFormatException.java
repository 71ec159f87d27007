package io.intellixity.seccerts.mongo;

import io.intellixity.seccerts.format.FormatException;

/** A tree handed to the database boundary is not storage-safe. */
public final class BsonFormatException extends FormatException {
  public BsonFormatException(String message) {
    super(message);
  }
}
