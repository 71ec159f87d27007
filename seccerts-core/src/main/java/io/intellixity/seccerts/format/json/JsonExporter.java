package io.intellixity.seccerts.format.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.intellixity.seccerts.format.FormatException;
import io.intellixity.seccerts.format.StorageFormat;

/** Renders storage documents as JSON downloads. */
public final class JsonExporter {
  private static final ObjectMapper JSON = new ObjectMapper()
      .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
  private static final ObjectWriter PRETTY = JSON.writerWithDefaultPrettyPrinter();

  private JsonExporter() {}

  /** Pretty-printed JSON of {@link StorageFormat#toJsonMapping()}. */
  public static String toJson(StorageFormat doc) {
    try {
      return PRETTY.writeValueAsString(doc.toJsonMapping());
    } catch (JsonProcessingException e) {
      throw new FormatException("Failed to JSON-encode document", e);
    }
  }

  /** UTF-8 JSON bytes of {@link StorageFormat#toJsonMapping()}. */
  public static byte[] toJsonBytes(StorageFormat doc) {
    try {
      return PRETTY.writeValueAsBytes(doc.toJsonMapping());
    } catch (JsonProcessingException e) {
      throw new FormatException("Failed to JSON-encode document", e);
    }
  }
}
