package io.intellixity.seccerts.mongo;

import io.intellixity.seccerts.format.StorageFormat;
import org.bson.Document;
import org.bson.types.Binary;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.*;

/**
 * Converts storage-format trees to and from {@link Document}s.
 * <p>
 * {@link #toBson} refuses anything the database cannot hold: sets, paths, keys that are not strings
 * or contain '.', and values without a BSON mapping. Storage trees produced by
 * {@link io.intellixity.seccerts.format.WorkingFormat#toStorageFormat()} always pass.
 */
public final class BsonStorageCodec {
  private static final Logger log = LoggerFactory.getLogger(BsonStorageCodec.class);

  private static final Set<Class<?>> SCALARS = Set.of(
      String.class, Boolean.class,
      Integer.class, Long.class, Double.class, Float.class, Short.class, Byte.class,
      BigDecimal.class, Decimal128.class,
      Date.class, Instant.class, LocalDate.class, LocalDateTime.class,
      ObjectId.class, Binary.class, byte[].class);

  private BsonStorageCodec() {}

  /**
   * Copies a storage tree into a {@link Document}.
   *
   * @throws BsonFormatException if the root is not a mapping or any value is not storage-safe
   */
  public static Document toBson(StorageFormat storage) {
    Objects.requireNonNull(storage, "storage");
    if (!(storage.get() instanceof Map<?, ?> root)) {
      throw new BsonFormatException("Document root must be a mapping but got: " + typeName(storage.get()));
    }
    Document doc = document(root, "");
    log.trace("seccerts.mongo toBson fields={}", doc.keySet());
    return doc;
  }

  /** Copies a {@link Document} into a storage tree of plain maps and lists. */
  public static StorageFormat fromBson(Document doc) {
    Objects.requireNonNull(doc, "doc");
    log.trace("seccerts.mongo fromBson fields={}", doc.keySet());
    return new StorageFormat(plain(doc));
  }

  private static Document document(Map<?, ?> m, String path) {
    Document doc = new Document();
    for (Map.Entry<?, ?> e : m.entrySet()) {
      if (!(e.getKey() instanceof String key)) {
        throw new BsonFormatException("Non-string key at " + display(path) + ": " + e.getKey());
      }
      if (key.indexOf('.') >= 0) {
        throw new BsonFormatException("Dotted key at " + display(path) + ": " + key);
      }
      doc.put(key, value(e.getValue(), path.isEmpty() ? key : path + "." + key));
    }
    return doc;
  }

  private static Object value(Object v, String path) {
    if (v == null) return null;
    if (v instanceof Map<?, ?> m) return document(m, path);
    if (v instanceof List<?> l) {
      List<Object> out = new ArrayList<>(l.size());
      for (int i = 0; i < l.size(); i++) out.add(value(l.get(i), path + "[" + i + "]"));
      return out;
    }
    if (v instanceof Set<?>) {
      throw new BsonFormatException("Set value at " + display(path) + " must be stored as a tagged mapping");
    }
    if (SCALARS.contains(v.getClass())) return v;
    throw new BsonFormatException("Value at " + display(path) + " has no BSON mapping: " + typeName(v));
  }

  private static Object plain(Object v) {
    if (v instanceof Map<?, ?> m) {
      Map<String, Object> out = new LinkedHashMap<>();
      for (Map.Entry<?, ?> e : m.entrySet()) out.put(String.valueOf(e.getKey()), plain(e.getValue()));
      return out;
    }
    if (v instanceof List<?> l) {
      List<Object> out = new ArrayList<>(l.size());
      for (Object o : l) out.add(plain(o));
      return out;
    }
    return v;
  }

  private static String display(String path) {
    return path.isEmpty() ? "<root>" : path;
  }

  private static String typeName(Object v) {
    return v == null ? "null" : v.getClass().getName();
  }
}
