package io.intellixity.seccerts.mongo;

import io.intellixity.seccerts.format.Formats;
import io.intellixity.seccerts.format.StorageFormat;
import io.intellixity.seccerts.format.WorkingFormat;
import io.intellixity.seccerts.registry.ComplexTypeRegistry;
import org.bson.Document;

/** {@link Formats} entry points for code that reads and writes {@link Document}s. */
public final class MongoFormats {
  private MongoFormats() {}

  /** Database document to working format. */
  public static Object load(Document doc) {
    return BsonStorageCodec.fromBson(doc).toWorkingFormat().get();
  }

  /** Working-format mapping to a database document. */
  public static Document store(Object workingDoc) {
    return BsonStorageCodec.toBson(new WorkingFormat(workingDoc).toStorageFormat());
  }

  /** Database document to object format. */
  public static Object materialize(Document doc, ComplexTypeRegistry registry) {
    return Formats.materialize(load(doc), registry);
  }

  /** Object-format mapping (or registered domain instance) to a database document. */
  public static Document dematerialize(Object objDoc, ComplexTypeRegistry registry) {
    return store(Formats.dematerialize(objDoc, registry));
  }

  /** Storage tree of a database document, for JSON export. */
  public static StorageFormat storage(Document doc) {
    return BsonStorageCodec.fromBson(doc);
  }
}
