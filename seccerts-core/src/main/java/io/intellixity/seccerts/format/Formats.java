package io.intellixity.seccerts.format;

import io.intellixity.seccerts.registry.ComplexTypeRegistry;

/**
 * Entry points used by the storage and rendering layers.
 *
 * <p>Documents read from the database go through {@link #load(Object)} before use; documents go
 * through {@link #store(Object)} before they are written. Components that need typed domain
 * entities use {@link #materialize} and {@link #dematerialize}.</p>
 */
public final class Formats {
  private Formats() {}

  /** Storage to working format. */
  public static Object load(Object storageDoc) {
    return new StorageFormat(storageDoc).toWorkingFormat().get();
  }

  /** Working to storage format. */
  public static Object store(Object workingDoc) {
    return new WorkingFormat(workingDoc).toStorageFormat().get();
  }

  /** Working to object format, resolving registered domain types. */
  public static Object materialize(Object workingDoc, ComplexTypeRegistry registry) {
    return new WorkingFormat(workingDoc).toRawFormat().toObjFormat(registry).get();
  }

  /** Object to working format. */
  public static Object dematerialize(Object objDoc, ComplexTypeRegistry registry) {
    return new ObjFormat(objDoc).toRawFormat(registry).toWorkingFormat().get();
  }
}
