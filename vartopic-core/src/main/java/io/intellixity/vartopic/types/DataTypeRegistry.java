package io.intellixity.vartopic.types;

import io.intellixity.vartopic.error.NoSuchDataTypeException;
import io.intellixity.vartopic.variant.Variant;

import java.util.Optional;

/**
 * Lookup of data types by identifier.
 * <p>
 * Implementations are read-only once built and safe for concurrent reads.
 */
public interface DataTypeRegistry {
  Optional<DataType<?>> find(String typeId);

  default DataType<?> get(String typeId) {
    return find(typeId).orElseThrow(() -> new NoSuchDataTypeException(typeId));
  }

  /**
   * True iff {@code typeId} names a built-in primitive. Array forms ({@code "int32[]"},
   * {@code "int32[4]"}) are built-in iff their element type is. Unknown ids are not built-in.
   */
  default boolean isBuiltin(String typeId) {
    if (typeId == null) return false;
    return find(elementTypeId(typeId)).map(DataType::builtin).orElse(false);
  }

  default Variant createVariant(String typeId) {
    return get(typeId).variantFactory().createVariant();
  }

  /** Strips a trailing {@code [...]} array suffix. */
  static String elementTypeId(String typeId) {
    int bracket = typeId.indexOf('[');
    return (bracket > 0 && typeId.endsWith("]")) ? typeId.substring(0, bracket) : typeId;
  }
}
