package io.intellixity.vartopic.variant;

/**
 * Type-erasure boundary between a concrete value type {@code T} and a {@link Variant}.
 * <p>
 * One factory is bound to each registered type; the registry keyed by schema type name hands out
 * variants without its callers knowing {@code T}.
 */
public interface VariantFactory<T> {
  /** Stable identity of {@code T}. */
  TypeIdentity typeInfo();

  /** A variant holding a freshly default-constructed {@code T}. */
  Variant createVariant();
}
