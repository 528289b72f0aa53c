package io.intellixity.vartopic.types;

import io.intellixity.vartopic.variant.VariantFactory;

/** A named data type known to a {@link DataTypeRegistry}. */
public interface DataType<T> {
  /** Type identifier, e.g. {@code "float64"} or {@code "geometry_msgs/Point"}. */
  String id();

  Class<T> javaType();

  /** True for primitives that need no schema resolution. */
  boolean builtin();

  VariantFactory<T> variantFactory();
}
