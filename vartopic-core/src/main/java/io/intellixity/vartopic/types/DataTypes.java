package io.intellixity.vartopic.types;

import io.intellixity.vartopic.variant.VariantFactories;
import io.intellixity.vartopic.variant.VariantFactory;

import java.util.Objects;
import java.util.function.Supplier;

/** Constructors for {@link DataType} instances contributed by providers. */
public final class DataTypes {
  private DataTypes() {}

  public static <T> DataType<T> builtin(String id, Class<T> javaType, Supplier<? extends T> defaults) {
    return new Simple<>(id, true, VariantFactories.of(javaType, defaults), javaType);
  }

  /** A schema-backed (non-builtin) type whose values come from {@code factory}. */
  @SuppressWarnings("unchecked")
  public static <T> DataType<T> message(String id, VariantFactory<T> factory) {
    Objects.requireNonNull(factory, "factory");
    return new Simple<>(id, false, factory, (Class<T>) factory.typeInfo().javaType());
  }

  record Simple<T>(String id, boolean builtin, VariantFactory<T> variantFactory, Class<T> javaType)
      implements DataType<T> {
    Simple {
      if (id == null || id.isBlank()) throw new IllegalArgumentException("data type id is blank");
      Objects.requireNonNull(variantFactory, "variantFactory");
      Objects.requireNonNull(javaType, "javaType");
    }
  }
}
