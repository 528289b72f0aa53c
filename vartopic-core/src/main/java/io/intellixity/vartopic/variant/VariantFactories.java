package io.intellixity.vartopic.variant;

import io.intellixity.vartopic.error.InvalidDataTypeException;

import java.lang.reflect.Constructor;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/** Factory constructors for {@link VariantFactory}. */
public final class VariantFactories {
  private static final Set<Class<?>> IMMUTABLE = Set.of(
      Boolean.class, Byte.class, Short.class, Integer.class, Long.class, Float.class, Double.class,
      Character.class, String.class, BigInteger.class, BigDecimal.class, Instant.class, Duration.class
  );

  private VariantFactories() {}

  /**
   * Factory for {@code type} whose default value comes from {@code defaults}.
   * Values of well-known immutable types are shared on copy; any other type is not copyable.
   */
  public static <T> VariantFactory<T> of(Class<T> type, Supplier<? extends T> defaults) {
    Objects.requireNonNull(type, "type");
    UnaryOperator<Object> copier = IMMUTABLE.contains(type) ? UnaryOperator.identity() : null;
    return new SupplierFactory<>(type, defaults, copier);
  }

  public static <T> VariantFactory<T> of(Class<T> type, Supplier<? extends T> defaults, UnaryOperator<T> copier) {
    Objects.requireNonNull(copier, "copier");
    @SuppressWarnings("unchecked")
    UnaryOperator<Object> erased = v -> copier.apply((T) v);
    return new SupplierFactory<>(type, defaults, erased);
  }

  /** Factory default-constructing {@code type} through its public no-arg constructor. */
  public static <T> VariantFactory<T> reflective(Class<T> type) {
    Objects.requireNonNull(type, "type");
    Constructor<T> ctor;
    try {
      ctor = type.getConstructor();
    } catch (NoSuchMethodException e) {
      throw new InvalidDataTypeException(type.getName() + " has no public no-arg constructor", e);
    }
    return of(type, () -> {
      try {
        return ctor.newInstance();
      } catch (ReflectiveOperationException e) {
        throw new InvalidDataTypeException("cannot construct " + type.getName(), e);
      }
    });
  }

  private static final class SupplierFactory<T> implements VariantFactory<T> {
    private final TypeIdentity type;
    private final Supplier<? extends T> defaults;
    private final UnaryOperator<Object> copier;

    SupplierFactory(Class<T> type, Supplier<? extends T> defaults, UnaryOperator<Object> copier) {
      this.type = TypeIdentity.of(Objects.requireNonNull(type, "type"));
      this.defaults = Objects.requireNonNull(defaults, "defaults");
      this.copier = copier;
    }

    @Override public TypeIdentity typeInfo() { return type; }

    @Override
    public Variant createVariant() {
      return new Variant(type, defaults.get(), copier);
    }

    @Override
    public String toString() {
      return "VariantFactory[" + type.name() + "]";
    }
  }
}
