package io.intellixity.vartopic.variant;

import io.intellixity.vartopic.error.DataTypeMismatchException;
import io.intellixity.vartopic.error.ImmutableDataTypeException;
import io.intellixity.vartopic.error.InvalidOperationException;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Type-erased container owning exactly one value plus its {@link TypeIdentity}.
 * <p>
 * Not thread-safe; a variant belongs to whoever created it until handed over.
 */
public final class Variant {
  private final TypeIdentity type;
  private final UnaryOperator<Object> copier;
  private Object value;
  private boolean frozen;

  Variant(TypeIdentity type, Object value, UnaryOperator<Object> copier) {
    this.type = Objects.requireNonNull(type, "type");
    this.copier = copier;
    this.value = checked(value);
  }

  public TypeIdentity type() { return type; }

  public Object value() { return value; }

  public <V> V value(Class<V> expected) {
    Objects.requireNonNull(expected, "expected");
    if (!expected.isAssignableFrom(type.javaType())) {
      throw new DataTypeMismatchException(expected.getName(), type.name());
    }
    return expected.cast(value);
  }

  /** Replaces the held value; the previous one is released. */
  public void set(Object newValue) {
    if (frozen) throw new ImmutableDataTypeException();
    this.value = checked(newValue);
  }

  /** Independent variant holding a deep copy of the value. */
  public Variant copy() {
    if (copier == null) {
      throw new InvalidOperationException("type [" + type.name() + "] does not support copying");
    }
    Variant out = new Variant(type, copier.apply(value), copier);
    out.frozen = frozen;
    return out;
  }

  /** Rejects further {@link #set(Object)} calls. */
  public Variant freeze() {
    this.frozen = true;
    return this;
  }

  public boolean isFrozen() { return frozen; }

  private Object checked(Object v) {
    if (v == null) throw new DataTypeMismatchException(type.name(), "null");
    if (!type.isInstance(v)) throw new DataTypeMismatchException(type.name(), v.getClass().getName());
    return v;
  }

  @Override
  public String toString() {
    return type.name() + "(" + value + ")";
  }
}
