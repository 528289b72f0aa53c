package io.intellixity.vartopic.variant;

import java.util.Objects;

/**
 * Runtime identity of a concrete value type.
 * <p>
 * Two identities are equal iff they denote the same Java class.
 */
public record TypeIdentity(Class<?> javaType) {
  public TypeIdentity {
    Objects.requireNonNull(javaType, "javaType");
  }

  public static TypeIdentity of(Class<?> javaType) {
    return new TypeIdentity(javaType);
  }

  public String name() { return javaType.getName(); }

  public boolean isInstance(Object value) {
    return javaType.isInstance(value);
  }

  @Override
  public String toString() { return name(); }
}
