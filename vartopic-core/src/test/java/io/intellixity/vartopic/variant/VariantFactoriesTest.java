package io.intellixity.vartopic.variant;

import io.intellixity.vartopic.error.InvalidDataTypeException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class VariantFactoriesTest {

  public static final class Point {
    public double x;
    public double y;
  }

  public static final class NoDefault {
    public NoDefault(int ignored) {}
  }

  @Test
  void factoriesOfSameType_shareIdentity() {
    VariantFactory<Point> a = VariantFactories.reflective(Point.class);
    VariantFactory<Point> b = VariantFactories.of(Point.class, Point::new);

    assertEquals(a.typeInfo(), b.typeInfo());
    assertEquals(a.typeInfo().hashCode(), b.typeInfo().hashCode());
  }

  @Test
  void factoriesOfDifferentTypes_differ() {
    assertNotEquals(VariantFactories.reflective(Point.class).typeInfo(), VariantFactories.of(String.class, () -> "").typeInfo());
  }

  @Test
  void createVariant_holdsFreshDefault() {
    VariantFactory<Point> f = VariantFactories.reflective(Point.class);
    Variant v1 = f.createVariant();
    Variant v2 = f.createVariant();

    assertEquals(f.typeInfo(), v1.type());
    assertNotSame(v1.value(), v2.value());
    assertEquals(0d, v1.value(Point.class).x);
  }

  @Test
  void typeWithoutNoArgConstructor_failsAtRegistration() {
    assertThrows(InvalidDataTypeException.class, () -> VariantFactories.reflective(NoDefault.class));
  }

  @Test
  void customCopier_isUsedForCopies() {
    VariantFactory<ArrayList<Integer>> f = VariantFactories.of(listClass(), ArrayList::new, ArrayList::new);
    Variant v = f.createVariant();
    @SuppressWarnings("unchecked")
    List<Integer> held = (List<Integer>) v.value();
    held.add(1);

    Variant c = v.copy();
    held.add(2);

    assertEquals(List.of(1), c.value());
    assertEquals(List.of(1, 2), v.value());
  }

  @Test
  void typeIdentity_name() {
    assertEquals("java.lang.String", TypeIdentity.of(String.class).name());
    assertTrue(TypeIdentity.of(Number.class).isInstance(1));
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private static Class<ArrayList<Integer>> listClass() {
    return (Class) ArrayList.class;
  }
}
