package io.intellixity.vartopic.types.providers;

import io.intellixity.vartopic.types.DataType;
import io.intellixity.vartopic.types.DataTypeProvider;
import io.intellixity.vartopic.types.DataTypes;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Built-in primitive types.
 * <p>
 * Unsigned types widen to the next Java type so every value fits; {@code byte} and {@code char}
 * are the deprecated aliases of {@code int8} and {@code uint8}.
 * <p>
 * Variant identity is per Java type: {@code uint8}, {@code int16} and {@code char} share
 * {@link Short}, so their factories report the same {@code typeInfo()}. Ranges are not checked
 * on {@code Variant.set}; a {@code uint8} variant accepts any {@code Short}.
 */
public final class BuiltinDataTypeProvider implements DataTypeProvider {
  @Override
  public Collection<DataType<?>> dataTypes() {
    return List.of(
        DataTypes.builtin("bool", Boolean.class, () -> false),
        DataTypes.builtin("int8", Byte.class, () -> (byte) 0),
        DataTypes.builtin("uint8", Short.class, () -> (short) 0),
        DataTypes.builtin("int16", Short.class, () -> (short) 0),
        DataTypes.builtin("uint16", Integer.class, () -> 0),
        DataTypes.builtin("int32", Integer.class, () -> 0),
        DataTypes.builtin("uint32", Long.class, () -> 0L),
        DataTypes.builtin("int64", Long.class, () -> 0L),
        DataTypes.builtin("uint64", BigInteger.class, () -> BigInteger.ZERO),
        DataTypes.builtin("float32", Float.class, () -> 0f),
        DataTypes.builtin("float64", Double.class, () -> 0d),
        DataTypes.builtin("string", String.class, () -> ""),
        DataTypes.builtin("time", Instant.class, () -> Instant.EPOCH),
        DataTypes.builtin("duration", Duration.class, () -> Duration.ZERO),
        // deprecated aliases
        DataTypes.builtin("byte", Byte.class, () -> (byte) 0),
        DataTypes.builtin("char", Short.class, () -> (short) 0)
    );
  }
}
