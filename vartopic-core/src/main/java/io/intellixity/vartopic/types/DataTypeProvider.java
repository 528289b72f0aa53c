package io.intellixity.vartopic.types;

import java.util.Collection;

/**
 * Contributes {@link DataType}s to a {@link DiscoveredDataTypeRegistry}.
 * <p>
 * Registered under this interface's name in {@code META-INF/vartopic.factories}.
 */
public interface DataTypeProvider {
  Collection<DataType<?>> dataTypes();
}
