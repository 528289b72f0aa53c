package io.intellixity.vartopic.types;

import io.intellixity.vartopic.error.AmbiguousDataTypeIdentifierException;
import io.intellixity.vartopic.util.VartopicFactoriesLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * DataTypeRegistry built via discovery (META-INF/vartopic.factories).
 * <p>
 * Providers are merged in discovery order. The same id contributed twice with the same Java type
 * keeps the first; with different Java types it is rejected as ambiguous.
 */
public final class DiscoveredDataTypeRegistry implements DataTypeRegistry {
  private static final Logger log = LoggerFactory.getLogger(DiscoveredDataTypeRegistry.class);

  private final Map<String, DataType<?>> types;

  public DiscoveredDataTypeRegistry() {
    this(VartopicFactoriesLoader.load(DataTypeProvider.class));
  }

  public DiscoveredDataTypeRegistry(List<? extends DataTypeProvider> providers) {
    Objects.requireNonNull(providers, "providers");
    Map<String, DataType<?>> merged = new LinkedHashMap<>();

    for (DataTypeProvider p : providers) {
      if (p == null) continue;
      Collection<DataType<?>> contributed = p.dataTypes();
      if (contributed == null) continue;
      for (DataType<?> dt : contributed) {
        if (dt == null) continue;
        DataType<?> prev = merged.putIfAbsent(dt.id(), dt);
        if (prev != null && !prev.javaType().equals(dt.javaType())) {
          throw new AmbiguousDataTypeIdentifierException(dt.id());
        }
      }
    }

    this.types = Map.copyOf(merged);
    log.debug("Registered {} data types from {} providers", types.size(), providers.size());
  }

  @Override
  public Optional<DataType<?>> find(String typeId) {
    if (typeId == null || typeId.isBlank()) return Optional.empty();
    return Optional.ofNullable(types.get(typeId));
  }

  public Set<String> typeIds() { return types.keySet(); }
}
