package io.intellixity.vartopic.util;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * spring.factories-style SPI loader.
 * <p>
 * Reads every {@code META-INF/vartopic.factories} resource on the classpath. Each resource is a
 * Java Properties file mapping an SPI interface name to comma-separated implementation classes:
 *
 * <pre>
 * io.intellixity.vartopic.types.DataTypeProvider=com.acme.GeometryTypes,com.acme.SensorTypes
 * </pre>
 *
 * Implementations are instantiated through their public no-arg constructor, in discovery order,
 * each class at most once.
 */
public final class VartopicFactoriesLoader {
  public static final String RESOURCE = "META-INF/vartopic.factories";

  private VartopicFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    if (cl == null) cl = VartopicFactoriesLoader.class.getClassLoader();

    Set<String> implNames = new LinkedHashSet<>();
    for (URL url : resources(cl)) {
      implNames.addAll(implementationNames(url, spiType.getName()));
    }

    List<T> out = new ArrayList<>(implNames.size());
    for (String implName : implNames) {
      out.add(newInstance(implName, spiType, cl));
    }
    return out;
  }

  static List<String> implementationNames(URL url, String key) {
    Properties p = new Properties();
    try (InputStream in = url.openStream()) {
      p.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to load " + RESOURCE + " from " + url, e);
    }

    String v = p.getProperty(key);
    if (v == null || v.isBlank()) return List.of();
    List<String> names = new ArrayList<>();
    for (String part : v.split(",")) {
      String name = part.trim();
      if (!name.isEmpty()) names.add(name);
    }
    return names;
  }

  private static List<URL> resources(ClassLoader cl) {
    try {
      return Collections.list(cl.getResources(RESOURCE));
    } catch (IOException e) {
      throw new IllegalStateException("Failed to enumerate " + RESOURCE, e);
    }
  }

  private static <T> T newInstance(String implName, Class<T> spiType, ClassLoader cl) {
    Class<?> raw;
    try {
      raw = Class.forName(implName, true, cl);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("Unknown implementation " + implName + " for SPI " + spiType.getName(), e);
    }
    if (!spiType.isAssignableFrom(raw)) {
      throw new IllegalArgumentException("Class " + implName + " does not implement " + spiType.getName());
    }
    try {
      return spiType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to instantiate " + implName + " for SPI " + spiType.getName(), e);
    }
  }
}
