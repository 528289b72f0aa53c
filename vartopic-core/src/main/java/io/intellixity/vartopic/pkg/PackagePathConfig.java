package io.intellixity.vartopic.pkg;

import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Package search path configuration.
 * <p>
 * Lookup order: system property {@value #PROPERTY}, environment variable {@value #ENV}, then
 * {@value #ROS_ENV}. Entries are separated by {@link File#pathSeparator}; blank entries are dropped.
 */
public record PackagePathConfig(List<Path> searchRoots) {
  public static final String PROPERTY = "vartopic.package.path";
  public static final String ENV = "VARTOPIC_PACKAGE_PATH";
  public static final String ROS_ENV = "ROS_PACKAGE_PATH";

  public PackagePathConfig {
    searchRoots = searchRoots == null ? List.of() : List.copyOf(searchRoots);
  }

  public static PackagePathConfig fromEnvironment() {
    return from(System.getProperties(), System.getenv());
  }

  static PackagePathConfig from(Properties props, Map<String, String> env) {
    Objects.requireNonNull(props, "props");
    Objects.requireNonNull(env, "env");
    String raw = props.getProperty(PROPERTY);
    if (raw == null || raw.isBlank()) raw = env.get(ENV);
    if (raw == null || raw.isBlank()) raw = env.get(ROS_ENV);
    return parse(raw);
  }

  public static PackagePathConfig parse(String raw) {
    if (raw == null || raw.isBlank()) return new PackagePathConfig(List.of());
    List<Path> roots = new ArrayList<>();
    for (String part : raw.split(File.pathSeparator)) {
      String s = part.trim();
      if (!s.isEmpty()) roots.add(Paths.get(s));
    }
    return new PackagePathConfig(roots);
  }
}
