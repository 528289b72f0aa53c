package io.intellixity.vartopic.pkg;

import java.nio.file.Path;
import java.util.Optional;

/** Maps a package name to its root directory. */
@FunctionalInterface
public interface PackageLocator {
  Optional<Path> locate(String packageName);
}
