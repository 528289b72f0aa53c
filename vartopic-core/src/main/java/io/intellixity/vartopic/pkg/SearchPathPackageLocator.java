package io.intellixity.vartopic.pkg;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Locates a package as the directory {@code <root>/<package>} under an ordered list of search
 * roots; the first root containing it wins.
 */
public final class SearchPathPackageLocator implements PackageLocator {
  private static final Logger log = LoggerFactory.getLogger(SearchPathPackageLocator.class);

  private final List<Path> roots;

  public SearchPathPackageLocator(PackagePathConfig config) {
    this(Objects.requireNonNull(config, "config").searchRoots());
  }

  public SearchPathPackageLocator(List<Path> searchRoots) {
    Objects.requireNonNull(searchRoots, "searchRoots");
    List<Path> existing = new ArrayList<>();
    for (Path root : searchRoots) {
      if (Files.isDirectory(root)) existing.add(root);
      else log.warn("Ignoring package search root {}: not a directory", root);
    }
    this.roots = List.copyOf(existing);
  }

  @Override
  public Optional<Path> locate(String packageName) {
    if (packageName == null || packageName.isBlank()) return Optional.empty();
    for (Path root : roots) {
      Path candidate = root.resolve(packageName);
      if (Files.isDirectory(candidate)) {
        log.trace("Package {} located at {}", packageName, candidate);
        return Optional.of(candidate);
      }
    }
    return Optional.empty();
  }

  public List<Path> roots() { return roots; }
}
