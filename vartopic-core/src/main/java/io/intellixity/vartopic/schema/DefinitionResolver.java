package io.intellixity.vartopic.schema;

import io.intellixity.vartopic.error.FileOpenException;
import io.intellixity.vartopic.error.PackageNotFoundException;
import io.intellixity.vartopic.pkg.PackageLocator;
import io.intellixity.vartopic.schema.parse.FieldMatch;
import io.intellixity.vartopic.schema.parse.LineMatcher;
import io.intellixity.vartopic.types.DataTypeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves a schema and every schema it transitively references into one {@link SchemaIdentity}.
 * <p>
 * Dependencies are expanded breadth-first and each one is inlined exactly once, in the order it
 * was first referenced, so the flattened text is deterministic for a fixed set of schema files.
 * Schema text for {@code pkg/Type} is read from {@code <package root>/msg/Type.msg}.
 * <p>
 * The resolver holds no per-call state; concurrent {@link #resolve(String)} calls are independent.
 */
public final class DefinitionResolver {
  private static final Logger log = LoggerFactory.getLogger(DefinitionResolver.class);

  public static final String MSG_DIR = "msg";
  public static final String MSG_EXTENSION = ".msg";

  private final PackageLocator packages;
  private final LineMatcher lineMatcher;
  private final DataTypeRegistry types;

  public DefinitionResolver(PackageLocator packages, LineMatcher lineMatcher, DataTypeRegistry types) {
    this.packages = Objects.requireNonNull(packages, "packages");
    this.lineMatcher = Objects.requireNonNull(lineMatcher, "lineMatcher");
    this.types = Objects.requireNonNull(types, "types");
  }

  /**
   * Resolves {@code rootTypeId}. The checksum of the result is always {@value SchemaIdentity#ANY_CHECKSUM}.
   * When the root schema is empty the result has an empty type id and definition.
   *
   * @throws io.intellixity.vartopic.error.InvalidMessageTypeException for an identifier without package
   * @throws io.intellixity.vartopic.error.InvalidDataTypeException for an empty local type name
   * @throws PackageNotFoundException if a package cannot be located
   * @throws FileOpenException if a schema file cannot be read
   */
  public SchemaIdentity resolve(String rootTypeId) {
    Objects.requireNonNull(rootTypeId, "rootTypeId");
    ResolutionState state = new ResolutionState(rootTypeId);

    while (!state.pending.isEmpty()) {
      String current = state.pending.peekFirst();
      String text = read(current);

      if (!text.isEmpty()) {
        for (String line : text.split("\n", -1)) {
          Optional<FieldMatch> m = lineMatcher.match(line);
          if (m.isEmpty()) continue;
          String memberType = SchemaTypeIds.qualifyMember(m.get().memberType());
          if (!types.isBuiltin(memberType)) state.discover(memberType);
        }

        if (state.definition.length() > 0) {
          state.definition.append(FlattenedDefinitions.separator(current));
        }
        state.definition.append(text);
        log.debug("Expanded {} while resolving {}", current, rootTypeId);
      }
      state.pending.pollFirst();
    }

    SchemaIdentity out = new SchemaIdentity();
    if (state.definition.length() > 0) {
      out.setTypeId(rootTypeId);
      out.setDefinition(state.definition.toString());
    }
    log.debug("Resolved {} ({} types)", rootTypeId, state.visited.size());
    return out;
  }

  /** Path of the schema file for {@code typeId}, without checking that it exists. */
  public Path schemaFile(String typeId) {
    SchemaTypeId id = SchemaTypeIds.parse(typeId);
    Path root = packages.locate(id.packageName())
        .orElseThrow(() -> new PackageNotFoundException(id.packageName()));
    return root.resolve(MSG_DIR).resolve(id.localType() + MSG_EXTENSION);
  }

  /**
   * Raw text of the single schema {@code typeId}, without dependencies.
   * Bytes that are not valid UTF-8 are replaced, not rejected.
   *
   * @throws PackageNotFoundException if its package cannot be located
   * @throws FileOpenException if the schema file cannot be read
   */
  public String read(String typeId) {
    Path file = schemaFile(typeId);
    try {
      return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new FileOpenException(file.toString(), e);
    }
  }

  private static final class ResolutionState {
    final Set<String> visited = new HashSet<>();
    final Deque<String> pending = new ArrayDeque<>();
    final StringBuilder definition = new StringBuilder();

    ResolutionState(String root) {
      visited.add(root);
      pending.addLast(root);
    }

    void discover(String typeId) {
      if (visited.add(typeId)) pending.addLast(typeId);
    }
  }
}
