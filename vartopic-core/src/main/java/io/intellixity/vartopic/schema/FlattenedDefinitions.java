package io.intellixity.vartopic.schema;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The flattened definition text format.
 * <p>
 * The root schema's text comes first. Each inlined dependency follows in first-discovery order,
 * introduced by a newline, an 80 character rule of {@code '='}, and a {@code "MSG: <typeId>"} line.
 */
public final class FlattenedDefinitions {
  public static final int RULE_WIDTH = 80;
  public static final String RULE = "=".repeat(RULE_WIDTH);
  public static final String MARKER = "MSG: ";

  private static final String SECTION_START = "\n" + RULE + "\n" + MARKER;

  private FlattenedDefinitions() {}

  /** Text placed before an inlined dependency's schema text. */
  public static String separator(String typeId) {
    return SECTION_START + typeId + "\n";
  }

  /**
   * Splits a flattened definition back into per-type texts, keyed by type id in the order they
   * appear; the first entry is {@code rootTypeId}.
   */
  public static Map<String, String> split(String rootTypeId, String definition) {
    Map<String, String> out = new LinkedHashMap<>();
    if (definition == null || definition.isEmpty()) return out;

    String currentType = rootTypeId;
    int from = 0;
    while (true) {
      int next = definition.indexOf(SECTION_START, from);
      if (next < 0) {
        out.putIfAbsent(currentType, definition.substring(from));
        return out;
      }
      out.putIfAbsent(currentType, definition.substring(from, next));

      int idStart = next + SECTION_START.length();
      int idEnd = definition.indexOf('\n', idStart);
      if (idEnd < 0) idEnd = definition.length();
      currentType = definition.substring(idStart, idEnd).trim();
      from = Math.min(idEnd + 1, definition.length());
    }
  }

  public static Map<String, String> split(SchemaIdentity identity) {
    return split(identity.getTypeId(), identity.getDefinition());
  }
}
