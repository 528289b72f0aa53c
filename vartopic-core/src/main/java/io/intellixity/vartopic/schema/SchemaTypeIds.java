package io.intellixity.vartopic.schema;

import io.intellixity.vartopic.error.InvalidDataTypeException;
import io.intellixity.vartopic.error.InvalidMessageTypeException;

/** Parsing of {@code package/LocalType} identifiers. */
public final class SchemaTypeIds {
  public static final char SEPARATOR = '/';
  public static final String BASE_PACKAGE = "std_msgs";
  public static final String HEADER = "Header";
  public static final String QUALIFIED_HEADER = BASE_PACKAGE + SEPARATOR + HEADER;

  private SchemaTypeIds() {}

  /**
   * Splits {@code typeId} at its first separator. A bare {@code Header} belongs to the base
   * package; any other identifier without a package is rejected.
   *
   * @throws InvalidMessageTypeException if no package is given and none can be defaulted
   * @throws InvalidDataTypeException if the local type name is empty
   */
  public static SchemaTypeId parse(String typeId) {
    if (typeId == null) throw new InvalidMessageTypeException(null);
    int i = typeId.indexOf(SEPARATOR);
    String pkg = "";
    String type = typeId;
    if (i > 0) {
      pkg = typeId.substring(0, i);
      type = typeId.substring(i + 1);
    }

    if (pkg.isEmpty()) {
      if (!HEADER.equals(type)) throw new InvalidMessageTypeException(typeId);
      pkg = BASE_PACKAGE;
    }
    if (type.isEmpty()) throw new InvalidDataTypeException();
    return new SchemaTypeId(pkg, type);
  }

  /** Rewrites a bare {@code Header} member reference to its qualified form. */
  public static String qualifyMember(String memberType) {
    return HEADER.equals(memberType) ? QUALIFIED_HEADER : memberType;
  }
}
