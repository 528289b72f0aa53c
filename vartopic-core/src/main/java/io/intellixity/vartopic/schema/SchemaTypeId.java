package io.intellixity.vartopic.schema;

/** A type identifier split into owning package and local type name. */
public record SchemaTypeId(String packageName, String localType) {
  public String qualified() {
    return packageName + SchemaTypeIds.SEPARATOR + localType;
  }

  @Override
  public String toString() { return qualified(); }
}
