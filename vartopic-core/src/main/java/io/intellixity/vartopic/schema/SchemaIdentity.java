package io.intellixity.vartopic.schema;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.intellixity.vartopic.error.InvalidMessageTypeException;

import java.util.Objects;

/**
 * Identity of a message schema: canonical type id, checksum and flattened definition.
 * <p>
 * The checksum is either the wildcard {@value #ANY_CHECKSUM} or a 32 character fingerprint.
 * Instances are plain mutable values owned by whoever holds them; copies are independent.
 * Equality covers type id and checksum, since the definition is derived from both.
 */
@JsonSerialize(using = SchemaIdentityJsonSerializer.class)
@JsonDeserialize(using = SchemaIdentityJsonDeserializer.class)
public final class SchemaIdentity {
  public static final String ANY_CHECKSUM = "*";
  public static final int CHECKSUM_LENGTH = 32;

  private String typeId;
  private String checksum;
  private String definition;

  public SchemaIdentity() {
    this("", ANY_CHECKSUM, "");
  }

  public SchemaIdentity(String typeId, String checksum, String definition) {
    setTypeId(typeId);
    setChecksum(checksum);
    setDefinition(definition);
  }

  public SchemaIdentity(SchemaIdentity src) {
    this(Objects.requireNonNull(src, "src").typeId, src.checksum, src.definition);
  }

  public String getTypeId() { return typeId; }
  public void setTypeId(String typeId) { this.typeId = typeId == null ? "" : typeId; }

  public String getChecksum() { return checksum; }
  public void setChecksum(String checksum) { this.checksum = checksum == null ? ANY_CHECKSUM : checksum; }

  public String getDefinition() { return definition; }
  public void setDefinition(String definition) { this.definition = definition == null ? "" : definition; }

  public boolean isValid() {
    return !checksum.isEmpty()
        && (ANY_CHECKSUM.equals(checksum) || checksum.length() == CHECKSUM_LENGTH)
        && !typeId.isEmpty()
        && !definition.isEmpty();
  }

  /** Returns this identity, or throws when it must not be used to build anything from. */
  public SchemaIdentity requireValid() {
    if (!isValid()) throw new InvalidMessageTypeException(typeId);
    return this;
  }

  public boolean hasWildcardChecksum() {
    return ANY_CHECKSUM.equals(checksum);
  }

  public void clear() {
    typeId = "";
    checksum = ANY_CHECKSUM;
    definition = "";
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SchemaIdentity other)) return false;
    return typeId.equals(other.typeId) && checksum.equals(other.checksum);
  }

  @Override
  public int hashCode() {
    return Objects.hash(typeId, checksum);
  }

  @Override
  public String toString() { return typeId; }
}
