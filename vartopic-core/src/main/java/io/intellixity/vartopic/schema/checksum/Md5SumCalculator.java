package io.intellixity.vartopic.schema.checksum;

import io.intellixity.vartopic.error.DefinitionParseException;
import io.intellixity.vartopic.error.InvalidOperationException;
import io.intellixity.vartopic.error.NoSuchDataTypeException;
import io.intellixity.vartopic.schema.FlattenedDefinitions;
import io.intellixity.vartopic.schema.SchemaIdentity;
import io.intellixity.vartopic.schema.SchemaTypeIds;
import io.intellixity.vartopic.schema.parse.MessageConstant;
import io.intellixity.vartopic.schema.parse.MessageDefinition;
import io.intellixity.vartopic.schema.parse.MessageDefinitionParser;
import io.intellixity.vartopic.schema.parse.MessageField;
import io.intellixity.vartopic.types.DataTypeRegistry;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HashMap;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * MD5 checksum compatible with ROS message md5sums.
 * <p>
 * Each schema hashes the text made of its constants ({@code type name=value}), then its fields:
 * built-in fields as declared ({@code type name}, array suffix kept), nested fields as
 * {@code <md5 of nested type> name}. Lines are joined by {@code '\n'} and the result trimmed.
 * Comments and whitespace in the schema text do not affect the checksum.
 * <p>
 * Empty nested schemas are not inlined in a flattened definition; their text is fetched from
 * {@code sectionSource} when one is configured.
 */
public final class Md5SumCalculator implements ChecksumCalculator {
  private final MessageDefinitionParser parser;
  private final DataTypeRegistry types;
  private final Function<String, String> sectionSource;

  public Md5SumCalculator(MessageDefinitionParser parser, DataTypeRegistry types) {
    this(parser, types, null);
  }

  public Md5SumCalculator(MessageDefinitionParser parser, DataTypeRegistry types, Function<String, String> sectionSource) {
    this.parser = Objects.requireNonNull(parser, "parser");
    this.types = Objects.requireNonNull(types, "types");
    this.sectionSource = sectionSource;
  }

  @Override
  public String compute(SchemaIdentity identity) {
    Objects.requireNonNull(identity, "identity");
    if (identity.getTypeId().isEmpty() || identity.getDefinition().isEmpty()) {
      throw new InvalidOperationException("cannot checksum unresolved schema [" + identity.getTypeId() + "]");
    }
    Map<String, String> sections = FlattenedDefinitions.split(identity);
    return new Computation(sections).md5(identity.getTypeId());
  }

  /** The text whose MD5 is the checksum of {@code definition}. */
  String md5Text(MessageDefinition definition, Computation c) {
    StringBuilder buf = new StringBuilder();
    for (MessageConstant k : definition.constants()) {
      buf.append(k.type()).append(' ').append(k.name()).append('=').append(k.value()).append('\n');
    }
    for (MessageField f : definition.fields()) {
      String element = SchemaTypeIds.qualifyMember(f.elementType());
      if (types.isBuiltin(element)) {
        buf.append(f.type()).append(' ').append(f.name()).append('\n');
      } else {
        buf.append(c.md5(element)).append(' ').append(f.name()).append('\n');
      }
    }
    return buf.toString().trim();
  }

  static String md5Hex(String text) {
    try {
      MessageDigest md = MessageDigest.getInstance("MD5");
      byte[] digest = md.digest(text.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(digest);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("MD5 not available", e);
    }
  }

  final class Computation {
    private final Map<String, String> sections;
    private final Map<String, String> done = new HashMap<>();
    private final Set<String> inProgress = new HashSet<>();

    Computation(Map<String, String> sections) {
      this.sections = sections;
    }

    String md5(String typeId) {
      String cached = done.get(typeId);
      if (cached != null) return cached;

      String text = sections.get(typeId);
      if (text == null && sectionSource != null) text = sectionSource.apply(typeId);
      if (text == null) throw new NoSuchDataTypeException(typeId);
      if (!inProgress.add(typeId)) {
        throw new DefinitionParseException(typeId, "", "recursive type reference");
      }
      String sum;
      try {
        sum = md5Hex(md5Text(parser.parse(typeId, text), this));
      } finally {
        inProgress.remove(typeId);
      }
      done.put(typeId, sum);
      return sum;
    }
  }
}
