package io.intellixity.vartopic.schema.parse;

import io.intellixity.vartopic.error.DefinitionParseException;
import io.intellixity.vartopic.types.DataTypeRegistry;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the text of a single schema into a {@link MessageDefinition}.
 * <p>
 * Unlike a {@link LineMatcher}, every non-blank line must be a field or a constant declaration.
 * A string constant's value is the rest of its line, {@code #} included.
 */
public final class MessageDefinitionParser {
  private static final Pattern CONSTANT = Pattern.compile(
      "^(" + RegexLineMatcher.TYPE + ")\\s+(" + RegexLineMatcher.NAME + ")\\s*=(.*)$");

  private final LineMatcher lineMatcher;
  private final DataTypeRegistry types;

  public MessageDefinitionParser(LineMatcher lineMatcher, DataTypeRegistry types) {
    this.lineMatcher = Objects.requireNonNull(lineMatcher, "lineMatcher");
    this.types = Objects.requireNonNull(types, "types");
  }

  public MessageDefinition parse(String typeId, String text) {
    List<MessageMember> members = new ArrayList<>();
    Set<String> names = new HashSet<>();
    if (text == null) return new MessageDefinition(typeId, members);

    for (String line : text.split("\n", -1)) {
      String code = RegexLineMatcher.stripComment(line).trim();
      if (code.isEmpty()) continue;

      MessageMember member = code.indexOf('=') >= 0 ? constant(typeId, line, code) : field(typeId, line);
      if (!names.add(member.name())) {
        throw new DefinitionParseException(typeId, line, "duplicate member name '" + member.name() + "'");
      }
      members.add(member);
    }
    return new MessageDefinition(typeId, members);
  }

  private MessageMember field(String typeId, String line) {
    Optional<FieldMatch> m = lineMatcher.match(line);
    if (m.isEmpty()) throw new DefinitionParseException(typeId, line, "not a field or constant declaration");
    return MessageField.of(m.get());
  }

  private MessageMember constant(String typeId, String line, String code) {
    Matcher m = CONSTANT.matcher(code);
    if (!m.matches()) throw new DefinitionParseException(typeId, line, "malformed constant declaration");
    String type = m.group(1);
    if (!types.isBuiltin(type) || "time".equals(type) || "duration".equals(type)) {
      throw new DefinitionParseException(typeId, line, "constant type must be a built-in primitive");
    }

    String value;
    if ("string".equals(type)) {
      value = line.substring(line.indexOf('=') + 1).trim();
    } else {
      value = m.group(3).trim();
      if (value.isEmpty()) throw new DefinitionParseException(typeId, line, "constant has no value");
    }
    return new MessageConstant(m.group(2), type, value);
  }
}
