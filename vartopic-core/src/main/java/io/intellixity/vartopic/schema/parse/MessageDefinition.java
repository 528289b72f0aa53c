package io.intellixity.vartopic.schema.parse;

import io.intellixity.vartopic.error.NoSuchMessageFieldException;
import io.intellixity.vartopic.error.NoSuchMessageMemberException;

import java.util.ArrayList;
import java.util.List;

/** Parsed members of one schema, in declaration order. */
public record MessageDefinition(String typeId, List<MessageMember> members) {
  public MessageDefinition {
    members = members == null ? List.of() : List.copyOf(members);
  }

  public MessageMember member(int index) {
    if (index < 0 || index >= members.size()) throw new NoSuchMessageMemberException(index);
    return members.get(index);
  }

  public List<MessageField> fields() {
    List<MessageField> out = new ArrayList<>();
    for (MessageMember m : members) {
      if (m instanceof MessageField f) out.add(f);
    }
    return out;
  }

  public List<MessageConstant> constants() {
    List<MessageConstant> out = new ArrayList<>();
    for (MessageMember m : members) {
      if (m instanceof MessageConstant c) out.add(c);
    }
    return out;
  }

  public MessageField field(int index) {
    List<MessageField> fs = fields();
    if (index < 0 || index >= fs.size()) throw new NoSuchMessageFieldException(index);
    return fs.get(index);
  }

  public MessageField field(String name) {
    for (MessageField f : fields()) {
      if (f.name().equals(name)) return f;
    }
    throw new NoSuchMessageFieldException(name);
  }
}
