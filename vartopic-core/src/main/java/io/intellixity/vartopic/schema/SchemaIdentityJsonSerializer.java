package io.intellixity.vartopic.schema;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/** JSON form of {@link SchemaIdentity}: {@code {"type", "md5sum", "definition"}}. */
public final class SchemaIdentityJsonSerializer extends JsonSerializer<SchemaIdentity> {
  static final String TYPE = "type";
  static final String MD5SUM = "md5sum";
  static final String DEFINITION = "definition";

  @Override
  public void serialize(SchemaIdentity s, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (s == null) {
      g.writeNull();
      return;
    }
    g.writeStartObject();
    g.writeStringField(TYPE, s.getTypeId());
    g.writeStringField(MD5SUM, s.getChecksum());
    g.writeStringField(DEFINITION, s.getDefinition());
    g.writeEndObject();
  }
}
