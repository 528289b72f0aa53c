package io.intellixity.vartopic.schema;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;

/** Reads the form written by {@link SchemaIdentityJsonSerializer}; absent fields take their defaults. */
public final class SchemaIdentityJsonDeserializer extends JsonDeserializer<SchemaIdentity> {
  @Override
  public SchemaIdentity deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    JsonNode n = p.getCodec().readTree(p);
    if (n == null || n.isNull()) return null;
    if (!n.isObject()) {
      return ctxt.reportInputMismatch(SchemaIdentity.class, "Expected object for schema identity, got %s", n.getNodeType());
    }
    return new SchemaIdentity(
        text(n, SchemaIdentityJsonSerializer.TYPE),
        text(n, SchemaIdentityJsonSerializer.MD5SUM),
        text(n, SchemaIdentityJsonSerializer.DEFINITION));
  }

  private static String text(JsonNode n, String field) {
    JsonNode v = n.get(field);
    return (v == null || v.isNull()) ? null : v.asText();
  }
}
