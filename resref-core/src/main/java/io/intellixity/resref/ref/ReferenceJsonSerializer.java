package io.intellixity.resref.ref;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.util.Map;

/** Canonical JSON form of a {@link Reference}; unresolved params are written as null. */
public final class ReferenceJsonSerializer extends JsonSerializer<Reference> {
  @Override
  public void serialize(Reference ref, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (ref == null) {
      g.writeNull();
      return;
    }

    String selfLink = ref.weakSelfLink();
    g.writeStartObject();
    g.writeStringField("collection", ref.collection());
    g.writeStringField("api", ref.api());
    g.writeStringField("version", ref.version());

    g.writeObjectFieldStart("params");
    for (Map.Entry<String, String> e : ref.params().entrySet()) {
      if (e.getValue() == null) g.writeNullField(e.getKey());
      else g.writeStringField(e.getKey(), e.getValue());
    }
    g.writeEndObject();

    g.writeStringField("selfLink", selfLink);
    g.writeEndObject();
  }
}
