package io.intellixity.tabula.store;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import io.intellixity.tabula.history.HistoryEntry;

import java.io.IOException;

/** Canonical JSON serializer for {@link StoreDescriptor}; history types use their persisted text. */
public final class StoreDescriptorJsonSerializer extends JsonSerializer<StoreDescriptor> {
  @Override
  public void serialize(StoreDescriptor d, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (d == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();
    g.writeStringField("path", d.path().toString());
    if (d.version() != null) {
      g.writeStringField("version", d.version());
    } else {
      g.writeNullField("version");
    }

    g.writeArrayFieldStart("tables");
    for (String t : d.tables()) g.writeString(t);
    g.writeEndArray();

    g.writeArrayFieldStart("history");
    for (HistoryEntry e : d.history()) {
      g.writeStartObject();
      g.writeNumberField("seq", e.sequence());
      g.writeNumberField("time", e.timestamp());
      g.writeStringField("type", e.kind().text());
      g.writeStringField("event", e.payload());
      g.writeEndObject();
    }
    g.writeEndArray();

    g.writeEndObject();
  }
}
