package io.flowdoc.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.flowdoc.core.document.Block;
import io.flowdoc.core.document.Connection;
import io.flowdoc.core.document.WorkflowDocument;
import java.io.IOException;
import java.io.Serial;
import java.util.List;
import java.util.Map;

/// Writes a {@link WorkflowDocument} in canonical field order.
///
/// Order: `name`, `description`, `version`, `blocks`, `connections`, `triggers`,
/// `metadata`, then extensions as read. Absent fields are omitted and explicit nulls
/// are written as null. Each block and connection is written through its `asFields()`
/// view, and malformed entries are written back as read, at their positions.
///
/// @implNote Package-private. Registered by {@link FlowdocJacksonModule}.
/// @see WorkflowDocumentDeserializer for the inverse operation
class WorkflowDocumentSerializer extends StdSerializer<WorkflowDocument> {

    @Serial private static final long serialVersionUID = -1862377405962154908L;

    WorkflowDocumentSerializer() {
        super(WorkflowDocument.class);
    }

    @Override
    public void serialize(
            WorkflowDocument document, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();

        writeIfDeclared(gen, provider, document, "name", document.getName());
        writeIfDeclared(gen, provider, document, "description", document.getDescription());
        writeIfDeclared(gen, provider, document, "version", document.getVersion());

        if (document.blockEntries() != null) {
            writeEntries(gen, provider, "blocks", document.blockEntries());
        }
        if (document.connectionEntries() != null) {
            writeEntries(gen, provider, "connections", document.connectionEntries());
        }

        writeIfDeclared(gen, provider, document, "triggers", document.getTriggers());
        writeIfDeclared(gen, provider, document, "metadata", document.getMetadata());
        for (Map.Entry<String, Object> extension : document.getExtensions().entrySet()) {
            provider.defaultSerializeField(extension.getKey(), extension.getValue(), gen);
        }

        gen.writeEndObject();
    }

    private static void writeEntries(
            JsonGenerator gen, SerializerProvider provider, String field, List<Object> entries)
            throws IOException {
        gen.writeArrayFieldStart(field);
        for (Object entry : entries) {
            if (entry instanceof Block block) {
                provider.defaultSerializeValue(block.asFields(), gen);
            } else if (entry instanceof Connection connection) {
                provider.defaultSerializeValue(connection.asFields(), gen);
            } else {
                provider.defaultSerializeValue(entry, gen);
            }
        }
        gen.writeEndArray();
    }

    private static void writeIfDeclared(
            JsonGenerator gen,
            SerializerProvider provider,
            WorkflowDocument document,
            String field,
            Object value)
            throws IOException {
        if (value != null) {
            provider.defaultSerializeField(field, value, gen);
        } else if (document.getNullFields().contains(field)) {
            gen.writeNullField(field);
        }
    }
}
