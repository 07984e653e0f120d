package io.flowdoc.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.flowdoc.core.diff.Change;
import java.io.IOException;
import java.io.Serial;

/// Serializes the `Change` sealed hierarchy with a `"type"` discriminator field.
///
/// Emitted shape per subtype:
/// - **`field_change`**: `{"type","field","oldValue","newValue"}`
/// - **`block_added`** / **`block_removed`**: `{"type","blockId","blockType","blockName"}`
/// - **`block_modified`**: `{"type","blockId","fieldDiffs":[...]}`
///
/// Null values are omitted. Reports are write-only, so there is no deserializer.
///
/// @implNote Package-private. Registered by {@link FlowdocJacksonModule}.
class ChangeSerializer extends StdSerializer<Change> {

    @Serial private static final long serialVersionUID = 2286014583302964420L;

    ChangeSerializer() {
        super(Change.class);
    }

    @Override
    public void serialize(Change change, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("type", change.type());

        if (change instanceof Change.FieldChange c) {
            gen.writeStringField("field", c.field());
            writeIfPresent(gen, "oldValue", c.oldValue());
            writeIfPresent(gen, "newValue", c.newValue());
        } else if (change instanceof Change.BlockAdded c) {
            writeBlock(gen, c.blockId(), c.blockType(), c.blockName());
        } else if (change instanceof Change.BlockRemoved c) {
            writeBlock(gen, c.blockId(), c.blockType(), c.blockName());
        } else if (change instanceof Change.BlockModified c) {
            gen.writeStringField("blockId", c.blockId());
            provider.defaultSerializeField("fieldDiffs", c.fieldDiffs(), gen);
        }

        gen.writeEndObject();
    }

    private static void writeBlock(JsonGenerator gen, String id, String type, String name)
            throws IOException {
        gen.writeStringField("blockId", id);
        writeIfPresent(gen, "blockType", type);
        writeIfPresent(gen, "blockName", name);
    }

    private static void writeIfPresent(JsonGenerator gen, String field, String value)
            throws IOException {
        if (value != null) {
            gen.writeStringField(field, value);
        }
    }
}
