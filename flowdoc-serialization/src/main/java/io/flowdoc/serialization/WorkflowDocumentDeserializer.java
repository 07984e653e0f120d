package io.flowdoc.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.flowdoc.core.document.Block;
import io.flowdoc.core.document.Connection;
import io.flowdoc.core.document.Position;
import io.flowdoc.core.document.WorkflowDocument;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Builds a {@link WorkflowDocument} from a YAML or JSON token stream.
///
/// Reading is lenient about what the validator judges and strict about what the
/// document model cannot hold:
/// - Missing fields stay absent; fields written as null are recorded as such. The
///   validator reports required ones.
/// - Numbers and booleans in string fields are read as their source text
///   (`version: 1.10` becomes `"1.10"`).
/// - A `blocks` or `connections` value that is not a sequence, null included, is
///   recorded as malformed rather than rejected. So are entries of those sequences
///   that are not mappings.
/// - `config` is kept as written, whatever its shape.
/// - Non-scalar values in string fields, a `position` without numeric coordinates and
///   non-mapping roots are rejected with {@link InvalidDocumentException}.
/// - Unknown fields are kept in document order as extensions and extras.
///
/// @implNote Package-private. Registered by {@link FlowdocJacksonModule}; also used
/// directly by {@link YamlDocumentCodec}.
/// @see WorkflowDocumentSerializer for the inverse operation
class WorkflowDocumentDeserializer extends StdDeserializer<WorkflowDocument> {

    @Serial private static final long serialVersionUID = 6412290517431750263L;

    static final String ROOT_NOT_MAPPING = "Root element must be a mapping";

    private static final List<String> NULLABLE_TOP_LEVEL =
            List.of("name", "description", "version", "triggers", "metadata");
    private static final List<String> BLOCK_FIELDS =
            List.of("id", "type", "name", "config", "position");
    private static final List<String> CONNECTION_FIELDS = List.of("from", "to", "condition");

    WorkflowDocumentDeserializer() {
        super(WorkflowDocument.class);
    }

    @Override
    public WorkflowDocument deserialize(JsonParser p, DeserializationContext ctx)
            throws IOException {
        return read(p);
    }

    /// Reads a document from the parser's current token.
    ///
    /// The parser is advanced first when it has no current token.
    ///
    /// @param p parser positioned on or before the root value, not null
    /// @return the document, never null
    /// @throws InvalidDocumentException if the content cannot be represented
    /// @throws IOException if the text is not well-formed
    static WorkflowDocument read(JsonParser p) throws IOException {
        if (!p.hasCurrentToken()) {
            p.nextToken();
        }
        if (p.currentToken() != JsonToken.START_OBJECT) {
            throw new InvalidDocumentException(ROOT_NOT_MAPPING);
        }
        return fromMap(readMapping(p));
    }

    private static WorkflowDocument fromMap(Map<String, Object> root)
            throws InvalidDocumentException {
        WorkflowDocument.Builder builder = WorkflowDocument.builder();
        Map<String, Object> extensions = new LinkedHashMap<>();

        for (Map.Entry<String, Object> field : root.entrySet()) {
            String key = field.getKey();
            Object value = field.getValue();

            switch (key) {
                case "name" -> builder.name(scalar(value, "Field 'name'"));
                case "description" -> builder.description(scalar(value, "Field 'description'"));
                case "version" -> builder.version(scalar(value, "Field 'version'"));
                case "blocks" -> {
                    if (value instanceof List<?> entries) {
                        readBlocks(entries, builder);
                    } else {
                        builder.malformed(key);
                    }
                }
                case "connections" -> {
                    if (value instanceof List<?> entries) {
                        readConnections(entries, builder);
                    } else {
                        builder.malformed(key);
                    }
                }
                case "triggers" -> {
                    if (value instanceof List<?> triggers) {
                        builder.triggers((List<?>) opaque(triggers));
                    } else if (value != null) {
                        extensions.put(key, opaque(value));
                    }
                }
                case "metadata" -> {
                    if (value instanceof Map<?, ?> metadata) {
                        @SuppressWarnings("unchecked")
                        Map<String, ?> plain = (Map<String, ?>) opaque(metadata);
                        builder.metadata(plain);
                    } else if (value != null) {
                        extensions.put(key, opaque(value));
                    }
                }
                default -> extensions.put(key, opaque(value));
            }

            if (value == null && NULLABLE_TOP_LEVEL.contains(key)) {
                builder.nullField(key);
            }
        }

        return builder.extensions(extensions).build();
    }

    private static void readBlocks(List<?> entries, WorkflowDocument.Builder document)
            throws InvalidDocumentException {
        List<Block> blocks = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            Object entry = entries.get(i);
            if (entry instanceof Map<?, ?> fields) {
                blocks.add(readBlock(i, fields));
            } else {
                document.malformedBlock(i, opaque(entry));
            }
        }
        document.blocks(blocks);
    }

    private static Block readBlock(int index, Map<?, ?> fields) throws InvalidDocumentException {
        String label = "Block " + index + " field ";
        Block.Builder builder = Block.builder();
        Map<String, Object> extras = new LinkedHashMap<>();

        for (Map.Entry<?, ?> field : fields.entrySet()) {
            String key = (String) field.getKey();
            Object value = field.getValue();

            switch (key) {
                case "id" -> builder.id(scalar(value, label + "'id'"));
                case "type" -> builder.type(scalar(value, label + "'type'"));
                case "name" -> builder.name(scalar(value, label + "'name'"));
                case "config" -> builder.config(opaque(value));
                case "position" -> {
                    if (value != null) {
                        builder.position(position(value, label));
                    }
                }
                default -> extras.put(key, opaque(value));
            }

            if (value == null && BLOCK_FIELDS.contains(key)) {
                builder.nullField(key);
            }
        }

        return builder.extras(extras).build();
    }

    private static Position position(Object value, String label)
            throws InvalidDocumentException {
        if (value instanceof Map<?, ?> coordinates
                && coordinates.get("x") instanceof Scalar x
                && coordinates.get("y") instanceof Scalar y
                && x.value() instanceof Number xValue
                && y.value() instanceof Number yValue) {
            return new Position(xValue.doubleValue(), yValue.doubleValue());
        }
        throw new InvalidDocumentException(label + "'position' must have numeric x and y");
    }

    private static void readConnections(List<?> entries, WorkflowDocument.Builder document)
            throws InvalidDocumentException {
        List<Connection> connections = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            if (!(entries.get(i) instanceof Map<?, ?> fields)) {
                document.malformedConnection(i, opaque(entries.get(i)));
                continue;
            }

            String label = "Connection " + i + " field ";
            String from = null;
            String to = null;
            String condition = null;
            Map<String, Object> extras = new LinkedHashMap<>();
            Set<String> nullFields = new LinkedHashSet<>();

            for (Map.Entry<?, ?> field : fields.entrySet()) {
                String key = (String) field.getKey();
                Object value = field.getValue();
                switch (key) {
                    case "from" -> from = scalar(value, label + "'from'");
                    case "to" -> to = scalar(value, label + "'to'");
                    case "condition" -> condition = scalar(value, label + "'condition'");
                    default -> extras.put(key, opaque(value));
                }
                if (value == null && CONNECTION_FIELDS.contains(key)) {
                    nullFields.add(key);
                }
            }
            connections.add(new Connection(from, to, condition, extras, nullFields));
        }
        document.connections(connections);
    }

    private static String scalar(Object value, String label) throws InvalidDocumentException {
        if (value == null) {
            return null;
        }
        if (!(value instanceof Scalar scalar)) {
            throw new InvalidDocumentException(label + " must be a scalar");
        }
        return scalar.text();
    }

    /// Strips source text from a read value, leaving plain maps, lists and scalars.
    private static Object opaque(Object value) {
        if (value instanceof Scalar scalar) {
            return scalar.value();
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> plain = new LinkedHashMap<>();
            map.forEach((key, nested) -> plain.put((String) key, opaque(nested)));
            return plain;
        }
        if (value instanceof List<?> list) {
            List<Object> plain = new ArrayList<>(list.size());
            list.forEach(nested -> plain.add(opaque(nested)));
            return plain;
        }
        return value;
    }

    // Token reading. Mappings become ordered maps, sequences lists, explicit nulls
    // null, and every other scalar a Scalar holding both its value and source text.

    private static Object readValue(JsonParser p) throws IOException {
        JsonToken token = p.currentToken();
        if (token == null) {
            throw new InvalidDocumentException("Unexpected end of input");
        }
        return switch (token) {
            case START_OBJECT -> readMapping(p);
            case START_ARRAY -> readSequence(p);
            case VALUE_NULL -> null;
            case VALUE_TRUE, VALUE_FALSE -> new Scalar(p.getBooleanValue(), p.getText());
            case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT ->
                    new Scalar(p.getNumberValue(), p.getText());
            case VALUE_STRING -> new Scalar(p.getText(), p.getText());
            case VALUE_EMBEDDED_OBJECT -> {
                Object embedded = p.getEmbeddedObject();
                yield new Scalar(embedded, p.getText());
            }
            default -> throw new InvalidDocumentException("Unexpected token " + token);
        };
    }

    private static Map<String, Object> readMapping(JsonParser p) throws IOException {
        Map<String, Object> fields = new LinkedHashMap<>();
        while (p.nextToken() == JsonToken.FIELD_NAME) {
            String key = p.currentName();
            p.nextToken();
            fields.put(key, readValue(p));
        }
        return fields;
    }

    private static List<Object> readSequence(JsonParser p) throws IOException {
        List<Object> entries = new ArrayList<>();
        while (p.nextToken() != JsonToken.END_ARRAY) {
            entries.add(readValue(p));
        }
        return entries;
    }

    /// A scalar as read: its typed value and the text it was written as.
    private record Scalar(Object value, String text) {}
}
