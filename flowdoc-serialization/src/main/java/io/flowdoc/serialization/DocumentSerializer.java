package io.flowdoc.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import io.flowdoc.core.document.WorkflowDocument;

/// Utility class for converting workflow documents and engine results to text.
///
/// {@snippet :
/// String yaml = DocumentSerializer.toYaml(document);
/// WorkflowDocument restored = DocumentSerializer.fromYaml(yaml);
///
/// // JSON report of any engine result
/// String json = DocumentSerializer.toJson(validationResult);
/// }
///
/// @implNote Thread-safe. Mappers are created per call via the factory methods.
/// For high-throughput use, cache a mapper or use {@link YamlDocumentCodec}.
///
/// @see FlowdocJacksonModule for the registered type handlers
public final class DocumentSerializer {

    private DocumentSerializer() {}

    /// Serializes a document to canonical YAML.
    ///
    /// @param document the document to serialize, not null
    /// @return YAML text, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toYaml(WorkflowDocument document) {
        return new YamlDocumentCodec().write(document);
    }

    /// Deserializes a document from YAML.
    ///
    /// @param yaml YAML text, not null
    /// @return the document, never null
    /// @throws IllegalArgumentException if the text is not a workflow document
    public static WorkflowDocument fromYaml(String yaml) {
        try {
            return createYamlMapper().readValue(yaml, WorkflowDocument.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize document: " + e.getOriginalMessage(), e);
        }
    }

    /// Serializes any engine value to pretty-printed JSON.
    ///
    /// @param value document or result record, not null
    /// @return JSON text, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(Object value) {
        try {
            return createJsonMapper().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize to JSON: " + e.getMessage(), e);
        }
    }

    /// Creates a YAML mapper configured for the document format.
    ///
    /// - no `---` document start marker
    /// - quotes only where a scalar would otherwise change type, see
    ///   {@link YamlStringQuotingChecker}
    /// - sequences indented under their key
    /// - multi-line strings written as literal blocks
    ///
    /// @return configured mapper, never null
    public static ObjectMapper createYamlMapper() {
        return YAMLMapper.builder(
                        YAMLFactory.builder()
                                .stringQuotingChecker(new YamlStringQuotingChecker())
                                .build())
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
                .enable(YAMLGenerator.Feature.INDENT_ARRAYS_WITH_INDICATOR)
                .enable(YAMLGenerator.Feature.LITERAL_BLOCK_STYLE)
                .addModule(new FlowdocJacksonModule())
                .build();
    }

    /// Creates a JSON mapper for reports.
    ///
    /// @return configured mapper with indented output, never null
    public static ObjectMapper createJsonMapper() {
        return new ObjectMapper()
                .registerModule(new FlowdocJacksonModule())
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
