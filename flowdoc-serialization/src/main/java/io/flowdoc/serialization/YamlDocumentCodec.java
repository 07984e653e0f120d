package io.flowdoc.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.flowdoc.core.document.DocumentParser;
import io.flowdoc.core.document.DocumentWriter;
import io.flowdoc.core.document.ParseResult;
import io.flowdoc.core.document.WorkflowDocument;
import java.io.IOException;
import java.util.Objects;
import java.util.logging.Logger;

/// YAML implementation of the document parser and writer.
///
/// ### Parse failures
/// - Malformed YAML: `YAML parsing error: <parser message>`
/// - Root that is not a mapping: `Root element must be a mapping`
/// - Shape the document model cannot hold, e.g. `Field 'name' must be a scalar`
///
/// Anything else parses, including non-mapping `blocks` entries; judging them and
/// required fields is left to the validator.
///
/// @implNote Thread-safe. The underlying mapper is configured once and never mutated.
/// @see WorkflowDocumentDeserializer
public class YamlDocumentCodec implements DocumentParser, DocumentWriter {

    private static final Logger logger = Logger.getLogger(YamlDocumentCodec.class.getName());

    private final ObjectMapper mapper;

    public YamlDocumentCodec() {
        this(DocumentSerializer.createYamlMapper());
    }

    /// @param mapper YAML mapper with {@link FlowdocJacksonModule} registered, not null
    public YamlDocumentCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public ParseResult parse(String text) {
        Objects.requireNonNull(text, "text must not be null");

        try (JsonParser parser = mapper.createParser(text)) {
            return ParseResult.parsed(WorkflowDocumentDeserializer.read(parser));
        } catch (InvalidDocumentException e) {
            return ParseResult.failed(e.getOriginalMessage());
        } catch (JsonProcessingException e) {
            logger.fine("YAML parsing failed: " + e.getOriginalMessage());
            return ParseResult.failed("YAML parsing error: " + e.getOriginalMessage());
        } catch (IOException e) {
            return ParseResult.failed("YAML parsing error: " + e.getMessage());
        }
    }

    @Override
    public String write(WorkflowDocument document) {
        Objects.requireNonNull(document, "document must not be null");
        try {
            return mapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize document: " + e.getMessage(), e);
        }
    }
}
