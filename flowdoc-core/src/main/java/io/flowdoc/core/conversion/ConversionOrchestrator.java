package io.flowdoc.core.conversion;

import io.flowdoc.core.FlowdocConfig;
import io.flowdoc.core.analysis.DocumentMetadata;
import io.flowdoc.core.analysis.MetadataExtractor;
import io.flowdoc.core.diff.DiffResult;
import io.flowdoc.core.document.DocumentParser;
import io.flowdoc.core.document.DocumentWriter;
import io.flowdoc.core.document.ParseResult;
import io.flowdoc.core.document.WorkflowDocument;
import io.flowdoc.core.generation.GenerationRequest;
import io.flowdoc.core.generation.GenerationResponse;
import io.flowdoc.core.generation.TextGenerator;
import io.flowdoc.core.validation.ValidationResult;
import io.flowdoc.core.validation.WorkflowValidator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Converts between natural language and workflow documents.
///
/// The only engine component that calls the {@link TextGenerator}. Every other
/// step (extraction, parsing, validation, repair) is local and synchronous.
///
/// ### Description to document
/// 1. Build the prompt from the description and context
/// 2. Call the generator (temperature and token limit from {@link FlowdocConfig})
/// 3. Extract the document text: first fenced block, else everything from the
///    first `name:` or `blocks:` line
/// 4. Validate; if invalid, run exactly one repair pass (parse and re-serialize
///    canonically) and validate again
///
/// The repair pass is never retried, and a still-invalid result is returned rather
/// than thrown.
///
/// ### Document to text
/// Canonical serialization, optionally followed by a generator formatting pass. The
/// formatted text is extracted like generated documents and kept only when it parses
/// back to the same document; otherwise the canonical text is returned.
///
/// @implNote Thread-safe as long as the generator is. The generator call is the
/// only blocking network operation; timeouts are the generator's responsibility.
/// @see ConversionResult
public class ConversionOrchestrator {

    private static final Logger logger = Logger.getLogger(ConversionOrchestrator.class.getName());

    /// Summary used whenever the generator cannot provide one.
    public static final String FALLBACK_SUMMARY = "Changes detected in workflow";

    private final TextGenerator generator;
    private final DocumentParser parser;
    private final DocumentWriter writer;
    private final WorkflowValidator validator;
    private final MetadataExtractor metadataExtractor;
    private final FlowdocConfig config;

    private ConversionOrchestrator(Builder builder) {
        this.generator = Objects.requireNonNull(builder.generator, "generator must not be null");
        this.parser = Objects.requireNonNull(builder.parser, "parser must not be null");
        this.writer = Objects.requireNonNull(builder.writer, "writer must not be null");
        this.validator = Objects.requireNonNull(builder.validator, "validator must not be null");
        this.metadataExtractor =
                Objects.requireNonNull(
                        builder.metadataExtractor, "metadataExtractor must not be null");
        this.config = builder.config != null ? builder.config : new FlowdocConfig();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Generates a workflow document from a natural-language description.
    ///
    /// @param description what the workflow should do, not null
    /// @param context optional hints (`workflow_type`, `category`), may be null
    /// @return the final text with its validation, never null
    /// @throws ConversionException if generation fails or yields no document text
    public ConversionResult describeToDocument(String description, Map<String, ?> context)
            throws ConversionException {
        Objects.requireNonNull(description, "description must not be null");

        GenerationRequest request =
                new GenerationRequest(
                        GenerationRequest.DESCRIBE,
                        PromptTemplates.describe(description, context),
                        config.getDescribeTemperature(),
                        config.getDescribeMaxTokens());

        String content = contentOf(generator.generate(request));
        String candidate =
                DocumentTextExtractor.extract(content)
                        .orElseThrow(
                                () ->
                                        new ConversionException(
                                                "No workflow document found in generated text"));

        ValidationResult validation = validator.validate(candidate);
        boolean repaired = false;
        if (!validation.valid()) {
            logger.warning(
                    "Generated document is invalid " + validation.errors() + ", attempting repair");
            candidate = repair(candidate);
            validation = validator.validate(candidate);
            repaired = true;
        }

        return result(candidate, validation, repaired);
    }

    /// Serializes a document and validates it, formatting with the generator when
    /// {@link FlowdocConfig#isLlmFormatting()} is set.
    ///
    /// @param document document to render, not null
    /// @return text with its validation, never null
    public ConversionResult documentToText(WorkflowDocument document) {
        return documentToText(document, config.isLlmFormatting());
    }

    /// Serializes a document and validates it.
    ///
    /// @param document document to render, not null
    /// @param llmFormatting whether to ask the generator to tidy the canonical text
    /// @return text with its validation, never null
    public ConversionResult documentToText(WorkflowDocument document, boolean llmFormatting) {
        Objects.requireNonNull(document, "document must not be null");
        String text = writer.write(document);
        if (llmFormatting) {
            text = format(text, document);
        }
        return result(text, validator.validate(document), false);
    }

    private String format(String canonical, WorkflowDocument document) {
        GenerationRequest request =
                new GenerationRequest(
                        GenerationRequest.FORMAT,
                        PromptTemplates.format(canonical),
                        config.getFormatTemperature(),
                        config.getFormatMaxTokens());

        GenerationResponse response;
        try {
            response = generator.generate(request);
        } catch (RuntimeException e) {
            logger.warning("Formatting generation failed: " + e.getMessage());
            return canonical;
        }
        if (response instanceof GenerationResponse.Error error) {
            logger.warning("Formatting generation failed: " + error.message());
            return canonical;
        }

        Optional<String> formatted =
                DocumentTextExtractor.extract(((GenerationResponse.Text) response).content());
        if (formatted.isPresent()
                && parser.parse(formatted.get()).document().filter(document::equals).isPresent()) {
            return formatted.get();
        }
        logger.info("Formatted text does not match the document, keeping canonical text");
        return canonical;
    }

    /// Asks the generator for a short prose summary of a diff.
    ///
    /// The summary is advisory. Any generator failure yields {@link #FALLBACK_SUMMARY}.
    ///
    /// @param originalText text of the original document, not null
    /// @param modifiedText text of the modified document, not null
    /// @param diff structural diff of the two, not null
    /// @return summary text, never null or blank
    public String summarizeDiff(String originalText, String modifiedText, DiffResult diff) {
        GenerationRequest request =
                new GenerationRequest(
                        GenerationRequest.SUMMARY,
                        PromptTemplates.summary(originalText, modifiedText, diff),
                        config.getSummaryTemperature(),
                        config.getSummaryMaxTokens());

        GenerationResponse response;
        try {
            response = generator.generate(request);
        } catch (RuntimeException e) {
            logger.warning("Diff summary generation failed: " + e.getMessage());
            return FALLBACK_SUMMARY;
        }

        if (response instanceof GenerationResponse.Text text && !text.content().isBlank()) {
            return text.content().strip();
        }
        if (response instanceof GenerationResponse.Error error) {
            logger.warning("Diff summary generation failed: " + error.message());
        }
        return FALLBACK_SUMMARY;
    }

    /// Re-serializes document text in canonical formatting.
    ///
    /// @param text document text, not null
    /// @return canonical text, or `text` unchanged if it does not parse
    public String repair(String text) {
        ParseResult parsed = parser.parse(text);
        if (parsed instanceof ParseResult.Parsed p) {
            return writer.write(p.value());
        }
        logger.fine("Repair skipped, text does not parse");
        return text;
    }

    private String contentOf(GenerationResponse response) throws ConversionException {
        if (response instanceof GenerationResponse.Error error) {
            logger.severe("Text generation failed: " + error.message());
            throw new ConversionException(
                    "Text generation failed: " + error.message(), error.cause());
        }
        return ((GenerationResponse.Text) response).content();
    }

    private ConversionResult result(String text, ValidationResult validation, boolean repaired) {
        Optional<WorkflowDocument> document = parser.parse(text).document();
        if (document.isEmpty()) {
            return new ConversionResult(text, validation, repaired, 0, false, 0.0);
        }
        DocumentMetadata metadata = metadataExtractor.extract(document.get());
        return new ConversionResult(
                text,
                validation,
                repaired,
                metadata.totalBlocks(),
                metadata.hasTriggers(),
                metadata.complexityScore());
    }

    public static final class Builder {
        private TextGenerator generator;
        private DocumentParser parser;
        private DocumentWriter writer;
        private WorkflowValidator validator;
        private MetadataExtractor metadataExtractor;
        private FlowdocConfig config;

        private Builder() {}

        public Builder generator(TextGenerator generator) {
            this.generator = generator;
            return this;
        }

        public Builder parser(DocumentParser parser) {
            this.parser = parser;
            return this;
        }

        public Builder writer(DocumentWriter writer) {
            this.writer = writer;
            return this;
        }

        public Builder validator(WorkflowValidator validator) {
            this.validator = validator;
            return this;
        }

        public Builder metadataExtractor(MetadataExtractor metadataExtractor) {
            this.metadataExtractor = metadataExtractor;
            return this;
        }

        public Builder config(FlowdocConfig config) {
            this.config = config;
            return this;
        }

        public ConversionOrchestrator build() {
            return new ConversionOrchestrator(this);
        }
    }
}
