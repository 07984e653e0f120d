package io.flowdoc.core;

import io.flowdoc.core.analysis.ComplexityScorer;
import io.flowdoc.core.analysis.MetadataExtractor;
import io.flowdoc.core.conversion.ConversionOrchestrator;
import io.flowdoc.core.diff.StructuralDiffer;
import io.flowdoc.core.document.DocumentParser;
import io.flowdoc.core.document.DocumentWriter;
import io.flowdoc.core.generation.TextGenerator;
import io.flowdoc.core.layout.LayoutEngine;
import io.flowdoc.core.template.PlaceholderTemplateResolver;
import io.flowdoc.core.template.TemplateInstantiator;
import io.flowdoc.core.template.TemplateRegistry;
import io.flowdoc.core.validation.WorkflowValidator;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Logger;

/// Container holding every component of the workflow document engine.
///
/// The engine owns the read-only {@link TemplateRegistry} and shares it, together
/// with the stateless components, across all callers.
///
/// ### Contracts
/// - **Invariant**: component references are immutable after construction
/// - The text generator is resolved on the first call to
///   {@link #getConversionOrchestrator()}, so offline operations never need
///   credentials
///
/// @implNote Safe for concurrent use. The lazy conversion orchestrator is created
/// at most once.
///
/// @apiNote Create instances via {@link FlowdocFactory#builder()} rather than
/// direct construction.
public final class FlowdocEngine {

    private static final Logger logger = Logger.getLogger(FlowdocEngine.class.getName());

    private final FlowdocConfig config;
    private final DocumentParser parser;
    private final DocumentWriter writer;
    private final WorkflowValidator validator;
    private final ComplexityScorer complexityScorer;
    private final MetadataExtractor metadataExtractor;
    private final StructuralDiffer differ;
    private final LayoutEngine layoutEngine;
    private final TemplateRegistry templateRegistry;
    private final TemplateInstantiator templateInstantiator;
    private final Supplier<TextGenerator> generatorSupplier;

    private volatile ConversionOrchestrator conversionOrchestrator;

    /// @param config engine configuration, not null
    /// @param parser document parser, not null
    /// @param writer document writer, not null
    /// @param templateRegistry read-only template catalogue, not null
    /// @param generatorSupplier resolves the text generator on first use, not null
    public FlowdocEngine(
            FlowdocConfig config,
            DocumentParser parser,
            DocumentWriter writer,
            TemplateRegistry templateRegistry,
            Supplier<TextGenerator> generatorSupplier) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
        this.templateRegistry =
                Objects.requireNonNull(templateRegistry, "templateRegistry must not be null");
        this.generatorSupplier =
                Objects.requireNonNull(generatorSupplier, "generatorSupplier must not be null");

        this.validator = new WorkflowValidator(parser);
        this.complexityScorer = new ComplexityScorer();
        this.metadataExtractor = new MetadataExtractor(complexityScorer);
        this.differ = new StructuralDiffer(complexityScorer, writer);
        this.layoutEngine = LayoutEngine.fromConfig(config);
        this.templateInstantiator =
                new TemplateInstantiator(
                        templateRegistry,
                        new PlaceholderTemplateResolver(),
                        parser);

        logger.info(
                "Flowdoc engine created with " + templateRegistry.list().size() + " templates");
    }

    public FlowdocConfig getConfig() {
        return config;
    }

    public DocumentParser getParser() {
        return parser;
    }

    public DocumentWriter getWriter() {
        return writer;
    }

    public WorkflowValidator getValidator() {
        return validator;
    }

    public ComplexityScorer getComplexityScorer() {
        return complexityScorer;
    }

    public MetadataExtractor getMetadataExtractor() {
        return metadataExtractor;
    }

    public StructuralDiffer getDiffer() {
        return differ;
    }

    public LayoutEngine getLayoutEngine() {
        return layoutEngine;
    }

    public TemplateRegistry getTemplateRegistry() {
        return templateRegistry;
    }

    public TemplateInstantiator getTemplateInstantiator() {
        return templateInstantiator;
    }

    /// Returns the conversion orchestrator, resolving the text generator on first use.
    ///
    /// @return the orchestrator, never null
    /// @throws IllegalStateException if no text generator is available for the model
    public ConversionOrchestrator getConversionOrchestrator() {
        ConversionOrchestrator result = conversionOrchestrator;
        if (result == null) {
            synchronized (this) {
                result = conversionOrchestrator;
                if (result == null) {
                    result =
                            ConversionOrchestrator.builder()
                                    .generator(generatorSupplier.get())
                                    .parser(parser)
                                    .writer(writer)
                                    .validator(validator)
                                    .metadataExtractor(metadataExtractor)
                                    .config(config)
                                    .build();
                    conversionOrchestrator = result;
                }
            }
        }
        return result;
    }
}
