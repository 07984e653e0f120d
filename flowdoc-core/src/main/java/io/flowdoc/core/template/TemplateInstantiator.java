package io.flowdoc.core.template;

import io.flowdoc.core.document.DocumentParser;
import io.flowdoc.core.document.ParseResult;
import io.flowdoc.core.document.WorkflowDocument;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Produces workflow documents from registered templates.
///
/// Instantiation substitutes every `{{key}}` of the template body with
/// `parameters[key]`, then parses the filled text. Placeholders without a parameter
/// stay in the output verbatim.
///
/// @implNote Thread-safe as long as the resolver and parser are.
public class TemplateInstantiator {

    private static final Logger logger = Logger.getLogger(TemplateInstantiator.class.getName());

    private final TemplateRegistry registry;
    private final TemplateResolver resolver;
    private final DocumentParser parser;

    public TemplateInstantiator(
            TemplateRegistry registry, TemplateResolver resolver, DocumentParser parser) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
    }

    /// Fills a template and parses the result.
    ///
    /// @param templateId registered template id, not null
    /// @param parameters substitution values by placeholder name, not null
    /// @return the instantiated document, never null
    /// @throws TemplateException if the id is not registered or the filled text does not parse
    public WorkflowDocument instantiate(String templateId, Map<String, String> parameters)
            throws TemplateException {
        String text = fill(templateId, parameters);
        ParseResult result = parser.parse(text);
        if (result instanceof ParseResult.Failed failed) {
            throw new TemplateException(
                    "Template '"
                            + templateId
                            + "' produced an unparseable document: "
                            + failed.error().message());
        }
        logger.fine("Instantiated template " + templateId);
        return result.document().orElseThrow();
    }

    /// Fills a template without parsing it.
    ///
    /// @param templateId registered template id, not null
    /// @param parameters substitution values by placeholder name, not null
    /// @return the filled text, never null
    /// @throws TemplateException if the id is not registered
    public String fill(String templateId, Map<String, String> parameters)
            throws TemplateException {
        Objects.requireNonNull(parameters, "parameters must not be null");
        WorkflowTemplate template =
                registry.find(templateId)
                        .orElseThrow(() -> new TemplateException("unknown template: " + templateId));
        return resolver.resolve(template.body(), parameters);
    }
}
