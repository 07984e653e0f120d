package io.flowdoc.cli.commands;

import io.flowdoc.core.document.WorkflowDocument;
import io.flowdoc.core.template.TemplateException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import picocli.CommandLine;

/// CLI command for instantiating a built-in template.
///
/// Placeholders without a matching `-p` parameter stay verbatim in the output.
///
/// ### Usage
/// ```bash
/// flowdoc template basic_automation -p workflow_name="Daily Report" [-o <out>]
/// ```
@CommandLine.Command(name = "template", description = "Instantiate a workflow template")
class TemplateCommand extends FlowdocCommand {

    @CommandLine.Parameters(index = "0", description = "Template id (see 'flowdoc templates')")
    private String templateId;

    @CommandLine.Option(
            names = {"-p", "--param"},
            description = "Placeholder value as key=value")
    private Map<String, String> parameters = new LinkedHashMap<>();

    @CommandLine.Option(
            names = {"-o", "--output"},
            description = "Write the document here instead of stdout")
    private Path output;

    @Override
    protected boolean showBanner() {
        return output != null;
    }

    @Override
    protected void execute() {
        try {
            WorkflowDocument document =
                    getEngine().getTemplateInstantiator().instantiate(templateId, parameters);
            emit(getEngine().getWriter().write(document), output);
        } catch (TemplateException e) {
            System.err.println(" [FAIL] " + e.getMessage());
        } catch (Exception e) {
            System.err.println(" [FAIL] Template instantiation failed: " + e.getMessage());
        }
    }
}
