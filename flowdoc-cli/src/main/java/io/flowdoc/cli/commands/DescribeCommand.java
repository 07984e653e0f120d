package io.flowdoc.cli.commands;

import io.flowdoc.core.conversion.ConversionException;
import io.flowdoc.core.conversion.ConversionResult;
import io.flowdoc.serialization.DocumentSerializer;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import picocli.CommandLine;

/// CLI command for turning a natural-language description into a workflow document.
///
/// Requires a configured text generator: an API key for the model named by
/// `FLOWDOC_MODEL`, or `FLOWDOC_STUB_ENABLED=true` for offline canned output.
///
/// ### Usage
/// ```bash
/// flowdoc describe "Email me when a form is submitted" -c category=automation
/// ```
@CommandLine.Command(
        name = "describe",
        description = "Generate a workflow document from a description")
class DescribeCommand extends FlowdocCommand {

    @CommandLine.Parameters(index = "0", description = "What the workflow should do")
    private String description;

    @CommandLine.Option(
            names = {"-c", "--context"},
            description = "Generation context as key=value (workflow_type, category)")
    private Map<String, String> context = new LinkedHashMap<>();

    @CommandLine.Option(
            names = {"-o", "--output"},
            description = "Write the document here instead of stdout")
    private Path output;

    @CommandLine.Option(names = "--json", description = "Print the conversion result as JSON")
    private boolean json;

    @Override
    protected boolean showBanner() {
        return !json && output != null;
    }

    @Override
    protected void execute() {
        try {
            ConversionResult result =
                    getEngine().getConversionOrchestrator().describeToDocument(description, context);

            if (json) {
                System.out.println(DocumentSerializer.toJson(result));
                return;
            }

            if (result.repaired()) {
                System.err.println(" [WARN] Generated document was re-formatted");
            }
            if (!result.isValid()) {
                System.err.println(" [WARN] Generated document is not valid:");
                result.validation().errors().forEach(error -> System.err.println("   - " + error));
            }
            emit(result.text(), output);
        } catch (ConversionException e) {
            System.err.println(" [FAIL] " + e.getMessage());
        } catch (Exception e) {
            System.err.println(" [FAIL] Conversion failed: " + e.getMessage());
        }
    }
}
