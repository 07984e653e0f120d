package io.flowdoc.cli.commands;

import io.flowdoc.core.validation.ValidationResult;
import io.flowdoc.serialization.DocumentSerializer;
import java.nio.file.Path;
import picocli.CommandLine;

/// CLI command for checking a workflow document against the validation rules.
///
/// Reports every error and warning at once. A document that does not parse yields
/// a single fatal error.
///
/// ### Usage
/// ```bash
/// flowdoc validate [--json] <file>
/// ```
///
/// @see FlowdocCommand
@CommandLine.Command(name = "validate", description = "Validate a workflow document")
class ValidateCommand extends FlowdocCommand {

    @CommandLine.Parameters(index = "0", description = "Workflow document (YAML)")
    private Path file;

    @CommandLine.Option(names = "--json", description = "Print the result as JSON")
    private boolean json;

    @Override
    protected boolean showBanner() {
        return !json;
    }

    @Override
    protected void execute() {
        try {
            ValidationResult result = getEngine().getValidator().validate(readText(file));

            if (json) {
                System.out.println(DocumentSerializer.toJson(result));
                return;
            }

            if (result.valid()) {
                System.out.println(" [OK] Document is valid!");
            } else {
                System.err.println(" [FAIL] Validation failed:");
                result.errors().forEach(error -> System.err.println("   - " + error));
            }
            result.warnings().forEach(warning -> System.out.println(" [WARN] " + warning));
            System.out.println("   Blocks: " + result.blockCount());
            System.out.println("   Connections: " + result.connectionCount());
            System.out.println("   Trigger: " + (result.hasTrigger() ? "yes" : "no"));
        } catch (Exception e) {
            System.err.println(" [FAIL] Validation failed: " + e.getMessage());
        }
    }
}
