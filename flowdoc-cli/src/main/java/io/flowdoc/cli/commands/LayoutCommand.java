package io.flowdoc.cli.commands;

import io.flowdoc.core.document.WorkflowDocument;
import io.flowdoc.core.layout.LayoutEngine;
import io.flowdoc.core.layout.LayoutResult;
import java.nio.file.Path;
import picocli.CommandLine;

/// CLI command for computing block positions and writing them into the document.
///
/// The laid-out document is printed to stdout, or written to `-o`. Unknown algorithm
/// names and hierarchical layout of a cyclic graph fall back to grid placement with a
/// warning.
///
/// ### Usage
/// ```bash
/// flowdoc layout [-a hierarchical|force_directed|grid] [-o <out>] <file>
/// ```
@CommandLine.Command(name = "layout", description = "Compute block positions")
class LayoutCommand extends FlowdocCommand {

    @CommandLine.Parameters(index = "0", description = "Workflow document (YAML)")
    private Path file;

    @CommandLine.Option(
            names = {"-a", "--algorithm"},
            description = "hierarchical, force_directed or grid (default: from config)")
    private String algorithm;

    @CommandLine.Option(
            names = {"-o", "--output"},
            description = "Write the laid-out document here instead of stdout")
    private Path output;

    @Override
    protected boolean showBanner() {
        return output != null;
    }

    @Override
    protected void execute() {
        try {
            WorkflowDocument document = loadDocument(file);
            LayoutEngine layoutEngine = getEngine().getLayoutEngine();
            String requested =
                    algorithm != null
                            ? algorithm
                            : getEngine().getConfig().getDefaultLayoutAlgorithm();

            LayoutResult result = layoutEngine.layout(document, requested);
            if (result.fellBack()) {
                System.err.println(
                        " [WARN] Layout '"
                                + requested
                                + "' not applicable, used "
                                + result.algorithmUsed().value());
            }

            WorkflowDocument laidOut = layoutEngine.apply(document, result);
            emit(getEngine().getWriter().write(laidOut), output);
        } catch (Exception e) {
            System.err.println(" [FAIL] Layout failed: " + e.getMessage());
        }
    }
}
