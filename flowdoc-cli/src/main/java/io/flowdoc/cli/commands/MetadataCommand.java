package io.flowdoc.cli.commands;

import io.flowdoc.core.analysis.DocumentMetadata;
import io.flowdoc.core.analysis.MetadataExtractor;
import io.flowdoc.core.document.WorkflowDocument;
import io.flowdoc.serialization.DocumentSerializer;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import picocli.CommandLine;

/// CLI command for printing the summary statistics of a workflow document.
///
/// ### Usage
/// ```bash
/// flowdoc metadata [--json] <file>
/// ```
@CommandLine.Command(name = "metadata", description = "Show document statistics")
class MetadataCommand extends FlowdocCommand {

    @CommandLine.Parameters(index = "0", description = "Workflow document (YAML)")
    private Path file;

    @CommandLine.Option(names = "--json", description = "Print the metadata as JSON")
    private boolean json;

    @Override
    protected boolean showBanner() {
        return !json;
    }

    @Override
    protected void execute() {
        try {
            WorkflowDocument document = loadDocument(file);
            MetadataExtractor extractor = getEngine().getMetadataExtractor();
            DocumentMetadata metadata = extractor.extract(document);

            if (json) {
                System.out.println(DocumentSerializer.toJson(metadata));
                return;
            }

            System.out.println(" Name: " + metadata.name());
            System.out.println(" Description: " + metadata.description());
            System.out.println(" Blocks: " + metadata.totalBlocks());
            System.out.println(" Connections: " + metadata.totalConnections());
            for (Map.Entry<String, Integer> entry : metadata.blockTypeHistogram().entrySet()) {
                System.out.println("   " + entry.getKey() + ": " + entry.getValue());
            }
            System.out.println(" Triggers: " + yesNo(metadata.hasTriggers()));
            System.out.println(" Conditions: " + yesNo(metadata.hasConditions()));
            System.out.println(" Loops: " + yesNo(metadata.hasLoops()));
            System.out.println(" Layout: " + yesNo(extractor.hasLayout(document)));
            System.out.println(
                    " Complexity: "
                            + String.format(Locale.ROOT, "%.2f", metadata.complexityScore()));
        } catch (Exception e) {
            System.err.println(" [FAIL] " + e.getMessage());
        }
    }

    private static String yesNo(boolean value) {
        return value ? "yes" : "no";
    }
}
