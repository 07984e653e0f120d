package io.flowdoc.cli.commands;

import io.flowdoc.core.diff.Change;
import io.flowdoc.core.diff.DiffResult;
import io.flowdoc.core.diff.FieldDiff;
import io.flowdoc.core.document.WorkflowDocument;
import io.flowdoc.serialization.DocumentSerializer;
import java.nio.file.Path;
import java.util.Locale;
import picocli.CommandLine;

/// CLI command for comparing two versions of a workflow document.
///
/// Prints the structural changes, the complexity delta and a unified text diff of
/// the canonical forms. With `--summary` the text generator is asked for a short
/// natural-language summary; a failed request prints the fallback summary.
///
/// ### Usage
/// ```bash
/// flowdoc diff [--summary] [--json] <original> <modified>
/// ```
@CommandLine.Command(name = "diff", description = "Compare two workflow documents")
class DiffCommand extends FlowdocCommand {

    @CommandLine.Parameters(index = "0", description = "Original document")
    private Path original;

    @CommandLine.Parameters(index = "1", description = "Modified document")
    private Path modified;

    @CommandLine.Option(names = "--summary", description = "Generate a change summary")
    private boolean summary;

    @CommandLine.Option(names = "--json", description = "Print the diff as JSON")
    private boolean json;

    @Override
    protected boolean showBanner() {
        return !json;
    }

    @Override
    protected void execute() {
        try {
            WorkflowDocument originalDoc = loadDocument(original);
            WorkflowDocument modifiedDoc = loadDocument(modified);

            DiffResult diff = getEngine().getDiffer().diff(originalDoc, modifiedDoc);
            if (summary && !diff.isEmpty()) {
                String text =
                        getEngine()
                                .getConversionOrchestrator()
                                .summarizeDiff(readText(original), readText(modified), diff);
                diff = diff.withSummary(text);
            }

            if (json) {
                System.out.println(DocumentSerializer.toJson(diff));
                return;
            }

            if (diff.isEmpty()) {
                System.out.println(" [OK] No structural changes");
                return;
            }

            System.out.println(" Changes: " + diff.changes().size());
            for (Change change : diff.changes()) {
                System.out.println("   " + describe(change));
            }
            System.out.println(
                    " Complexity delta: "
                            + String.format(Locale.ROOT, "%+.2f", diff.complexityDelta()));
            if (!diff.summary().isEmpty()) {
                System.out.println(" Summary: " + diff.summary());
            }
            if (!diff.textDiff().isEmpty()) {
                System.out.println();
                System.out.print(diff.textDiff());
            }
        } catch (Exception e) {
            System.err.println(" [FAIL] Diff failed: " + e.getMessage());
        }
    }

    private static String describe(Change change) {
        if (change instanceof Change.FieldChange fc) {
            return "~ " + fc.field() + ": " + fc.oldValue() + " -> " + fc.newValue();
        } else if (change instanceof Change.BlockAdded added) {
            return "+ block " + added.blockId() + " (" + added.blockType() + ")";
        } else if (change instanceof Change.BlockRemoved removed) {
            return "- block " + removed.blockId() + " (" + removed.blockType() + ")";
        } else if (change instanceof Change.BlockModified bm) {
            StringBuilder sb = new StringBuilder("~ block ").append(bm.blockId());
            for (FieldDiff fieldDiff : bm.fieldDiffs()) {
                sb.append("\n       ")
                        .append(fieldDiff.field())
                        .append(" ")
                        .append(fieldDiff.kind().value());
            }
            return sb.toString();
        }
        return change.type();
    }
}
