package io.flowdoc.core.conversion;

import io.flowdoc.core.diff.Change;
import io.flowdoc.core.diff.DiffResult;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;

/// Prompts sent to the text-generation collaborator.
final class PromptTemplates {

    private static final String DESCRIBE =
            """
            You are an expert workflow designer. Convert the following natural language \
            description into a valid workflow YAML document.

            Description: %s
            Workflow Type: %s

            Requirements:
            1. Produce a single valid YAML document
            2. Include blocks and the connections between them
            3. Use the block types trigger, action, condition, loop and parallel
            4. Start the workflow with at least one trigger block
            5. Give every block a unique id and a meaningful name

            Follow this structure:
            ```yaml
            name: "Workflow Name"
            description: "Brief description"
            version: "1.0.0"
            blocks:
              - id: "block_1"
                type: "trigger"
                name: "Block Name"
                config: {}
            connections:
              - from: "block_1"
                to: "block_2"
                condition: "success"
            metadata:
              created_at: "%s"
              category: "%s"
            ```

            Generate only the YAML content, no additional text or explanations.
            """;

    private static final String SUMMARY =
            """
            You are an expert at analyzing workflow differences. Summarize the changes \
            between two versions of a workflow in two or three sentences.

            Original YAML:
            %s

            Modified YAML:
            %s

            Detected changes:
            %s
            Complexity delta: %.2f

            Focus on structural and functional differences and ignore formatting.
            Reply with the summary text only.
            """;

    private static final String FORMAT =
            """
            You are an expert workflow designer. Tidy the formatting of the following \
            workflow YAML document so it is easy to read.

            ```yaml
            %s```

            Keep every field, value, block and connection exactly as it is. Do not add, \
            remove, rename or reorder anything.
            Generate only the YAML content, no additional text or explanations.
            """;

    private PromptTemplates() {}

    static String describe(String description, Map<String, ?> context) {
        return String.format(
                Locale.ROOT,
                DESCRIBE,
                description,
                contextValue(context, "workflow_type", "general"),
                Instant.now(),
                contextValue(context, "category", "general"));
    }

    static String format(String documentText) {
        return String.format(Locale.ROOT, FORMAT, documentText);
    }

    static String summary(String originalText, String modifiedText, DiffResult diff) {
        StringBuilder changes = new StringBuilder();
        for (Change change : diff.changes()) {
            changes.append("- ").append(describeChange(change)).append('\n');
        }
        if (changes.length() == 0) {
            changes.append("- none\n");
        }
        return String.format(
                Locale.ROOT,
                SUMMARY, originalText, modifiedText, changes, diff.complexityDelta());
    }

    private static String describeChange(Change change) {
        if (change instanceof Change.FieldChange c) {
            return c.field() + " changed from '" + c.oldValue() + "' to '" + c.newValue() + "'";
        } else if (change instanceof Change.BlockAdded c) {
            return "block " + c.blockId() + " (" + c.blockType() + ") added";
        } else if (change instanceof Change.BlockRemoved c) {
            return "block " + c.blockId() + " (" + c.blockType() + ") removed";
        } else if (change instanceof Change.BlockModified c) {
            return "block " + c.blockId() + " modified: " + c.fieldDiffs().size() + " fields";
        }
        return change.type();
    }

    private static String contextValue(Map<String, ?> context, String key, String fallback) {
        Object value = context != null ? context.get(key) : null;
        return value != null ? value.toString() : fallback;
    }
}
