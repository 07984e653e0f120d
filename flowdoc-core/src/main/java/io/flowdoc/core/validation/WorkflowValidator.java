package io.flowdoc.core.validation;

import io.flowdoc.core.document.Block;
import io.flowdoc.core.document.Connection;
import io.flowdoc.core.document.DocumentParser;
import io.flowdoc.core.document.ParseResult;
import io.flowdoc.core.document.WorkflowDocument;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/// Checks the structural rules of workflow documents.
///
/// ### Rules
/// Applied in this order; every violation is collected.
/// 1. Text that does not decode to a document yields a single fatal error.
/// 2. `name` is required.
/// 3. `blocks` is required and must be a sequence.
/// 4. Each block must be a mapping and needs an `id` (unique across the document) and
///    a `type`; a missing `name` is a warning.
/// 5. A document whose blocks include no `trigger` gets a warning.
/// 6. `connections`, when present, must be a sequence whose entries are mappings with
///    `from` and `to`.
///
/// A required field counts as present when it is written, even with an explicit null.
/// Counts include malformed entries. Connection endpoints are not resolved against
/// block ids, and cycles are not reported.
///
/// @implNote Stateless and thread-safe.
public class WorkflowValidator {

    static final String NO_TRIGGER_WARNING = "workflow has no trigger blocks";

    private final DocumentParser parser;

    /// Creates a validator.
    ///
    /// @param parser parser used by {@link #validate(String)}, not null
    public WorkflowValidator(DocumentParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
    }

    /// Parses and validates document text.
    ///
    /// @param text document text, not null
    /// @return validation result; a parse failure yields a single fatal error, never null
    public ValidationResult validate(String text) {
        Objects.requireNonNull(text, "text must not be null");
        ParseResult result = parser.parse(text);
        if (result instanceof ParseResult.Failed failed) {
            return ValidationResult.fatal(failed.error().message());
        }
        return validate(((ParseResult.Parsed) result).value());
    }

    /// Validates a parsed document.
    ///
    /// @param document the document to check, not null
    /// @return validation result with all errors and warnings, never null
    public ValidationResult validate(WorkflowDocument document) {
        Objects.requireNonNull(document, "document must not be null");

        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        boolean hasTrigger = false;

        if (!document.declares("name")) {
            errors.add("Missing required field: name");
        }

        if (document.isMalformed("blocks")) {
            errors.add("Field 'blocks' must be a sequence");
        } else if (document.getBlocks() == null) {
            errors.add("Missing required field: blocks");
        } else {
            hasTrigger = checkBlocks(document.blockEntries(), errors, warnings);
            if (!hasTrigger) {
                warnings.add(NO_TRIGGER_WARNING);
            }
        }

        if (document.isMalformed("connections")) {
            errors.add("Field 'connections' must be a sequence");
        } else if (document.getConnections() != null) {
            checkConnections(document.connectionEntries(), errors);
        }

        return ValidationResult.of(
                errors,
                warnings,
                sizeOf(document.blockEntries()),
                sizeOf(document.connectionEntries()),
                hasTrigger);
    }

    private static int sizeOf(List<Object> entries) {
        return entries != null ? entries.size() : 0;
    }

    private boolean checkBlocks(List<Object> entries, List<String> errors, List<String> warnings) {
        Set<String> seenIds = new HashSet<>();
        boolean hasTrigger = false;

        for (int i = 0; i < entries.size(); i++) {
            if (!(entries.get(i) instanceof Block block)) {
                errors.add("Block " + i + " must be a mapping");
                continue;
            }

            if (!block.declares("id")) {
                errors.add("Block " + i + " missing required field: id");
            } else if (!seenIds.add(block.id())) {
                errors.add("Duplicate block ID: " + block.id());
            }

            if (!block.declares("type")) {
                errors.add("Block " + i + " missing required field: type");
            } else if (block.isTrigger()) {
                hasTrigger = true;
            }

            if (!block.declares("name")) {
                warnings.add("Block " + i + " missing recommended field: name");
            }
        }

        return hasTrigger;
    }

    private void checkConnections(List<Object> entries, List<String> errors) {
        for (int i = 0; i < entries.size(); i++) {
            if (!(entries.get(i) instanceof Connection connection)) {
                errors.add("Connection " + i + " must be a mapping");
                continue;
            }
            if (!connection.declares("from")) {
                errors.add("Connection " + i + " missing required field: from");
            }
            if (!connection.declares("to")) {
                errors.add("Connection " + i + " missing required field: to");
            }
        }
    }
}
