package io.flowdoc.core.diff;

import io.flowdoc.core.analysis.ComplexityScorer;
import io.flowdoc.core.document.Block;
import io.flowdoc.core.document.DocumentWriter;
import io.flowdoc.core.document.WorkflowDocument;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Computes the semantic change set between two versions of a workflow document.
///
/// ### Algorithm
/// 1. `name`, `description` and `version` are compared; each mismatch is a
///    {@link Change.FieldChange}. Versions are compared after defaulting, so an
///    undeclared version equals `"1.0.0"`.
/// 2. Blocks are indexed by id on both sides. Ids only in the modified document are
///    {@link Change.BlockAdded}, ids only in the original are {@link Change.BlockRemoved},
///    and ids in both whose fields differ are {@link Change.BlockModified} with a
///    field-by-field comparison (nested `config` compared as a whole value).
/// 3. `complexityDelta = score(modified) - score(original)`.
///
/// Blocks without an id cannot be matched and are ignored. When an id is duplicated
/// the last block carrying it wins. Connections are not compared.
///
/// The result also carries a unified line diff of both documents in canonical
/// formatting, so formatting-only differences never show up in it.
///
/// @implNote Stateless and thread-safe.
public class StructuralDiffer {

    private static final Logger logger = Logger.getLogger(StructuralDiffer.class.getName());

    private final ComplexityScorer scorer;
    private final DocumentWriter writer;

    /// @param scorer scorer used for the complexity delta, not null
    /// @param writer writer used to render the texts for the line diff, not null
    public StructuralDiffer(ComplexityScorer scorer, DocumentWriter writer) {
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
    }

    /// Compares two documents.
    ///
    /// @param original the earlier version, not null
    /// @param modified the later version, not null
    /// @return the change set; empty for identical documents, never null
    public DiffResult diff(WorkflowDocument original, WorkflowDocument modified) {
        Objects.requireNonNull(original, "original must not be null");
        Objects.requireNonNull(modified, "modified must not be null");

        List<Change> changes = new ArrayList<>();
        compareField(changes, "name", original.getName(), modified.getName());
        compareField(
                changes, "description", original.getDescription(), modified.getDescription());
        compareField(
                changes,
                "version",
                original.getEffectiveVersion(),
                modified.getEffectiveVersion());

        Map<String, Block> before = indexById(original);
        Map<String, Block> after = indexById(modified);

        after.forEach(
                (id, block) -> {
                    if (!before.containsKey(id)) {
                        changes.add(new Change.BlockAdded(id, block.type(), block.name()));
                    }
                });
        before.forEach(
                (id, block) -> {
                    if (!after.containsKey(id)) {
                        changes.add(new Change.BlockRemoved(id, block.type(), block.name()));
                    }
                });
        before.forEach(
                (id, block) -> {
                    Block other = after.get(id);
                    if (other != null && !block.equals(other)) {
                        List<FieldDiff> fieldDiffs =
                                compareFields(block.asFields(), other.asFields());
                        if (!fieldDiffs.isEmpty()) {
                            changes.add(new Change.BlockModified(id, fieldDiffs));
                        }
                    }
                });

        Set<String> changeTypes = new LinkedHashSet<>();
        changes.forEach(change -> changeTypes.add(change.type()));

        double delta = scorer.score(modified) - scorer.score(original);
        String textDiff =
                LineDiff.unified(
                        writer.write(original), writer.write(modified), "original", "modified");

        logger.fine("Diff produced " + changes.size() + " changes, complexity delta " + delta);
        return new DiffResult(changes, new ArrayList<>(changeTypes), delta, textDiff, "");
    }

    /// Compares two field maps key by key.
    ///
    /// Keys are visited in the original's order, then keys only the modified map has.
    ///
    /// @param before fields of the original block, not null
    /// @param after fields of the modified block, not null
    /// @return differences, empty when the maps are equal, never null
    List<FieldDiff> compareFields(Map<String, Object> before, Map<String, Object> after) {
        List<FieldDiff> diffs = new ArrayList<>();
        for (Map.Entry<String, Object> entry : before.entrySet()) {
            String key = entry.getKey();
            if (!after.containsKey(key)) {
                diffs.add(FieldDiff.removed(key, entry.getValue()));
            } else if (!Objects.equals(entry.getValue(), after.get(key))) {
                diffs.add(FieldDiff.modified(key, entry.getValue(), after.get(key)));
            }
        }
        for (Map.Entry<String, Object> entry : after.entrySet()) {
            if (!before.containsKey(entry.getKey())) {
                diffs.add(FieldDiff.added(entry.getKey(), entry.getValue()));
            }
        }
        return diffs;
    }

    private void compareField(List<Change> changes, String field, String before, String after) {
        if (!Objects.equals(before, after)) {
            changes.add(new Change.FieldChange(field, before, after));
        }
    }

    private Map<String, Block> indexById(WorkflowDocument document) {
        Map<String, Block> index = new LinkedHashMap<>();
        for (Block block : document.blocksOrEmpty()) {
            if (block.id() != null) {
                index.put(block.id(), block);
            }
        }
        return index;
    }
}
