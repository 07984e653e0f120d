package io.flowdoc.core.diff;

import java.util.List;

/// Result of comparing two workflow documents.
///
/// @param changes semantic changes: field changes first, then added, removed and
///     modified blocks, never null
/// @param changeTypes distinct change tags in first-seen order, never null
/// @param complexityDelta `score(modified) - score(original)`
/// @param textDiff unified line diff of the canonical texts, empty when they are equal
/// @param summary advisory natural-language summary, empty until one is attached
public record DiffResult(
        List<Change> changes,
        List<String> changeTypes,
        double complexityDelta,
        String textDiff,
        String summary) {

    public DiffResult {
        changes = List.copyOf(changes);
        changeTypes = List.copyOf(changeTypes);
        textDiff = textDiff != null ? textDiff : "";
        summary = summary != null ? summary : "";
    }

    /// Returns whether the documents are structurally identical.
    public boolean isEmpty() {
        return changes.isEmpty();
    }

    /// Returns a copy carrying the given summary. Changes and delta are untouched.
    ///
    /// @param newSummary the summary text, may be null
    /// @return new result, never null
    public DiffResult withSummary(String newSummary) {
        return new DiffResult(changes, changeTypes, complexityDelta, textDiff, newSummary);
    }
}
