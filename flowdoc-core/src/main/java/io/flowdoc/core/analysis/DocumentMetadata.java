package io.flowdoc.core.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Descriptive summary of a workflow document.
///
/// @param name workflow name, `"Unnamed Workflow"` when the document has none
/// @param description workflow description, empty when absent
/// @param totalBlocks number of blocks
/// @param totalConnections number of connections
/// @param blockTypeHistogram block count per type string in first-seen order; blocks
///     without a type are counted under `"unknown"`
/// @param hasTriggers whether any block is a `trigger`
/// @param hasConditions whether any block is a `condition`
/// @param hasLoops whether any block is a `loop`
/// @param complexityScore score computed by {@link ComplexityScorer}
public record DocumentMetadata(
        String name,
        String description,
        int totalBlocks,
        int totalConnections,
        Map<String, Integer> blockTypeHistogram,
        boolean hasTriggers,
        boolean hasConditions,
        boolean hasLoops,
        double complexityScore) {

    public DocumentMetadata {
        blockTypeHistogram = Collections.unmodifiableMap(new LinkedHashMap<>(blockTypeHistogram));
    }
}
