package io.flowdoc.core.analysis;

import io.flowdoc.core.document.Block;
import io.flowdoc.core.document.BlockType;
import io.flowdoc.core.document.WorkflowDocument;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Derives {@link DocumentMetadata} from a workflow document.
///
/// @implNote Stateless and thread-safe.
public class MetadataExtractor {

    static final String UNNAMED = "Unnamed Workflow";
    static final String UNKNOWN_TYPE = "unknown";

    private final ComplexityScorer scorer;

    /// @param scorer scorer used for the `complexityScore` field, not null
    public MetadataExtractor(ComplexityScorer scorer) {
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
    }

    /// Extracts the summary fields of a document.
    ///
    /// @param document the document to summarize, not null
    /// @return metadata, never null
    public DocumentMetadata extract(WorkflowDocument document) {
        Objects.requireNonNull(document, "document must not be null");

        List<Block> blocks = document.blocksOrEmpty();
        Map<String, Integer> histogram = new LinkedHashMap<>();
        for (Block block : blocks) {
            String type = block.type() != null ? block.type() : UNKNOWN_TYPE;
            histogram.merge(type, 1, Integer::sum);
        }

        return new DocumentMetadata(
                document.getName() != null ? document.getName() : UNNAMED,
                document.getDescription() != null ? document.getDescription() : "",
                blocks.size(),
                document.connectionsOrEmpty().size(),
                histogram,
                histogram.containsKey(BlockType.TRIGGER.value()),
                histogram.containsKey(BlockType.CONDITION.value()),
                histogram.containsKey(BlockType.LOOP.value()),
                scorer.score(document));
    }

    /// Returns whether any block of the document carries a position.
    ///
    /// @param document the document to inspect, not null
    /// @return `true` if at least one block has been laid out
    public boolean hasLayout(WorkflowDocument document) {
        return document.blocksOrEmpty().stream().anyMatch(block -> block.position() != null);
    }
}
