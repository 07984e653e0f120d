package io.flowdoc.core.analysis;

import io.flowdoc.core.document.Block;
import io.flowdoc.core.document.BlockType;
import io.flowdoc.core.document.WorkflowDocument;
import java.util.Objects;

/// Computes the complexity score of a workflow document.
///
/// `score = blocks * 1.0 + connections * 0.5 + sum(typeWeight(block))`
///
/// Recognized types use their {@link BlockType#weight()}. A block without a type is
/// weighted as an `action`; a type the engine does not recognize weighs 1.0. Every
/// block contributes at least 2.0, so the score never decreases when blocks are added.
///
/// @implNote Stateless and thread-safe.
public class ComplexityScorer {

    static final double BLOCK_WEIGHT = 1.0;
    static final double CONNECTION_WEIGHT = 0.5;
    static final double UNRECOGNIZED_TYPE_WEIGHT = 1.0;

    /// Scores a document.
    ///
    /// @param document the document to score, not null
    /// @return non-negative score; 0.0 for a document without blocks or connections
    public double score(WorkflowDocument document) {
        Objects.requireNonNull(document, "document must not be null");

        double score = document.blocksOrEmpty().size() * BLOCK_WEIGHT;
        score += document.connectionsOrEmpty().size() * CONNECTION_WEIGHT;
        for (Block block : document.blocksOrEmpty()) {
            score += typeWeight(block);
        }
        return score;
    }

    /// Returns the weight a single block adds on top of the per-block weight.
    ///
    /// @param block the block, not null
    /// @return the type weight
    public double typeWeight(Block block) {
        if (block.type() == null) {
            return BlockType.ACTION.weight();
        }
        return block.blockType().map(BlockType::weight).orElse(UNRECOGNIZED_TYPE_WEIGHT);
    }
}
