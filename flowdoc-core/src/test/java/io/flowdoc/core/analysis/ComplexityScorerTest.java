package io.flowdoc.core.analysis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.flowdoc.core.TestDocuments;
import io.flowdoc.core.document.Block;
import io.flowdoc.core.document.BlockType;
import io.flowdoc.core.document.WorkflowDocument;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class ComplexityScorerTest {

    private final ComplexityScorer scorer = new ComplexityScorer();

    @Test
    void shouldScoreSingleLoopBlock() {
        WorkflowDocument document =
                WorkflowDocument.builder()
                        .name("Loop")
                        .blocks(List.of(Block.of("l1", "loop", "Repeat")))
                        .build();

        assertThat(scorer.score(document)).isCloseTo(3.0, within(1e-9));
    }

    @Test
    void shouldScoreTriggerActionDocument() {
        // 2 blocks + 1 connection * 0.5 + trigger 1.0 + action 1.2
        assertThat(scorer.score(TestDocuments.triggerAction())).isCloseTo(4.7, within(1e-9));
    }

    @Test
    void shouldScoreEmptyDocumentAsZero() {
        assertThat(scorer.score(WorkflowDocument.builder().name("Empty").build())).isZero();
    }

    @Test
    void shouldWeighMissingTypeAsAction() {
        Block untyped = Block.of("u1", null, "Untyped");

        assertThat(scorer.typeWeight(untyped)).isEqualTo(BlockType.ACTION.weight());
    }

    @Test
    void shouldWeighUnrecognizedTypeAsOne() {
        assertThat(scorer.typeWeight(Block.of("w1", "webhook", "Hook")))
                .isEqualTo(ComplexityScorer.UNRECOGNIZED_TYPE_WEIGHT);
    }

    @ParameterizedTest
    @EnumSource(BlockType.class)
    void shouldNeverDecreaseWhenBlockAdded(BlockType type) {
        WorkflowDocument before = TestDocuments.triggerAction();
        List<Block> blocks = new ArrayList<>(before.getBlocks());
        blocks.add(Block.builder().id("extra").type(type).name("Extra").build());
        WorkflowDocument after = before.withBlocks(blocks);

        assertThat(scorer.score(after)).isGreaterThan(scorer.score(before));
    }
}
