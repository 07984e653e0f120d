package io.flowdoc.core.analysis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import io.flowdoc.core.TestDocuments;
import io.flowdoc.core.document.Block;
import io.flowdoc.core.document.Position;
import io.flowdoc.core.document.WorkflowDocument;
import java.util.List;
import org.junit.jupiter.api.Test;

class MetadataExtractorTest {

    private final MetadataExtractor extractor = new MetadataExtractor(new ComplexityScorer());

    @Test
    void shouldSummarizeDocument() {
        DocumentMetadata metadata = extractor.extract(TestDocuments.cycle());

        assertThat(metadata.name()).isEqualTo("Cycle");
        assertThat(metadata.description()).isEmpty();
        assertThat(metadata.totalBlocks()).isEqualTo(3);
        assertThat(metadata.totalConnections()).isEqualTo(3);
        assertThat(metadata.blockTypeHistogram())
                .containsExactly(
                        entry("trigger", 1),
                        entry("action", 1),
                        entry("loop", 1));
        assertThat(metadata.hasTriggers()).isTrue();
        assertThat(metadata.hasConditions()).isFalse();
        assertThat(metadata.hasLoops()).isTrue();
        assertThat(metadata.complexityScore())
                .isEqualTo(new ComplexityScorer().score(TestDocuments.cycle()));
    }

    @Test
    void shouldDefaultNameAndCountUntypedBlocksAsUnknown() {
        WorkflowDocument document =
                WorkflowDocument.builder()
                        .blocks(
                                List.of(
                                        Block.of("x", null, "X"),
                                        Block.of("y", null, "Y"),
                                        Block.of("c", "condition", "C")))
                        .build();

        DocumentMetadata metadata = extractor.extract(document);

        assertThat(metadata.name()).isEqualTo(MetadataExtractor.UNNAMED);
        assertThat(metadata.blockTypeHistogram())
                .containsEntry(MetadataExtractor.UNKNOWN_TYPE, 2)
                .containsEntry("condition", 1);
        assertThat(metadata.hasConditions()).isTrue();
        assertThat(metadata.totalConnections()).isZero();
    }

    @Test
    void shouldDetectLayout() {
        WorkflowDocument document = TestDocuments.triggerAction();
        WorkflowDocument placed =
                document.withBlocks(
                        List.of(
                                document.getBlocks().get(0).withPosition(new Position(1, 2)),
                                document.getBlocks().get(1)));

        assertThat(extractor.hasLayout(document)).isFalse();
        assertThat(extractor.hasLayout(placed)).isTrue();
    }
}
