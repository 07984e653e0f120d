package io.flowdoc.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.flowdoc.core.conversion.ConversionResult;
import io.flowdoc.core.diff.Change;
import io.flowdoc.core.diff.DiffResult;
import io.flowdoc.core.diff.FieldDiff;
import io.flowdoc.core.document.Position;
import io.flowdoc.core.document.WorkflowDocument;
import io.flowdoc.core.layout.LayoutAlgorithm;
import io.flowdoc.core.layout.LayoutResult;
import io.flowdoc.core.validation.ValidationResult;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DocumentSerializerTest {

    private final ObjectMapper reader = new ObjectMapper();

    @Test
    void shouldWriteChangesWithTypeDiscriminator() throws Exception {
        DiffResult diff =
                new DiffResult(
                        List.of(
                                new Change.FieldChange("name", "A", "B"),
                                new Change.BlockAdded("a2", "action", null),
                                new Change.BlockModified(
                                        "t1",
                                        List.of(
                                                new FieldDiff(
                                                        "name", FieldDiff.Kind.MODIFIED, "x", "y")))),
                        List.of("field_change", "block_added", "block_modified"),
                        1.5,
                        "",
                        "Renamed");

        JsonNode json = reader.readTree(DocumentSerializer.toJson(diff));

        assertThat(json.has("empty")).isFalse();
        assertThat(json.get("complexityDelta").asDouble()).isEqualTo(1.5);
        assertThat(json.get("summary").asText()).isEqualTo("Renamed");
        JsonNode changes = json.get("changes");
        assertThat(changes.get(0).get("type").asText()).isEqualTo("field_change");
        assertThat(changes.get(0).get("oldValue").asText()).isEqualTo("A");
        assertThat(changes.get(1).get("type").asText()).isEqualTo("block_added");
        assertThat(changes.get(1).get("blockId").asText()).isEqualTo("a2");
        assertThat(changes.get(1).has("blockName")).isFalse();
        assertThat(changes.get(2).get("fieldDiffs").get(0).get("kind").asText())
                .isEqualTo("modified");
    }

    @Test
    void shouldWriteLayoutAlgorithmByWireName() throws Exception {
        LayoutResult result =
                new LayoutResult(
                        Map.of("b1", new Position(0, 0)),
                        "hierarchical",
                        LayoutAlgorithm.GRID,
                        1,
                        3L);

        JsonNode json = reader.readTree(DocumentSerializer.toJson(result));

        assertThat(json.get("algorithmUsed").asText()).isEqualTo("grid");
        assertThat(json.get("requestedAlgorithm").asText()).isEqualTo("hierarchical");
        assertThat(json.get("fellBack").asBoolean()).isTrue();
        assertThat(json.get("positions").get("b1").get("y").asDouble()).isZero();
    }

    @Test
    void shouldNestValidationInConversionResult() throws Exception {
        ValidationResult validation =
                ValidationResult.of(List.of(), List.of("workflow has no trigger blocks"), 1, 0, false);
        ConversionResult result = new ConversionResult("name: W", validation, true, 1, false, 2.2);

        JsonNode json = reader.readTree(DocumentSerializer.toJson(result));

        assertThat(json.has("valid")).isFalse();
        assertThat(json.get("repaired").asBoolean()).isTrue();
        assertThat(json.get("validation").get("valid").asBoolean()).isTrue();
        assertThat(json.get("validation").get("warnings").get(0).asText())
                .isEqualTo("workflow has no trigger blocks");
    }

    @Test
    void shouldConvertBetweenYamlAndDocument() {
        WorkflowDocument document = DocumentSerializer.fromYaml("name: W\nblocks: []\n");

        assertThat(document.getName()).isEqualTo("W");
        assertThat(document.getBlocks()).isEmpty();
        assertThat(DocumentSerializer.toYaml(document)).startsWith("name: W\nblocks:");
    }

    @Test
    void shouldRejectInvalidYamlInConvenienceApi() {
        assertThatThrownBy(() -> DocumentSerializer.fromYaml("- not a mapping"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Root element must be a mapping");
    }
}
