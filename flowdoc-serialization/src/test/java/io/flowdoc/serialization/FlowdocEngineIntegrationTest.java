package io.flowdoc.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.flowdoc.core.FlowdocEngine;
import io.flowdoc.core.FlowdocFactory;
import io.flowdoc.core.analysis.DocumentMetadata;
import io.flowdoc.core.conversion.ConversionResult;
import io.flowdoc.core.diff.DiffResult;
import io.flowdoc.core.document.Block;
import io.flowdoc.core.document.WorkflowDocument;
import io.flowdoc.core.generation.stub.StubTextGenerator;
import io.flowdoc.core.layout.LayoutAlgorithm;
import io.flowdoc.core.layout.LayoutResult;
import io.flowdoc.core.template.TemplateException;
import io.flowdoc.core.validation.ValidationResult;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/// Runs the engine end to end over the YAML codec.
class FlowdocEngineIntegrationTest {

    private static final String SCENARIO =
            """
            name: Order Flow
            blocks:
              - id: t1
                type: trigger
                name: Order placed
              - id: a1
                type: action
                name: Send email
                config:
                  to: ops@example.com
            connections:
              - from: t1
                to: a1
            """;

    private FlowdocEngine engine;

    @BeforeEach
    void setUp() {
        engine =
                FlowdocFactory.builder()
                        .codec(new YamlDocumentCodec())
                        .textGenerator(new StubTextGenerator("stub"))
                        .build();
    }

    @Test
    void shouldValidateWellFormedDocument() {
        ValidationResult result = engine.getValidator().validate(SCENARIO);

        assertThat(result.valid()).isTrue();
        assertThat(result.errors()).isEmpty();
        assertThat(result.warnings()).isEmpty();
        assertThat(result.blockCount()).isEqualTo(2);
        assertThat(result.connectionCount()).isEqualTo(1);
        assertThat(result.hasTrigger()).isTrue();
    }

    @Test
    void shouldKeepValidatingPastNonMappingBlock() {
        ValidationResult result =
                engine.getValidator()
                        .validate("blocks:\n  - just-a-string\n  - id: a\n    type: action\n");

        assertThat(result.valid()).isFalse();
        assertThat(result.errors())
                .containsExactly("Missing required field: name", "Block 0 must be a mapping");
        assertThat(result.warnings())
                .containsExactly(
                        "Block 1 missing recommended field: name",
                        "workflow has no trigger blocks");
        assertThat(result.blockCount()).isEqualTo(2);
    }

    @Test
    void shouldReportNullConnectionsAsNotASequence() {
        ValidationResult result =
                engine.getValidator()
                        .validate(
                                "name: W\nblocks:\n  - {id: t1, type: trigger, name: T}\n"
                                        + "connections:\n");

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).containsExactly("Field 'connections' must be a sequence");
    }

    @Test
    void shouldExtractMetadataFromParsedText() {
        WorkflowDocument document = parse(SCENARIO);

        DocumentMetadata metadata = engine.getMetadataExtractor().extract(document);

        assertThat(metadata.name()).isEqualTo("Order Flow");
        assertThat(metadata.blockTypeHistogram())
                .containsEntry("trigger", 1)
                .containsEntry("action", 1);
        // 2 blocks + 1 connection * 0.5 + trigger 1.0 + action 1.2
        assertThat(metadata.complexityScore()).isCloseTo(4.7, within(1e-9));
    }

    @Test
    void shouldInstantiateEveryBundledTemplate() throws TemplateException {
        Map<String, String> parameters =
                Map.of(
                        "workflow_name", "Nightly",
                        "workflow_description", "Runs every night",
                        "trigger_name", "Cron",
                        "action_name", "Export",
                        "condition_name", "Has rows",
                        "condition_logic", "rows > 0",
                        "true_action", "Upload",
                        "false_action", "Skip");

        for (var template : engine.getTemplateRegistry().list()) {
            WorkflowDocument document =
                    engine.getTemplateInstantiator().instantiate(template.id(), parameters);
            ValidationResult validation = engine.getValidator().validate(document);

            assertThat(document.getName()).isEqualTo("Nightly");
            assertThat(validation.valid()).as(template.id()).isTrue();
            assertThat(validation.hasTrigger()).as(template.id()).isTrue();
        }
    }

    @Test
    void shouldKeepQuotesAndBackslashesInTemplateValues() throws TemplateException {
        Map<String, String> parameters =
                Map.of(
                        "workflow_name", "C:\\temp\\x",
                        "workflow_description", "say \"hi\"\nthen leave",
                        "trigger_name", "it's",
                        "condition_name", "Active?",
                        "condition_logic", "status == \"active\"",
                        "true_action", "a",
                        "false_action", "b");

        WorkflowDocument document =
                engine.getTemplateInstantiator().instantiate("conditional_workflow", parameters);

        assertThat(document.getName()).isEqualTo("C:\\temp\\x");
        assertThat(document.getDescription()).isEqualTo("say \"hi\"\nthen leave");
        assertThat(document.getBlocks().get(0).name()).isEqualTo("it's");
        assertThat(document.getBlocks().get(1).config())
                .isEqualTo(Map.of("condition", "status == \"active\""));
    }

    @Test
    void shouldRejectUnknownTemplate() {
        assertThatThrownBy(
                        () -> engine.getTemplateInstantiator().instantiate("missing", Map.of()))
                .isInstanceOf(TemplateException.class)
                .hasMessage("unknown template: missing");
    }

    @Test
    void shouldDescribeWorkflowWithStubGenerator() throws Exception {
        ConversionResult result =
                engine.getConversionOrchestrator().describeToDocument("email on new order", null);

        assertThat(result.isValid()).isTrue();
        assertThat(result.repaired()).isFalse();
        assertThat(result.hasTriggers()).isTrue();
        assertThat(result.generatedBlocks()).isEqualTo(2);
        assertThat(parse(result.text()).getName()).isEqualTo("Stub Workflow");
    }

    @Test
    void shouldPersistAppliedLayout() {
        WorkflowDocument document = parse(SCENARIO);
        assertThat(engine.getMetadataExtractor().hasLayout(document)).isFalse();

        LayoutResult layout =
                engine.getLayoutEngine().layout(document, LayoutAlgorithm.HIERARCHICAL);
        String text = engine.getWriter().write(engine.getLayoutEngine().apply(document, layout));
        WorkflowDocument reparsed = parse(text);

        assertThat(engine.getMetadataExtractor().hasLayout(reparsed)).isTrue();
        for (Block block : reparsed.getBlocks()) {
            assertThat(block.position()).isEqualTo(layout.positions().get(block.id()));
        }
    }

    @Test
    void shouldDiffRenamedBlock() {
        WorkflowDocument original = parse(SCENARIO);
        WorkflowDocument modified = parse(SCENARIO.replace("Send email", "Send SMS"));

        DiffResult diff = engine.getDiffer().diff(original, modified);

        assertThat(diff.changeTypes()).containsExactly("block_modified");
        assertThat(diff.complexityDelta()).isZero();
        assertThat(diff.textDiff())
                .contains("--- original")
                .contains("+++ modified")
                .containsPattern("(?m)^-.*name: Send email$")
                .containsPattern("(?m)^\\+.*name: Send SMS$");
    }

    @Test
    void shouldRenderCanonicalText() {
        ConversionResult result = engine.getConversionOrchestrator().documentToText(parse(SCENARIO));

        assertThat(result.isValid()).isTrue();
        assertThat(parse(result.text())).isEqualTo(parse(SCENARIO));
        assertThat(List.of(result.text().split("\n")).get(0)).isEqualTo("name: Order Flow");
    }

    private WorkflowDocument parse(String text) {
        return engine.getParser().parse(text).document().orElseThrow();
    }
}
