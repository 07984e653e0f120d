package io.flowdoc.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.flowdoc.core.generation.GenerationRequest;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class DiffCommandTest extends BaseCommandTest {

    @Test
    void shouldReportNoChangesForEqualDocuments() throws Exception {
        Path original = writeFile("a.yaml", ORDER_FLOW);
        Path modified = writeFile("b.yaml", ORDER_FLOW);

        execute(new DiffCommand(), original.toString(), modified.toString());

        assertThat(out()).contains(" [OK] No structural changes");
    }

    @Test
    void shouldListChangesAndTextDiff() throws Exception {
        Path original = writeFile("a.yaml", ORDER_FLOW);
        Path modified =
                writeFile(
                        "b.yaml",
                        ORDER_FLOW
                                .replace("name: Order Flow", "name: Order Alerts")
                                .replace("Send email", "Send SMS"));

        execute(new DiffCommand(), original.toString(), modified.toString());

        assertThat(out())
                .contains(" Changes: 2")
                .contains("   ~ name: Order Flow -> Order Alerts")
                .contains("   ~ block a1")
                .contains("name modified")
                .contains(" Complexity delta: +0.00")
                .contains("--- original")
                .contains("+++ modified");
    }

    @Test
    void shouldAddGeneratedSummary() throws Exception {
        generator.registerResponse(GenerationRequest.SUMMARY, "Renamed the workflow");
        Path original = writeFile("a.yaml", ORDER_FLOW);
        Path modified = writeFile("b.yaml", ORDER_FLOW.replace("Order Flow", "Order Alerts"));

        execute(new DiffCommand(), original.toString(), modified.toString(), "--summary");

        assertThat(out()).contains(" Summary: Renamed the workflow");
    }

    @Test
    void shouldPrintJsonWithTypedChanges() throws Exception {
        Path original = writeFile("a.yaml", ORDER_FLOW);
        Path modified = writeFile("b.yaml", ORDER_FLOW.replace("Order Flow", "Order Alerts"));

        execute(new DiffCommand(), original.toString(), modified.toString(), "--json");

        JsonNode json = new ObjectMapper().readTree(out());
        assertThat(json.get("changes").get(0).get("type").asText()).isEqualTo("field_change");
        assertThat(json.get("changes").get(0).get("newValue").asText()).isEqualTo("Order Alerts");
    }

    @Test
    void shouldFailWhenModifiedFileIsMissing() throws Exception {
        Path original = writeFile("a.yaml", ORDER_FLOW);

        execute(new DiffCommand(), original.toString(), tempDir.resolve("nope.yaml").toString());

        assertThat(err()).contains(" [FAIL] Diff failed: File not found:");
    }
}
