package io.flowdoc.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class ValidateCommandTest extends BaseCommandTest {

    @Test
    void shouldReportValidDocument() throws Exception {
        Path file = writeFile("order.yaml", ORDER_FLOW);

        execute(new ValidateCommand(), file.toString());

        assertThat(out())
                .contains("The Workflow Document Engine")
                .contains(" [OK] Document is valid!")
                .contains("   Blocks: 2")
                .contains("   Connections: 1")
                .contains("   Trigger: yes");
        assertThat(err()).doesNotContain("[FAIL]");
    }

    @Test
    void shouldListErrorsOfInvalidDocument() throws Exception {
        Path file =
                writeFile(
                        "broken.yaml",
                        """
                        blocks:
                          - id: a1
                            type: action
                          - id: a1
                            type: action
                        connections:
                          - from: a1
                        """);

        execute(new ValidateCommand(), file.toString());

        assertThat(err())
                .contains(" [FAIL] Validation failed:")
                .contains("   - Missing required field: name")
                .contains("   - Duplicate block ID: a1")
                .contains("   - Connection 0 missing required field: to");
        assertThat(out())
                .contains(" [WARN] workflow has no trigger blocks")
                .contains("   Trigger: no");
    }

    @Test
    void shouldReportParseErrorAsSingleFailure() throws Exception {
        Path file = writeFile("list.yaml", "- just\n- a list\n");

        execute(new ValidateCommand(), file.toString());

        assertThat(err()).contains("   - Root element must be a mapping");
        assertThat(out()).contains("   Blocks: 0");
    }

    @Test
    void shouldPrintJsonWithoutBanner() throws Exception {
        Path file = writeFile("order.yaml", ORDER_FLOW);

        execute(new ValidateCommand(), file.toString(), "--json");

        assertThat(out()).doesNotContain("The Workflow Document Engine");
        JsonNode json = new ObjectMapper().readTree(out());
        assertThat(json.get("valid").asBoolean()).isTrue();
        assertThat(json.get("blockCount").asInt()).isEqualTo(2);
    }

    @Test
    void shouldFailOnMissingFile() throws Exception {
        execute(new ValidateCommand(), tempDir.resolve("missing.yaml").toString());

        assertThat(err()).contains(" [FAIL] Validation failed: File not found:");
    }
}
