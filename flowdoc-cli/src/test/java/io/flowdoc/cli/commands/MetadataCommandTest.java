package io.flowdoc.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class MetadataCommandTest extends BaseCommandTest {

    @Test
    void shouldPrintStatistics() throws Exception {
        Path file = writeFile("order.yaml", ORDER_FLOW);

        execute(new MetadataCommand(), file.toString());

        assertThat(out())
                .contains(" Name: Order Flow")
                .contains(" Description: Notify ops about new orders")
                .contains(" Blocks: 2")
                .contains("   trigger: 1")
                .contains("   action: 1")
                .contains(" Triggers: yes")
                .contains(" Conditions: no")
                .contains(" Layout: no")
                .contains(" Complexity: 4.70");
    }

    @Test
    void shouldPrintJson() throws Exception {
        Path file = writeFile("order.yaml", ORDER_FLOW);

        execute(new MetadataCommand(), file.toString(), "--json");

        JsonNode json = new ObjectMapper().readTree(out());
        assertThat(json.get("name").asText()).isEqualTo("Order Flow");
        assertThat(json.get("blockTypeHistogram").get("trigger").asInt()).isEqualTo(1);
        assertThat(json.get("hasLoops").asBoolean()).isFalse();
    }

    @Test
    void shouldFailOnUnparseableDocument() throws Exception {
        Path file = writeFile("bad.yaml", "name: [unclosed\n");

        execute(new MetadataCommand(), file.toString());

        assertThat(err()).contains(" [FAIL] ").contains("YAML parsing error");
    }
}
