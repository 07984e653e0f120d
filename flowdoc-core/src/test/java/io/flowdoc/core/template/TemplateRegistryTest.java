package io.flowdoc.core.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import java.util.List;
import org.junit.jupiter.api.Test;

class TemplateRegistryTest {

    private final TemplateRegistry registry = TemplateRegistry.defaults();

    @Test
    void shouldListBuiltInTemplates() {
        assertThat(registry.list())
                .extracting(WorkflowTemplate::id, WorkflowTemplate::name, WorkflowTemplate::category)
                .containsExactly(
                        tuple(
                                "basic_automation", "Basic Automation", "general"),
                        tuple(
                                "conditional_workflow", "Conditional Workflow", "general"));
    }

    @Test
    void shouldExposeCategories() {
        assertThat(registry.categories())
                .containsExactly("general", "automation", "integration", "data_processing");
    }

    @Test
    void shouldReportPlaceholdersOfTemplate() {
        assertThat(registry.placeholders("basic_automation"))
                .hasValueSatisfying(
                        names ->
                                assertThat(names)
                                        .containsExactly(
                                                "workflow_name",
                                                "workflow_description",
                                                "trigger_name",
                                                "action_name"));
        assertThat(registry.placeholders("conditional_workflow"))
                .hasValueSatisfying(names -> assertThat(names).contains("condition_logic"));
    }

    @Test
    void shouldReturnEmptyForUnknownTemplate() {
        assertThat(registry.find("nope")).isEmpty();
        assertThat(registry.placeholders("nope")).isEmpty();
    }

    @Test
    void shouldRejectDuplicateIds() {
        WorkflowTemplate template = new WorkflowTemplate("t", "T", "d", "general", "name: x");

        assertThatThrownBy(() -> new TemplateRegistry(List.of(template, template)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("t");
    }
}
