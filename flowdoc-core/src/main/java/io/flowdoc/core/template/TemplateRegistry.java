package io.flowdoc.core.template;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Read-only catalogue of workflow templates.
///
/// Built once at startup and shared by every caller; it has no mutators, so
/// concurrent lookups need no synchronization.
///
/// ### Built-in templates
/// | id | contents |
/// |---|---|
/// | `basic_automation` | trigger connected to one action |
/// | `conditional_workflow` | trigger, condition, and one action per branch |
///
/// @see TemplateInstantiator
public final class TemplateRegistry {

    /// Categories a template may be filed under.
    public static final List<String> CATEGORIES =
            List.of("general", "automation", "integration", "data_processing");

    private static final String RESOURCE_DIR = "/templates/";

    private final Map<String, WorkflowTemplate> templates;

    /// Creates a registry over the given templates.
    ///
    /// @param templates templates in catalogue order, ids must be unique
    /// @throws IllegalArgumentException if two templates share an id
    public TemplateRegistry(Collection<WorkflowTemplate> templates) {
        Map<String, WorkflowTemplate> byId = new LinkedHashMap<>();
        for (WorkflowTemplate template : templates) {
            if (byId.putIfAbsent(template.id(), template) != null) {
                throw new IllegalArgumentException("Duplicate template id: " + template.id());
            }
        }
        this.templates = byId;
    }

    /// Creates the registry of built-in templates bundled on the classpath.
    ///
    /// @return the default registry, never null
    /// @throws UncheckedIOException if a bundled template cannot be read
    public static TemplateRegistry defaults() {
        return new TemplateRegistry(
                List.of(
                        bundled(
                                "basic_automation",
                                "Basic Automation",
                                "Simple trigger-action workflow"),
                        bundled(
                                "conditional_workflow",
                                "Conditional Workflow",
                                "Workflow with conditional logic")));
    }

    public Optional<WorkflowTemplate> find(String id) {
        return Optional.ofNullable(templates.get(id));
    }

    /// @return all templates in catalogue order, unmodifiable
    public List<WorkflowTemplate> list() {
        return List.copyOf(templates.values());
    }

    public List<String> categories() {
        return CATEGORIES;
    }

    /// Returns the placeholder names of a template.
    ///
    /// @param id template id, not null
    /// @return placeholder names, or empty if the template is not registered
    public Optional<Set<String>> placeholders(String id) {
        return find(id).map(WorkflowTemplate::placeholders);
    }

    private static WorkflowTemplate bundled(String id, String name, String description) {
        String path = RESOURCE_DIR + id + ".yaml";
        try (InputStream in = TemplateRegistry.class.getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("Missing bundled template: " + path);
            }
            String body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            return new WorkflowTemplate(id, name, description, "general", body);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read bundled template: " + path, e);
        }
    }
}
