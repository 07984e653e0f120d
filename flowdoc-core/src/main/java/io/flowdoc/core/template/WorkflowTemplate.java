package io.flowdoc.core.template;

import java.util.Objects;
import java.util.Set;

/// A parameterized document skeleton.
///
/// @param id registry key, not null
/// @param name human-readable title, not null
/// @param description one-line summary, not null
/// @param category catalogue category, not null
/// @param body document text containing `{{key}}` placeholders, not null
public record WorkflowTemplate(
        String id, String name, String description, String category, String body) {

    public WorkflowTemplate {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(description, "description must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(body, "body must not be null");
    }

    /// @return placeholder names of the body in order of appearance
    public Set<String> placeholders() {
        return PlaceholderTemplateResolver.placeholders(body);
    }
}
