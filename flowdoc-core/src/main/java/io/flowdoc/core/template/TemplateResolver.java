package io.flowdoc.core.template;

import java.util.Map;

/// Resolves placeholders in template text. Pure utility, no dependencies.
public interface TemplateResolver {
    String resolve(String template, Map<String, String> parameters);
}
