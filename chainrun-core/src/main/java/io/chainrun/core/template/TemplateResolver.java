package io.chainrun.core.template;

import java.util.Map;

/// Resolves `{{ }}` placeholders in strings. Pure utility, no dependencies.
public interface TemplateResolver {
    String resolve(String template, Map<String, Object> context);
}
