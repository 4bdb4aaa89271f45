package io.chainrun.core.template;

import io.chainrun.core.chain.InputBinding;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Regex-based resolver for `{{ state.key }}` and `{{ key }}` placeholders.
///
/// Missing keys and null values are replaced with the empty string.
public class SimpleTemplateResolver implements TemplateResolver {

    private static final Pattern TEMPLATE_PATTERN = Pattern.compile("\\{\\{\\s*([^{}\\s]+)\\s*}}");

    @Override
    public String resolve(String template, Map<String, Object> context) {
        if (template == null) {
            return "";
        }

        Matcher matcher = TEMPLATE_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String variable = stripPrefix(matcher.group(1));
            Object value = context.get(variable);
            String replacement = value != null ? value.toString() : "";
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }

        matcher.appendTail(result);
        return result.toString();
    }

    private static String stripPrefix(String variable) {
        return variable.startsWith(InputBinding.STATE_PREFIX)
                ? variable.substring(InputBinding.STATE_PREFIX.length())
                : variable;
    }
}
