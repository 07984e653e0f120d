package io.flowdoc.core.template;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Resolves `{{identifier}}` placeholders in a single left-to-right pass.
///
/// Placeholders without a matching parameter are left verbatim. Substituted values
/// are never rescanned, so a value that itself contains `{{...}}` is inserted as is.
///
/// Templates are YAML, so a value is escaped for the scalar style its placeholder sits
/// in: inside `"..."` backslashes, quotes and control characters are escaped, inside
/// `'...'` single quotes are doubled, and elsewhere the value is inserted unchanged.
/// The quoting state is read from the template line up to the placeholder.
public class PlaceholderTemplateResolver implements TemplateResolver {

    static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{([A-Za-z_][A-Za-z0-9_.-]*)}}");

    @Override
    public String resolve(String template, Map<String, String> parameters) {
        if (template == null) {
            return "";
        }

        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String value = parameters.get(matcher.group(1));
            String replacement =
                    value != null
                            ? escape(value, quoteStyleAt(template, matcher.start()))
                            : matcher.group();
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }

        matcher.appendTail(result);
        return result.toString();
    }

    private enum QuoteStyle {
        PLAIN,
        DOUBLE,
        SINGLE
    }

    private static QuoteStyle quoteStyleAt(String template, int position) {
        int lineStart = template.lastIndexOf('\n', position - 1) + 1;
        QuoteStyle style = QuoteStyle.PLAIN;
        for (int i = lineStart; i < position; i++) {
            char c = template.charAt(i);
            switch (style) {
                case PLAIN -> {
                    boolean opens = i == lineStart || isIndicatorBoundary(template.charAt(i - 1));
                    if (c == '"' && opens) {
                        style = QuoteStyle.DOUBLE;
                    } else if (c == '\'' && opens) {
                        style = QuoteStyle.SINGLE;
                    }
                }
                case DOUBLE -> {
                    if (c == '\\') {
                        i++;
                    } else if (c == '"') {
                        style = QuoteStyle.PLAIN;
                    }
                }
                case SINGLE -> {
                    if (c == '\'' && i + 1 < position && template.charAt(i + 1) == '\'') {
                        i++;
                    } else if (c == '\'') {
                        style = QuoteStyle.PLAIN;
                    }
                }
            }
        }
        return style;
    }

    private static boolean isIndicatorBoundary(char previous) {
        return Character.isWhitespace(previous)
                || previous == '['
                || previous == '{'
                || previous == ',';
    }

    private static String escape(String value, QuoteStyle style) {
        return switch (style) {
            case PLAIN -> value;
            case SINGLE -> value.replace("'", "''");
            case DOUBLE -> escapeDoubleQuoted(value);
        };
    }

    private static String escapeDoubleQuoted(String value) {
        StringBuilder escaped = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> escaped.append("\\\\");
                case '"' -> escaped.append("\\\"");
                case '\n' -> escaped.append("\\n");
                case '\r' -> escaped.append("\\r");
                case '\t' -> escaped.append("\\t");
                default -> {
                    if (c < 0x20) {
                        escaped.append(String.format("\\x%02x", (int) c));
                    } else {
                        escaped.append(c);
                    }
                }
            }
        }
        return escaped.toString();
    }

    /// Lists the distinct placeholder names of a template in order of appearance.
    ///
    /// @param template template text, may be null
    /// @return placeholder names, never null
    public static Set<String> placeholders(String template) {
        Set<String> names = new LinkedHashSet<>();
        if (template != null) {
            Matcher matcher = PLACEHOLDER.matcher(template);
            while (matcher.find()) {
                names.add(matcher.group(1));
            }
        }
        return names;
    }
}
