package io.flowdoc.core.conversion;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Pulls workflow document text out of free-form generated text.
///
/// The first fenced code block (optionally tagged `yaml` or `yml`) wins. Without a
/// fence, every line from the first one starting with `name:` or `blocks:` to the
/// end of the text is taken.
final class DocumentTextExtractor {

    private static final Pattern FENCED_BLOCK =
            Pattern.compile("```(?:yaml|yml)?\\n(.*?)\\n```", Pattern.DOTALL);

    private DocumentTextExtractor() {}

    /// @param response generated text, not null
    /// @return candidate document text, or empty if nothing looks like a document
    static Optional<String> extract(String response) {
        String normalized = response.replace("\r\n", "\n");

        Matcher matcher = FENCED_BLOCK.matcher(normalized);
        if (matcher.find()) {
            return nonBlank(matcher.group(1).strip());
        }

        List<String> collected = new ArrayList<>();
        boolean inDocument = false;
        for (String line : normalized.split("\n", -1)) {
            String trimmed = line.strip();
            if (trimmed.startsWith("name:") || trimmed.startsWith("blocks:")) {
                inDocument = true;
            }
            if (inDocument) {
                collected.add(line);
            }
        }
        return nonBlank(String.join("\n", collected).strip());
    }

    private static Optional<String> nonBlank(String text) {
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }
}
