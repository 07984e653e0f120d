package io.flowdoc.core.generation;

import java.util.Objects;

/// One prompt sent to a {@link TextGenerator}.
///
/// @param purpose short tag naming what the text is for (`describe`, `summary`,
///     `format`), not null
/// @param prompt full prompt text, not null
/// @param temperature sampling temperature in `[0, 1]`
/// @param maxTokens upper bound on output tokens, positive
public record GenerationRequest(String purpose, String prompt, double temperature, int maxTokens) {

    public static final String DESCRIBE = "describe";
    public static final String SUMMARY = "summary";
    public static final String FORMAT = "format";

    public GenerationRequest {
        Objects.requireNonNull(purpose, "purpose must not be null");
        Objects.requireNonNull(prompt, "prompt must not be null");
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive");
        }
    }
}
