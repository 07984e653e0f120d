package io.flowdoc.core.generation;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/// Result of a blocking {@link TextGenerator} call.
///
/// Failures are data: providers never throw for remote errors, they return
/// {@link Error}.
public sealed interface GenerationResponse
        permits GenerationResponse.Text, GenerationResponse.Error {

    Instant timestamp();

    /// Generated text plus provider metadata (model, token usage).
    record Text(String content, Map<String, Object> metadata, Instant timestamp)
            implements GenerationResponse {

        public Text {
            Objects.requireNonNull(content, "content must not be null");
            metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
            timestamp = timestamp != null ? timestamp : Instant.now();
        }

        public static Text of(String content) {
            return new Text(content, Map.of(), Instant.now());
        }

        public static Text of(String content, Map<String, Object> metadata) {
            return new Text(content, metadata, Instant.now());
        }
    }

    record Error(String message, Throwable cause, Instant timestamp)
            implements GenerationResponse {

        public Error {
            Objects.requireNonNull(message, "message must not be null");
            timestamp = timestamp != null ? timestamp : Instant.now();
        }

        public static Error from(Throwable cause) {
            return new Error(
                    cause.getMessage() != null
                            ? cause.getMessage()
                            : cause.getClass().getSimpleName(),
                    cause,
                    Instant.now());
        }

        public static Error of(String message) {
            return new Error(message, null, Instant.now());
        }
    }
}
