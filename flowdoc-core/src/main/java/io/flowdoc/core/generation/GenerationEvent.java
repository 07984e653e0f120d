package io.flowdoc.core.generation;

import java.util.Objects;

/// One element of a streamed generation.
///
/// A stream is zero or more {@link Content} and {@link ToolCall} events followed by
/// exactly one terminal event, either {@link Failure} or {@link Done}.
public sealed interface GenerationEvent
        permits GenerationEvent.Content,
                GenerationEvent.ToolCall,
                GenerationEvent.Failure,
                GenerationEvent.Done {

    default boolean isTerminal() {
        return this instanceof Failure || this instanceof Done;
    }

    /// A chunk of generated text.
    record Content(String text) implements GenerationEvent {
        public Content {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    /// A tool invocation requested by the model. Arguments are the raw JSON string.
    record ToolCall(String name, String arguments) implements GenerationEvent {
        public ToolCall {
            Objects.requireNonNull(name, "name must not be null");
            arguments = arguments != null ? arguments : "{}";
        }
    }

    record Failure(String message) implements GenerationEvent {
        public Failure {
            Objects.requireNonNull(message, "message must not be null");
        }
    }

    record Done() implements GenerationEvent {}
}
