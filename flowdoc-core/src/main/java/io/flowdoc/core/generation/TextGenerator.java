package io.flowdoc.core.generation;

import java.util.function.Consumer;

/// External capability turning a prompt into free-form text.
///
/// This is the only network-bound collaborator of the engine. Implementations live
/// outside the core (see the LangChain4j adapter) and are discovered through
/// {@link io.flowdoc.core.generation.spi.TextGeneratorProvider}.
///
/// ### Contracts
/// - {@link #generate} never throws for remote failures; it returns
///   {@link GenerationResponse.Error}
/// - {@link #stream} delivers events in order and ends with exactly one terminal event
///
/// @see GenerationEvent
public interface TextGenerator {

    /// @return the model this generator talks to, never null
    String getModel();

    /// Generates text for a prompt, blocking until the full response is available.
    ///
    /// @param request prompt and sampling parameters, not null
    /// @return generated text or an error, never null
    GenerationResponse generate(GenerationRequest request);

    /// Generates text for a prompt as an event stream.
    ///
    /// The default implementation runs {@link #generate} and replays the result as
    /// one {@link GenerationEvent.Content} (or {@link GenerationEvent.Failure})
    /// followed by {@link GenerationEvent.Done} on success.
    ///
    /// @param request prompt and sampling parameters, not null
    /// @param listener receives events on the calling thread or a provider thread, not null
    default void stream(GenerationRequest request, Consumer<GenerationEvent> listener) {
        GenerationResponse response = generate(request);
        if (response instanceof GenerationResponse.Text text) {
            listener.accept(new GenerationEvent.Content(text.content()));
            listener.accept(new GenerationEvent.Done());
        } else if (response instanceof GenerationResponse.Error error) {
            listener.accept(new GenerationEvent.Failure(error.message()));
        }
    }
}
