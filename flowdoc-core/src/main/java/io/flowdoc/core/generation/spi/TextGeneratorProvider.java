package io.flowdoc.core.generation.spi;

import io.flowdoc.core.generation.TextGenerator;
import java.util.Map;

/// Service provider interface for text-generation backends.
///
/// Implementations are discovered with {@link java.util.ServiceLoader}; register
/// them in `META-INF/services/io.flowdoc.core.generation.spi.TextGeneratorProvider`.
/// When several providers support a model, the one with the highest
/// {@link #getPriority()} wins.
public interface TextGeneratorProvider {

    String getName();

    /// @param modelName model identifier, e.g. `claude-sonnet-4-5` or `gpt-4o`
    /// @return whether this provider can create a generator for the model
    boolean supportsModel(String modelName);

    /// Creates a generator for a model.
    ///
    /// @param modelName model identifier, not null
    /// @param credentials API keys and flags by name, not null
    /// @return a ready generator, never null
    /// @throws IllegalStateException if a required credential is missing
    TextGenerator create(String modelName, Map<String, String> credentials);

    default int getPriority() {
        return 0;
    }
}
