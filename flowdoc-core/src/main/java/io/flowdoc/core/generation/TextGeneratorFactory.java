package io.flowdoc.core.generation;

import io.flowdoc.core.generation.spi.TextGeneratorProvider;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.logging.Logger;

/// Creates {@link TextGenerator}s by picking the best provider for a model.
///
/// @implNote Providers are resolved once at construction. Thread-safe afterwards.
public class TextGeneratorFactory {

    private static final Logger logger = Logger.getLogger(TextGeneratorFactory.class.getName());

    private final List<TextGeneratorProvider> providers;
    private final Map<String, String> credentials;

    /// Creates a factory over the providers found by {@link ServiceLoader}.
    ///
    /// @param credentials API keys and flags by name, not null
    public TextGeneratorFactory(Map<String, String> credentials) {
        this(loadProviders(), credentials);
    }

    /// Creates a factory over an explicit provider list.
    ///
    /// @param providers candidate providers, not null
    /// @param credentials API keys and flags by name, not null
    public TextGeneratorFactory(
            List<TextGeneratorProvider> providers, Map<String, String> credentials) {
        this.providers =
                List.copyOf(Objects.requireNonNull(providers, "providers must not be null"));
        this.credentials =
                new HashMap<>(Objects.requireNonNull(credentials, "credentials must not be null"));

        logger.info(
                "Loaded "
                        + this.providers.size()
                        + " text generator providers: "
                        + this.providers.stream().map(TextGeneratorProvider::getName).toList());
    }

    /// Creates a generator for a model.
    ///
    /// @param modelName model identifier, not null
    /// @return a generator from the highest-priority supporting provider, never null
    /// @throws IllegalStateException if no provider supports the model
    public TextGenerator create(String modelName) {
        TextGeneratorProvider provider =
                providers.stream()
                        .filter(p -> p.supportsModel(modelName))
                        .max(Comparator.comparingInt(TextGeneratorProvider::getPriority))
                        .orElseThrow(
                                () ->
                                        new IllegalStateException(
                                                "No provider found for model: "
                                                        + modelName
                                                        + ". Available providers: "
                                                        + providers.stream()
                                                                .map(TextGeneratorProvider::getName)
                                                                .toList()));

        logger.info(
                "Creating text generator for '"
                        + modelName
                        + "' with provider: "
                        + provider.getName());
        return provider.create(modelName, credentials);
    }

    public List<TextGeneratorProvider> getProviders() {
        return Collections.unmodifiableList(providers);
    }

    public boolean isModelSupported(String modelName) {
        return providers.stream().anyMatch(p -> p.supportsModel(modelName));
    }

    private static List<TextGeneratorProvider> loadProviders() {
        List<TextGeneratorProvider> discovered = new ArrayList<>();
        for (TextGeneratorProvider provider : ServiceLoader.load(TextGeneratorProvider.class)) {
            discovered.add(provider);
            logger.fine("Discovered provider: " + provider.getName());
        }
        return discovered;
    }
}
