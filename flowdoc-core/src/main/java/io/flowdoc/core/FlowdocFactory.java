package io.flowdoc.core;

import io.flowdoc.core.document.DocumentParser;
import io.flowdoc.core.document.DocumentWriter;
import io.flowdoc.core.generation.TextGenerator;
import io.flowdoc.core.generation.TextGeneratorFactory;
import io.flowdoc.core.generation.spi.TextGeneratorProvider;
import io.flowdoc.core.generation.stub.StubTextGeneratorProvider;
import io.flowdoc.core.template.TemplateRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.ServiceLoader;
import java.util.function.Supplier;

/// Factory for creating and wiring {@link FlowdocEngine} instances.
///
/// The core has no YAML support of its own, so a parser and writer must always be
/// supplied (the serialization module provides both in one codec).
///
/// {@snippet :
/// var engine = FlowdocFactory.builder()
///     .codec(new YamlDocumentCodec())
///     .credentials(FlowdocFactory.loadCredentialsFromEnvironment())
///     .discoverProviders()
///     .build();
/// }
///
/// @see FlowdocEngine
/// @see FlowdocConfig
public final class FlowdocFactory {

    /// Credential key naming the model used for text generation.
    public static final String MODEL_KEY = "FLOWDOC_MODEL";

    /// Model used when no model is configured.
    public static final String DEFAULT_MODEL = "claude-sonnet-4-5";

    static final String STUB_ENABLED_PROPERTY = "flowdoc.stub.enabled";
    static final String STUB_ENABLED_KEY = "FLOWDOC_STUB_ENABLED";

    private FlowdocFactory() {}

    /// Discovers credentials and engine settings from environment variables.
    ///
    /// Picks up every variable ending in `_API_KEY`, `_KEY`, `_SECRET` or `_TOKEN`,
    /// plus `FLOWDOC_MODEL` and `FLOWDOC_STUB_ENABLED`.
    ///
    /// @return map of discovered credentials, never null (may be empty)
    public static Map<String, String> loadCredentialsFromEnvironment() {
        return filterCredentials(System.getenv());
    }

    /// Loads credentials from a Properties object.
    ///
    /// Supports:
    /// - Prefixed keys (`flowdoc.credentials.ANTHROPIC_API_KEY=sk-...`), prefix stripped
    /// - Direct API key names (`ANTHROPIC_API_KEY=sk-...`)
    /// - `flowdoc.stub.enabled` and `flowdoc.model`
    ///
    /// @param properties properties to extract credentials from, not null
    /// @return map of credential keys to values, never null (may be empty)
    public static Map<String, String> loadCredentialsFromProperties(Properties properties) {
        Map<String, String> credentials = new HashMap<>();
        String prefix = "flowdoc.credentials.";

        properties.forEach(
                (key, value) -> {
                    String keyStr = key.toString();
                    String valueStr = value.toString();
                    if (valueStr.isEmpty()) {
                        return;
                    }
                    if (keyStr.startsWith(prefix)) {
                        credentials.put(keyStr.substring(prefix.length()), valueStr);
                    } else if (keyStr.equals(STUB_ENABLED_PROPERTY)) {
                        credentials.put(STUB_ENABLED_PROPERTY, valueStr);
                    } else if (keyStr.equals("flowdoc.model")) {
                        credentials.put(MODEL_KEY, valueStr);
                    } else if (isApiKeyPattern(keyStr)) {
                        credentials.put(keyStr, valueStr);
                    }
                });

        return credentials;
    }

    static Map<String, String> filterCredentials(Map<String, String> variables) {
        Map<String, String> credentials = new HashMap<>();
        variables.forEach(
                (key, value) -> {
                    if (value == null || value.isEmpty()) {
                        return;
                    }
                    if (isApiKeyPattern(key) || key.equals(MODEL_KEY)) {
                        credentials.put(key, value);
                    } else if (key.equals(STUB_ENABLED_KEY)) {
                        credentials.put(STUB_ENABLED_PROPERTY, value);
                    }
                });
        return credentials;
    }

    private static boolean isApiKeyPattern(String key) {
        String upperKey = key.toUpperCase();
        return upperKey.endsWith("_API_KEY")
                || upperKey.endsWith("_KEY")
                || upperKey.endsWith("_SECRET")
                || upperKey.endsWith("_TOKEN");
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link FlowdocEngine}.
    public static class Builder {
        private FlowdocConfig config = new FlowdocConfig();
        private final Map<String, String> credentials = new HashMap<>();
        private final List<TextGeneratorProvider> providers = new ArrayList<>();
        private DocumentParser parser;
        private DocumentWriter writer;
        private TemplateRegistry templateRegistry;
        private TextGenerator textGenerator;
        private String model;

        public Builder config(FlowdocConfig config) {
            this.config = config;
            return this;
        }

        /// Sets parser and writer from one codec object.
        ///
        /// @param codec object implementing both document interfaces, not null
        /// @return this builder for chaining, never null
        public <C extends DocumentParser & DocumentWriter> Builder codec(C codec) {
            this.parser = codec;
            this.writer = codec;
            return this;
        }

        public Builder parser(DocumentParser parser) {
            this.parser = parser;
            return this;
        }

        public Builder writer(DocumentWriter writer) {
            this.writer = writer;
            return this;
        }

        public Builder credential(String key, String value) {
            this.credentials.put(key, value);
            return this;
        }

        public Builder credentials(Map<String, String> credentials) {
            this.credentials.putAll(credentials);
            return this;
        }

        /// Adds a text generator provider. The stub provider is always included.
        ///
        /// @param provider provider to add, not null
        /// @return this builder for chaining, never null
        public Builder textGeneratorProvider(TextGeneratorProvider provider) {
            this.providers.add(provider);
            return this;
        }

        /// Adds every provider registered with {@link ServiceLoader}.
        ///
        /// @return this builder for chaining, never null
        public Builder discoverProviders() {
            for (TextGeneratorProvider provider : ServiceLoader.load(TextGeneratorProvider.class)) {
                if (!(provider instanceof StubTextGeneratorProvider)) {
                    providers.add(provider);
                }
            }
            return this;
        }

        /// Uses a ready-made generator instead of resolving one through providers.
        ///
        /// @param textGenerator generator to use, not null
        /// @return this builder for chaining, never null
        public Builder textGenerator(TextGenerator textGenerator) {
            this.textGenerator = textGenerator;
            return this;
        }

        /// Sets the model used for text generation, overriding `FLOWDOC_MODEL`.
        ///
        /// @param model model identifier, not null
        /// @return this builder for chaining, never null
        public Builder model(String model) {
            this.model = model;
            return this;
        }

        /// Enables or disables offline stub generation.
        ///
        /// @param enabled `true` to answer every prompt with canned text
        /// @return this builder for chaining, never null
        public Builder stubMode(boolean enabled) {
            this.credentials.put(STUB_ENABLED_PROPERTY, String.valueOf(enabled));
            return this;
        }

        public Builder templateRegistry(TemplateRegistry templateRegistry) {
            this.templateRegistry = templateRegistry;
            return this;
        }

        /// Builds the engine.
        ///
        /// @apiNote **Side effects**: sets the `flowdoc.stub.enabled` system property
        /// when stub mode is enabled in the credentials.
        ///
        /// @return a fully wired engine, never null
        /// @throws NullPointerException if no parser or writer was supplied
        public FlowdocEngine build() {
            Objects.requireNonNull(parser, "parser must not be null");
            Objects.requireNonNull(writer, "writer must not be null");

            if ("true".equalsIgnoreCase(credentials.get(STUB_ENABLED_PROPERTY))) {
                System.setProperty(STUB_ENABLED_PROPERTY, "true");
            }

            TemplateRegistry registry =
                    templateRegistry != null ? templateRegistry : TemplateRegistry.defaults();
            return new FlowdocEngine(config, parser, writer, registry, generatorSupplier());
        }

        private Supplier<TextGenerator> generatorSupplier() {
            if (textGenerator != null) {
                TextGenerator fixed = textGenerator;
                return () -> fixed;
            }

            List<TextGeneratorProvider> candidates = new ArrayList<>(providers);
            candidates.add(new StubTextGeneratorProvider());
            Map<String, String> snapshot = Map.copyOf(credentials);
            String modelName =
                    model != null ? model : snapshot.getOrDefault(MODEL_KEY, DEFAULT_MODEL);
            return () -> new TextGeneratorFactory(candidates, snapshot).create(modelName);
        }
    }
}
