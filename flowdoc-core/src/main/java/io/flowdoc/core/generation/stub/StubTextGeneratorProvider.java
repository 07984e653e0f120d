package io.flowdoc.core.generation.stub;

import io.flowdoc.core.generation.TextGenerator;
import io.flowdoc.core.generation.spi.TextGeneratorProvider;
import java.util.Map;
import java.util.logging.Logger;

/// Provider of {@link StubTextGenerator}, active only in stub mode.
///
/// Stub mode is enabled by the system property `flowdoc.stub.enabled=true` or the
/// environment variable `FLOWDOC_STUB_ENABLED=true`. When enabled the provider
/// claims every model with priority 1000, overriding real backends.
public class StubTextGeneratorProvider implements TextGeneratorProvider {

    private static final Logger logger =
            Logger.getLogger(StubTextGeneratorProvider.class.getName());

    static final String ENABLED_KEY = "FLOWDOC_STUB_ENABLED";
    static final String ENABLED_PROPERTY = "flowdoc.stub.enabled";

    @Override
    public String getName() {
        return "stub";
    }

    @Override
    public boolean supportsModel(String modelName) {
        return isEnabledGlobally();
    }

    @Override
    public TextGenerator create(String modelName, Map<String, String> credentials) {
        if (!isEnabled(credentials)) {
            throw new IllegalStateException("Stub provider called but stub mode is disabled");
        }
        logger.info("[STUB] Creating stub text generator (model: " + modelName + ")");
        return new StubTextGenerator(modelName);
    }

    @Override
    public int getPriority() {
        return isEnabledGlobally() ? 1000 : -1;
    }

    private boolean isEnabledGlobally() {
        if ("true".equalsIgnoreCase(System.getProperty(ENABLED_PROPERTY))) {
            return true;
        }
        return "true".equalsIgnoreCase(System.getenv(ENABLED_KEY));
    }

    private boolean isEnabled(Map<String, String> credentials) {
        if (credentials != null) {
            String value = credentials.get(ENABLED_KEY);
            if (value == null) {
                value = credentials.get(ENABLED_PROPERTY);
            }
            if (value != null) {
                return "true".equalsIgnoreCase(value);
            }
        }
        return isEnabledGlobally();
    }
}
