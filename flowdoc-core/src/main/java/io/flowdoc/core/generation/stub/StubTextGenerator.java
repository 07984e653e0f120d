package io.flowdoc.core.generation.stub;

import io.flowdoc.core.generation.GenerationRequest;
import io.flowdoc.core.generation.GenerationResponse;
import io.flowdoc.core.generation.TextGenerator;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// Offline {@link TextGenerator} returning canned responses.
///
/// ### Response lookup, per request purpose
/// 1. A response registered with {@link #registerResponse(String, String)}
/// 2. The classpath resource `/stubs/{purpose}.txt`
/// 3. A generic text echoing the start of the prompt
///
/// The bundled `describe` response is a fenced, valid workflow document, so the
/// description-to-document pipeline runs end to end without network access.
public class StubTextGenerator implements TextGenerator {

    private static final Logger logger = Logger.getLogger(StubTextGenerator.class.getName());
    private static final String STUB_RESOURCE_BASE = "/stubs/";

    private final String model;
    private final Map<String, String> registered = new ConcurrentHashMap<>();

    public StubTextGenerator(String model) {
        this.model = Objects.requireNonNull(model, "model must not be null");
    }

    /// Registers the response returned for every request with a purpose.
    ///
    /// @param purpose request purpose, e.g. {@link GenerationRequest#DESCRIBE}, not null
    /// @param response canned text, not null
    public void registerResponse(String purpose, String response) {
        registered.put(purpose, response);
    }

    public void clearResponses() {
        registered.clear();
    }

    @Override
    public String getModel() {
        return model;
    }

    @Override
    public GenerationResponse generate(GenerationRequest request) {
        logger.info(
                "[STUB] "
                        + request.purpose()
                        + " request received ("
                        + request.prompt().length()
                        + " chars)");

        String response = registered.get(request.purpose());
        if (response == null) {
            response = loadResource(STUB_RESOURCE_BASE + request.purpose() + ".txt");
        }
        if (response == null) {
            response = fallback(request.prompt());
        }

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("stub", true);
        metadata.put("model", model);
        metadata.put("prompt_length", request.prompt().length());
        return GenerationResponse.Text.of(response, metadata);
    }

    private String fallback(String prompt) {
        return "[STUB RESPONSE from "
                + model
                + "]\n\nThe actual prompt was:\n"
                + (prompt.length() > 500 ? prompt.substring(0, 500) + "..." : prompt);
    }

    private String loadResource(String path) {
        try (InputStream in = getClass().getResourceAsStream(path)) {
            if (in == null) {
                return null;
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.warning("Failed to load stub resource: " + path + " - " + e.getMessage());
            return null;
        }
    }
}
