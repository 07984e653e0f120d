package io.flowdoc.adapter.langchain4j;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.anthropic.AnthropicStreamingChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiStreamingChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import io.flowdoc.core.generation.TextGenerator;
import io.flowdoc.core.generation.spi.TextGeneratorProvider;
import java.time.Duration;
import java.util.Map;
import java.util.logging.Logger;

/// LangChain4j implementation of {@link TextGeneratorProvider}.
///
/// Creates blocking and streaming chat models for the supported vendors, chosen by
/// model-name prefix:
///
/// | prefix | vendor | credential |
/// |---|---|---|
/// | `claude` | Anthropic | `ANTHROPIC_API_KEY` |
/// | `gpt`, `o1` | OpenAI | `OPENAI_API_KEY` |
/// | `gemini`, `gemma` | Google AI | `GOOGLE_API_KEY` |
/// | `deepseek` | DeepSeek (OpenAI-compatible API) | `DEEPSEEK_API_KEY` |
///
/// Temperature and token limit set here are defaults; each request overrides them.
///
/// @implNote Stateless and thread-safe. Each call to {@link #create} builds new
/// model instances.
/// @see LangChain4jTextGenerator
public class LangChain4jGeneratorProvider implements TextGeneratorProvider {

    private static final Logger logger =
            Logger.getLogger(LangChain4jGeneratorProvider.class.getName());

    private static final String DEEPSEEK_BASE_URL = "https://api.deepseek.com";
    private static final int DEFAULT_MAX_TOKENS = 4096;
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);
    private static final double DEFAULT_TEMPERATURE = 0.7;

    @Override
    public String getName() {
        return "langchain4j";
    }

    @Override
    public boolean supportsModel(String modelName) {
        if (modelName == null) return false;
        return modelName.startsWith("claude")
                || modelName.startsWith("gpt")
                || modelName.startsWith("o1")
                || modelName.startsWith("gemini")
                || modelName.startsWith("gemma")
                || modelName.startsWith("deepseek");
    }

    /// @throws IllegalArgumentException if the model name is not supported
    /// @throws IllegalStateException if the vendor's API key is missing
    @Override
    public TextGenerator create(String modelName, Map<String, String> credentials) {
        logger.info("Creating LangChain4j text generator with model: " + modelName);

        if (modelName.startsWith("claude")) {
            String apiKey = requireApiKey(credentials, "anthropic_api_key", "ANTHROPIC_API_KEY");
            return new LangChain4jTextGenerator(
                    modelName, anthropic(modelName, apiKey), anthropicStreaming(modelName, apiKey));
        } else if (modelName.startsWith("gpt") || modelName.startsWith("o1")) {
            String apiKey = requireApiKey(credentials, "openai_api_key", "OPENAI_API_KEY");
            return new LangChain4jTextGenerator(
                    modelName,
                    openAi(modelName, apiKey, null),
                    openAiStreaming(modelName, apiKey, null));
        } else if (modelName.startsWith("gemini") || modelName.startsWith("gemma")) {
            String apiKey = requireApiKey(credentials, "google_api_key", "GOOGLE_API_KEY");
            return new LangChain4jTextGenerator(
                    modelName, gemini(modelName, apiKey), geminiStreaming(modelName, apiKey));
        } else if (modelName.startsWith("deepseek")) {
            String apiKey = requireApiKey(credentials, "deepseek_api_key", "DEEPSEEK_API_KEY");
            return new LangChain4jTextGenerator(
                    modelName,
                    openAi(modelName, apiKey, DEEPSEEK_BASE_URL),
                    openAiStreaming(modelName, apiKey, DEEPSEEK_BASE_URL));
        }
        throw new IllegalArgumentException("Unsupported model: " + modelName);
    }

    @Override
    public int getPriority() {
        return 100;
    }

    private ChatModel anthropic(String modelName, String apiKey) {
        return AnthropicChatModel.builder()
                .apiKey(apiKey)
                .modelName(modelName)
                .temperature(DEFAULT_TEMPERATURE)
                .maxTokens(DEFAULT_MAX_TOKENS)
                .timeout(DEFAULT_TIMEOUT)
                .build();
    }

    private StreamingChatModel anthropicStreaming(String modelName, String apiKey) {
        return AnthropicStreamingChatModel.builder()
                .apiKey(apiKey)
                .modelName(modelName)
                .temperature(DEFAULT_TEMPERATURE)
                .maxTokens(DEFAULT_MAX_TOKENS)
                .timeout(DEFAULT_TIMEOUT)
                .build();
    }

    /// Creates an OpenAI-compatible model, used for both OpenAI and DeepSeek.
    ///
    /// @param baseUrl custom API endpoint, may be null for the OpenAI default
    private ChatModel openAi(String modelName, String apiKey, String baseUrl) {
        var builder =
                OpenAiChatModel.builder()
                        .apiKey(apiKey)
                        .modelName(modelName)
                        .temperature(DEFAULT_TEMPERATURE)
                        .maxTokens(DEFAULT_MAX_TOKENS)
                        .timeout(DEFAULT_TIMEOUT);
        if (baseUrl != null) builder.baseUrl(baseUrl);
        return builder.build();
    }

    private StreamingChatModel openAiStreaming(String modelName, String apiKey, String baseUrl) {
        var builder =
                OpenAiStreamingChatModel.builder()
                        .apiKey(apiKey)
                        .modelName(modelName)
                        .temperature(DEFAULT_TEMPERATURE)
                        .maxTokens(DEFAULT_MAX_TOKENS)
                        .timeout(DEFAULT_TIMEOUT);
        if (baseUrl != null) builder.baseUrl(baseUrl);
        return builder.build();
    }

    private ChatModel gemini(String modelName, String apiKey) {
        return GoogleAiGeminiChatModel.builder()
                .apiKey(apiKey)
                .modelName(modelName)
                .temperature(DEFAULT_TEMPERATURE)
                .maxOutputTokens(DEFAULT_MAX_TOKENS)
                .timeout(DEFAULT_TIMEOUT)
                .build();
    }

    private StreamingChatModel geminiStreaming(String modelName, String apiKey) {
        return GoogleAiGeminiStreamingChatModel.builder()
                .apiKey(apiKey)
                .modelName(modelName)
                .temperature(DEFAULT_TEMPERATURE)
                .maxOutputTokens(DEFAULT_MAX_TOKENS)
                .timeout(DEFAULT_TIMEOUT)
                .build();
    }

    /// Looks up an API key from credentials, trying each key name in order.
    ///
    /// @throws IllegalStateException if no key name resolves to a value
    private String requireApiKey(Map<String, String> credentials, String... keyNames) {
        for (String keyName : keyNames) {
            String value = credentials.get(keyName);
            if (value != null) return value;
        }
        throw new IllegalStateException(
                "API key not found. Provide one of: " + String.join(", ", keyNames));
    }
}
