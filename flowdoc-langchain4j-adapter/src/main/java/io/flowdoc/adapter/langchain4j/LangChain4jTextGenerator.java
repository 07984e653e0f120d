package io.flowdoc.adapter.langchain4j;

import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import io.flowdoc.core.generation.GenerationEvent;
import io.flowdoc.core.generation.GenerationRequest;
import io.flowdoc.core.generation.GenerationResponse;
import io.flowdoc.core.generation.TextGenerator;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Logger;

/// LangChain4j implementation of {@link TextGenerator}.
///
/// Sends each prompt as a single user message; temperature and token limit travel
/// with the request, so one generator serves both description and summary calls.
///
/// Streaming uses the {@link StreamingChatModel} when one was supplied: partial
/// responses become {@link GenerationEvent.Content}, tool execution requests of the
/// final message become {@link GenerationEvent.ToolCall}, followed by
/// {@link GenerationEvent.Done}. Errors end the stream with
/// {@link GenerationEvent.Failure}.
///
/// @implNote Thread-safe. Holds no conversation state.
/// @see LangChain4jGeneratorProvider for generator creation
public class LangChain4jTextGenerator implements TextGenerator {

    private static final Logger logger =
            Logger.getLogger(LangChain4jTextGenerator.class.getName());

    private final String modelName;
    private final ChatModel model;
    private final StreamingChatModel streamingModel;

    /// @param modelName model identifier, not null
    /// @param model blocking chat model, not null
    /// @param streamingModel streaming chat model, may be null to replay blocking results
    public LangChain4jTextGenerator(
            String modelName, ChatModel model, StreamingChatModel streamingModel) {
        this.modelName = Objects.requireNonNull(modelName, "modelName must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.streamingModel = streamingModel;
    }

    @Override
    public String getModel() {
        return modelName;
    }

    /// Sends the prompt to the chat model.
    ///
    /// @param request prompt and sampling parameters, not null
    /// @return text with token usage metadata on success, error on failure; never null
    @Override
    public GenerationResponse generate(GenerationRequest request) {
        Instant startTime = Instant.now();
        try {
            logger.fine("Generating " + request.purpose() + " text with " + modelName);
            ChatResponse response = model.chat(toChatRequest(request));
            if (response == null || response.aiMessage() == null) {
                return GenerationResponse.Error.of("No response from model");
            }

            String text = response.aiMessage().text();
            return GenerationResponse.Text.of(
                    text != null ? text : "", buildMetadata(response, startTime));
        } catch (Exception e) {
            logger.severe("Text generation with " + modelName + " failed: " + e.getMessage());
            return GenerationResponse.Error.from(e);
        }
    }

    @Override
    public void stream(GenerationRequest request, Consumer<GenerationEvent> listener) {
        if (streamingModel == null) {
            TextGenerator.super.stream(request, listener);
            return;
        }

        streamingModel.chat(
                toChatRequest(request),
                new StreamingChatResponseHandler() {
                    @Override
                    public void onPartialResponse(String partialResponse) {
                        listener.accept(new GenerationEvent.Content(partialResponse));
                    }

                    @Override
                    public void onCompleteResponse(ChatResponse completeResponse) {
                        AiMessage message = completeResponse.aiMessage();
                        if (message != null && message.hasToolExecutionRequests()) {
                            for (ToolExecutionRequest tool : message.toolExecutionRequests()) {
                                listener.accept(
                                        new GenerationEvent.ToolCall(
                                                tool.name(), tool.arguments()));
                            }
                        }
                        listener.accept(new GenerationEvent.Done());
                    }

                    @Override
                    public void onError(Throwable error) {
                        logger.severe(
                                "Streaming generation with "
                                        + modelName
                                        + " failed: "
                                        + error.getMessage());
                        listener.accept(
                                new GenerationEvent.Failure(
                                        error.getMessage() != null
                                                ? error.getMessage()
                                                : error.getClass().getSimpleName()));
                    }
                });
    }

    private ChatRequest toChatRequest(GenerationRequest request) {
        return ChatRequest.builder()
                .messages(UserMessage.from(request.prompt()))
                .temperature(request.temperature())
                .maxOutputTokens(request.maxTokens())
                .build();
    }

    private Map<String, Object> buildMetadata(ChatResponse response, Instant startTime) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("model", modelName);
        metadata.put("timestamp", startTime.toString());
        metadata.put("duration_ms", Duration.between(startTime, Instant.now()).toMillis());

        var tokenUsage = response.metadata().tokenUsage();
        if (tokenUsage != null) {
            metadata.put("input_tokens", tokenUsage.inputTokenCount());
            metadata.put("output_tokens", tokenUsage.outputTokenCount());
            metadata.put("total_tokens", tokenUsage.totalTokenCount());
        }

        var finishReason = response.metadata().finishReason();
        if (finishReason != null) {
            metadata.put("finish_reason", finishReason.toString());
        }
        return metadata;
    }
}
