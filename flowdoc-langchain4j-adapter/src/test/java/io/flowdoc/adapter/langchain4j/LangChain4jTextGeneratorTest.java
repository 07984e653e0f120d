package io.flowdoc.adapter.langchain4j;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.output.FinishReason;
import dev.langchain4j.model.output.TokenUsage;
import io.flowdoc.core.generation.GenerationEvent;
import io.flowdoc.core.generation.GenerationRequest;
import io.flowdoc.core.generation.GenerationResponse;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LangChain4jTextGeneratorTest {

    private static final GenerationRequest REQUEST =
            new GenerationRequest(GenerationRequest.DESCRIBE, "Build a workflow", 0.3, 1500);

    @Mock private ChatModel model;
    @Mock private StreamingChatModel streamingModel;

    @Nested
    class Generate {

        @Test
        void shouldReturnTextWithUsageMetadata() {
            when(model.chat(any(ChatRequest.class)))
                    .thenReturn(
                            ChatResponse.builder()
                                    .aiMessage(AiMessage.from("name: W"))
                                    .tokenUsage(new TokenUsage(12, 8))
                                    .finishReason(FinishReason.STOP)
                                    .build());
            var generator = new LangChain4jTextGenerator("claude-test", model, null);

            GenerationResponse response = generator.generate(REQUEST);

            assertThat(response).isInstanceOf(GenerationResponse.Text.class);
            GenerationResponse.Text text = (GenerationResponse.Text) response;
            assertThat(text.content()).isEqualTo("name: W");
            assertThat(text.metadata())
                    .containsEntry("model", "claude-test")
                    .containsEntry("input_tokens", 12)
                    .containsEntry("output_tokens", 8)
                    .containsEntry("total_tokens", 20)
                    .containsEntry("finish_reason", "STOP")
                    .containsKey("duration_ms");
        }

        @Test
        void shouldPassSamplingParametersWithRequest() {
            when(model.chat(any(ChatRequest.class)))
                    .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from("ok")).build());
            var generator = new LangChain4jTextGenerator("gpt-test", model, null);

            generator.generate(REQUEST);

            ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
            verify(model).chat(captor.capture());
            assertThat(captor.getValue().temperature()).isEqualTo(0.3);
            assertThat(captor.getValue().maxOutputTokens()).isEqualTo(1500);
            assertThat(captor.getValue().messages()).hasSize(1);
        }

        @Test
        void shouldReturnErrorWhenModelThrows() {
            when(model.chat(any(ChatRequest.class)))
                    .thenThrow(new RuntimeException("rate limited"));
            var generator = new LangChain4jTextGenerator("gpt-test", model, null);

            GenerationResponse response = generator.generate(REQUEST);

            assertThat(response).isInstanceOf(GenerationResponse.Error.class);
            assertThat(((GenerationResponse.Error) response).message()).isEqualTo("rate limited");
        }

        @Test
        void shouldReturnErrorWhenModelReturnsNothing() {
            var generator = new LangChain4jTextGenerator("gpt-test", model, null);

            GenerationResponse response = generator.generate(REQUEST);

            assertThat(response).isInstanceOf(GenerationResponse.Error.class);
            assertThat(((GenerationResponse.Error) response).message())
                    .isEqualTo("No response from model");
        }
    }

    @Nested
    class Stream {

        @Test
        void shouldForwardPartialResponsesAndToolCalls() {
            doAnswer(
                            invocation -> {
                                StreamingChatResponseHandler handler = invocation.getArgument(1);
                                handler.onPartialResponse("name: ");
                                handler.onPartialResponse("W");
                                handler.onCompleteResponse(
                                        ChatResponse.builder()
                                                .aiMessage(
                                                        AiMessage.from(
                                                                List.of(
                                                                        ToolExecutionRequest
                                                                                .builder()
                                                                                .name("lookup")
                                                                                .arguments(
                                                                                        "{\"q\":1}")
                                                                                .build())))
                                                .build());
                                return null;
                            })
                    .when(streamingModel)
                    .chat(any(ChatRequest.class), any(StreamingChatResponseHandler.class));
            var generator = new LangChain4jTextGenerator("claude-test", model, streamingModel);
            List<GenerationEvent> events = new ArrayList<>();

            generator.stream(REQUEST, events::add);

            assertThat(events)
                    .containsExactly(
                            new GenerationEvent.Content("name: "),
                            new GenerationEvent.Content("W"),
                            new GenerationEvent.ToolCall("lookup", "{\"q\":1}"),
                            new GenerationEvent.Done());
        }

        @Test
        void shouldEndStreamWithFailureOnError() {
            doAnswer(
                            invocation -> {
                                StreamingChatResponseHandler handler = invocation.getArgument(1);
                                handler.onError(new IllegalStateException("connection reset"));
                                return null;
                            })
                    .when(streamingModel)
                    .chat(any(ChatRequest.class), any(StreamingChatResponseHandler.class));
            var generator = new LangChain4jTextGenerator("claude-test", model, streamingModel);
            List<GenerationEvent> events = new ArrayList<>();

            generator.stream(REQUEST, events::add);

            assertThat(events).containsExactly(new GenerationEvent.Failure("connection reset"));
        }

        @Test
        void shouldReplayBlockingResultWithoutStreamingModel() {
            when(model.chat(any(ChatRequest.class)))
                    .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from("done")).build());
            var generator = new LangChain4jTextGenerator("gpt-test", model, null);
            List<GenerationEvent> events = new ArrayList<>();

            generator.stream(REQUEST, events::add);

            assertThat(events)
                    .containsExactly(new GenerationEvent.Content("done"), new GenerationEvent.Done());
        }
    }
}
