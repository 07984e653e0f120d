package io.flowdoc.core.generation.stub;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.flowdoc.core.generation.GenerationRequest;
import io.flowdoc.core.generation.GenerationResponse;
import io.flowdoc.core.generation.TextGenerator;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class StubTextGeneratorTest {

    private final StubTextGenerator generator = new StubTextGenerator("claude-test");

    @Test
    void shouldPreferRegisteredResponse() {
        generator.registerResponse("summary", "Two blocks were renamed.");

        GenerationResponse.Text response = text(generator.generate(request("summary")));

        assertThat(response.content()).isEqualTo("Two blocks were renamed.");
        assertThat(response.metadata())
                .containsEntry("stub", true)
                .containsEntry("model", "claude-test")
                .containsEntry("prompt_length", 6);
    }

    @Test
    void shouldFallBackToBundledResource() {
        GenerationResponse.Text response = text(generator.generate(request("describe")));

        assertThat(response.content()).contains("```yaml", "trigger_1", "action_1");
    }

    @Test
    void shouldEchoPromptWhenNothingMatches() {
        GenerationResponse.Text response = text(generator.generate(request("unheard-of")));

        assertThat(response.content()).startsWith("[STUB RESPONSE from claude-test]");
        assertThat(response.content()).contains("prompt");
    }

    @Test
    void shouldForgetClearedResponses() {
        generator.registerResponse("summary", "custom");
        generator.clearResponses();

        assertThat(text(generator.generate(request("summary"))).content()).isNotEqualTo("custom");
    }

    @Nested
    class Provider {

        private final StubTextGeneratorProvider provider = new StubTextGeneratorProvider();

        @AfterEach
        void clearProperty() {
            System.clearProperty(StubTextGeneratorProvider.ENABLED_PROPERTY);
        }

        @Test
        void shouldTakeOverEveryModelWhenEnabled() {
            System.setProperty(StubTextGeneratorProvider.ENABLED_PROPERTY, "true");

            assertThat(provider.supportsModel("gpt-4o")).isTrue();
            assertThat(provider.getPriority()).isEqualTo(1000);
            TextGenerator created = provider.create("gpt-4o", Map.of());
            assertThat(created).isInstanceOf(StubTextGenerator.class);
            assertThat(created.getModel()).isEqualTo("gpt-4o");
        }

        @Test
        void shouldHonourCredentialFlag() {
            TextGenerator created =
                    provider.create(
                            "m", Map.of(StubTextGeneratorProvider.ENABLED_PROPERTY, "true"));

            assertThat(created).isInstanceOf(StubTextGenerator.class);
        }

        @Test
        void shouldRefuseWhenDisabled() {
            assertThatThrownBy(
                            () ->
                                    provider.create(
                                            "m",
                                            Map.of(StubTextGeneratorProvider.ENABLED_KEY, "false")))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    private static GenerationRequest request(String purpose) {
        return new GenerationRequest(purpose, "prompt", 0.2, 50);
    }

    private static GenerationResponse.Text text(GenerationResponse response) {
        assertThat(response).isInstanceOf(GenerationResponse.Text.class);
        return (GenerationResponse.Text) response;
    }
}
