package io.flowdoc.adapter.langchain4j;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.flowdoc.core.generation.TextGenerator;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class LangChain4jGeneratorProviderTest {

    private final LangChain4jGeneratorProvider provider = new LangChain4jGeneratorProvider();

    @ParameterizedTest
    @ValueSource(
            strings = {
                "claude-sonnet-4-5",
                "gpt-4o",
                "o1-mini",
                "gemini-2.0-flash",
                "gemma-3",
                "deepseek-chat"
            })
    void shouldSupportKnownModelFamilies(String model) {
        assertThat(provider.supportsModel(model)).isTrue();
    }

    @Test
    void shouldNotSupportUnknownOrMissingModel() {
        assertThat(provider.supportsModel("llama-3")).isFalse();
        assertThat(provider.supportsModel(null)).isFalse();
    }

    @Test
    void shouldRequireVendorApiKey() {
        assertThatThrownBy(() -> provider.create("claude-sonnet-4-5", Map.of()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("ANTHROPIC_API_KEY");
    }

    @Test
    void shouldRejectUnsupportedModel() {
        assertThatThrownBy(() -> provider.create("llama-3", Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unsupported model: llama-3");
    }

    @Test
    void shouldCreateGeneratorFromEitherKeySpelling() {
        TextGenerator fromEnv =
                provider.create("gpt-4o", Map.of("OPENAI_API_KEY", "sk-test"));
        TextGenerator fromProperties =
                provider.create("deepseek-chat", Map.of("deepseek_api_key", "sk-test"));

        assertThat(fromEnv).isInstanceOf(LangChain4jTextGenerator.class);
        assertThat(fromEnv.getModel()).isEqualTo("gpt-4o");
        assertThat(fromProperties.getModel()).isEqualTo("deepseek-chat");
    }

    @Test
    void shouldReportNameAndPriority() {
        assertThat(provider.getName()).isEqualTo("langchain4j");
        assertThat(provider.getPriority()).isEqualTo(100);
    }
}
