package io.flowdoc.core.template;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class PlaceholderTemplateResolverTest {

    private final PlaceholderTemplateResolver resolver = new PlaceholderTemplateResolver();

    @Test
    void shouldReplaceKnownPlaceholders() {
        String result =
                resolver.resolve("Hello {{name}}, from {{team}}", Map.of("name", "Ada", "team", "ops"));

        assertThat(result).isEqualTo("Hello Ada, from ops");
    }

    @Test
    void shouldLeaveUnmatchedPlaceholdersVerbatim() {
        assertThat(resolver.resolve("{{known}} and {{unknown}}", Map.of("known", "x")))
                .isEqualTo("x and {{unknown}}");
    }

    @Test
    void shouldNotRescanSubstitutedValues() {
        String result =
                resolver.resolve("{{a}}-{{b}}", Map.of("a", "{{b}}", "b", "B"));

        assertThat(result).isEqualTo("{{b}}-B");
    }

    @Test
    void shouldInsertReplacementCharactersLiterally() {
        assertThat(resolver.resolve("cost: {{price}}", Map.of("price", "$5 \\ each")))
                .isEqualTo("cost: $5 \\ each");
    }

    @Test
    void shouldEscapeValuesInsideDoubleQuotes() {
        String result =
                resolver.resolve(
                        "condition: \"{{logic}}\"\npath: \"dir {{path}}\"",
                        Map.of("logic", "status == \"active\"", "path", "C:\\temp\\x\tend"));

        assertThat(result)
                .isEqualTo(
                        "condition: \"status == \\\"active\\\"\"\n"
                                + "path: \"dir C:\\\\temp\\\\x\\tend\"");
    }

    @Test
    void shouldDoubleSingleQuotesInsideSingleQuotes() {
        assertThat(resolver.resolve("name: '{{who}}'", Map.of("who", "it's")))
                .isEqualTo("name: 'it''s'");
    }

    @Test
    void shouldTrackQuotesClosedEarlierOnTheLine() {
        String template = "pair: [\"a \\\" b\", {{plain}}, \"{{quoted}}\"]";

        assertThat(resolver.resolve(template, Map.of("plain", "x\"y", "quoted", "x\"y")))
                .isEqualTo("pair: [\"a \\\" b\", x\"y, \"x\\\"y\"]");
    }

    @Test
    void shouldNotTreatApostropheInPlainTextAsQuote() {
        assertThat(resolver.resolve("note: it's {{what}}", Map.of("what", "Bob's")))
                .isEqualTo("note: it's Bob's");
    }

    @Test
    void shouldIgnoreMalformedPlaceholders() {
        String template = "{{ spaced }} {{1digit}} {single}";

        assertThat(resolver.resolve(template, Map.of("spaced", "x", "1digit", "y")))
                .isEqualTo(template);
    }

    @Test
    void shouldTreatNullTemplateAsEmpty() {
        assertThat(resolver.resolve(null, Map.of())).isEmpty();
    }

    @Test
    void shouldListDistinctPlaceholdersInOrder() {
        assertThat(PlaceholderTemplateResolver.placeholders("{{b}} {{a}} {{b}} {{c.d}}"))
                .containsExactly("b", "a", "c.d");
    }
}
