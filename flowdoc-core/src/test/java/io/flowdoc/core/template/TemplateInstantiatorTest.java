package io.flowdoc.core.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.flowdoc.core.TestDocuments;
import io.flowdoc.core.document.DocumentParser;
import io.flowdoc.core.document.ParseResult;
import io.flowdoc.core.document.WorkflowDocument;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TemplateInstantiatorTest {

    @Mock private DocumentParser parser;

    private TemplateInstantiator instantiator;

    @BeforeEach
    void setUp() {
        TemplateRegistry registry =
                new TemplateRegistry(
                        List.of(
                                new WorkflowTemplate(
                                        "greeting",
                                        "Greeting",
                                        "Says hello",
                                        "general",
                                        "name: \"{{who}}\"\nblocks: []\n")));
        instantiator = new TemplateInstantiator(registry, new PlaceholderTemplateResolver(), parser);
    }

    @Test
    void shouldFillAndParseTemplate() throws Exception {
        WorkflowDocument parsed = TestDocuments.triggerAction();
        when(parser.parse("name: \"Ada\"\nblocks: []\n")).thenReturn(ParseResult.parsed(parsed));

        WorkflowDocument document = instantiator.instantiate("greeting", Map.of("who", "Ada"));

        assertThat(document).isSameAs(parsed);
    }

    @Test
    void shouldEscapeQuotedValuesBeforeParsing() throws Exception {
        when(parser.parse(anyString())).thenReturn(ParseResult.parsed(TestDocuments.triggerAction()));

        instantiator.instantiate("greeting", Map.of("who", "C:\\temp \"x\""));

        verify(parser).parse("name: \"C:\\\\temp \\\"x\\\"\"\nblocks: []\n");
    }

    @Test
    void shouldKeepMissingParametersVerbatim() throws Exception {
        assertThat(instantiator.fill("greeting", Map.of()))
                .isEqualTo("name: \"{{who}}\"\nblocks: []\n");
    }

    @Test
    void shouldRejectUnknownTemplate() {
        assertThatThrownBy(() -> instantiator.instantiate("missing", Map.of()))
                .isInstanceOf(TemplateException.class)
                .hasMessage("unknown template: missing");
        verify(parser, never()).parse(anyString());
    }

    @Test
    void shouldReportUnparseableResult() {
        when(parser.parse(anyString())).thenReturn(ParseResult.failed("YAML parsing error: x"));

        assertThatThrownBy(() -> instantiator.instantiate("greeting", Map.of("who", "\"")))
                .isInstanceOf(TemplateException.class)
                .hasMessageContaining("greeting")
                .hasMessageContaining("YAML parsing error: x");
    }
}
