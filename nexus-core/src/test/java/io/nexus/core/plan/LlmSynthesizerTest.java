package io.nexus.core.plan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.nexus.core.llm.LanguageModel;
import io.nexus.core.llm.ModelResponse;
import io.nexus.core.tool.ToolExecutionResult;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class LlmSynthesizerTest {

    private LanguageModel model;
    private LlmSynthesizer synthesizer;

    @BeforeEach
    void setUp() {
        model = mock(LanguageModel.class);
        synthesizer = new LlmSynthesizer(model);
    }

    @Nested
    class Synthesis {

        @Test
        void shouldIncludeEveryResultBlock() {
            when(model.complete(anyString())).thenReturn(ModelResponse.Text.of("  The answer is 4.  "));

            String answer =
                    synthesizer.synthesize(
                            "what is 2+2",
                            List.of(
                                    ToolExecutionResult.success("add", "4"),
                                    ToolExecutionResult.failure("web_search", "timed out")));

            assertThat(answer).isEqualTo("The answer is 4.");
            ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
            verify(model).complete(prompt.capture());
            assertThat(prompt.getValue())
                    .contains("USER QUERY: what is 2+2")
                    .contains("Tool: add\nSuccess: true\nResult: 4\n\nTool: web_search\nSuccess: false\nResult: Error: timed out");
        }

        @Test
        void shouldRenderModelError() {
            when(model.complete(anyString())).thenReturn(ModelResponse.Error.of("quota exceeded"));

            assertThat(synthesizer.synthesize("q", List.of()))
                    .isEqualTo("Error synthesizing response: quota exceeded");
        }

        @Test
        void shouldNeverThrow() {
            when(model.complete(anyString())).thenThrow(new IllegalStateException("socket closed"));

            assertThat(synthesizer.synthesize("q", List.of()))
                    .isEqualTo("Error synthesizing response: socket closed");
        }

        @Test
        void shouldReportBlankReply() {
            when(model.complete(anyString())).thenReturn(ModelResponse.Text.of(""));

            assertThat(synthesizer.synthesize("q", List.of())).isEqualTo("Unable to synthesize response.");
        }
    }

    @Nested
    class DirectAnswer {

        @Test
        void shouldSendRawQuery() {
            when(model.complete("what is the capital of France?"))
                    .thenReturn(ModelResponse.Text.of("Paris"));

            assertThat(synthesizer.respondDirectly("what is the capital of France?")).isEqualTo("Paris");
        }

        @Test
        void shouldRenderModelError() {
            when(model.complete(anyString())).thenReturn(ModelResponse.Error.of("down"));

            assertThat(synthesizer.respondDirectly("q")).isEqualTo("Error generating direct response: down");
        }

        @Test
        void shouldReportBlankReply() {
            when(model.complete(anyString())).thenReturn(ModelResponse.Text.of(" "));

            assertThat(synthesizer.respondDirectly("q")).isEqualTo("Unable to generate response.");
        }
    }
}
