package io.nexus.core.plan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.nexus.core.json.JsonRenderer;
import io.nexus.core.json.JsonValue;
import io.nexus.core.json.JsonValue.JsonObject;
import io.nexus.core.llm.LanguageModel;
import io.nexus.core.llm.ModelResponse;
import io.nexus.core.tool.ToolDescriptor;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class LlmPlannerTest {

    private LanguageModel model;
    private PlanResponseParser parser;
    private LlmPlanner planner;

    private final JsonRenderer renderer = value -> "SCHEMA" + value.toPlain();

    @BeforeEach
    void setUp() {
        model = mock(LanguageModel.class);
        parser = mock(PlanResponseParser.class);
        planner = new LlmPlanner(model, parser, renderer);
    }

    @Test
    void shouldListToolsWithSchemasInPrompt() throws Exception {
        JsonObject schema = (JsonObject) JsonValue.of(Map.of("type", "object"));
        List<ToolDescriptor> catalog =
                List.of(
                        new ToolDescriptor("add", "Add two numbers", schema),
                        new ToolDescriptor("noop", "", JsonObject.empty()));
        when(model.complete(anyString())).thenReturn(ModelResponse.Text.of("[]"));
        when(parser.parse("[]")).thenReturn(List.of());

        planner.plan("what is 2+2", catalog);

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(model).complete(prompt.capture());
        assertThat(prompt.getValue())
                .contains("AVAILABLE TOOLS:")
                .contains("- add: Add two numbers\n  Schema: SCHEMA{type=object}")
                .contains("- noop: No description")
                .contains("USER QUERY: what is 2+2")
                .contains("If no tools are needed, respond with an empty array: []");
    }

    @Test
    void shouldReturnParsedCalls() throws Exception {
        List<PlannedCall> calls = List.of(PlannedCall.of("add", Map.of("a", 2, "b", 2)));
        when(model.complete(anyString())).thenReturn(ModelResponse.Text.of("[...]"));
        when(parser.parse("[...]")).thenReturn(calls);

        assertThat(planner.plan("q", List.of())).isEqualTo(calls);
    }

    @Test
    void shouldReturnEmptyPlanForBlankReply() throws Exception {
        when(model.complete(anyString())).thenReturn(ModelResponse.Text.of("   "));

        assertThat(planner.plan("q", List.of())).isEmpty();
        verify(parser, never()).parse(anyString());
    }

    @Test
    void shouldFailWhenModelFails() {
        when(model.complete(anyString())).thenReturn(ModelResponse.Error.of("rate limited"));

        assertThatThrownBy(() -> planner.plan("q", List.of()))
                .isInstanceOf(PlanningException.class)
                .hasMessageContaining("rate limited");
    }

    @Test
    void shouldPropagateParseFailure() throws Exception {
        when(model.complete(anyString())).thenReturn(ModelResponse.Text.of("not json"));
        when(parser.parse("not json")).thenThrow(new PlanningException("Invalid plan JSON"));

        assertThatThrownBy(() -> planner.plan("q", List.of()))
                .isInstanceOf(PlanningException.class);
    }
}
