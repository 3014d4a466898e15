package io.nexus.core.llm.stub;

import static org.assertj.core.api.Assertions.assertThat;

import io.nexus.core.llm.LanguageModelConfig;
import io.nexus.core.llm.ModelResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class StubLanguageModelTest {

    private final StubLanguageModel model =
            new StubLanguageModel(LanguageModelConfig.builder().model("gpt-5").build());

    @AfterEach
    void tearDown() {
        StubResponseRegistry.getInstance().clearResponses();
    }

    @Test
    void shouldPlanNoToolsByDefault() {
        ModelResponse response = model.complete("...\nAVAILABLE TOOLS:\n- add: Add\n...");

        assertThat(response).isInstanceOf(ModelResponse.Text.class);
        assertThat(((ModelResponse.Text) response).content()).isEqualTo("[]");
    }

    @Test
    void shouldEchoOtherPrompts() {
        ModelResponse.Text response = (ModelResponse.Text) model.complete("hello");

        assertThat(response.content()).startsWith("[STUB RESPONSE from gpt-5]").endsWith("hello");
        assertThat(response.metadata()).containsEntry("stub", true);
    }

    @Test
    void shouldPreferRegisteredResponse() {
        StubResponseRegistry.getInstance()
                .registerResponse("USER QUERY: add", "[{\"tool\":\"add\",\"arguments\":{}}]");

        ModelResponse.Text response =
                (ModelResponse.Text) model.complete("AVAILABLE TOOLS:\n...\nUSER QUERY: add 2 and 2");

        assertThat(response.content()).contains("\"tool\":\"add\"");
    }

    @Test
    void shouldReportStubIdentity() {
        assertThat(model.getId()).isEqualTo("stub:gpt-5");
    }
}
