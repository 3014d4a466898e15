package io.nexus.serialization;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.nexus.core.json.JsonValue;
import io.nexus.core.json.JsonValue.JsonObject;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JacksonJsonRendererTest {

    private static JsonValue schema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("text", Map.of("type", "string"));
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("type", "object");
        root.put("properties", properties);
        root.put("required", List.of("text"));
        return JsonValue.of(root);
    }

    @Test
    void shouldRenderCompactly() {
        JacksonJsonRenderer renderer = new JacksonJsonRenderer(new ObjectMapper());

        assertThat(renderer.render(schema()))
                .isEqualTo(
                        "{\"type\":\"object\",\"properties\":{\"text\":{\"type\":\"string\"}},"
                                + "\"required\":[\"text\"]}");
    }

    @Test
    void shouldRenderEmptyObject() {
        JacksonJsonRenderer renderer = new JacksonJsonRenderer(new ObjectMapper());

        assertThat(renderer.render(JsonObject.empty())).isEqualTo("{}");
    }

    @Test
    void shouldIndentWhenPretty() {
        JacksonJsonRenderer renderer = new JacksonJsonRenderer(new ObjectMapper(), true);

        String rendered = renderer.render(schema());

        assertThat(rendered).contains("\n").contains("\"type\" : \"object\"");
    }

    @Test
    void shouldRenderNullLiteral() {
        JacksonJsonRenderer renderer = new JacksonJsonRenderer(new ObjectMapper());

        assertThat(renderer.render(JsonValue.JsonNull.INSTANCE)).isEqualTo("null");
    }
}
