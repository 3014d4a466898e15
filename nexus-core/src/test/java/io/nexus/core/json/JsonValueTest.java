package io.nexus.core.json;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.nexus.core.json.JsonValue.JsonArray;
import io.nexus.core.json.JsonValue.JsonNull;
import io.nexus.core.json.JsonValue.JsonNumber;
import io.nexus.core.json.JsonValue.JsonObject;
import io.nexus.core.json.JsonValue.JsonString;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonValueTest {

    @Test
    void shouldConvertNestedPlainValues() {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("required", List.of("a", "b"));
        schema.put("nullable", null);

        JsonValue value = JsonValue.of(schema);

        assertThat(value).isInstanceOf(JsonObject.class);
        JsonObject object = (JsonObject) value;
        assertThat(object.members().keySet()).containsExactly("type", "required", "nullable");
        assertThat(object.get("type")).contains(new JsonString("object"));
        assertThat(object.get("nullable")).contains(JsonNull.INSTANCE);
        assertThat(object.get("required").orElseThrow()).isInstanceOf(JsonArray.class);
    }

    @Test
    void shouldPreserveMemberOrderWhenConvertingBack() {
        Map<String, Object> ordered = new LinkedHashMap<>();
        ordered.put("z", 1);
        ordered.put("a", 2);

        Object plain = JsonValue.of(ordered).toPlain();

        assertThat(plain).isInstanceOf(Map.class);
        List<Object> keys = new ArrayList<>(((Map<?, ?>) plain).keySet());
        assertThat(keys).containsExactly("z", "a");
    }

    @Test
    void shouldRepresentNumbersAsBigDecimal() {
        assertThat(JsonValue.of(3)).isEqualTo(new JsonNumber(new BigDecimal("3")));
        assertThat(JsonValue.of(2.5).toPlain()).isEqualTo(new BigDecimal("2.5"));
    }

    @Test
    void shouldRejectUnsupportedValue() {
        assertThatThrownBy(() -> JsonValue.of(new Object()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
