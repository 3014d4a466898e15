package io.nexus.core.tool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DefaultRouteTableTest {

    private DefaultRouteTable table;

    @BeforeEach
    void setUp() {
        table = new DefaultRouteTable();
    }

    @Nested
    class Registration {

        @Test
        void shouldRouteToolsToDeclaringSession() {
            table.register(
                    "search_server",
                    List.of(
                            ToolDescriptor.simple("web_search", "Search the web"),
                            ToolDescriptor.simple("web_fetch", "Fetch a page")));

            assertThat(table.resolve("web_search"))
                    .hasValueSatisfying(r -> assertThat(r.ownerSessionName()).isEqualTo("search_server"));
            assertThat(table.size()).isEqualTo(2);
        }

        @Test
        void shouldLetLaterSessionWinCollision() {
            table.register("a", List.of(ToolDescriptor.simple("x", "from a")));

            List<String> replaced =
                    table.register("b", List.of(ToolDescriptor.simple("x", "from b")));

            assertThat(replaced).containsExactly("x");
            assertThat(table.resolve("x"))
                    .hasValueSatisfying(
                            r -> {
                                assertThat(r.ownerSessionName()).isEqualTo("b");
                                assertThat(r.descriptor().description()).isEqualTo("from b");
                            });
            assertThat(table.size()).isEqualTo(1);
        }

        @Test
        void shouldKeepOriginalPositionOnCollision() {
            table.register(
                    "a",
                    List.of(ToolDescriptor.simple("first", ""), ToolDescriptor.simple("second", "")));
            table.register("b", List.of(ToolDescriptor.simple("first", "override")));

            assertThat(table.routes())
                    .extracting(ToolRoute::toolName)
                    .containsExactly("first", "second");
        }

        @Test
        void shouldNotReportReplacementWithinSameSession() {
            List<String> replaced =
                    table.register(
                            "a",
                            List.of(ToolDescriptor.simple("x", "1"), ToolDescriptor.simple("x", "2")));

            assertThat(replaced).isEmpty();
        }

        @Test
        void shouldRejectNullSessionName() {
            assertThatThrownBy(() -> table.register(null, List.of()))
                    .isInstanceOf(NullPointerException.class);
        }
    }

    @Nested
    class Lookup {

        @Test
        void shouldReturnEmptyForUnknownTool() {
            assertThat(table.resolve("missing")).isEmpty();
        }

        @Test
        void shouldStartEmpty() {
            assertThat(table.isEmpty()).isTrue();
            assertThat(table.descriptors()).isEmpty();
        }

        @Test
        void shouldReturnImmutableSnapshot() {
            table.register("a", List.of(ToolDescriptor.simple("x", "")));
            List<ToolRoute> snapshot = table.routes();

            table.register("a", List.of(ToolDescriptor.simple("y", "")));

            assertThat(snapshot).hasSize(1);
            assertThatThrownBy(() -> snapshot.add(snapshot.get(0)))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }
}
