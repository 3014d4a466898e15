package io.nexus.core.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class DownstreamEndpointTest {

    @Test
    void shouldParseNameAndAddress() {
        DownstreamEndpoint endpoint = DownstreamEndpoint.parse("search_server=http://localhost:8000/sse");

        assertThat(endpoint.name()).isEqualTo("search_server");
        assertThat(endpoint.address()).isEqualTo("http://localhost:8000/sse");
    }

    @Test
    void shouldSplitOnFirstEqualsSign() {
        DownstreamEndpoint endpoint = DownstreamEndpoint.parse("calc=http://host/sse?key=value");

        assertThat(endpoint.address()).isEqualTo("http://host/sse?key=value");
    }

    @Test
    void shouldTrimWhitespace() {
        DownstreamEndpoint endpoint = DownstreamEndpoint.parse(" calc = http://host/sse ");

        assertThat(endpoint.name()).isEqualTo("calc");
        assertThat(endpoint.address()).isEqualTo("http://host/sse");
    }

    @Test
    void shouldRejectEntryWithoutSeparator() {
        assertThatThrownBy(() -> DownstreamEndpoint.parse("http://host/sse"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("expected name=address");
    }

    @Test
    void shouldRejectBlankParts() {
        assertThatThrownBy(() -> DownstreamEndpoint.parse("=http://host/sse"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DownstreamEndpoint.parse("calc= "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
