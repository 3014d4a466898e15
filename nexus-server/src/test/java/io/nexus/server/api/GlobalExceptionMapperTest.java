package io.nexus.server.api;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class GlobalExceptionMapperTest {

    private final GlobalExceptionMapper mapper = new GlobalExceptionMapper();

    @Nested
    class ToResponse {

        @Test
        void shouldHideDetailsOfUnexpectedErrors() {
            Response response =
                    mapper.toResponse(new IllegalStateException("pool exhausted at Foo.java:42"));

            assertThat(response.getStatus()).isEqualTo(500);
            assertThat(response.getEntity()).isEqualTo(ErrorResponse.of(500, "Internal server error"));
        }

        @Test
        void shouldKeepStatusOfWebApplicationExceptions() {
            Response response = mapper.toResponse(new NotFoundException("no such path /x"));

            assertThat(response.getStatus()).isEqualTo(404);
            assertThat(response.getEntity()).isEqualTo(ErrorResponse.of(404, "Resource not found"));
        }

        @Test
        void shouldKeepMessageOfBadRequests() {
            Response response = mapper.toResponse(new BadRequestException("Malformed JSON body"));

            assertThat(response.getStatus()).isEqualTo(400);
            assertThat(response.getEntity())
                    .isEqualTo(ErrorResponse.of(400, "Malformed JSON body"));
        }
    }

    @Nested
    class MessageFor {

        @Test
        void shouldUseGenericMessagesPerStatus() {
            assertThat(GlobalExceptionMapper.messageFor(405, "x")).isEqualTo("Method not allowed");
            assertThat(GlobalExceptionMapper.messageFor(415, "x")).isEqualTo("Unsupported media type");
            assertThat(GlobalExceptionMapper.messageFor(503, "x")).isEqualTo("Internal server error");
            assertThat(GlobalExceptionMapper.messageFor(409, "x")).isEqualTo("Request failed");
        }

        @Test
        void shouldFallBackWhenBadRequestHasNoMessage() {
            assertThat(GlobalExceptionMapper.messageFor(400, null)).isEqualTo("Bad request");
        }
    }
}
