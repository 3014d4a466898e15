package io.nexus.server.api;

import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/// Global exception mapper that keeps stack traces out of responses.
///
/// Client errors keep their status with a generic message; anything else
/// becomes a 500. Full stack traces are logged server-side.
///
/// ```json
/// {"error": "Resource not found", "status": 404}
/// ```
///
/// @implNote Thread-safe. Stateless.
@Provider
public class GlobalExceptionMapper implements ExceptionMapper<Throwable> {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMapper.class);

    @Override
    public Response toResponse(Throwable exception) {
        int status =
                exception instanceof WebApplicationException wae
                        ? wae.getResponse().getStatus()
                        : 500;

        if (status >= 500) {
            LOG.errorv(exception, "Unhandled exception: {0}", exception.getMessage());
        } else {
            LOG.debugv("Client error {0}: {1}", status, exception.getMessage());
        }

        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(ErrorResponse.of(status, messageFor(status, exception.getMessage())))
                .build();
    }

    static String messageFor(int status, String raw) {
        return switch (status) {
            case 400 -> raw != null ? raw : "Bad request";
            case 404 -> "Resource not found";
            case 405 -> "Method not allowed";
            case 406 -> "Not acceptable";
            case 415 -> "Unsupported media type";
            default -> {
                if (status >= 500) yield "Internal server error";
                yield "Request failed";
            }
        };
    }
}
