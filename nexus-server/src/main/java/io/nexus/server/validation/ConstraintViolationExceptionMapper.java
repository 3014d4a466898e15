package io.nexus.server.validation;

import io.nexus.server.api.ErrorResponse;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Path;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.util.stream.Collectors;
import org.jboss.logging.Logger;

/// Maps Bean Validation constraint violations to HTTP 400 JSON responses.
///
/// Replaces the built-in Quarkus mapper so that validation failures use the
/// same {@link ErrorResponse} shape as every other error:
/// ```json
/// {"error": "query: Query is required", "status": 400}
/// ```
///
/// @implNote Thread-safe. Stateless.
/// @see ValidQuery
@Provider
public class ConstraintViolationExceptionMapper
        implements ExceptionMapper<ConstraintViolationException> {

    private static final Logger LOG = Logger.getLogger(ConstraintViolationExceptionMapper.class);

    @Override
    public Response toResponse(ConstraintViolationException exception) {
        String message =
                exception.getConstraintViolations().stream()
                        .map(v -> leafName(v) + ": " + v.getMessage())
                        .sorted()
                        .collect(Collectors.joining("; "));

        LOG.debugv("Validation error: {0}", LogSanitizer.sanitize(message));

        return Response.status(Response.Status.BAD_REQUEST)
                .type(MediaType.APPLICATION_JSON)
                .entity(ErrorResponse.of(400, message))
                .build();
    }

    /// Returns the last node of the violation's property path, e.g. `query`
    /// for `ask.request.query`.
    private static String leafName(ConstraintViolation<?> violation) {
        String name = null;
        for (Path.Node node : violation.getPropertyPath()) {
            name = node.getName();
        }
        return name != null ? name : "request";
    }
}
