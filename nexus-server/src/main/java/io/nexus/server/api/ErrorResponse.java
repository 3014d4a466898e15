package io.nexus.server.api;

/// JSON error body returned by every exception mapper.
///
/// @param error human-readable message, never a stack trace
/// @param status the HTTP status code
public record ErrorResponse(String error, int status) {

    public static ErrorResponse of(int status, String error) {
        return new ErrorResponse(error, status);
    }
}
