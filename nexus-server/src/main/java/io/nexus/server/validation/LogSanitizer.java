package io.nexus.server.validation;

/// Makes user-controlled strings safe to log.
///
/// Queries, endpoint data and tool tokens can carry `\r` / `\n`, which would
/// let a caller forge log entries, and queries can be long. Apply before
/// passing such values to a logger:
/// ```
/// LOG.infov("Query received: {0}", LogSanitizer.abbreviate(request.query(), 100));
/// ```
public final class LogSanitizer {

    private LogSanitizer() {}

    /// Removes carriage-return and newline characters from the input.
    ///
    /// @param value the string to sanitize, may be null
    /// @return sanitized string, or {@code "null"} if input is null
    public static String sanitize(String value) {
        if (value == null) {
            return "null";
        }
        return value.replace("\r", "").replace("\n", "");
    }

    /// Sanitizes and truncates the input.
    ///
    /// @param value the string to sanitize, may be null
    /// @param maxLength maximum length of the returned text before the ellipsis, positive
    /// @return sanitized text, suffixed with `...` when truncated
    public static String abbreviate(String value, int maxLength) {
        String clean = sanitize(value);
        return clean.length() > maxLength ? clean.substring(0, maxLength) + "..." : clean;
    }
}
