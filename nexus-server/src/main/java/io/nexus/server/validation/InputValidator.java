package io.nexus.server.validation;

import java.util.regex.Pattern;

/// Shared input validation predicates for the REST API boundary.
///
/// ### Dangerous Control Characters
/// Null bytes and non-printable control characters
/// (U+0000–U+0008, U+000B, U+000C, U+000E–U+001F, U+007F)
/// are rejected. TAB, LF, and CR are permitted in queries.
///
/// @see ValidQueryValidator
public final class InputValidator {

    /// Control characters that are never legitimate in user content.
    /// Excludes TAB (0x09), LF (0x0A), CR (0x0D) which are valid in free text.
    static final Pattern DANGEROUS_CONTROL =
            Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");

    /// Maximum accepted query length in characters.
    public static final int MAX_QUERY_LENGTH = 10_000;

    private InputValidator() {}

    /// Checks whether the value contains dangerous control characters.
    ///
    /// @param value the string to check, may be null
    /// @return {@code true} if the value contains illegal control characters
    public static boolean containsDangerousChars(String value) {
        return value != null && DANGEROUS_CONTROL.matcher(value).find();
    }

    /// Checks whether the value is longer than the given limit.
    ///
    /// @param value the string to measure, may be null
    /// @param maxLength the maximum allowed length in characters
    /// @return {@code true} if the value exceeds the limit
    public static boolean exceedsLength(String value, int maxLength) {
        return value != null && value.length() > maxLength;
    }
}
