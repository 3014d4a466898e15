package io.nexus.core.session;

import java.util.Objects;

/// A configured downstream tool server.
///
/// The `name` identifies the server in routes, logs and health reports and
/// must be unique among configured endpoints.
///
/// @param name stable endpoint name, not null or blank
/// @param address transport address, for example `http://localhost:8000/sse`, not null or blank
public record DownstreamEndpoint(String name, String address) {

    public DownstreamEndpoint {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(address, "address must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Endpoint name must not be blank");
        }
        if (address.isBlank()) {
            throw new IllegalArgumentException("Address of endpoint '" + name + "' must not be blank");
        }
        name = name.strip();
        address = address.strip();
    }

    /// Parses an endpoint from a `name=address` configuration entry.
    ///
    /// Only the first `=` separates name from address, so addresses carrying
    /// query parameters are preserved.
    ///
    /// @param entry configuration entry, not null
    /// @return parsed endpoint, never null
    /// @throws IllegalArgumentException if the entry has no `=` or a blank part
    public static DownstreamEndpoint parse(String entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        int separator = entry.indexOf('=');
        if (separator < 0) {
            throw new IllegalArgumentException(
                    "Invalid downstream server entry '" + entry + "', expected name=address");
        }
        return new DownstreamEndpoint(
                entry.substring(0, separator), entry.substring(separator + 1));
    }
}
