package io.nexus.core.introspect;

import io.nexus.core.routing.DownstreamSession;
import java.util.List;

/// Router health with per-downstream connection status.
///
/// The router reports itself as `healthy` whenever it can answer; the state
/// of each downstream server is listed separately.
///
/// @param routerStatus overall status, always `healthy`
/// @param downstreamServers one entry per configured endpoint in configuration order
public record HealthReport(String routerStatus, List<ServerStatus> downstreamServers) {

    public static final String HEALTHY = "healthy";

    public HealthReport {
        downstreamServers = downstreamServers != null ? List.copyOf(downstreamServers) : List.of();
    }

    /// Builds a report from the configured sessions.
    ///
    /// @param sessions sessions in configuration order, not null
    /// @return new report, never null
    public static HealthReport from(List<DownstreamSession> sessions) {
        List<ServerStatus> servers =
                sessions.stream()
                        .map(
                                session ->
                                        new ServerStatus(
                                                session.name(),
                                                session.endpoint().address(),
                                                session.isReady(),
                                                session.declaredTools().size(),
                                                session.failureMessage()))
                        .toList();
        return new HealthReport(HEALTHY, servers);
    }

    /// Status of one downstream server.
    ///
    /// @param server endpoint name
    /// @param address endpoint address
    /// @param connected whether the session is ready
    /// @param toolsCount number of tools the server declared
    /// @param error failure message of the last failed connect, may be null
    public record ServerStatus(
            String server, String address, boolean connected, int toolsCount, String error) {}
}
