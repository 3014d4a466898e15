package io.nexus.server.config;

import io.nexus.core.Router;
import io.nexus.core.routing.DownstreamSession;
import io.nexus.core.session.DownstreamEndpoint;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import java.util.List;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/// Connects the configured downstream servers once the application starts.
///
/// Servers that cannot be reached are logged and reported unhealthy; the
/// router still starts and serves the tools of the servers that connected.
@ApplicationScoped
public class ServerBootstrap {

    private static final Logger LOG = Logger.getLogger(ServerBootstrap.class);

    private final Router router;
    private final Optional<List<String>> serverEntries;

    @Inject
    public ServerBootstrap(
            Router router,
            @ConfigProperty(name = "nexus.downstream.servers")
                    Optional<List<String>> serverEntries) {
        this.router = router;
        this.serverEntries = serverEntries;
    }

    void onStart(@Observes StartupEvent ev) {
        List<DownstreamEndpoint> endpoints = endpoints();
        if (endpoints.isEmpty()) {
            LOG.warn("No downstream servers configured (nexus.downstream.servers)");
        }

        LOG.infov("Connecting {0} downstream server(s)...", endpoints.size());
        List<DownstreamSession> sessions = router.connectAll(endpoints);

        long ready = sessions.stream().filter(DownstreamSession::isReady).count();
        for (DownstreamSession session : sessions) {
            if (session.isReady()) {
                LOG.infov(
                        "Connected to {0} ({1} tools)",
                        session.name(), session.declaredTools().size());
            } else {
                LOG.warnv(
                        "Could not connect to {0} at {1}: {2}",
                        session.name(), session.endpoint().address(), session.failureMessage());
            }
        }
        LOG.infov(
                "Router ready: {0}/{1} servers connected, {2} tools routed",
                ready, sessions.size(), router.catalog().size());
    }

    List<DownstreamEndpoint> endpoints() {
        return serverEntries.orElse(List.of()).stream()
                .filter(entry -> !entry.isBlank())
                .map(DownstreamEndpoint::parse)
                .toList();
    }
}
