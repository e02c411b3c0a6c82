package io.agentmesh.bus;

import io.agentmesh.observability.AuditLogger;

import java.net.URI;
import java.net.URISyntaxException;

public final class BusTransports {
    private BusTransports() {
    }

    /**
     * Opens the transport for a broker URL. Only {@code memory://} is bundled;
     * other schemes are a startup configuration error.
     */
    public static BusTransport open(String brokerUrl, int redeliveryLimit, AuditLogger auditLogger) {
        if (brokerUrl == null || brokerUrl.isBlank()) {
            throw new IllegalArgumentException("broker URL is required");
        }
        URI uri;
        try {
            uri = new URI(brokerUrl.trim());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid broker URL: " + brokerUrl, e);
        }
        String scheme = uri.getScheme();
        if (InMemoryBroker.SCHEME.equalsIgnoreCase(scheme)) {
            return new InMemoryBroker(brokerUrl.trim(), redeliveryLimit, auditLogger);
        }
        throw new IllegalArgumentException("Unsupported broker URL scheme: " + scheme + " (supported: memory)");
    }
}
