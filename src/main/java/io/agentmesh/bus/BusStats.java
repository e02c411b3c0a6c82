package io.agentmesh.bus;

public record BusStats(
        String endpoint,
        long published,
        long delivered,
        long redelivered,
        long deadLettered,
        long unrouted,
        int subscriptions
) {
}
