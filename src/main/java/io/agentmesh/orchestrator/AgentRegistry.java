package io.agentmesh.orchestrator;

import io.agentmesh.model.AgentRecord;
import io.agentmesh.model.AgentStatus;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live agent records. Each record has its own monitor, so updates for one agent
 * never wait on another.
 */
public final class AgentRegistry {
    private static final Comparator<AgentRecord> DISPATCH_ORDER = Comparator
            .comparingLong(AgentRecord::registeredAtMs)
            .thenComparing(AgentRecord::agentId);

    private final Map<String, Entry> agents = new ConcurrentHashMap<>();

    public AgentRecord register(String agentType, Set<String> capabilities, long nowMs) {
        if (agentType == null || agentType.isBlank()) {
            throw new IllegalArgumentException("agent type cannot be empty");
        }
        if (capabilities == null || capabilities.isEmpty()) {
            throw new IllegalArgumentException("agent must declare at least one capability");
        }
        String agentId = agentType.trim() + "-" + UUID.randomUUID().toString().substring(0, 8);
        Entry entry = new Entry(agentId, agentType.trim(), Set.copyOf(capabilities), nowMs);
        agents.put(agentId, entry);
        return entry.snapshot();
    }

    public Optional<AgentRecord> find(String agentId) {
        Entry entry = agentId == null ? null : agents.get(agentId);
        return entry == null ? Optional.empty() : Optional.of(entry.snapshot());
    }

    /**
     * Applies a liveness signal. STOPPED records stay stopped.
     *
     * @return the status before the update, empty for unknown ids
     */
    public Optional<AgentStatus> heartbeat(String agentId, AgentStatus reported, long nowMs) {
        Entry entry = agentId == null ? null : agents.get(agentId);
        if (entry == null) {
            return Optional.empty();
        }
        return Optional.of(entry.heartbeat(reported, nowMs));
    }

    /** @return the status before the update, empty for unknown ids */
    public Optional<AgentStatus> markStopped(String agentId) {
        Entry entry = agentId == null ? null : agents.get(agentId);
        if (entry == null) {
            return Optional.empty();
        }
        return Optional.of(entry.stop());
    }

    /** Marks silent records UNHEALTHY and returns the ids that changed. */
    public List<String> sweep(long nowMs, long timeoutMs) {
        List<String> changed = new ArrayList<>();
        for (Entry entry : agents.values()) {
            if (entry.expire(nowMs, timeoutMs)) {
                changed.add(entry.agentId);
            }
        }
        return changed;
    }

    /**
     * READY records with the capability, in dispatch order. A record silent for
     * more than {@code timeoutMs} is left out even before the sweep marks it.
     */
    public List<AgentRecord> eligible(String capability, long nowMs, long timeoutMs) {
        List<AgentRecord> out = new ArrayList<>();
        for (Entry entry : agents.values()) {
            AgentRecord record = entry.snapshot();
            if (record.eligibleFor(capability) && nowMs - record.lastHeartbeatMs() <= timeoutMs) {
                out.add(record);
            }
        }
        out.sort(DISPATCH_ORDER);
        return out;
    }

    public List<AgentRecord> all() {
        List<AgentRecord> out = new ArrayList<>();
        for (Entry entry : agents.values()) {
            out.add(entry.snapshot());
        }
        out.sort(DISPATCH_ORDER);
        return out;
    }

    private static final class Entry {
        private final String agentId;
        private final String agentType;
        private final Set<String> capabilities;
        private final long registeredAtMs;
        private AgentStatus status;
        private long lastHeartbeatMs;

        Entry(String agentId, String agentType, Set<String> capabilities, long nowMs) {
            this.agentId = agentId;
            this.agentType = agentType;
            this.capabilities = capabilities;
            this.registeredAtMs = nowMs;
            this.status = AgentStatus.STARTING;
            this.lastHeartbeatMs = nowMs;
        }

        synchronized AgentStatus heartbeat(AgentStatus reported, long nowMs) {
            AgentStatus previous = status;
            if (status == AgentStatus.STOPPED) {
                return previous;
            }
            lastHeartbeatMs = Math.max(lastHeartbeatMs, nowMs);
            status = reported == AgentStatus.BUSY ? AgentStatus.BUSY : AgentStatus.READY;
            return previous;
        }

        synchronized AgentStatus stop() {
            AgentStatus previous = status;
            status = AgentStatus.STOPPED;
            return previous;
        }

        synchronized boolean expire(long nowMs, long timeoutMs) {
            if (status == AgentStatus.STOPPED || status == AgentStatus.UNHEALTHY) {
                return false;
            }
            if (nowMs - lastHeartbeatMs <= timeoutMs) {
                return false;
            }
            status = AgentStatus.UNHEALTHY;
            return true;
        }

        synchronized AgentRecord snapshot() {
            return new AgentRecord(agentId, agentType, capabilities, status, lastHeartbeatMs, registeredAtMs);
        }
    }
}
