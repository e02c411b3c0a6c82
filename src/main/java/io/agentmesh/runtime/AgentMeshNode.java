package io.agentmesh.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentmesh.agent.Agent;
import io.agentmesh.agent.AgentRuntime;
import io.agentmesh.bus.BrokerMessageBus;
import io.agentmesh.bus.BusTransport;
import io.agentmesh.bus.BusTransports;
import io.agentmesh.config.MeshSettings;
import io.agentmesh.memory.InMemoryDurableStore;
import io.agentmesh.memory.MemoryManager;
import io.agentmesh.memory.MemoryStore;
import io.agentmesh.memory.WorkingMemoryStore;
import io.agentmesh.model.TaskView;
import io.agentmesh.observability.AuditLogger;
import io.agentmesh.orchestrator.Orchestrator;
import io.agentmesh.orchestrator.PingResult;
import io.agentmesh.orchestrator.StatusReport;
import io.agentmesh.storage.Database;
import io.agentmesh.storage.SqliteMemoryStore;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One mesh process: broker transport, orchestrator, shared memory and a static
 * set of agent runtimes.
 */
public final class AgentMeshNode implements AutoCloseable {
    private final MeshSettings settings;
    private final AuditLogger auditLogger;
    private final BusTransport transport;
    private final BrokerMessageBus orchestratorBus;
    private final MemoryManager memory;
    private final Orchestrator orchestrator;
    private final List<BrokerMessageBus> agentBuses = new ArrayList<>();
    private final List<AgentRuntime> runtimes = new ArrayList<>();
    private boolean started;
    private boolean closed;

    public AgentMeshNode(MeshSettings settings, AuditLogger auditLogger, List<Agent> agents) {
        this.settings = settings;
        this.auditLogger = auditLogger == null ? AuditLogger.discarding() : auditLogger;
        this.transport = BusTransports.open(settings.brokerUrl(), settings.redeliveryLimit(), this.auditLogger);
        this.orchestratorBus = BrokerMessageBus.fromSettings(transport, Orchestrator.ACTOR, settings, this.auditLogger);
        this.memory = new MemoryManager(openDurableStore(settings), new WorkingMemoryStore(), this.auditLogger);
        this.orchestrator = new Orchestrator(orchestratorBus, settings, this.auditLogger);
        int seq = 0;
        for (Agent agent : agents) {
            seq++;
            BrokerMessageBus agentBus = BrokerMessageBus.fromSettings(
                    transport, "agent-" + agent.agentType() + "-" + seq, settings, this.auditLogger);
            agentBuses.add(agentBus);
            runtimes.add(new AgentRuntime(agent, agentBus, memory, settings, this.auditLogger));
        }
    }

    private static MemoryStore openDurableStore(MeshSettings settings) {
        if (settings.memoryPath() == null || settings.memoryPath().isBlank()) {
            return new InMemoryDurableStore();
        }
        return SqliteMemoryStore.open(new Database(Path.of(settings.memoryPath())));
    }

    /**
     * Starts the sweeper, the orchestrator and every runtime in order. If any
     * step throws, the node is closed before the error propagates.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("Node is closed");
        }
        if (started) {
            return;
        }
        try {
            memory.startSweeper(Duration.ofMillis(settings.memorySweepIntervalMs()));
            orchestrator.start();
            for (AgentRuntime runtime : runtimes) {
                runtime.start();
            }
        } catch (RuntimeException e) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "node.start",
                    "node",
                    transport.endpoint(),
                    "failed",
                    Map.of("error", String.valueOf(e.getMessage()))
            ));
            close();
            throw e;
        }
        started = true;
        auditLogger.log(AuditLogger.AuditEvent.of(
                "node.start",
                "node",
                transport.endpoint(),
                "ok",
                Map.of(
                        "agents", runtimes.size(),
                        "memory", settings.memoryPath() == null ? "in-memory" : settings.memoryPath()
                )
        ));
    }

    public String submit(String capability, JsonNode description) {
        return orchestrator.submitTask(description, capability);
    }

    public TaskView awaitTask(String taskId, Duration timeout) {
        return orchestrator.awaitTask(taskId, timeout);
    }

    public Optional<PingResult> ping(String agentId) {
        return orchestrator.ping(agentId);
    }

    public StatusReport status() {
        return orchestrator.status();
    }

    public MemoryManager memory() {
        return memory;
    }

    public Orchestrator orchestrator() {
        return orchestrator;
    }

    public List<AgentRuntime> runtimes() {
        return List.copyOf(runtimes);
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (AgentRuntime runtime : runtimes) {
            runtime.close();
        }
        orchestrator.close();
        for (BrokerMessageBus agentBus : agentBuses) {
            agentBus.close();
        }
        orchestratorBus.close();
        transport.close();
        memory.close();
        auditLogger.log(AuditLogger.AuditEvent.of("node.stop", "node", transport.endpoint(), "ok", Map.of()));
    }
}
