package io.agentmesh.orchestrator;

import io.agentmesh.bus.BusStats;
import io.agentmesh.model.AgentRecord;
import io.agentmesh.model.TaskStatus;

import java.util.List;
import java.util.Map;

public record StatusReport(
        List<AgentRecord> agents,
        Map<TaskStatus, Long> taskCounts,
        BusStats bus,
        long generatedAtMs
) {
    public StatusReport {
        agents = List.copyOf(agents);
        taskCounts = Map.copyOf(taskCounts);
    }
}
