package io.agentmesh.model;

import com.fasterxml.jackson.databind.JsonNode;

public record TaskView(
        String taskId,
        JsonNode description,
        String requiredCapability,
        TaskStatus status,
        String assignedAgent,
        int attempts,
        String lastError,
        JsonNode result,
        long submittedAtMs,
        long updatedAtMs,
        long deadlineAtMs
) {
}
