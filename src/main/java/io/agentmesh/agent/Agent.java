package io.agentmesh.agent;

import java.util.List;
import java.util.Set;

/**
 * Business logic of one agent kind. The runtime owns the lifecycle; an
 * implementation only declares what it can do and handles messages.
 */
public interface Agent {
    String agentType();

    Set<String> capabilities();

    /** Extra event topics the runtime subscribes to besides the dispatch topic. */
    default List<String> subscriptions() {
        return List.of();
    }

    AgentResult receive(AgentContext context) throws Exception;
}
