package io.agentmesh.bus;

/**
 * Well-known topics. Names follow {@code <domain>.<event>}.
 */
public final class Topics {
    public static final String AGENT_HEARTBEAT = "agent.heartbeat";
    public static final String AGENT_STATUS = "agent.status";
    public static final String AGENT_STOPPED = "agent.stopped";
    public static final String AGENT_ERROR = "agent.error";
    public static final String AGENT_UNHEALTHY = "agent.unhealthy";
    public static final String ORCHESTRATOR_REGISTER = "orchestrator.register";
    public static final String TASK_COMPLETED = "task.completed";
    public static final String TASK_FAILED = "task.failed";
    public static final String SYSTEM_STATS = "system.stats";
    public static final String REPLY_PREFIX = "_reply.";

    private Topics() {
    }

    public static String dispatch(String agentId) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId is required for dispatch topic");
        }
        return "agent." + agentId + ".dispatch";
    }

    public static boolean isReplyTopic(String topic) {
        return topic != null && topic.startsWith(REPLY_PREFIX);
    }
}
