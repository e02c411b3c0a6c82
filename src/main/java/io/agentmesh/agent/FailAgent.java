package io.agentmesh.agent;

import java.util.Set;

public final class FailAgent implements Agent {
    public static final String TYPE = "fail";

    @Override
    public String agentType() {
        return TYPE;
    }

    @Override
    public Set<String> capabilities() {
        return Set.of("fail");
    }

    @Override
    public AgentResult receive(AgentContext context) {
        return AgentResult.fail("intentional failure from fail agent");
    }
}
