package io.agentmesh.agent;

public final class AgentHandlerException extends RuntimeException {
    private final boolean fatal;

    public AgentHandlerException(String message, boolean fatal) {
        super(message);
        this.fatal = fatal;
    }

    public AgentHandlerException(String message, boolean fatal, Throwable cause) {
        super(message, cause);
        this.fatal = fatal;
    }

    public boolean fatal() {
        return fatal;
    }
}
