package io.agentmesh.bus;

public final class BusUnavailableException extends RuntimeException {
    public BusUnavailableException(String message) {
        super(message);
    }

    public BusUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
