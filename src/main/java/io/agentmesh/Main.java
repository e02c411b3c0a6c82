package io.agentmesh;

import io.agentmesh.cli.AgentMeshCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new AgentMeshCommand()).execute(args);
        System.exit(code);
    }
}
