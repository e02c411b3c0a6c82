package io.agentmesh.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentmesh.model.TaskView;
import io.agentmesh.orchestrator.PingResult;
import io.agentmesh.orchestrator.TaskFailedException;
import io.agentmesh.runtime.AgentMeshNode;
import io.agentmesh.util.Jsons;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.time.Duration;
import java.util.Optional;

/**
 * Line-oriented operator console over a running node.
 */
final class ConsoleSession {
    private static final String HELP = String.join(System.lineSeparator(),
            "Commands:",
            "  task <capability> <description...>  submit a task and wait for its outcome",
            "  ping <agent_id>                     show agent liveness",
            "  status                              registry, task counts and bus stats",
            "  memory-stats                        per-type memory statistics",
            "  help                                this text",
            "  quit                                leave the console");

    private final AgentMeshNode node;
    private final PrintStream out;
    private final Duration taskWait;

    ConsoleSession(AgentMeshNode node, PrintStream out, Duration taskWait) {
        this.node = node;
        this.out = out;
        this.taskWait = taskWait;
    }

    void run(BufferedReader in) throws IOException {
        out.println("agentmesh console; type 'help' for commands");
        out.print("> ");
        out.flush();
        String line;
        while ((line = in.readLine()) != null) {
            if (!execute(line)) {
                return;
            }
            out.print("> ");
            out.flush();
        }
    }

    /** Runs one console line. Returns {@code false} when the session should end. */
    boolean execute(String line) {
        ConsoleCommandParser.ConsoleCommand command = ConsoleCommandParser.parse(line);
        if (!command.valid()) {
            out.println("error: " + command.error());
            return true;
        }
        if (command.blank()) {
            return true;
        }
        switch (command.op()) {
            case "task" -> runTask(command.args().get(0), command.args().get(1));
            case "ping" -> runPing(command.args().get(0));
            case "status" -> out.println(Jsons.toJson(node.status()));
            case "memory-stats" -> out.println(Jsons.toJson(node.memory().stats()));
            case "help" -> out.println(HELP);
            case "quit" -> {
                return false;
            }
            default -> out.println("error: unsupported command " + command.op());
        }
        return true;
    }

    private void runTask(String capability, String rawDescription) {
        JsonNode description = Jsons.parseLenient(rawDescription);
        String taskId = node.submit(capability, description);
        out.println("submitted " + taskId);
        try {
            TaskView view = node.awaitTask(taskId, taskWait);
            out.println(Jsons.toJson(view));
        } catch (TaskFailedException e) {
            out.println("task failed: " + e.task().lastError());
        } catch (IllegalStateException e) {
            out.println("error: " + e.getMessage());
        }
    }

    private void runPing(String agentId) {
        Optional<PingResult> ping = node.ping(agentId);
        if (ping.isEmpty()) {
            out.println("unknown agent: " + agentId);
            return;
        }
        out.println(Jsons.toJson(ping.get()));
    }
}
