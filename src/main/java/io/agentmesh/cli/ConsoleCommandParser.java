package io.agentmesh.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

final class ConsoleCommandParser {
    static final Set<String> OPERATIONS = Set.of("task", "ping", "status", "memory-stats", "help", "quit");

    private ConsoleCommandParser() {
    }

    static ConsoleCommand parse(String raw) {
        List<String> tokens = parseTokens(raw);
        if (tokens.isEmpty()) {
            return ConsoleCommand.empty();
        }
        String op = tokens.get(0).toLowerCase(Locale.ROOT);
        if ("exit".equals(op)) {
            op = "quit";
        }
        if (!OPERATIONS.contains(op)) {
            return ConsoleCommand.invalid("unknown command: " + tokens.get(0));
        }
        switch (op) {
            case "task":
                if (tokens.size() < 3) {
                    return ConsoleCommand.invalid("usage: task <capability> <description...>");
                }
                return new ConsoleCommand(op, List.of(tokens.get(1), joinTail(tokens, 2)), null);
            case "ping":
                if (tokens.size() != 2) {
                    return ConsoleCommand.invalid("usage: ping <agent_id>");
                }
                return new ConsoleCommand(op, List.of(tokens.get(1)), null);
            default:
                return new ConsoleCommand(op, List.of(), null);
        }
    }

    static List<String> parseTokens(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return out;
        }
        for (String token : raw.trim().split("\\s+")) {
            if (token != null && !token.isBlank()) {
                out.add(token.trim());
            }
        }
        return out;
    }

    static String joinTail(List<String> tokens, int startIndex) {
        if (tokens == null || tokens.isEmpty() || startIndex >= tokens.size()) {
            return "";
        }
        return String.join(" ", tokens.subList(startIndex, tokens.size()));
    }

    record ConsoleCommand(String op, List<String> args, String error) {
        static ConsoleCommand empty() {
            return new ConsoleCommand("", List.of(), null);
        }

        static ConsoleCommand invalid(String error) {
            return new ConsoleCommand("", List.of(), error);
        }

        boolean valid() {
            return error == null;
        }

        boolean blank() {
            return error == null && op.isEmpty();
        }
    }
}
