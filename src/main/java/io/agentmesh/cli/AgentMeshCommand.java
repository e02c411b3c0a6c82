package io.agentmesh.cli;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentmesh.agent.Agent;
import io.agentmesh.agent.EchoAgent;
import io.agentmesh.agent.FailAgent;
import io.agentmesh.config.MeshConfig;
import io.agentmesh.config.MeshSettings;
import io.agentmesh.memory.MemoryFilter;
import io.agentmesh.memory.MemoryManager;
import io.agentmesh.memory.WorkingMemoryStore;
import io.agentmesh.model.MemoryItem;
import io.agentmesh.model.MemoryType;
import io.agentmesh.observability.AuditLogger;
import io.agentmesh.runtime.AgentMeshNode;
import io.agentmesh.storage.Database;
import io.agentmesh.storage.SqliteMemoryStore;
import io.agentmesh.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "agentmesh",
        mixinStandardHelpOptions = true,
        description = "AgentMesh single-node agent orchestration CLI",
        subcommands = {
                AgentMeshCommand.InitCommand.class,
                AgentMeshCommand.ShellCommand.class,
                AgentMeshCommand.MemoryCommand.class
        }
)
public final class AgentMeshCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | shell | memory");
    }

    MeshConfig config() {
        return MeshConfig.fromRoot(root);
    }

    /** Settings with the memory path defaulting to the root's SQLite file. */
    MeshSettings settings() {
        MeshConfig config = config();
        MeshSettings settings = MeshSettings.load(config);
        if (settings.memoryPath() == null) {
            settings = settings.withMemoryPath(config.memoryDbFile().toString());
        }
        return settings;
    }

    AuditLogger auditLogger() {
        return new AuditLogger(config().auditFile(), "cli");
    }

    MemoryManager openMemory() {
        Database database = new Database(Path.of(settings().memoryPath()));
        return new MemoryManager(SqliteMemoryStore.open(database), new WorkingMemoryStore(), auditLogger());
    }

    @Command(name = "init", description = "Create the data directory layout and memory schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        AgentMeshCommand parent;

        @Override
        public Integer call() throws Exception {
            MeshConfig config = parent.config();
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
            new Database(Path.of(parent.settings().memoryPath())).init();
            System.out.println("Initialized AgentMesh at: " + config.rootDir());
            return 0;
        }
    }

    @Command(name = "shell", description = "Start a node with the sample agents and open the operator console")
    static final class ShellCommand implements Callable<Integer> {
        @ParentCommand
        AgentMeshCommand parent;

        @Option(names = {"--task-wait-ms"}, description = "How long 'task' waits for an outcome", defaultValue = "60000")
        long taskWaitMs;

        @Option(names = {"--echo-agents"}, description = "Number of echo agents", defaultValue = "2")
        int echoAgents;

        @Override
        public Integer call() throws Exception {
            List<Agent> agents = new ArrayList<>();
            for (int i = 0; i < Math.max(0, echoAgents); i++) {
                agents.add(new EchoAgent());
            }
            agents.add(new FailAgent());
            try (AgentMeshNode node = new AgentMeshNode(parent.settings(), parent.auditLogger(), agents)) {
                node.start();
                ConsoleSession session = new ConsoleSession(node, System.out, Duration.ofMillis(Math.max(1L, taskWaitMs)));
                session.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
            }
            return 0;
        }
    }

    @Command(
            name = "memory",
            description = "Inspect and edit durable memory",
            subcommands = {
                    MemoryStatsCommand.class,
                    MemoryGetCommand.class,
                    MemoryPutCommand.class,
                    MemoryListCommand.class,
                    MemoryDeleteCommand.class
            }
    )
    static final class MemoryCommand implements Runnable {
        @ParentCommand
        AgentMeshCommand parent;

        @Override
        public void run() {
            System.out.println("Use subcommands: stats | get | put | list | delete");
        }
    }

    @Command(name = "stats", description = "Per-type item counts and age bounds")
    static final class MemoryStatsCommand implements Callable<Integer> {
        @ParentCommand
        MemoryCommand parent;

        @Override
        public Integer call() {
            try (MemoryManager memory = parent.parent.openMemory()) {
                System.out.println(Jsons.toJson(memory.stats()));
            }
            return 0;
        }
    }

    @Command(name = "get", description = "Print one memory item")
    static final class MemoryGetCommand implements Callable<Integer> {
        @ParentCommand
        MemoryCommand parent;

        @Parameters(index = "0", description = "Memory type")
        String type;

        @Parameters(index = "1", description = "Item key")
        String key;

        @Override
        public Integer call() {
            try (MemoryManager memory = parent.parent.openMemory()) {
                return memory.retrieve(durableType(type), key)
                        .map(item -> {
                            System.out.println(Jsons.toJson(item));
                            return 0;
                        })
                        .orElseGet(() -> {
                            System.out.println("Memory not found: " + type + "/" + key);
                            return 1;
                        });
            }
        }
    }

    @Command(name = "put", description = "Store a durable memory item")
    static final class MemoryPutCommand implements Callable<Integer> {
        @ParentCommand
        MemoryCommand parent;

        @Parameters(index = "0", description = "Memory type")
        String type;

        @Parameters(index = "1", description = "Item key")
        String key;

        @Parameters(index = "2", description = "Value as JSON (plain text is stored as a string)")
        String value;

        @Option(names = {"--meta"}, description = "Metadata entry name=value, repeatable")
        Map<String, String> metadata = new LinkedHashMap<>();

        @Override
        public Integer call() {
            try (MemoryManager memory = parent.parent.openMemory()) {
                MemoryItem item = memory.store(durableType(type), key, Jsons.parseLenient(value), null, metadata);
                System.out.println(Jsons.toJson(item));
            }
            return 0;
        }
    }

    @Command(name = "list", description = "List memory items oldest first")
    static final class MemoryListCommand implements Callable<Integer> {
        @ParentCommand
        MemoryCommand parent;

        @Parameters(index = "0", description = "Memory type")
        String type;

        @Option(names = {"--prefix"}, description = "Key prefix")
        String prefix;

        @Option(names = {"--field"}, description = "Value field match name=value, repeatable")
        Map<String, String> fields = new LinkedHashMap<>();

        @Option(names = {"--limit"}, description = "Maximum items", defaultValue = "100")
        int limit;

        @Override
        public Integer call() {
            MemoryFilter.Builder filter = MemoryFilter.builder().keyPrefix(prefix).limit(Math.max(0, limit));
            for (Map.Entry<String, String> e : fields.entrySet()) {
                filter.field(e.getKey(), e.getValue());
            }
            try (MemoryManager memory = parent.parent.openMemory()) {
                List<MemoryItem> items = new ArrayList<>();
                for (MemoryItem item : memory.list(durableType(type), filter.build())) {
                    items.add(item);
                }
                ObjectNode out = Jsons.object();
                out.put("type", durableType(type).name());
                out.put("count", items.size());
                out.set("items", Jsons.tree(items));
                System.out.println(Jsons.toJson(out));
            }
            return 0;
        }
    }

    @Command(name = "delete", description = "Delete one memory item")
    static final class MemoryDeleteCommand implements Callable<Integer> {
        @ParentCommand
        MemoryCommand parent;

        @Parameters(index = "0", description = "Memory type")
        String type;

        @Parameters(index = "1", description = "Item key")
        String key;

        @Override
        public Integer call() {
            try (MemoryManager memory = parent.parent.openMemory()) {
                boolean deleted = memory.delete(durableType(type), key);
                System.out.println(deleted ? "Deleted " + type + "/" + key : "Memory not found: " + type + "/" + key);
                return deleted ? 0 : 1;
            }
        }
    }

    static MemoryType durableType(String raw) {
        MemoryType type = MemoryType.fromString(raw);
        if (!type.durable()) {
            throw new IllegalArgumentException("WORKING memory lives inside a running node; use a durable type");
        }
        return type;
    }
}
