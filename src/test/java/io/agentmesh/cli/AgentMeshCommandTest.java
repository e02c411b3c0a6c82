package io.agentmesh.cli;

import io.agentmesh.TestSupport;
import io.agentmesh.config.MeshConfig;
import io.agentmesh.memory.MemoryManager;
import io.agentmesh.model.MemoryItem;
import io.agentmesh.model.MemoryType;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;

final class AgentMeshCommandTest {

    @Test
    void memorySubcommandsEditSqliteUnderRoot() throws Exception {
        Path root = Files.createTempDirectory("agentmesh-test-cli");
        try {
            String rootArg = "--root=" + root;
            Assertions.assertEquals(0, execute(rootArg, "init"));
            Assertions.assertTrue(Files.exists(MeshConfig.fromRoot(root.toString()).memoryDbFile()));

            Assertions.assertEquals(0, execute(rootArg, "memory", "put", "semantic", "fact/sky",
                    "{\"color\":\"blue\"}", "--meta", "source=operator"));
            Assertions.assertEquals(0, execute(rootArg, "memory", "get", "semantic", "fact/sky"));
            Assertions.assertEquals(0, execute(rootArg, "memory", "list", "semantic", "--field", "color=BLU"));
            Assertions.assertEquals(0, execute(rootArg, "memory", "stats"));

            AgentMeshCommand command = new AgentMeshCommand();
            command.root = root.toString();
            try (MemoryManager memory = command.openMemory()) {
                MemoryItem item = memory.require(MemoryType.SEMANTIC, "fact/sky");
                Assertions.assertEquals("blue", item.value().path("color").asText());
                Assertions.assertEquals("operator", item.metadata().get("source"));
            }

            Assertions.assertEquals(0, execute(rootArg, "memory", "delete", "semantic", "fact/sky"));
            Assertions.assertEquals(1, execute(rootArg, "memory", "get", "semantic", "fact/sky"));
            Assertions.assertEquals(1, execute(rootArg, "memory", "delete", "semantic", "fact/sky"));
        } finally {
            TestSupport.deleteRecursively(root);
        }
    }

    @Test
    void workingMemoryIsNotEditableFromCli() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> AgentMeshCommand.durableType("working"));
        Assertions.assertEquals(MemoryType.PROCEDURAL, AgentMeshCommand.durableType("procedural"));
    }

    private static int execute(String... args) {
        return new CommandLine(new AgentMeshCommand()).execute(args);
    }
}
