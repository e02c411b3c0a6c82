package io.agentmesh.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.agentmesh.TestSupport;
import io.agentmesh.agent.Agent;
import io.agentmesh.agent.AgentHandlerException;
import io.agentmesh.agent.AgentResult;
import io.agentmesh.agent.AgentRuntime;
import io.agentmesh.agent.EchoAgent;
import io.agentmesh.agent.FailAgent;
import io.agentmesh.agent.ScriptedAgent;
import io.agentmesh.bus.BrokerMessageBus;
import io.agentmesh.bus.InMemoryBroker;
import io.agentmesh.bus.RequestTimeoutException;
import io.agentmesh.bus.Topics;
import io.agentmesh.config.MeshSettings;
import io.agentmesh.memory.MemoryManager;
import io.agentmesh.model.AgentStatus;
import io.agentmesh.model.Message;
import io.agentmesh.model.TaskStatus;
import io.agentmesh.model.TaskView;
import io.agentmesh.observability.AuditLogger;
import io.agentmesh.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static io.agentmesh.TestSupport.waitUntil;

final class OrchestratorTest {
    private static final Duration WAIT = Duration.ofSeconds(5);

    private InMemoryBroker broker;
    private BrokerMessageBus control;
    private MemoryManager memory;
    private final List<AgentRuntime> runtimes = new ArrayList<>();
    private final List<BrokerMessageBus> buses = new ArrayList<>();
    private Orchestrator orchestrator;

    @BeforeEach
    void setUp() {
        broker = new InMemoryBroker("memory://test", 2, AuditLogger.discarding());
        control = new BrokerMessageBus(broker, "control", 3, 1L, 5L, AuditLogger.discarding());
        memory = MemoryManager.inMemory();
    }

    @AfterEach
    void tearDown() {
        for (AgentRuntime runtime : runtimes) {
            runtime.close();
        }
        if (orchestrator != null) {
            orchestrator.close();
        }
        for (BrokerMessageBus bus : buses) {
            bus.close();
        }
        control.close();
        broker.close();
        memory.close();
    }

    @Test
    void echoTaskCompletesAndAnnouncesCompletion() throws Exception {
        List<Message> completed = new CopyOnWriteArrayList<>();
        control.subscribe(Topics.TASK_COMPLETED, completed::add);
        MeshSettings settings = TestSupport.settings().build();
        startOrchestrator(settings);
        AgentRuntime echo = startAgent(new EchoAgent(), settings);

        String taskId = orchestrator.submitTask(TextNode.valueOf("hello mesh"), "echo");
        TaskView view = orchestrator.awaitTask(taskId, WAIT);

        Assertions.assertEquals(TaskStatus.COMPLETED, view.status());
        Assertions.assertEquals(echo.agentId(), view.assignedAgent());
        Assertions.assertEquals(0, view.attempts());
        Assertions.assertEquals("hello mesh", view.result().path("received").asText());
        Assertions.assertTrue(waitUntil(() -> completed.size() == 1, WAIT));
        Assertions.assertEquals(taskId, completed.get(0).payload().path("task_id").asText());
        Assertions.assertEquals(TaskStatus.COMPLETED, orchestrator.getTask(taskId).orElseThrow().status());
    }

    @Test
    void taskWithoutEligibleAgentFailsAtDeadline() {
        startOrchestrator(TestSupport.settings().submissionDeadlineMs(200L).build());

        String taskId = orchestrator.submitTask(TextNode.valueOf("nobody home"), "translate");
        TaskFailedException error = Assertions.assertThrows(TaskFailedException.class, () -> orchestrator.awaitTask(taskId, WAIT));

        Assertions.assertTrue(error.getCause() instanceof NoEligibleAgentException);
        Assertions.assertEquals("translate", ((NoEligibleAgentException) error.getCause()).capability());
        Assertions.assertEquals(TaskStatus.FAILED, error.task().status());
        Assertions.assertEquals(0, error.task().attempts());
    }

    @Test
    void failingAgentExhaustsAttemptCeiling() throws Exception {
        List<Message> failed = new CopyOnWriteArrayList<>();
        control.subscribe(Topics.TASK_FAILED, failed::add);
        MeshSettings settings = TestSupport.settings().dispatchMaxAttempts(3).build();
        startOrchestrator(settings);
        startAgent(new FailAgent(), settings);

        String taskId = orchestrator.submitTask(TextNode.valueOf("x"), "fail");
        TaskFailedException error = Assertions.assertThrows(TaskFailedException.class, () -> orchestrator.awaitTask(taskId, WAIT));

        Assertions.assertTrue(error.getCause() instanceof AgentHandlerException);
        Assertions.assertEquals(3, error.task().attempts());
        Assertions.assertTrue(error.task().lastError().contains("intentional failure from fail agent"));
        Assertions.assertTrue(waitUntil(() -> failed.size() == 1, WAIT));
        Assertions.assertEquals(3, failed.get(0).payload().path("attempts").asInt());
    }

    @Test
    void failureCallbacksCanReadTheTaskFromAnotherThread() throws Exception {
        List<Message> failed = new CopyOnWriteArrayList<>();
        control.subscribe(Topics.TASK_FAILED, failed::add);
        MeshSettings settings = TestSupport.settings().dispatchMaxAttempts(1).submissionDeadlineMs(300L).build();
        startOrchestrator(settings);
        startAgent(new FailAgent(), settings);

        String noAgentTask = orchestrator.submitTask(TextNode.valueOf("nobody home"), "translate");
        CompletableFuture<TaskStatus> seenByNoAgentCallback = statusSeenFromOtherThread(noAgentTask);
        String failingTask = orchestrator.submitTask(TextNode.valueOf("x"), "fail");
        CompletableFuture<TaskStatus> seenByFailingCallback = statusSeenFromOtherThread(failingTask);

        Assertions.assertEquals(TaskStatus.FAILED, seenByNoAgentCallback.get(5, TimeUnit.SECONDS));
        Assertions.assertEquals(TaskStatus.FAILED, seenByFailingCallback.get(5, TimeUnit.SECONDS));
        Assertions.assertTrue(waitUntil(() -> failed.size() == 2, WAIT));
    }

    @Test
    void retryPrefersAgentThatHasNotFailedTheTask() throws Exception {
        MeshSettings settings = TestSupport.settings().dispatchMaxAttempts(2).build();
        startOrchestrator(settings);
        AtomicInteger flakyCalls = new AtomicInteger();
        startAgent(new ScriptedAgent("flaky", Set.of("work"), List.of(), context -> {
            flakyCalls.incrementAndGet();
            return AgentResult.fail("flaky refused");
        }), settings);
        AgentRuntime steady = startAgent(new ScriptedAgent("steady", Set.of("work"), List.of(),
                context -> AgentResult.ok(TextNode.valueOf("done"))), settings);

        int totalAttempts = 0;
        for (int i = 0; i < 4; i++) {
            String taskId = orchestrator.submitTask(TextNode.valueOf("job " + i), "work");
            TaskView view = orchestrator.awaitTask(taskId, WAIT);
            Assertions.assertEquals(TaskStatus.COMPLETED, view.status());
            Assertions.assertEquals(steady.agentId(), view.assignedAgent());
            totalAttempts += view.attempts();
        }
        Assertions.assertEquals(flakyCalls.get(), totalAttempts);
        Assertions.assertTrue(totalAttempts >= 1, "round robin never reached the flaky agent");
    }

    @Test
    void failedFirstPickIsRedispatchedToAnotherAgentWithOneAttempt() throws Exception {
        MeshSettings settings = TestSupport.settings().dispatchMaxAttempts(3).build();
        startOrchestrator(settings);
        AtomicInteger calls = new AtomicInteger();
        AtomicReference<String> failedBy = new AtomicReference<>();
        ScriptedAgent.Script failFirst = context -> {
            if (calls.getAndIncrement() == 0) {
                failedBy.set(context.agentId());
                return AgentResult.fail("first pick refused");
            }
            return AgentResult.ok(TextNode.valueOf("handled by " + context.agentId()));
        };
        AgentRuntime first = startAgent(new ScriptedAgent("worker-a", Set.of("work"), List.of(), failFirst), settings);
        AgentRuntime second = startAgent(new ScriptedAgent("worker-b", Set.of("work"), List.of(), failFirst), settings);

        String taskId = orchestrator.submitTask(TextNode.valueOf("job"), "work");
        TaskView view = orchestrator.awaitTask(taskId, WAIT);

        Assertions.assertEquals(TaskStatus.COMPLETED, view.status());
        Assertions.assertEquals(1, view.attempts());
        Assertions.assertEquals(2, calls.get());
        Assertions.assertTrue(Set.of(first.agentId(), second.agentId()).contains(failedBy.get()));
        Assertions.assertNotEquals(failedBy.get(), view.assignedAgent());
        Assertions.assertEquals("handled by " + view.assignedAgent(), view.result().asText());
    }

    @Test
    void responseTimeoutCountsAsFailedAttempt() throws Exception {
        MeshSettings settings = TestSupport.settings()
                .requestTimeoutMs(150L)
                .dispatchMaxAttempts(1)
                .shutdownGraceMs(100L)
                .build();
        startOrchestrator(settings);
        AgentRuntime slow = startAgent(new ScriptedAgent("slow", List.of(), context -> {
            Thread.sleep(400L);
            return AgentResult.ok(TextNode.valueOf("too late"));
        }), settings);

        String taskId = orchestrator.submitTask(TextNode.valueOf("x"), "slow");
        TaskFailedException error = Assertions.assertThrows(TaskFailedException.class, () -> orchestrator.awaitTask(taskId, WAIT));
        Assertions.assertTrue(error.getCause() instanceof RequestTimeoutException);
        Assertions.assertEquals(1, error.task().attempts());

        Assertions.assertTrue(waitUntil(() -> slow.inFlight() == 0, WAIT));
        Thread.sleep(100L);
        TaskView view = orchestrator.getTask(taskId).orElseThrow();
        Assertions.assertEquals(TaskStatus.FAILED, view.status());
        Assertions.assertNull(view.result());
    }

    @Test
    void silentAgentBecomesUnhealthyAndRecoversOnHeartbeat() throws Exception {
        MeshSettings settings = TestSupport.settings()
                .heartbeatIntervalMs(100L)
                .submissionDeadlineMs(100L)
                .build();
        List<Message> unhealthy = new CopyOnWriteArrayList<>();
        control.subscribe(Topics.AGENT_UNHEALTHY, unhealthy::add);
        startOrchestrator(settings);
        String ghost = orchestrator.register("ghost", Set.of("haunt"));

        Assertions.assertTrue(waitUntil(() -> status(ghost) == AgentStatus.UNHEALTHY, WAIT));
        Assertions.assertTrue(waitUntil(() -> unhealthy.size() == 1, WAIT));
        Assertions.assertEquals(ghost, unhealthy.get(0).payload().path("agent_id").asText());
        Assertions.assertEquals(settings.heartbeatTimeoutMs(), unhealthy.get(0).payload().path("timeout_ms").asLong());
        Assertions.assertTrue(unhealthy.get(0).payload().path("silence_ms").asLong() > settings.heartbeatTimeoutMs());
        String taskId = orchestrator.submitTask(TextNode.valueOf("boo"), "haunt");
        TaskFailedException error = Assertions.assertThrows(TaskFailedException.class, () -> orchestrator.awaitTask(taskId, WAIT));
        Assertions.assertTrue(error.getCause() instanceof NoEligibleAgentException);

        control.publish(Topics.AGENT_HEARTBEAT, heartbeat(ghost, "READY"));
        Assertions.assertTrue(waitUntil(() -> status(ghost) == AgentStatus.READY, WAIT));
    }

    @Test
    void sweepTickPublishesSystemStats() throws Exception {
        List<Message> stats = new CopyOnWriteArrayList<>();
        control.subscribe(Topics.SYSTEM_STATS, stats::add);
        MeshSettings settings = TestSupport.settings().build();
        startOrchestrator(settings);
        AgentRuntime echo = startAgent(new EchoAgent(), settings);
        orchestrator.register("ghost", Set.of("haunt"));
        String taskId = orchestrator.submitTask(TextNode.valueOf("count me"), "echo");
        orchestrator.awaitTask(taskId, WAIT);
        stats.clear();

        Assertions.assertTrue(waitUntil(() -> !stats.isEmpty(), WAIT));
        JsonNode latest = stats.get(stats.size() - 1).payload();
        Assertions.assertEquals(2, latest.path("agents").size());
        Assertions.assertTrue(latest.path("agents_online").asLong() >= 1L);
        Assertions.assertEquals(1L, latest.path("task_counts").path("COMPLETED").asLong());
        Assertions.assertTrue(latest.path("uptime_ms").asLong() >= 0L);
        Assertions.assertTrue(latest.path("bus_published").asLong() > 0L);
        boolean listsEcho = false;
        for (JsonNode row : latest.path("agents")) {
            listsEcho |= echo.agentId().equals(row.path("agent_id").asText());
        }
        Assertions.assertTrue(listsEcho);
    }

    @Test
    void heartbeatFromUnknownAgentIsIgnored() throws Exception {
        startOrchestrator(TestSupport.settings().heartbeatIntervalMs(1_000L).build());
        String known = orchestrator.register("worker", Set.of("work"));

        control.publish(Topics.AGENT_HEARTBEAT, heartbeat("stranger-1", "READY"));
        control.publish(Topics.AGENT_HEARTBEAT, heartbeat(known, "BUSY"));

        Assertions.assertTrue(waitUntil(() -> status(known) == AgentStatus.BUSY, WAIT));
        Assertions.assertEquals(1, orchestrator.agents().size());
        Assertions.assertTrue(orchestrator.ping("stranger-1").isEmpty());
    }

    @Test
    void deregisteredAgentStaysStopped() throws Exception {
        startOrchestrator(TestSupport.settings().heartbeatIntervalMs(1_000L).build());
        String agentId = orchestrator.register("worker", Set.of("work"));

        Assertions.assertTrue(orchestrator.deregister(agentId));
        Assertions.assertFalse(orchestrator.deregister("missing-agent"));
        control.publish(Topics.AGENT_HEARTBEAT, heartbeat(agentId, "READY"));
        Thread.sleep(100L);

        Assertions.assertEquals(AgentStatus.STOPPED, status(agentId));
    }

    @Test
    void stoppedRuntimeIsMarkedStopped() throws Exception {
        MeshSettings settings = TestSupport.settings().build();
        startOrchestrator(settings);
        AgentRuntime echo = startAgent(new EchoAgent(), settings);

        echo.stop();

        Assertions.assertTrue(waitUntil(() -> status(echo.agentId()) == AgentStatus.STOPPED, WAIT));
    }

    @Test
    void pingAndStatusReflectRegistryAndTasks() throws Exception {
        MeshSettings settings = TestSupport.settings().build();
        startOrchestrator(settings);
        AgentRuntime echo = startAgent(new EchoAgent(), settings);
        String taskId = orchestrator.submitTask(TextNode.valueOf("count me"), "echo");
        orchestrator.awaitTask(taskId, WAIT);

        Optional<PingResult> ping = orchestrator.ping(echo.agentId());
        Assertions.assertTrue(ping.isPresent());
        Assertions.assertEquals(AgentStatus.READY, ping.get().status());
        Assertions.assertTrue(ping.get().silenceMs() >= 0L);

        StatusReport report = orchestrator.status();
        Assertions.assertEquals(1, report.agents().size());
        Assertions.assertEquals(1L, report.taskCounts().get(TaskStatus.COMPLETED));
        Assertions.assertEquals(0L, report.taskCounts().get(TaskStatus.FAILED));
        Assertions.assertTrue(report.bus().published() > 0L);
        Assertions.assertEquals(1, orchestrator.tasks(TaskStatus.COMPLETED).size());
        Assertions.assertTrue(orchestrator.tasks(TaskStatus.PENDING).isEmpty());
    }

    @Test
    void invalidSubmissionsAreRejected() {
        startOrchestrator(TestSupport.settings().build());

        Assertions.assertThrows(IllegalArgumentException.class, () -> orchestrator.submitTask(TextNode.valueOf("x"), " "));
        Assertions.assertThrows(IllegalArgumentException.class, () -> orchestrator.completion("tsk_missing"));
        Assertions.assertTrue(orchestrator.getTask("tsk_missing").isEmpty());
        Assertions.assertThrows(IllegalArgumentException.class, () -> orchestrator.register(" ", Set.of("x")));
        Assertions.assertThrows(IllegalArgumentException.class, () -> orchestrator.register("worker", Set.of()));
    }

    private void startOrchestrator(MeshSettings settings) {
        BrokerMessageBus bus = bus("orchestrator");
        orchestrator = new Orchestrator(bus, settings, AuditLogger.discarding());
        orchestrator.start();
    }

    private AgentRuntime startAgent(Agent agent, MeshSettings settings) throws InterruptedException {
        AgentRuntime runtime = new AgentRuntime(agent, bus("agent-" + agent.agentType()), memory, settings, AuditLogger.discarding());
        runtimes.add(runtime);
        runtime.start();
        String agentId = runtime.agentId();
        Assertions.assertTrue(waitUntil(() -> status(agentId) == AgentStatus.READY, WAIT));
        return runtime;
    }

    private CompletableFuture<TaskStatus> statusSeenFromOtherThread(String taskId) {
        CompletableFuture<TaskStatus> seen = new CompletableFuture<>();
        orchestrator.completion(taskId).whenComplete((view, error) -> {
            try {
                TaskStatus status = CompletableFuture
                        .supplyAsync(() -> orchestrator.getTask(taskId).orElseThrow().status())
                        .get(1, TimeUnit.SECONDS);
                seen.complete(status);
            } catch (Exception e) {
                seen.completeExceptionally(e);
            }
        });
        return seen;
    }

    private BrokerMessageBus bus(String clientId) {
        BrokerMessageBus bus = new BrokerMessageBus(broker, clientId, 3, 1L, 5L, AuditLogger.discarding());
        buses.add(bus);
        return bus;
    }

    private AgentStatus status(String agentId) {
        return orchestrator.ping(agentId).map(PingResult::status).orElse(null);
    }

    private static ObjectNode heartbeat(String agentId, String status) {
        ObjectNode payload = Jsons.object();
        payload.put("agent_id", agentId);
        payload.put("status", status);
        return payload;
    }
}
