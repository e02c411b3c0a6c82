package io.agentmesh.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentmesh.agent.AgentHandlerException;
import io.agentmesh.bus.BusUnavailableException;
import io.agentmesh.bus.MessageBus;
import io.agentmesh.bus.Subscription;
import io.agentmesh.bus.Topics;
import io.agentmesh.config.MeshSettings;
import io.agentmesh.model.AgentRecord;
import io.agentmesh.model.AgentStatus;
import io.agentmesh.model.Message;
import io.agentmesh.model.MessageKind;
import io.agentmesh.model.TaskStatus;
import io.agentmesh.model.TaskView;
import io.agentmesh.observability.AuditLogger;
import io.agentmesh.util.Backoff;
import io.agentmesh.util.Jsons;
import io.agentmesh.util.Threads;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the agent registry and the task lifecycle.
 *
 * <p>Tasks move {@code PENDING -> DISPATCHED -> IN_PROGRESS} and end COMPLETED
 * or FAILED. A failed dispatch goes back to PENDING with backoff until the
 * attempt ceiling is reached. Each dispatch bumps the task's epoch; outcomes
 * from an older epoch are ignored.
 */
public final class Orchestrator implements AutoCloseable {
    public static final String ACTOR = "orchestrator";
    private static final String REGISTER_GROUP = "orchestrator";

    private final MessageBus bus;
    private final MeshSettings settings;
    private final AuditLogger auditLogger;
    private final AgentRegistry registry = new AgentRegistry();
    private final Map<String, TaskEntry> tasks = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> cursors = new ConcurrentHashMap<>();
    private final List<Subscription> subscriptions = new ArrayList<>();
    private final ScheduledExecutorService scheduler;
    private volatile boolean started;
    private volatile long startedAtMs;
    private volatile boolean closed;

    public Orchestrator(MessageBus bus, MeshSettings settings, AuditLogger auditLogger) {
        if (bus == null || settings == null) {
            throw new IllegalArgumentException("bus and settings are required");
        }
        this.bus = bus;
        this.settings = settings;
        this.auditLogger = auditLogger == null ? AuditLogger.discarding() : auditLogger;
        this.scheduler = Executors.newScheduledThreadPool(4, Threads.daemon("orchestrator"));
    }

    public synchronized void start() {
        if (started) {
            return;
        }
        if (closed) {
            throw new IllegalStateException("Orchestrator is closed");
        }
        subscriptions.add(bus.subscribe(Topics.ORCHESTRATOR_REGISTER, REGISTER_GROUP, this::onRegister));
        subscriptions.add(bus.subscribe(Topics.AGENT_HEARTBEAT, this::onHeartbeat));
        subscriptions.add(bus.subscribe(Topics.AGENT_STATUS, this::onHeartbeat));
        subscriptions.add(bus.subscribe(Topics.AGENT_STOPPED, this::onStopped));
        long interval = settings.heartbeatIntervalMs();
        scheduler.scheduleAtFixedRate(this::sweepQuietly, interval, interval, TimeUnit.MILLISECONDS);
        started = true;
        startedAtMs = now();
        audit("orchestrator.start", "orchestrator", "ok", Map.of("heartbeat_interval_ms", interval));
    }

    public String register(String agentType, Set<String> capabilities) {
        AgentRecord record = registry.register(agentType, capabilities, now());
        audit("orchestrator.agent.register", "agent/" + record.agentId(), "ok", Map.of(
                "agent_type", record.agentType(),
                "capabilities", new ArrayList<>(new TreeSet<>(record.capabilities()))
        ));
        return record.agentId();
    }

    public boolean deregister(String agentId) {
        Optional<AgentStatus> previous = registry.markStopped(agentId);
        previous.ifPresent(status -> audit("orchestrator.agent.deregister", "agent/" + agentId, "ok",
                Map.of("previous_status", status.name())));
        return previous.isPresent();
    }

    /**
     * Marks records UNHEALTHY after {@code 3 x heartbeat interval} of silence
     * and announces each one on {@code agent.unhealthy}.
     */
    public List<String> sweepHeartbeats() {
        long nowMs = now();
        List<String> changed = registry.sweep(nowMs, settings.heartbeatTimeoutMs());
        for (String agentId : changed) {
            long lastHeartbeatMs = registry.find(agentId).map(AgentRecord::lastHeartbeatMs).orElse(nowMs);
            audit("orchestrator.agent.status", "agent/" + agentId, "unhealthy",
                    Map.of("timeout_ms", settings.heartbeatTimeoutMs()));
            ObjectNode payload = Jsons.object();
            payload.put("agent_id", agentId);
            payload.put("silence_ms", Math.max(0L, nowMs - lastHeartbeatMs));
            payload.put("timeout_ms", settings.heartbeatTimeoutMs());
            publishQuietly(Topics.AGENT_UNHEALTHY, "agent/" + agentId, payload);
        }
        return changed;
    }

    /** Publishes a {@code system.stats} snapshot built from {@link #status()}. */
    public void publishSystemStats() {
        StatusReport report = status();
        ObjectNode payload = Jsons.object();
        payload.put("uptime_ms", started ? Math.max(0L, report.generatedAtMs() - startedAtMs) : 0L);
        long online = 0L;
        ArrayNode agents = payload.putArray("agents");
        for (AgentRecord record : report.agents()) {
            ObjectNode row = agents.addObject();
            row.put("agent_id", record.agentId());
            row.put("agent_type", record.agentType());
            row.put("status", record.status().name());
            row.put("last_heartbeat_ms", record.lastHeartbeatMs());
            if (record.status() == AgentStatus.READY || record.status() == AgentStatus.BUSY) {
                online++;
            }
        }
        payload.put("agents_online", online);
        ObjectNode counts = payload.putObject("task_counts");
        for (Map.Entry<TaskStatus, Long> count : new EnumMap<>(report.taskCounts()).entrySet()) {
            counts.put(count.getKey().name(), count.getValue());
        }
        payload.put("bus_published", report.bus().published());
        payload.put("bus_delivered", report.bus().delivered());
        payload.put("bus_dead_lettered", report.bus().deadLettered());
        payload.put("generated_at_ms", report.generatedAtMs());
        publishQuietly(Topics.SYSTEM_STATS, "orchestrator", payload);
    }

    public String submitTask(JsonNode description, String requiredCapability) {
        if (requiredCapability == null || requiredCapability.isBlank()) {
            throw new IllegalArgumentException("required capability cannot be empty");
        }
        if (closed) {
            throw new IllegalStateException("Orchestrator is closed");
        }
        long nowMs = now();
        String taskId = "tsk_" + UUID.randomUUID();
        TaskEntry entry = new TaskEntry(
                taskId,
                description == null ? Jsons.mapper().nullNode() : description.deepCopy(),
                requiredCapability.trim(),
                nowMs,
                nowMs + settings.submissionDeadlineMs()
        );
        tasks.put(taskId, entry);
        audit("orchestrator.task.submit", "task/" + taskId, "pending", Map.of("capability", entry.capability));
        schedule(taskId, 0L);
        return taskId;
    }

    public Optional<TaskView> getTask(String taskId) {
        TaskEntry entry = taskId == null ? null : tasks.get(taskId);
        return entry == null ? Optional.empty() : Optional.of(entry.view());
    }

    public List<TaskView> tasks(TaskStatus status) {
        List<TaskView> out = new ArrayList<>();
        for (TaskEntry entry : tasks.values()) {
            TaskView view = entry.view();
            if (status == null || view.status() == status) {
                out.add(view);
            }
        }
        out.sort(Comparator.comparingLong(TaskView::submittedAtMs).thenComparing(TaskView::taskId));
        return out;
    }

    public List<AgentRecord> agents() {
        return registry.all();
    }

    /**
     * Future completing with the final view, or exceptionally with
     * {@link TaskFailedException}.
     */
    public CompletableFuture<TaskView> completion(String taskId) {
        TaskEntry entry = taskId == null ? null : tasks.get(taskId);
        if (entry == null) {
            throw new IllegalArgumentException("Unknown task: " + taskId);
        }
        return entry.completion.copy();
    }

    public TaskView awaitTask(String taskId, Duration timeout) {
        CompletableFuture<TaskView> future = completion(taskId);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for task " + taskId, e);
        } catch (TimeoutException e) {
            throw new IllegalStateException("Task " + taskId + " not finished within " + timeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Task " + taskId + " failed", cause);
        }
    }

    public Optional<PingResult> ping(String agentId) {
        long nowMs = now();
        return registry.find(agentId).map(record -> new PingResult(
                record.agentId(),
                record.status(),
                record.lastHeartbeatMs(),
                Math.max(0L, nowMs - record.lastHeartbeatMs())
        ));
    }

    public StatusReport status() {
        Map<TaskStatus, Long> counts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            counts.put(status, 0L);
        }
        for (TaskEntry entry : tasks.values()) {
            counts.merge(entry.view().status(), 1L, Long::sum);
        }
        return new StatusReport(registry.all(), counts, bus.stats(), now());
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (Subscription subscription : subscriptions) {
            subscription.close();
        }
        subscriptions.clear();
        scheduler.shutdownNow();
        audit("orchestrator.stop", "orchestrator", "ok", Map.of("tasks", tasks.size()));
    }

    private void onRegister(Message message) {
        if (message.kind() != MessageKind.REQUEST) {
            return;
        }
        JsonNode body = message.payload();
        ObjectNode reply = Jsons.object();
        try {
            Set<String> capabilities = new LinkedHashSet<>();
            for (JsonNode capability : body.path("capabilities")) {
                capabilities.add(capability.asText());
            }
            String agentId = register(body.path("agent_type").asText(null), capabilities);
            reply.put("status", "ok");
            reply.put("agent_id", agentId);
        } catch (IllegalArgumentException e) {
            reply.put("status", "error");
            reply.put("error", e.getMessage());
        }
        try {
            bus.respond(message, reply);
        } catch (BusUnavailableException e) {
            audit("orchestrator.agent.register", "agent/" + reply.path("agent_id").asText(""), "unavailable",
                    Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    private void onHeartbeat(Message message) {
        JsonNode body = message.payload();
        String agentId = body.path("agent_id").asText(null);
        AgentStatus reported;
        try {
            reported = AgentStatus.fromString(body.path("status").asText("READY"));
        } catch (IllegalArgumentException e) {
            reported = AgentStatus.READY;
        }
        Optional<AgentStatus> previous = registry.heartbeat(agentId, reported, now());
        if (previous.isEmpty()) {
            audit("orchestrator.heartbeat", "agent/" + agentId, "ignored_unknown",
                    Map.of("topic", message.topic(), "sender", message.sender()));
            return;
        }
        AgentStatus before = previous.get();
        if (before != AgentStatus.STOPPED && before != reported) {
            audit("orchestrator.agent.status", "agent/" + agentId, reported.name().toLowerCase(),
                    Map.of("previous_status", before.name()));
        }
    }

    private void onStopped(Message message) {
        String agentId = message.payload().path("agent_id").asText(null);
        if (registry.markStopped(agentId).isPresent()) {
            audit("orchestrator.agent.status", "agent/" + agentId, "stopped",
                    Map.of("reason", message.payload().path("reason").asText("")));
        }
    }

    private void sweepQuietly() {
        try {
            sweepHeartbeats();
            publishSystemStats();
        } catch (RuntimeException e) {
            audit("orchestrator.sweep", "orchestrator", "error", Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    private void schedule(String taskId, long delayMs) {
        if (closed) {
            return;
        }
        scheduler.schedule(() -> dispatchQuietly(taskId), Math.max(0L, delayMs), TimeUnit.MILLISECONDS);
    }

    private void dispatchQuietly(String taskId) {
        try {
            dispatch(taskId);
        } catch (RuntimeException e) {
            audit("orchestrator.task.dispatch", "task/" + taskId, "error", Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    private void dispatch(String taskId) {
        TaskEntry entry = tasks.get(taskId);
        if (entry == null) {
            return;
        }
        long nowMs = now();
        String agentId;
        long epoch;
        int attempt;
        TaskView failed = null;
        NoEligibleAgentException noAgent = null;
        synchronized (entry) {
            if (entry.status != TaskStatus.PENDING) {
                return;
            }
            Optional<AgentRecord> chosen = choose(entry, nowMs);
            if (chosen.isEmpty()) {
                if (nowMs >= entry.deadlineAtMs) {
                    noAgent = new NoEligibleAgentException(entry.capability, nowMs - entry.submittedAtMs);
                    failed = fail(entry, noAgent, nowMs);
                } else {
                    schedule(taskId, Math.min(settings.dispatchPollIntervalMs(), entry.deadlineAtMs - nowMs));
                }
                agentId = null;
                epoch = 0L;
                attempt = 0;
            } else {
                agentId = chosen.get().agentId();
                entry.epoch++;
                epoch = entry.epoch;
                attempt = entry.attempts + 1;
                entry.status = TaskStatus.DISPATCHED;
                entry.assignedAgent = agentId;
                entry.updatedAtMs = nowMs;
            }
        }
        if (agentId == null) {
            if (failed != null) {
                announceFailure(entry, failed, noAgent);
            }
            return;
        }
        audit("orchestrator.task.dispatch", "task/" + taskId, "dispatched", Map.of(
                "agent_id", agentId,
                "attempt", attempt,
                "epoch", epoch
        ));

        ObjectNode request = Jsons.object();
        request.put("task_id", taskId);
        request.put("attempt", attempt);
        request.set("description", entry.description);
        request.put("required_capability", entry.capability);
        CompletableFuture<Message> response;
        try {
            response = bus.requestAsync(Topics.dispatch(agentId), request, Duration.ofMillis(settings.requestTimeoutMs()));
        } catch (RuntimeException e) {
            response = CompletableFuture.failedFuture(e);
        }
        if (!response.isCompletedExceptionally()) {
            synchronized (entry) {
                if (entry.epoch == epoch && entry.status == TaskStatus.DISPATCHED) {
                    entry.status = TaskStatus.IN_PROGRESS;
                    entry.updatedAtMs = now();
                }
            }
        }
        response.whenComplete((message, error) -> onOutcome(entry, epoch, agentId, message, error));
    }

    private Optional<AgentRecord> choose(TaskEntry entry, long nowMs) {
        List<AgentRecord> candidates = registry.eligible(entry.capability, nowMs, settings.heartbeatTimeoutMs());
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        List<AgentRecord> preferred = new ArrayList<>();
        for (AgentRecord candidate : candidates) {
            if (!entry.failedAgents.contains(candidate.agentId())) {
                preferred.add(candidate);
            }
        }
        List<AgentRecord> pool = preferred.isEmpty() ? candidates : preferred;
        AtomicInteger cursor = cursors.computeIfAbsent(entry.capability, ignored -> new AtomicInteger());
        return Optional.of(pool.get(Math.floorMod(cursor.getAndIncrement(), pool.size())));
    }

    private void onOutcome(TaskEntry entry, long epoch, String agentId, Message message, Throwable error) {
        long nowMs = now();
        Throwable cause = unwrap(error);
        if (cause == null) {
            JsonNode body = message.payload();
            if (!"ok".equals(body.path("status").asText())) {
                cause = new AgentHandlerException(
                        body.path("error").asText("agent reported an error"),
                        body.path("fatal").asBoolean(false)
                );
            }
        }
        TaskView terminal = null;
        long retryDelayMs = -1L;
        synchronized (entry) {
            boolean current = entry.epoch == epoch
                    && (entry.status == TaskStatus.DISPATCHED || entry.status == TaskStatus.IN_PROGRESS);
            if (!current) {
                audit("orchestrator.task.outcome", "task/" + entry.taskId, "ignored_stale", Map.of(
                        "agent_id", agentId,
                        "epoch", epoch,
                        "current_epoch", entry.epoch
                ));
                return;
            }
            if (cause == null) {
                entry.status = TaskStatus.COMPLETED;
                entry.result = message.payload().path("result").deepCopy();
                entry.updatedAtMs = nowMs;
                terminal = entry.view();
            } else {
                entry.attempts++;
                entry.lastError = describe(cause);
                entry.failedAgents.add(agentId);
                entry.updatedAtMs = nowMs;
                if (entry.attempts >= settings.dispatchMaxAttempts()) {
                    terminal = fail(entry, cause, nowMs);
                } else {
                    entry.status = TaskStatus.PENDING;
                    entry.assignedAgent = null;
                    retryDelayMs = Backoff.delayMs(entry.attempts, settings.dispatchBaseBackoffMs(), settings.dispatchMaxBackoffMs());
                }
            }
        }
        if (terminal != null && terminal.status() == TaskStatus.COMPLETED) {
            audit("orchestrator.task.complete", "task/" + entry.taskId, "completed", Map.of("agent_id", agentId));
            entry.completion.complete(terminal);
            publishOutcome(Topics.TASK_COMPLETED, terminal);
        } else if (terminal != null) {
            announceFailure(entry, terminal, cause);
        } else if (retryDelayMs >= 0L) {
            audit("orchestrator.task.retry", "task/" + entry.taskId, "retry_scheduled", Map.of(
                    "agent_id", agentId,
                    "attempts", entry.view().attempts(),
                    "delay_ms", retryDelayMs,
                    "error", describe(cause)
            ));
            schedule(entry.taskId, retryDelayMs);
        }
    }

    /**
     * Moves the entry to FAILED; caller holds the entry's monitor and calls
     * {@link #announceFailure} after releasing it.
     */
    private TaskView fail(TaskEntry entry, Throwable cause, long nowMs) {
        entry.status = TaskStatus.FAILED;
        entry.lastError = describe(cause);
        entry.updatedAtMs = nowMs;
        return entry.view();
    }

    private void announceFailure(TaskEntry entry, TaskView view, Throwable cause) {
        audit("orchestrator.task.fail", "task/" + entry.taskId, "failed", Map.of(
                "attempts", view.attempts(),
                "error", String.valueOf(view.lastError())
        ));
        entry.completion.completeExceptionally(new TaskFailedException(view, cause));
        publishOutcome(Topics.TASK_FAILED, view);
    }

    private void publishOutcome(String topic, TaskView view) {
        ObjectNode payload = Jsons.object();
        payload.put("task_id", view.taskId());
        payload.put("status", view.status().name());
        payload.put("agent_id", view.assignedAgent());
        payload.put("attempts", view.attempts());
        if (view.result() != null) {
            payload.set("result", view.result());
        }
        if (view.lastError() != null) {
            payload.put("error", view.lastError());
        }
        publishQuietly(topic, "task/" + view.taskId(), payload);
    }

    private void publishQuietly(String topic, String resource, JsonNode payload) {
        try {
            bus.publish(topic, payload);
        } catch (BusUnavailableException e) {
            audit("orchestrator.publish", resource, "unavailable", Map.of(
                    "topic", topic,
                    "error", String.valueOf(e.getMessage())
            ));
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException || current instanceof ExecutionException) {
            if (current.getCause() == null) {
                break;
            }
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return cause.getClass().getSimpleName() + (message == null || message.isBlank() ? "" : ": " + message);
    }

    private void audit(String action, String resource, String result, Map<String, Object> details) {
        auditLogger.log(AuditLogger.AuditEvent.of(action, ACTOR, resource, result, details));
    }

    private static long now() {
        return Instant.now().toEpochMilli();
    }

    private static final class TaskEntry {
        private final String taskId;
        private final JsonNode description;
        private final String capability;
        private final long submittedAtMs;
        private final long deadlineAtMs;
        private final Set<String> failedAgents = new HashSet<>();
        private final CompletableFuture<TaskView> completion = new CompletableFuture<>();
        private TaskStatus status = TaskStatus.PENDING;
        private String assignedAgent;
        private int attempts;
        private String lastError;
        private JsonNode result;
        private long updatedAtMs;
        private long epoch;

        TaskEntry(String taskId, JsonNode description, String capability, long submittedAtMs, long deadlineAtMs) {
            this.taskId = taskId;
            this.description = description;
            this.capability = capability;
            this.submittedAtMs = submittedAtMs;
            this.deadlineAtMs = deadlineAtMs;
            this.updatedAtMs = submittedAtMs;
        }

        synchronized TaskView view() {
            return new TaskView(
                    taskId,
                    description.deepCopy(),
                    capability,
                    status,
                    assignedAgent,
                    attempts,
                    lastError,
                    result == null ? null : result.deepCopy(),
                    submittedAtMs,
                    updatedAtMs,
                    deadlineAtMs
            );
        }
    }
}
