package io.agentmesh.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentmesh.bus.BusUnavailableException;
import io.agentmesh.bus.MessageBus;
import io.agentmesh.bus.Subscription;
import io.agentmesh.bus.Topics;
import io.agentmesh.config.MeshSettings;
import io.agentmesh.memory.MemoryManager;
import io.agentmesh.model.AgentStatus;
import io.agentmesh.model.Message;
import io.agentmesh.model.MessageKind;
import io.agentmesh.observability.AuditLogger;
import io.agentmesh.util.Jsons;
import io.agentmesh.util.Threads;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Hosts one {@link Agent}: registration, heartbeats, the message loop and an
 * orderly shutdown.
 *
 * <p>Lifecycle: {@code CREATED -> STARTING -> RUNNING -> STOPPING -> STOPPED},
 * with {@code FAILED} reachable from STARTING and RUNNING.
 */
public final class AgentRuntime implements AutoCloseable {
    private static final int RECENT_MESSAGE_LIMIT = 1_024;
    static final int MAX_HEARTBEAT_FAILURES = 3;
    private static final JsonNode IN_FLIGHT = Jsons.mapper().missingNode();

    private final Agent agent;
    private final MessageBus bus;
    private final MemoryManager memory;
    private final MeshSettings settings;
    private final AuditLogger auditLogger;
    private final AtomicReference<AgentRuntimeState> state = new AtomicReference<>(AgentRuntimeState.CREATED);
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger heartbeatFailures = new AtomicInteger();
    private final List<Subscription> subscriptions = new ArrayList<>();
    private final Map<String, JsonNode> recentMessages;
    private final CountDownLatch terminated = new CountDownLatch(1);
    private volatile String agentId;
    private volatile AgentStatus lastPublishedStatus;
    private volatile String stopReason;
    private ExecutorService workers;
    private ScheduledExecutorService heartbeats;

    public AgentRuntime(Agent agent, MessageBus bus, MemoryManager memory, MeshSettings settings, AuditLogger auditLogger) {
        this(agent, bus, memory, settings, auditLogger, null);
    }

    /**
     * @param agentId preassigned id; when {@code null} the runtime registers
     *                with the orchestrator over the bus on start
     */
    public AgentRuntime(Agent agent, MessageBus bus, MemoryManager memory, MeshSettings settings, AuditLogger auditLogger, String agentId) {
        if (agent == null || bus == null || memory == null || settings == null) {
            throw new IllegalArgumentException("agent, bus, memory and settings are required");
        }
        this.agent = agent;
        this.bus = bus;
        this.memory = memory;
        this.settings = settings;
        this.auditLogger = auditLogger == null ? AuditLogger.discarding() : auditLogger;
        this.agentId = agentId == null || agentId.isBlank() ? null : agentId.trim();
        this.recentMessages = new LinkedHashMap<>(64, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, JsonNode> eldest) {
                return size() > RECENT_MESSAGE_LIMIT;
            }
        };
    }

    public String agentId() {
        return agentId;
    }

    public String agentType() {
        return agent.agentType();
    }

    public AgentRuntimeState state() {
        return state.get();
    }

    public int inFlight() {
        return inFlight.get();
    }

    public String stopReason() {
        return stopReason;
    }

    /**
     * Registers, subscribes and sends the first heartbeat, then enters RUNNING.
     *
     * @throws IllegalStateException when not in CREATED, or when any startup
     *                               step fails (the runtime is then FAILED)
     */
    public void start() {
        transition(AgentRuntimeState.CREATED, AgentRuntimeState.STARTING);
        audit("agent.start", "starting", Map.of("agent_type", agent.agentType()));
        try {
            if (agentId == null) {
                agentId = register();
            }
            int concurrency = Math.max(1, settings.agentMaxConcurrency());
            workers = Executors.newFixedThreadPool(concurrency, Threads.daemon("agent-" + agent.agentType()));
            synchronized (subscriptions) {
                subscriptions.add(bus.subscribe(Topics.dispatch(agentId), this::onMessage));
                for (String topic : agent.subscriptions()) {
                    subscriptions.add(bus.subscribe(topic, this::onMessage));
                }
            }
            publishHeartbeat();
            heartbeats = Executors.newSingleThreadScheduledExecutor(Threads.daemon("heartbeat-" + agent.agentType()));
            long interval = settings.heartbeatIntervalMs();
            heartbeats.scheduleAtFixedRate(this::heartbeatQuietly, interval, interval, TimeUnit.MILLISECONDS);
            transition(AgentRuntimeState.STARTING, AgentRuntimeState.RUNNING);
        } catch (RuntimeException e) {
            tearDown();
            state.set(AgentRuntimeState.FAILED);
            stopReason = "startup failed: " + e.getMessage();
            terminated.countDown();
            audit("agent.start", "failed", Map.of("error", String.valueOf(e.getMessage())));
            throw new IllegalStateException("Agent " + agent.agentType() + " failed to start: " + e.getMessage(), e);
        }
        audit("agent.start", "running", Map.of("agent_type", agent.agentType()));
        publishStatusIfChanged();
    }

    public void stop() {
        stop("requested");
    }

    @Override
    public void close() {
        AgentRuntimeState current = state.get();
        if (current == AgentRuntimeState.RUNNING) {
            stop("closed");
        }
    }

    /** Waits until the runtime reaches STOPPED or FAILED. */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void stop(String reason) {
        if (!state.compareAndSet(AgentRuntimeState.RUNNING, AgentRuntimeState.STOPPING)) {
            AgentRuntimeState current = state.get();
            if (current == AgentRuntimeState.STOPPING || current.terminal()) {
                return;
            }
            throw new IllegalStateException("Illegal agent state transition: " + current + " -> " + AgentRuntimeState.STOPPING);
        }
        stopReason = reason;
        audit("agent.stop", "stopping", Map.of("reason", reason, "in_flight", inFlight.get()));
        closeSubscriptions();
        if (heartbeats != null) {
            heartbeats.shutdownNow();
        }
        int abandoned = drainWorkers();
        ObjectNode payload = Jsons.object();
        payload.put("agent_id", agentId);
        payload.put("agent_type", agent.agentType());
        payload.put("reason", reason);
        payload.put("abandoned", abandoned);
        publishQuietly(Topics.AGENT_STOPPED, payload);
        transition(AgentRuntimeState.STOPPING, AgentRuntimeState.STOPPED);
        terminated.countDown();
        audit("agent.stop", "stopped", Map.of("reason", reason, "abandoned", abandoned));
    }

    private String register() {
        ObjectNode request = Jsons.object();
        request.put("agent_type", agent.agentType());
        ArrayNode caps = request.putArray("capabilities");
        for (String capability : new TreeSet<>(agent.capabilities())) {
            caps.add(capability);
        }
        Message response = bus.request(Topics.ORCHESTRATOR_REGISTER, request, Duration.ofMillis(settings.requestTimeoutMs()));
        JsonNode body = response.payload();
        if (!"ok".equals(body.path("status").asText()) || body.path("agent_id").asText("").isBlank()) {
            throw new IllegalStateException("Registration rejected: " + body.path("error").asText("no agent id"));
        }
        String assigned = body.path("agent_id").asText();
        audit("agent.register", "ok", Map.of("agent_id", assigned));
        return assigned;
    }

    private void onMessage(Message message) {
        JsonNode known;
        boolean duplicate;
        synchronized (recentMessages) {
            duplicate = recentMessages.containsKey(message.messageId());
            known = recentMessages.get(message.messageId());
            if (!duplicate) {
                recentMessages.put(message.messageId(), IN_FLIGHT);
            }
        }
        if (duplicate) {
            boolean answered = message.kind() == MessageKind.REQUEST && known != null && !known.isMissingNode();
            audit("agent.message.duplicate", answered ? "replayed" : "ignored", Map.of("message_id", message.messageId()));
            if (answered) {
                respondQuietly(message, known);
            }
            return;
        }
        if (state.get() != AgentRuntimeState.RUNNING) {
            reject(message, "agent " + agentId + " is not running");
            return;
        }
        inFlight.incrementAndGet();
        publishStatusIfChanged();
        try {
            workers.execute(() -> handle(message));
        } catch (RejectedExecutionException e) {
            inFlight.decrementAndGet();
            reject(message, "agent " + agentId + " is shutting down");
        }
    }

    private void handle(Message message) {
        AgentResult result;
        try {
            result = agent.receive(new AgentContext(agentId, message, memory, bus::publish));
            if (result == null) {
                result = AgentResult.fail("agent returned no result");
            }
        } catch (AgentHandlerException e) {
            result = new AgentResult(false, null, e.getMessage(), e.fatal());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = AgentResult.fail("handler interrupted");
        } catch (Exception e) {
            result = AgentResult.fail(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        try {
            if (message.kind() == MessageKind.REQUEST) {
                JsonNode reply = replyFor(result);
                synchronized (recentMessages) {
                    recentMessages.put(message.messageId(), reply);
                }
                respondQuietly(message, reply);
            } else if (!result.success()) {
                ObjectNode error = Jsons.object();
                error.put("agent_id", agentId);
                error.put("message_id", message.messageId());
                error.put("topic", message.topic());
                error.put("error", result.error());
                error.put("fatal", result.fatal());
                publishQuietly(Topics.AGENT_ERROR, error);
            }
            if (!result.success()) {
                audit("agent.handle", result.fatal() ? "fatal" : "error", Map.of(
                        "message_id", message.messageId(),
                        "topic", message.topic(),
                        "error", String.valueOf(result.error())
                ));
            }
        } finally {
            inFlight.decrementAndGet();
            publishStatusIfChanged();
        }
        if (result.fatal()) {
            String reason = "fatal: " + result.error();
            Thread stopper = Threads.daemon("agent-stop").newThread(() -> stop(reason));
            stopper.start();
        }
    }

    private static JsonNode replyFor(AgentResult result) {
        ObjectNode reply = Jsons.object();
        if (result.success()) {
            reply.put("status", "ok");
            reply.set("result", result.output() == null ? Jsons.mapper().nullNode() : result.output());
        } else {
            reply.put("status", "error");
            reply.put("error", result.error());
            reply.put("fatal", result.fatal());
        }
        return reply;
    }

    private void reject(Message message, String error) {
        if (message.kind() == MessageKind.REQUEST) {
            respondQuietly(message, replyFor(AgentResult.fail(error)));
        }
        audit("agent.message.reject", "rejected", Map.of("message_id", message.messageId(), "error", error));
    }

    private void respondQuietly(Message request, JsonNode reply) {
        try {
            bus.respond(request, reply);
        } catch (BusUnavailableException e) {
            audit("agent.respond", "unavailable", Map.of(
                    "message_id", request.messageId(),
                    "error", String.valueOf(e.getMessage())
            ));
        }
    }

    private void publishQuietly(String topic, JsonNode payload) {
        try {
            bus.publish(topic, payload);
        } catch (BusUnavailableException e) {
            audit("agent.publish", "unavailable", Map.of("topic", topic, "error", String.valueOf(e.getMessage())));
        }
    }

    private AgentStatus currentStatus() {
        return inFlight.get() >= Math.max(1, settings.agentMaxConcurrency()) ? AgentStatus.BUSY : AgentStatus.READY;
    }

    private void publishHeartbeat() {
        ObjectNode payload = Jsons.object();
        payload.put("agent_id", agentId);
        payload.put("agent_type", agent.agentType());
        payload.put("status", currentStatus().name());
        payload.put("in_flight", inFlight.get());
        payload.put("sent_at", Instant.now().toString());
        bus.publish(Topics.AGENT_HEARTBEAT, payload);
    }

    private void heartbeatQuietly() {
        if (state.get() != AgentRuntimeState.RUNNING) {
            return;
        }
        if (workers.isShutdown()) {
            failRunning("worker pool terminated");
            return;
        }
        try {
            publishHeartbeat();
            heartbeatFailures.set(0);
        } catch (BusUnavailableException e) {
            int failures = heartbeatFailures.incrementAndGet();
            audit("agent.heartbeat", "unavailable", Map.of(
                    "error", String.valueOf(e.getMessage()),
                    "consecutive_failures", failures
            ));
            if (failures >= MAX_HEARTBEAT_FAILURES) {
                failRunning("heartbeat failed " + failures + " consecutive times: " + e.getMessage());
            }
        } catch (RuntimeException e) {
            audit("agent.heartbeat", "error", Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    /** RUNNING -> FAILED on an unrecoverable internal error; in-flight work is abandoned. */
    private void failRunning(String reason) {
        if (!state.compareAndSet(AgentRuntimeState.RUNNING, AgentRuntimeState.FAILED)) {
            return;
        }
        stopReason = reason;
        tearDown();
        terminated.countDown();
        audit("agent.fail", "failed", Map.of("reason", reason, "in_flight", inFlight.get()));
    }

    private void publishStatusIfChanged() {
        if (state.get() != AgentRuntimeState.RUNNING) {
            return;
        }
        AgentStatus status = currentStatus();
        synchronized (this) {
            if (status == lastPublishedStatus) {
                return;
            }
            lastPublishedStatus = status;
        }
        ObjectNode payload = Jsons.object();
        payload.put("agent_id", agentId);
        payload.put("status", status.name());
        publishQuietly(Topics.AGENT_STATUS, payload);
    }

    private int drainWorkers() {
        if (workers == null) {
            return 0;
        }
        workers.shutdown();
        try {
            if (workers.awaitTermination(settings.shutdownGraceMs(), TimeUnit.MILLISECONDS)) {
                return 0;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        int abandoned = Math.max(inFlight.get(), workers.shutdownNow().size());
        audit("agent.stop", "abandoned", Map.of("abandoned", abandoned));
        return abandoned;
    }

    private void closeSubscriptions() {
        synchronized (subscriptions) {
            for (Subscription subscription : subscriptions) {
                subscription.close();
            }
            subscriptions.clear();
        }
    }

    private void tearDown() {
        closeSubscriptions();
        if (heartbeats != null) {
            heartbeats.shutdownNow();
        }
        if (workers != null) {
            workers.shutdownNow();
        }
    }

    private void transition(AgentRuntimeState from, AgentRuntimeState to) {
        if (!from.canTransitionTo(to) || !state.compareAndSet(from, to)) {
            throw new IllegalStateException("Illegal agent state transition: " + state.get() + " -> " + to);
        }
    }

    private void audit(String action, String result, Map<String, Object> details) {
        auditLogger.log(AuditLogger.AuditEvent.of(
                action,
                agentId == null ? agent.agentType() : agentId,
                "agent/" + agent.agentType(),
                result,
                details
        ));
    }
}
