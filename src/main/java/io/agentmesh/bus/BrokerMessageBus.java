package io.agentmesh.bus;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentmesh.config.MeshSettings;
import io.agentmesh.model.Message;
import io.agentmesh.model.MessageKind;
import io.agentmesh.observability.AuditLogger;
import io.agentmesh.util.Backoff;
import io.agentmesh.util.Threads;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bus client over a {@link BusTransport}. One instance per participant; the
 * client id names the sender of everything it publishes and scopes its reply
 * topics.
 */
public final class BrokerMessageBus implements MessageBus {
    private final BusTransport transport;
    private final String clientId;
    private final int publishMaxAttempts;
    private final long publishBaseBackoffMs;
    private final long publishMaxBackoffMs;
    private final AuditLogger auditLogger;
    private final ScheduledExecutorService timeouts;
    private final Set<Subscription> owned = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public BrokerMessageBus(
            BusTransport transport,
            String clientId,
            int publishMaxAttempts,
            long publishBaseBackoffMs,
            long publishMaxBackoffMs,
            AuditLogger auditLogger
    ) {
        if (transport == null) {
            throw new IllegalArgumentException("transport cannot be null");
        }
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("clientId cannot be empty");
        }
        this.transport = transport;
        this.clientId = clientId.trim();
        this.publishMaxAttempts = Math.max(1, publishMaxAttempts);
        this.publishBaseBackoffMs = Math.max(0L, publishBaseBackoffMs);
        this.publishMaxBackoffMs = Math.max(this.publishBaseBackoffMs, publishMaxBackoffMs);
        this.auditLogger = auditLogger == null ? AuditLogger.discarding() : auditLogger;
        this.timeouts = Executors.newSingleThreadScheduledExecutor(Threads.daemon("bus-timeouts"));
    }

    public static BrokerMessageBus fromSettings(BusTransport transport, String clientId, MeshSettings settings, AuditLogger auditLogger) {
        return new BrokerMessageBus(
                transport,
                clientId,
                settings.publishMaxAttempts(),
                settings.publishBaseBackoffMs(),
                settings.publishMaxBackoffMs(),
                auditLogger
        );
    }

    @Override
    public String clientId() {
        return clientId;
    }

    @Override
    public Message publish(String topic, JsonNode payload) {
        Message message = Message.event(clientId, topic, payload);
        send(message);
        return message;
    }

    @Override
    public Subscription subscribe(String topic, MessageHandler handler) {
        return track(transport.open(topic, null, handler));
    }

    @Override
    public Subscription subscribe(String topic, String group, MessageHandler handler) {
        if (group == null || group.isBlank()) {
            throw new IllegalArgumentException("consumer group cannot be empty");
        }
        return track(transport.open(topic, group, handler));
    }

    @Override
    public Message request(String topic, JsonNode payload, Duration timeout) {
        CompletableFuture<Message> future = requestAsync(topic, payload, timeout);
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for response on " + topic, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Request on " + topic + " failed", cause);
        }
    }

    @Override
    public CompletableFuture<Message> requestAsync(String topic, JsonNode payload, Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("request timeout must be positive");
        }
        String correlationId = Message.newCorrelationId();
        String replyTopic = Topics.REPLY_PREFIX + clientId + "." + UUID.randomUUID();
        CompletableFuture<Message> future = new CompletableFuture<>();

        Subscription replies = transport.open(replyTopic, null, response -> {
            if (response.kind() != MessageKind.RESPONSE || !correlationId.equals(response.correlationId())) {
                discardResponse(response, correlationId, "mismatched");
                return;
            }
            if (!future.complete(response)) {
                discardResponse(response, correlationId, "late");
            }
        });
        owned.add(replies);
        ScheduledFuture<?> timer = timeouts.schedule(
                () -> future.completeExceptionally(new RequestTimeoutException(topic, correlationId, timeout)),
                timeout.toMillis(),
                TimeUnit.MILLISECONDS
        );
        future.whenComplete((response, error) -> {
            timer.cancel(false);
            owned.remove(replies);
            replies.close();
            if (error instanceof CancellationException) {
                auditLogger.log(AuditLogger.AuditEvent.of(
                        "bus.request.cancel",
                        clientId,
                        topic,
                        "cancelled",
                        Map.of("correlation_id", correlationId)
                ));
            }
        });

        try {
            send(Message.request(clientId, topic, payload, correlationId, replyTopic));
        } catch (RuntimeException e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    @Override
    public Message respond(Message request, JsonNode payload) {
        if (request == null || request.replyTo() == null) {
            throw new IllegalArgumentException("Cannot respond to a message without reply topic");
        }
        Message response = Message.response(clientId, request, payload);
        send(response);
        return response;
    }

    @Override
    public BusStats stats() {
        return transport.stats();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        for (Subscription subscription : owned) {
            subscription.close();
        }
        owned.clear();
        timeouts.shutdownNow();
    }

    private void send(Message message) {
        if (closed.get()) {
            throw new BusUnavailableException("Bus client is closed: " + clientId);
        }
        RuntimeException last = null;
        for (int attempt = 1; attempt <= publishMaxAttempts; attempt++) {
            try {
                transport.send(message);
                return;
            } catch (IllegalArgumentException e) {
                throw e;
            } catch (RuntimeException e) {
                last = e;
                if (attempt == publishMaxAttempts) {
                    break;
                }
                long delayMs = Backoff.delayMs(attempt, publishBaseBackoffMs, publishMaxBackoffMs);
                auditLogger.log(AuditLogger.AuditEvent.of(
                        "bus.publish.retry",
                        clientId,
                        message.topic(),
                        "retry",
                        Map.of(
                                "message_id", message.messageId(),
                                "attempt", attempt,
                                "delay_ms", delayMs,
                                "error", String.valueOf(e.getMessage())
                        )
                ));
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw new BusUnavailableException("Interrupted while retrying publish on " + message.topic(), e);
                }
            }
        }
        auditLogger.log(AuditLogger.AuditEvent.of(
                "bus.publish",
                clientId,
                message.topic(),
                "unavailable",
                Map.of(
                        "message_id", message.messageId(),
                        "attempts", publishMaxAttempts,
                        "error", String.valueOf(last == null ? "" : last.getMessage())
                )
        ));
        throw new BusUnavailableException(
                "Publish to " + message.topic() + " failed after " + publishMaxAttempts + " attempts", last);
    }

    private Subscription track(Subscription subscription) {
        owned.add(subscription);
        return new Subscription() {
            @Override
            public String topic() {
                return subscription.topic();
            }

            @Override
            public String group() {
                return subscription.group();
            }

            @Override
            public boolean active() {
                return subscription.active();
            }

            @Override
            public void close() {
                owned.remove(subscription);
                subscription.close();
            }
        };
    }

    private void discardResponse(Message response, String expectedCorrelationId, String reason) {
        auditLogger.log(AuditLogger.AuditEvent.of(
                "bus.response.discard",
                clientId,
                response.topic(),
                reason,
                Map.of(
                        "message_id", response.messageId(),
                        "correlation_id", response.correlationId(),
                        "expected_correlation_id", expectedCorrelationId
                )
        ));
    }
}
