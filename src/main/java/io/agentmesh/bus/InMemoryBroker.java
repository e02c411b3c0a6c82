package io.agentmesh.bus;

import io.agentmesh.model.Message;
import io.agentmesh.observability.AuditLogger;
import io.agentmesh.util.Threads;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process broker behind {@code memory://} endpoints.
 *
 * <p>Every subscription owns a single delivery thread, so a subscriber sees
 * messages in the order they were sent. A handler that throws gets the same
 * message again, up to {@code redeliveryLimit} more times, before the message
 * is dead-lettered to the audit log.
 */
public final class InMemoryBroker implements BusTransport {
    public static final String SCHEME = "memory";

    private final String endpoint;
    private final int redeliveryLimit;
    private final AuditLogger auditLogger;
    private final Map<String, TopicRoute> routes = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong published = new AtomicLong();
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong redelivered = new AtomicLong();
    private final AtomicLong deadLettered = new AtomicLong();
    private final AtomicLong unrouted = new AtomicLong();
    private final AtomicInteger subscriptionSeq = new AtomicInteger();

    public InMemoryBroker(String endpoint, int redeliveryLimit, AuditLogger auditLogger) {
        this.endpoint = endpoint == null || endpoint.isBlank() ? SCHEME + "://local" : endpoint;
        this.redeliveryLimit = Math.max(0, redeliveryLimit);
        this.auditLogger = auditLogger == null ? AuditLogger.discarding() : auditLogger;
    }

    @Override
    public String endpoint() {
        return endpoint;
    }

    @Override
    public void send(Message message) {
        if (closed.get()) {
            throw new BusUnavailableException("Broker is closed: " + endpoint);
        }
        published.incrementAndGet();
        TopicRoute route = routes.get(message.topic());
        int targets = route == null ? 0 : route.dispatch(message);
        if (targets == 0) {
            unrouted.incrementAndGet();
            if (Topics.isReplyTopic(message.topic())) {
                auditLogger.log(AuditLogger.AuditEvent.of(
                        "bus.response.discard",
                        message.sender(),
                        message.topic(),
                        "no_waiter",
                        Map.of(
                                "message_id", message.messageId(),
                                "correlation_id", message.correlationId()
                        )
                ));
            }
        }
    }

    @Override
    public Subscription open(String topic, String group, MessageHandler handler) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic cannot be empty");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        if (closed.get()) {
            throw new BusUnavailableException("Broker is closed: " + endpoint);
        }
        String safeGroup = group == null || group.isBlank() ? null : group.trim();
        DeliveryWorker worker = new DeliveryWorker(topic, safeGroup, handler, subscriptionSeq.incrementAndGet());
        routes.compute(topic, (ignored, existing) -> {
            TopicRoute route = existing == null ? new TopicRoute() : existing;
            route.add(worker);
            return route;
        });
        return worker;
    }

    /** Topics that currently hold at least one subscription. */
    int routeCount() {
        return routes.size();
    }

    @Override
    public BusStats stats() {
        int subscriptions = 0;
        for (TopicRoute route : routes.values()) {
            subscriptions += route.size();
        }
        return new BusStats(
                endpoint,
                published.get(),
                delivered.get(),
                redelivered.get(),
                deadLettered.get(),
                unrouted.get(),
                subscriptions
        );
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        List<DeliveryWorker> workers = new ArrayList<>();
        for (TopicRoute route : routes.values()) {
            workers.addAll(route.all());
        }
        for (DeliveryWorker worker : workers) {
            worker.close();
        }
        routes.clear();
    }

    private void deliver(DeliveryWorker worker, Message message) {
        int attempt = 0;
        while (worker.active()) {
            attempt++;
            try {
                worker.handler.handle(message);
                delivered.incrementAndGet();
                return;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (Exception e) {
                if (attempt > redeliveryLimit) {
                    deadLettered.incrementAndGet();
                    auditLogger.log(AuditLogger.AuditEvent.of(
                            "bus.deliver.dead_letter",
                            message.sender(),
                            message.topic(),
                            "dead_lettered",
                            Map.of(
                                    "message_id", message.messageId(),
                                    "subscription", worker.name(),
                                    "attempts", attempt,
                                    "error", String.valueOf(e.getMessage())
                            )
                    ));
                    return;
                }
                redelivered.incrementAndGet();
            }
        }
    }

    private final class TopicRoute {
        private final List<DeliveryWorker> broadcast = new CopyOnWriteArrayList<>();
        private final Map<String, ConsumerGroup> groups = new ConcurrentHashMap<>();

        void add(DeliveryWorker worker) {
            if (worker.group == null) {
                broadcast.add(worker);
            } else {
                groups.compute(worker.group, (ignored, existing) -> {
                    ConsumerGroup consumerGroup = existing == null ? new ConsumerGroup() : existing;
                    consumerGroup.members.add(worker);
                    return consumerGroup;
                });
            }
        }

        void remove(DeliveryWorker worker) {
            if (worker.group == null) {
                broadcast.remove(worker);
                return;
            }
            groups.computeIfPresent(worker.group, (ignored, consumerGroup) -> {
                consumerGroup.members.remove(worker);
                return consumerGroup.members.isEmpty() ? null : consumerGroup;
            });
        }

        int dispatch(Message message) {
            int targets = 0;
            for (DeliveryWorker worker : broadcast) {
                if (worker.enqueue(message)) {
                    targets++;
                }
            }
            for (ConsumerGroup consumerGroup : groups.values()) {
                if (consumerGroup.dispatch(message)) {
                    targets++;
                }
            }
            return targets;
        }

        int size() {
            int count = broadcast.size();
            for (ConsumerGroup consumerGroup : groups.values()) {
                count += consumerGroup.members.size();
            }
            return count;
        }

        List<DeliveryWorker> all() {
            List<DeliveryWorker> out = new ArrayList<>(broadcast);
            for (ConsumerGroup consumerGroup : groups.values()) {
                out.addAll(consumerGroup.members);
            }
            return out;
        }
    }

    private static final class ConsumerGroup {
        private final List<DeliveryWorker> members = new CopyOnWriteArrayList<>();
        private final AtomicInteger cursor = new AtomicInteger();

        boolean dispatch(Message message) {
            for (int tries = members.size(); tries > 0; tries--) {
                List<DeliveryWorker> snapshot = members;
                int size = snapshot.size();
                if (size == 0) {
                    return false;
                }
                DeliveryWorker next = snapshot.get(Math.floorMod(cursor.getAndIncrement(), size));
                if (next.enqueue(message)) {
                    return true;
                }
            }
            return false;
        }
    }

    private final class DeliveryWorker implements Subscription {
        private final String topic;
        private final String group;
        private final MessageHandler handler;
        private final String name;
        private final ExecutorService executor;
        private final AtomicBoolean active = new AtomicBoolean(true);

        DeliveryWorker(String topic, String group, MessageHandler handler, int seq) {
            this.topic = topic;
            this.group = group;
            this.handler = handler;
            this.name = "sub-" + seq;
            this.executor = Executors.newSingleThreadExecutor(Threads.daemon("delivery-" + seq));
        }

        boolean enqueue(Message message) {
            if (!active.get()) {
                return false;
            }
            Message copy = new Message(
                    message.messageId(),
                    message.topic(),
                    message.payload(),
                    message.correlationId(),
                    message.replyTo(),
                    message.sentAtMs(),
                    message.kind(),
                    message.sender()
            );
            try {
                executor.execute(() -> deliver(this, copy));
                return true;
            } catch (RejectedExecutionException e) {
                return false;
            }
        }

        String name() {
            return name;
        }

        @Override
        public String topic() {
            return topic;
        }

        @Override
        public String group() {
            return group;
        }

        @Override
        public boolean active() {
            return active.get();
        }

        @Override
        public void close() {
            if (!active.compareAndSet(true, false)) {
                return;
            }
            routes.computeIfPresent(topic, (ignored, route) -> {
                route.remove(this);
                return route.size() == 0 ? null : route;
            });
            executor.shutdown();
        }
    }
}
