package com.chapterbus.bus;

import com.chapterbus.bus.middleware.MiddlewareChain;
import com.chapterbus.contract.Message;
import com.chapterbus.contract.Topics;
import com.chapterbus.thread.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process message bus shared by the orchestrator and the worker adapters.
 *
 * Delivery is asynchronous. Every topic (SEQUENTIAL mode) or every subscription
 * (PARALLEL mode) owns a serial lane, so each handler sees a topic's messages in
 * publish order while different topics never wait on each other.
 *
 * Request/response: {@link #request} publishes a message whose reply_to is the
 * reply inbox and parks a {@link PendingRequest} under its correlation id. The first
 * correlated reply wins; later ones are discarded. Deadlines are enforced by the
 * bus timer, not by the serving handler.
 */
public class EventBus implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private static final String MDC_CHAPTER = "chapter";

    private final DispatchMode dispatchMode;
    private final SubscriptionRegistry registry;
    private final MiddlewareChain middleware;
    private final ExecutorService dispatchExecutor;
    private final ScheduledExecutorService timer;

    private final ConcurrentHashMap<String, SerialLane> lanes = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Object> topicLocks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, PendingRequest> pendingRequests = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public EventBus(DispatchMode dispatchMode,
                    SubscriptionRegistry registry,
                    MiddlewareChain middleware,
                    ExecutorService dispatchExecutor,
                    ScheduledExecutorService timer) {
        this.dispatchMode = Objects.requireNonNull(dispatchMode, "dispatchMode");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.middleware = Objects.requireNonNull(middleware, "middleware");
        this.dispatchExecutor = Objects.requireNonNull(dispatchExecutor, "dispatchExecutor");
        this.timer = Objects.requireNonNull(timer, "timer");
    }

    /** Bus with its own small pools; used by tests and embedded callers. */
    public static EventBus create(DispatchMode dispatchMode, MiddlewareChain middleware) {
        return new EventBus(
            dispatchMode,
            new SubscriptionRegistry(false),
            middleware,
            Executors.newFixedThreadPool(4, new NamedThreadFactory("bus-dispatch")),
            Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("bus-timer")));
    }

    public Subscription subscribe(String topic, MessageHandler handler) {
        return subscribe(topic, handler, Subscription.DEFAULT_PRIORITY);
    }

    public Subscription subscribe(String topic, MessageHandler handler, int priority) {
        if (Topics.REPLY_INBOX.equals(topic)) {
            throw new IllegalArgumentException(topic + " is reserved for request/response replies");
        }
        Subscription subscription = registry.add(topic, handler, priority);
        log.debug("Subscribed handler={} to topic={} priority={}", subscription.id(), topic, priority);
        return subscription;
    }

    public boolean unsubscribe(Subscription subscription) {
        boolean removed = registry.remove(subscription);
        lanes.remove(subscriptionLaneKey(subscription.id()));
        return removed;
    }

    /**
     * Fire-and-forget publish. Returns once the message is queued; handler failures are
     * logged and never reach the caller.
     */
    public void publish(Message message) {
        Objects.requireNonNull(message, "message cannot be null");
        ensureOpen();
        middleware.beforePublish(message);

        if (Topics.REPLY_INBOX.equals(message.topic())) {
            resolveReply(message);
            return;
        }

        // one lock per topic keeps enqueue order identical across that topic's lanes
        synchronized (topicLocks.computeIfAbsent(message.topic(), t -> new Object())) {
            List<Subscription> handlers = registry.handlersFor(message.topic());
            if (handlers.isEmpty()) {
                log.debug("No handler subscribed to topic={}, message={} dropped", message.topic(), message.id());
                return;
            }
            if (dispatchMode == DispatchMode.SEQUENTIAL) {
                lane(topicLaneKey(message.topic()))
                    .submit(() -> handlers.forEach(s -> deliver(message, s)));
            } else {
                for (Subscription s : handlers) {
                    lane(subscriptionLaneKey(s.id())).submit(() -> deliver(message, s));
                }
            }
        }
    }

    /**
     * Publishes a request on {@code topic} and returns a future completed by the first
     * correlated reply. The future fails with {@link RequestTimeoutException} once
     * {@code timeout} elapses. Cancelling it withdraws the request and notifies the
     * serving adapter on {@link Topics#CANCEL}.
     *
     * Error-tagged replies complete the future normally; inspect {@link Message#isError()}.
     */
    public CompletableFuture<Message> request(String topic, Map<String, Object> payload, Duration timeout) {
        return request(topic, payload, timeout, null);
    }

    public CompletableFuture<Message> request(String topic, Map<String, Object> payload,
                                              Duration timeout, Integer chapterNumber) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        ensureOpen();

        Instant deadline = Instant.now().plus(timeout);
        Message request = Message.request(topic, payload, Topics.REPLY_INBOX, deadline, chapterNumber);
        PendingRequest pending = new PendingRequest(request.correlationId(), topic, deadline);
        pendingRequests.put(pending.correlationId(), pending);
        pending.armTimeout(timer.schedule(() -> expire(pending, timeout),
            timeout.toMillis(), TimeUnit.MILLISECONDS));

        CompletableFuture<Message> outcome = pending.outcome();
        outcome.whenComplete((reply, error) -> {
            if (error instanceof CancellationException) {
                withdraw(pending);
            }
        });

        if (!registry.hasHandlers(topic)) {
            log.warn("Request on topic={} has no handler; it will time out after {}ms",
                topic, timeout.toMillis());
        }
        publish(request);
        return outcome;
    }

    public int pendingRequestCount() {
        return pendingRequests.size();
    }

    public boolean hasSubscribers(String topic) {
        return registry.hasHandlers(topic);
    }

    public DispatchMode dispatchMode() {
        return dispatchMode;
    }

    public SubscriptionRegistry registry() {
        return registry;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        for (PendingRequest pending : pendingRequests.values()) {
            pending.disarmTimeout();
            pending.outcome().completeExceptionally(new CancellationException("event bus closed"));
        }
        pendingRequests.clear();
        timer.shutdownNow();
        dispatchExecutor.shutdown();
        try {
            if (!dispatchExecutor.awaitTermination(2, TimeUnit.SECONDS)) {
                dispatchExecutor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            dispatchExecutor.shutdownNow();
        }
        log.info("Event bus closed");
    }

    private void deliver(Message message, Subscription subscription) {
        boolean tagged = message.chapterNumber() != null;
        if (tagged) {
            MDC.put(MDC_CHAPTER, String.valueOf(message.chapterNumber()));
        }
        Throwable error = null;
        try {
            subscription.handler().handle(message);
        } catch (Throwable ex) {
            // Errors included: one handler must not cost its siblings the message
            error = ex;
            log.warn("Handler {} failed for message={} topic={}: {}",
                subscription.id(), message.id(), message.topic(), ex.toString());
        } finally {
            if (tagged) {
                MDC.remove(MDC_CHAPTER);
            }
        }
        middleware.afterDelivery(message, subscription, error);
    }

    private void resolveReply(Message reply) {
        if (reply.correlationId() == null) {
            log.warn("Reply message={} has no correlation_id, discarded", reply.id());
            middleware.onReply(reply, false);
            return;
        }
        PendingRequest pending = pendingRequests.remove(reply.correlationId());
        boolean accepted = false;
        if (pending != null) {
            pending.disarmTimeout();
            accepted = pending.outcome().complete(reply);
        }
        if (!accepted) {
            log.info("Discarding late or duplicate reply for correlation_id={}", reply.correlationId());
        }
        middleware.onReply(reply, accepted);
    }

    private void expire(PendingRequest pending, Duration timeout) {
        if (pendingRequests.remove(pending.correlationId(), pending)) {
            log.warn("Request on topic={} correlation_id={} timed out after {}ms",
                pending.topic(), pending.correlationId(), timeout.toMillis());
            pending.outcome().completeExceptionally(
                new RequestTimeoutException(pending.topic(), pending.correlationId(), timeout));
        }
    }

    private void withdraw(PendingRequest pending) {
        if (!pendingRequests.remove(pending.correlationId(), pending)) {
            return;
        }
        pending.disarmTimeout();
        if (closed.get()) {
            return;
        }
        log.info("Request on topic={} correlation_id={} cancelled", pending.topic(), pending.correlationId());
        Map<String, Object> notice = new LinkedHashMap<>();
        notice.put("correlation_id", pending.correlationId());
        notice.put("topic", pending.topic());
        publish(Message.event(Topics.CANCEL, notice));
    }

    private SerialLane lane(String key) {
        return lanes.computeIfAbsent(key, k -> new SerialLane(dispatchExecutor));
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("event bus is closed");
        }
    }

    private static String topicLaneKey(String topic) {
        return "topic:" + topic;
    }

    private static String subscriptionLaneKey(String subscriptionId) {
        return "sub:" + subscriptionId;
    }
}
