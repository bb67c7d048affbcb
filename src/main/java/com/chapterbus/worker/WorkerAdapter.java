package com.chapterbus.worker;

import com.chapterbus.bus.EventBus;
import com.chapterbus.bus.MessageHandler;
import com.chapterbus.bus.Subscription;
import com.chapterbus.contract.FailureKind;
import com.chapterbus.contract.Message;
import com.chapterbus.contract.Topics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Serves one worker's request topic on the bus.
 *
 * Every request gets exactly one reply on its reply_to topic: the collaborator's
 * result, or an error-tagged reply naming the {@link FailureKind}. Collaborator
 * exceptions, rate-limit waits past the deadline and deadline overruns all end up
 * as data, so the caller's request resolves instead of timing out.
 *
 * Requests are served concurrently; the handler itself only schedules work.
 */
public class WorkerAdapter implements MessageHandler {

    private static final Logger log = LoggerFactory.getLogger(WorkerAdapter.class);

    private final WorkerDefinition definition;
    private final EventBus bus;
    private final RateLimiter rateLimiter;
    private final Executor executor;
    private final ScheduledExecutorService timer;
    private final ConcurrentHashMap<String, InFlightCall> inFlight = new ConcurrentHashMap<>();

    private volatile List<Subscription> subscriptions = List.of();

    public WorkerAdapter(WorkerDefinition definition,
                         EventBus bus,
                         RateLimiter rateLimiter,
                         Executor executor,
                         ScheduledExecutorService timer) {
        this.definition = definition;
        this.bus = bus;
        this.rateLimiter = rateLimiter;
        this.executor = executor;
        this.timer = timer;
    }

    public String workerName() {
        return definition.name();
    }

    public String requestTopic() {
        return Topics.workerRequest(definition.name());
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    synchronized void attach() {
        if (!subscriptions.isEmpty()) {
            return;
        }
        Subscription requests = bus.subscribe(requestTopic(), this);
        Subscription cancels = bus.subscribe(Topics.CANCEL, this::onCancel);
        subscriptions = List.of(requests, cancels);
        log.info("Worker {} serving topic={} provider={}", workerName(), requestTopic(), definition.providerId());
    }

    synchronized void detach() {
        subscriptions.forEach(bus::unsubscribe);
        subscriptions = List.of();
        inFlight.values().forEach(call -> call.cancel("worker detached"));
    }

    @Override
    public void handle(Message request) {
        if (!request.isRequest()) {
            log.warn("Worker {} ignoring message={} without reply_to", workerName(), request.id());
            return;
        }
        Instant deadline = request.deadline() != null
            ? request.deadline()
            : Instant.now().plus(definition.defaultTimeout());

        InFlightCall call = new InFlightCall(request);
        if (request.correlationId() != null) {
            inFlight.put(request.correlationId(), call);
        }

        long remainingMillis = Math.max(0, Duration.between(Instant.now(), deadline).toMillis());
        ScheduledFuture<?> guard = timer.schedule(() -> call.fail(new WorkerException(
                FailureKind.DEADLINE_EXCEEDED,
                "worker " + workerName() + " exceeded its deadline")),
            remainingMillis, TimeUnit.MILLISECONDS);

        call.result.whenComplete((value, error) -> {
            guard.cancel(false);
            if (request.correlationId() != null) {
                inFlight.remove(request.correlationId(), call);
            }
            if (call.cancelledByCaller) {
                log.debug("Worker {} dropped reply for cancelled request {}", workerName(), request.correlationId());
                return;
            }
            reply(request, value, error);
        });

        executor.execute(() -> start(call, deadline));
    }

    private void start(InFlightCall call, Instant deadline) {
        try {
            rateLimiter.acquire(definition.providerId(), deadline);
            if (call.result.isDone()) {
                return;
            }
            CompletableFuture<Map<String, Object>> invocation =
                definition.collaborator().invoke(call.request.payload(), deadline);
            if (invocation == null) {
                call.fail(new WorkerException(FailureKind.INVALID_RESPONSE,
                    "worker " + workerName() + " returned no future"));
                return;
            }
            call.invocation = invocation;
            invocation.whenComplete((value, error) -> {
                if (error == null) {
                    call.result.complete(value);
                } else {
                    call.fail(unwrap(error));
                }
            });
            if (call.result.isDone()) {
                invocation.cancel(true);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            call.fail(new CancellationException("interrupted while waiting for a rate-limit permit"));
        } catch (RuntimeException ex) {
            call.fail(ex);
        }
    }

    private void reply(Message request, Map<String, Object> value, Throwable error) {
        Message reply;
        if (error == null && value == null) {
            reply = request.errorReply(FailureKind.INVALID_RESPONSE,
                "worker " + workerName() + " returned an empty result");
        } else if (error == null) {
            reply = request.reply(value);
        } else {
            FailureKind kind = classify(error);
            log.warn("Worker {} failed request {} ({}): {}",
                workerName(), request.correlationId(), kind, error.getMessage());
            reply = request.errorReply(kind, error.getMessage());
        }
        try {
            bus.publish(reply);
        } catch (IllegalStateException ex) {
            log.warn("Worker {} could not publish reply for {}: {}",
                workerName(), request.correlationId(), ex.getMessage());
        }
    }

    private void onCancel(Message notice) {
        Object correlationId = notice.payload().get("correlation_id");
        if (correlationId == null) {
            return;
        }
        InFlightCall call = inFlight.get(String.valueOf(correlationId));
        if (call != null) {
            log.info("Worker {} stopping cancelled request {}", workerName(), correlationId);
            call.cancel("cancelled by caller");
        }
    }

    static FailureKind classify(Throwable error) {
        if (error instanceof WorkerException we) {
            return we.getKind();
        }
        if (error instanceof CancellationException) {
            return FailureKind.CANCELLED;
        }
        return FailureKind.PROVIDER_ERROR;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static final class InFlightCall {
        private final Message request;
        private final CompletableFuture<Map<String, Object>> result = new CompletableFuture<>();
        private volatile CompletableFuture<Map<String, Object>> invocation;
        private volatile boolean cancelledByCaller;

        private InFlightCall(Message request) {
            this.request = request;
        }

        private void fail(Throwable error) {
            if (result.completeExceptionally(error)) {
                stopInvocation();
            }
        }

        private void cancel(String reason) {
            cancelledByCaller = true;
            fail(new CancellationException(reason));
        }

        private void stopInvocation() {
            CompletableFuture<Map<String, Object>> running = invocation;
            if (running != null && !running.isDone()) {
                running.cancel(true);
            }
        }
    }
}
