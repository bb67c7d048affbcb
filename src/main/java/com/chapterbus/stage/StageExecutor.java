package com.chapterbus.stage;

import com.chapterbus.bus.EventBus;
import com.chapterbus.bus.RequestTimeoutException;
import com.chapterbus.contract.FailureKind;
import com.chapterbus.contract.Message;
import com.chapterbus.contract.Topics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Runs a {@link Stage} as bus requests and merges the replies into a {@link StageResult}.
 *
 * Blocks the calling thread until the stage has settled. Deadlines are enforced by
 * the bus, so a stage never waits longer than its slowest call's timeout.
 */
public class StageExecutor {

    private static final Logger log = LoggerFactory.getLogger(StageExecutor.class);

    private final EventBus bus;

    public StageExecutor(EventBus bus) {
        this.bus = bus;
    }

    public StageResult execute(Stage stage, Integer chapterNumber, CancellationScope scope) {
        StageResult result = stage.policy() == CombinationPolicy.SEQUENTIAL
            ? runSequential(stage, chapterNumber, scope)
            : runParallel(stage, chapterNumber, scope);
        log.debug("Stage {} finished with {} ({} outputs, {} issues)",
            stage.name(), result.status(), result.outputs().size(), result.issues().size());
        return result;
    }

    private StageResult runSequential(Stage stage, Integer chapterNumber, CancellationScope scope) {
        Map<String, Map<String, Object>> outputs = new LinkedHashMap<>();
        Map<String, Object> previous = Map.of();
        for (WorkerCall call : stage.calls()) {
            Outcome outcome = await(stage, call, issue(stage, call, chapterNumber, previous, scope), scope);
            if (outcome.issue() != null) {
                return new StageResult(stage.name(), StageStatus.FAILURE, outputs, List.of(outcome.issue()));
            }
            outputs.put(call.key(), outcome.output());
            previous = outcome.output();
        }
        return new StageResult(stage.name(), StageStatus.SUCCESS, outputs, List.of());
    }

    private StageResult runParallel(Stage stage, Integer chapterNumber, CancellationScope scope) {
        Map<String, CompletableFuture<Message>> futures = new LinkedHashMap<>();
        if (stage.concurrent()) {
            for (WorkerCall call : stage.calls()) {
                futures.put(call.key(), issue(stage, call, chapterNumber, Map.of(), scope));
            }
        }

        Map<String, Map<String, Object>> outputs = new TreeMap<>();
        List<StageIssue> issues = new ArrayList<>();
        for (WorkerCall call : stage.calls()) {
            CompletableFuture<Message> future = stage.concurrent()
                ? futures.get(call.key())
                : issue(stage, call, chapterNumber, Map.of(), scope);
            Outcome outcome = await(stage, call, future, scope);
            if (outcome.issue() != null) {
                issues.add(outcome.issue());
            } else {
                outputs.put(call.key(), outcome.output());
            }
        }

        StageStatus status;
        if (issues.isEmpty()) {
            status = StageStatus.SUCCESS;
        } else if (stage.bestEffort() && !outputs.isEmpty()) {
            status = StageStatus.PARTIAL;
        } else {
            status = StageStatus.FAILURE;
        }
        return new StageResult(stage.name(), status, outputs, issues);
    }

    private CompletableFuture<Message> issue(Stage stage, WorkerCall call, Integer chapterNumber,
                                             Map<String, Object> previous, CancellationScope scope) {
        if (scope.isCancelled()) {
            return CompletableFuture.failedFuture(new CancellationException(scope.reason()));
        }
        Map<String, Object> payload;
        try {
            payload = call.payloadBuilder().apply(previous);
        } catch (RuntimeException ex) {
            log.warn("Stage {} could not build payload for call {}: {}", stage.name(), call.key(), ex.getMessage());
            return CompletableFuture.failedFuture(ex);
        }
        return scope.register(bus.request(Topics.workerRequest(call.worker()), payload, call.timeout(), chapterNumber));
    }

    private Outcome await(Stage stage, WorkerCall call, CompletableFuture<Message> future, CancellationScope scope) {
        try {
            Message reply = future.get();
            if (reply.isError()) {
                FailureKind kind = reply.errorKind().orElse(FailureKind.PROVIDER_ERROR);
                if (issueKindFor(kind) == IssueKind.TIMEOUT) {
                    return Outcome.failed(timeoutIssue(stage, call));
                }
                return Outcome.failed(new StageIssue(stage.name(), call.key(), call.worker(),
                    issueKindFor(kind), kind, reply.errorMessage()));
            }
            return Outcome.succeeded(reply.payload());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return Outcome.failed(new StageIssue(stage.name(), call.key(), call.worker(),
                IssueKind.CANCELLED, null, "interrupted"));
        } catch (CancellationException ex) {
            return Outcome.failed(new StageIssue(stage.name(), call.key(), call.worker(),
                IssueKind.CANCELLED, null, scope.isCancelled() ? scope.reason() : "cancelled"));
        } catch (ExecutionException ex) {
            return Outcome.failed(toIssue(stage, call, ex.getCause()));
        } finally {
            scope.release(future);
        }
    }

    private static StageIssue toIssue(Stage stage, WorkerCall call, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof RequestTimeoutException) {
            return timeoutIssue(stage, call);
        }
        if (cause instanceof CancellationException) {
            return new StageIssue(stage.name(), call.key(), call.worker(), IssueKind.CANCELLED, null,
                cause.getMessage());
        }
        return new StageIssue(stage.name(), call.key(), call.worker(), IssueKind.WORKER_FAILURE,
            FailureKind.PROVIDER_ERROR, cause.getMessage());
    }

    /**
     * The bus timer and the adapter's own deadline guard race for the same instant;
     * whichever wins, the call is reported the same way.
     */
    private static StageIssue timeoutIssue(Stage stage, WorkerCall call) {
        return new StageIssue(stage.name(), call.key(), call.worker(), IssueKind.TIMEOUT,
            FailureKind.DEADLINE_EXCEEDED, "no reply within " + call.timeout().toMillis() + "ms");
    }

    /** A worker reporting its own deadline overrun counts as a timeout of the call. */
    static IssueKind issueKindFor(FailureKind kind) {
        return switch (kind) {
            case DEADLINE_EXCEEDED -> IssueKind.TIMEOUT;
            case CANCELLED -> IssueKind.CANCELLED;
            default -> IssueKind.WORKER_FAILURE;
        };
    }

    private record Outcome(Map<String, Object> output, StageIssue issue) {
        static Outcome succeeded(Map<String, Object> output) {
            return new Outcome(output, null);
        }

        static Outcome failed(StageIssue issue) {
            return new Outcome(null, issue);
        }
    }
}
