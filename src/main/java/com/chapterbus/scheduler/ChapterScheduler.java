package com.chapterbus.scheduler;

import com.chapterbus.contract.ConfigurationException;
import com.chapterbus.persistence.ChapterStore;
import com.chapterbus.pipeline.ChapterPipeline;
import com.chapterbus.pipeline.ChapterRunResult;
import com.chapterbus.pipeline.ChapterSnapshot;
import com.chapterbus.pipeline.WorkerRoles;
import com.chapterbus.stage.CancellationScope;
import com.chapterbus.thread.NamedThreadFactory;
import com.chapterbus.worker.WorkerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs chapter pipelines with at most {@code p} in flight and dependency edges
 * between chapters.
 *
 * A dependent chapter is submitted only once its dependency has settled, so no pool
 * thread ever waits on another chapter. A chapter whose dependency did not complete
 * is SKIPPED; independent chapters are unaffected.
 */
public class ChapterScheduler {

    private static final Logger log = LoggerFactory.getLogger(ChapterScheduler.class);

    private final ChapterPipeline pipeline;
    private final ChapterStore store;
    private final WorkerRegistry workers;
    private final ScheduledExecutorService timer;

    public ChapterScheduler(ChapterPipeline pipeline, ChapterStore store, WorkerRegistry workers,
                            ScheduledExecutorService timer) {
        this.pipeline = pipeline;
        this.store = store;
        this.workers = workers;
        this.timer = timer;
    }

    /** Scheduler with its own timeout timer; call {@link #shutdown()} when done. */
    public static ChapterScheduler create(ChapterPipeline pipeline, ChapterStore store, WorkerRegistry workers) {
        return new ChapterScheduler(pipeline, store, workers,
            Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("chapter-timer")));
    }

    public void shutdown() {
        timer.shutdownNow();
    }

    public SchedulerReport run(List<ChapterJob> jobs, int parallelism) {
        return run(jobs, parallelism, null);
    }

    /**
     * Runs {@code jobs} and waits for the report.
     *
     * @throws ConfigurationException for an invalid job list or missing workers, before anything starts
     */
    public SchedulerReport run(List<ChapterJob> jobs, int parallelism, Duration chapterTimeout) {
        SchedulerRun run = start(jobs, parallelism, chapterTimeout);
        try {
            return run.completion().get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            run.cancel();
            throw new IllegalStateException("interrupted while waiting for chapters " + chapterNumbers(jobs), ex);
        } catch (ExecutionException ex) {
            throw new IllegalStateException("scheduler run failed: " + ex.getCause().getMessage(), ex.getCause());
        }
    }

    /** Starts {@code jobs} in the background. */
    public SchedulerRun start(List<ChapterJob> jobs, int parallelism, Duration chapterTimeout) {
        validate(jobs, parallelism, chapterTimeout);
        workers.requireWorkers(WorkerRoles.REQUIRED);

        SchedulerRun run = new SchedulerRun(jobs);
        Instant startedAt = Instant.now();
        ExecutorService pool = Executors.newFixedThreadPool(parallelism, new NamedThreadFactory("chapter"));
        Map<Integer, ChapterSnapshot> snapshots = new ConcurrentHashMap<>();
        Map<Integer, CompletableFuture<ChapterReport>> futures = new LinkedHashMap<>();

        log.info("Scheduling chapters {} with parallelism {}", chapterNumbers(jobs), parallelism);
        for (ChapterJob job : jobs) {
            CompletableFuture<ChapterReport> dependency = job.dependsOn() == null ? null : futures.get(job.dependsOn());
            CompletableFuture<ChapterReport> future;
            if (dependency == null) {
                future = CompletableFuture.supplyAsync(
                    () -> runChapter(job, previousSnapshot(job, snapshots), run, snapshots, chapterTimeout), pool);
            } else {
                future = dependency.handleAsync((report, error) -> {
                    if (error != null || report == null || !report.outcome().isCompleted()) {
                        String reason = "dependency chapter " + job.dependsOn() + " did not complete";
                        log.warn("Skipping chapter {}: {}", job.chapter(), reason);
                        ChapterReport skipped = ChapterReport.skipped(job.chapter(), reason);
                        run.finished(skipped);
                        return skipped;
                    }
                    return runChapter(job, previousSnapshot(job, snapshots), run, snapshots, chapterTimeout);
                }, pool);
            }
            futures.put(job.chapter(), future);
        }

        CompletableFuture.allOf(futures.values().toArray(new CompletableFuture<?>[0]))
            .whenComplete((ignored, error) -> {
                pool.shutdown();
                List<ChapterReport> reports = new ArrayList<>();
                for (CompletableFuture<ChapterReport> future : futures.values()) {
                    reports.add(future.join());
                }
                SchedulerReport report = new SchedulerReport(reports, startedAt, Instant.now());
                log.info("Scheduler run finished: {} done, {} with warnings, {} failed, {} skipped",
                    report.count(ChapterOutcome.DONE), report.count(ChapterOutcome.COMPLETED_WITH_WARNINGS),
                    report.count(ChapterOutcome.FAILED), report.count(ChapterOutcome.SKIPPED));
                run.completion().complete(report);
            });
        return run;
    }

    private ChapterReport runChapter(ChapterJob job, ChapterSnapshot previous, SchedulerRun run,
                                     Map<Integer, ChapterSnapshot> snapshots, Duration chapterTimeout) {
        CancellationScope scope = new CancellationScope();
        run.started(job.chapter(), scope);
        ScheduledFuture<?> timeout = chapterTimeout == null ? null : timer.schedule(() -> {
            if (scope.cancel("chapter timeout")) {
                log.warn("Chapter {} exceeded its {}ms budget", job.chapter(), chapterTimeout.toMillis());
            }
        }, chapterTimeout.toMillis(), TimeUnit.MILLISECONDS);

        ChapterReport report;
        try {
            if (run.isCancelled()) {
                report = ChapterReport.failed(job.chapter(), "cancelled");
            } else {
                ChapterRunResult result = pipeline.run(job.chapter(), previous, scope);
                if (result.isDone() && result.snapshot() != null) {
                    snapshots.put(job.chapter(), result.snapshot());
                }
                report = ChapterReport.from(result);
            }
        } catch (RuntimeException ex) {
            log.error("Chapter {} could not run", job.chapter(), ex);
            report = ChapterReport.failed(job.chapter(), ex.getMessage());
        } finally {
            if (timeout != null) {
                timeout.cancel(false);
            }
        }
        run.finished(report);
        return report;
    }

    private ChapterSnapshot previousSnapshot(ChapterJob job, Map<Integer, ChapterSnapshot> snapshots) {
        if (job.dependsOn() == null) {
            return null;
        }
        ChapterSnapshot produced = snapshots.get(job.dependsOn());
        return produced != null ? produced : store.find(job.dependsOn()).orElse(null);
    }

    private void validate(List<ChapterJob> jobs, int parallelism, Duration chapterTimeout) {
        if (parallelism < 1) {
            throw new ConfigurationException("parallelism must be >= 1, got " + parallelism);
        }
        if (chapterTimeout != null && (chapterTimeout.isZero() || chapterTimeout.isNegative())) {
            throw new ConfigurationException("chapter timeout must be positive");
        }
        if (jobs == null || jobs.isEmpty()) {
            throw new ConfigurationException("no chapters to run");
        }
        Set<Integer> seen = new HashSet<>();
        for (ChapterJob job : jobs) {
            if (!seen.add(job.chapter())) {
                throw new ConfigurationException("chapter " + job.chapter() + " is scheduled twice");
            }
            Integer dependency = job.dependsOn();
            if (dependency == null) {
                continue;
            }
            if (dependency == job.chapter()) {
                throw new ConfigurationException("chapter " + job.chapter() + " depends on itself");
            }
            // dependencies may only point backwards, which also rules out cycles
            boolean earlierInRun = seen.contains(dependency);
            if (!earlierInRun && store.find(dependency).isEmpty()) {
                throw new ConfigurationException("chapter " + job.chapter() + " depends on chapter " + dependency
                    + ", which is neither scheduled before it nor committed");
            }
        }
    }

    private static List<Integer> chapterNumbers(List<ChapterJob> jobs) {
        return jobs.stream().map(ChapterJob::chapter).toList();
    }
}
