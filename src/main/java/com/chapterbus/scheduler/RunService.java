package com.chapterbus.scheduler;

import com.chapterbus.config.ChapterBusProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Background scheduler runs started over the REST API.
 */
@Service
public class RunService {

    private static final Logger log = LoggerFactory.getLogger(RunService.class);

    public enum RunState {
        RUNNING,
        CANCELLING,
        CANCELLED,
        COMPLETED
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record RunStatus(
        String runId,
        RunState state,
        List<ChapterJob> jobs,
        int parallelism,
        Set<Integer> activeChapters,
        List<ChapterReport> finishedChapters,
        Instant createdAt,
        SchedulerReport report
    ) {
    }

    private final ChapterScheduler scheduler;
    private final ChapterBusProperties properties;
    private final ConcurrentHashMap<String, TrackedRun> runs = new ConcurrentHashMap<>();

    public RunService(ChapterScheduler scheduler, ChapterBusProperties properties) {
        this.scheduler = scheduler;
        this.properties = properties;
    }

    /**
     * @param parallelism concurrent chapters, or null for the configured default
     * @param continuity  chain each chapter to the one before it
     */
    public RunStatus start(List<Integer> chapters, Integer parallelism, boolean continuity) {
        if (chapters == null || chapters.isEmpty()) {
            throw new IllegalArgumentException("chapters must not be empty");
        }
        List<ChapterJob> jobs = continuity
            ? ChapterJob.continuityChain(chapters)
            : chapters.stream().map(ChapterJob::independent).toList();
        int p = parallelism != null ? parallelism : properties.getParallelism();

        SchedulerRun run = scheduler.start(jobs, p, properties.getChapterTimeout());
        TrackedRun tracked = new TrackedRun(UUID.randomUUID().toString(), run, p, Instant.now());
        runs.put(tracked.runId(), tracked);
        log.info("Started run {} for chapters {}", tracked.runId(), chapters);
        return toStatus(tracked);
    }

    public Optional<RunStatus> status(String runId) {
        return Optional.ofNullable(runs.get(runId)).map(this::toStatus);
    }

    public Optional<RunStatus> cancel(String runId) {
        TrackedRun tracked = runs.get(runId);
        if (tracked == null) {
            return Optional.empty();
        }
        if (!tracked.run().isFinished()) {
            log.info("Cancelling run {}", runId);
            tracked.run().cancel();
        }
        return Optional.of(toStatus(tracked));
    }

    public List<RunStatus> list() {
        List<RunStatus> statuses = new ArrayList<>();
        runs.values().forEach(tracked -> statuses.add(toStatus(tracked)));
        statuses.sort((a, b) -> a.createdAt().compareTo(b.createdAt()));
        return statuses;
    }

    private RunStatus toStatus(TrackedRun tracked) {
        SchedulerRun run = tracked.run();
        SchedulerReport report = run.isFinished() ? run.completion().getNow(null) : null;
        RunState state;
        if (report != null) {
            state = run.isCancelled() ? RunState.CANCELLED : RunState.COMPLETED;
        } else {
            state = run.isCancelled() ? RunState.CANCELLING : RunState.RUNNING;
        }
        return new RunStatus(tracked.runId(), state, run.jobs(), tracked.parallelism(), run.activeChapters(),
            new ArrayList<>(run.finishedChapters().values()), tracked.createdAt(), report);
    }

    private record TrackedRun(String runId, SchedulerRun run, int parallelism, Instant createdAt) {
    }
}
