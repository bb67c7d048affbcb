package com.chapterbus.scheduler;

import com.chapterbus.stage.CancellationScope;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle on a running batch of chapters.
 */
public class SchedulerRun {

    private final List<ChapterJob> jobs;
    private final CompletableFuture<SchedulerReport> completion = new CompletableFuture<>();
    private final ConcurrentHashMap<Integer, CancellationScope> active = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Integer, ChapterReport> finished = new ConcurrentHashMap<>();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    SchedulerRun(List<ChapterJob> jobs) {
        this.jobs = List.copyOf(jobs);
    }

    public List<ChapterJob> jobs() {
        return jobs;
    }

    public CompletableFuture<SchedulerReport> completion() {
        return completion;
    }

    /** Cancels running chapters; chapters not started yet end FAILED with reason cancelled. */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            active.values().forEach(scope -> scope.cancel("cancelled"));
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isFinished() {
        return completion.isDone();
    }

    public Set<Integer> activeChapters() {
        return new TreeSet<>(active.keySet());
    }

    public Map<Integer, ChapterReport> finishedChapters() {
        return new TreeMap<>(finished);
    }

    void started(int chapter, CancellationScope scope) {
        active.put(chapter, scope);
        if (cancelled.get()) {
            scope.cancel("cancelled");
        }
    }

    void finished(ChapterReport report) {
        active.remove(report.chapter());
        finished.put(report.chapter(), report);
    }
}
