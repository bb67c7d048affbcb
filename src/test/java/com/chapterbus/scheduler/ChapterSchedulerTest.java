package com.chapterbus.scheduler;

import com.chapterbus.contract.ConfigurationException;
import com.chapterbus.contract.FailureKind;
import com.chapterbus.pipeline.PipelineSettings;
import com.chapterbus.pipeline.PipelineState;
import com.chapterbus.pipeline.WorkerRoles;
import com.chapterbus.support.PipelineFixture;
import com.chapterbus.support.Workers;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class ChapterSchedulerTest {

    private PipelineFixture fixture;
    private ChapterScheduler scheduler;

    @BeforeEach
    void setUp() {
        fixture = new PipelineFixture();
        scheduler = ChapterScheduler.create(
            fixture.pipeline(PipelineSettings.uniform(1, Duration.ofSeconds(10))), fixture.store, fixture.workers);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
        fixture.close();
    }

    private static int chapterOf(Map<String, Object> payload) {
        return ((Number) payload.get("chapter_number")).intValue();
    }

    @Nested
    @DisplayName("Dependencies")
    class Dependencies {

        @Test
        void dependentChapter_startsOnlyAfterItsDependencyIsCommitted() {
            AtomicBoolean startedTooEarly = new AtomicBoolean(false);
            Map<Integer, Object> previousSeen = new ConcurrentHashMap<>();
            fixture.workers.register(WorkerRoles.PLANNER, Workers.answering(payload -> {
                int chapter = chapterOf(payload);
                if (chapter > 1 && fixture.store.find(chapter - 1).isEmpty()) {
                    startedTooEarly.set(true);
                }
                if (payload.containsKey("previous_chapter")) {
                    previousSeen.put(chapter, payload.get("previous_chapter"));
                }
                return Map.of("outline", PipelineFixture.outline(chapter));
            }));

            SchedulerReport report = scheduler.run(ChapterJob.continuityChain(List.of(1, 2, 3)), 3);

            assertFalse(startedTooEarly.get());
            assertEquals(3, report.count(ChapterOutcome.DONE));
            assertEquals(List.of(1, 2, 3), report.chapters().stream().map(ChapterReport::chapter).toList());
            assertEquals(List.of(2, 3), previousSeen.keySet().stream().sorted().toList());
            assertEquals(List.of(1, 2, 3), fixture.store.committedChapters());
        }

        @Test
        void failedDependency_skipsDependentsButNotIndependentChapters() {
            fixture.workers.register(WorkerRoles.PLANNER, Workers.answering(payload -> {
                int chapter = chapterOf(payload);
                if (chapter == 1) {
                    throw new IllegalStateException("planner refused chapter 1");
                }
                return Map.of("outline", PipelineFixture.outline(chapter));
            }));

            SchedulerReport report = scheduler.run(List.of(
                ChapterJob.independent(1),
                ChapterJob.after(2, 1),
                ChapterJob.after(3, 2),
                ChapterJob.independent(4)), 2);

            assertEquals(ChapterOutcome.FAILED, report.outcome(1));
            assertEquals(PipelineState.PLANNING, report.report(1).orElseThrow().lastState());
            assertEquals(ChapterOutcome.SKIPPED, report.outcome(2));
            assertEquals(ChapterOutcome.SKIPPED, report.outcome(3));
            assertTrue(report.report(3).orElseThrow().reason().contains("chapter 2"));
            assertEquals(ChapterOutcome.DONE, report.outcome(4));
            assertEquals(List.of(4), fixture.store.committedChapters());
        }

        @Test
        void chapterWithWarnings_stillUnblocksDependents() {
            fixture.workers.register(WorkerRoles.QUALITY_REVIEWER, Workers.answering(payload -> chapterOf(payload) == 1
                ? Map.of("findings", List.of(Map.of("severity", "blocking", "description", "flat dialogue")))
                : Map.of("findings", List.of())));

            SchedulerReport report = scheduler.run(ChapterJob.continuityChain(List.of(1, 2)), 2);

            assertEquals(ChapterOutcome.COMPLETED_WITH_WARNINGS, report.outcome(1));
            assertEquals(1, report.report(1).orElseThrow().unresolvedFindings().size());
            assertEquals(ChapterOutcome.DONE, report.outcome(2));
        }

        @Test
        void dependencyOutsideTheRun_isReadFromTheStore() {
            scheduler.run(List.of(ChapterJob.independent(1)), 1);
            Map<Integer, Object> previousSeen = new ConcurrentHashMap<>();
            fixture.workers.register(WorkerRoles.PLANNER, Workers.answering(payload -> {
                if (payload.containsKey("previous_chapter")) {
                    previousSeen.put(chapterOf(payload), payload.get("previous_chapter"));
                }
                return Map.of("outline", PipelineFixture.outline(chapterOf(payload)));
            }));

            SchedulerReport report = scheduler.run(List.of(ChapterJob.after(2, 1)), 1);

            assertEquals(ChapterOutcome.DONE, report.outcome(2));
            assertTrue(previousSeen.containsKey(2));
        }
    }

    @Nested
    @DisplayName("Parallelism")
    class Parallelism {

        @Test
        void inFlightChapters_neverExceedParallelism() {
            AtomicInteger planning = new AtomicInteger();
            AtomicInteger maxPlanning = new AtomicInteger();
            fixture.workers.register(WorkerRoles.PLANNER, (payload, deadline) -> {
                maxPlanning.accumulateAndGet(planning.incrementAndGet(), Math::max);
                return CompletableFuture.supplyAsync(() -> {
                    planning.decrementAndGet();
                    return Map.<String, Object>of("outline", PipelineFixture.outline(chapterOf(payload)));
                }, CompletableFuture.delayedExecutor(100, TimeUnit.MILLISECONDS));
            });

            SchedulerReport report = scheduler.run(
                List.of(1, 2, 3, 4, 5, 6).stream().map(ChapterJob::independent).toList(), 2);

            assertEquals(6, report.count(ChapterOutcome.DONE));
            assertTrue(maxPlanning.get() <= 2, "more than 2 chapters in flight: " + maxPlanning.get());
        }

        @Test
        void failingChapter_doesNotAffectSiblings() {
            fixture.workers.register(WorkerRoles.COMPOSER, Workers.answering(payload -> {
                if (chapterOf(payload) == 2) {
                    throw new IllegalStateException("writer crashed");
                }
                return Map.of("scene_text", "text");
            }));

            SchedulerReport report = scheduler.run(
                List.of(ChapterJob.independent(1), ChapterJob.independent(2), ChapterJob.independent(3)), 3);

            assertEquals(ChapterOutcome.DONE, report.outcome(1));
            assertEquals(ChapterOutcome.FAILED, report.outcome(2));
            assertEquals(PipelineState.COMPOSING, report.report(2).orElseThrow().lastState());
            assertEquals(ChapterOutcome.DONE, report.outcome(3));
        }
    }

    @Nested
    @DisplayName("Timeouts and cancellation")
    class Cancellation {

        @Test
        void chapterTimeout_cancelsTheChapter() {
            fixture.workers.register(WorkerRoles.COMPOSER, (payload, deadline) -> new CompletableFuture<>());

            SchedulerReport report = scheduler.run(ChapterJob.continuityChain(List.of(1, 2)), 1, Duration.ofMillis(300));

            ChapterReport first = report.report(1).orElseThrow();
            assertEquals(ChapterOutcome.FAILED, first.outcome());
            assertEquals("cancelled", first.reason());
            assertEquals(PipelineState.COMPOSING, first.lastState());
            assertEquals(ChapterOutcome.SKIPPED, report.outcome(2));
        }

        @Test
        void cancellingRun_stopsActiveChapters() throws Exception {
            fixture.workers.register(WorkerRoles.COMPOSER, (payload, deadline) -> new CompletableFuture<>());

            SchedulerRun run = scheduler.start(List.of(
                ChapterJob.independent(1), ChapterJob.after(2, 1), ChapterJob.independent(3)), 1, null);
            await().atMost(Duration.ofSeconds(2)).until(() -> !run.activeChapters().isEmpty());
            run.cancel();

            SchedulerReport report = run.completion().get(5, TimeUnit.SECONDS);
            assertTrue(run.isCancelled());
            assertTrue(run.isFinished());
            assertEquals(ChapterOutcome.FAILED, report.outcome(1));
            assertEquals(ChapterOutcome.SKIPPED, report.outcome(2));
            assertEquals(ChapterOutcome.FAILED, report.outcome(3));
            assertEquals("cancelled", report.report(3).orElseThrow().reason());
            assertTrue(fixture.store.committedChapters().isEmpty());
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        void invalidParallelism_isRejected() {
            assertThrows(ConfigurationException.class,
                () -> scheduler.run(List.of(ChapterJob.independent(1)), 0));
        }

        @Test
        void emptyJobList_isRejected() {
            assertThrows(ConfigurationException.class, () -> scheduler.run(List.of(), 1));
        }

        @Test
        void duplicateChapter_isRejected() {
            assertThrows(ConfigurationException.class,
                () -> scheduler.run(List.of(ChapterJob.independent(1), ChapterJob.independent(1)), 1));
        }

        @Test
        void selfDependency_isRejected() {
            assertThrows(ConfigurationException.class,
                () -> scheduler.run(List.of(ChapterJob.after(1, 1)), 1));
        }

        @Test
        void forwardOrUnknownDependency_isRejected() {
            ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> scheduler.run(List.of(ChapterJob.after(1, 2), ChapterJob.independent(2)), 2));
            assertTrue(ex.getMessage().contains("chapter 1"));
        }

        @Test
        void nonPositiveTimeout_isRejected() {
            assertThrows(ConfigurationException.class,
                () -> scheduler.run(List.of(ChapterJob.independent(1)), 1, Duration.ZERO));
        }

        @Test
        void missingWorkers_areReportedBeforeAnythingRuns() {
            fixture.workers.unregister(WorkerRoles.PLANNER);

            ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> scheduler.run(List.of(ChapterJob.independent(1)), 1));
            assertTrue(ex.getMessage().contains(WorkerRoles.PLANNER));
        }

        @Test
        void chapterNumbers_startAtOne() {
            assertThrows(IllegalArgumentException.class, () -> ChapterJob.independent(0));
        }

        @Test
        void workerFailure_isReportedAsFailedChapter() {
            fixture.workers.register(WorkerRoles.PLANNER, Workers.failing(FailureKind.PROVIDER_ERROR, "down"));

            SchedulerReport report = scheduler.run(List.of(ChapterJob.independent(7)), 1);

            assertEquals(ChapterOutcome.FAILED, report.outcome(7));
            assertTrue(report.report(7).orElseThrow().reason().startsWith("planning failed"));
        }
    }
}
