package com.chapterbus.pipeline;

import com.chapterbus.bus.LoggedMessage;
import com.chapterbus.contract.ConfigurationException;
import com.chapterbus.contract.FailureKind;
import com.chapterbus.contract.Topics;
import com.chapterbus.persistence.ChapterStore;
import com.chapterbus.persistence.InMemoryChapterStore;
import com.chapterbus.persistence.PersistenceException;
import com.chapterbus.stage.CancellationScope;
import com.chapterbus.stage.IssueKind;
import com.chapterbus.stage.StageIssue;
import com.chapterbus.stage.StageResult;
import com.chapterbus.stage.StageStatus;
import com.chapterbus.support.PipelineFixture;
import com.chapterbus.support.Workers;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class ChapterPipelineTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    private PipelineFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new PipelineFixture();
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private static Map<String, Object> finding(String severity, Integer sceneIndex, String description) {
        Map<String, Object> finding = new LinkedHashMap<>();
        finding.put("severity", severity);
        finding.put("description", description);
        if (sceneIndex != null) {
            finding.put("scene_index", sceneIndex);
        }
        return finding;
    }

    @Nested
    @DisplayName("Happy path")
    class HappyPath {

        @Test
        void chapter_runsThroughEveryStageAndIsCommitted() {
            ChapterRunResult result = fixture.pipeline().run(1);

            assertEquals(PipelineState.DONE, result.state());
            assertEquals(ChapterStatus.DONE, result.status());
            assertNull(result.failedAt());
            assertEquals(0, result.revisionRounds());
            assertTrue(result.issues().isEmpty());

            ChapterSnapshot committed = fixture.store.find(1).orElseThrow();
            assertEquals("## Chapter 1: Arrival 1\n\nScene 0 of chapter 1\n\nScene 1 of chapter 1", committed.text());
            assertEquals(committed.contentHash(), result.snapshot().contentHash());
            assertEquals(1, fixture.store.versionCount(1));
        }

        @Test
        void stages_runInPipelineOrder() {
            ChapterRunResult result = fixture.pipeline().run(1);

            assertEquals(List.of("plan", "world_and_characters", "compose", "assemble", "review_round_1", "finalize"),
                result.timings().stream().map(StageTiming::stage).toList());
            assertEquals(StageStatus.SUCCESS, result.stageResult(ChapterPipeline.STAGE_WORLD_AND_CHARACTERS).status());
        }

        @Test
        void withoutParallelFanOut_chapterProducesTheSameText() {
            ChapterRunResult result = fixture.pipeline(
                PipelineSettings.uniform(2, TIMEOUT).withParallelFanOut(false)).run(1);

            assertTrue(result.isDone());
            assertEquals("## Chapter 1: Arrival 1\n\nScene 0 of chapter 1\n\nScene 1 of chapter 1", result.snapshot().text());
            assertEquals(List.of("character:Alice", "character:Bob", "world"),
                List.copyOf(result.stageResult(ChapterPipeline.STAGE_WORLD_AND_CHARACTERS).outputs().keySet()));
        }

        @Test
        void annotatedCharacterNames_resolveToRegisteredWorkers() {
            List<Map<String, Object>> composed = Collections.synchronizedList(new ArrayList<>());
            fixture.workers.register(WorkerRoles.COMPOSER, Workers.answering(payload -> {
                composed.add(payload);
                return Map.of("scene_text", "text " + payload.get("scene_index"));
            }));

            ChapterRunResult result = fixture.pipeline().run(1);

            assertTrue(result.isDone());
            StageResult world = result.stageResult(ChapterPipeline.STAGE_WORLD_AND_CHARACTERS);
            assertEquals(List.of("character:Alice", "character:Bob", "world"), List.copyOf(world.outputs().keySet()));
            @SuppressWarnings("unchecked")
            Map<String, Object> reactions = (Map<String, Object>) composed.get(1).get("character_reactions");
            assertEquals(List.of("Alice", "Bob"), List.copyOf(reactions.keySet()));
            assertEquals("", composed.get(0).get("previous_scene_text"));
            assertEquals("text 0", composed.get(1).get("previous_scene_text"));
            assertEquals(Map.of("weather", "rain"), composed.get(0).get("setting"));
        }

        @Test
        void outlineWithoutTitle_isNamedAfterThePlannedChapter() {
            fixture.workers.register(WorkerRoles.PLANNER, Workers.constant(Map.of("outline", Map.of(
                "number", 42,
                "scenes", List.of(Map.of("location", "harbour", "characters_present", List.of("Alice (the captain)")))))));

            ChapterRunResult result = fixture.pipeline().run(3);

            assertTrue(result.isDone());
            ChapterSnapshot committed = fixture.store.find(3).orElseThrow();
            assertEquals("Chapter 3", committed.title());
            assertEquals(3, committed.outline().number());
            assertEquals(List.of("Alice"), committed.outline().scenes().get(0).charactersPresent());
            assertTrue(committed.text().startsWith("## Chapter 3: Chapter 3"));
        }

        @Test
        void unknownCharacter_getsNoReactionCall() {
            fixture.workers.register(WorkerRoles.PLANNER, Workers.constant(Map.of("outline", Map.of(
                "title", "Strangers",
                "scenes", List.of(Map.of("characters_present", List.of("Alice", "A stranger in grey")))))));

            ChapterRunResult result = fixture.pipeline().run(3);

            assertTrue(result.isDone());
            StageResult world = result.stageResult(ChapterPipeline.STAGE_WORLD_AND_CHARACTERS);
            assertEquals(List.of("character:Alice", "world"), List.copyOf(world.outputs().keySet()));
        }

        @Test
        void previousChapter_isPassedToPlanner() {
            List<Map<String, Object>> planned = Collections.synchronizedList(new ArrayList<>());
            fixture.workers.register(WorkerRoles.PLANNER, Workers.answering(payload -> {
                planned.add(payload);
                return Map.of("outline", PipelineFixture.outline(((Number) payload.get("chapter_number")).intValue()));
            }));
            ChapterSnapshot first = fixture.pipeline().run(1).snapshot();

            ChapterRunResult second = fixture.pipeline().run(2, first, new CancellationScope());

            assertTrue(second.isDone());
            assertFalse(planned.get(0).containsKey("previous_chapter"));
            @SuppressWarnings("unchecked")
            Map<String, Object> context = (Map<String, Object>) planned.get(1).get("previous_chapter");
            assertEquals(1, context.get("chapter_number"));
            assertEquals("Arrival 1", context.get("title"));
            assertEquals(List.of("Alice", "Bob"), planned.get(1).get("available_characters"));
        }

        @Test
        void lifecycleEvents_arePublishedOnTheBus() throws Exception {
            ChapterRunResult result = fixture.pipeline().run(5);
            assertTrue(result.isDone());

            List<LoggedMessage> finalized = awaitMessages(Topics.CHAPTER_FINALIZED, 5, 1);
            assertEquals(result.snapshot().contentHash(), finalized.get(0).message().payload().get("content_hash"));
            assertEquals(4, fixture.messageLog.query(Optional.of(Topics.STAGE_STARTED), Optional.of(5), 100).size());
            assertEquals(4, fixture.messageLog.query(Optional.of(Topics.STAGE_COMPLETED), Optional.of(5), 100).size());
        }

        @Test
        void intermediates_areSavedWhenEnabled() {
            ChapterRunResult result = fixture.pipeline(PipelineSettings.uniform(1, TIMEOUT).withSaveIntermediates(true)).run(1);

            assertTrue(result.isDone());
            Map<String, Object> saved = fixture.memoryStore().intermediates(1);
            assertTrue(saved.containsKey("outline"));
            assertEquals("Scene 0 of chapter 1", saved.get("scene_0_draft"));
            assertTrue(saved.containsKey("scene_1_draft"));
            assertTrue(saved.containsKey("review_round_1"));
        }

        @Test
        void intermediates_areNotSavedByDefault() {
            fixture.pipeline().run(1);

            assertTrue(fixture.memoryStore().intermediates(1).isEmpty());
        }
    }

    @Nested
    @DisplayName("Partial results")
    class PartialResults {

        @Test
        void slowCharacter_timesOutWithoutFailingTheChapter() {
            fixture.workers.register(WorkerRoles.character("Bob"),
                Workers.delayed(Duration.ofSeconds(1), Map.of("reaction", Map.of("mood", "late"))));
            PipelineSettings settings = PipelineSettings.uniform(2, TIMEOUT).withCharacterTimeout(Duration.ofMillis(200));

            ChapterRunResult result = fixture.pipeline(settings).run(1);

            StageResult world = result.stageResult(ChapterPipeline.STAGE_WORLD_AND_CHARACTERS);
            assertEquals(StageStatus.PARTIAL, world.status());
            assertEquals(1, world.issues().size());
            assertEquals("character:Bob", world.issues().get(0).callKey());
            assertEquals(IssueKind.TIMEOUT, world.issues().get(0).kind());
            assertEquals(PipelineState.DONE, result.state());
            assertEquals(1, result.issues().size());
        }

        @Test
        void singleCharacterMissingItsDeadline_stillReachesDone() {
            fixture.workers.register(WorkerRoles.PLANNER, Workers.constant(Map.of("outline", Map.of(
                "title", "Alone",
                "scenes", List.of(Map.of("location", "harbour", "characters_present", List.of("Alice")))))));
            fixture.workers.register(WorkerRoles.character("Alice"),
                Workers.delayed(Duration.ofMillis(50), Map.of("reaction", Map.of("mood", "late"))));
            PipelineSettings settings = PipelineSettings.uniform(1, TIMEOUT).withCharacterTimeout(Duration.ofMillis(10));

            ChapterRunResult result = fixture.pipeline(settings).run(1);

            StageResult world = result.stageResult(ChapterPipeline.STAGE_WORLD_AND_CHARACTERS);
            assertEquals(StageStatus.PARTIAL, world.status());
            assertEquals(1, world.issues().size());
            StageIssue issue = world.issues().get(0);
            assertEquals("character:Alice", issue.callKey());
            assertEquals(IssueKind.TIMEOUT, issue.kind());
            assertEquals(FailureKind.DEADLINE_EXCEEDED, issue.failureKind());
            assertEquals("no reply within 10ms", issue.description());
            assertNotNull(world.output("world"));
            assertEquals(PipelineState.DONE, result.state());
            assertEquals(ChapterStatus.DONE, result.status());
        }

        @Test
        void failedWorldValidator_leavesSettingEmpty() {
            List<Map<String, Object>> composed = Collections.synchronizedList(new ArrayList<>());
            fixture.workers.register(WorkerRoles.WORLD_VALIDATOR, Workers.failing(FailureKind.PROVIDER_ERROR, "down"));
            fixture.workers.register(WorkerRoles.COMPOSER, Workers.answering(payload -> {
                composed.add(payload);
                return Map.of("scene_text", "text");
            }));

            ChapterRunResult result = fixture.pipeline().run(1);

            assertTrue(result.isDone());
            assertEquals(Map.of(), composed.get(0).get("setting"));
        }
    }

    @Nested
    @DisplayName("Review loop")
    class ReviewLoop {

        @Test
        void persistentBlockingFinding_endsWithWarningsAfterBudget() {
            AtomicInteger reviews = new AtomicInteger();
            AtomicInteger revisions = new AtomicInteger();
            fixture.workers.register(WorkerRoles.QUALITY_REVIEWER, Workers.answering(payload -> {
                reviews.incrementAndGet();
                return Map.of("findings", List.of(finding("blocking", 0, "pacing drags")));
            }));
            fixture.workers.register(WorkerRoles.REVISER, Workers.answering(payload -> {
                revisions.incrementAndGet();
                return Map.of("revised_text", payload.get("scene_text") + "!");
            }));

            ChapterRunResult result = fixture.pipeline(PipelineSettings.uniform(2, TIMEOUT)).run(1);

            assertEquals(PipelineState.DONE, result.state());
            assertEquals(ChapterStatus.COMPLETED_WITH_WARNINGS, result.status());
            assertEquals(2, result.revisionRounds());
            assertEquals(3, reviews.get());
            assertEquals(2, revisions.get());
            assertEquals(1, result.unresolvedFindings().size());
            assertEquals("pacing drags", result.unresolvedFindings().get(0).description());
            assertNotNull(result.stageResult("review_round_3"));
            assertNull(result.stageResult("revise_round_3"));
            assertTrue(fixture.store.find(1).orElseThrow().text().contains("Scene 0 of chapter 1!!"));
        }

        @Test
        void resolvedFinding_revisesOnlyTheTargetedScene() {
            AtomicInteger reviews = new AtomicInteger();
            List<Object> revisedScenes = Collections.synchronizedList(new ArrayList<>());
            fixture.workers.register(WorkerRoles.CONSISTENCY_REVIEWER, Workers.answering(payload ->
                reviews.incrementAndGet() == 1
                    ? Map.of("findings", List.of(finding("blocking", 1, "the forge was closed")))
                    : Map.of("findings", List.of())));
            fixture.workers.register(WorkerRoles.REVISER, Workers.answering(payload -> {
                revisedScenes.add(payload.get("scene_index"));
                return Map.of("revised_text", payload.get("scene_text") + " (revised)");
            }));

            ChapterRunResult result = fixture.pipeline().run(1);

            assertEquals(ChapterStatus.DONE, result.status());
            assertEquals(1, result.revisionRounds());
            assertEquals(List.of(1), revisedScenes);
            assertTrue(result.unresolvedFindings().isEmpty());
            String text = result.snapshot().text();
            assertTrue(text.contains("Scene 0 of chapter 1\n\n"));
            assertTrue(text.endsWith("Scene 1 of chapter 1 (revised)"));
        }

        @Test
        void findingWithoutSceneIndex_revisesEveryScene() {
            AtomicInteger reviews = new AtomicInteger();
            List<Object> revisedScenes = Collections.synchronizedList(new ArrayList<>());
            fixture.workers.register(WorkerRoles.QUALITY_REVIEWER, Workers.answering(payload ->
                reviews.incrementAndGet() == 1
                    ? Map.of("issues", List.of(finding("BLOCKING", null, "tone is off")))
                    : Map.of("issues", List.of())));
            fixture.workers.register(WorkerRoles.REVISER, Workers.answering(payload -> {
                revisedScenes.add(payload.get("scene_index"));
                return Map.of("revised_text", "rewritten");
            }));

            ChapterRunResult result = fixture.pipeline().run(1);

            assertTrue(result.isDone());
            assertEquals(List.of(0, 1), revisedScenes.stream().sorted().toList());
        }

        @Test
        void findingWithOutOfRangeSceneIndex_revisesEveryScene() {
            AtomicInteger reviews = new AtomicInteger();
            List<Object> revisedScenes = Collections.synchronizedList(new ArrayList<>());
            fixture.workers.register(WorkerRoles.CONSISTENCY_REVIEWER, Workers.answering(payload ->
                reviews.incrementAndGet() == 1
                    ? Map.of("findings", List.of(finding("blocking", 7, "the harbour has no name")))
                    : Map.of("findings", List.of())));
            fixture.workers.register(WorkerRoles.REVISER, Workers.answering(payload -> {
                revisedScenes.add(payload.get("scene_index"));
                return Map.of("revised_text", "rewritten " + payload.get("scene_index"));
            }));

            ChapterRunResult result = fixture.pipeline().run(1);

            assertEquals(ChapterStatus.DONE, result.status());
            assertEquals(List.of(0, 1), revisedScenes.stream().sorted().toList());
        }

        @Test
        void advisoryFindings_doNotTriggerRevision() {
            AtomicInteger revisions = new AtomicInteger();
            fixture.workers.register(WorkerRoles.QUALITY_REVIEWER,
                Workers.constant(Map.of("findings", List.of("consider a stronger verb", finding(null, 0, "minor")))));
            fixture.workers.register(WorkerRoles.REVISER, Workers.answering(payload -> {
                revisions.incrementAndGet();
                return Map.of("revised_text", "x");
            }));

            ChapterRunResult result = fixture.pipeline().run(1);

            assertEquals(ChapterStatus.DONE, result.status());
            assertEquals(0, revisions.get());
        }

        @Test
        void zeroRevisionBudget_acceptsChapterWithWarnings() {
            AtomicInteger revisions = new AtomicInteger();
            fixture.workers.register(WorkerRoles.QUALITY_REVIEWER,
                Workers.constant(Map.of("findings", List.of(finding("blocking", 0, "plot hole")))));
            fixture.workers.register(WorkerRoles.REVISER, Workers.answering(payload -> {
                revisions.incrementAndGet();
                return Map.of("revised_text", "x");
            }));

            ChapterRunResult result = fixture.pipeline(PipelineSettings.uniform(0, TIMEOUT)).run(1);

            assertEquals(PipelineState.DONE, result.state());
            assertEquals(ChapterStatus.COMPLETED_WITH_WARNINGS, result.status());
            assertEquals(0, revisions.get());
            assertEquals(0, result.revisionRounds());
        }

        @Test
        void unresolvedFatalFinding_failsTheChapter() {
            fixture.workers.register(WorkerRoles.CONSISTENCY_REVIEWER,
                Workers.constant(Map.of("findings", List.of(finding("fatal", null, "hero is dead and alive")))));

            ChapterRunResult result = fixture.pipeline(PipelineSettings.uniform(1, TIMEOUT)).run(1);

            assertEquals(PipelineState.FAILED, result.state());
            assertEquals(PipelineState.REVIEWING, result.failedAt());
            assertTrue(result.reason().contains("hero is dead and alive"));
            assertTrue(fixture.store.find(1).isEmpty());
        }

        @Test
        void allReviewersFailing_leavesChapterUnverified() {
            fixture.workers.register(WorkerRoles.CONSISTENCY_REVIEWER, Workers.failing(FailureKind.PROVIDER_ERROR, "down"));
            fixture.workers.register(WorkerRoles.QUALITY_REVIEWER, Workers.failing(FailureKind.RATE_LIMITED, "quota"));

            ChapterRunResult result = fixture.pipeline().run(1);

            assertEquals(PipelineState.DONE, result.state());
            assertEquals(ChapterStatus.COMPLETED_WITH_WARNINGS, result.status());
            assertEquals(2, result.issues().size());
        }

        @Test
        void failedRevision_keepsPreviousSceneText() {
            AtomicInteger reviews = new AtomicInteger();
            fixture.workers.register(WorkerRoles.QUALITY_REVIEWER, Workers.answering(payload ->
                reviews.incrementAndGet() == 1
                    ? Map.of("findings", List.of(finding("blocking", 0, "weak opening")))
                    : Map.of("findings", List.of())));
            fixture.workers.register(WorkerRoles.REVISER, Workers.failing(FailureKind.PROVIDER_ERROR, "down"));

            ChapterRunResult result = fixture.pipeline().run(1);

            assertTrue(result.isDone());
            assertTrue(result.snapshot().text().contains("Scene 0 of chapter 1"));
            assertTrue(result.issues().stream().map(StageIssue::stageName).anyMatch("revise_round_1"::equals));
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        void plannerFailure_failsInPlanning() throws Exception {
            fixture.workers.register(WorkerRoles.PLANNER, Workers.failing(FailureKind.PROVIDER_ERROR, "no model"));

            ChapterRunResult result = fixture.pipeline().run(1);

            assertEquals(PipelineState.FAILED, result.state());
            assertEquals(PipelineState.PLANNING, result.failedAt());
            assertEquals(ChapterStatus.FAILED, result.status());
            assertTrue(result.reason().startsWith("planning failed"));
            assertNull(result.snapshot());

            List<LoggedMessage> failed = awaitMessages(Topics.CHAPTER_FAILED, 1, 1);
            assertEquals("PLANNING", failed.get(0).message().payload().get("state"));
        }

        @Test
        void outlineWithoutScenes_failsInPlanning() {
            fixture.workers.register(WorkerRoles.PLANNER,
                Workers.constant(Map.of("outline", Map.of("title", "Empty", "scenes", List.of()))));

            ChapterRunResult result = fixture.pipeline().run(1);

            assertEquals(PipelineState.PLANNING, result.failedAt());
            assertTrue(result.reason().contains("without scenes"));
        }

        @Test
        void replyWithoutOutline_failsInPlanning() {
            fixture.workers.register(WorkerRoles.PLANNER, Workers.constant(Map.of("plan", "freeform")));

            ChapterRunResult result = fixture.pipeline().run(1);

            assertEquals(PipelineState.PLANNING, result.failedAt());
        }

        @Test
        void composerFailure_failsInComposing() {
            fixture.workers.register(WorkerRoles.COMPOSER, Workers.answering(payload -> {
                if (((Number) payload.get("scene_index")).intValue() == 1) {
                    throw new IllegalStateException("writer crashed");
                }
                return Map.of("scene_text", "ok");
            }));

            ChapterRunResult result = fixture.pipeline().run(1);

            assertEquals(PipelineState.COMPOSING, result.failedAt());
            assertTrue(result.reason().contains("scene-001"));
            assertTrue(fixture.store.find(1).isEmpty());
        }

        @Test
        void blankSceneText_failsInComposing() {
            fixture.workers.register(WorkerRoles.COMPOSER, Workers.constant(Map.of("scene_text", "  ")));

            ChapterRunResult result = fixture.pipeline().run(1);

            assertEquals(PipelineState.COMPOSING, result.failedAt());
        }

        @Test
        void missingWorker_isAConfigurationError() {
            fixture.workers.unregister(WorkerRoles.REVISER);

            ConfigurationException ex = assertThrows(ConfigurationException.class, () -> fixture.pipeline().run(1));
            assertTrue(ex.getMessage().contains(WorkerRoles.REVISER));
        }
    }

    @Nested
    @DisplayName("Finalize retry")
    class FinalizeRetry {

        @Test
        void failedCommit_canBeRetriedWithoutDuplicateVersions() {
            FlakyStore store = new FlakyStore(1);
            fixture.close();
            fixture = new PipelineFixture(store);
            ChapterPipeline pipeline = fixture.pipeline();

            ChapterRunResult failed = pipeline.run(1);

            assertEquals(PipelineState.FAILED, failed.state());
            assertEquals(PipelineState.FINALIZING, failed.failedAt());
            assertTrue(failed.isRetryableFinalize());
            assertTrue(store.find(1).isEmpty());

            ChapterRunResult retried = pipeline.retryFinalize(failed);

            assertEquals(PipelineState.DONE, retried.state());
            assertEquals(ChapterStatus.DONE, retried.status());
            assertEquals(1, store.versionCount(1));
            assertEquals(failed.snapshot().contentHash(), store.find(1).orElseThrow().contentHash());

            // committing the same snapshot again is a no-op
            store.commit(1, failed.snapshot());
            assertEquals(1, store.versionCount(1));
            assertThrows(IllegalArgumentException.class, () -> pipeline.retryFinalize(retried));
        }

        @Test
        void repeatedCommitFailure_staysRetryable() {
            FlakyStore store = new FlakyStore(2);
            fixture.close();
            fixture = new PipelineFixture(store);
            ChapterPipeline pipeline = fixture.pipeline();

            ChapterRunResult retried = pipeline.retryFinalize(pipeline.run(1));

            assertTrue(retried.isRetryableFinalize());
            assertTrue(retried.reason().startsWith("persistence failed"));
            assertTrue(pipeline.retryFinalize(retried).isDone());
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        void cancellingScope_failsChapterAsCancelled() throws Exception {
            CountDownLatch composing = new CountDownLatch(1);
            fixture.workers.register(WorkerRoles.COMPOSER, (payload, deadline) -> {
                composing.countDown();
                return new CompletableFuture<>();
            });
            CancellationScope scope = new CancellationScope();
            ChapterPipeline pipeline = fixture.pipeline(PipelineSettings.uniform(1, Duration.ofSeconds(30)));

            CompletableFuture<ChapterRunResult> running =
                CompletableFuture.supplyAsync(() -> pipeline.run(1, null, scope));
            assertTrue(composing.await(2, TimeUnit.SECONDS));
            scope.cancel("cancelled");

            ChapterRunResult result = running.get(5, TimeUnit.SECONDS);
            assertEquals(PipelineState.FAILED, result.state());
            assertEquals(PipelineState.COMPOSING, result.failedAt());
            assertEquals("cancelled", result.reason());
            assertTrue(fixture.store.find(1).isEmpty());
        }

        @Test
        void alreadyCancelledScope_stopsBeforePlanning() {
            AtomicInteger plans = new AtomicInteger();
            fixture.workers.register(WorkerRoles.PLANNER, Workers.answering(payload -> {
                plans.incrementAndGet();
                return Map.of();
            }));
            CancellationScope scope = new CancellationScope();
            scope.cancel("run cancelled");

            ChapterRunResult result = fixture.pipeline().run(1, null, scope);

            assertEquals(PipelineState.PLANNING, result.failedAt());
            assertEquals("cancelled", result.reason());
            assertEquals(0, plans.get());
        }
    }

    private List<LoggedMessage> awaitMessages(String topic, int chapter, int count) {
        await().atMost(Duration.ofSeconds(2)).until(
            () -> fixture.messageLog.query(Optional.of(topic), Optional.of(chapter), 100).size() >= count);
        return fixture.messageLog.query(Optional.of(topic), Optional.of(chapter), 100);
    }

    /** In-memory store whose first {@code failures} commits throw. */
    private static final class FlakyStore implements ChapterStore {

        private final InMemoryChapterStore delegate = new InMemoryChapterStore();
        private final AtomicInteger remainingFailures;

        private FlakyStore(int failures) {
            this.remainingFailures = new AtomicInteger(failures);
        }

        @Override
        public void commit(int chapterNumber, ChapterSnapshot snapshot) {
            if (remainingFailures.getAndDecrement() > 0) {
                throw new PersistenceException("disk full");
            }
            delegate.commit(chapterNumber, snapshot);
        }

        @Override
        public Optional<ChapterSnapshot> find(int chapterNumber) {
            return delegate.find(chapterNumber);
        }

        @Override
        public List<Integer> committedChapters() {
            return delegate.committedChapters();
        }

        @Override
        public int versionCount(int chapterNumber) {
            return delegate.versionCount(chapterNumber);
        }

        @Override
        public void saveIntermediate(int chapterNumber, String name, Object content) {
            delegate.saveIntermediate(chapterNumber, name, content);
        }
    }
}
