package com.chapterbus.pipeline;

import com.chapterbus.bus.EventBus;
import com.chapterbus.contract.Message;
import com.chapterbus.contract.Topics;
import com.chapterbus.persistence.ChapterStore;
import com.chapterbus.persistence.PersistenceException;
import com.chapterbus.stage.CancellationScope;
import com.chapterbus.stage.Stage;
import com.chapterbus.stage.StageExecutor;
import com.chapterbus.stage.StageIssue;
import com.chapterbus.stage.StageResult;
import com.chapterbus.stage.WorkerCall;
import com.chapterbus.worker.CharacterNameResolver;
import com.chapterbus.worker.WorkerRegistry;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Drives one chapter through
 * PLANNING, WORLD_AND_CHARACTERS, COMPOSING, ASSEMBLING, REVIEWING and FINALIZING.
 *
 * <p>Each run owns its {@link ChapterState}; the only inputs shared with other runs
 * are the previous chapter's immutable snapshot and the bus. A run never throws for
 * a chapter-level failure: it ends in FAILED with a reason and returns normally, so
 * sibling chapters are unaffected.
 *
 * <p>Worker payloads carry an {@code operation} key so one endpoint can serve several
 * roles. Replies are read by key: {@code outline}, {@code enriched_setting},
 * {@code reaction}, {@code scene_text}, {@code findings} and {@code revised_text}.
 */
public class ChapterPipeline {

    private static final Logger log = LoggerFactory.getLogger(ChapterPipeline.class);

    public static final String STAGE_PLAN = "plan";
    public static final String STAGE_WORLD_AND_CHARACTERS = "world_and_characters";
    public static final String STAGE_COMPOSE = "compose";
    public static final String STAGE_ASSEMBLE = "assemble";
    public static final String STAGE_REVIEW = "review_round_";
    public static final String STAGE_REVISE = "revise_round_";
    public static final String STAGE_FINALIZE = "finalize";

    static final String WORLD_CALL = "world";
    static final String CHARACTER_CALL = "character:";
    static final String CONSISTENCY_CALL = "consistency";
    static final String QUALITY_CALL = "quality";

    private static final String MDC_CHAPTER = "chapter";
    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {};

    private final EventBus bus;
    private final StageExecutor stageExecutor;
    private final WorkerRegistry workers;
    private final ChapterStore store;
    private final PipelineSettings settings;
    private final ObjectMapper mapper;

    public ChapterPipeline(EventBus bus,
                           StageExecutor stageExecutor,
                           WorkerRegistry workers,
                           ChapterStore store,
                           PipelineSettings settings,
                           ObjectMapper mapper) {
        this.bus = bus;
        this.stageExecutor = stageExecutor;
        this.workers = workers;
        this.store = store;
        this.settings = settings;
        this.mapper = mapper;
    }

    public PipelineSettings settings() {
        return settings;
    }

    public ChapterRunResult run(int chapterNumber) {
        return run(chapterNumber, null, new CancellationScope());
    }

    /**
     * Runs the chapter to DONE or FAILED.
     *
     * @param previousChapter snapshot of the chapter this one continues from, or null
     * @throws com.chapterbus.contract.ConfigurationException when a required worker is not registered
     */
    public ChapterRunResult run(int chapterNumber, ChapterSnapshot previousChapter, CancellationScope scope) {
        workers.requireWorkers(WorkerRoles.REQUIRED);

        String previousMdc = MDC.get(MDC_CHAPTER);
        MDC.put(MDC_CHAPTER, String.valueOf(chapterNumber));
        ChapterState state = new ChapterState(chapterNumber, previousChapter);
        ChapterSnapshot snapshot = null;
        try {
            log.info("=== Generating chapter {} ===", chapterNumber);
            plan(state, scope);
            gatherWorldAndCharacters(state, scope);
            compose(state, scope);
            state.advanceTo(PipelineState.ASSEMBLING);
            assembleStage(state);
            review(state, scope);
            snapshot = finalizeChapter(state, scope);
        } catch (ChapterCancelledException ex) {
            fail(state, "cancelled");
        } catch (ChapterFailure ex) {
            fail(state, ex.getMessage());
        } catch (RuntimeException ex) {
            log.error("Chapter {} hit an unexpected error in {}", chapterNumber, state.state(), ex);
            fail(state, "unexpected error: " + ex.getMessage());
        } finally {
            if (previousMdc != null) {
                MDC.put(MDC_CHAPTER, previousMdc);
            } else {
                MDC.remove(MDC_CHAPTER);
            }
        }
        if (state.state() == PipelineState.DONE) {
            log.info("=== Chapter {} complete ({}, {} revision round(s)) ===",
                chapterNumber, state.status(), state.revisionRound());
        }
        return ChapterRunResult.from(state, snapshot);
    }

    /**
     * Re-commits the snapshot of a run that failed while finalizing. The snapshot is
     * committed unchanged, so a store that already holds it does not gain a version.
     */
    public ChapterRunResult retryFinalize(ChapterRunResult failed) {
        if (!failed.isRetryableFinalize()) {
            throw new IllegalArgumentException(
                "chapter " + failed.chapterNumber() + " did not fail while finalizing");
        }
        ChapterSnapshot snapshot = failed.snapshot();
        try {
            store.commit(failed.chapterNumber(), snapshot);
        } catch (PersistenceException ex) {
            log.warn("Retrying finalize of chapter {} failed again: {}", failed.chapterNumber(), ex.getMessage());
            return new ChapterRunResult(failed.chapterNumber(), PipelineState.FAILED, PipelineState.FINALIZING,
                ChapterStatus.FAILED, "persistence failed: " + ex.getMessage(), failed.revisionRounds(),
                failed.issues(), failed.unresolvedFindings(), failed.timings(), failed.stageResults(), snapshot);
        }
        log.info("Chapter {} finalized on retry", failed.chapterNumber());
        announce(Topics.CHAPTER_FINALIZED, failed.chapterNumber(), finalizedPayload(snapshot));
        return new ChapterRunResult(failed.chapterNumber(), PipelineState.DONE, null, snapshot.status(), null,
            failed.revisionRounds(), failed.issues(), failed.unresolvedFindings(), failed.timings(),
            failed.stageResults(), snapshot);
    }

    private void plan(ChapterState state, CancellationScope scope) {
        List<String> cast = castNames();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("operation", "plan_chapter");
        payload.put("chapter_number", state.chapterNumber());
        payload.put("available_characters", cast);
        previousChapterContext(state).ifPresent(context -> payload.put("previous_chapter", context));

        StageResult result = runStage(state, scope, Stage.sequential(STAGE_PLAN,
            List.of(WorkerCall.of("outline", WorkerRoles.PLANNER, payload, settings.planTimeout()))));
        if (!result.isSuccess()) {
            throw new ChapterFailure("planning failed: " + describe(result.issues()));
        }

        Object raw = result.output("outline").get("outline");
        if (raw == null) {
            throw new ChapterFailure("planner returned no outline");
        }
        ChapterOutline outline;
        try {
            if (raw instanceof Map<?, ?> fields) {
                // the outline always belongs to the chapter being planned
                Map<Object, Object> numbered = new LinkedHashMap<>(fields);
                numbered.put("number", state.chapterNumber());
                raw = numbered;
            }
            outline = mapper.convertValue(raw, ChapterOutline.class);
        } catch (IllegalArgumentException ex) {
            throw new ChapterFailure("planner returned an unreadable outline: " + ex.getMessage());
        }
        if (outline.scenes().isEmpty()) {
            throw new ChapterFailure("planner returned an outline without scenes");
        }

        CharacterNameResolver resolver = new CharacterNameResolver(cast);
        List<ScenePlan> resolved = new ArrayList<>();
        for (ScenePlan scene : outline.scenes()) {
            resolved.add(resolveCharacters(scene, resolver));
        }
        outline = outline.withScenes(resolved);
        state.setOutline(outline);
        log.info("Planned chapter {}: \"{}\" with {} scene(s)", state.chapterNumber(), outline.title(), outline.sceneCount());
        saveIntermediate(state, "outline", outline);
    }

    private void gatherWorldAndCharacters(ChapterState state, CancellationScope scope) {
        state.advanceTo(PipelineState.WORLD_AND_CHARACTERS);
        ChapterOutline outline = state.outline();

        List<WorkerCall> calls = new ArrayList<>();
        Map<String, Object> worldPayload = new LinkedHashMap<>();
        worldPayload.put("operation", "validate_setting");
        worldPayload.put("chapter_number", state.chapterNumber());
        worldPayload.put("scenes", sceneMaps(outline.scenes()));
        calls.add(WorkerCall.of(WORLD_CALL, WorkerRoles.WORLD_VALIDATOR, worldPayload, settings.worldTimeout()));

        for (String character : activeCharacters(outline)) {
            List<Map<String, Object>> appearances = new ArrayList<>();
            for (ScenePlan scene : outline.scenes()) {
                if (scene.charactersPresent().contains(character)) {
                    appearances.add(sceneMap(scene));
                }
            }
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("operation", "react");
            payload.put("chapter_number", state.chapterNumber());
            payload.put("character", character);
            payload.put("scenes", appearances);
            calls.add(WorkerCall.of(CHARACTER_CALL + character, WorkerRoles.character(character),
                payload, settings.characterTimeout()));
        }

        StageResult result = runStage(state, scope,
            Stage.parallel(STAGE_WORLD_AND_CHARACTERS, calls, true, settings.parallelFanOut()));
        if (!result.isSuccess()) {
            log.warn("World and character stage was {}: {}", result.status(), describe(result.issues()));
        }

        Map<String, Object> world = result.output(WORLD_CALL);
        state.setSetting(world != null ? asMap(world.get("enriched_setting")) : Map.of());
        result.outputs().forEach((key, output) -> {
            if (key.startsWith(CHARACTER_CALL)) {
                Object reaction = output.get("reaction");
                state.putReaction(key.substring(CHARACTER_CALL.length()),
                    reaction != null ? asMap(reaction) : output);
            }
        });
    }

    private void compose(ChapterState state, CancellationScope scope) {
        state.advanceTo(PipelineState.COMPOSING);
        ChapterOutline outline = state.outline();

        List<WorkerCall> calls = new ArrayList<>();
        for (int i = 0; i < outline.sceneCount(); i++) {
            int sceneIndex = i;
            calls.add(WorkerCall.chained(sceneKey(sceneIndex), WorkerRoles.COMPOSER,
                previous -> composePayload(state, sceneIndex, previous), settings.composeTimeout()));
        }

        StageResult result = runStage(state, scope, Stage.sequential(STAGE_COMPOSE, calls));
        if (!result.isSuccess()) {
            throw new ChapterFailure("composing failed: " + describe(result.issues()));
        }
        for (int i = 0; i < outline.sceneCount(); i++) {
            Object text = result.output(sceneKey(i)).get("scene_text");
            if (text == null || String.valueOf(text).isBlank()) {
                throw new ChapterFailure("writer returned no text for scene " + i);
            }
            state.addScene(String.valueOf(text));
            saveIntermediate(state, "scene_" + i + "_draft", String.valueOf(text));
        }
    }

    private Map<String, Object> composePayload(ChapterState state, int sceneIndex, Map<String, Object> previous) {
        ScenePlan scene = state.outline().scenes().get(sceneIndex);
        Map<String, Object> reactions = new LinkedHashMap<>();
        for (String character : scene.charactersPresent()) {
            Map<String, Object> reaction = state.reactions().get(character);
            if (reaction != null) {
                reactions.put(character, reaction);
            }
        }
        Object previousText = previous.get("scene_text");

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("operation", "compose_scene");
        payload.put("chapter_number", state.chapterNumber());
        payload.put("scene_index", sceneIndex);
        payload.put("scene_plan", sceneMap(scene));
        payload.put("setting", state.setting());
        payload.put("character_reactions", reactions);
        payload.put("previous_scene_text", previousText != null ? String.valueOf(previousText) : "");
        previousChapterContext(state).ifPresent(context -> payload.put("previous_chapter", context));
        return payload;
    }

    private void assembleStage(ChapterState state) {
        state.beginStage(STAGE_ASSEMBLE);
        try {
            assemble(state);
        } catch (ChapterFailure ex) {
            state.endStage("FAILURE");
            throw ex;
        }
        state.endStage("SUCCESS");
    }

    /** Local step; also re-run after every revision round. */
    private void assemble(ChapterState state) {
        ChapterOutline outline = state.outline();
        if (state.scenes().size() != outline.sceneCount()) {
            throw new ChapterFailure("scene count mismatch: outline has " + outline.sceneCount()
                + " scene(s), composed " + state.scenes().size());
        }
        String header = "## Chapter " + state.chapterNumber() + ": " + outline.title() + "\n\n";
        state.setAssembledText(header + String.join("\n\n", state.scenes()));
    }

    private void review(ChapterState state, CancellationScope scope) {
        state.advanceTo(PipelineState.REVIEWING);
        List<ReviewFinding> blocking = List.of();
        boolean unverified = false;

        while (true) {
            int round = state.revisionRound();
            StageResult result = runStage(state, scope, reviewStage(state, round));
            if (result.isFailure()) {
                log.warn("No reviewer answered in round {}; chapter {} is unverified: {}",
                    round + 1, state.chapterNumber(), describe(result.issues()));
                unverified = true;
                state.setFindings(List.of());
                blocking = List.of();
                break;
            }

            List<ReviewFinding> findings = new ArrayList<>();
            findings.addAll(findingsFrom(result.output(CONSISTENCY_CALL), STAGE_REVIEW + CONSISTENCY_CALL));
            findings.addAll(findingsFrom(result.output(QUALITY_CALL), STAGE_REVIEW + QUALITY_CALL));
            state.setFindings(findings);
            saveIntermediate(state, STAGE_REVIEW + (round + 1), Map.of("findings", findings));

            blocking = findings.stream().filter(ReviewFinding::isBlocking).toList();
            if (blocking.isEmpty()) {
                log.info("Review round {}: {} finding(s), none blocking", round + 1, findings.size());
                break;
            }
            if (round >= settings.maxRevisionRounds()) {
                log.warn("Revision budget of {} round(s) spent with {} blocking finding(s)",
                    settings.maxRevisionRounds(), blocking.size());
                break;
            }
            log.info("Review round {}: {} blocking finding(s), revising", round + 1, blocking.size());
            revise(state, scope, blocking, round);
            state.incrementRevisionRound();
            assemble(state);
        }

        state.setUnresolvedFindings(blocking);
        if (blocking.stream().anyMatch(finding -> finding.severity() == Severity.FATAL)) {
            throw new ChapterFailure("unresolved fatal review finding: " + blocking.stream()
                .filter(finding -> finding.severity() == Severity.FATAL)
                .map(ReviewFinding::description)
                .collect(Collectors.joining("; ")));
        }
        if (!blocking.isEmpty() || unverified) {
            state.setStatus(ChapterStatus.COMPLETED_WITH_WARNINGS);
        }
    }

    private Stage reviewStage(ChapterState state, int round) {
        Map<String, Object> consistency = new LinkedHashMap<>();
        consistency.put("operation", "check_consistency");
        consistency.put("chapter_number", state.chapterNumber());
        consistency.put("chapter_text", state.assembledText());
        consistency.put("setting", state.setting());

        Map<String, Object> quality = new LinkedHashMap<>();
        quality.put("operation", "check_quality");
        quality.put("chapter_number", state.chapterNumber());
        quality.put("chapter_text", state.assembledText());
        quality.put("outline", mapper.convertValue(state.outline(), MAP));

        return Stage.parallel(STAGE_REVIEW + (round + 1), List.of(
            WorkerCall.of(CONSISTENCY_CALL, WorkerRoles.CONSISTENCY_REVIEWER, consistency, settings.reviewTimeout()),
            WorkerCall.of(QUALITY_CALL, WorkerRoles.QUALITY_REVIEWER, quality, settings.reviewTimeout())),
            true, settings.parallelFanOut());
    }

    private void revise(ChapterState state, CancellationScope scope, List<ReviewFinding> blocking, int round) {
        int sceneCount = state.scenes().size();
        SortedSet<Integer> affected = new TreeSet<>();
        for (ReviewFinding finding : blocking) {
            for (int i = 0; i < sceneCount; i++) {
                if (finding.appliesTo(i, sceneCount)) {
                    affected.add(i);
                }
            }
        }

        List<WorkerCall> calls = new ArrayList<>();
        for (int sceneIndex : affected) {
            List<String> feedback = blocking.stream()
                .filter(finding -> finding.appliesTo(sceneIndex, sceneCount))
                .map(ReviewFinding::description)
                .toList();
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("operation", "revise_scene");
            payload.put("chapter_number", state.chapterNumber());
            payload.put("scene_index", sceneIndex);
            payload.put("scene_text", state.scenes().get(sceneIndex));
            payload.put("findings", feedback);
            payload.put("revision_round", round + 1);
            calls.add(WorkerCall.of(sceneKey(sceneIndex), WorkerRoles.REVISER, payload, settings.revisionTimeout()));
        }

        StageResult result = runStage(state, scope,
            Stage.parallel(STAGE_REVISE + (round + 1), calls, true, settings.parallelFanOut()));
        for (int sceneIndex : affected) {
            Map<String, Object> output = result.output(sceneKey(sceneIndex));
            Object revised = output != null ? output.get("revised_text") : null;
            if (revised != null && !String.valueOf(revised).isBlank()) {
                state.replaceScene(sceneIndex, String.valueOf(revised));
            } else {
                log.warn("Scene {} keeps its previous text after revision round {}", sceneIndex, round + 1);
            }
        }
    }

    private ChapterSnapshot finalizeChapter(ChapterState state, CancellationScope scope) {
        checkCancelled(state, scope);
        state.advanceTo(PipelineState.FINALIZING);
        if (state.status() == ChapterStatus.IN_PROGRESS) {
            state.setStatus(ChapterStatus.DONE);
        }
        ChapterSnapshot snapshot = ChapterSnapshot.of(state);

        state.beginStage(STAGE_FINALIZE);
        try {
            store.commit(state.chapterNumber(), snapshot);
        } catch (PersistenceException ex) {
            state.endStage("FAILURE");
            fail(state, "persistence failed: " + ex.getMessage());
            return snapshot;
        }
        state.endStage("SUCCESS");
        state.advanceTo(PipelineState.DONE);
        announce(Topics.CHAPTER_FINALIZED, state.chapterNumber(), finalizedPayload(snapshot));
        return snapshot;
    }

    private StageResult runStage(ChapterState state, CancellationScope scope, Stage stage) {
        checkCancelled(state, scope);
        state.beginStage(stage.name());
        announce(Topics.STAGE_STARTED, state.chapterNumber(), Map.of(
            "chapter_number", state.chapterNumber(),
            "stage", stage.name(),
            "calls", stage.calls().size()));

        StageResult result = stageExecutor.execute(stage, state.chapterNumber(), scope);
        state.record(result);
        state.endStage(result.status().name());
        announce(Topics.STAGE_COMPLETED, state.chapterNumber(), Map.of(
            "chapter_number", state.chapterNumber(),
            "stage", stage.name(),
            "status", result.status().name(),
            "issues", result.issues().size()));

        checkCancelled(state, scope);
        return result;
    }

    private void checkCancelled(ChapterState state, CancellationScope scope) {
        if (scope.isCancelled()) {
            throw new ChapterCancelledException(state.chapterNumber(), scope.reason());
        }
        if (Thread.currentThread().isInterrupted()) {
            scope.cancel("interrupted");
            throw new ChapterCancelledException(state.chapterNumber(), "interrupted");
        }
    }

    private void fail(ChapterState state, String reason) {
        PipelineState at = state.state();
        state.fail(reason);
        log.warn("Chapter {} failed in {}: {}", state.chapterNumber(), at, reason);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("chapter_number", state.chapterNumber());
        payload.put("state", at.name());
        payload.put("reason", reason);
        announce(Topics.CHAPTER_FAILED, state.chapterNumber(), payload);
    }

    private void announce(String topic, int chapterNumber, Map<String, Object> payload) {
        try {
            bus.publish(Message.event(topic, payload, chapterNumber));
        } catch (IllegalStateException ex) {
            log.debug("Lifecycle event {} not published: {}", topic, ex.getMessage());
        }
    }

    private void saveIntermediate(ChapterState state, String name, Object content) {
        if (!settings.saveIntermediates()) {
            return;
        }
        try {
            store.saveIntermediate(state.chapterNumber(), name, content);
        } catch (RuntimeException ex) {
            log.warn("Failed to save intermediate {} for chapter {}: {}", name, state.chapterNumber(), ex.getMessage());
        }
    }

    private List<String> castNames() {
        return workers.workerNamesWithPrefix(WorkerRoles.CHARACTER_PREFIX).stream()
            .map(WorkerRoles::characterName)
            .toList();
    }

    private ScenePlan resolveCharacters(ScenePlan scene, CharacterNameResolver resolver) {
        Set<String> present = new LinkedHashSet<>();
        for (String name : scene.charactersPresent()) {
            resolver.resolve(name).ifPresentOrElse(present::add,
                () -> log.warn("Character '{}' could not be resolved to any registered worker", name));
        }
        String pov = resolver.resolve(scene.povCharacter()).orElse(scene.povCharacter());
        return scene.withCharacters(new ArrayList<>(present), pov);
    }

    private static Set<String> activeCharacters(ChapterOutline outline) {
        Set<String> active = new LinkedHashSet<>();
        outline.scenes().forEach(scene -> active.addAll(scene.charactersPresent()));
        return active;
    }

    private Optional<Map<String, Object>> previousChapterContext(ChapterState state) {
        ChapterSnapshot previous = state.previousChapter();
        if (previous == null) {
            return Optional.empty();
        }
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("chapter_number", previous.chapterNumber());
        context.put("title", previous.title());
        context.put("summary", previous.summary());
        return Optional.of(context);
    }

    private List<Map<String, Object>> sceneMaps(List<ScenePlan> scenes) {
        return scenes.stream().map(this::sceneMap).toList();
    }

    private Map<String, Object> sceneMap(ScenePlan scene) {
        return mapper.convertValue(scene, MAP);
    }

    private static List<ReviewFinding> findingsFrom(Map<String, Object> reply, String sourceStage) {
        if (reply == null) {
            return List.of();
        }
        Object raw = reply.containsKey("findings") ? reply.get("findings") : reply.get("issues");
        if (!(raw instanceof List<?> items)) {
            return List.of();
        }
        List<ReviewFinding> findings = new ArrayList<>();
        for (Object item : items) {
            if (item != null) {
                findings.add(ReviewFinding.fromReply(sourceStage, item));
            }
        }
        return findings;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        if (value instanceof Map<?, ?> map) {
            return Collections.unmodifiableMap((Map<String, Object>) map);
        }
        return Map.of();
    }

    private static Map<String, Object> finalizedPayload(ChapterSnapshot snapshot) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("chapter_number", snapshot.chapterNumber());
        payload.put("title", snapshot.title());
        payload.put("status", snapshot.status().name());
        payload.put("content_hash", snapshot.contentHash());
        payload.put("word_count", snapshot.wordCount());
        return payload;
    }

    private static String sceneKey(int sceneIndex) {
        return String.format("scene-%03d", sceneIndex);
    }

    private static String describe(List<StageIssue> issues) {
        if (issues.isEmpty()) {
            return "no details";
        }
        return issues.stream()
            .map(issue -> issue.callKey() + " " + issue.kind()
                + (issue.description() != null ? " (" + issue.description() + ")" : ""))
            .collect(Collectors.joining("; "));
    }

    /** Chapter-level failure raised inside a run and turned into FAILED by {@link #run}. */
    private static final class ChapterFailure extends RuntimeException {
        private ChapterFailure(String message) {
            super(message);
        }
    }
}
