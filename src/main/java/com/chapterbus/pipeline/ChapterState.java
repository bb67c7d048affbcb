package com.chapterbus.pipeline;

import com.chapterbus.stage.StageIssue;
import com.chapterbus.stage.StageResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Working state of one orchestrator run. Owned by the run's thread; never shared.
 *
 * State only moves forward through {@link PipelineState}, or to FAILED.
 */
public class ChapterState {

    private final int chapterNumber;
    private final ChapterSnapshot previousChapter;

    private PipelineState state = PipelineState.PLANNING;
    private ChapterStatus status = ChapterStatus.IN_PROGRESS;
    private PipelineState failedAt;
    private String reason;

    private ChapterOutline outline;
    private Map<String, Object> setting = Map.of();
    private final SortedMap<String, Map<String, Object>> reactions = new TreeMap<>();
    private final List<String> scenes = new ArrayList<>();
    private String assembledText = "";
    private final List<ReviewFinding> findings = new ArrayList<>();
    private final List<ReviewFinding> unresolvedFindings = new ArrayList<>();
    private int revisionRound;

    private final List<StageResult> stageResults = new ArrayList<>();
    private final List<StageIssue> issues = new ArrayList<>();
    private final List<StageTiming> timings = new ArrayList<>();

    private String currentStage;
    private Instant currentStageStartedAt;

    public ChapterState(int chapterNumber, ChapterSnapshot previousChapter) {
        this.chapterNumber = chapterNumber;
        this.previousChapter = previousChapter;
    }

    void advanceTo(PipelineState next) {
        if (state.isTerminal()) {
            throw new IllegalStateException("chapter " + chapterNumber + " is already " + state);
        }
        if (next != PipelineState.FAILED && next.ordinal() <= state.ordinal()) {
            throw new IllegalStateException("chapter " + chapterNumber + " cannot move from " + state + " to " + next);
        }
        state = next;
    }

    void fail(String why) {
        if (state == PipelineState.FAILED) {
            return;
        }
        failedAt = state;
        reason = why;
        status = ChapterStatus.FAILED;
        state = PipelineState.FAILED;
    }

    void beginStage(String name) {
        currentStage = name;
        currentStageStartedAt = Instant.now();
    }

    void endStage(String outcome) {
        if (currentStage == null) {
            return;
        }
        timings.add(new StageTiming(currentStage, outcome, currentStageStartedAt, Instant.now()));
        currentStage = null;
        currentStageStartedAt = null;
    }

    void record(StageResult result) {
        stageResults.add(result);
        issues.addAll(result.issues());
    }

    void setOutline(ChapterOutline outline) {
        this.outline = outline;
    }

    void setSetting(Map<String, Object> setting) {
        this.setting = setting == null ? Map.of() : setting;
    }

    void putReaction(String character, Map<String, Object> reaction) {
        reactions.put(character, reaction);
    }

    void addScene(String text) {
        scenes.add(text);
    }

    void replaceScene(int index, String text) {
        scenes.set(index, text);
    }

    void setAssembledText(String text) {
        this.assembledText = text;
    }

    void setFindings(List<ReviewFinding> latest) {
        findings.clear();
        findings.addAll(latest);
    }

    void setUnresolvedFindings(List<ReviewFinding> remaining) {
        unresolvedFindings.clear();
        unresolvedFindings.addAll(remaining);
    }

    void incrementRevisionRound() {
        revisionRound++;
    }

    void setStatus(ChapterStatus status) {
        this.status = status;
    }

    public int chapterNumber() {
        return chapterNumber;
    }

    public ChapterSnapshot previousChapter() {
        return previousChapter;
    }

    public PipelineState state() {
        return state;
    }

    public ChapterStatus status() {
        return status;
    }

    public PipelineState failedAt() {
        return failedAt;
    }

    public String reason() {
        return reason;
    }

    public ChapterOutline outline() {
        return outline;
    }

    public Map<String, Object> setting() {
        return setting;
    }

    public SortedMap<String, Map<String, Object>> reactions() {
        return Collections.unmodifiableSortedMap(reactions);
    }

    public List<String> scenes() {
        return Collections.unmodifiableList(scenes);
    }

    public String assembledText() {
        return assembledText;
    }

    public List<ReviewFinding> findings() {
        return List.copyOf(findings);
    }

    public List<ReviewFinding> unresolvedFindings() {
        return List.copyOf(unresolvedFindings);
    }

    public int revisionRound() {
        return revisionRound;
    }

    public List<StageResult> stageResults() {
        return List.copyOf(stageResults);
    }

    public List<StageIssue> issues() {
        return List.copyOf(issues);
    }

    public List<StageTiming> timings() {
        return List.copyOf(timings);
    }
}
