package com.chapterbus.pipeline;

import com.chapterbus.config.ChapterBusProperties;
import com.chapterbus.contract.ConfigurationException;

import java.time.Duration;

/**
 * Validated per-run pipeline knobs.
 */
public record PipelineSettings(
    int maxRevisionRounds,
    Duration planTimeout,
    Duration worldTimeout,
    Duration characterTimeout,
    Duration composeTimeout,
    Duration reviewTimeout,
    Duration revisionTimeout,
    boolean saveIntermediates,
    boolean parallelFanOut
) {

    public PipelineSettings {
        if (maxRevisionRounds < 0) {
            throw new ConfigurationException("max revision rounds must be >= 0, got " + maxRevisionRounds);
        }
        requirePositive("plan", planTimeout);
        requirePositive("world", worldTimeout);
        requirePositive("character", characterTimeout);
        requirePositive("compose", composeTimeout);
        requirePositive("review", reviewTimeout);
        requirePositive("revision", revisionTimeout);
    }

    public static PipelineSettings from(ChapterBusProperties properties) {
        ChapterBusProperties.Pipeline pipeline = properties.getPipeline();
        return new PipelineSettings(
            pipeline.getMaxRevisionRounds(),
            pipeline.getPlanTimeout(),
            pipeline.getWorldTimeout(),
            pipeline.getCharacterTimeout(),
            pipeline.getComposeTimeout(),
            pipeline.getReviewTimeout(),
            pipeline.getRevisionTimeout(),
            properties.getOutput().isSaveIntermediates(),
            pipeline.isParallelFanOut());
    }

    /** Same timeouts for every stage, concurrent fan-out; handy for embedding and tests. */
    public static PipelineSettings uniform(int maxRevisionRounds, Duration timeout) {
        return new PipelineSettings(maxRevisionRounds, timeout, timeout, timeout, timeout, timeout, timeout, false, true);
    }

    public PipelineSettings withCharacterTimeout(Duration timeout) {
        return new PipelineSettings(maxRevisionRounds, planTimeout, worldTimeout, timeout,
            composeTimeout, reviewTimeout, revisionTimeout, saveIntermediates, parallelFanOut);
    }

    public PipelineSettings withSaveIntermediates(boolean enabled) {
        return new PipelineSettings(maxRevisionRounds, planTimeout, worldTimeout, characterTimeout,
            composeTimeout, reviewTimeout, revisionTimeout, enabled, parallelFanOut);
    }

    /** When off, character, review and revision calls are issued one at a time. */
    public PipelineSettings withParallelFanOut(boolean enabled) {
        return new PipelineSettings(maxRevisionRounds, planTimeout, worldTimeout, characterTimeout,
            composeTimeout, reviewTimeout, revisionTimeout, saveIntermediates, enabled);
    }

    private static void requirePositive(String stage, Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new ConfigurationException(stage + " timeout must be positive");
        }
    }
}
