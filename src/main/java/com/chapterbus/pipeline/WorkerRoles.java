package com.chapterbus.pipeline;

import java.util.List;

/**
 * Worker names the chapter pipeline talks to. Character workers are registered as
 * {@code character.<name>}, one per cast member.
 */
public final class WorkerRoles {

    public static final String PLANNER = "plot.plan";
    public static final String WORLD_VALIDATOR = "world.validate";
    public static final String COMPOSER = "writer.compose";
    public static final String CONSISTENCY_REVIEWER = "world.consistency";
    public static final String QUALITY_REVIEWER = "plot.quality";
    public static final String REVISER = "writer.revise";
    public static final String CHARACTER_PREFIX = "character.";

    public static final List<String> REQUIRED = List.of(
        PLANNER, WORLD_VALIDATOR, COMPOSER, CONSISTENCY_REVIEWER, QUALITY_REVIEWER, REVISER);

    private WorkerRoles() {
    }

    public static String character(String name) {
        return CHARACTER_PREFIX + name;
    }

    public static String characterName(String workerName) {
        return workerName.startsWith(CHARACTER_PREFIX)
            ? workerName.substring(CHARACTER_PREFIX.length())
            : workerName;
    }
}
