package com.chapterbus.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Planner output for one chapter. Scene order is the order scenes are composed and
 * assembled in.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChapterOutline(
    int number,
    String title,
    String summary,
    String povCharacter,
    List<ScenePlan> scenes,
    String chapterGoal,
    String emotionalArc
) {

    public ChapterOutline {
        title = title == null || title.isBlank() ? "Chapter " + number : title;
        summary = summary == null ? "" : summary;
        povCharacter = povCharacter == null ? "" : povCharacter;
        scenes = scenes == null ? List.of() : List.copyOf(scenes);
        chapterGoal = chapterGoal == null ? "" : chapterGoal;
        emotionalArc = emotionalArc == null ? "" : emotionalArc;
    }

    public ChapterOutline withScenes(List<ScenePlan> resolved) {
        return new ChapterOutline(number, title, summary, povCharacter, resolved, chapterGoal, emotionalArc);
    }

    public int sceneCount() {
        return scenes.size();
    }
}
