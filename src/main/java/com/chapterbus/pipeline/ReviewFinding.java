package com.chapterbus.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

/**
 * One reviewer observation. A finding without a valid scene index applies to the whole
 * chapter.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReviewFinding(Severity severity, String sourceStage, String description, Integer sceneIndex) {

    public ReviewFinding {
        severity = severity == null ? Severity.ADVISORY : severity;
        description = description == null ? "" : description;
    }

    @JsonIgnore
    public boolean isBlocking() {
        return severity.isBlocking();
    }

    /**
     * Whether a revision of {@code scene} should address this finding. A finding
     * without a scene index, or with one outside {@code [0, sceneCount)}, applies to
     * every scene.
     */
    public boolean appliesTo(int scene, int sceneCount) {
        if (sceneIndex == null || sceneIndex < 0 || sceneIndex >= sceneCount) {
            return true;
        }
        return sceneIndex == scene;
    }

    /**
     * Reads a reviewer item: either a map with severity/description/scene_index or a
     * bare string, which is taken as an advisory note.
     */
    static ReviewFinding fromReply(String sourceStage, Object item) {
        if (item instanceof Map<?, ?> map) {
            Object description = map.containsKey("description") ? map.get("description") : map.get("issue");
            return new ReviewFinding(
                Severity.fromValue(map.get("severity")),
                sourceStage,
                description == null ? String.valueOf(map) : String.valueOf(description),
                sceneIndexOf(map.get("scene_index")));
        }
        return new ReviewFinding(Severity.ADVISORY, sourceStage, String.valueOf(item), null);
    }

    private static Integer sceneIndexOf(Object raw) {
        if (raw instanceof Number number) {
            return number.intValue();
        }
        if (raw instanceof String text && !text.isBlank()) {
            try {
                return Integer.valueOf(text.trim());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }
}
