package com.chapterbus.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScenePlan(
    String location,
    List<String> charactersPresent,
    String sceneGoal,
    String conflict,
    String expectedOutcome,
    List<String> beats,
    String povCharacter
) {

    public ScenePlan {
        location = location == null ? "" : location;
        charactersPresent = charactersPresent == null ? List.of() : List.copyOf(charactersPresent);
        sceneGoal = sceneGoal == null ? "" : sceneGoal;
        conflict = conflict == null ? "" : conflict;
        expectedOutcome = expectedOutcome == null ? "" : expectedOutcome;
        beats = beats == null ? List.of() : List.copyOf(beats);
        povCharacter = povCharacter == null ? "" : povCharacter;
    }

    public ScenePlan withCharacters(List<String> characters, String pov) {
        return new ScenePlan(location, characters, sceneGoal, conflict, expectedOutcome, beats, pov);
    }
}
