package com.chapterbus.pipeline;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;

/**
 * Immutable, finalized view of a chapter. The only chapter data shared across runs:
 * dependent chapters read it, the store persists it.
 *
 * {@code contentHash} is the SHA-256 of {@code text}; committing the same chapter
 * with the same hash twice is a no-op.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ChapterSnapshot(
    int chapterNumber,
    String title,
    String text,
    ChapterOutline outline,
    List<ReviewFinding> unresolvedFindings,
    int revisionRounds,
    ChapterStatus status,
    String contentHash,
    Instant createdAt
) {

    private static final int SUMMARY_LENGTH = 500;

    public ChapterSnapshot {
        unresolvedFindings = unresolvedFindings == null ? List.of() : List.copyOf(unresolvedFindings);
        text = text == null ? "" : text;
        contentHash = contentHash == null ? hash(text) : contentHash;
        createdAt = createdAt == null ? Instant.now() : createdAt;
    }

    public static ChapterSnapshot of(ChapterState state) {
        return new ChapterSnapshot(
            state.chapterNumber(),
            state.outline() != null ? state.outline().title() : "Chapter " + state.chapterNumber(),
            state.assembledText(),
            state.outline(),
            state.unresolvedFindings(),
            state.revisionRound(),
            state.status() == ChapterStatus.IN_PROGRESS ? ChapterStatus.DONE : state.status(),
            null,
            Instant.now());
    }

    /** Short continuity context handed to the planner and writer of the next chapter. */
    public String summary() {
        return text.length() > SUMMARY_LENGTH ? text.substring(0, SUMMARY_LENGTH) + "..." : text;
    }

    public int wordCount() {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    static String hash(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is not available", ex);
        }
    }
}
