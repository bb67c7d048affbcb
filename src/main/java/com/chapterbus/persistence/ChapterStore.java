package com.chapterbus.persistence;

import com.chapterbus.pipeline.ChapterSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Persistence boundary for finalized chapters.
 */
public interface ChapterStore {

    /**
     * Persists {@code snapshot} as the current version of {@code chapterNumber}.
     * Committing a snapshot whose content hash equals the current version's is a no-op.
     *
     * @throws PersistenceException when the chapter could not be written
     */
    void commit(int chapterNumber, ChapterSnapshot snapshot);

    Optional<ChapterSnapshot> find(int chapterNumber);

    /** Chapter numbers with a committed version, ascending. */
    List<Integer> committedChapters();

    /** Number of distinct committed versions of a chapter. */
    int versionCount(int chapterNumber);

    /**
     * Stores a pipeline by-product (outline, scene draft, review round). Strings are
     * stored as text, anything else as JSON.
     */
    void saveIntermediate(int chapterNumber, String name, Object content);
}
