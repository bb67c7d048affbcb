package com.chapterbus.persistence;

import com.chapterbus.pipeline.ChapterSnapshot;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Keeps every committed version in memory. Used for tests and dry runs.
 */
public class InMemoryChapterStore implements ChapterStore {

    private final Map<Integer, List<ChapterSnapshot>> versions = new TreeMap<>();
    private final Map<Integer, Map<String, Object>> intermediates = new TreeMap<>();

    @Override
    public synchronized void commit(int chapterNumber, ChapterSnapshot snapshot) {
        List<ChapterSnapshot> history = versions.computeIfAbsent(chapterNumber, n -> new ArrayList<>());
        if (!history.isEmpty() && history.get(history.size() - 1).contentHash().equals(snapshot.contentHash())) {
            return;
        }
        history.add(snapshot);
    }

    @Override
    public synchronized Optional<ChapterSnapshot> find(int chapterNumber) {
        List<ChapterSnapshot> history = versions.get(chapterNumber);
        return history == null || history.isEmpty()
            ? Optional.empty()
            : Optional.of(history.get(history.size() - 1));
    }

    @Override
    public synchronized List<Integer> committedChapters() {
        return List.copyOf(versions.keySet());
    }

    @Override
    public synchronized int versionCount(int chapterNumber) {
        List<ChapterSnapshot> history = versions.get(chapterNumber);
        return history == null ? 0 : history.size();
    }

    @Override
    public synchronized void saveIntermediate(int chapterNumber, String name, Object content) {
        intermediates.computeIfAbsent(chapterNumber, n -> new LinkedHashMap<>()).put(name, content);
    }

    public synchronized Map<String, Object> intermediates(int chapterNumber) {
        return Map.copyOf(intermediates.getOrDefault(chapterNumber, Map.of()));
    }
}
