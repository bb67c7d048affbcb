package com.chapterbus.bus;

import com.chapterbus.contract.Message;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Bounded in-memory log; the oldest entries are evicted once {@code capacity} is reached.
 */
public class InMemoryMessageLog implements MessageLog {

    private final Deque<LoggedMessage> entries = new ArrayDeque<>();
    private final AtomicLong sequence = new AtomicLong(0);
    private final int capacity;

    public InMemoryMessageLog(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized LoggedMessage append(Message message) {
        LoggedMessage entry = new LoggedMessage(sequence.incrementAndGet(), message);
        entries.addLast(entry);
        while (entries.size() > capacity) {
            entries.removeFirst();
        }
        return entry;
    }

    @Override
    public synchronized List<LoggedMessage> query(Optional<String> topic,
                                                  Optional<Integer> chapterNumber,
                                                  int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }

        return entries.stream()
            .filter(e -> topic.map(t -> t.equals(e.message().topic())).orElse(true))
            .filter(e -> chapterNumber.map(c -> c.equals(e.message().chapterNumber())).orElse(true))
            .limit(limit)
            .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public long getLatestSequence() {
        return sequence.get();
    }

    @Override
    public synchronized void clear() {
        entries.clear();
    }
}
