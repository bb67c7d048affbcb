package com.chapterbus.bus;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Topic → ordered handler list. Lists are replaced copy-on-write so dispatch can read
 * a stable snapshot without locking.
 */
public class SubscriptionRegistry {

    private final ConcurrentHashMap<String, List<Subscription>> byTopic = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final boolean singleHandlerTopics;

    public SubscriptionRegistry(boolean singleHandlerTopics) {
        this.singleHandlerTopics = singleHandlerTopics;
    }

    public Subscription add(String topic, MessageHandler handler, int priority) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic is required");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler is required");
        }
        Subscription subscription = new Subscription(
            UUID.randomUUID().toString(), topic, handler, priority, sequence.incrementAndGet());

        byTopic.compute(topic, (key, existing) -> {
            if (singleHandlerTopics && existing != null && !existing.isEmpty()) {
                throw new DuplicateSubscriptionException(topic);
            }
            List<Subscription> next = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
            next.add(subscription);
            next.sort(Subscription.DISPATCH_ORDER);
            return List.copyOf(next);
        });
        return subscription;
    }

    public boolean remove(Subscription subscription) {
        AtomicBoolean removed = new AtomicBoolean(false);
        byTopic.computeIfPresent(subscription.topic(), (key, existing) -> {
            List<Subscription> next = new ArrayList<>(existing);
            removed.set(next.removeIf(s -> s.id().equals(subscription.id())));
            return next.isEmpty() ? null : List.copyOf(next);
        });
        return removed.get();
    }

    /** Snapshot of the handlers currently subscribed to {@code topic}, in dispatch order. */
    public List<Subscription> handlersFor(String topic) {
        return byTopic.getOrDefault(topic, List.of());
    }

    public boolean hasHandlers(String topic) {
        return !handlersFor(topic).isEmpty();
    }

    public Set<String> topics() {
        return Set.copyOf(byTopic.keySet());
    }

    public int size() {
        return byTopic.values().stream().mapToInt(List::size).sum();
    }

    public boolean isSingleHandlerTopics() {
        return singleHandlerTopics;
    }
}
