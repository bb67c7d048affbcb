package com.chapterbus.bus;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SubscriptionRegistryTest {

    private SubscriptionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SubscriptionRegistry(false);
    }

    @Test
    void handlers_orderedByPriorityThenRegistration() {
        Subscription second = registry.add("t", message -> { }, 0);
        Subscription urgent = registry.add("t", message -> { }, -1);
        Subscription third = registry.add("t", message -> { }, 0);

        List<Subscription> handlers = registry.handlersFor("t");

        assertEquals(List.of(urgent.id(), second.id(), third.id()),
            handlers.stream().map(Subscription::id).toList());
    }

    @Test
    void remove_dropsTopicWhenLastHandlerLeaves() {
        Subscription only = registry.add("t", message -> { }, 0);

        assertTrue(registry.remove(only));
        assertFalse(registry.remove(only));
        assertFalse(registry.hasHandlers("t"));
        assertTrue(registry.topics().isEmpty());
    }

    @Test
    void snapshot_isUnaffectedByLaterChanges() {
        registry.add("t", message -> { }, 0);
        List<Subscription> snapshot = registry.handlersFor("t");

        registry.add("t", message -> { }, 0);

        assertEquals(1, snapshot.size());
        assertEquals(2, registry.size());
    }

    @Test
    void singleHandlerTopics_rejectSecondSubscriber() {
        SubscriptionRegistry strict = new SubscriptionRegistry(true);
        strict.add("worker.plot.plan.request", message -> { }, 0);

        DuplicateSubscriptionException ex = assertThrows(DuplicateSubscriptionException.class,
            () -> strict.add("worker.plot.plan.request", message -> { }, 0));
        assertTrue(ex.getMessage().contains("worker.plot.plan.request"));
        assertEquals(1, strict.size());
    }

    @Test
    void blankTopic_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> registry.add(" ", message -> { }, 0));
        assertThrows(IllegalArgumentException.class, () -> registry.add("t", null, 0));
    }
}
