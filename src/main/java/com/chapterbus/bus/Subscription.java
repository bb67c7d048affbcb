package com.chapterbus.bus;

import java.util.Comparator;

/**
 * Handle returned by {@link EventBus#subscribe}. Handlers of one topic run in ascending
 * priority, ties broken by registration sequence.
 */
public record Subscription(
    String id,
    String topic,
    MessageHandler handler,
    int priority,
    long sequence
) {

    public static final int DEFAULT_PRIORITY = 0;

    static final Comparator<Subscription> DISPATCH_ORDER =
        Comparator.comparingInt(Subscription::priority).thenComparingLong(Subscription::sequence);
}
