package com.chapterbus.bus;

/**
 * Thrown when a second handler subscribes to a topic on a bus that enforces
 * single-handler topics.
 */
public class DuplicateSubscriptionException extends RuntimeException {

    public DuplicateSubscriptionException(String topic) {
        super("topic already has a handler: " + topic);
    }
}
