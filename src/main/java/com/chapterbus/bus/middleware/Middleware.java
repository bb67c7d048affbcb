package com.chapterbus.bus.middleware;

import com.chapterbus.bus.Subscription;
import com.chapterbus.contract.Message;

/**
 * Observer of every message passing through the bus. Middleware sees messages but
 * cannot drop, reroute or rewrite them.
 */
public interface Middleware {

    /** Called once per published message, before any handler runs. */
    default void beforePublish(Message message) {
    }

    /**
     * Called after one handler processed a message.
     *
     * @param error the handler's failure, or null when it completed normally
     */
    default void afterDelivery(Message message, Subscription subscription, Throwable error) {
    }

    /**
     * Called for every reply arriving on the reply inbox.
     *
     * @param accepted false when the reply was late or a duplicate and got discarded
     */
    default void onReply(Message reply, boolean accepted) {
    }
}
