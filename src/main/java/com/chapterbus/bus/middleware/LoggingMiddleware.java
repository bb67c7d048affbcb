package com.chapterbus.bus.middleware;

import com.chapterbus.bus.Subscription;
import com.chapterbus.contract.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Debug trace of bus traffic.
 */
public class LoggingMiddleware implements Middleware {

    private static final Logger log = LoggerFactory.getLogger(LoggingMiddleware.class);

    @Override
    public void beforePublish(Message message) {
        if (log.isDebugEnabled()) {
            log.debug("-> {} (id={}, corr={}, chapter={})",
                message.topic(),
                shortId(message.id()),
                shortId(message.correlationId()),
                message.chapterNumber() != null ? message.chapterNumber() : "none");
        }
    }

    @Override
    public void afterDelivery(Message message, Subscription subscription, Throwable error) {
        if (error != null) {
            log.debug("x {} handler={} failed: {}", message.topic(), shortId(subscription.id()), error.getMessage());
        }
    }

    @Override
    public void onReply(Message reply, boolean accepted) {
        if (log.isDebugEnabled()) {
            log.debug("<- reply corr={} {}{}",
                shortId(reply.correlationId()),
                accepted ? "accepted" : "discarded",
                reply.isError() ? " error_kind=" + reply.payload().get(Message.ERROR_KIND) : "");
        }
    }

    private static String shortId(String id) {
        if (id == null) {
            return "none";
        }
        return id.length() > 8 ? id.substring(0, 8) : id;
    }
}
