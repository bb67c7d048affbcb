package com.chapterbus.bus.middleware;

import com.chapterbus.bus.Subscription;
import com.chapterbus.contract.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Ordered middleware list. A failing middleware is logged and skipped; it never
 * affects delivery or the other middleware.
 */
public class MiddlewareChain {

    private static final Logger log = LoggerFactory.getLogger(MiddlewareChain.class);

    private final List<Middleware> middleware = new CopyOnWriteArrayList<>();

    public MiddlewareChain() {
    }

    public MiddlewareChain(List<? extends Middleware> initial) {
        middleware.addAll(initial);
    }

    public MiddlewareChain add(Middleware m) {
        middleware.add(m);
        return this;
    }

    public List<Middleware> middleware() {
        return List.copyOf(middleware);
    }

    public void beforePublish(Message message) {
        each(m -> m.beforePublish(message), message);
    }

    public void afterDelivery(Message message, Subscription subscription, Throwable error) {
        each(m -> m.afterDelivery(message, subscription, error), message);
    }

    public void onReply(Message reply, boolean accepted) {
        each(m -> m.onReply(reply, accepted), reply);
    }

    private void each(Consumer<Middleware> call, Message message) {
        for (Middleware m : middleware) {
            try {
                call.accept(m);
            } catch (RuntimeException ex) {
                log.warn("Middleware {} failed for message={} topic={}: {}",
                    m.getClass().getSimpleName(), message.id(), message.topic(), ex.getMessage());
            }
        }
    }
}
