package com.chapterbus.bus;

import java.time.Duration;

/**
 * A request/response call received no correlated reply before its deadline.
 */
public class RequestTimeoutException extends RuntimeException {

    private final String topic;
    private final String correlationId;
    private final Duration timeout;

    public RequestTimeoutException(String topic, String correlationId, Duration timeout) {
        super("no reply on " + topic + " for correlation_id=" + correlationId
            + " within " + timeout.toMillis() + "ms");
        this.topic = topic;
        this.correlationId = correlationId;
        this.timeout = timeout;
    }

    public String getTopic() {
        return topic;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
