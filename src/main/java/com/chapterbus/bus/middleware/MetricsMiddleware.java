package com.chapterbus.bus.middleware;

import com.chapterbus.bus.Subscription;
import com.chapterbus.contract.Message;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Bus traffic counters, registered as Micrometer meters tagged by topic.
 */
public class MetricsMiddleware implements Middleware {

    static final String PUBLISHED = "chapterbus.bus.published";
    static final String DELIVERIES = "chapterbus.bus.deliveries";
    static final String REPLIES = "chapterbus.bus.replies";
    static final String ERROR_REPLIES = "chapterbus.bus.replies.error";

    private static final String TOPIC = "topic";
    private static final String OUTCOME = "outcome";

    private final MeterRegistry meterRegistry;

    /** Standalone counters, for embedding without a Spring context. */
    public MetricsMiddleware() {
        this(new SimpleMeterRegistry());
    }

    public MetricsMiddleware(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
    }

    @Override
    public void beforePublish(Message message) {
        meterRegistry.counter(PUBLISHED, TOPIC, message.topic()).increment();
    }

    @Override
    public void afterDelivery(Message message, Subscription subscription, Throwable error) {
        meterRegistry.counter(DELIVERIES, TOPIC, message.topic(), OUTCOME, error == null ? "delivered" : "failed")
            .increment();
    }

    @Override
    public void onReply(Message reply, boolean accepted) {
        meterRegistry.counter(REPLIES, OUTCOME, accepted ? "accepted" : "discarded").increment();
        if (reply.isError()) {
            meterRegistry.counter(ERROR_REPLIES).increment();
        }
    }

    public long published(String topic) {
        return count(meterRegistry.find(PUBLISHED).tag(TOPIC, topic).counter());
    }

    public long delivered(String topic) {
        return count(meterRegistry.find(DELIVERIES).tags(TOPIC, topic, OUTCOME, "delivered").counter());
    }

    public long failed(String topic) {
        return count(meterRegistry.find(DELIVERIES).tags(TOPIC, topic, OUTCOME, "failed").counter());
    }

    public long repliesAccepted() {
        return count(meterRegistry.find(REPLIES).tag(OUTCOME, "accepted").counter());
    }

    public long repliesDiscarded() {
        return count(meterRegistry.find(REPLIES).tag(OUTCOME, "discarded").counter());
    }

    public long errorReplies() {
        return count(meterRegistry.find(ERROR_REPLIES).counter());
    }

    public MetricsSnapshot snapshot() {
        Map<String, TopicMetrics> perTopic = new TreeMap<>();
        for (Counter counter : meterRegistry.find(PUBLISHED).counters()) {
            String topic = counter.getId().getTag(TOPIC);
            perTopic.put(topic, new TopicMetrics(count(counter), delivered(topic), failed(topic)));
        }
        return new MetricsSnapshot(perTopic, repliesAccepted(), repliesDiscarded(), errorReplies());
    }

    private static long count(Counter counter) {
        return counter == null ? 0 : (long) counter.count();
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record TopicMetrics(long published, long delivered, long failed) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record MetricsSnapshot(
        Map<String, TopicMetrics> topics,
        long repliesAccepted,
        long repliesDiscarded,
        long errorReplies
    ) {
    }
}
