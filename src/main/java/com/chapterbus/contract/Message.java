package com.chapterbus.contract;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable unit of exchange on the bus.
 *
 * A message with a reply_to topic is a request: the serving handler answers with a
 * message on that topic carrying the same correlation_id. Messages without reply_to
 * are fire-and-forget.
 *
 * Error-tagged replies carry the reserved payload keys {@code error_kind} and
 * {@code error_message}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Message(
    @JsonProperty("id") String id,
    @JsonProperty("topic") String topic,
    @JsonProperty("correlation_id") String correlationId,
    @JsonProperty("reply_to") String replyTo,
    @JsonProperty("payload") Map<String, Object> payload,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("chapter_number") Integer chapterNumber,
    @JsonProperty("deadline") Instant deadline
) {

    public static final String ERROR_KIND = "error_kind";
    public static final String ERROR_MESSAGE = "error_message";

    public Message {
        Objects.requireNonNull(id, "id is required");
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic is required");
        }
        payload = payload == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        createdAt = createdAt != null ? createdAt : Instant.now();
    }

    /** Fire-and-forget message. */
    public static Message event(String topic, Map<String, Object> payload) {
        return event(topic, payload, null);
    }

    public static Message event(String topic, Map<String, Object> payload, Integer chapterNumber) {
        return new Message(newId(), topic, null, null, payload, Instant.now(), chapterNumber, null);
    }

    /** Request expecting exactly one correlated reply on {@code replyTo}. */
    public static Message request(String topic, Map<String, Object> payload, String replyTo,
                                  Instant deadline, Integer chapterNumber) {
        if (replyTo == null || replyTo.isBlank()) {
            throw new IllegalArgumentException("reply_to is required for a request");
        }
        return new Message(newId(), topic, newId(), replyTo, payload, Instant.now(), chapterNumber, deadline);
    }

    public Message reply(Map<String, Object> replyPayload) {
        requireRequest();
        return new Message(newId(), replyTo, correlationId, null, replyPayload, Instant.now(), chapterNumber, null);
    }

    public Message errorReply(FailureKind kind, String description) {
        requireRequest();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(ERROR_KIND, kind.name());
        body.put(ERROR_MESSAGE, description != null ? description : kind.name());
        return new Message(newId(), replyTo, correlationId, null, body, Instant.now(), chapterNumber, null);
    }

    @JsonIgnore
    public boolean isRequest() {
        return replyTo != null;
    }

    @JsonIgnore
    public boolean isError() {
        return payload.containsKey(ERROR_KIND);
    }

    @JsonIgnore
    public Optional<FailureKind> errorKind() {
        Object raw = payload.get(ERROR_KIND);
        return raw == null ? Optional.empty() : Optional.of(FailureKind.fromValue(String.valueOf(raw)));
    }

    @JsonIgnore
    public String errorMessage() {
        Object raw = payload.get(ERROR_MESSAGE);
        return raw != null ? String.valueOf(raw) : null;
    }

    private void requireRequest() {
        if (!isRequest()) {
            throw new IllegalStateException("message " + id + " on " + topic + " is not a request");
        }
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
