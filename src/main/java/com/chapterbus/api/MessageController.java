package com.chapterbus.api;

import com.chapterbus.bus.EventBus;
import com.chapterbus.bus.LoggedMessage;
import com.chapterbus.bus.MessageLog;
import com.chapterbus.bus.Subscription;
import com.chapterbus.bus.middleware.MetricsMiddleware;
import com.chapterbus.contract.Topics;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/v1")
public class MessageController {

    private final MessageLog messageLog;
    private final MetricsMiddleware metrics;
    private final EventBus eventBus;

    public MessageController(MessageLog messageLog, MetricsMiddleware metrics, EventBus eventBus) {
        this.messageLog = messageLog;
        this.metrics = metrics;
        this.eventBus = eventBus;
    }

    @GetMapping("/messages")
    public List<LoggedMessage> query(@RequestParam(required = false) String topic,
                                     @RequestParam(required = false) Integer chapter,
                                     @RequestParam(defaultValue = "100") int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1");
        }
        return messageLog.query(
            Optional.ofNullable(topic),
            Optional.ofNullable(chapter),
            Math.min(limit, 1000)
        );
    }

    @GetMapping("/bus/metrics")
    public Map<String, Object> metrics() {
        return Map.of(
            "metrics", metrics.snapshot(),
            "pending_requests", eventBus.pendingRequestCount(),
            "latest_sequence", messageLog.getLatestSequence()
        );
    }

    /** Live feed of one topic, e.g. pipeline.stage.completed. */
    @GetMapping(value = "/messages/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestParam String topic,
                             @RequestParam(required = false) Integer chapter) {
        if (Topics.REPLY_INBOX.equals(topic)) {
            throw new IllegalArgumentException(topic + " cannot be streamed");
        }
        SseEmitter emitter = new SseEmitter(0L);
        Subscription subscription = eventBus.subscribe(topic, message -> {
            if (chapter != null && !chapter.equals(message.chapterNumber())) {
                return;
            }
            try {
                emitter.send(SseEmitter.event()
                    .name("message")
                    .data(message));
            } catch (IOException ex) {
                emitter.completeWithError(ex);
            }
        });

        emitter.onCompletion(() -> eventBus.unsubscribe(subscription));
        emitter.onTimeout(() -> eventBus.unsubscribe(subscription));
        emitter.onError(ex -> eventBus.unsubscribe(subscription));
        return emitter;
    }
}
