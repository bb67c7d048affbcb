package com.chapterbus.config;

import com.chapterbus.bus.EventBus;
import com.chapterbus.bus.InMemoryMessageLog;
import com.chapterbus.bus.MessageLog;
import com.chapterbus.bus.SubscriptionRegistry;
import com.chapterbus.bus.middleware.JournalMiddleware;
import com.chapterbus.bus.middleware.LoggingMiddleware;
import com.chapterbus.bus.middleware.MetricsMiddleware;
import com.chapterbus.bus.middleware.MiddlewareChain;
import com.chapterbus.thread.NamedThreadFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Executors;

@Configuration
public class BusConfiguration {

    @Bean
    public MessageLog messageLog(ChapterBusProperties properties) {
        return new InMemoryMessageLog(properties.getBus().getMessageLogCapacity());
    }

    @Bean
    public MetricsMiddleware metricsMiddleware(MeterRegistry meterRegistry) {
        return new MetricsMiddleware(meterRegistry);
    }

    @Bean
    public JournalMiddleware journalMiddleware(MessageLog messageLog, ObjectMapper objectMapper,
                                               ChapterBusProperties properties) {
        String journalFile = properties.getBus().getJournalFile();
        Path path = journalFile == null || journalFile.isBlank() ? null : Path.of(journalFile);
        return new JournalMiddleware(messageLog, objectMapper, path);
    }

    @Bean
    public MiddlewareChain middlewareChain(JournalMiddleware journal, MetricsMiddleware metrics) {
        return new MiddlewareChain(List.of(journal, metrics, new LoggingMiddleware()));
    }

    @Bean(destroyMethod = "close")
    public EventBus eventBus(ChapterBusProperties properties, MiddlewareChain middlewareChain) {
        ChapterBusProperties.Bus bus = properties.getBus();
        return new EventBus(
            bus.getDispatchMode(),
            new SubscriptionRegistry(bus.isSingleHandlerTopics()),
            middlewareChain,
            Executors.newFixedThreadPool(Math.max(1, bus.getDispatchThreads()), new NamedThreadFactory("bus-dispatch")),
            Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("bus-timer")));
    }
}
