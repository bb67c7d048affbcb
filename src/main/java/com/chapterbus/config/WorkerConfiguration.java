package com.chapterbus.config;

import com.chapterbus.bus.EventBus;
import com.chapterbus.contract.ConfigurationException;
import com.chapterbus.worker.HttpWorkerCollaborator;
import com.chapterbus.worker.RateLimiter;
import com.chapterbus.worker.TokenBucketRateLimiter;
import com.chapterbus.worker.WorkerDefinition;
import com.chapterbus.worker.WorkerRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the worker dispatch table from {@code chapterbus.workers}. Every configured
 * worker is served over HTTP; in-process collaborators are registered at runtime.
 */
@Configuration
public class WorkerConfiguration {

    private static final Logger log = LoggerFactory.getLogger(WorkerConfiguration.class);

    @Bean
    public RateLimiter rateLimiter(ChapterBusProperties properties) {
        Map<String, TokenBucketRateLimiter.Limit> limits = new LinkedHashMap<>();
        properties.getRateLimits().forEach((provider, limit) -> {
            int burst = limit.getBurst() != null ? limit.getBurst() : limit.getRequestsPerMinute();
            limits.put(provider, new TokenBucketRateLimiter.Limit(limit.getRequestsPerMinute(), burst));
        });
        if (limits.isEmpty()) {
            return RateLimiter.unlimited();
        }
        return new TokenBucketRateLimiter(limits);
    }

    @Bean
    public HttpClient workerHttpClient() {
        return HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
    }

    @Bean(destroyMethod = "shutdown")
    public WorkerRegistry workerRegistry(EventBus eventBus,
                                         RateLimiter rateLimiter,
                                         HttpClient workerHttpClient,
                                         ObjectMapper objectMapper,
                                         ChapterBusProperties properties) {
        WorkerRegistry registry = WorkerRegistry.create(eventBus, rateLimiter);
        for (ChapterBusProperties.Worker worker : properties.getWorkers()) {
            if (worker.getName() == null || worker.getName().isBlank()) {
                throw new ConfigurationException("chapterbus.workers entries need a name");
            }
            if (worker.getEndpoint() == null || worker.getEndpoint().isBlank()) {
                throw new ConfigurationException("worker " + worker.getName() + " has no endpoint");
            }
            registry.register(new WorkerDefinition(
                worker.getName(),
                worker.getProvider(),
                worker.getTimeout(),
                new HttpWorkerCollaborator(worker.getEndpoint(), worker.getBearerToken(), objectMapper, workerHttpClient)));
        }
        log.info("Registered {} configured worker(s): {}", properties.getWorkers().size(), registry.workerNames());
        return registry;
    }
}
