package com.chapterbus.config;

import com.chapterbus.bus.EventBus;
import com.chapterbus.persistence.ChapterStore;
import com.chapterbus.persistence.FileSystemChapterStore;
import com.chapterbus.persistence.InMemoryChapterStore;
import com.chapterbus.pipeline.ChapterPipeline;
import com.chapterbus.pipeline.PipelineSettings;
import com.chapterbus.scheduler.ChapterScheduler;
import com.chapterbus.stage.StageExecutor;
import com.chapterbus.worker.WorkerRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class PipelineConfiguration {

    @Bean
    @ConditionalOnProperty(name = "chapterbus.output.store", havingValue = "filesystem", matchIfMissing = true)
    public ChapterStore fileSystemChapterStore(ChapterBusProperties properties, ObjectMapper objectMapper) {
        ChapterBusProperties.Output output = properties.getOutput();
        return new FileSystemChapterStore(Path.of(output.getDirectory()), output.isVersioning(), objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "chapterbus.output.store", havingValue = "memory")
    public ChapterStore inMemoryChapterStore() {
        return new InMemoryChapterStore();
    }

    @Bean
    public PipelineSettings pipelineSettings(ChapterBusProperties properties) {
        return PipelineSettings.from(properties);
    }

    @Bean
    public StageExecutor stageExecutor(EventBus eventBus) {
        return new StageExecutor(eventBus);
    }

    @Bean
    public ChapterPipeline chapterPipeline(EventBus eventBus,
                                           StageExecutor stageExecutor,
                                           WorkerRegistry workerRegistry,
                                           ChapterStore chapterStore,
                                           PipelineSettings pipelineSettings,
                                           ObjectMapper objectMapper) {
        return new ChapterPipeline(eventBus, stageExecutor, workerRegistry, chapterStore, pipelineSettings, objectMapper);
    }

    @Bean(destroyMethod = "shutdown")
    public ChapterScheduler chapterScheduler(ChapterPipeline chapterPipeline,
                                             ChapterStore chapterStore,
                                             WorkerRegistry workerRegistry) {
        return ChapterScheduler.create(chapterPipeline, chapterStore, workerRegistry);
    }
}
