package com.chapterbus.config;

import com.chapterbus.bus.DispatchMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything under {@code chapterbus.*}. Workers are a list because worker names
 * contain dots, which Spring would otherwise split into nested keys.
 */
@Component
@ConfigurationProperties(prefix = "chapterbus")
public class ChapterBusProperties {

    private int parallelism = 2;
    private Duration chapterTimeout = Duration.ofMinutes(30);
    private Pipeline pipeline = new Pipeline();
    private Bus bus = new Bus();
    private List<Worker> workers = new ArrayList<>();
    private Map<String, RateLimit> rateLimits = new LinkedHashMap<>();
    private Output output = new Output();

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    public Duration getChapterTimeout() {
        return chapterTimeout;
    }

    public void setChapterTimeout(Duration chapterTimeout) {
        this.chapterTimeout = chapterTimeout;
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    public void setPipeline(Pipeline pipeline) {
        this.pipeline = pipeline == null ? new Pipeline() : pipeline;
    }

    public Bus getBus() {
        return bus;
    }

    public void setBus(Bus bus) {
        this.bus = bus == null ? new Bus() : bus;
    }

    public List<Worker> getWorkers() {
        return workers;
    }

    public void setWorkers(List<Worker> workers) {
        this.workers = workers == null ? new ArrayList<>() : workers;
    }

    public Map<String, RateLimit> getRateLimits() {
        return rateLimits;
    }

    public void setRateLimits(Map<String, RateLimit> rateLimits) {
        this.rateLimits = rateLimits == null ? new LinkedHashMap<>() : rateLimits;
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output == null ? new Output() : output;
    }

    public static class Pipeline {
        private int maxRevisionRounds = 3;
        private Duration planTimeout = Duration.ofSeconds(120);
        private Duration worldTimeout = Duration.ofSeconds(90);
        private Duration characterTimeout = Duration.ofSeconds(60);
        private Duration composeTimeout = Duration.ofSeconds(180);
        private Duration reviewTimeout = Duration.ofSeconds(90);
        private Duration revisionTimeout = Duration.ofSeconds(180);
        private boolean parallelFanOut = true;

        public int getMaxRevisionRounds() {
            return maxRevisionRounds;
        }

        public void setMaxRevisionRounds(int maxRevisionRounds) {
            this.maxRevisionRounds = maxRevisionRounds;
        }

        public Duration getPlanTimeout() {
            return planTimeout;
        }

        public void setPlanTimeout(Duration planTimeout) {
            this.planTimeout = planTimeout;
        }

        public Duration getWorldTimeout() {
            return worldTimeout;
        }

        public void setWorldTimeout(Duration worldTimeout) {
            this.worldTimeout = worldTimeout;
        }

        public Duration getCharacterTimeout() {
            return characterTimeout;
        }

        public void setCharacterTimeout(Duration characterTimeout) {
            this.characterTimeout = characterTimeout;
        }

        public Duration getComposeTimeout() {
            return composeTimeout;
        }

        public void setComposeTimeout(Duration composeTimeout) {
            this.composeTimeout = composeTimeout;
        }

        public Duration getReviewTimeout() {
            return reviewTimeout;
        }

        public void setReviewTimeout(Duration reviewTimeout) {
            this.reviewTimeout = reviewTimeout;
        }

        public Duration getRevisionTimeout() {
            return revisionTimeout;
        }

        public void setRevisionTimeout(Duration revisionTimeout) {
            this.revisionTimeout = revisionTimeout;
        }

        public boolean isParallelFanOut() {
            return parallelFanOut;
        }

        public void setParallelFanOut(boolean parallelFanOut) {
            this.parallelFanOut = parallelFanOut;
        }
    }

    public static class Bus {
        private DispatchMode dispatchMode = DispatchMode.PARALLEL;
        private boolean singleHandlerTopics = false;
        private int dispatchThreads = 4;
        private int messageLogCapacity = 10_000;
        private String journalFile;

        public DispatchMode getDispatchMode() {
            return dispatchMode;
        }

        public void setDispatchMode(DispatchMode dispatchMode) {
            this.dispatchMode = dispatchMode;
        }

        public boolean isSingleHandlerTopics() {
            return singleHandlerTopics;
        }

        public void setSingleHandlerTopics(boolean singleHandlerTopics) {
            this.singleHandlerTopics = singleHandlerTopics;
        }

        public int getDispatchThreads() {
            return dispatchThreads;
        }

        public void setDispatchThreads(int dispatchThreads) {
            this.dispatchThreads = dispatchThreads;
        }

        public int getMessageLogCapacity() {
            return messageLogCapacity;
        }

        public void setMessageLogCapacity(int messageLogCapacity) {
            this.messageLogCapacity = messageLogCapacity;
        }

        public String getJournalFile() {
            return journalFile;
        }

        public void setJournalFile(String journalFile) {
            this.journalFile = journalFile;
        }
    }

    public static class Worker {
        private String name;
        private String endpoint;
        private String provider;
        private String bearerToken;
        private Duration timeout = Duration.ofSeconds(60);

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getBearerToken() {
            return bearerToken;
        }

        public void setBearerToken(String bearerToken) {
            this.bearerToken = bearerToken;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class RateLimit {
        private int requestsPerMinute = 60;
        private Integer burst;

        public int getRequestsPerMinute() {
            return requestsPerMinute;
        }

        public void setRequestsPerMinute(int requestsPerMinute) {
            this.requestsPerMinute = requestsPerMinute;
        }

        public Integer getBurst() {
            return burst;
        }

        public void setBurst(Integer burst) {
            this.burst = burst;
        }
    }

    public static class Output {
        private String store = "filesystem";
        private String directory = "output";
        private boolean versioning = true;
        private boolean saveIntermediates = false;

        public String getStore() {
            return store;
        }

        public void setStore(String store) {
            this.store = store;
        }

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public boolean isVersioning() {
            return versioning;
        }

        public void setVersioning(boolean versioning) {
            this.versioning = versioning;
        }

        public boolean isSaveIntermediates() {
            return saveIntermediates;
        }

        public void setSaveIntermediates(boolean saveIntermediates) {
            this.saveIntermediates = saveIntermediates;
        }
    }
}
