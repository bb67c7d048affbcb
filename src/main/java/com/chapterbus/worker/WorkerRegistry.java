package com.chapterbus.worker;

import com.chapterbus.bus.EventBus;
import com.chapterbus.contract.ConfigurationException;
import com.chapterbus.contract.Topics;
import com.chapterbus.thread.MdcPropagatingExecutor;
import com.chapterbus.thread.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Typed dispatch table from worker name to its bus adapter.
 *
 * Built from configuration at startup; tests and embedders may register
 * collaborators at runtime. Registering a name that is already present replaces
 * the previous adapter.
 */
public class WorkerRegistry {

    private static final Logger log = LoggerFactory.getLogger(WorkerRegistry.class);

    private final EventBus bus;
    private final RateLimiter rateLimiter;
    private final Executor workerExecutor;
    private final ScheduledExecutorService timer;
    private final ConcurrentHashMap<String, WorkerAdapter> adapters = new ConcurrentHashMap<>();
    private final List<ExecutorService> ownedPools;

    public WorkerRegistry(EventBus bus, RateLimiter rateLimiter, Executor workerExecutor, ScheduledExecutorService timer) {
        this(bus, rateLimiter, workerExecutor, timer, List.of());
    }

    private WorkerRegistry(EventBus bus, RateLimiter rateLimiter, Executor workerExecutor,
                           ScheduledExecutorService timer, List<ExecutorService> ownedPools) {
        this.bus = bus;
        this.rateLimiter = rateLimiter;
        this.workerExecutor = workerExecutor;
        this.timer = timer;
        this.ownedPools = ownedPools;
    }

    /**
     * Registry with its own worker pool and deadline timer, both shut down by
     * {@link #shutdown()}. Worker calls inherit the caller's MDC.
     */
    public static WorkerRegistry create(EventBus bus, RateLimiter rateLimiter) {
        ExecutorService workerPool = Executors.newCachedThreadPool(new NamedThreadFactory("worker"));
        ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("worker-timer"));
        return new WorkerRegistry(bus, rateLimiter, new MdcPropagatingExecutor(workerPool), timer,
            List.of(workerPool, timer));
    }

    public WorkerAdapter register(String workerName, WorkerCollaborator collaborator) {
        return register(new WorkerDefinition(workerName, null, null, collaborator));
    }

    public WorkerAdapter register(WorkerDefinition definition) {
        WorkerAdapter adapter = new WorkerAdapter(definition, bus, rateLimiter, workerExecutor, timer);
        WorkerAdapter previous = adapters.put(definition.name(), adapter);
        if (previous != null) {
            previous.detach();
            log.info("Replacing worker {}", definition.name());
        }
        adapter.attach();
        return adapter;
    }

    public boolean unregister(String workerName) {
        WorkerAdapter removed = adapters.remove(workerName);
        if (removed == null) {
            return false;
        }
        removed.detach();
        log.info("Worker {} unregistered", workerName);
        return true;
    }

    public boolean isRegistered(String workerName) {
        return adapters.containsKey(workerName);
    }

    public Optional<WorkerAdapter> find(String workerName) {
        return Optional.ofNullable(adapters.get(workerName));
    }

    /** Sorted so that callers iterating workers get a stable order. */
    public Set<String> workerNames() {
        return new TreeSet<>(adapters.keySet());
    }

    public List<String> workerNamesWithPrefix(String prefix) {
        List<String> names = new ArrayList<>();
        for (String name : workerNames()) {
            if (name.startsWith(prefix)) {
                names.add(name);
            }
        }
        return names;
    }

    public String topicFor(String workerName) {
        if (!isRegistered(workerName)) {
            throw new ConfigurationException("Unknown worker: " + workerName);
        }
        return Topics.workerRequest(workerName);
    }

    /**
     * Fails fast when any of {@code required} has no adapter.
     *
     * @throws ConfigurationException naming every missing worker
     */
    public void requireWorkers(Collection<String> required) {
        List<String> missing = new ArrayList<>();
        for (String name : required) {
            if (!isRegistered(name)) {
                missing.add(name);
            }
        }
        if (!missing.isEmpty()) {
            throw new ConfigurationException("Required workers are not registered: " + missing);
        }
    }

    public void shutdown() {
        adapters.keySet().forEach(this::unregister);
        ownedPools.forEach(ExecutorService::shutdownNow);
    }
}
