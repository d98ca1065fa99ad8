package com.growpad.core.engine;

import com.growpad.core.events.EventBus;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Live runs known to this process.
 * <p>
 * An entry is created when a run starts and disposed, together with the run's event
 * queue, once the run is terminal and the grace period has passed. Runs that are not
 * registered (finished long ago, or started by another process) are still readable
 * from the store; they just have nobody to wake.
 */
@Component
public class RunRegistry {

    private static final Logger log = LoggerFactory.getLogger(RunRegistry.class);

    private final ConcurrentHashMap<String, RunContext> contexts = new ConcurrentHashMap<>();
    private final EventBus eventBus;
    private final EngineProperties properties;

    private final ScheduledExecutorService reaper = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "run-registry-reaper");
        t.setDaemon(true);
        return t;
    });

    public RunRegistry(EventBus eventBus, EngineProperties properties) {
        this.eventBus = eventBus;
        this.properties = properties;
    }

    public RunContext register(String runId) {
        RunContext context = new RunContext(runId);
        contexts.put(runId, context);
        log.debug("Registered run {}", runId);
        return context;
    }

    public Optional<RunContext> get(String runId) {
        return Optional.ofNullable(contexts.get(runId));
    }

    /**
     * Wakes the run's worker if it is waiting on a gate.
     */
    public void signal(String runId) {
        RunContext context = contexts.get(runId);
        if (context != null) {
            context.signal();
        }
    }

    public boolean isRegistered(String runId) {
        return contexts.containsKey(runId);
    }

    /**
     * Drops the entry and the event queue after the grace period.
     */
    public void scheduleDisposal(String runId) {
        long delayMs = properties.getRegistryGracePeriod().toMillis();
        if (delayMs <= 0) {
            dispose(runId);
            return;
        }
        reaper.schedule(() -> dispose(runId), delayMs, TimeUnit.MILLISECONDS);
    }

    public void dispose(String runId) {
        contexts.remove(runId);
        eventBus.dispose(runId);
        log.debug("Disposed run {}", runId);
    }

    @PreDestroy
    void shutdown() {
        reaper.shutdownNow();
    }
}
