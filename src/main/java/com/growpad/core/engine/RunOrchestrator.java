package com.growpad.core.engine;

import com.growpad.core.model.Run;
import com.growpad.core.model.RunRequest;
import com.growpad.core.model.RunSummary;
import com.growpad.core.schema.SchemaValidator;
import com.growpad.core.store.RunStore;
import com.growpad.core.store.WorkspaceStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Accepts run requests and executes each on its own worker thread.
 */
@Service
public class RunOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RunOrchestrator.class);

    private final RunStore store;
    private final WorkspaceStore workspaces;
    private final RunRegistry registry;
    private final RunPipeline pipeline;

    private final ExecutorService workers = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "run-worker");
        t.setDaemon(true);
        return t;
    });
    private final ConcurrentHashMap<String, CompletableFuture<Void>> active = new ConcurrentHashMap<>();

    public RunOrchestrator(RunStore store, WorkspaceStore workspaces, RunRegistry registry, RunPipeline pipeline) {
        this.store = store;
        this.workspaces = workspaces;
        this.registry = registry;
        this.pipeline = pipeline;
    }

    /**
     * Creates the run and hands it to a worker. Returns as soon as the PENDING state is saved.
     *
     * @throws com.growpad.core.store.WorkspaceNotFoundException if the workspace does not exist
     * @throws IllegalArgumentException                          if the request is malformed
     */
    public RunSummary start(RunRequest request) {
        if (request == null || request.workspaceId() == null || request.workspaceId().isBlank()) {
            throw new IllegalArgumentException("workspace_id is required");
        }
        Integer index = request.selectedFeatureIndex();
        if (index != null && (index < 0 || index >= SchemaValidator.TOP_FEATURE_COUNT)) {
            throw new IllegalArgumentException("selected_feature_index must be between 0 and %d, got %d"
                    .formatted(SchemaValidator.TOP_FEATURE_COUNT - 1, index));
        }
        workspaces.load(request.workspaceId());

        Run run = store.create(request, store.inputsHash(request));
        String runId = run.getRunId();
        RunContext context = registry.register(runId);

        CompletableFuture<Void> done = new CompletableFuture<>();
        active.put(runId, done);
        done.whenComplete((v, t) -> active.remove(runId));
        workers.submit(() -> {
            Thread worker = Thread.currentThread();
            String previousName = worker.getName();
            worker.setName("run-worker-" + runId);
            try {
                pipeline.execute(runId, context);
                done.complete(null);
            } catch (Throwable t) {
                log.error("Run worker for {} died: {}", runId, t.getMessage(), t);
                done.completeExceptionally(t);
            } finally {
                registry.scheduleDisposal(runId);
                worker.setName(previousName);
            }
        });
        log.info("Accepted run {} for workspace {}", runId, request.workspaceId());
        return run.toSummary();
    }

    /**
     * @throws com.growpad.core.store.RunNotFoundException if the run does not exist
     */
    public RunSummary status(String runId) {
        return store.load(runId).toSummary();
    }

    public List<RunSummary> list(String workspaceId, int limit) {
        return store.list(workspaceId, limit).stream().map(Run::toSummary).toList();
    }

    /**
     * Blocks until the run's worker finishes, then returns the persisted summary.
     * Returns immediately for runs that are not executing in this process.
     */
    public RunSummary awaitCompletion(String runId, Duration timeout) throws InterruptedException, TimeoutException {
        CompletableFuture<Void> done = active.get(runId);
        if (done != null) {
            try {
                done.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (ExecutionException e) {
                throw new IllegalStateException("Run worker for " + runId + " failed", e.getCause());
            }
        }
        return status(runId);
    }

    public boolean isExecuting(String runId) {
        return active.containsKey(runId);
    }

    @PreDestroy
    void shutdown() {
        workers.shutdownNow();
    }
}
