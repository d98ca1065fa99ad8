package com.growpad.dispatch.api;

import com.growpad.core.engine.RunControlService;
import com.growpad.core.engine.RunOrchestrator;
import com.growpad.core.events.RunEvent;
import com.growpad.core.model.ApprovalDecision;
import com.growpad.core.model.RunRequest;
import com.growpad.core.model.RunSummary;
import com.growpad.core.store.RunNotFoundException;
import com.growpad.core.store.RunStore;
import com.growpad.core.store.WorkspaceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * REST controller for run lifecycle operations.
 */
@RestController
@RequestMapping("/api/v1/runs")
public class RunController {

    private static final Logger log = LoggerFactory.getLogger(RunController.class);

    private final RunOrchestrator orchestrator;
    private final RunControlService control;
    private final RunStore runStore;
    private final SseStreamingService sseStreamingService;

    public RunController(RunOrchestrator orchestrator, RunControlService control, RunStore runStore,
                         SseStreamingService sseStreamingService) {
        this.orchestrator = orchestrator;
        this.control = control;
        this.runStore = runStore;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/runs: Start a run. Executes asynchronously.
     */
    @PostMapping
    public ResponseEntity<?> start(@RequestBody RunRequest request) {
        return handle(() -> ResponseEntity.status(HttpStatus.ACCEPTED).body(orchestrator.start(request)));
    }

    /**
     * GET /api/v1/runs: Runs, newest first.
     */
    @GetMapping
    public ResponseEntity<Map<String, List<RunSummary>>> list(
            @RequestParam(name = "workspace_id", required = false) String workspaceId,
            @RequestParam(name = "limit", defaultValue = "50") int limit) {
        return ResponseEntity.ok(Map.of("runs", orchestrator.list(workspaceId, Math.max(1, limit))));
    }

    /**
     * GET /api/v1/runs/{id}: Run summary.
     */
    @GetMapping("/{id}")
    public ResponseEntity<?> get(@PathVariable String id) {
        return handle(() -> ResponseEntity.ok(orchestrator.status(id)));
    }

    /**
     * GET /api/v1/runs/{id}/events: SSE stream of run events.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamEvents(@PathVariable String id) {
        if (!runStore.exists(id)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(sseStreamingService.createEmitter(id));
    }

    /**
     * GET /api/v1/runs/{id}/log: Persisted event log.
     */
    @GetMapping("/{id}/log")
    public ResponseEntity<?> eventLog(@PathVariable String id) {
        return handle(() -> {
            List<RunEvent> events = runStore.readEvents(id);
            return ResponseEntity.ok(Map.of("events", events));
        });
    }

    /**
     * GET /api/v1/runs/{id}/artifacts: Names of the files in the run's artifacts directory.
     */
    @GetMapping("/{id}/artifacts")
    public ResponseEntity<?> artifacts(@PathVariable String id) {
        if (!runStore.exists(id)) {
            return notFound("Run not found: " + id);
        }
        Path dir = runStore.artifactsDir(id);
        try (Stream<Path> files = Files.list(dir)) {
            List<String> names = files.filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .filter(n -> !n.startsWith("."))
                    .sorted()
                    .toList();
            return ResponseEntity.ok(Map.of("artifacts", names));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list artifacts of " + id, e);
        }
    }

    /**
     * GET /api/v1/runs/{id}/artifacts/{name}: Download one artifact.
     */
    @GetMapping("/{id}/artifacts/{name:.+}")
    public ResponseEntity<?> artifact(@PathVariable String id, @PathVariable String name) {
        if (!runStore.exists(id)) {
            return notFound("Run not found: " + id);
        }
        Path dir = runStore.artifactsDir(id);
        Path file = dir.resolve(name).normalize();
        if (!file.startsWith(dir) || !Files.isRegularFile(file)) {
            return notFound("Artifact not found: " + name);
        }
        MediaType type = MediaTypeFactory.getMediaType(name).orElse(MediaType.APPLICATION_OCTET_STREAM);
        return ResponseEntity.ok().contentType(type).body(new FileSystemResource(file));
    }

    /**
     * POST /api/v1/runs/{id}/select-feature: Answer the feature-selection gate.
     */
    @PostMapping("/{id}/select-feature")
    public ResponseEntity<?> selectFeature(@PathVariable String id, @RequestBody FeatureSelectionRequest request) {
        if (request.selectedFeatureIndex() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "selected_feature_index is required"));
        }
        return handle(() -> ResponseEntity.ok(control.selectFeature(id, request.selectedFeatureIndex())));
    }

    /**
     * POST /api/v1/runs/{id}/approvals: Record an approval decision.
     */
    @PostMapping("/{id}/approvals")
    public ResponseEntity<?> approve(@PathVariable String id, @RequestBody ApprovalRequest request) {
        ApprovalDecision decision;
        try {
            decision = ApprovalDecision.valueOf(String.valueOf(request.decision()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid decision: " + request.decision()));
        }
        return handle(() -> ResponseEntity.ok(control.recordApproval(id, request.approver(), decision)));
    }

    /**
     * POST /api/v1/runs/{id}/cancel: Cancel a run that has not finished.
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<?> cancel(@PathVariable String id) {
        return handle(() -> ResponseEntity.ok(control.cancel(id)));
    }

    private ResponseEntity<?> handle(Supplier<ResponseEntity<?>> action) {
        try {
            return action.get();
        } catch (RunNotFoundException | WorkspaceNotFoundException e) {
            return notFound(e.getMessage());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (IllegalStateException e) {
            log.debug("Conflict: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    private static ResponseEntity<Map<String, String>> notFound(String message) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", message));
    }
}
