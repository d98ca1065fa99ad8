package com.growpad.dispatch.api;

import com.growpad.core.model.Workspace;
import com.growpad.core.store.WorkspaceNotFoundException;
import com.growpad.core.store.WorkspaceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller for workspace configuration.
 */
@RestController
@RequestMapping("/api/v1/workspaces")
public class WorkspaceController {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceController.class);

    private final WorkspaceStore workspaceStore;

    public WorkspaceController(WorkspaceStore workspaceStore) {
        this.workspaceStore = workspaceStore;
    }

    /**
     * POST /api/v1/workspaces: Create a workspace.
     */
    @PostMapping
    public ResponseEntity<?> create(@RequestBody WorkspaceRequest request) {
        try {
            Workspace workspace = workspaceStore.create(request.toDraft());
            return ResponseEntity.status(HttpStatus.CREATED).body(workspace);
        } catch (IllegalArgumentException e) {
            log.debug("Rejected workspace: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * GET /api/v1/workspaces/{id}: Workspace configuration.
     */
    @GetMapping("/{id}")
    public ResponseEntity<?> get(@PathVariable String id) {
        try {
            return ResponseEntity.ok(workspaceStore.load(id));
        } catch (WorkspaceNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        }
    }
}
