package com.growpad.core.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.growpad.core.model.Guardrails;
import com.growpad.core.model.Workspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.UUID;

/**
 * Workspace configuration under {@code workspaces/<workspace_id>/config.json}.
 * The engine only reads workspaces; they are written here on creation.
 */
@Service
public class WorkspaceStore {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceStore.class);

    private static final String CONFIG_FILE = "config.json";

    private final Path workspacesDir;
    private final ObjectMapper mapper = JsonSupport.newMapper();

    @Autowired
    public WorkspaceStore(StoreProperties properties) {
        this(Path.of(properties.getDataDir()));
    }

    public WorkspaceStore(Path dataDir) {
        this.workspacesDir = dataDir.resolve("workspaces");
    }

    /**
     * Persists a new workspace with a fresh identity.
     *
     * @throws IllegalArgumentException if the guardrails ask for more than two retries or no repository is given
     */
    public Workspace create(Workspace draft) {
        Guardrails guardrails = draft.guardrails();
        if (guardrails.maxRetries() < 0 || guardrails.maxRetries() > Guardrails.RETRY_CEILING) {
            throw new IllegalArgumentException("max_retries must be between 0 and %d, got %d"
                    .formatted(Guardrails.RETRY_CEILING, guardrails.maxRetries()));
        }
        if (draft.repoUrl() == null || draft.repoUrl().isBlank()) {
            throw new IllegalArgumentException("repo_url is required");
        }
        String workspaceId = "ws_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        Instant now = Instant.now();
        Workspace workspace = new Workspace(workspaceId, draft.teamName(), draft.repoUrl(), draft.branch(),
                guardrails, draft.approvalWorkflowEnabled(), draft.approvers(), now, now);
        Path file = workspacesDir.resolve(workspaceId).resolve(CONFIG_FILE);
        try {
            Files.createDirectories(file.getParent());
            Files.write(file, mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(workspace));
        } catch (IOException e) {
            throw new StoreException("Failed to write workspace " + workspaceId, e);
        }
        log.info("Created workspace {} for team {}", workspaceId, draft.teamName());
        return workspace;
    }

    /**
     * @throws WorkspaceNotFoundException if the workspace does not exist
     */
    public Workspace load(String workspaceId) {
        if (workspaceId == null || !RunStore.SAFE_ID.matcher(workspaceId).matches()) {
            throw new WorkspaceNotFoundException(String.valueOf(workspaceId));
        }
        Path file = workspacesDir.resolve(workspaceId).resolve(CONFIG_FILE);
        try {
            return mapper.readValue(Files.readAllBytes(file), Workspace.class);
        } catch (NoSuchFileException e) {
            throw new WorkspaceNotFoundException(workspaceId);
        } catch (IOException e) {
            throw new StoreException("Failed to read workspace " + workspaceId, e);
        }
    }
}
