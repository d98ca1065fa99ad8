package com.growpad.core.engine;

import com.growpad.core.model.ApprovalDecision;
import com.growpad.core.model.Run;
import com.growpad.core.model.RunStatus;
import com.growpad.core.model.RunSummary;
import com.growpad.core.model.StageId;
import com.growpad.core.model.Workspace;
import com.growpad.core.schema.SchemaValidator;
import com.growpad.core.store.RunStore;
import com.growpad.core.store.WorkspaceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * External one-field mutations of a run: feature selection, approval decisions and
 * cancellation. Each is a locked reload-mutate-save followed by a wake-up of the
 * run's worker, so the worker never overwrites them and never waits a full poll
 * interval to see them.
 */
@Service
public class RunControlService {

    private static final Logger log = LoggerFactory.getLogger(RunControlService.class);

    private final RunStore runStore;
    private final WorkspaceStore workspaceStore;
    private final RunRegistry registry;

    public RunControlService(RunStore runStore, WorkspaceStore workspaceStore, RunRegistry registry) {
        this.runStore = runStore;
        this.workspaceStore = workspaceStore;
        this.registry = registry;
    }

    /**
     * @throws IllegalArgumentException if the index is out of range
     * @throws IllegalStateException    if the run is terminal or its feature is already chosen
     */
    public RunSummary selectFeature(String runId, int index) {
        Run saved = runStore.update(runId, run -> {
            requireActive(run);
            StageId stage = run.getCurrentStage();
            if (run.getSelectedFeature() != null
                    || (stage != null && stage.compareTo(StageId.SELECT_FEATURE) > 0)) {
                throw new IllegalStateException("Run %s already selected feature %s".formatted(
                        runId, run.getSelectedFeature() != null ? "'" + run.getSelectedFeature() + "'"
                                : String.valueOf(run.getSelectedFeatureIndex())));
            }
            int candidates = run.getTopFeatures().isEmpty() ? SchemaValidator.TOP_FEATURE_COUNT
                    : run.getTopFeatures().size();
            if (index < 0 || index >= candidates) {
                throw new IllegalArgumentException("Feature index must be between 0 and %d, got %d"
                        .formatted(candidates - 1, index));
            }
            run.setSelectedFeatureIndex(index);
        });
        registry.signal(runId);
        log.info("Feature {} selected for run {}", index, runId);
        return saved.toSummary();
    }

    /**
     * @throws IllegalArgumentException if the workspace names approvers and {@code approver} is not one of them
     * @throws IllegalStateException    if the run is not waiting for approval
     */
    public RunSummary recordApproval(String runId, String approver, ApprovalDecision decision) {
        if (approver == null || approver.isBlank()) {
            throw new IllegalArgumentException("approver is required");
        }
        if (decision == null) {
            throw new IllegalArgumentException("decision is required");
        }
        Run current = runStore.load(runId);
        Workspace workspace = workspaceStore.load(current.getWorkspaceId());
        if (!workspace.approvers().isEmpty() && !workspace.approvers().contains(approver)) {
            throw new IllegalArgumentException("'%s' is not an approver for workspace %s"
                    .formatted(approver, workspace.workspaceId()));
        }
        Run saved = runStore.update(runId, run -> {
            if (run.getStatus() != RunStatus.AWAITING_APPROVAL) {
                throw new IllegalStateException("Run %s is not awaiting approval (status %s)"
                        .formatted(runId, run.getStatus()));
            }
            run.getApprovalState().put(approver, decision);
        });
        registry.signal(runId);
        log.info("Approval decision {} from {} recorded for run {}", decision, approver, runId);
        return saved.toSummary();
    }

    /**
     * @throws IllegalStateException if the run is already terminal
     */
    public RunSummary cancel(String runId) {
        Run saved = runStore.update(runId, run -> {
            requireActive(run);
            run.transitionTo(RunStatus.CANCELLED);
            run.getTimestamps().put(Run.COMPLETED_AT, Instant.now());
        });
        registry.signal(runId);
        log.info("Cancellation requested for run {}", runId);
        return saved.toSummary();
    }

    private static void requireActive(Run run) {
        if (run.isTerminal()) {
            throw new IllegalStateException("Run %s is already %s".formatted(run.getRunId(), run.getStatus()));
        }
    }
}
