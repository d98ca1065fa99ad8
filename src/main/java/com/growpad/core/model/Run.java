package com.growpad.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Persisted state of a single pipeline execution.
 * <p>
 * The run worker owns bulk mutation. External actors change exactly one field each
 * (selected feature, approval state, status on cancel), always through a locked
 * reload-mutate-save in the run store.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Run {

    public static final String CREATED_AT = "created_at";
    public static final String STARTED_AT = "started_at";
    public static final String COMPLETED_AT = "completed_at";

    private String runId;
    private String workspaceId;
    private RunStatus status = RunStatus.PENDING;
    private StageId currentStage;
    private int retryCount;
    private List<StageRecord> stageHistory = new ArrayList<>();
    private String evidenceDir;
    private String goalStatement;
    private boolean fastMode = true;
    private List<FeatureCandidate> topFeatures = new ArrayList<>();
    private Integer selectedFeatureIndex;
    private String selectedFeature;
    private Map<String, ApprovalDecision> approvalState = new LinkedHashMap<>();
    private Map<String, String> outputsIndex = new LinkedHashMap<>();
    private Map<String, Instant> timestamps = new LinkedHashMap<>();
    private String inputsHash;
    private FailureCause failureCause;
    private String lastError;
    private String stackDetected;

    public Run() {}

    public Run(String runId, String workspaceId, String inputsHash, Instant createdAt) {
        this.runId = runId;
        this.workspaceId = workspaceId;
        this.inputsHash = inputsHash;
        this.timestamps.put(CREATED_AT, createdAt);
        this.timestamps.put(STARTED_AT, null);
        this.timestamps.put(COMPLETED_AT, null);
    }

    /**
     * Moves to {@code next}, enforcing the status table.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public void transitionTo(RunStatus next) {
        if (status == next) {
            return;
        }
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Run %s cannot move from %s to %s".formatted(runId, status, next));
        }
        this.status = next;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    public void addStageRecord(StageRecord record) {
        stageHistory.add(record);
    }

    /** Most recent record for {@code stage}, or null. */
    public StageRecord latestRecord(StageId stage) {
        for (int i = stageHistory.size() - 1; i >= 0; i--) {
            if (stageHistory.get(i).stage() == stage) {
                return stageHistory.get(i);
            }
        }
        return null;
    }

    public long countRecords(StageId stage) {
        return stageHistory.stream().filter(r -> r.stage() == stage).count();
    }

    public RunSummary toSummary() {
        return new RunSummary(runId, workspaceId, status, currentStage, retryCount,
                Map.copyOf(outputsIndex), new LinkedHashMap<>(approvalState), failureCause, lastError);
    }

    public String getRunId() { return runId; }
    public void setRunId(String runId) { this.runId = runId; }

    public String getWorkspaceId() { return workspaceId; }
    public void setWorkspaceId(String workspaceId) { this.workspaceId = workspaceId; }

    public RunStatus getStatus() { return status; }
    public void setStatus(RunStatus status) { this.status = status; }

    public StageId getCurrentStage() { return currentStage; }
    public void setCurrentStage(StageId currentStage) { this.currentStage = currentStage; }

    public int getRetryCount() { return retryCount; }
    public void setRetryCount(int retryCount) { this.retryCount = retryCount; }

    public List<StageRecord> getStageHistory() { return stageHistory; }
    public void setStageHistory(List<StageRecord> stageHistory) {
        this.stageHistory = stageHistory == null ? new ArrayList<>() : new ArrayList<>(stageHistory);
    }

    public String getEvidenceDir() { return evidenceDir; }
    public void setEvidenceDir(String evidenceDir) { this.evidenceDir = evidenceDir; }

    public String getGoalStatement() { return goalStatement; }
    public void setGoalStatement(String goalStatement) { this.goalStatement = goalStatement; }

    public boolean isFastMode() { return fastMode; }
    public void setFastMode(boolean fastMode) { this.fastMode = fastMode; }

    public List<FeatureCandidate> getTopFeatures() { return topFeatures; }
    public void setTopFeatures(List<FeatureCandidate> topFeatures) {
        this.topFeatures = topFeatures == null ? new ArrayList<>() : new ArrayList<>(topFeatures);
    }

    public Integer getSelectedFeatureIndex() { return selectedFeatureIndex; }
    public void setSelectedFeatureIndex(Integer selectedFeatureIndex) { this.selectedFeatureIndex = selectedFeatureIndex; }

    public String getSelectedFeature() { return selectedFeature; }
    public void setSelectedFeature(String selectedFeature) { this.selectedFeature = selectedFeature; }

    public Map<String, ApprovalDecision> getApprovalState() { return approvalState; }
    public void setApprovalState(Map<String, ApprovalDecision> approvalState) {
        this.approvalState = approvalState == null ? new LinkedHashMap<>() : new LinkedHashMap<>(approvalState);
    }

    public Map<String, String> getOutputsIndex() { return outputsIndex; }
    public void setOutputsIndex(Map<String, String> outputsIndex) {
        this.outputsIndex = outputsIndex == null ? new LinkedHashMap<>() : new LinkedHashMap<>(outputsIndex);
    }

    public Map<String, Instant> getTimestamps() { return timestamps; }
    public void setTimestamps(Map<String, Instant> timestamps) {
        this.timestamps = timestamps == null ? new LinkedHashMap<>() : new LinkedHashMap<>(timestamps);
    }

    public String getInputsHash() { return inputsHash; }
    public void setInputsHash(String inputsHash) { this.inputsHash = inputsHash; }

    public FailureCause getFailureCause() { return failureCause; }
    public void setFailureCause(FailureCause failureCause) { this.failureCause = failureCause; }

    public String getLastError() { return lastError; }
    public void setLastError(String lastError) { this.lastError = lastError; }

    public String getStackDetected() { return stackDetected; }
    public void setStackDetected(String stackDetected) { this.stackDetected = stackDetected; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Run other)) return false;
        return retryCount == other.retryCount
                && fastMode == other.fastMode
                && Objects.equals(runId, other.runId)
                && Objects.equals(workspaceId, other.workspaceId)
                && status == other.status
                && currentStage == other.currentStage
                && Objects.equals(stageHistory, other.stageHistory)
                && Objects.equals(evidenceDir, other.evidenceDir)
                && Objects.equals(goalStatement, other.goalStatement)
                && Objects.equals(topFeatures, other.topFeatures)
                && Objects.equals(selectedFeatureIndex, other.selectedFeatureIndex)
                && Objects.equals(selectedFeature, other.selectedFeature)
                && Objects.equals(approvalState, other.approvalState)
                && Objects.equals(outputsIndex, other.outputsIndex)
                && Objects.equals(timestamps, other.timestamps)
                && Objects.equals(inputsHash, other.inputsHash)
                && failureCause == other.failureCause
                && Objects.equals(lastError, other.lastError)
                && Objects.equals(stackDetected, other.stackDetected);
    }

    @Override
    public int hashCode() {
        return Objects.hash(runId, workspaceId, status, currentStage, retryCount, inputsHash);
    }

    @Override
    public String toString() {
        return "Run[" + runId + ", " + status + ", stage=" + currentStage + ", retries=" + retryCount + "]";
    }
}
