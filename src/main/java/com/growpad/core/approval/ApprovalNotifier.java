package com.growpad.core.approval;

import com.growpad.core.model.Workspace;

/**
 * Tells approvers that a run is waiting for their decision. Best-effort: failures
 * are logged by the caller and never fail the run.
 */
public interface ApprovalNotifier {

    void requestApproval(String runId, Workspace workspace, String feature);
}
