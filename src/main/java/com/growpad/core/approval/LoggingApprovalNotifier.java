package com.growpad.core.approval;

import com.growpad.core.model.Workspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Default notifier: writes the approval request to the log.
 */
@Service
public class LoggingApprovalNotifier implements ApprovalNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingApprovalNotifier.class);

    @Override
    public void requestApproval(String runId, Workspace workspace, String feature) {
        log.info("Approval requested for run {} (team {}, feature '{}') from {}", runId, workspace.teamName(),
                feature, workspace.approvers().isEmpty() ? "any approver" : workspace.approvers());
    }
}
