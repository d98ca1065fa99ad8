package com.growpad.core.store;

public class WorkspaceNotFoundException extends RuntimeException {

    public WorkspaceNotFoundException(String workspaceId) {
        super("Workspace not found: " + workspaceId);
    }
}
