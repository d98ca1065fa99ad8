package com.growpad.core.store;

public class RunNotFoundException extends RuntimeException {

    public RunNotFoundException(String runId) {
        super("Run not found: " + runId);
    }
}
