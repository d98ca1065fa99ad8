package com.growpad.core.engine;

import com.growpad.core.model.FailureCause;

/**
 * Fatal error inside a run worker. Tagged with the cause recorded on the run.
 */
public class PipelineException extends RuntimeException {

    private final FailureCause failureCause;

    public PipelineException(FailureCause failureCause, String message) {
        super(message);
        this.failureCause = failureCause;
    }

    public PipelineException(FailureCause failureCause, String message, Throwable cause) {
        super(message, cause);
        this.failureCause = failureCause;
    }

    public FailureCause getFailureCause() {
        return failureCause;
    }

    @Override
    public String toString() {
        return "[" + failureCause + "] " + getMessage();
    }
}
