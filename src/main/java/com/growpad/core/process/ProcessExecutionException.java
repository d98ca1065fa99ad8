package com.growpad.core.process;

public class ProcessExecutionException extends RuntimeException {

    public ProcessExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
