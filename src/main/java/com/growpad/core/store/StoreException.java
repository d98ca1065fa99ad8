package com.growpad.core.store;

/**
 * Thrown when the filesystem store cannot read or write.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
