package com.streamfirst.watcher.ports;

/**
 * Thrown when the watcher store cannot read or persist its state.
 */
public class WatcherStoreException extends RuntimeException {

    public WatcherStoreException(String message) {
        super(message);
    }

    public WatcherStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
