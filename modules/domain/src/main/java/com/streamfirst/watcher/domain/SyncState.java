package com.streamfirst.watcher.domain;

/**
 * Lifecycle of the background sync driver.
 */
public enum SyncState {
    /** Constructed, worker not started yet */
    IDLE,
    /** Worker loop is active */
    RUNNING,
    /** Stop was requested, the current iteration is still draining */
    STOP_REQUESTED,
    /** Worker has exited, either after a stop or after a fatal error */
    STOPPED
}
