package com.streamfirst.watcher.ports;

import java.net.URI;
import lombok.Getter;

/**
 * Thrown when a block file cannot be retrieved or decoded.
 * Expected during normal operation: archives lag behind the ledger and go offline.
 */
@Getter
public class BlockFetchException extends Exception {

    private final URI blockUrl;

    public BlockFetchException(URI blockUrl, String message) {
        super(message + ": " + blockUrl);
        this.blockUrl = blockUrl;
    }

    public BlockFetchException(URI blockUrl, String message, Throwable cause) {
        super(message + ": " + blockUrl, cause);
        this.blockUrl = blockUrl;
    }
}
