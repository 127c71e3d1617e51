package com.streamfirst.watcher.ports;

import com.streamfirst.watcher.domain.Source;
import lombok.Getter;

/**
 * Thrown when block material for a source and index is stored a second time.
 * Callers re-fetching a block treat this as success.
 */
@Getter
public class BlockAlreadyExistsException extends WatcherStoreException {

    private final Source source;
    private final long blockIndex;

    public BlockAlreadyExistsException(Source source, long blockIndex) {
        super("Block " + blockIndex + " from " + source + " already exists");
        this.source = source;
        this.blockIndex = blockIndex;
    }
}
