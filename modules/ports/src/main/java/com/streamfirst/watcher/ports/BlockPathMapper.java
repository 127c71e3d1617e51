package com.streamfirst.watcher.ports;

import com.streamfirst.watcher.domain.BlockPath;

/**
 * Maps a block index to the canonical relative path of its file in an archive.
 * Implementations must be pure and deterministic.
 */
@FunctionalInterface
public interface BlockPathMapper {

    BlockPath blockIndexToPath(long blockIndex);
}
