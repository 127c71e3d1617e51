package com.streamfirst.watcher.ports;

import com.streamfirst.watcher.domain.BlockMaterial;
import com.streamfirst.watcher.domain.Source;

import java.net.URI;
import java.util.Set;

/**
 * Port for retrieving block files from remote archives.
 * Implementations are called concurrently, one caller per source, and must be thread safe.
 */
public interface BlockFetcherPort {
    
    /**
     * Gets the sources this fetcher was configured for.
     * 
     * @return the configured sources
     */
    Set<Source> getSourceUrls();
    
    /**
     * Fetches and decodes one block file.
     * Makes exactly one attempt; retrying is up to the caller.
     * 
     * @param blockUrl the full URL of the block file
     * @return the decoded block material
     * @throws BlockFetchException if the block is unavailable or cannot be decoded
     */
    BlockMaterial fetchBlock(URI blockUrl) throws BlockFetchException;
}
