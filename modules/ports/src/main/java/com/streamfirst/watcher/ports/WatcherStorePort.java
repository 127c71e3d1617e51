package com.streamfirst.watcher.ports;

import com.streamfirst.watcher.domain.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Port for the durable watcher state: the per-source sync cursors, collected signatures and,
 * optionally, the raw block material.
 * Implementations must be safe for concurrent use.
 */
public interface WatcherStorePort {
    
    /**
     * Gets the sources this store was provisioned with.
     * 
     * @return the configured sources
     * @throws WatcherStoreException if the configuration cannot be read
     */
    Set<Source> getConfiguredSources();
    
    /**
     * Gets the sync cursor of every configured source.
     * An empty cursor means nothing was synced yet for that source; a present cursor {@code i}
     * means blocks {@code 0..i} are synced.
     * 
     * @return cursor per configured source
     * @throws WatcherStoreException if the cursors cannot be read
     */
    Map<Source, OptionalLong> lastSyncedBlocks();
    
    /**
     * Persists the raw block material fetched from a source.
     * 
     * @param source the source the material was fetched from
     * @param material the block material
     * @throws BlockAlreadyExistsException if material for this source and index is already stored
     * @throws WatcherStoreException if the material cannot be stored
     */
    void addBlockMaterial(Source source, BlockMaterial material);
    
    /**
     * Records a block signature published by a source.
     * Recording a signature also advances the cursor of that source to {@code blockIndex}.
     * 
     * @param source the source that published the signature
     * @param blockIndex the signed block
     * @param signature the signature
     * @param archivePath the canonical path of the block file in the archive
     * @throws WatcherStoreException if the signature cannot be stored
     */
    void addBlockSignature(Source source, long blockIndex, BlockSignature signature, BlockPath archivePath);
    
    /**
     * Advances the cursor of a source without recording a signature.
     * 
     * @param source the source
     * @param blockIndex the last synced block for the source
     * @throws WatcherStoreException if the cursor cannot be updated
     */
    void updateLastSynced(Source source, long blockIndex);
    
    /**
     * Gets every signature recorded for a block, across all sources.
     * 
     * @param blockIndex the block
     * @return recorded signatures, ordered by source
     */
    List<SignatureRecord> getBlockSignatures(long blockIndex);
    
    /**
     * Gets block material previously stored for a source.
     * 
     * @param source the source
     * @param blockIndex the block
     * @return the stored material, or empty if none was stored
     */
    Optional<BlockMaterial> getBlockMaterial(Source source, long blockIndex);
}
