package com.streamfirst.watcher.adapters.archive;

import com.streamfirst.watcher.ports.BlockPathMapper;
import com.streamfirst.watcher.ports.LedgerException;
import com.streamfirst.watcher.ports.LedgerPort;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Ledger backed by a local block archive on disk. The block count is the number of consecutive
 * block files present starting at block 0. Blocks are only ever appended, so the count is cached
 * and probed forward from the last known value.
 */
@Slf4j
public class LocalArchiveLedgerAdapter implements LedgerPort {
    
    private final Path archiveRoot;
    private final BlockPathMapper pathMapper;
    private long knownBlocks;

    public LocalArchiveLedgerAdapter(Path archiveRoot, BlockPathMapper pathMapper) {
        this.archiveRoot = archiveRoot;
        this.pathMapper = pathMapper;
    }

    @Override
    public synchronized long numBlocks() {
        if (!Files.isDirectory(archiveRoot)) {
            throw new LedgerException("Ledger archive not found: " + archiveRoot);
        }
        
        long before = knownBlocks;
        while (Files.isRegularFile(archiveRoot.resolve(pathMapper.blockIndexToPath(knownBlocks).value()))) {
            knownBlocks++;
        }
        
        if (knownBlocks != before) {
            log.debug("Ledger archive {} grew from {} to {} blocks", archiveRoot, before, knownBlocks);
        }
        return knownBlocks;
    }
}
