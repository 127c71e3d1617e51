package com.streamfirst.watcher.ports;

/**
 * Port for the local ledger, the authoritative reference for how many blocks exist.
 */
public interface LedgerPort {

    /**
     * Gets the number of blocks currently in the ledger.
     *
     * @return the block count
     * @throws LedgerException if the ledger cannot be queried
     */
    long numBlocks();
}
