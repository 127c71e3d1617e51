package com.streamfirst.watcher.adapters;

import com.streamfirst.watcher.ports.LedgerPort;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of LedgerPort for testing and development.
 * The block count is set by the caller instead of being read from a ledger.
 */
@Slf4j
public class InMemoryLedgerAdapter implements LedgerPort {
    
    private final AtomicLong numBlocks;

    public InMemoryLedgerAdapter() {
        this(0);
    }

    public InMemoryLedgerAdapter(long numBlocks) {
        this.numBlocks = new AtomicLong(requireNotNegative(numBlocks));
    }

    @Override
    public long numBlocks() {
        return numBlocks.get();
    }

    /**
     * Sets the block count reported by this ledger.
     */
    public void setNumBlocks(long count) {
        log.debug("Ledger block count set to {}", count);
        numBlocks.set(requireNotNegative(count));
    }

    /**
     * Appends blocks to the ledger, returning the new block count.
     */
    public long appendBlocks(long count) {
        long total = numBlocks.addAndGet(requireNotNegative(count));
        log.debug("Ledger grew by {} to {} blocks", count, total);
        return total;
    }

    private static long requireNotNegative(long count) {
        if (count < 0) {
            throw new IllegalArgumentException("Block count cannot be negative: " + count);
        }
        return count;
    }
}
