package com.streamfirst.watcher.application;

import com.streamfirst.watcher.domain.SyncState;
import com.streamfirst.watcher.ports.*;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps the watcher in step with the local ledger. A background thread compares the watcher's
 * progress with the ledger height, runs bounded sync passes while behind and polls while caught
 * up. Store and ledger errors end the thread; fetch errors never do.
 * 
 * The thread starts on construction and is stopped by {@link #stop()} or {@link #close()}.
 */
@Slf4j
public class WatcherSyncThread implements AutoCloseable {

    /** Maximal number of blocks to attempt to sync at each loop iteration. */
    static final int MAX_BLOCKS_PER_SYNC_ITERATION = 10;

    private final Watcher watcher;
    private final LedgerPort ledger;
    private final Duration pollInterval;

    private final AtomicBoolean currentlyBehind = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicReference<SyncState> state = new AtomicReference<>(SyncState.IDLE);
    private final AtomicReference<RuntimeException> failure = new AtomicReference<>();
    private final Object pollMonitor = new Object();
    private final Thread worker;

    /**
     * Creates and starts a sync thread around an existing watcher.
     * The sync thread takes ownership of the watcher and closes it when the thread exits.
     * 
     * @param watcher the watcher to drive
     * @param ledger the local ledger to follow
     * @param pollInterval how long to wait between checks while caught up
     */
    public WatcherSyncThread(Watcher watcher, LedgerPort ledger, Duration pollInterval) {
        this.watcher = Objects.requireNonNull(watcher, "Watcher cannot be null");
        this.ledger = Objects.requireNonNull(ledger, "Ledger cannot be null");
        this.pollInterval = requireValidPollInterval(pollInterval);

        log.debug("Creating watcher sync thread.");
        this.worker = new Thread(this::run, "WatcherSync");
        state.set(SyncState.RUNNING);
        worker.start();
    }

    /**
     * Creates a watcher from its collaborators and starts a sync thread for it.
     * 
     * @throws WatcherConfigurationException if the fetcher and the store were configured with
     *     different sources
     */
    public WatcherSyncThread(
            WatcherStorePort store,
            BlockFetcherPort fetcher,
            BlockPathMapper pathMapper,
            LedgerPort ledger,
            Duration pollInterval,
            boolean storeBlockData) {
        this(createWatcher(store, fetcher, pathMapper, ledger, pollInterval, storeBlockData), ledger, pollInterval);
    }

    // Must validate before building the watcher, which owns a fetch thread pool
    private static Watcher createWatcher(
            WatcherStorePort store,
            BlockFetcherPort fetcher,
            BlockPathMapper pathMapper,
            LedgerPort ledger,
            Duration pollInterval,
            boolean storeBlockData) {
        Objects.requireNonNull(ledger, "Ledger cannot be null");
        requireValidPollInterval(pollInterval);
        return new Watcher(store, fetcher, pathMapper, storeBlockData);
    }

    private static Duration requireValidPollInterval(Duration pollInterval) {
        Objects.requireNonNull(pollInterval, "Poll interval cannot be null");
        if (pollInterval.isNegative()) {
            throw new IllegalArgumentException("Poll interval cannot be negative: " + pollInterval);
        }
        return pollInterval;
    }

    /**
     * Stops the sync thread and waits for it to exit.
     * A sync pass in progress finishes first; a poll wait is cut short. Safe to call repeatedly.
     */
    public void stop() {
        if (stopRequested.compareAndSet(false, true)) {
            state.compareAndSet(SyncState.RUNNING, SyncState.STOP_REQUESTED);
        }
        synchronized (pollMonitor) {
            pollMonitor.notifyAll();
        }
        if (Thread.currentThread() != worker) {
            joinUninterruptibly(worker);
        }
    }

    /** Stops the sync thread. */
    @Override
    public void close() {
        stop();
    }

    /**
     * Checks whether the watcher is behind the ledger, as of the last check made by the thread.
     */
    public boolean isBehind() {
        return currentlyBehind.get();
    }

    public SyncState getState() {
        return state.get();
    }

    /**
     * Gets the error that ended the thread, if it ended because of one.
     */
    public Optional<RuntimeException> getFailure() {
        return Optional.ofNullable(failure.get());
    }

    private void run() {
        log.debug("WatcherSyncThread has started.");
        try {
            while (!stopRequested.get()) {
                syncIteration();
            }
            log.debug("WatcherSyncThread stop requested.");
        } catch (RuntimeException e) {
            failure.set(e);
            log.error("WatcherSyncThread stopped by an unrecoverable error", e);
        } finally {
            watcher.close();
            state.set(SyncState.STOPPED);
        }
    }

    private void syncIteration() {
        long lowestNextBlockToSync = watcher.lowestNextBlockToSync();
        long ledgerNumBlocks = ledger.numBlocks();
        boolean isBehind = lowestNextBlockToSync < ledgerNumBlocks;
        log.debug("Lowest next block to sync: {}, Ledger block height {}, is_behind {}",
                lowestNextBlockToSync, ledgerNumBlocks, isBehind);

        currentlyBehind.set(isBehind);

        if (isBehind) {
            long maxBlocks = Math.min(
                    ledgerNumBlocks - 1,
                    lowestNextBlockToSync + MAX_BLOCKS_PER_SYNC_ITERATION);
            // The outcome is not needed: the next iteration re-evaluates from the store
            watcher.syncBlocks(lowestNextBlockToSync, OptionalLong.of(maxBlocks));
        } else if (!stopRequested.get()) {
            log.trace("Sleeping, watcher blocks synced = {}...", lowestNextBlockToSync);
            awaitPollInterval();
        }
    }

    private void awaitPollInterval() {
        long deadline = System.nanoTime() + pollInterval.toNanos();
        synchronized (pollMonitor) {
            try {
                long remaining;
                while (!stopRequested.get() && (remaining = deadline - System.nanoTime()) > 0) {
                    TimeUnit.NANOSECONDS.timedWait(pollMonitor, remaining);
                }
            } catch (InterruptedException e) {
                log.warn("WatcherSyncThread interrupted while waiting, stopping");
                Thread.currentThread().interrupt();
                stopRequested.set(true);
            }
        }
    }

    private static void joinUninterruptibly(Thread thread) {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    thread.join();
                    return;
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
