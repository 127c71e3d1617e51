package com.streamfirst.watcher.application;

import com.streamfirst.watcher.domain.*;
import com.streamfirst.watcher.ports.*;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Watches multiple validator archives and collects block signatures (and block data, when
 * enabled) into the watcher store. Each source advances its own cursor; a source that cannot
 * deliver a block never holds back the others.
 */
@Slf4j
public class Watcher implements AutoCloseable {

  private final WatcherStorePort store;
  private final BlockPathMapper pathMapper;
  private final boolean storeBlockData;
  private final ExecutorService fetchExecutor;
  private final ParallelBlockFetcher parallelFetcher;

  /**
   * Creates a watcher.
   *
   * @param store the store used for cursors, signatures and block data
   * @param fetcher the fetcher used to retrieve blocks from the watched sources
   * @param pathMapper maps block indices to archive paths
   * @param storeBlockData whether fetched block material is persisted in addition to signatures
   * @throws WatcherConfigurationException if the fetcher and the store were configured with
   *     different sources
   */
  public Watcher(
      WatcherStorePort store,
      BlockFetcherPort fetcher,
      BlockPathMapper pathMapper,
      boolean storeBlockData) {
    verifySameSources(fetcher.getSourceUrls(), store.getConfiguredSources());
    this.store = store;
    this.pathMapper = pathMapper;
    this.storeBlockData = storeBlockData;
    this.fetchExecutor = Executors.newCachedThreadPool(new FetchThreadFactory());
    this.parallelFetcher = new ParallelBlockFetcher(fetcher, pathMapper, fetchExecutor);
  }

  private static void verifySameSources(Set<Source> fetcherSources, Set<Source> storeSources) {
    Set<Source> missingFromStore = new HashSet<>(fetcherSources);
    missingFromStore.removeAll(storeSources);
    Set<Source> missingFromFetcher = new HashSet<>(storeSources);
    missingFromFetcher.removeAll(fetcherSources);
    if (!missingFromStore.isEmpty() || !missingFromFetcher.isEmpty()) {
      throw new WatcherConfigurationException(missingFromStore, missingFromFetcher);
    }
  }

  /**
   * The lowest next block that still needs to be synced from some source. A source that has not
   * synced anything yet counts as needing block 0.
   *
   * @return the minimum next block over all sources, or 0 if there are no sources
   * @throws WatcherStoreException if the cursors cannot be read
   */
  public long lowestNextBlockToSync() {
    return store.lastSyncedBlocks().values().stream()
        .mapToLong(lastSynced -> lastSynced.isPresent() ? lastSynced.getAsLong() + 1 : 0)
        .min()
        .orElse(0);
  }

  /**
   * Syncs blocks and collects signatures until either every source reached the max block height
   * or a full round of fetches made no progress.
   *
   * @param start block to fetch for sources that have not synced anything yet
   * @param maxBlockHeight last block to sync per source; if empty, keep going as long as any
   *     source delivers blocks
   * @return true if every source reached {@code maxBlockHeight}, false if a round ended without
   *     any source delivering a block
   * @throws WatcherStoreException if the store rejects a write
   */
  public boolean syncBlocks(long start, OptionalLong maxBlockHeight) {
    log.debug("Now syncing signatures from {} to {}", start, maxBlockHeight);

    while (true) {
      Map<Source, OptionalLong> lastSynced = new HashMap<>(store.lastSyncedBlocks());

      // Only keep sources that still need syncing
      if (maxBlockHeight.isPresent()) {
        long max = maxBlockHeight.getAsLong();
        lastSynced.values().removeIf(cursor -> cursor.isPresent() && cursor.getAsLong() >= max);
      }
      if (lastSynced.isEmpty()) {
        return maxBlockHeight.isPresent();
      }

      Map<Source, Long> targets = new HashMap<>();
      lastSynced.forEach(
          (source, cursor) ->
              targets.put(source, cursor.isPresent() ? cursor.getAsLong() + 1 : start));

      Map<Source, FetchOutcome> outcomes = parallelFetcher.fetchAll(targets);

      // Any delivered block means more may be available right away
      boolean hadSuccess = false;
      for (FetchOutcome outcome : outcomes.values()) {
        if (outcome.isSuccess()) {
          reconcile(outcome.source(), outcome.blockIndex(), outcome.result().orElseThrow());
          hadSuccess = true;
        } else {
          log.debug(
              "Could not sync block {} for {}: {}",
              outcome.blockIndex(),
              outcome.source(),
              outcome.result().getErrorMessage().orElse("unknown error"));
        }
      }

      if (!hadSuccess) {
        return false;
      }
    }
  }

  private void reconcile(Source source, long blockIndex, BlockMaterial material) {
    log.info("Archive block retrieved for {} {}", source, blockIndex);

    if (storeBlockData) {
      try {
        store.addBlockMaterial(source, material);
      } catch (BlockAlreadyExistsException e) {
        log.debug("Block {} from {} was already stored", blockIndex, source);
      }
    }

    // Recording a signature advances the cursor on its own
    if (material.getSignature().isPresent()) {
      BlockPath archivePath = pathMapper.blockIndexToPath(blockIndex);
      store.addBlockSignature(source, blockIndex, material.getSignature().get(), archivePath);
    } else {
      store.updateLastSynced(source, blockIndex);
    }
  }

  /** Releases the fetch worker threads. */
  @Override
  public void close() {
    fetchExecutor.shutdown();
  }

  private static final class FetchThreadFactory implements ThreadFactory {
    private final AtomicInteger counter = new AtomicInteger(1);

    @Override
    public Thread newThread(Runnable runnable) {
      Thread thread = new Thread(runnable, "ParallelFetch-" + counter.getAndIncrement());
      thread.setDaemon(true);
      return thread;
    }
  }
}
