package com.streamfirst.watcher.application;

import com.streamfirst.watcher.domain.*;
import com.streamfirst.watcher.ports.BlockFetchException;
import com.streamfirst.watcher.ports.BlockFetcherPort;
import com.streamfirst.watcher.ports.BlockPathMapper;
import java.net.URI;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Fetches one block from each of several sources concurrently. One task is submitted per source;
 * the number of sources is small, so no further bounding is applied. Every task runs to
 * completion before results are returned, and a failing source only affects its own entry.
 */
@Slf4j
@RequiredArgsConstructor
class ParallelBlockFetcher {

  private final BlockFetcherPort fetcher;
  private final BlockPathMapper pathMapper;
  private final Executor executor;

  /**
   * Attempts to fetch the requested block from every source, once.
   *
   * @param targets block index to fetch, per source
   * @return the outcome of each attempt, per source
   */
  Map<Source, FetchOutcome> fetchAll(Map<Source, Long> targets) {
    Map<Source, CompletableFuture<FetchOutcome>> pending = new HashMap<>();
    targets.forEach(
        (source, blockIndex) ->
            pending.put(
                source,
                CompletableFuture.supplyAsync(() -> fetchSingle(source, blockIndex), executor)));

    CompletableFuture.allOf(pending.values().toArray(new CompletableFuture[0])).join();

    Map<Source, FetchOutcome> outcomes = new HashMap<>();
    pending.forEach((source, future) -> outcomes.put(source, future.join()));
    return outcomes;
  }

  private FetchOutcome fetchSingle(Source source, long blockIndex) {
    URI blockUrl = null;
    try {
      BlockPath path = pathMapper.blockIndexToPath(blockIndex);
      blockUrl = source.resolve(path);
      BlockMaterial material = fetcher.fetchBlock(blockUrl);
      return new FetchOutcome(source, blockIndex, Result.success(material));
    } catch (BlockFetchException e) {
      return new FetchOutcome(source, blockIndex, Result.failure(e.getMessage(), e));
    } catch (RuntimeException e) {
      // Unchecked fetcher errors are reported per source like any other fetch failure
      log.warn("Unexpected error fetching block {} from {} ({})", blockIndex, source, blockUrl, e);
      return new FetchOutcome(
          source, blockIndex, Result.failure("Unexpected fetch error: " + e.getMessage(), e));
    }
  }
}
