package com.streamfirst.watcher.domain;

import lombok.NonNull;

/**
 * Result of one fetch attempt: the block index that was requested from a source and either the
 * retrieved material or the reason it could not be retrieved.
 */
public record FetchOutcome(
    @NonNull Source source,
    long blockIndex,
    @NonNull Result<BlockMaterial> result) {

  public boolean isSuccess() {
    return result.isSuccess();
  }
}
