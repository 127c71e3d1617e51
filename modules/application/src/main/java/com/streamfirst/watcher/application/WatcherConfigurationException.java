package com.streamfirst.watcher.application;

import com.streamfirst.watcher.domain.Source;
import java.util.Set;
import lombok.Getter;

/**
 * Thrown when the fetcher and the store were provisioned with different sources. This is a
 * deployment mistake, not a runtime condition, so it is reported once at construction.
 */
@Getter
public class WatcherConfigurationException extends IllegalStateException {

  private final Set<Source> missingFromStore;
  private final Set<Source> missingFromFetcher;

  public WatcherConfigurationException(Set<Source> missingFromStore, Set<Source> missingFromFetcher) {
    super(
        "Fetcher and store sources differ: missing from store "
            + missingFromStore
            + ", missing from fetcher "
            + missingFromFetcher);
    this.missingFromStore = Set.copyOf(missingFromStore);
    this.missingFromFetcher = Set.copyOf(missingFromFetcher);
  }
}
