package com.streamfirst.watcher.boot;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Externalized watcher settings, bound from the {@code watcher.*} properties.
 */
@Data
@ConfigurationProperties(prefix = "watcher")
public class WatcherProperties {

    /** Base URLs of the validator archives to watch. */
    private List<String> sources = new ArrayList<>();

    /** How long the sync thread waits between ledger checks while caught up. */
    private Duration pollInterval = Duration.ofSeconds(1);

    /** Whether fetched block data is stored in addition to signatures. */
    private boolean storeBlockData = false;

    /** Directory of the local node's block archive, used as the ledger. */
    private Path ledgerArchive;

    /** Directory for durable watcher state. In-memory state is used when unset. */
    private Path stateDir;

    private final Http http = new Http();

    @Data
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(10);
    }
}
