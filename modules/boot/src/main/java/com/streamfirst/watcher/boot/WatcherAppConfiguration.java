package com.streamfirst.watcher.boot;

import com.streamfirst.watcher.adapters.InMemoryLedgerAdapter;
import com.streamfirst.watcher.adapters.InMemoryWatcherStoreAdapter;
import com.streamfirst.watcher.adapters.archive.ArchiveBlockPathMapper;
import com.streamfirst.watcher.adapters.archive.LocalArchiveLedgerAdapter;
import com.streamfirst.watcher.adapters.file.JsonFileWatcherStoreAdapter;
import com.streamfirst.watcher.adapters.http.HttpBlockFetcherAdapter;
import com.streamfirst.watcher.application.WatcherSyncThread;
import com.streamfirst.watcher.domain.Source;
import com.streamfirst.watcher.ports.BlockPathMapper;
import com.streamfirst.watcher.ports.LedgerPort;
import com.streamfirst.watcher.ports.WatcherStorePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Wires the watcher adapters and starts the sync thread. The thread is stopped when the
 * application context closes.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(WatcherProperties.class)
public class WatcherAppConfiguration {

    // --- Adapter Beans ---

    @Bean
    public BlockPathMapper blockPathMapper() {
        return new ArchiveBlockPathMapper();
    }

    @Bean(destroyMethod = "close")
    public HttpBlockFetcherAdapter blockFetcher(WatcherProperties properties) {
        return new HttpBlockFetcherAdapter(
                sources(properties),
                properties.getHttp().getConnectTimeout(),
                properties.getHttp().getReadTimeout());
    }

    @Bean
    public WatcherStorePort watcherStore(WatcherProperties properties) {
        List<Source> sources = sources(properties);
        if (properties.getStateDir() == null) {
            log.warn("No watcher.state-dir configured, watcher state will not survive a restart");
            return new InMemoryWatcherStoreAdapter(sources);
        }
        log.info("Using watcher state directory {}", properties.getStateDir());
        return new JsonFileWatcherStoreAdapter(properties.getStateDir(), sources);
    }

    @Bean
    public LedgerPort ledger(WatcherProperties properties, BlockPathMapper blockPathMapper) {
        if (properties.getLedgerArchive() == null) {
            log.warn("No watcher.ledger-archive configured, using an empty in-memory ledger");
            return new InMemoryLedgerAdapter();
        }
        return new LocalArchiveLedgerAdapter(properties.getLedgerArchive(), blockPathMapper);
    }

    // --- Background Driver ---

    @Bean(destroyMethod = "stop")
    public WatcherSyncThread watcherSyncThread(
            WatcherStorePort watcherStore,
            HttpBlockFetcherAdapter blockFetcher,
            BlockPathMapper blockPathMapper,
            LedgerPort ledger,
            WatcherProperties properties) {
        log.info("Starting watcher for {} sources, polling every {}",
                blockFetcher.getSourceUrls().size(), properties.getPollInterval());
        return new WatcherSyncThread(
                watcherStore,
                blockFetcher,
                blockPathMapper,
                ledger,
                properties.getPollInterval(),
                properties.isStoreBlockData());
    }

    private static List<Source> sources(WatcherProperties properties) {
        // With no sources the driver would report itself behind forever
        if (properties.getSources().isEmpty()) {
            throw new IllegalStateException("At least one watcher.sources entry is required");
        }
        return properties.getSources().stream().map(Source::of).toList();
    }
}
