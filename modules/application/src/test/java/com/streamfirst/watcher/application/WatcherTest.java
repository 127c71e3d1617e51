package com.streamfirst.watcher.application;

import com.streamfirst.watcher.domain.*;
import com.streamfirst.watcher.ports.WatcherStoreException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

import static com.streamfirst.watcher.application.FakeArchiveFetcher.PATH_MAPPER;
import static org.assertj.core.api.Assertions.*;

class WatcherTest {

    private static final Source SOURCE_A = Source.of("https://a.example.org/archive/");
    private static final Source SOURCE_B = Source.of("https://b.example.org/archive/");

    private final List<Watcher> watchers = new ArrayList<>();

    @AfterEach
    void closeWatchers() {
        watchers.forEach(Watcher::close);
    }

    private Watcher watcher(FakeWatcherStore store, FakeArchiveFetcher fetcher, boolean storeBlockData) {
        Watcher watcher = new Watcher(store, fetcher, PATH_MAPPER, storeBlockData);
        watchers.add(watcher);
        return watcher;
    }

    @Test
    void syncsAllSourcesUpToMaxHeight() {
        FakeWatcherStore store = new FakeWatcherStore(SOURCE_A, SOURCE_B);
        FakeArchiveFetcher fetcher = new FakeArchiveFetcher(SOURCE_A, SOURCE_B)
                .withHeight(SOURCE_A, 5)
                .withHeight(SOURCE_B, 5);
        Watcher watcher = watcher(store, fetcher, false);

        assertThat(watcher.lowestNextBlockToSync()).isZero();
        assertThat(watcher.syncBlocks(0, OptionalLong.of(2))).isTrue();

        assertThat(store.cursorOf(SOURCE_A)).hasValue(2);
        assertThat(store.cursorOf(SOURCE_B)).hasValue(2);
        assertThat(watcher.lowestNextBlockToSync()).isEqualTo(3);
        for (long index = 0; index <= 2; index++) {
            assertThat(store.getBlockSignatures(index))
                    .extracting(SignatureRecord::source, SignatureRecord::signature, SignatureRecord::archivePath)
                    .containsExactly(
                            tuple(SOURCE_A, FakeArchiveFetcher.signatureOf(SOURCE_A, index), PATH_MAPPER.blockIndexToPath(index)),
                            tuple(SOURCE_B, FakeArchiveFetcher.signatureOf(SOURCE_B, index), PATH_MAPPER.blockIndexToPath(index)));
        }
        assertThat(store.getBlockSignatures(3)).isEmpty();
    }

    @Test
    void failingSourceDoesNotHoldBackOthers() {
        FakeWatcherStore store = new FakeWatcherStore(SOURCE_A, SOURCE_B);
        FakeArchiveFetcher fetcher = new FakeArchiveFetcher(SOURCE_A, SOURCE_B).withHeight(SOURCE_A, 5);
        Watcher watcher = watcher(store, fetcher, false);

        assertThat(watcher.syncBlocks(0, OptionalLong.of(2))).isFalse();

        assertThat(store.cursorOf(SOURCE_A)).hasValue(2);
        assertThat(store.cursorOf(SOURCE_B)).isEmpty();
        assertThat(watcher.lowestNextBlockToSync()).isZero();
    }

    @Test
    void returnsFalseWithoutChangesWhenEveryFetchFails() {
        FakeWatcherStore store = new FakeWatcherStore(SOURCE_A, SOURCE_B);
        FakeArchiveFetcher fetcher = new FakeArchiveFetcher(SOURCE_A, SOURCE_B);
        Watcher watcher = watcher(store, fetcher, true);

        assertThat(watcher.syncBlocks(0, OptionalLong.of(10))).isFalse();

        assertThat(store.getWriteCount()).isZero();
        assertThat(fetcher.getRequests()).hasSize(2);
    }

    @Test
    void returnsFalseWhenArchivesEndBeforeMaxHeight() {
        FakeWatcherStore store = new FakeWatcherStore(SOURCE_A, SOURCE_B);
        FakeArchiveFetcher fetcher = new FakeArchiveFetcher(SOURCE_A, SOURCE_B)
                .withHeight(SOURCE_A, 2)
                .withHeight(SOURCE_B, 2);
        Watcher watcher = watcher(store, fetcher, false);

        assertThat(watcher.syncBlocks(0, OptionalLong.of(3))).isFalse();

        assertThat(store.cursorOf(SOURCE_A)).hasValue(2);
        assertThat(store.cursorOf(SOURCE_B)).hasValue(2);
    }

    @Test
    void unboundedSyncStopsWhenSourcesRunDry() {
        FakeWatcherStore store = new FakeWatcherStore(SOURCE_A, SOURCE_B);
        FakeArchiveFetcher fetcher = new FakeArchiveFetcher(SOURCE_A, SOURCE_B)
                .withHeight(SOURCE_A, 3)
                .withHeight(SOURCE_B, 1);
        Watcher watcher = watcher(store, fetcher, false);

        assertThat(watcher.syncBlocks(0, OptionalLong.empty())).isFalse();

        assertThat(store.cursorOf(SOURCE_A)).hasValue(3);
        assertThat(store.cursorOf(SOURCE_B)).hasValue(1);
        assertThat(watcher.lowestNextBlockToSync()).isEqualTo(2);
    }

    @Test
    void resumesFromStoredCursorsAndStartsNewSourcesAtStart() {
        FakeWatcherStore store = new FakeWatcherStore(SOURCE_A, SOURCE_B).withCursor(SOURCE_A, 5);
        FakeArchiveFetcher fetcher = new FakeArchiveFetcher(SOURCE_A, SOURCE_B);
        Watcher watcher = watcher(store, fetcher, false);

        watcher.syncBlocks(3, OptionalLong.of(10));

        assertThat(fetcher.getRequests()).containsExactlyInAnyOrder(
                SOURCE_A.resolve(PATH_MAPPER.blockIndexToPath(6)),
                SOURCE_B.resolve(PATH_MAPPER.blockIndexToPath(3)));
    }

    @Test
    void sourcesAtMaxHeightAreNotFetched() {
        FakeWatcherStore store = new FakeWatcherStore(SOURCE_A, SOURCE_B)
                .withCursor(SOURCE_A, 4)
                .withCursor(SOURCE_B, 7);
        FakeArchiveFetcher fetcher = new FakeArchiveFetcher(SOURCE_A, SOURCE_B);
        Watcher watcher = watcher(store, fetcher, false);

        assertThat(watcher.syncBlocks(0, OptionalLong.of(4))).isTrue();
        assertThat(fetcher.getRequests()).isEmpty();
    }

    @Test
    void unsignedBlockOnlyAdvancesCursor() {
        FakeWatcherStore store = new FakeWatcherStore(SOURCE_A);
        FakeArchiveFetcher fetcher = new FakeArchiveFetcher(SOURCE_A)
                .withHeight(SOURCE_A, 1)
                .withUnsignedBlock(1);
        Watcher watcher = watcher(store, fetcher, false);

        assertThat(watcher.syncBlocks(0, OptionalLong.of(1))).isTrue();

        assertThat(store.cursorOf(SOURCE_A)).hasValue(1);
        assertThat(store.getBlockSignatures(0)).hasSize(1);
        assertThat(store.getBlockSignatures(1)).isEmpty();
    }

    @Test
    void storesBlockDataWhenEnabledAndToleratesDuplicates() {
        FakeWatcherStore store = new FakeWatcherStore(SOURCE_A);
        FakeArchiveFetcher fetcher = new FakeArchiveFetcher(SOURCE_A).withHeight(SOURCE_A, 1);
        store.addBlockMaterial(SOURCE_A, BlockMaterial.unsigned(0, "block-0".getBytes()));
        Watcher watcher = watcher(store, fetcher, true);

        assertThat(watcher.syncBlocks(0, OptionalLong.of(1))).isTrue();

        assertThat(store.cursorOf(SOURCE_A)).hasValue(1);
        assertThat(store.getBlockMaterial(SOURCE_A, 0)).isPresent();
        assertThat(store.getBlockMaterial(SOURCE_A, 1))
                .hasValueSatisfying(material -> assertThat(material.getContents()).isEqualTo("block-1".getBytes()));
    }

    @Test
    void doesNotStoreBlockDataWhenDisabled() {
        FakeWatcherStore store = new FakeWatcherStore(SOURCE_A);
        FakeArchiveFetcher fetcher = new FakeArchiveFetcher(SOURCE_A).withHeight(SOURCE_A, 0);
        Watcher watcher = watcher(store, fetcher, false);

        watcher.syncBlocks(0, OptionalLong.of(0));

        assertThat(store.getBlockMaterial(SOURCE_A, 0)).isEmpty();
    }

    @Test
    void uncheckedFetchErrorsCountAsFailures() {
        FakeWatcherStore store = new FakeWatcherStore(SOURCE_A);
        FakeArchiveFetcher fetcher = new FakeArchiveFetcher(SOURCE_A)
                .failingWith(new IllegalStateException("boom"));
        Watcher watcher = watcher(store, fetcher, false);

        assertThat(watcher.syncBlocks(0, OptionalLong.of(5))).isFalse();
        assertThat(store.cursorOf(SOURCE_A)).isEmpty();
    }

    @Test
    void storeErrorsPropagate() {
        FakeWatcherStore store = new FakeWatcherStore(SOURCE_A);
        FakeArchiveFetcher fetcher = new FakeArchiveFetcher(SOURCE_A).withHeight(SOURCE_A, 3);
        store.failWrites();
        Watcher watcher = watcher(store, fetcher, false);

        assertThatThrownBy(() -> watcher.syncBlocks(0, OptionalLong.of(3)))
                .isInstanceOf(WatcherStoreException.class);
    }

    @Test
    void lowestNextBlockIsZeroWithoutSources() {
        Watcher watcher = watcher(new FakeWatcherStore(), new FakeArchiveFetcher(), false);

        assertThat(watcher.lowestNextBlockToSync()).isZero();
        assertThat(watcher.syncBlocks(0, OptionalLong.of(3))).isTrue();
        assertThat(watcher.syncBlocks(0, OptionalLong.empty())).isFalse();
    }

    @Test
    void lowestNextBlockTakesMinimumOverSources() {
        FakeWatcherStore store = new FakeWatcherStore(SOURCE_A, SOURCE_B)
                .withCursor(SOURCE_A, 8)
                .withCursor(SOURCE_B, 3);
        Watcher watcher = watcher(store, new FakeArchiveFetcher(SOURCE_A, SOURCE_B), false);

        assertThat(watcher.lowestNextBlockToSync()).isEqualTo(4);
    }

    @Test
    void rejectsMismatchedSourceConfiguration() {
        Source extra = Source.of("https://c.example.org/archive/");
        FakeWatcherStore store = new FakeWatcherStore(SOURCE_A, SOURCE_B);
        FakeArchiveFetcher fetcher = new FakeArchiveFetcher(SOURCE_A, extra);

        assertThatThrownBy(() -> new Watcher(store, fetcher, PATH_MAPPER, false))
                .isInstanceOfSatisfying(WatcherConfigurationException.class, e -> {
                    assertThat(e.getMissingFromStore()).containsExactly(extra);
                    assertThat(e.getMissingFromFetcher()).containsExactly(SOURCE_B);
                });
    }
}
