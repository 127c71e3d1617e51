package com.streamfirst.watcher.adapters;

import com.streamfirst.watcher.domain.*;
import com.streamfirst.watcher.ports.BlockAlreadyExistsException;
import com.streamfirst.watcher.ports.WatcherStoreException;
import com.streamfirst.watcher.ports.WatcherStorePort;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of WatcherStorePort for testing and development.
 * Provisioned with a fixed set of sources; every mutation for any other source is rejected.
 * State is lost when the application stops.
 */
@Slf4j
public class InMemoryWatcherStoreAdapter implements WatcherStorePort {

    private static final Comparator<SignatureRecord> BY_SOURCE =
            Comparator.comparing(record -> record.source().toString());

    private final Set<Source> sources;
    private final Map<Source, Long> cursors = new ConcurrentHashMap<>();
    private final Map<MaterialKey, BlockMaterial> materials = new ConcurrentHashMap<>();
    private final Map<Long, Map<Source, SignatureRecord>> signatures = new ConcurrentHashMap<>();

    public InMemoryWatcherStoreAdapter(Collection<Source> sources) {
        this.sources = Collections.unmodifiableSet(new LinkedHashSet<>(sources));
    }

    @Override
    public Set<Source> getConfiguredSources() {
        return sources;
    }

    @Override
    public Map<Source, OptionalLong> lastSyncedBlocks() {
        Map<Source, OptionalLong> result = new LinkedHashMap<>();
        for (Source source : sources) {
            Long cursor = cursors.get(source);
            result.put(source, cursor == null ? OptionalLong.empty() : OptionalLong.of(cursor));
        }
        return result;
    }

    @Override
    public void addBlockMaterial(Source source, BlockMaterial material) {
        requireConfigured(source);
        BlockMaterial existing = materials.putIfAbsent(new MaterialKey(source, material.getIndex()), material);
        if (existing != null) {
            throw new BlockAlreadyExistsException(source, material.getIndex());
        }
        log.debug("Stored block {} from {}", material.getIndex(), source);
    }

    @Override
    public void addBlockSignature(Source source, long blockIndex, BlockSignature signature, BlockPath archivePath) {
        requireConfigured(source);
        SignatureRecord record = new SignatureRecord(source, blockIndex, signature, archivePath);
        signatures.computeIfAbsent(blockIndex, k -> new ConcurrentHashMap<>()).put(source, record);
        cursors.put(source, blockIndex);
        log.debug("Recorded signature for block {} from {}", blockIndex, source);
    }

    @Override
    public void updateLastSynced(Source source, long blockIndex) {
        requireConfigured(source);
        cursors.put(source, blockIndex);
        log.trace("Source {} synced up to block {}", source, blockIndex);
    }

    @Override
    public List<SignatureRecord> getBlockSignatures(long blockIndex) {
        Map<Source, SignatureRecord> bySource = signatures.get(blockIndex);
        if (bySource == null) {
            return List.of();
        }
        List<SignatureRecord> result = new ArrayList<>(bySource.values());
        result.sort(BY_SOURCE);
        return result;
    }

    @Override
    public Optional<BlockMaterial> getBlockMaterial(Source source, long blockIndex) {
        return Optional.ofNullable(materials.get(new MaterialKey(source, blockIndex)));
    }

    /**
     * Gets every recorded signature, ordered by block index then source.
     */
    public List<SignatureRecord> getAllSignatures() {
        List<SignatureRecord> result = new ArrayList<>();
        signatures.values().forEach(bySource -> result.addAll(bySource.values()));
        result.sort(Comparator.comparingLong(SignatureRecord::blockIndex).thenComparing(BY_SOURCE));
        return result;
    }

    public int getSignatureCount() {
        return signatures.values().stream().mapToInt(Map::size).sum();
    }

    public int getMaterialCount() {
        return materials.size();
    }

    /**
     * Clears all cursors, signatures and material. Useful for testing.
     */
    public void clear() {
        cursors.clear();
        materials.clear();
        signatures.clear();
        log.debug("Cleared watcher store");
    }

    protected void requireConfigured(Source source) {
        if (!sources.contains(source)) {
            throw new WatcherStoreException("Source is not configured in the store: " + source);
        }
    }

    private record MaterialKey(Source source, long blockIndex) {}
}
