package com.streamfirst.watcher.adapters.file;

import com.google.gson.*;
import com.streamfirst.watcher.adapters.InMemoryWatcherStoreAdapter;
import com.streamfirst.watcher.adapters.http.BlockMaterialCodec;
import com.streamfirst.watcher.domain.*;
import com.streamfirst.watcher.ports.BlockAlreadyExistsException;
import com.streamfirst.watcher.ports.WatcherStoreException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Watcher store persisted to a directory.
 *
 * <p>Cursors and signatures live in {@code state.json}, rewritten as a whole after every
 * change through a temporary file and an atomic rename, so a crash leaves either the old or
 * the new state. Block material is written once per source and index under
 * {@code blocks/<encoded source>/<index>.json} in the archive's block file format, the same way.
 *
 * <p>Entries for sources that are no longer configured are ignored on load and dropped on the
 * next write.
 */
@Slf4j
public class JsonFileWatcherStoreAdapter extends InMemoryWatcherStoreAdapter {

    static final String STATE_FILE = "state.json";
    static final String BLOCKS_DIR = "blocks";
    static final String BLOCK_FILE_SUFFIX = ".json";
    static final String TMP_SUFFIX = ".tmp";

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private final Path directory;
    private final Path stateFile;
    private final Object materialLock = new Object();

    public JsonFileWatcherStoreAdapter(Path directory, Collection<Source> sources) {
        super(sources);
        this.directory = directory;
        this.stateFile = directory.resolve(STATE_FILE);
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new WatcherStoreException("Cannot create store directory " + directory, e);
        }
        load();
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public synchronized void addBlockSignature(
            Source source, long blockIndex, BlockSignature signature, BlockPath archivePath) {
        super.addBlockSignature(source, blockIndex, signature, archivePath);
        writeState();
    }

    @Override
    public synchronized void updateLastSynced(Source source, long blockIndex) {
        super.updateLastSynced(source, blockIndex);
        writeState();
    }

    /**
     * Writes the block file through a temporary sibling and an atomic rename, so a block file
     * either holds complete material or does not exist.
     */
    @Override
    public void addBlockMaterial(Source source, BlockMaterial material) {
        requireConfigured(source);
        Path file = blockFile(source, material.getIndex());
        Path tmpFile = file.resolveSibling(file.getFileName() + TMP_SUFFIX);
        // Guards the exists check and the rename, since ATOMIC_MOVE may replace an existing target
        synchronized (materialLock) {
            if (Files.exists(file)) {
                throw new BlockAlreadyExistsException(source, material.getIndex());
            }
            try {
                Files.createDirectories(file.getParent());
                Files.write(tmpFile, BlockMaterialCodec.encode(material));
                Files.move(tmpFile, file, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                throw new WatcherStoreException("Cannot store block " + material.getIndex() + " from " + source, e);
            }
        }
        log.debug("Stored block {} from {} at {}", material.getIndex(), source, file);
    }

    @Override
    public Optional<BlockMaterial> getBlockMaterial(Source source, long blockIndex) {
        Path file = blockFile(source, blockIndex);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(BlockMaterialCodec.decode(Files.readAllBytes(file)));
        } catch (IOException | IllegalArgumentException e) {
            throw new WatcherStoreException("Cannot read stored block " + file, e);
        }
    }

    @Override
    public int getMaterialCount() {
        Path blocks = directory.resolve(BLOCKS_DIR);
        if (!Files.isDirectory(blocks)) {
            return 0;
        }
        try (var files = Files.walk(blocks)) {
            return (int) files
                    .filter(Files::isRegularFile)
                    .filter(file -> file.getFileName().toString().endsWith(BLOCK_FILE_SUFFIX))
                    .count();
        } catch (IOException e) {
            throw new WatcherStoreException("Cannot list stored blocks in " + blocks, e);
        }
    }

    /** Clears cursors and signatures. Stored block files are kept. */
    @Override
    public synchronized void clear() {
        super.clear();
        writeState();
    }

    Path blockFile(Source source, long blockIndex) {
        String sourceDir = URLEncoder.encode(source.toString(), StandardCharsets.UTF_8);
        return directory.resolve(BLOCKS_DIR).resolve(sourceDir).resolve(blockIndex + BLOCK_FILE_SUFFIX);
    }

    private void load() {
        if (!Files.isRegularFile(stateFile)) {
            log.info("No watcher state at {}, starting fresh", stateFile);
            return;
        }

        JsonObject root;
        try {
            root = JsonParser.parseString(Files.readString(stateFile, StandardCharsets.UTF_8)).getAsJsonObject();
        } catch (IOException | JsonParseException | IllegalStateException e) {
            throw new WatcherStoreException("Cannot read watcher state " + stateFile, e);
        }

        try {
            // Signatures first: replaying them moves cursors, which are then restored exactly
            JsonArray signatures = root.has("signatures") ? root.getAsJsonArray("signatures") : new JsonArray();
            for (JsonElement element : signatures) {
                JsonObject entry = element.getAsJsonObject();
                Source source = Source.of(entry.get("source").getAsString());
                if (!getConfiguredSources().contains(source)) {
                    log.warn("Ignoring stored signature from unconfigured source {}", source);
                    continue;
                }
                super.addBlockSignature(
                        source,
                        entry.get("index").getAsLong(),
                        BlockMaterialCodec.signatureFromJson(entry.getAsJsonObject("signature")),
                        BlockPath.of(entry.get("path").getAsString()));
            }

            JsonObject cursors = root.has("cursors") ? root.getAsJsonObject("cursors") : new JsonObject();
            for (Map.Entry<String, JsonElement> entry : cursors.entrySet()) {
                Source source = Source.of(entry.getKey());
                if (!getConfiguredSources().contains(source)) {
                    log.warn("Ignoring stored cursor of unconfigured source {}", source);
                    continue;
                }
                super.updateLastSynced(source, entry.getValue().getAsLong());
            }
        } catch (RuntimeException e) {
            throw new WatcherStoreException("Corrupt watcher state " + stateFile, e);
        }
        log.info("Loaded watcher state from {}: {} signatures", stateFile, getSignatureCount());
    }

    private void writeState() {
        JsonObject root = new JsonObject();

        JsonObject cursors = new JsonObject();
        for (Map.Entry<Source, OptionalLong> entry : lastSyncedBlocks().entrySet()) {
            entry.getValue().ifPresent(cursor -> cursors.addProperty(entry.getKey().toString(), cursor));
        }
        root.add("cursors", cursors);

        JsonArray signatures = new JsonArray();
        for (SignatureRecord record : getAllSignatures()) {
            JsonObject entry = new JsonObject();
            entry.addProperty("source", record.source().toString());
            entry.addProperty("index", record.blockIndex());
            entry.addProperty("path", record.archivePath().value());
            entry.add("signature", BlockMaterialCodec.signatureToJson(record.signature()));
            signatures.add(entry);
        }
        root.add("signatures", signatures);

        Path tmpFile = stateFile.resolveSibling(STATE_FILE + TMP_SUFFIX);
        try {
            Files.writeString(tmpFile, GSON.toJson(root), StandardCharsets.UTF_8);
            Files.move(tmpFile, stateFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new WatcherStoreException("Cannot write watcher state " + stateFile, e);
        }
    }
}
