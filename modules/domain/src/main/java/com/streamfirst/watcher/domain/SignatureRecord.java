package com.streamfirst.watcher.domain;

import lombok.NonNull;

/**
 * A signature as recorded by the store: which source published it, for which block, and under
 * which archive path the block file was found.
 */
public record SignatureRecord(
    @NonNull Source source,
    long blockIndex,
    @NonNull BlockSignature signature,
    @NonNull BlockPath archivePath) {}
