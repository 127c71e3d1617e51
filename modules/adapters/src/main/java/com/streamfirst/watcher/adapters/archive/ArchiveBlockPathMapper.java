package com.streamfirst.watcher.adapters.archive;

import com.streamfirst.watcher.domain.BlockPath;
import com.streamfirst.watcher.ports.BlockPathMapper;

/**
 * Archive layout used by validators: the block index as 16 hex digits, the first 14 digits split
 * into two-character directories, and the full hex string as the file name.
 *
 * <p>Block {@code 0x1234} lives at {@code 00/00/00/00/00/00/12/0000000000001234.pb}.
 */
public final class ArchiveBlockPathMapper implements BlockPathMapper {

  public static final String BLOCK_FILE_EXTENSION = ".pb";

  private static final int HEX_DIGITS = 16;

  @Override
  public BlockPath blockIndexToPath(long blockIndex) {
    if (blockIndex < 0) {
      throw new IllegalArgumentException("Block index cannot be negative: " + blockIndex);
    }
    String hex = String.format("%016x", blockIndex);
    StringBuilder path = new StringBuilder(HEX_DIGITS * 2);
    for (int i = 0; i < HEX_DIGITS - 2; i += 2) {
      path.append(hex, i, i + 2).append('/');
    }
    path.append(hex).append(BLOCK_FILE_EXTENSION);
    return BlockPath.of(path.toString());
  }
}
