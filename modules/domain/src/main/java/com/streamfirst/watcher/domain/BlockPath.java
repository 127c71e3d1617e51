package com.streamfirst.watcher.domain;

/**
 * Canonical relative path of a block file inside an archive. The same path is used to build the
 * fetch URL and as the storage key of the block's signature.
 *
 * @param value the relative, {@code /}-separated path
 */
public record BlockPath(String value) {

  public BlockPath {
    if (value == null || value.trim().isEmpty()) {
      throw new IllegalArgumentException("Block path cannot be null or empty");
    }
    value = value.replace('\\', '/');
    if (value.startsWith("/")) {
      throw new IllegalArgumentException("Block path must be relative: " + value);
    }
    if (value.contains("..")) {
      throw new IllegalArgumentException("Block path cannot contain '..': " + value);
    }
  }

  public static BlockPath of(String value) {
    return new BlockPath(value);
  }

  /** Gets the file name (last component). */
  public String getFileName() {
    int lastSlash = value.lastIndexOf('/');
    return lastSlash == -1 ? value : value.substring(lastSlash + 1);
  }

  @Override
  public String toString() {
    return value;
  }
}
