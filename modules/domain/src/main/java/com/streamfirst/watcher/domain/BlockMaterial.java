package com.streamfirst.watcher.domain;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Value;

/**
 * Block data fetched from one source for one block index. The contents are opaque to the
 * watcher; only the optional signature is interpreted.
 */
@Value
@EqualsAndHashCode(of = {"index", "contents"})
public class BlockMaterial {
  /** Index of the block in the chain */
  long index;

  /** Raw block bytes as published by the archive */
  @Getter(AccessLevel.NONE)
  byte[] contents;

  /** Signature over the block, absent when the archive did not publish one */
  @Getter(AccessLevel.NONE)
  BlockSignature signature;

  public BlockMaterial(long index, byte[] contents, BlockSignature signature) {
    Objects.requireNonNull(contents, "Block contents cannot be null");
    if (index < 0) {
      throw new IllegalArgumentException("Block index cannot be negative: " + index);
    }
    this.index = index;
    this.contents = Arrays.copyOf(contents, contents.length);
    this.signature = signature;
  }

  public static BlockMaterial unsigned(long index, byte[] contents) {
    return new BlockMaterial(index, contents, null);
  }

  public static BlockMaterial signed(long index, byte[] contents, BlockSignature signature) {
    return new BlockMaterial(index, contents, signature);
  }

  public byte[] getContents() {
    return Arrays.copyOf(contents, contents.length);
  }

  public Optional<BlockSignature> getSignature() {
    return Optional.ofNullable(signature);
  }

  @Override
  public String toString() {
    return "BlockMaterial{"
        + "index="
        + index
        + ", size="
        + contents.length
        + ", signed="
        + (signature != null)
        + '}';
  }
}
