package com.streamfirst.watcher.domain;

import java.time.Instant;
import java.util.Optional;
import lombok.NonNull;

/**
 * Attestation a validator attached to a block it archived.
 *
 * @param signer hex encoded public key of the signing validator
 * @param signature hex encoded signature bytes
 * @param signedAt when the validator signed the block, if the archive recorded it
 */
public record BlockSignature(@NonNull String signer, @NonNull String signature, Instant signedAt) {

  public BlockSignature {
    if (signature.isEmpty()) {
      throw new IllegalArgumentException("Signature cannot be empty");
    }
  }

  public static BlockSignature of(String signer, String signature) {
    return new BlockSignature(signer, signature, null);
  }

  public Optional<Instant> getSignedAt() {
    return Optional.ofNullable(signedAt);
  }
}
