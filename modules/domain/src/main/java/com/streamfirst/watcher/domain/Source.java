package com.streamfirst.watcher.domain;

import java.net.URI;
import java.util.Objects;

/**
 * A watched archive endpoint, one per validator. Block files published by the validator are found
 * by resolving a {@link BlockPath} against the base URL.
 *
 * @param baseUrl absolute base URL of the archive, always ending with {@code /}
 */
public record Source(URI baseUrl) {
  public Source {
    Objects.requireNonNull(baseUrl, "Source base URL cannot be null");
    if (!baseUrl.isAbsolute()) {
      throw new IllegalArgumentException("Source base URL must be absolute: " + baseUrl);
    }
    // Without the trailing slash, resolve() would replace the last path segment
    String raw = baseUrl.toString();
    if (!raw.endsWith("/")) {
      baseUrl = URI.create(raw + "/");
    }
  }

  /** Creates a source from a URL string. */
  public static Source of(String baseUrl) {
    return new Source(URI.create(baseUrl));
  }

  /** Builds the URL of a block file published by this source. */
  public URI resolve(BlockPath path) {
    return baseUrl.resolve(path.value());
  }

  @Override
  public String toString() {
    return baseUrl.toString();
  }
}
