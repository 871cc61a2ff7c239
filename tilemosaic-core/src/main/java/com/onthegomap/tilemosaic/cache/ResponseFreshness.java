package com.onthegomap.tilemosaic.cache;

import java.time.Instant;
import java.util.Optional;

/**
 * Freshness signals carried by one upstream response: an explicit expiry and the validators.
 */
public record ResponseFreshness(Optional<Instant> expiresAt, Optional<String> etag, Optional<Instant> lastModified) {

  public static final ResponseFreshness NONE = new ResponseFreshness(Optional.empty(), Optional.empty(),
    Optional.empty());

  /** Returns a copy that expires at {@code fallback} when this response gave no explicit lifetime. */
  public ResponseFreshness withDefaultExpiry(Instant fallback) {
    return expiresAt.isPresent() ? this : new ResponseFreshness(Optional.of(fallback), etag, lastModified);
  }

  /** Returns a copy that expires no earlier than {@code floor}, whatever lifetime this response gave. */
  public ResponseFreshness withMinimumExpiry(Instant floor) {
    return expiresAt.isPresent() && expiresAt.get().isAfter(floor) ? this :
      new ResponseFreshness(Optional.of(floor), etag, lastModified);
  }
}
