package com.onthegomap.tilemosaic.cache;

import java.time.Instant;
import java.util.Optional;

/**
 * Values an upstream server can use to answer a conditional request with "not modified".
 *
 * @param etag         sent back as {@code If-None-Match}
 * @param lastModified sent back as {@code If-Modified-Since}
 */
public record Validators(Optional<String> etag, Optional<Instant> lastModified) {

  public static final Validators NONE = new Validators(Optional.empty(), Optional.empty());

  public boolean isEmpty() {
    return etag.isEmpty() && lastModified.isEmpty();
  }
}
