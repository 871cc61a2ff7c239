package com.onthegomap.tilemosaic.cache;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * One stored upstream answer with the metadata needed to decide whether it is still usable.
 * <p>
 * A known-absent marker ({@link #absent()} true) records that upstream answered "does not exist" and has an empty
 * payload.
 *
 * @param payload      response body
 * @param absent       true if this entry records a negative answer
 * @param etag         entity tag validator
 * @param lastModified last-modified validator
 * @param expiresAt    end of the explicit freshness lifetime, if upstream gave one
 * @param storedAt     when the entry was written or last revalidated
 */
public record CacheEntry(
  byte[] payload,
  boolean absent,
  Optional<String> etag,
  Optional<Instant> lastModified,
  Optional<Instant> expiresAt,
  Instant storedAt
) {

  private static final byte[] EMPTY = new byte[0];

  public CacheEntry {
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(storedAt, "storedAt");
    payload = payload.clone();
    if (absent && payload.length > 0) {
      throw new IllegalArgumentException("known-absent entries carry no payload");
    }
  }

  /** Returns a copy of the stored body. */
  @Override
  public byte[] payload() {
    return payload.clone();
  }

  public static CacheEntry present(byte[] payload, ResponseFreshness freshness, Instant storedAt) {
    return new CacheEntry(payload, false, freshness.etag(), freshness.lastModified(), freshness.expiresAt(), storedAt);
  }

  public static CacheEntry knownAbsent(ResponseFreshness freshness, Instant storedAt) {
    return new CacheEntry(EMPTY, true, freshness.etag(), freshness.lastModified(), freshness.expiresAt(), storedAt);
  }

  public Validators validators() {
    return new Validators(etag, lastModified);
  }

  /** Returns a copy with the same payload but freshness metadata replaced by {@code freshness}. */
  public CacheEntry withFreshness(ResponseFreshness freshness, Instant now) {
    return new CacheEntry(
      payload,
      absent,
      freshness.etag().or(() -> etag),
      freshness.lastModified().or(() -> lastModified),
      freshness.expiresAt(),
      now
    );
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof CacheEntry other &&
      absent == other.absent &&
      Arrays.equals(payload, other.payload) &&
      etag.equals(other.etag) &&
      lastModified.equals(other.lastModified) &&
      expiresAt.equals(other.expiresAt) &&
      storedAt.equals(other.storedAt));
  }

  @Override
  public int hashCode() {
    return Objects.hash(Arrays.hashCode(payload), absent, etag, lastModified, expiresAt, storedAt);
  }

  @Override
  public String toString() {
    return "CacheEntry{" +
      (absent ? "absent" : payload.length + " bytes") +
      ", etag=" + etag.orElse(null) +
      ", lastModified=" + lastModified.orElse(null) +
      ", expiresAt=" + expiresAt.orElse(null) +
      ", storedAt=" + storedAt +
      '}';
  }
}
