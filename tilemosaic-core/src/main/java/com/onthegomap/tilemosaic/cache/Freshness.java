package com.onthegomap.tilemosaic.cache;

/**
 * Result of comparing a cache entry's lifetime against the current time.
 */
public sealed interface Freshness {

  Freshness FRESH = new Fresh();
  Freshness ABSENT = new Absent();

  static Freshness needsRevalidation(Validators validators) {
    return new NeedsRevalidation(validators);
  }

  /** The entry can be used without contacting upstream. */
  record Fresh() implements Freshness {}

  /**
   * The entry must be revalidated before use, conditionally when {@code validators} is not empty.
   */
  record NeedsRevalidation(Validators validators) implements Freshness {}

  /** There is no entry. */
  record Absent() implements Freshness {}
}
