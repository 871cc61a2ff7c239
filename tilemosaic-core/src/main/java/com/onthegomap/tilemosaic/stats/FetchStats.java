package com.onthegomap.tilemosaic.stats;

import java.util.concurrent.atomic.LongAdder;
import javax.annotation.concurrent.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counters describing how tile and region lookups were served during a run.
 */
@ThreadSafe
public class FetchStats {

  private static final Logger LOGGER = LoggerFactory.getLogger(FetchStats.class);

  private final LongAdder freshHits = new LongAdder();
  private final LongAdder knownAbsentHits = new LongAdder();
  private final LongAdder notModified = new LongAdder();
  private final LongAdder modified = new LongAdder();
  private final LongAdder requests = new LongAdder();
  private final LongAdder missing = new LongAdder();
  private final LongAdder retries = new LongAdder();
  private final LongAdder regionLookups = new LongAdder();

  /** A cached entry was fresh and served without contacting upstream. */
  public void freshHit(boolean absent) {
    (absent ? knownAbsentHits : freshHits).increment();
  }

  /** A conditional request confirmed the cached entry. */
  public void notModified() {
    notModified.increment();
  }

  /** A conditional request returned new content. */
  public void modified() {
    modified.increment();
  }

  /** One request was sent upstream, counting each retry. */
  public void request() {
    requests.increment();
  }

  public void missing() {
    missing.increment();
  }

  public void retry() {
    retries.increment();
  }

  public void regionLookup() {
    regionLookups.increment();
  }

  public long requests() {
    return requests.sum();
  }

  public long freshHits() {
    return freshHits.sum();
  }

  public long knownAbsentHits() {
    return knownAbsentHits.sum();
  }

  public long notModifiedCount() {
    return notModified.sum();
  }

  public long retries() {
    return retries.sum();
  }

  public void printSummary() {
    LOGGER.info("""
      fetch summary:
        requests: {} (retries: {}, region lookups: {})
        cache hits: {} fresh, {} known absent
        revalidated: {} not modified, {} modified
        missing tiles: {}
      """.stripTrailing(),
      requests.sum(), retries.sum(), regionLookups.sum(),
      freshHits.sum(), knownAbsentHits.sum(),
      notModified.sum(), modified.sum(),
      missing.sum());
  }
}
