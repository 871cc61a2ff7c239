package com.onthegomap.tilemosaic.fetch;

import com.onthegomap.tilemosaic.cache.CacheEntry;
import com.onthegomap.tilemosaic.cache.Freshness;
import com.onthegomap.tilemosaic.cache.PersistentCache;
import com.onthegomap.tilemosaic.cache.ResponseFreshness;
import com.onthegomap.tilemosaic.cache.Validators;
import com.onthegomap.tilemosaic.geo.TileKey;
import com.onthegomap.tilemosaic.http.FreshnessHeaders;
import com.onthegomap.tilemosaic.http.UpstreamResponse;
import com.onthegomap.tilemosaic.stats.FetchStats;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import javax.annotation.concurrent.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Returns tile images from the persistent cache when fresh, revalidating or fetching them from upstream otherwise.
 * <p>
 * A tile upstream reports as nonexistent ({@code 403} or {@code 404}) is remembered with a known-absent marker so it
 * is not requested again until the marker expires. Concurrent fetches of the same tile share a single request.
 */
@ThreadSafe
public class TileFetcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(TileFetcher.class);

  private final PersistentCache cache;
  private final UpstreamClient client;
  private final String urlTemplate;
  private final Duration missingTileTtl;
  private final Clock clock;
  private final FetchStats stats;
  private final SingleFlight<TileKey, TileResult> singleFlight = new SingleFlight<>();

  public TileFetcher(PersistentCache cache, UpstreamClient client, String urlTemplate, Duration missingTileTtl,
    Clock clock, FetchStats stats) {
    this.cache = cache;
    this.client = client;
    this.urlTemplate = urlTemplate;
    this.missingTileTtl = missingTileTtl;
    this.clock = clock;
    this.stats = stats;
  }

  /**
   * Returns the tile for {@code key}.
   *
   * @throws TransientFetchException if upstream kept failing
   */
  public TileResult fetch(TileKey key) {
    return singleFlight.get(key, () -> load(key));
  }

  private TileResult load(TileKey key) throws InterruptedException {
    String cacheKey = key.cacheKey();
    Optional<CacheEntry> cached = cache.get(cacheKey);
    Freshness freshness = PersistentCache.evaluateFreshness(cached, clock.instant());
    if (freshness instanceof Freshness.Fresh) {
      stats.freshHit(cached.get().absent());
      return toResult(cached.get());
    }
    Validators validators = freshness instanceof Freshness.NeedsRevalidation revalidate ?
      revalidate.validators() : Validators.NONE;

    String url = key.toUrl(urlTemplate);
    LOGGER.debug("Requesting {} from {}{}", key, url, validators.isEmpty() ? "" : " (conditional)");
    UpstreamResponse response = client.get(url, validators,
      status -> status == 200 || status == 403 || status == 404 || (status == 304 && cached.isPresent()));
    Instant received = clock.instant();
    ResponseFreshness responseFreshness = FreshnessHeaders.parse(response.headers(), received);

    if (response.isNotModified()) {
      stats.notModified();
      if (cached.get().absent()) {
        responseFreshness = responseFreshness.withMinimumExpiry(received.plus(missingTileTtl));
      }
      CacheEntry refreshed = cache.refresh(cacheKey, responseFreshness, received)
        .orElseGet(() -> cached.get());
      return toResult(refreshed);
    } else if (response.isOk()) {
      if (cached.isPresent()) {
        stats.modified();
      }
      cache.put(cacheKey, CacheEntry.present(response.body(), responseFreshness, received));
      return TileResult.present(response.body());
    } else {
      stats.missing();
      cache.put(cacheKey, CacheEntry.knownAbsent(
        responseFreshness.withMinimumExpiry(received.plus(missingTileTtl)), received));
      return TileResult.missing();
    }
  }

  private TileResult toResult(CacheEntry entry) {
    return entry.absent() ? TileResult.missing() : TileResult.present(entry.payload());
  }
}
