package com.onthegomap.tilemosaic.region;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.onthegomap.tilemosaic.cache.CacheEntry;
import com.onthegomap.tilemosaic.cache.Freshness;
import com.onthegomap.tilemosaic.cache.PersistentCache;
import com.onthegomap.tilemosaic.cache.ResponseFreshness;
import com.onthegomap.tilemosaic.cache.Validators;
import com.onthegomap.tilemosaic.config.TileMosaicConfig;
import com.onthegomap.tilemosaic.fetch.SingleFlight;
import com.onthegomap.tilemosaic.fetch.UpstreamClient;
import com.onthegomap.tilemosaic.geo.GridCoordinate;
import com.onthegomap.tilemosaic.http.FreshnessHeaders;
import com.onthegomap.tilemosaic.http.UpstreamResponse;
import com.onthegomap.tilemosaic.stats.FetchStats;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Function;
import javax.annotation.concurrent.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates between region names and grid coordinates.
 * <p>
 * Lookups go through a bounded in-memory LRU, then the persistent cache, then the region lookup service. Negative
 * answers are cached like positive ones. Answers without an explicit lifetime are kept for the configured region TTL,
 * and an answer held in memory is dropped once its persistent entry would have expired.
 */
@ThreadSafe
public class CoordinateResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(CoordinateResolver.class);

  private static final String NAME_TO_COORDINATE = "d661249b-2b5a-4436-966a-3d3b8d7a574f";
  private static final String COORDINATE_TO_NAME = "b713fe80-283b-4585-af4d-a3b7d9a32492";

  private final PersistentCache cache;
  private final UpstreamClient client;
  private final String regionApi;
  private final Duration regionTtl;
  private final Clock clock;
  private final FetchStats stats;
  private final Cache<String, Answer<GridCoordinate>> coordinatesByName;
  private final Cache<GridCoordinate, Answer<RegionName>> namesByCoordinate;
  private final SingleFlight<String, Answer<?>> singleFlight = new SingleFlight<>();

  /** A lookup result and the instant it stops being usable without asking again. */
  private record Answer<T>(Optional<T> value, Instant expiresAt) {

    boolean isFresh(Instant now) {
      return now.isBefore(expiresAt);
    }
  }

  public CoordinateResolver(PersistentCache cache, UpstreamClient client, String regionApi, int memoryCacheSize,
    Duration regionTtl, Clock clock, FetchStats stats) {
    this.cache = cache;
    this.client = client;
    this.regionApi = regionApi.replaceFirst("/+$", "");
    this.regionTtl = regionTtl;
    this.clock = clock;
    this.stats = stats;
    // a single segment keeps eviction strictly least-recently-used
    this.coordinatesByName = CacheBuilder.newBuilder().concurrencyLevel(1).maximumSize(memoryCacheSize).build();
    this.namesByCoordinate = CacheBuilder.newBuilder().concurrencyLevel(1).maximumSize(memoryCacheSize).build();
  }

  public static CoordinateResolver create(PersistentCache cache, UpstreamClient client, TileMosaicConfig config,
    Clock clock, FetchStats stats) {
    return new CoordinateResolver(cache, client, config.regionApi(), config.regionCacheSize(), config.regionTtl(),
      clock, stats);
  }

  static String nameKey(RegionName name) {
    return "region-name/" + name.key();
  }

  static String coordinateKey(GridCoordinate coordinate) {
    return "region-coordinate/" + coordinate.x() + "/" + coordinate.y();
  }

  /**
   * Returns the grid coordinate of the region called {@code name}.
   *
   * @throws RegionNotFoundException if there is no such region
   */
  public GridCoordinate resolveName(RegionName name) {
    return lookupName(name, false)
      .orElseThrow(() -> new RegionNotFoundException("No region named '" + name + "'"));
  }

  /**
   * Returns the name of the region at {@code coordinate}.
   *
   * @throws RegionNotFoundException if there is no region at that coordinate
   */
  public RegionName resolveCoordinate(GridCoordinate coordinate) {
    return lookupCoordinate(coordinate, false)
      .orElseThrow(() -> new RegionNotFoundException("No region at " + coordinate));
  }

  /** Returns true if a region exists at {@code coordinate}. */
  public boolean regionExists(GridCoordinate coordinate) {
    return lookupCoordinate(coordinate, false).isPresent();
  }

  /** Like {@link #resolveName(RegionName)} but ignores every cached answer. */
  public GridCoordinate forceRefresh(RegionName name) {
    return lookupName(name, true)
      .orElseThrow(() -> new RegionNotFoundException("No region named '" + name + "'"));
  }

  /** Like {@link #resolveCoordinate(GridCoordinate)} but ignores every cached answer. */
  public RegionName forceRefresh(GridCoordinate coordinate) {
    return lookupCoordinate(coordinate, true)
      .orElseThrow(() -> new RegionNotFoundException("No region at " + coordinate));
  }

  private Optional<GridCoordinate> lookupName(RegionName name, boolean force) {
    if (!force) {
      Answer<GridCoordinate> inMemory = coordinatesByName.getIfPresent(name.key());
      if (inMemory != null && inMemory.isFresh(clock.instant())) {
        return inMemory.value();
      }
    }
    String url = regionApi + "/" + NAME_TO_COORDINATE + "?var=coords&sim_name=" + encode(name.name());
    @SuppressWarnings("unchecked") Answer<GridCoordinate> answer = (Answer<GridCoordinate>) singleFlight.get(
      flightKey(nameKey(name), force),
      () -> load(nameKey(name), url, force, RegionLookupResponses::parseCoordinate)
    );
    coordinatesByName.put(name.key(), answer);
    answer.value().ifPresent(
      coordinate -> namesByCoordinate.put(coordinate, new Answer<>(Optional.of(name), answer.expiresAt())));
    return answer.value();
  }

  private Optional<RegionName> lookupCoordinate(GridCoordinate coordinate, boolean force) {
    if (!force) {
      Answer<RegionName> inMemory = namesByCoordinate.getIfPresent(coordinate);
      if (inMemory != null && inMemory.isFresh(clock.instant())) {
        return inMemory.value();
      }
    }
    String url = regionApi + "/" + COORDINATE_TO_NAME + "?var=region&grid_x=" + coordinate.x() + "&grid_y=" +
      coordinate.y();
    @SuppressWarnings("unchecked") Answer<RegionName> answer = (Answer<RegionName>) singleFlight.get(
      flightKey(coordinateKey(coordinate), force),
      () -> load(coordinateKey(coordinate), url, force, RegionLookupResponses::parseRegionName)
    );
    namesByCoordinate.put(coordinate, answer);
    answer.value().ifPresent(
      name -> coordinatesByName.put(name.key(), new Answer<>(Optional.of(coordinate), answer.expiresAt())));
    return answer.value();
  }

  // a forced lookup must not join a normal one already in flight
  private static String flightKey(String cacheKey, boolean force) {
    return force ? "force:" + cacheKey : cacheKey;
  }

  private <T> Answer<T> load(String cacheKey, String url, boolean force, Function<String, Optional<T>> parser)
    throws InterruptedException {
    Optional<CacheEntry> cached = force ? Optional.empty() : cache.get(cacheKey);
    Freshness freshness = PersistentCache.evaluateFreshness(cached, clock.instant());
    if (freshness instanceof Freshness.Fresh) {
      stats.freshHit(cached.get().absent());
      return decode(cached.get(), parser);
    }
    Validators validators = freshness instanceof Freshness.NeedsRevalidation revalidate ?
      revalidate.validators() : Validators.NONE;
    stats.regionLookup();
    LOGGER.debug("Looking up {}", cacheKey);
    UpstreamResponse response = client.get(url, validators,
      status -> status == 200 || (status == 304 && cached.isPresent()));
    Instant received = clock.instant();
    ResponseFreshness responseFreshness = FreshnessHeaders.parse(response.headers(), received)
      .withDefaultExpiry(received.plus(regionTtl));
    if (response.isNotModified()) {
      stats.notModified();
      CacheEntry refreshed = cache.refresh(cacheKey, responseFreshness, received).orElseGet(() -> cached.get());
      return decode(refreshed, parser);
    }
    Optional<T> result = parser.apply(new String(response.body(), StandardCharsets.UTF_8));
    CacheEntry entry = result.isPresent() ?
      CacheEntry.present(response.body(), responseFreshness, received) :
      CacheEntry.knownAbsent(responseFreshness, received);
    cache.put(cacheKey, entry);
    return new Answer<>(result, expiry(entry));
  }

  private <T> Answer<T> decode(CacheEntry entry, Function<String, Optional<T>> parser) {
    Optional<T> value = entry.absent() ? Optional.empty() :
      parser.apply(new String(entry.payload(), StandardCharsets.UTF_8));
    return new Answer<>(value, expiry(entry));
  }

  private Instant expiry(CacheEntry entry) {
    return entry.expiresAt().orElseGet(() -> entry.storedAt().plus(regionTtl));
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
  }
}
