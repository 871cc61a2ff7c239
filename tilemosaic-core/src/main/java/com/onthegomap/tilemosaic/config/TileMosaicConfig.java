package com.onthegomap.tilemosaic.config;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Holder for common parameters used by the cache, fetchers and compositor.
 */
public record TileMosaicConfig(
  Arguments arguments,
  Path cacheDir,
  int fetchThreads,
  String httpUserAgent,
  Duration httpTimeout,
  int httpRetries,
  Duration httpRetryWait,
  double httpRateLimit,
  String tileUrl,
  String regionApi,
  Duration missingTileTtl,
  Duration regionTtl,
  int regionCacheSize,
  int markerRadius,
  float routeStrokeWidth,
  boolean toleratePartial
) {

  public static final String DEFAULT_TILE_URL =
    "https://secondlife-maps-cdn.akamaized.net/map-{z}-{x}-{y}-objects.jpg";
  public static final String DEFAULT_REGION_API = "https://cap.secondlife.com/cap/0";

  public TileMosaicConfig {
    if (fetchThreads < 1) {
      throw new IllegalArgumentException("fetch_threads must be >= 1, was " + fetchThreads);
    }
    if (httpRetries < 0) {
      throw new IllegalArgumentException("HTTP Retries must be >= 0, was " + httpRetries);
    }
    if (httpRateLimit < 0) {
      throw new IllegalArgumentException("http_rate_limit must be >= 0, was " + httpRateLimit);
    }
    if (regionCacheSize < 1) {
      throw new IllegalArgumentException("region_cache_size must be >= 1, was " + regionCacheSize);
    }
    if (markerRadius < 0) {
      throw new IllegalArgumentException("marker_radius must be >= 0, was " + markerRadius);
    }
    if (routeStrokeWidth <= 0) {
      throw new IllegalArgumentException("route_stroke_width must be > 0, was " + routeStrokeWidth);
    }
    if (!tileUrl.contains("{z}") || !tileUrl.contains("{x}") || !tileUrl.contains("{y}")) {
      throw new IllegalArgumentException("tile_url must contain {z}, {x} and {y} placeholders: " + tileUrl);
    }
  }

  public static TileMosaicConfig defaults() {
    return from(Arguments.of());
  }

  public static TileMosaicConfig from(Arguments arguments) {
    return new TileMosaicConfig(
      arguments,
      arguments.file("cache_dir", "directory holding the persistent tile and region cache", Path.of("data", "cache")),
      arguments.getInteger("fetch_threads", "maximum number of tiles to fetch concurrently", 8),
      arguments.getString("http_user_agent", "User-Agent header to set when fetching tiles and regions",
        "tilemosaic (https://github.com/onthegomap/tilemosaic)"),
      arguments.getDuration("http_timeout", "Timeout to use for each HTTP request", "30s"),
      arguments.getInteger("http_retries", "Retries to use when an HTTP request fails transiently", 3),
      arguments.getDuration("http_retry_wait", "How long to wait before the first retry, doubling each time", "1s"),
      arguments.getDouble("http_rate_limit", "Maximum upstream requests per second, 0 for unlimited", 10),
      arguments.getString("tile_url", "Tile URL template with {z}, {x} and {y} placeholders", DEFAULT_TILE_URL),
      arguments.getString("region_api", "Base URL of the region name lookup service", DEFAULT_REGION_API),
      arguments.getDuration("missing_tile_ttl", "How long to remember that a tile does not exist", "7d"),
      arguments.getDuration("region_ttl", "How long to keep region lookups that carry no explicit lifetime", "7d"),
      arguments.getInteger("region_cache_size", "Number of region lookups to keep in memory", 10_000),
      arguments.getInteger("marker_radius", "Radius in pixels of the dot drawn at each waypoint", 4),
      (float) arguments.getDouble("route_stroke_width", "Width in pixels of the route line", 2),
      arguments.getBoolean("tolerate_partial", "Fill tiles that keep failing with the missing tile color", false)
    );
  }
}
