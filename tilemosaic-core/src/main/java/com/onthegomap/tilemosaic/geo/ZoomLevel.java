package com.onthegomap.tilemosaic.geo;

import java.util.Arrays;
import java.util.List;

/**
 * Detail levels the tile CDN publishes, from most detailed ({@link #Z1}, one region per tile) to coarsest
 * ({@link #Z128}, 128 × 128 regions per tile).
 * <p>
 * Every tile image is {@value #TILE_PIXELS} pixels square regardless of level.
 */
public enum ZoomLevel {
  Z1(1),
  Z2(2),
  Z4(4),
  Z8(8),
  Z16(16),
  Z32(32),
  Z64(64),
  Z128(128);

  public static final int TILE_PIXELS = 256;
  public static final int REGION_METERS = 256;

  /** All levels, most detailed first. */
  public static final List<ZoomLevel> ALL = List.of(values());

  private final int regionsPerTile;

  ZoomLevel(int regionsPerTile) {
    this.regionsPerTile = regionsPerTile;
  }

  /** Number of regions one tile covers along each edge. */
  public int regionsPerTile() {
    return regionsPerTile;
  }

  /** Pixels one region occupies along each edge of a tile at this level. */
  public int pixelsPerRegion() {
    return TILE_PIXELS / regionsPerTile;
  }

  /** The 1-based level number used in tile URLs: {@code log2(regionsPerTile) + 1}. */
  public int urlLevel() {
    return Integer.numberOfTrailingZeros(regionsPerTile) + 1;
  }

  /** Number of tiles needed to cover {@code regions} regions along one axis. */
  public int tilesFor(int regions) {
    return (regions + regionsPerTile - 1) / regionsPerTile;
  }

  public static ZoomLevel coarsest() {
    return Z128;
  }

  /**
   * Returns the level covering {@code regionsPerTile} regions per tile edge.
   *
   * @throws IllegalArgumentException if no level has that size
   */
  public static ZoomLevel ofRegionsPerTile(int regionsPerTile) {
    return Arrays.stream(values())
      .filter(z -> z.regionsPerTile == regionsPerTile)
      .findFirst()
      .orElseThrow(() -> new IllegalArgumentException("no zoom level with " + regionsPerTile + " regions per tile"));
  }

  @Override
  public String toString() {
    return Integer.toString(regionsPerTile);
  }
}
