package com.onthegomap.tilemosaic.geo;

/**
 * Identifies one tile image: the lower-left region it covers and its detail level.
 *
 * @param origin lower-left region of the tile, aligned to a multiple of {@code zoom.regionsPerTile()}
 * @param zoom   detail level
 */
public record TileKey(GridCoordinate origin, ZoomLevel zoom) implements Comparable<TileKey> {

  public TileKey {
    if (origin.x() % zoom.regionsPerTile() != 0 || origin.y() % zoom.regionsPerTile() != 0) {
      throw new IllegalArgumentException("tile origin " + origin + " not aligned to zoom " + zoom);
    }
  }

  /** Returns the key of the tile at {@code zoom} that contains {@code region}. */
  public static TileKey containing(GridCoordinate region, ZoomLevel zoom) {
    return new TileKey(region.alignDown(zoom.regionsPerTile()), zoom);
  }

  /** Key this tile is stored under in the persistent cache. */
  public String cacheKey() {
    return "tile/" + zoom.urlLevel() + "/" + origin.x() + "/" + origin.y();
  }

  /**
   * Returns the regions this tile covers, clipped to the grid limit.
   */
  public GridRectangle regions() {
    int size = zoom.regionsPerTile();
    return GridRectangle.of(
      origin.x(), origin.y(),
      Math.min(GridCoordinate.MAX, origin.x() + size - 1), Math.min(GridCoordinate.MAX, origin.y() + size - 1)
    );
  }

  /** Fills in a url template with {@code {z}}, {@code {x}} and {@code {y}} placeholders. */
  public String toUrl(String template) {
    return template
      .replace("{z}", Integer.toString(zoom.urlLevel()))
      .replace("{x}", Integer.toString(origin.x()))
      .replace("{y}", Integer.toString(origin.y()));
  }

  @Override
  public int compareTo(TileKey o) {
    int result = Integer.compare(zoom.regionsPerTile(), o.zoom.regionsPerTile());
    return result != 0 ? result : origin.compareTo(o.origin);
  }

  @Override
  public String toString() {
    return "tile " + zoom.urlLevel() + "/" + origin.x() + "/" + origin.y();
  }
}
