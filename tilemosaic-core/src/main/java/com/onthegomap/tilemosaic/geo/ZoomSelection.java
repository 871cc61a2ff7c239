package com.onthegomap.tilemosaic.geo;

/**
 * Detail level chosen for a rectangle together with the exact pixel size of the resulting mosaic.
 *
 * @param zoom         chosen detail level
 * @param widthPixels  mosaic width, a multiple of the tile size
 * @param heightPixels mosaic height, a multiple of the tile size
 * @param fitsBounds   false when even the coarsest level exceeds the requested maximum size
 */
public record ZoomSelection(ZoomLevel zoom, int widthPixels, int heightPixels, boolean fitsBounds) {

  /** Returns the pixel size {@code rectangle} composes to at {@code zoom}. */
  public static ZoomSelection of(GridRectangle rectangle, ZoomLevel zoom, int maxWidth, int maxHeight) {
    int width = zoom.tilesFor(rectangle.sizeX()) * ZoomLevel.TILE_PIXELS;
    int height = zoom.tilesFor(rectangle.sizeY()) * ZoomLevel.TILE_PIXELS;
    return new ZoomSelection(zoom, width, height, width <= maxWidth && height <= maxHeight);
  }

  /** Width divided by height. */
  public double aspectRatio() {
    return (double) widthPixels / heightPixels;
  }

  /**
   * Regions covered by the mosaic, starting at {@code rectangle}'s lower left and extending to the edge of the last
   * tile.
   */
  public GridRectangle coveredRectangle(GridRectangle rectangle) {
    int regionsX = widthPixels / zoom.pixelsPerRegion();
    int regionsY = heightPixels / zoom.pixelsPerRegion();
    GridCoordinate ll = rectangle.lowerLeft();
    return GridRectangle.of(
      ll.x(), ll.y(),
      Math.min(GridCoordinate.MAX, ll.x() + regionsX - 1), Math.min(GridCoordinate.MAX, ll.y() + regionsY - 1)
    );
  }
}
