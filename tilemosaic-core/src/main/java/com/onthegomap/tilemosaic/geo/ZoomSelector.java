package com.onthegomap.tilemosaic.geo;

import java.util.List;

/**
 * Picks the most detailed zoom level whose mosaic fits a maximum pixel size.
 * <p>
 * When no level fits, the coarsest level is returned anyway with its oversized dimensions and
 * {@link ZoomSelection#fitsBounds()} set to false.
 */
public class ZoomSelector {

  private final List<ZoomLevel> levels;

  public ZoomSelector() {
    this(ZoomLevel.ALL);
  }

  /** Restricts selection to {@code levels}, which must be ordered most detailed first. */
  public ZoomSelector(List<ZoomLevel> levels) {
    if (levels.isEmpty()) {
      throw new IllegalArgumentException("at least one zoom level required");
    }
    this.levels = List.copyOf(levels);
  }

  /**
   * Returns the zoom level and pixel dimensions for composing {@code rectangle} no larger than
   * {@code maxWidth × maxHeight}.
   *
   * @throws IllegalArgumentException if either bound is not positive
   */
  public ZoomSelection select(GridRectangle rectangle, int maxWidth, int maxHeight) {
    if (maxWidth <= 0 || maxHeight <= 0) {
      throw new IllegalArgumentException("max size must be positive, got " + maxWidth + "x" + maxHeight);
    }
    ZoomSelection selection = null;
    for (ZoomLevel zoom : levels) {
      selection = ZoomSelection.of(rectangle, zoom, maxWidth, maxHeight);
      if (selection.fitsBounds()) {
        return selection;
      }
    }
    return selection;
  }
}
