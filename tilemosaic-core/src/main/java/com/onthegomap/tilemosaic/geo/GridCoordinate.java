package com.onthegomap.tilemosaic.geo;

import java.util.Comparator;

/**
 * Integer address of one region on the world grid.
 * <p>
 * Ordered by {@code x} then {@code y}.
 */
public record GridCoordinate(int x, int y) implements Comparable<GridCoordinate> {

  public static final int MAX = 65_535;

  private static final Comparator<GridCoordinate> ORDER =
    Comparator.comparingInt(GridCoordinate::x).thenComparingInt(GridCoordinate::y);

  public GridCoordinate {
    if (x < 0 || x > MAX || y < 0 || y > MAX) {
      throw new InvalidRectangleException("grid coordinate out of range 0.." + MAX + ": (" + x + ", " + y + ")");
    }
  }

  /** Returns this coordinate rounded down to a multiple of {@code step} on both axes. */
  public GridCoordinate alignDown(int step) {
    return new GridCoordinate(x - x % step, y - y % step);
  }

  @Override
  public int compareTo(GridCoordinate o) {
    return ORDER.compare(this, o);
  }

  @Override
  public String toString() {
    return "(" + x + ", " + y + ")";
  }
}
