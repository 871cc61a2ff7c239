package com.onthegomap.tilemosaic.geo;

import java.util.Collection;
import java.util.Optional;

/**
 * An inclusive rectangle of grid regions, from {@code lowerLeft} (south-west) to {@code upperRight} (north-east).
 * <p>
 * A rectangle of a single region has both corners equal.
 */
public record GridRectangle(GridCoordinate lowerLeft, GridCoordinate upperRight) {

  public GridRectangle {
    if (lowerLeft == null || upperRight == null) {
      throw new InvalidRectangleException("rectangle corners must not be null");
    }
    if (lowerLeft.x() > upperRight.x() || lowerLeft.y() > upperRight.y()) {
      throw new InvalidRectangleException("inverted rectangle: lower left " + lowerLeft + " upper right " + upperRight);
    }
  }

  /**
   * Returns the rectangle between {@code lowerLeft} and {@code upperRight}.
   *
   * @throws InvalidRectangleException if the corners are inverted on either axis
   */
  public static GridRectangle of(GridCoordinate lowerLeft, GridCoordinate upperRight) {
    return new GridRectangle(lowerLeft, upperRight);
  }

  public static GridRectangle of(int minX, int minY, int maxX, int maxY) {
    return of(new GridCoordinate(minX, minY), new GridCoordinate(maxX, maxY));
  }

  /** Returns the rectangle spanned by two opposite corners given in any order. */
  public static GridRectangle spanning(GridCoordinate a, GridCoordinate b) {
    return of(
      Math.min(a.x(), b.x()), Math.min(a.y(), b.y()),
      Math.max(a.x(), b.x()), Math.max(a.y(), b.y())
    );
  }

  /**
   * Returns the smallest rectangle containing every coordinate in {@code coordinates}.
   *
   * @throws InvalidRectangleException if {@code coordinates} is empty
   */
  public static GridRectangle bounding(Collection<GridCoordinate> coordinates) {
    if (coordinates.isEmpty()) {
      throw new InvalidRectangleException("cannot bound an empty set of coordinates");
    }
    int minX = Integer.MAX_VALUE, minY = Integer.MAX_VALUE, maxX = Integer.MIN_VALUE, maxY = Integer.MIN_VALUE;
    for (GridCoordinate c : coordinates) {
      minX = Math.min(minX, c.x());
      minY = Math.min(minY, c.y());
      maxX = Math.max(maxX, c.x());
      maxY = Math.max(maxY, c.y());
    }
    return of(minX, minY, maxX, maxY);
  }

  /** Number of regions along the x axis, counting both edges. */
  public int sizeX() {
    return upperRight.x() - lowerLeft.x() + 1;
  }

  /** Number of regions along the y axis, counting both edges. */
  public int sizeY() {
    return upperRight.y() - lowerLeft.y() + 1;
  }

  public boolean contains(GridCoordinate coordinate) {
    return coordinate.x() >= lowerLeft.x() && coordinate.x() <= upperRight.x() &&
      coordinate.y() >= lowerLeft.y() && coordinate.y() <= upperRight.y();
  }

  public boolean contains(int x, int y) {
    return x >= lowerLeft.x() && x <= upperRight.x() && y >= lowerLeft.y() && y <= upperRight.y();
  }

  /** Returns the overlap of this rectangle and {@code other}, or empty if they do not touch. */
  public Optional<GridRectangle> intersect(GridRectangle other) {
    int minX = Math.max(lowerLeft.x(), other.lowerLeft.x());
    int minY = Math.max(lowerLeft.y(), other.lowerLeft.y());
    int maxX = Math.min(upperRight.x(), other.upperRight.x());
    int maxY = Math.min(upperRight.y(), other.upperRight.y());
    return minX > maxX || minY > maxY ? Optional.empty() : Optional.of(of(minX, minY, maxX, maxY));
  }

  @Override
  public String toString() {
    return "[" + lowerLeft + " - " + upperRight + "]";
  }
}
