package com.onthegomap.tilemosaic.render;

import com.onthegomap.tilemosaic.geo.GridCoordinate;
import com.onthegomap.tilemosaic.geo.InvalidRectangleException;
import com.onthegomap.tilemosaic.geo.ZoomLevel;

/**
 * A point on a route: a region plus an offset in meters from that region's south-west corner.
 */
public record Waypoint(GridCoordinate region, double offsetX, double offsetY) {

  public Waypoint {
    if (offsetX < 0 || offsetX > ZoomLevel.REGION_METERS || offsetY < 0 || offsetY > ZoomLevel.REGION_METERS) {
      throw new InvalidRectangleException(
        "waypoint offset must be within 0.." + ZoomLevel.REGION_METERS + ": " + offsetX + ", " + offsetY);
    }
  }

  /** Returns a waypoint at the center of {@code region}. */
  public static Waypoint center(GridCoordinate region) {
    return new Waypoint(region, ZoomLevel.REGION_METERS / 2d, ZoomLevel.REGION_METERS / 2d);
  }

  /**
   * Parses {@code x:y} or {@code x:y:offsetX:offsetY}.
   *
   * @throws InvalidRectangleException if {@code text} is malformed
   */
  public static Waypoint parse(String text) {
    String[] parts = text.strip().split(":");
    try {
      GridCoordinate region = new GridCoordinate(Integer.parseInt(parts[0].strip()), Integer.parseInt(parts[1].strip()));
      if (parts.length == 2) {
        return center(region);
      } else if (parts.length == 4) {
        return new Waypoint(region, Double.parseDouble(parts[2].strip()), Double.parseDouble(parts[3].strip()));
      }
    } catch (NumberFormatException | ArrayIndexOutOfBoundsException e) {
      throw new InvalidRectangleException("invalid waypoint '" + text + "': " + e.getMessage());
    }
    throw new InvalidRectangleException("invalid waypoint '" + text + "', expected x:y or x:y:offsetX:offsetY");
  }
}
