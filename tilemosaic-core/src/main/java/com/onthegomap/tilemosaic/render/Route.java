package com.onthegomap.tilemosaic.render;

import com.onthegomap.tilemosaic.geo.GridRectangle;
import com.onthegomap.tilemosaic.geo.InvalidRectangleException;
import java.awt.Color;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Ordered waypoints to draw over a mosaic, in one color. Waypoints may repeat.
 */
public record Route(List<Waypoint> waypoints, Color color) {

  public static final Color DEFAULT_COLOR = Color.RED;

  public Route {
    Objects.requireNonNull(color, "color");
    if (waypoints == null || waypoints.isEmpty()) {
      throw new InvalidRectangleException("route needs at least one waypoint");
    }
    waypoints = List.copyOf(waypoints);
  }

  /** Parses waypoints separated by {@code ;}, see {@link Waypoint#parse(String)}. */
  public static Route parse(String text, Color color) {
    return new Route(Stream.of(text.split(";"))
      .filter(part -> !part.isBlank())
      .map(Waypoint::parse)
      .toList(), color);
  }

  /** Smallest rectangle containing the region of every waypoint. */
  public GridRectangle boundingRectangle() {
    return GridRectangle.bounding(waypoints.stream().map(Waypoint::region).toList());
  }
}
