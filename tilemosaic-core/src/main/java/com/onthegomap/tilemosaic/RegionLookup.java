package com.onthegomap.tilemosaic;

import com.onthegomap.tilemosaic.config.Arguments;
import com.onthegomap.tilemosaic.config.TileMosaicConfig;
import com.onthegomap.tilemosaic.geo.GridCoordinate;
import com.onthegomap.tilemosaic.region.CoordinateResolver;
import com.onthegomap.tilemosaic.region.RegionName;
import java.io.IOException;

/**
 * Resolves a region name to its grid coordinate ({@code name=Thorkell}) or a coordinate to its region name
 * ({@code grid_x=1136 grid_y=1075}) and prints the answer.
 */
public class RegionLookup {

  private RegionLookup() {}

  static String lookup(CoordinateResolver resolver, Arguments arguments) {
    boolean force = arguments.getBoolean("force_refresh", "ignore cached answers", false);
    String name = arguments.getString("name", "region name to look up", null);
    if (name != null) {
      RegionName region = RegionName.of(name);
      GridCoordinate coordinate = force ? resolver.forceRefresh(region) : resolver.resolveName(region);
      return region + ": " + coordinate.x() + ", " + coordinate.y();
    }
    GridCoordinate coordinate = arguments.gridCoordinate("grid", "grid coordinate to look up");
    if (coordinate == null) {
      throw new IllegalArgumentException("Provide name=<region name> or grid_x=<x> grid_y=<y>");
    }
    RegionName region = force ? resolver.forceRefresh(coordinate) : resolver.resolveCoordinate(coordinate);
    return coordinate.x() + ", " + coordinate.y() + ": " + region;
  }

  public static void main(String[] args) throws IOException {
    Arguments arguments = Arguments.fromArgsOrConfigFile(args);
    try (TileMosaic mosaic = TileMosaic.create(TileMosaicConfig.from(arguments))) {
      System.out.println(lookup(mosaic.resolver(), arguments));
    }
  }
}
