package com.onthegomap.tilemosaic;

import com.onthegomap.tilemosaic.geo.GridRectangle;
import com.onthegomap.tilemosaic.geo.ZoomLevel;
import com.onthegomap.tilemosaic.geo.ZoomSelection;
import java.awt.image.BufferedImage;
import java.util.Optional;

/**
 * A finished mosaic.
 *
 * @param image     the mosaic, with the route drawn on it if there was one
 * @param routeFree the mosaic without the route, when requested
 * @param selection chosen zoom level and pixel size
 * @param requested rectangle that was asked for
 * @param covered   rectangle the image actually covers
 */
public record MosaicResult(
  BufferedImage image,
  Optional<BufferedImage> routeFree,
  ZoomSelection selection,
  GridRectangle requested,
  GridRectangle covered
) {

  /** Image width divided by height. */
  public double aspectRatio() {
    return selection.aspectRatio();
  }

  /**
   * Descriptor used to calibrate in-world map displays: {@code <x,y,0>/regionsX/regionsY/1} where {@code x,y} are the
   * global meter coordinates of the covered area's south-west corner.
   */
  public String calibrationDescriptor() {
    return "<%d,%d,0>/%d/%d/1".formatted(
      covered.lowerLeft().x() * ZoomLevel.REGION_METERS,
      covered.lowerLeft().y() * ZoomLevel.REGION_METERS,
      covered.sizeX(),
      covered.sizeY()
    );
  }
}
