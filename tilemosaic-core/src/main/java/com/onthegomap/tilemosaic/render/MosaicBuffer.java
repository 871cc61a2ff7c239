package com.onthegomap.tilemosaic.render;

import com.onthegomap.tilemosaic.geo.GridCoordinate;
import com.onthegomap.tilemosaic.geo.GridRectangle;
import com.onthegomap.tilemosaic.geo.TileKey;
import com.onthegomap.tilemosaic.geo.ZoomLevel;
import com.onthegomap.tilemosaic.geo.ZoomSelection;
import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.concurrent.ThreadSafe;

/**
 * ARGB raster a mosaic is composed into.
 * <p>
 * The raster starts at the requested rectangle's lower-left region and extends to the edge of the last tile on each
 * axis, so it is always a whole number of tiles wide and high. Image row 0 is the northern edge. Writes to disjoint
 * tiles may come from any thread.
 */
@ThreadSafe
public class MosaicBuffer {

  private final GridRectangle requested;
  private final GridRectangle covered;
  private final ZoomLevel zoom;
  private final BufferedImage image;

  private MosaicBuffer(GridRectangle requested, ZoomSelection selection) {
    this.requested = requested;
    this.covered = selection.coveredRectangle(requested);
    this.zoom = selection.zoom();
    this.image = new BufferedImage(selection.widthPixels(), selection.heightPixels(), BufferedImage.TYPE_INT_ARGB);
  }

  /** Returns an empty, fully transparent buffer for {@code rectangle} at {@code zoom}. */
  public static MosaicBuffer create(GridRectangle rectangle, ZoomLevel zoom) {
    return new MosaicBuffer(rectangle, ZoomSelection.of(rectangle, zoom, Integer.MAX_VALUE, Integer.MAX_VALUE));
  }

  public GridRectangle requested() {
    return requested;
  }

  /** Regions the raster covers, possibly extending past the requested rectangle's upper right. */
  public GridRectangle covered() {
    return covered;
  }

  public ZoomLevel zoom() {
    return zoom;
  }

  public int width() {
    return image.getWidth();
  }

  public int height() {
    return image.getHeight();
  }

  /** The live raster. Callers must not write to it while tiles are still being placed. */
  public BufferedImage image() {
    return image;
  }

  /** Returns a deep copy of the raster. */
  public synchronized BufferedImage copyImage() {
    BufferedImage copy = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_ARGB);
    image.copyData(copy.getRaster());
    return copy;
  }

  /** Tiles whose area overlaps this buffer, ordered by {@link TileKey}. */
  public List<TileKey> tiles() {
    int step = zoom.regionsPerTile();
    GridCoordinate start = requested.lowerLeft().alignDown(step);
    List<TileKey> result = new ArrayList<>();
    for (int x = start.x(); x <= covered.upperRight().x(); x += step) {
      for (int y = start.y(); y <= covered.upperRight().y(); y += step) {
        result.add(new TileKey(new GridCoordinate(x, y), zoom));
      }
    }
    return result;
  }

  /** Pixel column of the western edge of regions at grid {@code x}. */
  public int pixelX(int x) {
    return (x - covered.lowerLeft().x()) * zoom.pixelsPerRegion();
  }

  /** Pixel row of the northern edge of regions at grid {@code y}. */
  public int pixelTopY(int y) {
    return image.getHeight() - (y - covered.lowerLeft().y() + 1) * zoom.pixelsPerRegion();
  }

  /**
   * Maps a point {@code metersX, metersY} inside region {@code region} to buffer pixel space.
   */
  public double[] toPixel(GridCoordinate region, double metersX, double metersY) {
    double pixelsPerMeter = (double) ZoomLevel.TILE_PIXELS / (zoom.regionsPerTile() * ZoomLevel.REGION_METERS);
    GridCoordinate ll = covered.lowerLeft();
    double px = ((region.x() - ll.x()) * (double) ZoomLevel.REGION_METERS + metersX) * pixelsPerMeter;
    double py = image.getHeight() - ((region.y() - ll.y()) * (double) ZoomLevel.REGION_METERS + metersY) *
      pixelsPerMeter;
    return new double[]{px, py};
  }

  /** Copies {@code tile} into the area of {@code key}, scaling it to the tile size and clipping to the buffer. */
  public synchronized void placeTile(TileKey key, BufferedImage tile) {
    int left = pixelX(key.origin().x());
    int top = pixelTopY(key.origin().y() + zoom.regionsPerTile() - 1);
    Graphics2D graphics = image.createGraphics();
    try {
      graphics.setComposite(AlphaComposite.Src);
      graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_NEAREST_NEIGHBOR);
      graphics.drawImage(tile, left, top, ZoomLevel.TILE_PIXELS, ZoomLevel.TILE_PIXELS, null);
    } finally {
      graphics.dispose();
    }
  }

  /** Paints the whole area of {@code key} with {@code color}. */
  public synchronized void fillTile(TileKey key, Color color) {
    int left = pixelX(key.origin().x());
    int top = pixelTopY(key.origin().y() + zoom.regionsPerTile() - 1);
    fill(left, top, ZoomLevel.TILE_PIXELS, ZoomLevel.TILE_PIXELS, color);
  }

  /** Paints the whole raster with {@code color}, including any area past the edge of the grid. */
  public synchronized void fillAll(Color color) {
    fill(0, 0, image.getWidth(), image.getHeight(), color);
  }

  /** Paints the area of one region with {@code color}. */
  public synchronized void fillRegion(GridCoordinate region, Color color) {
    int size = zoom.pixelsPerRegion();
    fill(pixelX(region.x()), pixelTopY(region.y()), size, size, color);
  }

  private void fill(int left, int top, int width, int height, Color color) {
    int x0 = Math.max(0, left);
    int y0 = Math.max(0, top);
    int x1 = Math.min(image.getWidth(), left + width);
    int y1 = Math.min(image.getHeight(), top + height);
    int argb = color.getRGB();
    for (int y = y0; y < y1; y++) {
      for (int x = x0; x < x1; x++) {
        image.setRGB(x, y, argb);
      }
    }
  }
}
