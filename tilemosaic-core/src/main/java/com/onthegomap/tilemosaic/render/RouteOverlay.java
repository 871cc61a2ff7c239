package com.onthegomap.tilemosaic.render;

import java.awt.BasicStroke;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.Ellipse2D;
import java.awt.geom.Path2D;
import java.awt.geom.Point2D;
import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Optional;

/**
 * Draws a route over a composed mosaic as a smooth curve through its waypoints with a dot at each one.
 */
public class RouteOverlay {

  private static final double SAMPLE_STEP_PIXELS = 2;

  private final int markerRadius;
  private final float strokeWidth;

  public RouteOverlay(int markerRadius, float strokeWidth) {
    this.markerRadius = markerRadius;
    this.strokeWidth = strokeWidth;
  }

  /**
   * Images produced by {@link #draw(MosaicBuffer, Route, boolean)}.
   *
   * @param withRoute the mosaic with the route drawn on it
   * @param routeFree the untouched mosaic, when requested
   */
  public record Result(BufferedImage withRoute, Optional<BufferedImage> routeFree) {}

  /**
   * Draws {@code route} onto {@code buffer}.
   * <p>
   * When {@code keepRouteFree} is set the route goes onto a copy and the buffer's own raster is returned untouched as
   * {@link Result#routeFree()}; otherwise the buffer is drawn on in place.
   */
  public Result draw(MosaicBuffer buffer, Route route, boolean keepRouteFree) {
    BufferedImage target = keepRouteFree ? buffer.copyImage() : buffer.image();
    List<Point2D> points = route.waypoints().stream()
      .map(waypoint -> {
        double[] pixel = buffer.toPixel(waypoint.region(), waypoint.offsetX(), waypoint.offsetY());
        return (Point2D) new Point2D.Double(pixel[0], pixel[1]);
      })
      .toList();

    Graphics2D graphics = target.createGraphics();
    try {
      graphics.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
      graphics.setRenderingHint(RenderingHints.KEY_STROKE_CONTROL, RenderingHints.VALUE_STROKE_PURE);
      graphics.setColor(route.color());
      if (points.size() >= 2) {
        Path2D.Double path = new Path2D.Double();
        List<Point2D> curve = CatmullRomSpline.interpolate(points, SAMPLE_STEP_PIXELS);
        path.moveTo(curve.get(0).getX(), curve.get(0).getY());
        for (Point2D point : curve.subList(1, curve.size())) {
          path.lineTo(point.getX(), point.getY());
        }
        graphics.setStroke(new BasicStroke(strokeWidth, BasicStroke.CAP_ROUND, BasicStroke.JOIN_ROUND));
        graphics.draw(path);
      }
      for (Point2D point : points) {
        graphics.fill(new Ellipse2D.Double(point.getX() - markerRadius, point.getY() - markerRadius,
          2d * markerRadius, 2d * markerRadius));
      }
    } finally {
      graphics.dispose();
    }
    return new Result(target, keepRouteFree ? Optional.of(buffer.image()) : Optional.empty());
  }
}
