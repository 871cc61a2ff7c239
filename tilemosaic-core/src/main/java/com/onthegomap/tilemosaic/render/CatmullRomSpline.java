package com.onthegomap.tilemosaic.render;

import java.awt.geom.Point2D;
import java.util.ArrayList;
import java.util.List;

/**
 * Uniform Catmull-Rom interpolation through a sequence of points.
 * <p>
 * The curve passes through every input point. End tangents come from repeating the first and last points.
 */
public class CatmullRomSpline {

  private CatmullRomSpline() {}

  /**
   * Returns points along the curve through {@code points}, starting with the first and ending with the last, with
   * consecutive samples no more than about {@code maxStep} pixels apart.
   */
  public static List<Point2D> interpolate(List<? extends Point2D> points, double maxStep) {
    List<Point2D> result = new ArrayList<>();
    if (points.isEmpty()) {
      return result;
    }
    result.add(points.get(0));
    int n = points.size();
    for (int i = 0; i < n - 1; i++) {
      Point2D p0 = points.get(Math.max(0, i - 1));
      Point2D p1 = points.get(i);
      Point2D p2 = points.get(i + 1);
      Point2D p3 = points.get(Math.min(n - 1, i + 2));
      int samples = Math.max(1, (int) Math.ceil(p1.distance(p2) / maxStep));
      for (int s = 1; s <= samples; s++) {
        double t = (double) s / samples;
        result.add(s == samples ? p2 : new Point2D.Double(
          at(p0.getX(), p1.getX(), p2.getX(), p3.getX(), t),
          at(p0.getY(), p1.getY(), p2.getY(), p3.getY(), t)
        ));
      }
    }
    return result;
  }

  private static double at(double p0, double p1, double p2, double p3, double t) {
    double t2 = t * t;
    double t3 = t2 * t;
    return 0.5 * (2 * p1 + (p2 - p0) * t + (2 * p0 - 5 * p1 + 4 * p2 - p3) * t2 + (3 * p1 - p0 - 3 * p2 + p3) * t3);
  }
}
