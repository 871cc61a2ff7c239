package com.onthegomap.tilemosaic.render;

import static org.junit.jupiter.api.Assertions.*;

import java.awt.geom.Point2D;
import java.util.List;
import org.junit.jupiter.api.Test;

class CatmullRomSplineTest {

  private static Point2D p(double x, double y) {
    return new Point2D.Double(x, y);
  }

  @Test
  void testEmptyAndSinglePoint() {
    assertEquals(List.of(), CatmullRomSpline.interpolate(List.of(), 1));
    assertEquals(List.of(p(3, 4)), CatmullRomSpline.interpolate(List.of(p(3, 4)), 1));
  }

  @Test
  void testPassesThroughEveryPoint() {
    List<Point2D> points = List.of(p(0, 0), p(100, 20), p(150, 150), p(20, 200));
    List<Point2D> curve = CatmullRomSpline.interpolate(points, 2);
    int from = 0;
    for (Point2D point : points) {
      int index = curve.subList(from, curve.size()).indexOf(point);
      assertTrue(index >= 0, "missing " + point);
      from += index + 1;
    }
    assertEquals(points.get(0), curve.get(0));
    assertEquals(points.get(3), curve.get(curve.size() - 1));
  }

  @Test
  void testStraightLineStaysStraight() {
    List<Point2D> curve = CatmullRomSpline.interpolate(List.of(p(0, 0), p(10, 10)), 1);
    assertEquals(16, curve.size());
    for (int i = 0; i < curve.size(); i++) {
      Point2D point = curve.get(i);
      assertEquals(point.getX(), point.getY(), 1e-9);
      if (i > 0) {
        assertTrue(point.distance(curve.get(i - 1)) <= 1.5, "step " + i);
        assertTrue(point.getX() > curve.get(i - 1).getX());
      }
    }
  }

  @Test
  void testRepeatedPoints() {
    List<Point2D> curve = CatmullRomSpline.interpolate(List.of(p(5, 5), p(5, 5), p(6, 5)), 1);
    assertEquals(p(5, 5), curve.get(0));
    assertEquals(p(6, 5), curve.get(curve.size() - 1));
    assertTrue(curve.stream().allMatch(point -> Double.isFinite(point.getX()) && Double.isFinite(point.getY())));
  }
}
