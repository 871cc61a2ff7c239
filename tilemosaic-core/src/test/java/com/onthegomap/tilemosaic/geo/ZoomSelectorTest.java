package com.onthegomap.tilemosaic.geo;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ZoomSelectorTest {

  private final ZoomSelector selector = new ZoomSelector();

  @Test
  void testLargeRectangleFallsBackToCoarsest() {
    var selection = selector.select(GridRectangle.of(380, 380, 1500, 1500), 2048, 2048);
    assertEquals(ZoomLevel.Z128, selection.zoom());
    assertEquals(2304, selection.widthPixels());
    assertEquals(2304, selection.heightPixels());
    assertFalse(selection.fitsBounds());
  }

  @ParameterizedTest
  @CsvSource({
    "0,0,0,0, 256,256, 1, 256,256, true",
    "0,0,1,0, 256,256, 2, 256,256, true",
    "0,0,1,0, 512,256, 1, 512,256, true",
    "0,0,7,3, 1024,1024, 2, 1024,512, true",
    "1130,1070,1140,1080, 2048,2048, 2, 1536,1536, true",
    "1130,1070,1140,1080, 2816,2816, 1, 2816,2816, true",
    "10,10,10,10, 100,100, 128, 256,256, false",
    "0,0,255,0, 512,256, 128, 512,256, true",
  })
  void testSelect(int minX, int minY, int maxX, int maxY, int maxWidth, int maxHeight, int expectedZoom,
    int expectedWidth, int expectedHeight, boolean fits) {
    var selection = selector.select(GridRectangle.of(minX, minY, maxX, maxY), maxWidth, maxHeight);
    assertEquals(ZoomLevel.ofRegionsPerTile(expectedZoom), selection.zoom());
    assertEquals(expectedWidth, selection.widthPixels());
    assertEquals(expectedHeight, selection.heightPixels());
    assertEquals(fits, selection.fitsBounds());
  }

  @Test
  void testMostDetailedThatFitsWins() {
    var rect = GridRectangle.of(0, 0, 15, 15);
    for (ZoomLevel zoom : ZoomLevel.ALL) {
      var selection = selector.select(rect, 16 * 256 / zoom.regionsPerTile(), 16 * 256 / zoom.regionsPerTile());
      assertEquals(zoom.regionsPerTile() > 16 ? ZoomLevel.Z128 : zoom, selection.zoom(), "bound for " + zoom);
      assertEquals(zoom.regionsPerTile() <= 16, selection.fitsBounds());
    }
  }

  @Test
  void testRejectsNonPositiveBounds() {
    var rect = GridRectangle.of(0, 0, 1, 1);
    assertThrows(IllegalArgumentException.class, () -> selector.select(rect, 0, 100));
    assertThrows(IllegalArgumentException.class, () -> selector.select(rect, 100, -1));
  }

  @Test
  void testRestrictedLevels() {
    var limited = new ZoomSelector(List.of(ZoomLevel.Z4, ZoomLevel.Z8));
    var selection = limited.select(GridRectangle.of(0, 0, 0, 0), 4096, 4096);
    assertEquals(ZoomLevel.Z4, selection.zoom());
  }

  @Test
  void testCoveredRectangleExtendsToTileEdge() {
    var rect = GridRectangle.of(1130, 1070, 1140, 1080);
    var selection = selector.select(rect, 2048, 2048);
    assertEquals(GridRectangle.of(1130, 1070, 1141, 1081), selection.coveredRectangle(rect));
    assertEquals(1d, selection.aspectRatio(), 1e-9);
  }
}
