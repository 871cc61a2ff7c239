package com.onthegomap.tilemosaic.render;

import static com.onthegomap.tilemosaic.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.tilemosaic.TestUtils.FakeUpstream;
import com.onthegomap.tilemosaic.TestUtils.MutableClock;
import com.onthegomap.tilemosaic.cache.PersistentCache;
import com.onthegomap.tilemosaic.fetch.RequestRateLimiter;
import com.onthegomap.tilemosaic.fetch.TileFetcher;
import com.onthegomap.tilemosaic.fetch.TransientFetchException;
import com.onthegomap.tilemosaic.fetch.UpstreamClient;
import com.onthegomap.tilemosaic.fetch.UpstreamFormatException;
import com.onthegomap.tilemosaic.geo.GridRectangle;
import com.onthegomap.tilemosaic.geo.ZoomLevel;
import com.onthegomap.tilemosaic.http.UpstreamResponse;
import com.onthegomap.tilemosaic.region.CoordinateResolver;
import com.onthegomap.tilemosaic.stats.FetchStats;
import com.onthegomap.tilemosaic.worker.WorkerPool;
import java.awt.Color;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.IntBinaryOperator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class MosaicCompositorTest {

  private final List<AutoCloseable> toClose = new ArrayList<>();

  @AfterEach
  void close() throws Exception {
    for (AutoCloseable closeable : toClose) {
      closeable.close();
    }
  }

  /** Serves {@link com.onthegomap.tilemosaic.TestUtils#colorFor} tiles after a per-tile delay. */
  private static FakeUpstream tiles(IntBinaryOperator delayMillis) {
    return new FakeUpstream(request -> {
      int[] tile = parseTileUrl(request.url());
      if (tile == null) {
        // every region exists except (1, 0)
        return ok(request.url().contains("grid_x=1&grid_y=0") ? "var region={'error' : true };" :
          "var region='Somewhere';");
      }
      Thread.sleep(delayMillis.applyAsInt(tile[1], tile[2]));
      return ok(solidTile(colorFor(tile[1], tile[2])), Map.of());
    });
  }

  private MosaicCompositor compositor(FakeUpstream upstream, int retries) {
    PersistentCache cache = PersistentCache.newInMemoryDatabase();
    WorkerPool pool = new WorkerPool("test", 4);
    toClose.add(cache);
    toClose.add(pool);
    MutableClock clock = new MutableClock();
    FetchStats stats = new FetchStats();
    UpstreamClient client = new UpstreamClient(upstream, RequestRateLimiter.unlimited(), stats, retries,
      Duration.ZERO);
    TileFetcher fetcher = new TileFetcher(cache, client, TILE_URL, Duration.ofDays(7), clock, stats);
    CoordinateResolver resolver = new CoordinateResolver(cache, client, REGION_API, 100, Duration.ofDays(7), clock,
      stats);
    return new MosaicCompositor(fetcher, resolver, pool);
  }

  private MosaicCompositor compositor(FakeUpstream upstream) {
    return compositor(upstream, 1);
  }

  @Test
  void testPlacesTilesByGridPosition() {
    var upstream = tiles((x, y) -> 0);
    var buffer = compositor(upstream).compose(GridRectangle.of(0, 0, 1, 1), ZoomLevel.Z1, FillPolicy.defaults());
    assertEquals(512, buffer.width());
    assertEquals(512, buffer.height());
    // north is up: grid y=1 is the top row of the image
    assertUniform(buffer.image(), 0, 256, 256, 256, colorFor(0, 0));
    assertUniform(buffer.image(), 256, 256, 256, 256, colorFor(1, 0));
    assertUniform(buffer.image(), 0, 0, 256, 256, colorFor(0, 1));
    assertUniform(buffer.image(), 256, 0, 256, 256, colorFor(1, 1));
    assertEquals(4, upstream.requests.size());
  }

  @Test
  void testMissingTileIsFilled() {
    var upstream = new FakeUpstream(request -> {
      int[] tile = parseTileUrl(request.url());
      return tile[1] == 1 && tile[2] == 1 ? UpstreamResponse.of(404, new byte[0]) :
        ok(solidTile(colorFor(tile[1], tile[2])), Map.of());
    });
    var buffer = compositor(upstream).compose(GridRectangle.of(0, 0, 1, 1), ZoomLevel.Z1, FillPolicy.defaults());
    assertUniform(buffer.image(), 256, 0, 256, 256, Color.BLACK);
    assertUniform(buffer.image(), 0, 0, 256, 256, colorFor(0, 1));

    var custom = compositor(upstream).compose(GridRectangle.of(0, 0, 1, 1), ZoomLevel.Z1,
      FillPolicy.defaults().withMissingTileColor(Color.MAGENTA));
    assertUniform(custom.image(), 256, 0, 256, 256, Color.MAGENTA);
  }

  @Test
  void testMissingFillReachesPastGridEdge() {
    var upstream = new FakeUpstream(request -> UpstreamResponse.of(404, new byte[0]));
    var buffer = compositor(upstream).compose(GridRectangle.of(65535, 65535, 65535, 65535), ZoomLevel.Z128,
      FillPolicy.defaults());
    assertEquals(256, buffer.width());
    assertEquals(256, buffer.height());
    assertEquals(Color.BLACK.getRGB(), buffer.image().getRGB(0, 0));
    assertUniform(buffer.image(), 0, 0, 256, 256, Color.BLACK);
  }

  @Test
  void testResultDoesNotDependOnCompletionOrder() {
    var forward = compositor(tiles((x, y) -> x * 7 + y * 3)).compose(GridRectangle.of(0, 0, 3, 3), ZoomLevel.Z1,
      FillPolicy.defaults());
    var backward = compositor(tiles((x, y) -> 30 - x * 7 - y * 3)).compose(GridRectangle.of(0, 0, 3, 3),
      ZoomLevel.Z1, FillPolicy.defaults());
    assertSameImage(forward.image(), backward.image());
    assertUniform(forward.image(), 768, 0, 256, 256, colorFor(3, 3));
  }

  @Test
  void testUnalignedRectangleClipsTiles() {
    var upstream = tiles((x, y) -> 0);
    var buffer = compositor(upstream).compose(GridRectangle.of(1, 1, 2, 2), ZoomLevel.Z2, FillPolicy.defaults());
    assertEquals(256, buffer.width());
    assertEquals(256, buffer.height());
    assertEquals(4, upstream.requests.size());
    assertEquals(colorFor(0, 0).getRGB(), buffer.image().getRGB(10, 200));
    assertEquals(colorFor(2, 0).getRGB(), buffer.image().getRGB(200, 200));
    assertEquals(colorFor(0, 2).getRGB(), buffer.image().getRGB(10, 10));
    assertEquals(colorFor(2, 2).getRGB(), buffer.image().getRGB(200, 10));
  }

  @Test
  void testMissingRegionsInsidePresentTile() {
    var upstream = tiles((x, y) -> 0);
    var buffer = compositor(upstream).compose(GridRectangle.of(0, 0, 1, 1), ZoomLevel.Z2,
      FillPolicy.defaults().withMissingRegionColor(FillPolicy.WATER_COLOR));
    assertUniform(buffer.image(), 128, 128, 128, 128, FillPolicy.WATER_COLOR);
    assertUniform(buffer.image(), 0, 128, 128, 128, colorFor(0, 0));
    assertUniform(buffer.image(), 0, 0, 256, 128, colorFor(0, 0));
    assertEquals(4, upstream.count("grid_x="));
  }

  @Test
  void testRegionsAreNotCheckedByDefault() {
    var upstream = tiles((x, y) -> 0);
    compositor(upstream).compose(GridRectangle.of(0, 0, 1, 1), ZoomLevel.Z2, FillPolicy.defaults());
    assertEquals(0, upstream.count("grid_x="));
  }

  @Test
  void testFailedTileFailsMosaic() {
    var upstream = new FakeUpstream(request -> {
      int[] tile = parseTileUrl(request.url());
      if (tile[1] == 1 && tile[2] == 0) {
        throw new IOException("connection reset");
      }
      return ok(solidTile(colorFor(tile[1], tile[2])), Map.of());
    });
    var compositor = compositor(upstream);
    assertThrows(TransientFetchException.class,
      () -> compositor.compose(GridRectangle.of(0, 0, 1, 1), ZoomLevel.Z1, FillPolicy.defaults()));
  }

  @Test
  void testToleratePartialFillsFailedTile() {
    var upstream = new FakeUpstream(request -> {
      int[] tile = parseTileUrl(request.url());
      if (tile[1] == 1 && tile[2] == 0) {
        throw new IOException("connection reset");
      }
      return ok(solidTile(colorFor(tile[1], tile[2])), Map.of());
    });
    var buffer = compositor(upstream).compose(GridRectangle.of(0, 0, 1, 1), ZoomLevel.Z1,
      FillPolicy.defaults().withToleratePartial(true).withMissingTileColor(Color.GRAY));
    assertUniform(buffer.image(), 256, 256, 256, 256, Color.GRAY);
    assertUniform(buffer.image(), 0, 256, 256, 256, colorFor(0, 0));
  }

  @Test
  void testUndecodableTile() {
    var upstream = new FakeUpstream(request -> ok("not an image"));
    var compositor = compositor(upstream);
    assertThrows(UpstreamFormatException.class,
      () -> compositor.compose(GridRectangle.of(0, 0, 0, 0), ZoomLevel.Z1, FillPolicy.defaults()));
  }
}
