package com.onthegomap.tilemosaic.region;

import static com.onthegomap.tilemosaic.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.tilemosaic.TestUtils.FakeUpstream;
import com.onthegomap.tilemosaic.TestUtils.MutableClock;
import com.onthegomap.tilemosaic.cache.PersistentCache;
import com.onthegomap.tilemosaic.fetch.RequestRateLimiter;
import com.onthegomap.tilemosaic.fetch.TransientFetchException;
import com.onthegomap.tilemosaic.fetch.UpstreamClient;
import com.onthegomap.tilemosaic.fetch.UpstreamFormatException;
import com.onthegomap.tilemosaic.geo.GridCoordinate;
import com.onthegomap.tilemosaic.stats.FetchStats;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

class CoordinateResolverTest {

  private static final GridCoordinate THORKELL = new GridCoordinate(1136, 1075);

  private final PersistentCache cache = PersistentCache.newInMemoryDatabase();
  private final MutableClock clock = new MutableClock();
  private final FetchStats stats = new FetchStats();

  @AfterEach
  void close() throws IOException {
    cache.close();
  }

  /** Answers like the region lookup service for a grid with Thorkell and Da Boom in it. */
  private final FakeUpstream upstream = new FakeUpstream(request -> {
    String url = request.url();
    if (url.contains("sim_name=Thorkell") || url.contains("sim_name=thorkell")) {
      return ok("var coords = {'x' : 1136, 'y' : 1075 };");
    } else if (url.contains("sim_name=Da%20Boom")) {
      return ok("var coords = {'x' : 1000, 'y' : 1000 };");
    } else if (url.contains("sim_name=")) {
      return ok("var coords = {'error' : true };");
    } else if (url.contains("grid_x=1136&grid_y=1075")) {
      return ok("var region='Thorkell';");
    } else if (url.contains("grid_x=")) {
      return ok("var region={'error' : true };");
    }
    throw new IOException("unexpected url " + url);
  });

  private CoordinateResolver resolver(FakeUpstream upstream, int memoryCacheSize) {
    var client = new UpstreamClient(upstream, RequestRateLimiter.unlimited(), stats, 1, Duration.ZERO);
    return new CoordinateResolver(cache, client, REGION_API + "/", memoryCacheSize, Duration.ofDays(7), clock, stats);
  }

  private CoordinateResolver resolver() {
    return resolver(upstream, 100);
  }

  @Test
  void testResolveName() {
    assertEquals(THORKELL, resolver().resolveName(RegionName.of("Thorkell")));
    assertEquals(
      "https://regions.test/cap/0/d661249b-2b5a-4436-966a-3d3b8d7a574f?var=coords&sim_name=Thorkell",
      upstream.last().url()
    );
  }

  @Test
  void testResolveCoordinate() {
    assertEquals(RegionName.of("Thorkell"), resolver().resolveCoordinate(THORKELL));
    assertEquals(
      "https://regions.test/cap/0/b713fe80-283b-4585-af4d-a3b7d9a32492?var=region&grid_x=1136&grid_y=1075",
      upstream.last().url()
    );
  }

  @Test
  void testEncodesSpacesInNames() {
    assertEquals(new GridCoordinate(1000, 1000), resolver().resolveName(RegionName.of("Da Boom")));
    assertTrue(upstream.last().url().endsWith("sim_name=Da%20Boom"), upstream.last().url());
  }

  @Test
  void testMemoryCacheAvoidsRequests() {
    var resolver = resolver();
    resolver.resolveName(RegionName.of("Thorkell"));
    resolver.resolveName(RegionName.of("THORKELL"));
    assertEquals(1, upstream.requests.size());
  }

  @Test
  void testNameLookupAlsoAnswersReverseLookup() {
    var resolver = resolver();
    resolver.resolveName(RegionName.of("Thorkell"));
    assertEquals(RegionName.of("Thorkell"), resolver.resolveCoordinate(THORKELL));
    assertTrue(resolver.regionExists(THORKELL));
    assertEquals(1, upstream.requests.size());
  }

  @Test
  void testPersistentCacheSurvivesNewResolver() {
    resolver().resolveName(RegionName.of("Thorkell"));
    assertEquals(THORKELL, resolver().resolveName(RegionName.of("Thorkell")));
    assertEquals(1, upstream.requests.size());
    assertEquals(1, stats.freshHits());
  }

  @Test
  void testEvictedEntriesComeFromPersistentCache() {
    var resolver = resolver(upstream, 1);
    resolver.resolveName(RegionName.of("Thorkell"));
    resolver.resolveName(RegionName.of("Da Boom"));
    assertEquals(THORKELL, resolver.resolveName(RegionName.of("Thorkell")));
    assertEquals(2, upstream.requests.size());
  }

  @Test
  void testUnknownRegionIsCached() {
    var resolver = resolver();
    assertThrows(RegionNotFoundException.class, () -> resolver.resolveName(RegionName.of("Nowhere")));
    assertThrows(RegionNotFoundException.class, () -> resolver().resolveName(RegionName.of("Nowhere")));
    assertEquals(1, upstream.requests.size());
    assertTrue(cache.get(CoordinateResolver.nameKey(RegionName.of("nowhere"))).orElseThrow().absent());
  }

  @Test
  void testRegionExists() {
    var resolver = resolver();
    assertTrue(resolver.regionExists(THORKELL));
    assertFalse(resolver.regionExists(new GridCoordinate(1137, 1075)));
    assertFalse(resolver.regionExists(new GridCoordinate(1137, 1075)));
    assertEquals(2, upstream.requests.size());
  }

  @Test
  void testForceRefreshBypassesCaches() {
    var resolver = resolver();
    resolver.resolveName(RegionName.of("Thorkell"));
    assertEquals(THORKELL, resolver.forceRefresh(RegionName.of("Thorkell")));
    assertEquals(RegionName.of("Thorkell"), resolver.forceRefresh(THORKELL));
    assertEquals(3, upstream.requests.size());
  }

  @Test
  void testAnswersExpireAfterRegionTtl() {
    resolver().resolveName(RegionName.of("Thorkell"));
    clock.advance(Duration.ofDays(6));
    resolver().resolveName(RegionName.of("Thorkell"));
    assertEquals(1, upstream.requests.size());
    clock.advance(Duration.ofDays(2));
    resolver().resolveName(RegionName.of("Thorkell"));
    assertEquals(2, upstream.requests.size());
  }

  @Test
  void testMemoryEntriesExpireAfterRegionTtl() {
    AtomicInteger calls = new AtomicInteger();
    var moving = new FakeUpstream(request -> calls.getAndIncrement() == 0 ?
      ok("var coords = {'x' : 1136, 'y' : 1075 };") :
      ok("var coords = {'x' : 2000, 'y' : 2000 };"));
    var resolver = resolver(moving, 100);
    assertEquals(THORKELL, resolver.resolveName(RegionName.of("Thorkell")));
    clock.advance(Duration.ofDays(6));
    assertEquals(THORKELL, resolver.resolveName(RegionName.of("Thorkell")));
    assertEquals(1, moving.requests.size());

    clock.advance(Duration.ofDays(24));
    assertEquals(new GridCoordinate(2000, 2000), resolver.resolveName(RegionName.of("Thorkell")));
    assertEquals(2, moving.requests.size());
  }

  @Test
  void testMemoryEntriesFollowExplicitLifetime() {
    var shortLived = new FakeUpstream(request -> ok("var region='Thorkell';".getBytes(StandardCharsets.UTF_8),
      Map.of("Cache-Control", "max-age=60")));
    var resolver = resolver(shortLived, 100);
    resolver.resolveCoordinate(THORKELL);
    clock.advance(Duration.ofSeconds(30));
    resolver.resolveCoordinate(THORKELL);
    assertEquals(1, shortLived.requests.size());
    clock.advance(Duration.ofSeconds(60));
    resolver.resolveCoordinate(THORKELL);
    assertEquals(2, shortLived.requests.size());
  }

  @Test
  @Timeout(10)
  void testForceRefreshDoesNotJoinLookupInFlight() throws InterruptedException {
    CountDownLatch firstStarted = new CountDownLatch(1);
    CountDownLatch releaseFirst = new CountDownLatch(1);
    AtomicInteger calls = new AtomicInteger();
    var slow = new FakeUpstream(request -> {
      if (calls.getAndIncrement() == 0) {
        firstStarted.countDown();
        releaseFirst.await();
        return ok("var coords = {'x' : 1136, 'y' : 1075 };");
      }
      return ok("var coords = {'x' : 2000, 'y' : 2000 };");
    });
    var resolver = resolver(slow, 100);
    Thread normal = new Thread(() -> resolver.resolveName(RegionName.of("Thorkell")));
    normal.start();
    firstStarted.await();

    assertEquals(new GridCoordinate(2000, 2000), resolver.forceRefresh(RegionName.of("Thorkell")));
    assertEquals(2, slow.requests.size());
    releaseFirst.countDown();
    normal.join();
  }

  @Test
  void testTransportFailureIsNotCached() {
    var failing = new FakeUpstream(request -> {
      throw new IOException("down");
    });
    var resolver = resolver(failing, 100);
    assertThrows(TransientFetchException.class, () -> resolver.resolveName(RegionName.of("Thorkell")));
    assertEquals(Optional.empty(), cache.get(CoordinateResolver.nameKey(RegionName.of("Thorkell"))));
    assertEquals(THORKELL, resolver().resolveName(RegionName.of("Thorkell")));
  }

  @Test
  void testUnparseableAnswer() {
    var garbage = new FakeUpstream(request -> ok("<html>maintenance</html>"));
    var resolver = resolver(garbage, 100);
    assertThrows(UpstreamFormatException.class, () -> resolver.resolveName(RegionName.of("Thorkell")));
    assertEquals(Optional.empty(), cache.get(CoordinateResolver.nameKey(RegionName.of("Thorkell"))));
  }
}
