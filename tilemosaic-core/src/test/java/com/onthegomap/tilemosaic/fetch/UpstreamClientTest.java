package com.onthegomap.tilemosaic.fetch;

import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.tilemosaic.TestUtils.FakeUpstream;
import com.onthegomap.tilemosaic.cache.Validators;
import com.onthegomap.tilemosaic.http.UpstreamResponse;
import com.onthegomap.tilemosaic.stats.FetchStats;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class UpstreamClientTest {

  private final List<Duration> slept = new ArrayList<>();
  private final FetchStats stats = new FetchStats();

  private UpstreamClient client(FakeUpstream upstream, int retries) {
    return new UpstreamClient(upstream, RequestRateLimiter.unlimited(), stats, retries, Duration.ofSeconds(1)) {
      @Override
      protected void retrySleep(Duration wait) {
        slept.add(wait);
      }
    };
  }

  @ParameterizedTest
  @CsvSource({
    "0, 0, true",
    "1, 0, false",
    "1, 1, true",
    "2, 2, true",
    "3, 2, false",
  })
  void testRetriesTransportFailures(int failures, int retries, boolean succeeds) throws InterruptedException {
    AtomicInteger attempts = new AtomicInteger();
    var upstream = new FakeUpstream(request -> {
      if (attempts.incrementAndGet() <= failures) {
        throw new IOException("connection reset");
      }
      return UpstreamResponse.of(200, new byte[]{1});
    });
    var client = client(upstream, retries);
    if (succeeds) {
      assertEquals(200, client.get("http://x", Validators.NONE, status -> status == 200).statusCode());
      assertEquals(failures + 1, upstream.requests.size());
    } else {
      var error = assertThrows(TransientFetchException.class,
        () -> client.get("http://x", Validators.NONE, status -> status == 200));
      assertInstanceOf(IOException.class, error.getCause());
      assertEquals(retries + 1, upstream.requests.size());
    }
    assertEquals(upstream.requests.size(), stats.requests());
  }

  @Test
  void testWaitDoubles() throws InterruptedException {
    AtomicInteger attempts = new AtomicInteger();
    var upstream = new FakeUpstream(request -> UpstreamResponse.of(attempts.incrementAndGet() <= 3 ? 503 : 200,
      new byte[0]));
    client(upstream, 3).get("http://x", Validators.NONE, status -> status == 200);
    assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4)), slept);
    assertEquals(3, stats.retries());
  }

  @Test
  void testUnexpectedStatusFails() {
    var upstream = new FakeUpstream(request -> UpstreamResponse.of(500, new byte[0]));
    var error = assertThrows(TransientFetchException.class,
      () -> client(upstream, 1).get("http://x", Validators.NONE, status -> status == 200));
    assertTrue(error.getMessage().contains("500"), error.getMessage());
    assertEquals(2, upstream.requests.size());
  }

  @Test
  void testPassesValidators() throws InterruptedException {
    var upstream = new FakeUpstream(request -> UpstreamResponse.of(304, new byte[0]));
    var validators = new Validators(Optional.of("\"abc\""), Optional.empty());
    client(upstream, 0).get("http://x", validators, status -> status == 304);
    assertEquals(validators, upstream.last().validators());
  }
}
