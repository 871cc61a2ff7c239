package com.onthegomap.tilemosaic.fetch;

import com.google.common.util.concurrent.RateLimiter;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Paces outbound requests to a fixed number of permits per second, shared by every fetch.
 * <p>
 * Callers are served in the order they reserve permits, and up to one second of unused permits can be spent as a
 * burst.
 */
@ThreadSafe
public class RequestRateLimiter {

  private static final RequestRateLimiter UNLIMITED = new RequestRateLimiter(null);

  private final RateLimiter rateLimiter;

  private RequestRateLimiter(RateLimiter rateLimiter) {
    this.rateLimiter = rateLimiter;
  }

  /** Returns a limiter allowing {@code permitsPerSecond} requests per second, or no limit when 0. */
  public static RequestRateLimiter create(double permitsPerSecond) {
    if (permitsPerSecond < 0) {
      throw new IllegalArgumentException("permitsPerSecond must be >= 0, was " + permitsPerSecond);
    }
    return permitsPerSecond == 0 ? UNLIMITED : new RequestRateLimiter(RateLimiter.create(permitsPerSecond));
  }

  public static RequestRateLimiter unlimited() {
    return UNLIMITED;
  }

  /** Blocks until a permit is available and returns the seconds spent waiting. */
  public double acquire() {
    return rateLimiter == null ? 0 : rateLimiter.acquire();
  }

  public double permitsPerSecond() {
    return rateLimiter == null ? Double.POSITIVE_INFINITY : rateLimiter.getRate();
  }
}
