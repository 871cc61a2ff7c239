package com.onthegomap.tilemosaic.fetch;

import com.onthegomap.tilemosaic.cache.Validators;
import com.onthegomap.tilemosaic.config.TileMosaicConfig;
import com.onthegomap.tilemosaic.http.Upstream;
import com.onthegomap.tilemosaic.http.UpstreamResponse;
import com.onthegomap.tilemosaic.stats.FetchStats;
import java.io.IOException;
import java.time.Duration;
import java.util.function.IntPredicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends rate-limited requests to an {@link Upstream}, retrying transport failures and unexpected statuses with a
 * doubling wait.
 * <p>
 * Every attempt, including each retry, takes one permit from the shared {@link RequestRateLimiter}.
 */
public class UpstreamClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(UpstreamClient.class);

  private final Upstream upstream;
  private final RequestRateLimiter rateLimiter;
  private final FetchStats stats;
  private final int retries;
  private final Duration retryWait;

  public UpstreamClient(Upstream upstream, RequestRateLimiter rateLimiter, FetchStats stats, int retries,
    Duration retryWait) {
    this.upstream = upstream;
    this.rateLimiter = rateLimiter;
    this.stats = stats;
    this.retries = retries;
    this.retryWait = retryWait;
  }

  public static UpstreamClient create(Upstream upstream, TileMosaicConfig config, FetchStats stats) {
    return new UpstreamClient(upstream, RequestRateLimiter.create(config.httpRateLimit()), stats,
      config.httpRetries(), config.httpRetryWait());
  }

  /**
   * Returns the first response to {@code url} whose status satisfies {@code expected}.
   *
   * @throws TransientFetchException if every attempt failed or returned an unexpected status
   * @throws InterruptedException    if interrupted while waiting for a permit, the response or a retry
   */
  public UpstreamResponse get(String url, Validators validators, IntPredicate expected) throws InterruptedException {
    Duration wait = retryWait;
    for (int i = 0; ; i++) {
      boolean lastTry = i >= retries;
      String failure;
      Throwable cause = null;
      try {
        rateLimiter.acquire();
        stats.request();
        UpstreamResponse response = upstream.get(url, validators);
        if (expected.test(response.statusCode())) {
          return response;
        }
        failure = "unexpected status " + response.statusCode();
      } catch (IOException e) {
        failure = e.toString();
        cause = e;
      }
      if (lastTry) {
        throw new TransientFetchException("GET " + url + " failed after " + (i + 1) + " attempts: " + failure, cause);
      }
      LOGGER.warn("GET {} failed ({}), retrying in {}ms", url, failure, wait.toMillis());
      stats.retry();
      retrySleep(wait);
      wait = wait.multipliedBy(2);
    }
  }

  protected void retrySleep(Duration wait) throws InterruptedException {
    Thread.sleep(wait.toMillis());
  }
}
