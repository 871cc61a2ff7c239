package com.onthegomap.tilemosaic.http;

import com.onthegomap.tilemosaic.cache.Validators;
import java.io.IOException;

/**
 * Request/response transport to the tile and region services.
 */
@FunctionalInterface
public interface Upstream {

  /**
   * Issues a GET for {@code url}, conditional on {@code validators} when they are not empty.
   *
   * @throws IOException if the request could not be completed
   */
  UpstreamResponse get(String url, Validators validators) throws IOException, InterruptedException;
}
