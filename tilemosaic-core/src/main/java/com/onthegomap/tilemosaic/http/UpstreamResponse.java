package com.onthegomap.tilemosaic.http;

import java.net.http.HttpHeaders;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Status, headers and fully-read body of one upstream response.
 */
public record UpstreamResponse(int statusCode, HttpHeaders headers, byte[] body) {

  private static final HttpHeaders NO_HEADERS = HttpHeaders.of(Map.of(), (k, v) -> true);

  public static UpstreamResponse of(int statusCode, byte[] body) {
    return new UpstreamResponse(statusCode, NO_HEADERS, body);
  }

  public static UpstreamResponse of(int statusCode, byte[] body, Map<String, String> headers) {
    Map<String, List<String>> multi = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    headers.forEach((k, v) -> multi.put(k, List.of(v)));
    return new UpstreamResponse(statusCode, HttpHeaders.of(multi, (k, v) -> true), body);
  }

  public boolean isOk() {
    return statusCode == 200;
  }

  public boolean isNotModified() {
    return statusCode == 304;
  }

  /** True for the statuses the tile CDN uses to say a tile does not exist. */
  public boolean isNotFound() {
    return statusCode == 403 || statusCode == 404;
  }
}
