package com.onthegomap.tilemosaic.http;

import static com.google.common.net.HttpHeaders.*;

import com.onthegomap.tilemosaic.cache.Validators;
import com.onthegomap.tilemosaic.config.TileMosaicConfig;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Upstream} that sends requests over HTTP with the configured user agent and timeout.
 */
public class HttpUpstream implements Upstream {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpUpstream.class);

  private final TileMosaicConfig config;
  private final HttpClient client;

  public HttpUpstream(TileMosaicConfig config) {
    this.config = config;
    this.client = HttpClient.newBuilder()
      .followRedirects(HttpClient.Redirect.NORMAL)
      .connectTimeout(config.httpTimeout())
      .build();
  }

  @Override
  public UpstreamResponse get(String url, Validators validators) throws IOException, InterruptedException {
    HttpRequest.Builder request = newHttpRequest(url).GET();
    validators.etag().ifPresent(etag -> request.header(IF_NONE_MATCH, etag));
    validators.lastModified()
      .ifPresent(lastModified -> request.header(IF_MODIFIED_SINCE, FreshnessHeaders.formatDate(lastModified)));
    HttpResponse<byte[]> response = client.send(request.build(), HttpResponse.BodyHandlers.ofByteArray());
    LOGGER.trace("GET {} -> {}", url, response.statusCode());
    return new UpstreamResponse(response.statusCode(), response.headers(), response.body());
  }

  private HttpRequest.Builder newHttpRequest(String url) {
    return HttpRequest.newBuilder(URI.create(url))
      .timeout(config.httpTimeout())
      .header(USER_AGENT, config.httpUserAgent());
  }
}
