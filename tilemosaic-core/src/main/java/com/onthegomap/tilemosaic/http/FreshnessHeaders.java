package com.onthegomap.tilemosaic.http;

import static com.google.common.net.HttpHeaders.*;

import com.google.common.base.Splitter;
import com.onthegomap.tilemosaic.cache.ResponseFreshness;
import java.net.http.HttpHeaders;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Reads the freshness lifetime and validators out of response headers.
 * <p>
 * Only {@code Cache-Control} ({@code max-age}, {@code s-maxage}, {@code no-cache}, {@code no-store}), {@code Expires},
 * {@code ETag} and {@code Last-Modified} are interpreted.
 */
public class FreshnessHeaders {

  private static final Splitter DIRECTIVES = Splitter.on(',').trimResults().omitEmptyStrings();

  private FreshnessHeaders() {}

  public static ResponseFreshness parse(HttpHeaders headers, Instant now) {
    return new ResponseFreshness(
      expiresAt(headers, now),
      headers.firstValue(ETAG).filter(etag -> !etag.isBlank()),
      headers.firstValue(LAST_MODIFIED).flatMap(FreshnessHeaders::parseDate)
    );
  }

  private static Optional<Instant> expiresAt(HttpHeaders headers, Instant now) {
    OptionalLong maxAge = OptionalLong.empty();
    OptionalLong sharedMaxAge = OptionalLong.empty();
    for (String value : headers.allValues(CACHE_CONTROL)) {
      for (String directive : DIRECTIVES.split(value.toLowerCase(Locale.ROOT))) {
        if (directive.equals("no-cache") || directive.equals("no-store")) {
          return Optional.empty();
        } else if (directive.startsWith("s-maxage=")) {
          sharedMaxAge = parseSeconds(directive.substring("s-maxage=".length()));
        } else if (directive.startsWith("max-age=")) {
          maxAge = parseSeconds(directive.substring("max-age=".length()));
        }
      }
    }
    if (sharedMaxAge.isPresent()) {
      return Optional.of(now.plusSeconds(sharedMaxAge.getAsLong()));
    } else if (maxAge.isPresent()) {
      return Optional.of(now.plusSeconds(maxAge.getAsLong()));
    }
    // an unparseable Expires means already expired
    return headers.firstValue(EXPIRES).flatMap(FreshnessHeaders::parseDate);
  }

  private static OptionalLong parseSeconds(String value) {
    try {
      return OptionalLong.of(Math.max(0, Long.parseLong(value.replace("\"", "").trim())));
    } catch (NumberFormatException e) {
      return OptionalLong.empty();
    }
  }

  static Optional<Instant> parseDate(String value) {
    try {
      return Optional.of(Instant.from(DateTimeFormatter.RFC_1123_DATE_TIME.parse(value.trim())));
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }

  /** Formats {@code instant} as an HTTP date, for example {@code Tue, 3 Jun 2008 11:05:30 GMT}. */
  public static String formatDate(Instant instant) {
    return DateTimeFormatter.RFC_1123_DATE_TIME.format(instant.atOffset(ZoneOffset.UTC));
  }
}
