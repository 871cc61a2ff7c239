package com.onthegomap.tilemosaic.region;

import com.onthegomap.tilemosaic.fetch.UpstreamFormatException;
import com.onthegomap.tilemosaic.geo.GridCoordinate;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsers for the javascript snippets the region lookup service answers with.
 * <p>
 * Name to coordinate: {@code var coords = {'x' : 1136, 'y' : 1075 };}. Coordinate to name:
 * {@code var region='Thorkell';}. Either variable is assigned {@code {'error' : true }} when the region does not exist.
 */
final class RegionLookupResponses {

  private static final Pattern COORDS = Pattern.compile(
    "^\\s*var\\s+coords\\s*=\\s*\\{\\s*'x'\\s*:\\s*(\\d+)(?:\\.0*)?\\s*,\\s*'y'\\s*:\\s*(\\d+)(?:\\.0*)?\\s*}\\s*;?\\s*$");
  private static final Pattern REGION = Pattern.compile(
    "^\\s*var\\s+region\\s*=\\s*'((?:[^'\\\\]|\\\\.)*)'\\s*;?\\s*$");
  private static final Pattern ERROR = Pattern.compile(
    "^\\s*var\\s+(coords|region)\\s*=\\s*\\{\\s*'error'\\s*:\\s*true\\s*}\\s*;?\\s*$");

  private RegionLookupResponses() {}

  /**
   * Returns the coordinate in a name lookup answer, or empty if the region does not exist.
   *
   * @throws UpstreamFormatException for any other answer
   */
  static Optional<GridCoordinate> parseCoordinate(String body) {
    if (isError(body, "coords")) {
      return Optional.empty();
    }
    Matcher matcher = COORDS.matcher(body);
    if (!matcher.matches()) {
      throw new UpstreamFormatException("unexpected region coordinate answer: " + abbreviate(body));
    }
    try {
      return Optional.of(new GridCoordinate(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2))));
    } catch (RuntimeException e) {
      throw new UpstreamFormatException("invalid region coordinate answer: " + abbreviate(body), e);
    }
  }

  /**
   * Returns the region name in a coordinate lookup answer, or empty if there is no region there.
   *
   * @throws UpstreamFormatException for any other answer
   */
  static Optional<RegionName> parseRegionName(String body) {
    if (isError(body, "region")) {
      return Optional.empty();
    }
    Matcher matcher = REGION.matcher(body);
    if (!matcher.matches()) {
      throw new UpstreamFormatException("unexpected region name answer: " + abbreviate(body));
    }
    String name = matcher.group(1).replaceAll("\\\\(.)", "$1");
    try {
      return Optional.of(new RegionName(name));
    } catch (IllegalArgumentException e) {
      throw new UpstreamFormatException("invalid region name answer: " + abbreviate(body), e);
    }
  }

  private static boolean isError(String body, String variable) {
    Matcher matcher = ERROR.matcher(body);
    return matcher.matches() && matcher.group(1).equals(variable);
  }

  private static String abbreviate(String body) {
    return body.length() > 100 ? body.substring(0, 100) + "..." : body;
  }
}
