package com.onthegomap.tilemosaic.region;

import java.util.Locale;

/**
 * Name of a region as shown to users. Names compare case-insensitively but keep their original spelling.
 */
public record RegionName(String name) {

  public static final int MAX_LENGTH = 35;

  public RegionName {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("region name must not be blank");
    }
    name = name.strip();
    if (name.length() > MAX_LENGTH) {
      throw new IllegalArgumentException("region name longer than " + MAX_LENGTH + " characters: " + name);
    }
  }

  public static RegionName of(String name) {
    return new RegionName(name);
  }

  /** Lower-cased form used for lookups. */
  public String key() {
    return name.toLowerCase(Locale.ROOT);
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof RegionName other && key().equals(other.key()));
  }

  @Override
  public int hashCode() {
    return key().hashCode();
  }

  @Override
  public String toString() {
    return name;
  }
}
