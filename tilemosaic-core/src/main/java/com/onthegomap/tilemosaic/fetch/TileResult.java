package com.onthegomap.tilemosaic.fetch;

import java.util.Arrays;
import java.util.Optional;

/**
 * Outcome of fetching one tile: its encoded image, or the fact that upstream has no tile for that area.
 */
public final class TileResult {

  private static final TileResult MISSING = new TileResult(null);

  private final byte[] bytes;

  private TileResult(byte[] bytes) {
    this.bytes = bytes;
  }

  public static TileResult present(byte[] bytes) {
    return new TileResult(bytes.clone());
  }

  public static TileResult missing() {
    return MISSING;
  }

  public boolean isPresent() {
    return bytes != null;
  }

  /** Encoded tile image, or empty if the tile does not exist. */
  public Optional<byte[]> bytes() {
    return bytes == null ? Optional.empty() : Optional.of(bytes.clone());
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof TileResult other && Arrays.equals(bytes, other.bytes));
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return bytes == null ? "TileResult[missing]" : "TileResult[" + bytes.length + " bytes]";
  }
}
