package com.onthegomap.tilemosaic;

/**
 * Base type of every error raised while resolving regions, fetching tiles or composing a mosaic.
 * <p>
 * Each subtype names one cause so callers can attribute a failed run to a specific tile, region or cache problem.
 */
public class MosaicException extends RuntimeException {

  public MosaicException(String message) {
    super(message);
  }

  public MosaicException(String message, Throwable cause) {
    super(message, cause);
  }
}
