package com.onthegomap.tilemosaic.fetch;

import com.onthegomap.tilemosaic.MosaicException;

/** Upstream answered with a body that could not be understood. Never retried. */
public class UpstreamFormatException extends MosaicException {

  public UpstreamFormatException(String message) {
    super(message);
  }

  public UpstreamFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
