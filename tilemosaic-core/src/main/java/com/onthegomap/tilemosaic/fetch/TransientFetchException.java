package com.onthegomap.tilemosaic.fetch;

import com.onthegomap.tilemosaic.MosaicException;

/** An upstream request kept failing after all retries. */
public class TransientFetchException extends MosaicException {

  public TransientFetchException(String message) {
    super(message);
  }

  public TransientFetchException(String message, Throwable cause) {
    super(message, cause);
  }
}
