package com.onthegomap.tilemosaic.cache;

import com.onthegomap.tilemosaic.MosaicException;

/** The local cache could not be read or written. Fatal for the run. */
public class CacheIOException extends MosaicException {

  public CacheIOException(String message, Throwable cause) {
    super(message, cause);
  }
}
