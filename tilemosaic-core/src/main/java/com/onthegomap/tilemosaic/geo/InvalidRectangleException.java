package com.onthegomap.tilemosaic.geo;

import com.onthegomap.tilemosaic.MosaicException;

/** Raised for malformed coordinates or rectangles, before anything is fetched. */
public class InvalidRectangleException extends MosaicException {

  public InvalidRectangleException(String message) {
    super(message);
  }
}
