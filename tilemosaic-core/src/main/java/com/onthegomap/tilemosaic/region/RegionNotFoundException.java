package com.onthegomap.tilemosaic.region;

import com.onthegomap.tilemosaic.MosaicException;

/** Upstream authoritatively answered that no such region exists. */
public class RegionNotFoundException extends MosaicException {

  public RegionNotFoundException(String message) {
    super(message);
  }
}
