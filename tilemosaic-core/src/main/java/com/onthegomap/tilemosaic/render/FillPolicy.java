package com.onthegomap.tilemosaic.render;

import java.awt.Color;
import java.util.Objects;
import java.util.Optional;

/**
 * How the compositor fills areas it has no imagery for.
 *
 * @param missingTileColor   color of tiles upstream has no image for
 * @param missingRegionColor when set, regions inside present tiles that do not exist are painted this color, at the
 *                           cost of one region lookup per region
 * @param toleratePartial    fill tiles that keep failing to download with {@code missingTileColor} instead of failing
 *                           the whole mosaic
 */
public record FillPolicy(Color missingTileColor, Optional<Color> missingRegionColor, boolean toleratePartial) {

  public static final Color DEFAULT_MISSING_TILE_COLOR = Color.BLACK;
  public static final Color WATER_COLOR = new Color(0x1d, 0x47, 0x5f);

  public FillPolicy {
    Objects.requireNonNull(missingTileColor, "missingTileColor");
    Objects.requireNonNull(missingRegionColor, "missingRegionColor");
  }

  public static FillPolicy defaults() {
    return new FillPolicy(DEFAULT_MISSING_TILE_COLOR, Optional.empty(), false);
  }

  public FillPolicy withMissingTileColor(Color color) {
    return new FillPolicy(color, missingRegionColor, toleratePartial);
  }

  public FillPolicy withMissingRegionColor(Color color) {
    return new FillPolicy(missingTileColor, Optional.of(color), toleratePartial);
  }

  public FillPolicy withToleratePartial(boolean tolerate) {
    return new FillPolicy(missingTileColor, missingRegionColor, tolerate);
  }
}
