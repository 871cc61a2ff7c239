package com.onthegomap.tilemosaic.render;

import com.onthegomap.tilemosaic.fetch.TileFetcher;
import com.onthegomap.tilemosaic.fetch.TileResult;
import com.onthegomap.tilemosaic.fetch.TransientFetchException;
import com.onthegomap.tilemosaic.fetch.UpstreamFormatException;
import com.onthegomap.tilemosaic.geo.GridCoordinate;
import com.onthegomap.tilemosaic.geo.GridRectangle;
import com.onthegomap.tilemosaic.geo.TileKey;
import com.onthegomap.tilemosaic.geo.ZoomLevel;
import com.onthegomap.tilemosaic.region.CoordinateResolver;
import com.onthegomap.tilemosaic.util.Exceptions;
import com.onthegomap.tilemosaic.worker.WorkerPool;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import javax.imageio.ImageIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches every tile covering a rectangle in parallel and assembles them into one {@link MosaicBuffer}.
 * <p>
 * Each tile is written at the offset computed from its grid position, so the result does not depend on the order
 * fetches complete in. The number of tiles fetched at once is bounded by the size of the {@link WorkerPool}.
 */
public class MosaicCompositor {

  private static final Logger LOGGER = LoggerFactory.getLogger(MosaicCompositor.class);

  private final TileFetcher fetcher;
  private final CoordinateResolver resolver;
  private final WorkerPool pool;

  public MosaicCompositor(TileFetcher fetcher, CoordinateResolver resolver, WorkerPool pool) {
    this.fetcher = fetcher;
    this.resolver = resolver;
    this.pool = pool;
  }

  /**
   * Composes {@code rectangle} at {@code zoom}, blocking until every tile is placed.
   *
   * @throws TransientFetchException  if a tile kept failing and {@link FillPolicy#toleratePartial()} is off
   * @throws UpstreamFormatException  if a tile image could not be decoded
   */
  public MosaicBuffer compose(GridRectangle rectangle, ZoomLevel zoom, FillPolicy fill) {
    try {
      return composeAsync(rectangle, zoom, fill).get();
    } catch (InterruptedException | ExecutionException e) {
      return Exceptions.throwFatalException(e);
    }
  }

  /**
   * Starts composing {@code rectangle} at {@code zoom}. The returned future fails as soon as any tile fails, and
   * cancelling it stops waiting for outstanding tiles.
   */
  public CompletableFuture<MosaicBuffer> composeAsync(GridRectangle rectangle, ZoomLevel zoom, FillPolicy fill) {
    MosaicBuffer buffer = MosaicBuffer.create(rectangle, zoom);
    // tiles past the grid edge are never fetched, so their area starts out missing
    buffer.fillAll(fill.missingTileColor());
    List<TileKey> tiles = buffer.tiles();
    LOGGER.info("Composing {} at zoom {} from {} tiles into {}x{} pixels", rectangle, zoom, tiles.size(),
      buffer.width(), buffer.height());
    List<CompletableFuture<Void>> futures = tiles.stream()
      .map(key -> pool.submit(() -> {
        placeTile(buffer, key, fill);
        return (Void) null;
      }))
      .toList();
    return WorkerPool.joinFutures(futures).thenApply(done -> buffer);
  }

  private void placeTile(MosaicBuffer buffer, TileKey key, FillPolicy fill) {
    TileResult result;
    try {
      result = fetcher.fetch(key);
    } catch (TransientFetchException e) {
      if (!fill.toleratePartial()) {
        throw e;
      }
      LOGGER.warn("Filling {} after failed fetch: {}", key, e.getMessage());
      result = TileResult.missing();
    }
    Optional<byte[]> bytes = result.bytes();
    if (bytes.isEmpty()) {
      buffer.fillTile(key, fill.missingTileColor());
      return;
    }
    buffer.placeTile(key, decode(key, bytes.get()));
    if (fill.missingRegionColor().isPresent()) {
      fillMissingRegions(buffer, key, fill.missingRegionColor().get());
    }
  }

  private void fillMissingRegions(MosaicBuffer buffer, TileKey key, Color color) {
    Optional<GridRectangle> inside = key.regions().intersect(buffer.covered());
    if (inside.isEmpty()) {
      return;
    }
    GridRectangle regions = inside.get();
    for (int x = regions.lowerLeft().x(); x <= regions.upperRight().x(); x++) {
      for (int y = regions.lowerLeft().y(); y <= regions.upperRight().y(); y++) {
        GridCoordinate region = new GridCoordinate(x, y);
        if (!resolver.regionExists(region)) {
          buffer.fillRegion(region, color);
        }
      }
    }
  }

  private static BufferedImage decode(TileKey key, byte[] bytes) {
    try {
      BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
      if (image == null) {
        throw new UpstreamFormatException("Unrecognized image format for " + key);
      }
      return image;
    } catch (IOException e) {
      throw new UpstreamFormatException("Unable to decode " + key, e);
    }
  }
}
