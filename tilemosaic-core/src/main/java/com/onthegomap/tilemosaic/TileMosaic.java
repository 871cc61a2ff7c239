package com.onthegomap.tilemosaic;

import com.onthegomap.tilemosaic.cache.PersistentCache;
import com.onthegomap.tilemosaic.config.Arguments;
import com.onthegomap.tilemosaic.config.TileMosaicConfig;
import com.onthegomap.tilemosaic.fetch.TileFetcher;
import com.onthegomap.tilemosaic.fetch.UpstreamClient;
import com.onthegomap.tilemosaic.geo.GridCoordinate;
import com.onthegomap.tilemosaic.geo.GridRectangle;
import com.onthegomap.tilemosaic.geo.InvalidRectangleException;
import com.onthegomap.tilemosaic.geo.ZoomSelection;
import com.onthegomap.tilemosaic.geo.ZoomSelector;
import com.onthegomap.tilemosaic.http.HttpUpstream;
import com.onthegomap.tilemosaic.http.Upstream;
import com.onthegomap.tilemosaic.region.CoordinateResolver;
import com.onthegomap.tilemosaic.region.RegionName;
import com.onthegomap.tilemosaic.render.FillPolicy;
import com.onthegomap.tilemosaic.render.MosaicBuffer;
import com.onthegomap.tilemosaic.render.MosaicCompositor;
import com.onthegomap.tilemosaic.render.Route;
import com.onthegomap.tilemosaic.render.RouteOverlay;
import com.onthegomap.tilemosaic.stats.FetchStats;
import com.onthegomap.tilemosaic.util.Colors;
import com.onthegomap.tilemosaic.util.LogUtil;
import com.onthegomap.tilemosaic.worker.WorkerPool;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Locale;
import java.util.Optional;
import javax.imageio.ImageIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the cache, fetchers, compositor and route overlay together to turn a rectangle or route into an image.
 * <p>
 * For example:
 * <pre>{@code
 * try (var mosaic = TileMosaic.create(TileMosaicConfig.defaults())) {
 *   var result = mosaic.generate(GridRectangle.of(1130, 1070, 1140, 1080), 2048, 2048, FillPolicy.defaults(),
 *     Optional.empty(), false);
 *   TileMosaic.writeImage(result.image(), Path.of("mosaic.png"));
 * }
 * }</pre>
 */
public class TileMosaic implements Closeable {

  private static final Logger LOGGER = LoggerFactory.getLogger(TileMosaic.class);

  private final PersistentCache cache;
  private final Clock clock;
  private final FetchStats stats;
  private final CoordinateResolver resolver;
  private final WorkerPool pool;
  private final MosaicCompositor compositor;
  private final RouteOverlay overlay;
  private final ZoomSelector zoomSelector = new ZoomSelector();

  TileMosaic(TileMosaicConfig config, PersistentCache cache, Upstream upstream, Clock clock) {
    this.cache = cache;
    this.clock = clock;
    this.stats = new FetchStats();
    UpstreamClient client = UpstreamClient.create(upstream, config, stats);
    TileFetcher fetcher = new TileFetcher(cache, client, config.tileUrl(), config.missingTileTtl(), clock, stats);
    this.resolver = CoordinateResolver.create(cache, client, config, clock, stats);
    this.pool = new WorkerPool("fetch", config.fetchThreads());
    this.compositor = new MosaicCompositor(fetcher, resolver, pool);
    this.overlay = new RouteOverlay(config.markerRadius(), config.routeStrokeWidth());
  }

  /** Returns a mosaic generator using the on-disk cache in {@link TileMosaicConfig#cacheDir()} and HTTP upstream. */
  public static TileMosaic create(TileMosaicConfig config) {
    return new TileMosaic(config, PersistentCache.open(config.cacheDir()), new HttpUpstream(config),
      Clock.systemUTC());
  }

  public CoordinateResolver resolver() {
    return resolver;
  }

  public FetchStats stats() {
    return stats;
  }

  /**
   * Composes {@code rectangle} at the most detailed zoom that fits {@code maxWidth × maxHeight} and draws
   * {@code route} over it if present.
   *
   * @param keepRouteFree also return the mosaic without the route
   */
  public MosaicResult generate(GridRectangle rectangle, int maxWidth, int maxHeight, FillPolicy fill,
    Optional<Route> route, boolean keepRouteFree) {
    ZoomSelection selection = zoomSelector.select(rectangle, maxWidth, maxHeight);
    if (!selection.fitsBounds()) {
      LOGGER.warn("{} does not fit in {}x{} even at the coarsest zoom, output will be {}x{}", rectangle, maxWidth,
        maxHeight, selection.widthPixels(), selection.heightPixels());
    }
    MosaicBuffer buffer = compositor.compose(rectangle, selection.zoom(), fill);
    BufferedImage image = buffer.image();
    Optional<BufferedImage> routeFree = Optional.empty();
    if (route.isPresent()) {
      RouteOverlay.Result drawn = overlay.draw(buffer, route.get(), keepRouteFree);
      image = drawn.withRoute();
      routeFree = drawn.routeFree();
    }
    return new MosaicResult(image, routeFree, selection, rectangle, buffer.covered());
  }

  /**
   * Writes {@code image} to {@code path} in the format named by its extension, defaulting to {@code png}.
   *
   * @throws IllegalArgumentException if no image writer supports that format
   */
  public static void writeImage(BufferedImage image, Path path) {
    String name = path.getFileName().toString();
    int dot = name.lastIndexOf('.');
    String format = dot < 0 ? "png" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    BufferedImage toWrite = image;
    if (format.equals("jpg") || format.equals("jpeg") || format.equals("bmp")) {
      // these writers reject images with an alpha channel
      toWrite = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
      var graphics = toWrite.createGraphics();
      graphics.drawImage(image, 0, 0, null);
      graphics.dispose();
    }
    try {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      if (!ImageIO.write(toWrite, format, path.toFile())) {
        throw new IllegalArgumentException("No image writer for format " + format + ": " + path);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Error writing " + path, e);
    }
  }

  @Override
  public void close() throws IOException {
    pool.close();
    cache.close();
  }

  /** Reads the rectangle to compose from arguments: explicit corners, region names, or the route's bounds. */
  GridRectangle rectangleFrom(Arguments arguments, Optional<Route> route) {
    GridRectangle rectangle = arguments.gridRectangle("the area to compose");
    if (rectangle != null) {
      return rectangle;
    }
    String lowerLeftRegion = arguments.getString("lower_left_region", "region name at one corner", null);
    String upperRightRegion = arguments.getString("upper_right_region", "region name at the opposite corner", null);
    if (lowerLeftRegion != null && upperRightRegion != null) {
      GridCoordinate a = resolver.resolveName(RegionName.of(lowerLeftRegion));
      GridCoordinate b = resolver.resolveName(RegionName.of(upperRightRegion));
      return GridRectangle.spanning(a, b);
    }
    return route.map(Route::boundingRectangle).orElseThrow(() -> new InvalidRectangleException(
      "Provide lower_left_x/y and upper_right_x/y, lower_left_region and upper_right_region, or waypoints"));
  }

  static FillPolicy fillPolicyFrom(Arguments arguments, TileMosaicConfig config) {
    FillPolicy fill = FillPolicy.defaults()
      .withMissingTileColor(arguments.getObject("missing_tile_color", "color of tiles that do not exist",
        FillPolicy.DEFAULT_MISSING_TILE_COLOR, Colors::parse))
      .withToleratePartial(config.toleratePartial());
    Color defaultRegionColor = arguments.getBoolean("fill_missing_regions",
      "paint regions that do not exist with the water color", false) ? FillPolicy.WATER_COLOR : null;
    Color missingRegionColor = arguments.getObject("missing_region_color",
      "color of regions that do not exist inside present tiles", defaultRegionColor, Colors::parse);
    return missingRegionColor == null ? fill : fill.withMissingRegionColor(missingRegionColor);
  }

  /** Generates a mosaic described by {@code arguments}, writes the requested files and returns the result. */
  public static MosaicResult run(Arguments arguments) throws IOException {
    TileMosaicConfig config = TileMosaicConfig.from(arguments);
    try (TileMosaic mosaic = create(config)) {
      return mosaic.run(arguments, config);
    }
  }

  MosaicResult run(Arguments arguments, TileMosaicConfig config) {
    return LogUtil.withStage("mosaic", () -> generateAndWrite(arguments, config));
  }

  private MosaicResult generateAndWrite(Arguments arguments, TileMosaicConfig config) {
    Color routeColor = arguments.getObject("route_color", "color of the route line and markers", Route.DEFAULT_COLOR,
      Colors::parse);
    Optional<Route> route = Optional.ofNullable(arguments.getString("waypoints",
      "route waypoints as x:y:offsetX:offsetY separated by ;", null)).map(text -> Route.parse(text, routeColor));
    GridRectangle rectangle = rectangleFrom(arguments, route);
    int maxWidth = arguments.getInteger("max_width", "maximum output width in pixels", 2048);
    int maxHeight = arguments.getInteger("max_height", "maximum output height in pixels", 2048);
    Path output = arguments.file("output", "output image", Path.of("mosaic.png"));
    Path outputWithoutRoute = arguments.file("output_without_route", "output image without the route", null);
    Path metadataOutput = arguments.file("metadata_output", "JSON file describing the output", null);

    MosaicResult result = generate(rectangle, maxWidth, maxHeight, fillPolicyFrom(arguments, config), route,
      outputWithoutRoute != null);
    writeImage(result.image(), output);
    LOGGER.info("Wrote {}x{} mosaic to {}", result.image().getWidth(), result.image().getHeight(), output);
    if (outputWithoutRoute != null) {
      writeImage(result.routeFree().orElse(result.image()), outputWithoutRoute);
    }
    if (metadataOutput != null) {
      MosaicMetadata.from(result, route.map(r -> r.waypoints().size()), clock.instant()).write(metadataOutput);
    }
    stats.printSummary();
    return result;
  }

  public static void main(String[] args) throws IOException {
    MosaicResult result = run(Arguments.fromArgsOrConfigFile(args));
    System.out.println("aspect ratio: " + result.aspectRatio());
    System.out.println("descriptor: " + result.calibrationDescriptor());
  }
}
