package com.onthegomap.tilemosaic;

import static com.fasterxml.jackson.annotation.JsonInclude.Include.NON_ABSENT;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.onthegomap.tilemosaic.geo.GridRectangle;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

/**
 * JSON sidecar describing how a mosaic was made.
 */
public record MosaicMetadata(
  @JsonProperty("zoom") int regionsPerTile,
  @JsonProperty("width") int widthPixels,
  @JsonProperty("height") int heightPixels,
  @JsonProperty("fits_bounds") boolean fitsBounds,
  @JsonProperty("requested") Rectangle requested,
  @JsonProperty("covered") Rectangle covered,
  @JsonProperty("aspect_ratio") double aspectRatio,
  @JsonProperty("descriptor") String descriptor,
  @JsonProperty("waypoints") Optional<Integer> waypoints,
  @JsonProperty("generated_at") Instant generatedAt
) {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
    .registerModules(new Jdk8Module(), new JavaTimeModule())
    .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
    .setSerializationInclusion(NON_ABSENT);

  private static final ObjectWriter PRETTY_WRITER = OBJECT_MAPPER.writerWithDefaultPrettyPrinter();

  public record Rectangle(
    @JsonProperty("min_x") int minX,
    @JsonProperty("min_y") int minY,
    @JsonProperty("max_x") int maxX,
    @JsonProperty("max_y") int maxY
  ) {

    static Rectangle of(GridRectangle rectangle) {
      return new Rectangle(rectangle.lowerLeft().x(), rectangle.lowerLeft().y(), rectangle.upperRight().x(),
        rectangle.upperRight().y());
    }
  }

  public static MosaicMetadata from(MosaicResult result, Optional<Integer> waypoints, Instant generatedAt) {
    var selection = result.selection();
    return new MosaicMetadata(
      selection.zoom().regionsPerTile(),
      selection.widthPixels(),
      selection.heightPixels(),
      selection.fitsBounds(),
      Rectangle.of(result.requested()),
      Rectangle.of(result.covered()),
      result.aspectRatio(),
      result.calibrationDescriptor(),
      waypoints,
      generatedAt
    );
  }

  public String toJson() {
    try {
      return PRETTY_WRITER.writeValueAsString(this);
    } catch (IOException e) {
      throw new UncheckedIOException("Error converting mosaic metadata to JSON", e);
    }
  }

  public static MosaicMetadata fromJson(String json) {
    try {
      return OBJECT_MAPPER.readValue(json, MosaicMetadata.class);
    } catch (IOException e) {
      throw new UncheckedIOException("Invalid mosaic metadata: " + json, e);
    }
  }

  public void write(Path path) {
    try {
      PRETTY_WRITER.writeValue(path.toFile(), this);
    } catch (IOException e) {
      throw new UncheckedIOException("Error writing " + path, e);
    }
  }
}
