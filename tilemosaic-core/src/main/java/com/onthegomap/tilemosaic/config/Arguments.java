package com.onthegomap.tilemosaic.config;

import com.onthegomap.tilemosaic.geo.GridCoordinate;
import com.onthegomap.tilemosaic.geo.GridRectangle;
import com.onthegomap.tilemosaic.geo.InvalidRectangleException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Key/value options for a mosaic run, read from the command line, JVM properties, environment variables or a
 * {@code .properties} file.
 * <p>
 * Keys are matched ignoring case and separators, so {@code "MAX-WIDTH"}, {@code "max.width"} and {@code "max_width"}
 * are the same option. A key written as {@code "new_name|old_name"} reads a renamed option and accepts the old
 * spelling with a warning.
 */
public class Arguments {

  private static final Logger LOGGER = LoggerFactory.getLogger(Arguments.class);

  /** Looks up a value by its normalized key: lower case with {@code _} separators. */
  private final UnaryOperator<String> lookup;

  private Arguments(UnaryOperator<String> lookup) {
    this.lookup = lookup;
  }

  /** Options from {@code -Dtilemosaic.<key>=value} JVM properties. */
  public static Arguments fromJvmProperties() {
    return fromJvmProperties(System::getProperty);
  }

  static Arguments fromJvmProperties(UnaryOperator<String> properties) {
    return new Arguments(key -> properties.apply("tilemosaic." + key.replace('_', '.')));
  }

  /** Options from {@code TILEMOSAIC_<KEY>=value} environment variables. */
  public static Arguments fromEnvironment() {
    return fromEnvironment(System::getenv);
  }

  static Arguments fromEnvironment(UnaryOperator<String> environment) {
    return new Arguments(key -> environment.apply("TILEMOSAIC_" + key.toUpperCase(Locale.ROOT)));
  }

  /**
   * Options from command-line arguments: {@code key=value}, {@code --key=value}, {@code --key value}, or a bare
   * {@code --key} meaning {@code key=true}.
   */
  public static Arguments fromArgs(String... args) {
    Map<String, String> parsed = new HashMap<>();
    int i = 0;
    while (i < args.length) {
      String arg = args[i++].strip();
      int equals = arg.indexOf('=');
      if (equals >= 0) {
        parsed.put(stripDashes(arg.substring(0, equals)), arg.substring(equals + 1));
      } else if (arg.startsWith("-") && i < args.length && !args[i].strip().startsWith("-")) {
        parsed.put(stripDashes(arg), args[i++].strip());
      } else {
        parsed.put(stripDashes(arg), "true");
      }
    }
    return of(parsed);
  }

  private static String stripDashes(String key) {
    return key.replaceFirst("^[\\s-]+", "");
  }

  /** Options from a {@code .properties} file, with keys matched the same way as every other source. */
  public static Arguments fromConfigFile(Path path) {
    Properties properties = new Properties();
    try (var reader = Files.newBufferedReader(path)) {
      properties.load(reader);
    } catch (IOException e) {
      throw new IllegalArgumentException("Unable to load config file: " + path, e);
    }
    Map<String, String> values = new HashMap<>();
    for (String key : properties.stringPropertyNames()) {
      values.put(key, properties.getProperty(key));
    }
    return of(values);
  }

  /**
   * Options from the command line, then JVM properties, then environment variables, then the file named by the
   * {@code config} option from any of those.
   */
  public static Arguments fromArgsOrConfigFile(String... args) {
    Arguments explicit = fromArgs(args).orElse(fromJvmProperties()).orElse(fromEnvironment());
    Path configFile = explicit.file("config", "path to config file", null);
    return configFile == null ? explicit : explicit.orElse(fromConfigFile(configFile));
  }

  public static Arguments of(Map<String, String> map) {
    Map<String, String> normalized = new HashMap<>();
    map.forEach((key, value) -> normalized.put(normalize(key), value));
    return new Arguments(normalized::get);
  }

  /** Shorthand for {@link #of(Map)} with alternating keys and values. */
  public static Arguments of(Object... keysAndValues) {
    if (keysAndValues.length % 2 != 0) {
      throw new IllegalArgumentException("Expected key/value pairs, got " + keysAndValues.length + " items");
    }
    Map<String, String> map = new HashMap<>();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      map.put(keysAndValues[i].toString(), keysAndValues[i + 1].toString());
    }
    return of(map);
  }

  private static String normalize(String key) {
    return key.strip().replaceAll("[._-]", "_").toLowerCase(Locale.ROOT);
  }

  /** Returns options that read {@code this} first and fall back to {@code other}. */
  public Arguments orElse(Arguments other) {
    return new Arguments(key -> {
      String value = lookup.apply(key);
      return value != null ? value : other.lookup.apply(key);
    });
  }

  private String getArg(String key) {
    String[] spellings = key.split("\\|");
    for (int i = 0; i < spellings.length; i++) {
      String value = lookup.apply(normalize(spellings[i]));
      if (value != null) {
        if (i > 0) {
          LOGGER.warn("Argument '{}' is deprecated, use '{}'", spellings[i].strip(), spellings[0].strip());
        }
        return value.strip();
      }
    }
    return null;
  }

  private String getArg(String key, String defaultValue) {
    String value = getArg(key);
    return value == null ? defaultValue : value;
  }

  private static void logArgValue(String key, String description, Object value) {
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("argument: {}={} ({})", key.replaceFirst("\\|.*$", ""), value, description);
    }
  }

  public String getString(String key, String description, String defaultValue) {
    String value = getArg(key, defaultValue);
    logArgValue(key, description, value);
    return value;
  }

  /** Returns the path in {@code key}, or {@code defaultValue} if it is not set. */
  public Path file(String key, String description, Path defaultValue) {
    String value = getArg(key);
    Path file = value == null ? defaultValue : Path.of(value);
    logArgValue(key, description, file);
    return file;
  }

  /** Returns true when {@code key} is {@code "true"} in any case, false for any other value. */
  public boolean getBoolean(String key, String description, boolean defaultValue) {
    boolean value = "true".equalsIgnoreCase(getArg(key, Boolean.toString(defaultValue)));
    logArgValue(key, description, value);
    return value;
  }

  /**
   * Returns {@code key} as an integer.
   *
   * @throws NumberFormatException if the value is not an integer
   */
  public int getInteger(String key, String description, int defaultValue) {
    int value = Integer.parseInt(getArg(key, Integer.toString(defaultValue)));
    logArgValue(key, description, value);
    return value;
  }

  /** @throws NumberFormatException if the value is not a number */
  public double getDouble(String key, String description, double defaultValue) {
    double value = Double.parseDouble(getArg(key, Double.toString(defaultValue)));
    logArgValue(key, description, value);
    return value;
  }

  /**
   * Returns a duration written like {@code "10s"}, {@code "90m"} or {@code "1h30m"}. Whole days take a {@code d}
   * suffix on their own, like {@code "7d"}.
   *
   * @throws DateTimeParseException if the value is not a duration
   */
  public Duration getDuration(String key, String description, String defaultValue) {
    String value = getArg(key, defaultValue).toUpperCase(Locale.ROOT);
    Duration parsed = Duration.parse(value.endsWith("D") ? "P" + value : "PT" + value);
    logArgValue(key, description, parsed.toSeconds() + " seconds");
    return parsed;
  }

  /** Returns {@code key} converted by {@code converter}, or {@code defaultValue} if it is not set. */
  public <T> T getObject(String key, String description, T defaultValue, Function<String, T> converter) {
    String raw = getArg(key);
    T value = raw == null ? defaultValue : converter.apply(raw);
    logArgValue(key, description, value);
    return value;
  }

  /**
   * Returns the grid coordinate made of the {@code <prefix>_x} and {@code <prefix>_y} options, or null if neither
   * is set.
   *
   * @throws IllegalArgumentException if only one of the two is set
   */
  public GridCoordinate gridCoordinate(String prefix, String description) {
    String x = getArg(prefix + "_x");
    String y = getArg(prefix + "_y");
    if (x == null && y == null) {
      return null;
    } else if (x == null || y == null) {
      throw new IllegalArgumentException("Both " + prefix + "_x and " + prefix + "_y are required (" + description +
        ")");
    }
    GridCoordinate result = new GridCoordinate(Integer.parseInt(x), Integer.parseInt(y));
    logArgValue(prefix, description, result);
    return result;
  }

  /**
   * Returns the rectangle made of the {@code lower_left_x/y} and {@code upper_right_x/y} options, or null if none
   * are set.
   *
   * @throws InvalidRectangleException if the corners are inverted or out of range
   */
  public GridRectangle gridRectangle(String description) {
    GridCoordinate lowerLeft = gridCoordinate("lower_left", "lower-left corner of " + description);
    GridCoordinate upperRight = gridCoordinate("upper_right", "upper-right corner of " + description);
    if (lowerLeft == null && upperRight == null) {
      return null;
    } else if (lowerLeft == null || upperRight == null) {
      throw new IllegalArgumentException("Both lower_left and upper_right corners are required (" + description + ")");
    }
    return GridRectangle.of(lowerLeft, upperRight);
  }
}
