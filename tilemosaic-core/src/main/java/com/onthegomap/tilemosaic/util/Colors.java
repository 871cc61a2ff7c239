package com.onthegomap.tilemosaic.util;

import java.awt.Color;
import java.util.Locale;

/** Parses and formats css-style hex colors. */
public class Colors {

  private Colors() {}

  /**
   * Returns the color for {@code #rgb}, {@code #rrggbb} or {@code #rrggbbaa}. The leading {@code #} is optional.
   *
   * @throws IllegalArgumentException if {@code value} is not one of those forms
   */
  public static Color parse(String value) {
    String hex = value.strip();
    if (hex.startsWith("#")) {
      hex = hex.substring(1);
    }
    if (!hex.matches("[0-9a-fA-F]+")) {
      throw new IllegalArgumentException("Invalid color: " + value);
    }
    return switch (hex.length()) {
      case 3 -> new Color(
        Integer.parseInt(hex.substring(0, 1).repeat(2), 16),
        Integer.parseInt(hex.substring(1, 2).repeat(2), 16),
        Integer.parseInt(hex.substring(2, 3).repeat(2), 16)
      );
      case 6 -> new Color(Integer.parseInt(hex, 16));
      case 8 -> new Color(
        Integer.parseInt(hex.substring(0, 2), 16),
        Integer.parseInt(hex.substring(2, 4), 16),
        Integer.parseInt(hex.substring(4, 6), 16),
        Integer.parseInt(hex.substring(6, 8), 16)
      );
      default -> throw new IllegalArgumentException("Invalid color: " + value);
    };
  }

  /** Returns {@code color} as {@code #rrggbb}, or {@code #rrggbbaa} when it is not opaque. */
  public static String format(Color color) {
    String rgb = "#%02x%02x%02x".formatted(color.getRed(), color.getGreen(), color.getBlue());
    return (color.getAlpha() == 255 ? rgb : rgb + "%02x".formatted(color.getAlpha())).toLowerCase(Locale.ROOT);
  }
}
