package com.onthegomap.wayedit.util;

import com.onthegomap.wayedit.geo.LatLon;

/**
 * Utilities to parse values from strings.
 */
public class Parse {

  private Parse() {}

  /** Returns {@code value} as an integer or null if it is not a plain integer, like {@code "12"} or {@code "-3"}. */
  public static Integer parseIntOrNull(String value) {
    try {
      return value == null ? null : Integer.parseInt(value.strip());
    } catch (NumberFormatException e) {
      return null;
    }
  }

  /** Returns {@code value} as a long or null if it is not a plain integer. */
  public static Long parseLongOrNull(String value) {
    try {
      return value == null ? null : Long.parseLong(value.strip());
    } catch (NumberFormatException e) {
      return null;
    }
  }

  /**
   * Returns a position parsed from {@code lat,lon}.
   *
   * @throws IllegalArgumentException if {@code value} is not two comma-separated numbers in range
   */
  public static LatLon latLon(String value) {
    String[] parts = value.split(",");
    if (parts.length != 2) {
      throw new IllegalArgumentException("Expected lat,lon but got: " + value);
    }
    return latLon(parts, 0);
  }

  /** Returns a position parsed from the two entries of {@code parts} starting at {@code offset}. */
  public static LatLon latLon(String[] parts, int offset) {
    try {
      return new LatLon(Double.parseDouble(parts[offset].strip()), Double.parseDouble(parts[offset + 1].strip()));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid position: " + parts[offset] + "," + parts[offset + 1], e);
    }
  }
}
