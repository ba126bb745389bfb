package com.onthegomap.wayedit.geo;

import org.locationtech.jts.geom.LineSegment;

/**
 * A collection of utilities for working with web mercator projected coordinates.
 * <p>
 * Web mercator world coordinates range from 0 to 1 where (0, 0) is the north-west corner of the world and (1, 1) is the
 * south-east corner.
 */
public class GeoUtils {

  private static final double DEGREES_PER_RADIAN = 180 / Math.PI;
  private static final double RADIANS_PER_DEGREE = Math.PI / 180;
  private static final double MAX_LAT = getWorldLat(-0.1);
  private static final double MIN_LAT = getWorldLat(1.1);

  private GeoUtils() {}

  /**
   * Returns the longitude for a web mercator coordinate {@code x} where 0 is the international date line on the west
   * side, 1 is the international date line on the east side, and 0.5 is the prime meridian.
   */
  public static double getWorldLon(double x) {
    return x * 360 - 180;
  }

  /**
   * Returns the latitude for a web mercator {@code y} coordinate where 0 is the north edge of the map, 0.5 is the
   * equator, and 1 is the south edge of the map.
   */
  public static double getWorldLat(double y) {
    double n = Math.PI - 2 * Math.PI * y;
    return DEGREES_PER_RADIAN * Math.atan(0.5 * (Math.exp(n) - Math.exp(-n)));
  }

  /**
   * Returns the web mercator X coordinate for {@code longitude} where 0 is the international date line on the west
   * side, 1 is the international date line on the east side, and 0.5 is the prime meridian.
   */
  public static double getWorldX(double longitude) {
    return (longitude + 180) / 360;
  }

  /**
   * Returns the web mercator Y coordinate for {@code latitude} where 0 is the north edge of the map, 0.5 is the
   * equator, and 1 is the south edge of the map.
   */
  public static double getWorldY(double latitude) {
    if (latitude <= MIN_LAT) {
      return 1.1;
    }
    if (latitude >= MAX_LAT) {
      return -0.1;
    }
    double sin = Math.sin(latitude * RADIANS_PER_DEGREE);
    return 0.5 - 0.25 * Math.log((1 + sin) / (1 - sin)) / Math.PI;
  }

  /**
   * Returns the fraction from 0 ({@code start}) to 1 ({@code end}) along the segment of the point on that segment
   * closest to {@code position}, measured in web mercator space.
   */
  public static double fractionAlongSegment(LatLon start, LatLon end, LatLon position) {
    var segment = new LineSegment(start.toWorldCoordinate(), end.toWorldCoordinate());
    if (segment.getLength() == 0) {
      return 0;
    }
    double fraction = segment.projectionFactor(position.toWorldCoordinate());
    return Math.max(0, Math.min(1, fraction));
  }

  /** Returns the position {@code fraction} of the way from {@code start} to {@code end} in web mercator space. */
  public static LatLon interpolate(LatLon start, LatLon end, double fraction) {
    if (fraction <= 0) {
      return start;
    } else if (fraction >= 1) {
      return end;
    }
    var segment = new LineSegment(start.toWorldCoordinate(), end.toWorldCoordinate());
    return LatLon.fromWorldCoordinate(segment.pointAlong(fraction));
  }
}
