package com.onthegomap.wayedit.geo;

import org.locationtech.jts.geom.Coordinate;

/**
 * An immutable latitude/longitude position on the earth's surface.
 * <p>
 * Equality is exact, which is what lets a split request find "the node at this position" again after the way has been
 * re-fetched.
 */
public record LatLon(double lat, double lon) {

  public LatLon {
    if (lat < -90 || lat > 90) {
      throw new IllegalArgumentException("Invalid latitude: " + lat);
    }
    if (lon < -180 || lon > 180) {
      throw new IllegalArgumentException("Invalid longitude: " + lon);
    }
  }

  /** Returns this position as a web mercator world coordinate, see {@link GeoUtils#getWorldX(double)}. */
  public Coordinate toWorldCoordinate() {
    return new Coordinate(GeoUtils.getWorldX(lon), GeoUtils.getWorldY(lat));
  }

  /** Returns the position for a web mercator world coordinate. */
  public static LatLon fromWorldCoordinate(Coordinate coordinate) {
    return new LatLon(GeoUtils.getWorldLat(coordinate.y), GeoUtils.getWorldLon(coordinate.x));
  }

  @Override
  public String toString() {
    return lat + "," + lon;
  }
}
