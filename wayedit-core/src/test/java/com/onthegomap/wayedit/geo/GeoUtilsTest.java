package com.onthegomap.wayedit.geo;

import static com.onthegomap.wayedit.TestUtils.assertSamePosition;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class GeoUtilsTest {

  @ParameterizedTest
  @CsvSource({
    "0,0, 0.5,0.5",
    "0, -180, 0, 0.5",
    "0, 180, 1, 0.5",
    "85.05112877980659, 180, 1, 0",
    "-85.05112877980659, -180, 0, 1",
  })
  void testWorldCoords(double lat, double lon, double worldX, double worldY) {
    assertEquals(worldY, GeoUtils.getWorldY(lat), 1e-5);
    assertEquals(worldX, GeoUtils.getWorldX(lon), 1e-5);
    assertEquals(lat, GeoUtils.getWorldLat(worldY), 1e-5);
    assertEquals(lon, GeoUtils.getWorldLon(worldX), 1e-5);
  }

  @Test
  void testLatLonWorldCoordinate() {
    var position = new LatLon(53.55, 9.99);
    assertSamePosition(position, LatLon.fromWorldCoordinate(position.toWorldCoordinate()));
  }

  @Test
  void testLatLonRange() {
    assertThrows(IllegalArgumentException.class, () -> new LatLon(90.1, 0));
    assertThrows(IllegalArgumentException.class, () -> new LatLon(0, -180.1));
    assertEquals("1.5,-2.0", new LatLon(1.5, -2).toString());
  }

  @ParameterizedTest
  @CsvSource({
    "0.001, 1.25, 0.25",
    "-0.001, 1.5, 0.5",
    "0, 1, 0",
    "0, 2, 1",
    "0, 0.5, 0",
    "0, 3, 1",
  })
  void testFractionAlongSegment(double lat, double lon, double expected) {
    var start = new LatLon(0, 1);
    var end = new LatLon(0, 2);
    assertEquals(expected, GeoUtils.fractionAlongSegment(start, end, new LatLon(lat, lon)), 1e-9);
  }

  @Test
  void testFractionAlongZeroLengthSegment() {
    var point = new LatLon(1, 1);
    assertEquals(0, GeoUtils.fractionAlongSegment(point, point, new LatLon(2, 2)));
  }

  @Test
  void testInterpolate() {
    var start = new LatLon(0, 1);
    var end = new LatLon(0, 2);
    assertSame(start, GeoUtils.interpolate(start, end, 0));
    assertSame(end, GeoUtils.interpolate(start, end, 1));
    assertSamePosition(new LatLon(0, 1.25), GeoUtils.interpolate(start, end, 0.25));
  }
}
