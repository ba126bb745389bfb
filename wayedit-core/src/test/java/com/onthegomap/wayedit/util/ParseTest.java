package com.onthegomap.wayedit.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.onthegomap.wayedit.geo.LatLon;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class ParseTest {

  @ParameterizedTest
  @CsvSource(value = {
    "0, 0",
    "12, 12",
    "-3, -3",
    "' 7 ', 7",
    "2147483647, 2147483647",
  })
  void testParseIntOrNull(String input, Integer expected) {
    assertEquals(expected, Parse.parseIntOrNull(input));
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "1.5", "12a", "yes", "2147483648"})
  void testParseIntOrNullInvalid(String input) {
    assertNull(Parse.parseIntOrNull(input));
  }

  @Test
  void testParseIntOrNullNull() {
    assertNull(Parse.parseIntOrNull(null));
  }

  @Test
  void testParseLongOrNull() {
    assertEquals(4_000_000_000L, Parse.parseLongOrNull("4000000000"));
    assertNull(Parse.parseLongOrNull("4e9"));
    assertNull(Parse.parseLongOrNull(null));
  }

  @Test
  void testLatLon() {
    assertEquals(new LatLon(53.5, 9.75), Parse.latLon("53.5,9.75"));
    assertEquals(new LatLon(-1, 2), Parse.latLon(" -1 , 2 "));
    assertEquals(new LatLon(3, 4), Parse.latLon(new String[]{"1", "2", "3", "4"}, 2));
  }

  @ParameterizedTest
  @ValueSource(strings = {"1", "1,2,3", "a,b", "91,0", "0,181"})
  void testLatLonInvalid(String input) {
    assertThrows(IllegalArgumentException.class, () -> Parse.latLon(input));
  }
}
