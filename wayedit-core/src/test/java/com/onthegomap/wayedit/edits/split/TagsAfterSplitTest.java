package com.onthegomap.wayedit.edits.split;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class TagsAfterSplitTest {

  @Test
  void testRemovesTagsThatDescribeTheWholeWay() {
    assertEquals(Map.of("highway", "steps", "incline", "up", "steps", "yes"), TagsAfterSplit.filter(Map.of(
      "highway", "steps",
      "step_count", "12",
      "incline", "up",
      "steps", "yes",
      "capacity", "5"
    )));
  }

  @Test
  void testRemovesEveryCountOfTheWholeWay() {
    assertEquals(Map.of("name", "Main St"), TagsAfterSplit.filter(Map.of(
      "step_count", "5",
      "steps", "5",
      "incline", "10%",
      "seats", "4",
      "capacity", "2",
      "parking:lane:both:capacity", "1",
      "name", "Main St"
    )));
    assertEquals(Map.of("steps", "spiral"), TagsAfterSplit.filter(Map.of("steps", "spiral")));
    assertEquals(Map.of("incline", "up"), TagsAfterSplit.filter(Map.of("incline", "up")));
  }

  @Test
  void testKeepsUnrelatedTags() {
    var tags = Map.of("highway", "residential", "name", "Main Street", "maxspeed", "30");
    assertEquals(tags, TagsAfterSplit.filter(tags));
  }

  @Test
  void testDoesNotModifyInput() {
    Map<String, String> tags = new HashMap<>(Map.of("seats", "4", "name", "x"));
    assertEquals(Map.of("name", "x"), TagsAfterSplit.filter(tags));
    assertEquals(Map.of("seats", "4", "name", "x"), tags);
  }

  @ParameterizedTest
  @CsvSource({
    "steps, 12, false",
    "steps, ' 3', false",
    "steps, yes, true",
    "steps, 12.5, true",
    "incline, 10%, false",
    "incline, -5°, false",
    "incline, up, true",
    "incline, down, true",
    "step_count, 3, false",
    "seats, 2, false",
  })
  void testValueDependentRemoval(String key, String value, boolean kept) {
    assertEquals(kept, TagsAfterSplit.filter(Map.of(key, value)).containsKey(key));
  }

  @ParameterizedTest
  @ValueSource(strings = {
    "capacity",
    "capacity:disabled",
    "bicycle_parking:capacity",
    "parking:lane:both:capacity",
    "parking:lane:right:capacity:disabled",
  })
  void testRemovesCapacityKeys(String key) {
    assertFalse(TagsAfterSplit.filter(Map.of(key, "10")).containsKey(key));
  }

  @ParameterizedTest
  @ValueSource(strings = {"capacityx", "xcapacity", "max_capacity", "capacity_total"})
  void testKeepsKeysThatOnlyContainCapacity(String key) {
    assertTrue(TagsAfterSplit.filter(Map.of(key, "10")).containsKey(key));
  }
}
