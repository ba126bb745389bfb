package com.onthegomap.wayedit.osm;

import java.util.Map;

/** An element with a set of string key/value pairs. */
public interface WithTags {

  /** The key/value pairs on this element. */
  Map<String, String> tags();

  default boolean hasTag(String key) {
    return tags().containsKey(key);
  }

  default boolean hasTag(String key, String value) {
    return value.equals(tags().get(key));
  }

  /** Returns true if the value for {@code key} is {@code value1} or {@code value2}. */
  default boolean hasTag(String key, String value1, String value2) {
    String actual = tags().get(key);
    return actual != null && (actual.equals(value1) || actual.equals(value2));
  }

  /** Returns the value for {@code key} or {@code null} if not present. */
  default String getString(String key) {
    return tags().get(key);
  }

  /** Returns the value for {@code key} or {@code defaultValue} if not present. */
  default String getString(String key, String defaultValue) {
    return tags().getOrDefault(key, defaultValue);
  }
}
