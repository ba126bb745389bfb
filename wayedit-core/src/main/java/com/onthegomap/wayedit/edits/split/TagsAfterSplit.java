package com.onthegomap.wayedit.edits.split;

import com.onthegomap.wayedit.util.Parse;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Removes tags that describe the way as a whole and are likely wrong for each of the pieces it is split into.
 */
public class TagsAfterSplit {

  private static final Pattern DIGIT = Pattern.compile("\\d");
  // capacity, bicycle_parking:capacity, parking:lane:both:capacity, parking:lane:right:capacity:disabled, ...
  private static final Pattern CAPACITY = Pattern.compile("^(.*:)?capacity(:.*)?$");

  private TagsAfterSplit() {}

  /** Returns a copy of {@code tags} without the tags that may be incorrect after splitting the way. */
  public static Map<String, String> filter(Map<String, String> tags) {
    Map<String, String> result = new TreeMap<>(tags);
    result.remove("step_count");
    // "steps" is also used to denote the kind of steps
    if (Parse.parseIntOrNull(result.get("steps")) != null) {
      result.remove("steps");
    }
    String incline = result.get("incline");
    if (incline != null && DIGIT.matcher(incline).find()) {
      result.remove("incline");
    }
    result.remove("seats");
    result.keySet().removeIf(key -> CAPACITY.matcher(key).matches());
    return result;
  }
}
