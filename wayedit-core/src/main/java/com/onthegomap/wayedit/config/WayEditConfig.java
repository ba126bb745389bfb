package com.onthegomap.wayedit.config;

/**
 * Holds the settings that control how edits are produced and written.
 *
 * @param idStart     ID of the first new element of each type, following IDs count down from there
 * @param prettyPrint whether JSON output should be indented
 */
public record WayEditConfig(
  Arguments arguments,
  long idStart,
  boolean prettyPrint
) {

  public WayEditConfig {
    if (idStart >= 0) {
      throw new IllegalArgumentException("id_start must be negative, got " + idStart);
    }
  }

  public static WayEditConfig defaults() {
    return from(Arguments.of());
  }

  public static WayEditConfig from(Arguments arguments) {
    return new WayEditConfig(
      arguments,
      arguments.getLong("id_start", "ID of the first new node, way, or relation, must be negative", -1),
      arguments.getBoolean("pretty", "indent JSON output", false)
    );
  }
}
