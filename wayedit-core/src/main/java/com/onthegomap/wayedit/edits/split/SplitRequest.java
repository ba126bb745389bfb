package com.onthegomap.wayedit.edits.split;

import com.onthegomap.wayedit.geo.LatLon;
import com.onthegomap.wayedit.util.Parse;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Where a user asked to split a way.
 * <p>
 * Position-based requests are more robust against concurrent edits than node indices because they still resolve to
 * the right spot after the way was reversed or had nodes added elsewhere.
 */
public sealed interface SplitRequest {

  /** Returns {@code true} if this request inserts a new node into the way. */
  boolean createsNode();

  /** Split at the existing node located at {@code position}. */
  record AtPoint(LatLon position) implements SplitRequest {

    @Override
    public boolean createsNode() {
      return false;
    }
  }

  /** Split at the existing node at {@code index} of the way. */
  record AtNodeIndex(int index) implements SplitRequest {

    @Override
    public boolean createsNode() {
      return false;
    }
  }

  /**
   * Split between the two adjacent nodes located at {@code first} and {@code second}, at the point of that segment
   * closest to {@code position}.
   */
  record AtLinePosition(LatLon first, LatLon second, LatLon position) implements SplitRequest {

    @Override
    public boolean createsNode() {
      return true;
    }
  }

  /** Split between the nodes at {@code index} and {@code index + 1}, at the point closest to {@code position}. */
  record AtSegment(int index, LatLon position) implements SplitRequest {

    @Override
    public boolean createsNode() {
      return true;
    }
  }

  /**
   * Parses a single request.
   * <p>
   * Formats: {@code point:lat,lon}, {@code index:i}, {@code line:lat1,lon1,lat2,lon2,lat,lon}, {@code segment:i,lat,lon}
   *
   * @throws IllegalArgumentException if {@code value} does not match any format
   */
  static SplitRequest parse(String value) {
    String[] kindAndArgs = value.strip().split(":", 2);
    if (kindAndArgs.length != 2) {
      throw new IllegalArgumentException("Expected kind:arguments but got: " + value);
    }
    String[] args = kindAndArgs[1].split(",");
    String kind = kindAndArgs[0].strip().toLowerCase(Locale.ROOT);
    return switch (kind) {
      case "point" -> {
        expectArgs(value, args, 2);
        yield new AtPoint(Parse.latLon(args, 0));
      }
      case "index" -> {
        expectArgs(value, args, 1);
        yield new AtNodeIndex(parseIndex(value, args[0]));
      }
      case "line" -> {
        expectArgs(value, args, 6);
        yield new AtLinePosition(Parse.latLon(args, 0), Parse.latLon(args, 2), Parse.latLon(args, 4));
      }
      case "segment" -> {
        expectArgs(value, args, 3);
        yield new AtSegment(parseIndex(value, args[0]), Parse.latLon(args, 1));
      }
      default -> throw new IllegalArgumentException("Unrecognized split kind '" + kind + "' in: " + value);
    };
  }

  /** Parses requests separated by {@code ;}, see {@link #parse(String)}. */
  static List<SplitRequest> parseAll(String value) {
    List<SplitRequest> result = new ArrayList<>();
    for (String part : value.split(";")) {
      if (!part.isBlank()) {
        result.add(parse(part));
      }
    }
    return result;
  }

  private static void expectArgs(String value, String[] args, int count) {
    if (args.length != count) {
      throw new IllegalArgumentException("Expected " + count + " arguments but got " + args.length + ": " + value);
    }
  }

  private static int parseIndex(String value, String index) {
    Integer result = Parse.parseIntOrNull(index);
    if (result == null || result < 0) {
      throw new IllegalArgumentException("Invalid node index in: " + value);
    }
    return result;
  }
}
