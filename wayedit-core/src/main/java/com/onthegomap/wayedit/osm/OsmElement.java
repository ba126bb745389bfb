package com.onthegomap.wayedit.osm;

import com.carrotsearch.hppc.LongArrayList;
import com.onthegomap.wayedit.geo.LatLon;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A map data element as stored by OpenStreetMap.
 * <p>
 * Positive IDs refer to elements that exist upstream, negative IDs to elements created locally that have not been
 * uploaded yet.
 *
 * @see <a href="https://wiki.openstreetmap.org/wiki/Elements">OSM element data model</a>
 */
public interface OsmElement extends WithTags {

  /** OSM element ID */
  long id();

  /** Revision counter from the upstream store, 0 for elements that have not been uploaded yet. */
  int version();

  Type type();

  enum Type {
    NODE,
    WAY,
    RELATION;

    /** Returns the lower-case name used by the OSM API, for example {@code "way"}. */
    public String apiName() {
      return name().toLowerCase(Locale.ROOT);
    }

    /** Returns the type for a lower-case OSM API name. */
    public static Type fromApiName(String name) {
      return switch (name) {
        case "node" -> NODE;
        case "way" -> WAY;
        case "relation" -> RELATION;
        default -> throw new IllegalArgumentException("Unrecognized element type: " + name);
      };
    }
  }

  /** A point on the earth's surface. */
  record Node(
    @Override long id,
    @Override int version,
    @Override Map<String, String> tags,
    LatLon position
  ) implements OsmElement {

    public Node {
      tags = tags == null ? Map.of() : tags;
    }

    public Node(long id, double lat, double lon) {
      this(id, 1, Map.of(), new LatLon(lat, lon));
    }

    @Override
    public Type type() {
      return Type.NODE;
    }
  }

  /**
   * An ordered list of nodes that define a polyline, or a closed ring when the first and last node are the same.
   * <p>
   * The node list is exposed as-is, callers that need to modify it must copy it first.
   */
  record Way(
    @Override long id,
    @Override int version,
    @Override Map<String, String> tags,
    LongArrayList nodes
  ) implements OsmElement {

    public Way {
      tags = tags == null ? Map.of() : tags;
      if (nodes == null || nodes.size() < 2) {
        throw new IllegalArgumentException("Way " + id + " must have at least 2 nodes, got " + nodes);
      }
    }

    public Way(long id, long... nodes) {
      this(id, 1, Map.of(), LongArrayList.from(nodes));
    }

    public long firstNode() {
      return nodes.get(0);
    }

    public long lastNode() {
      return nodes.get(nodes.size() - 1);
    }

    /** Returns {@code true} if the first and last node are the same. */
    public boolean isClosed() {
      return firstNode() == lastNode();
    }

    /** Returns {@code true} if this way ends where {@code other} starts or ends. */
    public boolean isBeforeInChain(Way other) {
      return lastNode() == other.lastNode() || lastNode() == other.firstNode();
    }

    /** Returns {@code true} if this way starts where {@code other} starts or ends. */
    public boolean isAfterInChain(Way other) {
      return firstNode() == other.lastNode() || firstNode() == other.firstNode();
    }

    @Override
    public Type type() {
      return Type.WAY;
    }
  }

  /** An ordered list of nodes, ways, and other relations. */
  record Relation(
    @Override long id,
    @Override int version,
    @Override Map<String, String> tags,
    List<Member> members
  ) implements OsmElement {

    public Relation {
      tags = tags == null ? Map.of() : tags;
      members = members == null ? List.of() : List.copyOf(members);
    }

    /** Returns a copy of this relation with the same identity and tags but a new list of members. */
    public Relation withMembers(List<Member> newMembers) {
      return new Relation(id, version, tags, newMembers);
    }

    @Override
    public Type type() {
      return Type.RELATION;
    }

    /**
     * A node, way, or relation contained in a relation with an optional "role" to clarify the purpose of each member.
     */
    public record Member(
      Type type,
      long ref,
      String role
    ) {

      public Member {
        role = role == null ? "" : role;
      }

      public static Member way(long ref, String role) {
        return new Member(Type.WAY, ref, role);
      }

      public static Member node(long ref, String role) {
        return new Member(Type.NODE, ref, role);
      }

      public boolean isWay(long wayId) {
        return type == Type.WAY && ref == wayId;
      }
    }
  }
}
