package com.onthegomap.wayedit.edits.split;

import com.carrotsearch.hppc.LongHashSet;
import com.onthegomap.wayedit.osm.OsmElement;
import java.util.List;
import java.util.function.LongFunction;

/**
 * The "via" of a turn restriction or similar relation: where the {@code from} and {@code to} members connect.
 */
public sealed interface Vias {

  NoVia NONE = new NoVia();

  /** The relation has no via member, or none that could be resolved to nodes. */
  record NoVia() implements Vias {}

  /** IDs of the via node, or of the first and last nodes of each via way. */
  record ViaNodes(LongHashSet nodeIds) implements Vias {

    /** Returns {@code true} if {@code way} starts or ends at one of the via nodes. */
    public boolean touchesEndOf(OsmElement.Way way) {
      return nodeIds.contains(way.firstNode()) || nodeIds.contains(way.lastNode());
    }
  }

  /**
   * Returns the via node IDs of {@code relation}.
   * <p>
   * For {@code type=destination_sign} the via is the {@code intersection} member, or the {@code sign} member if there
   * is no intersection. For any other type it is the {@code via} member.
   *
   * @param relation the relation
   * @param getWay   looks up via ways by ID, returning {@code null} for unknown ways
   */
  static Vias of(OsmElement.Relation relation, LongFunction<OsmElement.Way> getWay) {
    List<OsmElement.Relation.Member> vias;
    if (relation.hasTag("type", "destination_sign")) {
      vias = withRole(relation, "intersection");
      if (vias.isEmpty()) {
        vias = withRole(relation, "sign");
      }
    } else {
      vias = withRole(relation, "via");
    }
    LongHashSet nodeIds = new LongHashSet();
    for (var via : vias) {
      if (via.type() == OsmElement.Type.NODE) {
        nodeIds.add(via.ref());
      } else {
        var way = getWay.apply(via.ref());
        if (way != null) {
          nodeIds.add(way.firstNode());
          nodeIds.add(way.lastNode());
        }
      }
    }
    return nodeIds.isEmpty() ? NONE : new ViaNodes(nodeIds);
  }

  private static List<OsmElement.Relation.Member> withRole(OsmElement.Relation relation, String role) {
    return relation.members().stream()
      .filter(member -> member.type() == OsmElement.Type.NODE || member.type() == OsmElement.Type.WAY)
      .filter(member -> role.equals(member.role()))
      .toList();
  }
}
