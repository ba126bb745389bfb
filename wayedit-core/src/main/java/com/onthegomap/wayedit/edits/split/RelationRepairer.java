package com.onthegomap.wayedit.edits.split;

import com.onthegomap.wayedit.mapdata.MapDataRepository;
import com.onthegomap.wayedit.osm.OsmElement;
import com.onthegomap.wayedit.osm.OsmElement.Relation.Member;
import com.onthegomap.wayedit.util.Lists;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces the members that refer to a way that was split with members for the pieces of that way, in every relation
 * the way is a member of.
 * <p>
 * For {@code from} and {@code to} members of turn restrictions and similar relations only the piece that connects to
 * the via is kept. For anything else all pieces are inserted in place of the original member, in reverse order if the
 * way runs backwards along an ordered relation like a route.
 */
public class RelationRepairer {

  private static final Logger LOGGER = LoggerFactory.getLogger(RelationRepairer.class);

  private final OsmElement.Way originalWay;
  private final List<OsmElement.Way> newWays;
  private final Map<Long, OsmElement.Way> newWaysById = new HashMap<>();
  private final MapDataRepository mapData;

  enum Orientation {
    FORWARD,
    BACKWARD,
    UNKNOWN
  }

  RelationRepairer(OsmElement.Way originalWay, List<OsmElement.Way> newWays, MapDataRepository mapData) {
    this.originalWay = originalWay;
    this.newWays = newWays;
    this.mapData = mapData;
    for (var way : newWays) {
      newWaysById.put(way.id(), way);
    }
  }

  /**
   * Returns every relation that contains {@code originalWay}, updated to contain {@code newWays} instead.
   *
   * @param originalWay the way before it was split
   * @param newWays     the pieces of the way in order from its start to its end
   * @param mapData     source of the relations and of the ways next to the original way in them
   */
  public static List<OsmElement.Relation> repair(OsmElement.Way originalWay, List<OsmElement.Way> newWays,
    MapDataRepository mapData) {
    return new RelationRepairer(originalWay, newWays, mapData).repairAll();
  }

  List<OsmElement.Relation> repairAll() {
    Map<Long, OsmElement.Relation> result = new LinkedHashMap<>();
    for (var relation : mapData.getRelationsForWay(originalWay.id())) {
      if (!result.containsKey(relation.id())) {
        var updated = repair(relation);
        if (updated != null) {
          result.put(relation.id(), updated);
        }
      }
    }
    return List.copyOf(result.values());
  }

  /** Returns {@code relation} with its members updated, or {@code null} if no member was replaced. */
  OsmElement.Relation repair(OsmElement.Relation relation) {
    List<Member> members = relation.members();
    boolean changed = false;
    // back to front so that members before index i never move
    for (int i = members.size() - 1; i >= 0; i--) {
      Member member = members.get(i);
      if (member.isWay(originalWay.id())) {
        List<Member> replacement = replacementFor(relation, members, i, member.role());
        if (replacement != null) {
          members = Lists.splice(members, i, replacement);
          changed = true;
        }
      }
    }
    if (changed) {
      LOGGER.debug("Relation #{}: replaced way #{} with {}", relation.id(), originalWay.id(),
        newWays.stream().map(OsmElement.Way::id).toList());
      return relation.withMembers(members);
    }
    return null;
  }

  private List<Member> replacementFor(OsmElement.Relation relation, List<Member> members, int index, String role) {
    if ("from".equals(role) || "to".equals(role)) {
      if (Vias.of(relation, this::getWayBeforeSplit) instanceof Vias.ViaNodes via) {
        for (var way : newWays) {
          if (via.touchesEndOf(way)) {
            return List.of(Member.way(way.id(), role));
          }
        }
        LOGGER.warn("Relation #{}: no piece of way #{} connects to via nodes {}, leaving its '{}' member unchanged",
          relation.id(), originalWay.id(), via.nodeIds(), role);
        return null;
      }
    }
    List<Member> result = new ArrayList<>(newWays.size());
    for (var way : newWays) {
      result.add(Member.way(way.id(), role));
    }
    if (orientationIn(members, index) == Orientation.BACKWARD) {
      Collections.reverse(result);
    }
    return result;
  }

  /**
   * Returns whether the original way runs forward or backward in an ordered relation, by testing if it connects to
   * the nearest way before it or after it in the member list.
   */
  Orientation orientationIn(List<Member> members, int index) {
    Member before = Lists.findPrevious(members, index, member -> member.type() == OsmElement.Type.WAY);
    OsmElement.Way wayBefore = before == null ? null : getWayBeforeSplit(before.ref());
    if (wayBefore != null) {
      if (originalWay.isAfterInChain(wayBefore)) {
        return Orientation.FORWARD;
      }
      if (originalWay.isBeforeInChain(wayBefore)) {
        return Orientation.BACKWARD;
      }
    }

    Member after = Lists.findNext(members, index + 1, member -> member.type() == OsmElement.Type.WAY);
    OsmElement.Way wayAfter = after == null ? null : getWayAfterSplit(after.ref());
    if (wayAfter != null) {
      if (originalWay.isBeforeInChain(wayAfter)) {
        return Orientation.FORWARD;
      }
      if (originalWay.isAfterInChain(wayAfter)) {
        return Orientation.BACKWARD;
      }
    }
    return Orientation.UNKNOWN;
  }

  /** Members before the one being replaced still refer to the ways as they were before the split. */
  private OsmElement.Way getWayBeforeSplit(long id) {
    return id == originalWay.id() ? originalWay : mapData.getWay(id);
  }

  /** Members after the one being replaced have already been updated to refer to the pieces. */
  private OsmElement.Way getWayAfterSplit(long id) {
    var newWay = newWaysById.get(id);
    return newWay != null ? newWay : mapData.getWay(id);
  }
}
