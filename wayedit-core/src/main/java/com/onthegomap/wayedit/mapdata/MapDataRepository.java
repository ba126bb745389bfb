package com.onthegomap.wayedit.mapdata;

import com.onthegomap.wayedit.osm.OsmElement;
import java.util.List;

/**
 * Read access to a snapshot of map data, which may be backed by a local cache or the upstream API.
 * <p>
 * Lookups return {@code null} when the element does not exist (any more).
 */
public interface MapDataRepository {

  /** Returns an in-memory repository that elements can be written to. */
  static InMemoryMapDataRepository newInMemory() {
    return new InMemoryMapDataRepository();
  }

  OsmElement.Node getNode(long id);

  OsmElement.Way getWay(long id);

  OsmElement.Relation getRelation(long id);

  /** Returns the way with {@code wayId} and all nodes it references, or {@code null} if the way does not exist. */
  WayComplete getWayComplete(long wayId);

  /** Returns every relation that has the way with {@code wayId} as a member. */
  List<OsmElement.Relation> getRelationsForWay(long wayId);
}
