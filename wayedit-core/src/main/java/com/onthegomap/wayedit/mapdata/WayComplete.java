package com.onthegomap.wayedit.mapdata;

import com.onthegomap.wayedit.osm.OsmElement;
import java.util.Map;

/**
 * A way together with every node it references that the repository knows about.
 *
 * @param way   the way
 * @param nodes referenced nodes by ID, nodes missing from the repository are absent from this map
 */
public record WayComplete(OsmElement.Way way, Map<Long, OsmElement.Node> nodes) {

  public WayComplete {
    nodes = Map.copyOf(nodes);
  }

  /** Returns the node with {@code id} or {@code null} if it is not part of this snapshot. */
  public OsmElement.Node getNode(long id) {
    return nodes.get(id);
  }
}
