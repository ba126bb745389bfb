package com.onthegomap.wayedit.edits;

import com.onthegomap.wayedit.osm.OsmElement;
import java.util.ArrayList;
import java.util.List;

/**
 * The elements created or modified by an edit.
 *
 * @param createdNodes     new nodes
 * @param updatedWays      modified ways followed by new ways, or in whatever order the edit defines
 * @param updatedRelations modified relations, each at most once
 */
public record ElementUpdates(
  List<OsmElement.Node> createdNodes,
  List<OsmElement.Way> updatedWays,
  List<OsmElement.Relation> updatedRelations
) {

  public ElementUpdates {
    createdNodes = List.copyOf(createdNodes);
    updatedWays = List.copyOf(updatedWays);
    updatedRelations = List.copyOf(updatedRelations);
  }

  /** Returns all nodes, then all ways, then all relations. */
  public List<OsmElement> all() {
    List<OsmElement> result = new ArrayList<>(size());
    result.addAll(createdNodes);
    result.addAll(updatedWays);
    result.addAll(updatedRelations);
    return result;
  }

  public int size() {
    return createdNodes.size() + updatedWays.size() + updatedRelations.size();
  }
}
