package com.onthegomap.wayedit.mapdata;

import com.carrotsearch.hppc.LongArrayList;
import com.onthegomap.wayedit.osm.OsmElement;
import java.io.Closeable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * A {@link MapDataRepository} that keeps every element in sorted in-memory maps, with a reverse index from ways to
 * the relations that contain them.
 * <p>
 * Not thread-safe.
 */
public class InMemoryMapDataRepository implements MapDataRepository {

  private final NavigableMap<Long, OsmElement.Node> nodes = new TreeMap<>();
  private final NavigableMap<Long, OsmElement.Way> ways = new TreeMap<>();
  private final NavigableMap<Long, OsmElement.Relation> relations = new TreeMap<>();
  private final NavigableMap<Long, LongArrayList> waysToParentRelation = new TreeMap<>();

  /** Writes elements into a repository, replacing any existing element with the same type and ID. */
  public interface BulkWriter extends Closeable {

    void putNode(OsmElement.Node node);

    void putWay(OsmElement.Way way);

    void putRelation(OsmElement.Relation relation);

    default void put(OsmElement element) {
      if (element instanceof OsmElement.Node node) {
        putNode(node);
      } else if (element instanceof OsmElement.Way way) {
        putWay(way);
      } else if (element instanceof OsmElement.Relation relation) {
        putRelation(relation);
      } else {
        throw new IllegalArgumentException("Unrecognized element: " + element);
      }
    }

    @Override
    default void close() {}
  }

  private class Bulk implements BulkWriter {

    @Override
    public void putNode(OsmElement.Node node) {
      nodes.put(node.id(), node);
    }

    @Override
    public void putWay(OsmElement.Way way) {
      ways.put(way.id(), way);
    }

    @Override
    public void putRelation(OsmElement.Relation relation) {
      var previous = relations.put(relation.id(), relation);
      if (previous != null) {
        unindexRelation(previous);
      }
      for (var member : relation.members()) {
        if (member.type() == OsmElement.Type.WAY) {
          addParent(waysToParentRelation, member.ref(), relation.id());
        }
      }
    }
  }

  public BulkWriter newBulkWriter() {
    return new Bulk();
  }

  /** Writes {@code elements} into this repository, replacing existing ones with the same type and ID. */
  public void putAll(Iterable<? extends OsmElement> elements) {
    try (var writer = newBulkWriter()) {
      for (var element : elements) {
        writer.put(element);
      }
    }
  }

  public void deleteNode(long nodeId) {
    nodes.remove(nodeId);
  }

  public void deleteWay(long wayId) {
    ways.remove(wayId);
  }

  public void deleteRelation(long relationId) {
    var previous = relations.remove(relationId);
    if (previous != null) {
      unindexRelation(previous);
    }
  }

  private void unindexRelation(OsmElement.Relation relation) {
    for (var member : relation.members()) {
      if (member.type() == OsmElement.Type.WAY) {
        removeParent(waysToParentRelation, member.ref(), relation.id());
      }
    }
  }

  private static void addParent(Map<Long, LongArrayList> index, long child, long parent) {
    var parents = index.computeIfAbsent(child, c -> new LongArrayList());
    if (!parents.contains(parent)) {
      parents.add(parent);
    }
  }

  private static void removeParent(Map<Long, LongArrayList> index, long child, long parent) {
    var parents = index.get(child);
    if (parents != null) {
      parents.removeAll(parent);
      if (parents.isEmpty()) {
        index.remove(child);
      }
    }
  }

  @Override
  public OsmElement.Node getNode(long id) {
    return nodes.get(id);
  }

  @Override
  public OsmElement.Way getWay(long id) {
    return ways.get(id);
  }

  @Override
  public OsmElement.Relation getRelation(long id) {
    return relations.get(id);
  }

  @Override
  public WayComplete getWayComplete(long wayId) {
    var way = ways.get(wayId);
    if (way == null) {
      return null;
    }
    Map<Long, OsmElement.Node> wayNodes = new HashMap<>();
    for (var nodeId : way.nodes()) {
      var node = nodes.get(nodeId.value);
      if (node != null) {
        wayNodes.put(node.id(), node);
      }
    }
    return new WayComplete(way, wayNodes);
  }

  @Override
  public List<OsmElement.Relation> getRelationsForWay(long wayId) {
    return resolveRelations(waysToParentRelation.get(wayId));
  }

  private List<OsmElement.Relation> resolveRelations(LongArrayList ids) {
    List<OsmElement.Relation> result = new ArrayList<>();
    if (ids != null) {
      for (var id : ids) {
        var relation = relations.get(id.value);
        if (relation != null) {
          result.add(relation);
        }
      }
    }
    return result;
  }

  /** Returns every node, then every way, then every relation, each sorted by ID. */
  public List<OsmElement> elements() {
    List<OsmElement> result = new ArrayList<>(nodes.size() + ways.size() + relations.size());
    result.addAll(nodes.values());
    result.addAll(ways.values());
    result.addAll(relations.values());
    return result;
  }
}
