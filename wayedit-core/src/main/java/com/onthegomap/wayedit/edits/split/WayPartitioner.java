package com.onthegomap.wayedit.edits.split;

import com.carrotsearch.hppc.IntArrayList;
import com.carrotsearch.hppc.LongArrayList;
import com.onthegomap.wayedit.mapdata.ElementIdProvider;
import com.onthegomap.wayedit.osm.OsmElement;
import com.onthegomap.wayedit.util.Lists;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cuts a way into pieces at a list of {@link WaySplit WaySplits}.
 * <p>
 * One of the pieces keeps the ID and version of the original way so it inherits its history, the others become new
 * ways.
 */
public class WayPartitioner {

  private static final Logger LOGGER = LoggerFactory.getLogger(WayPartitioner.class);

  private WayPartitioner() {}

  /**
   * The result of splitting a way.
   *
   * @param createdNodes nodes inserted into the way at the split positions
   * @param ways         the pieces of the way in order from its start to its end
   */
  public record Result(List<OsmElement.Node> createdNodes, List<OsmElement.Way> ways) {}

  /**
   * Splits {@code way} at {@code splits}.
   *
   * @param way        the way to split, not modified
   * @param splits     distinct splits sorted from the start to the end of the way
   * @param idProvider source of IDs for new nodes and ways
   */
  public static Result split(OsmElement.Way way, List<WaySplit> splits, ElementIdProvider idProvider) {
    LongArrayList nodeIds = new LongArrayList(way.nodes());
    IntArrayList splitAtIndices = new IntArrayList(splits.size());
    List<OsmElement.Node> createdNodes = new ArrayList<>();

    // every inserted node shifts the index of all nodes after it
    int insertedNodeCount = 0;
    for (var split : splits) {
      if (split instanceof WaySplit.AtIndex atIndex) {
        splitAtIndices.add(atIndex.index() + insertedNodeCount);
      } else if (split instanceof WaySplit.AtLinePosition atLine) {
        var node = new OsmElement.Node(idProvider.nextNodeId(), 0, Map.of(), atLine.position());
        createdNodes.add(node);
        int nodeIndex = atLine.insertIndex() + insertedNodeCount;
        nodeIds.insert(nodeIndex, node.id());
        splitAtIndices.add(nodeIndex);
        insertedNodeCount++;
      }
    }

    List<LongArrayList> chunks = splitIntoChunks(way, nodeIds, splitAtIndices);
    int indexOfChunkToKeep = Lists.indexOfMaxBy(chunks, LongArrayList::size);
    Map<String, String> tags = Map.copyOf(TagsAfterSplit.filter(way.tags()));

    List<OsmElement.Way> result = new ArrayList<>(chunks.size());
    for (int i = 0; i < chunks.size(); i++) {
      if (i == indexOfChunkToKeep) {
        result.add(new OsmElement.Way(way.id(), way.version(), tags, chunks.get(i)));
      } else {
        result.add(new OsmElement.Way(idProvider.nextWayId(), 0, tags, chunks.get(i)));
      }
    }
    LOGGER.debug("Way #{}: split into {} with {} new nodes", way.id(),
      result.stream().map(OsmElement.Way::id).toList(), createdNodes.size());
    return new Result(createdNodes, result);
  }

  /**
   * Splits the node list at {@code indices}. For a closed way the piece that ends at the former start node is joined
   * to the piece that starts there, so a ring split at 2 nodes results in 2 pieces, not 3.
   */
  static List<LongArrayList> splitIntoChunks(OsmElement.Way way, LongArrayList nodeIds, IntArrayList indices) {
    List<LongArrayList> chunks = Lists.splitIntoChunks(nodeIds, indices);
    if (way.isClosed() && chunks.size() > 1) {
      LongArrayList first = chunks.get(0);
      LongArrayList last = chunks.get(chunks.size() - 1);
      if (first.get(0) == last.get(last.size() - 1)) {
        chunks.remove(chunks.size() - 1);
        LongArrayList joined = Lists.slice(last, 0, last.size() - 1);
        joined.addAll(first);
        chunks.set(0, joined);
      }
    }
    return chunks;
  }
}
