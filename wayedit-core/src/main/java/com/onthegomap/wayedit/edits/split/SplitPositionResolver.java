package com.onthegomap.wayedit.edits.split;

import com.onthegomap.wayedit.edits.ConflictException;
import com.onthegomap.wayedit.geo.GeoUtils;
import com.onthegomap.wayedit.geo.LatLon;
import com.onthegomap.wayedit.mapdata.WayComplete;
import com.onthegomap.wayedit.osm.OsmElement;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts {@link SplitRequest SplitRequests} into {@link WaySplit WaySplits} against the current node list of a way.
 * <p>
 * The result is sorted from the start to the end of the way because inserting a node shifts the index of every node
 * after it.
 */
public class SplitPositionResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(SplitPositionResolver.class);

  private SplitPositionResolver() {}

  /**
   * Returns the position of every node of the way, in order.
   *
   * @throws ConflictException if a node of the way is missing from {@code completeWay}
   */
  public static List<LatLon> positions(WayComplete completeWay) throws ConflictException {
    var way = completeWay.way();
    List<LatLon> result = new ArrayList<>(way.nodes().size());
    for (var nodeId : way.nodes()) {
      var node = completeWay.getNode(nodeId.value);
      if (node == null) {
        throw new ConflictException("unresolvable", "Node #" + nodeId.value + " of way #" + way.id() + " is missing");
      }
      result.add(node.position());
    }
    return result;
  }

  /**
   * Returns the distinct splits for {@code requests} sorted from the start to the end of {@code way}.
   *
   * @param way       the way to split
   * @param positions position of each node of {@code way}
   * @param requests  where to split, in any order
   * @throws ConflictException if a request does not match the geometry of {@code way}
   */
  public static List<WaySplit> resolve(OsmElement.Way way, List<LatLon> positions, List<SplitRequest> requests)
    throws ConflictException {
    List<WaySplit> result = new ArrayList<>(requests.size());
    for (var request : requests) {
      result.add(resolve(way, positions, request));
    }
    // stable, so equal splits keep their input order
    result.sort(WaySplit.FRONT_TO_BACK);
    List<WaySplit> distinct = List.copyOf(new LinkedHashSet<>(result));
    LOGGER.debug("Way #{}: resolved {} to {}", way.id(), requests, distinct);
    return distinct;
  }

  static WaySplit resolve(OsmElement.Way way, List<LatLon> positions, SplitRequest request)
    throws ConflictException {
    if (request instanceof SplitRequest.AtPoint point) {
      int index = positions.indexOf(point.position());
      if (index < 0) {
        throw new ConflictException("unresolvable",
          "Node at split position " + point.position() + " of way #" + way.id() + " has been moved or removed");
      }
      return atIndex(way, index);
    } else if (request instanceof SplitRequest.AtNodeIndex nodeIndex) {
      if (nodeIndex.index() >= positions.size()) {
        throw new ConflictException("unresolvable",
          "Way #" + way.id() + " has no node at index " + nodeIndex.index());
      }
      return atIndex(way, nodeIndex.index());
    } else if (request instanceof SplitRequest.AtLinePosition line) {
      int index = indexOfSegment(positions, line.first(), line.second());
      if (index < 0) {
        throw new ConflictException("unresolvable",
          "Segment " + line.first() + " to " + line.second() + " of way #" + way.id() + " has been changed");
      }
      return atLinePosition(way, positions, index, line.position());
    } else if (request instanceof SplitRequest.AtSegment segment) {
      if (segment.index() >= positions.size() - 1) {
        throw new ConflictException("unresolvable",
          "Way #" + way.id() + " has no segment at index " + segment.index());
      }
      return atLinePosition(way, positions, segment.index(), segment.position());
    }
    throw new IllegalArgumentException("Unrecognized split request: " + request);
  }

  private static WaySplit atIndex(OsmElement.Way way, int index) throws ConflictException {
    int last = way.nodes().size() - 1;
    if (way.isClosed()) {
      // first and last node of a ring are the same node
      return new WaySplit.AtIndex(index == last ? 0 : index);
    } else if (index == 0 || index == last) {
      throw new ConflictException("unresolvable", "Cannot split way #" + way.id() + " at its end node");
    }
    return new WaySplit.AtIndex(index);
  }

  /** A point that projects onto or beyond an end of the segment splits at that existing node instead. */
  private static WaySplit atLinePosition(OsmElement.Way way, List<LatLon> positions, int index, LatLon position)
    throws ConflictException {
    LatLon start = positions.get(index);
    LatLon end = positions.get(index + 1);
    double fraction = GeoUtils.fractionAlongSegment(start, end, position);
    if (fraction <= 0) {
      return atIndex(way, index);
    } else if (fraction >= 1) {
      return atIndex(way, index + 1);
    }
    return new WaySplit.AtLinePosition(index, fraction, GeoUtils.interpolate(start, end, fraction));
  }

  /** Returns the index of the first node of the first segment between {@code a} and {@code b} in either direction. */
  private static int indexOfSegment(List<LatLon> positions, LatLon a, LatLon b) {
    for (int i = 0; i < positions.size() - 1; i++) {
      LatLon start = positions.get(i);
      LatLon end = positions.get(i + 1);
      if ((start.equals(a) && end.equals(b)) || (start.equals(b) && end.equals(a))) {
        return i;
      }
    }
    return -1;
  }
}
