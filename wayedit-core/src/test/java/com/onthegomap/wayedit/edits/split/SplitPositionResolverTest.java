package com.onthegomap.wayedit.edits.split;

import static com.onthegomap.wayedit.TestUtils.assertSamePosition;
import static com.onthegomap.wayedit.TestUtils.position;
import static com.onthegomap.wayedit.TestUtils.way;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.onthegomap.wayedit.TestUtils;
import com.onthegomap.wayedit.edits.ConflictException;
import com.onthegomap.wayedit.geo.LatLon;
import com.onthegomap.wayedit.mapdata.WayComplete;
import com.onthegomap.wayedit.osm.OsmElement;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SplitPositionResolverTest {

  private final OsmElement.Way open = way(1, 1, 2, 3, 4, 5);
  private final OsmElement.Way closed = way(2, 1, 2, 3, 4, 1);

  private static List<LatLon> positionsOf(OsmElement.Way way) {
    List<LatLon> result = new ArrayList<>();
    for (var node : way.nodes()) {
      result.add(position(node.value));
    }
    return result;
  }

  private List<WaySplit> resolve(OsmElement.Way way, SplitRequest... requests) throws ConflictException {
    return SplitPositionResolver.resolve(way, positionsOf(way), List.of(requests));
  }

  @Test
  void testPositions() throws ConflictException {
    var nodes = TestUtils.nodes(1, 2, 3, 4, 5);
    Map<Long, OsmElement.Node> byId = new HashMap<>();
    nodes.forEach(node -> byId.put(node.id(), node));
    assertEquals(positionsOf(open), SplitPositionResolver.positions(new WayComplete(open, byId)));
  }

  @Test
  void testPositionsWithMissingNode() {
    var nodes = Map.of(1L, TestUtils.node(1), 2L, TestUtils.node(2));
    var exception = assertThrows(ConflictException.class,
      () -> SplitPositionResolver.positions(new WayComplete(open, nodes)));
    assertEquals("unresolvable", exception.stat());
  }

  @Test
  void testAtPoint() throws ConflictException {
    assertEquals(List.of(new WaySplit.AtIndex(2)), resolve(open, new SplitRequest.AtPoint(position(3))));
  }

  @Test
  void testAtPointThatMoved() {
    var exception = assertThrows(ConflictException.class,
      () -> resolve(open, new SplitRequest.AtPoint(new LatLon(1, 1))));
    assertEquals("unresolvable", exception.stat());
  }

  @Test
  void testAtNodeIndex() throws ConflictException {
    assertEquals(List.of(new WaySplit.AtIndex(3)), resolve(open, new SplitRequest.AtNodeIndex(3)));
  }

  @ParameterizedTest
  @ValueSource(ints = {0, 4, 5, 100})
  void testCannotSplitOpenWayAtEndOrOutside(int index) {
    assertThrows(ConflictException.class, () -> resolve(open, new SplitRequest.AtNodeIndex(index)));
  }

  @Test
  void testEndOfClosedWayIsItsStart() throws ConflictException {
    assertEquals(List.of(new WaySplit.AtIndex(0), new WaySplit.AtIndex(2)), resolve(closed,
      new SplitRequest.AtNodeIndex(4),
      new SplitRequest.AtNodeIndex(2)
    ));
    // node 1 is the first position that matches
    assertEquals(List.of(new WaySplit.AtIndex(0)), resolve(closed, new SplitRequest.AtPoint(position(1))));
  }

  @Test
  void testAtLinePosition() throws ConflictException {
    var splits = resolve(open, new SplitRequest.AtLinePosition(position(2), position(3), new LatLon(0.0001, 0.00225)));
    assertEquals(1, splits.size());
    var split = (WaySplit.AtLinePosition) splits.get(0);
    assertEquals(1, split.index());
    assertEquals(0.25, split.fraction(), 1e-9);
    assertSamePosition(new LatLon(0, 0.00225), split.position());
  }

  @Test
  void testAtLinePositionOnReversedSegment() throws ConflictException {
    var forward = resolve(open, new SplitRequest.AtLinePosition(position(3), position(4), new LatLon(0, 0.0035)));
    var backward = resolve(open, new SplitRequest.AtLinePosition(position(4), position(3), new LatLon(0, 0.0035)));
    assertEquals(forward, backward);
    assertEquals(2, forward.get(0).index());
  }

  @Test
  void testAtLinePositionOnSegmentThatChanged() {
    var exception = assertThrows(ConflictException.class,
      () -> resolve(open, new SplitRequest.AtLinePosition(position(2), position(4), position(3))));
    assertEquals("unresolvable", exception.stat());
  }

  @Test
  void testAtSegment() throws ConflictException {
    var splits = resolve(open, new SplitRequest.AtSegment(3, new LatLon(0, 0.0045)));
    var split = (WaySplit.AtLinePosition) splits.get(0);
    assertEquals(3, split.index());
    assertEquals(0.5, split.fraction(), 1e-9);
    assertThrows(ConflictException.class, () -> resolve(open, new SplitRequest.AtSegment(4, position(5))));
  }

  @Test
  void testSortedFromStartToEnd() throws ConflictException {
    var splits = resolve(open,
      new SplitRequest.AtNodeIndex(3),
      new SplitRequest.AtSegment(2, new LatLon(0, 0.0035)),
      new SplitRequest.AtSegment(0, new LatLon(0, 0.0015)),
      new SplitRequest.AtPoint(position(2))
    );
    assertEquals(List.of(0, 1, 2, 3), splits.stream().map(WaySplit::index).toList());
    assertEquals(List.of(
      WaySplit.AtLinePosition.class,
      WaySplit.AtIndex.class,
      WaySplit.AtLinePosition.class,
      WaySplit.AtIndex.class
    ), splits.stream().map(Object::getClass).toList());
  }

  @Test
  void testLinePositionBeyondSegmentEndSplitsAtExistingNode() throws ConflictException {
    // segment 2-3 spans 0.002 to 0.003
    assertEquals(List.of(new WaySplit.AtIndex(2)),
      resolve(open, new SplitRequest.AtSegment(1, new LatLon(0, 0.0035))));
    assertEquals(List.of(new WaySplit.AtIndex(2)), resolve(open, new SplitRequest.AtSegment(1, position(3))));
    assertEquals(List.of(new WaySplit.AtIndex(1)),
      resolve(open, new SplitRequest.AtLinePosition(position(2), position(3), new LatLon(0.001, 0.0015))));
  }

  @Test
  void testLinePositionAtExistingNodeMergesWithSplitAtThatNode() throws ConflictException {
    assertEquals(List.of(new WaySplit.AtIndex(2)), resolve(open,
      new SplitRequest.AtSegment(2, position(3)),
      new SplitRequest.AtNodeIndex(2)
    ));
  }

  @Test
  void testLinePositionBeyondEndOfOpenWayIsAConflict() {
    assertThrows(ConflictException.class,
      () -> resolve(open, new SplitRequest.AtSegment(0, new LatLon(0, 0.0005))));
    assertThrows(ConflictException.class,
      () -> resolve(open, new SplitRequest.AtSegment(3, new LatLon(0, 0.006))));
  }

  @Test
  void testLinePositionBeyondEndOfClosedWayIsItsStart() throws ConflictException {
    // last segment of the ring runs from node 4 back to node 1
    assertEquals(List.of(new WaySplit.AtIndex(0)),
      resolve(closed, new SplitRequest.AtSegment(3, new LatLon(0, 0.0005))));
  }

  @Test
  void testRemovesDuplicates() throws ConflictException {
    assertEquals(List.of(new WaySplit.AtIndex(1)), resolve(open,
      new SplitRequest.AtNodeIndex(1),
      new SplitRequest.AtPoint(position(2)),
      new SplitRequest.AtNodeIndex(1)
    ));
  }
}
