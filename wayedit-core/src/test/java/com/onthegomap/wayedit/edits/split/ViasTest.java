package com.onthegomap.wayedit.edits.split;

import static com.onthegomap.wayedit.TestUtils.relation;
import static com.onthegomap.wayedit.TestUtils.way;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.carrotsearch.hppc.LongHashSet;
import com.onthegomap.wayedit.osm.OsmElement;
import com.onthegomap.wayedit.osm.OsmElement.Relation.Member;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ViasTest {

  private static final Map<Long, OsmElement.Way> WAYS = Map.of(
    30L, way(30, 5, 6, 7),
    31L, way(31, 7, 8)
  );

  private static Vias of(OsmElement.Relation relation) {
    return Vias.of(relation, WAYS::get);
  }

  @Test
  void testNoVia() {
    assertSame(Vias.NONE, of(relation(1, Map.of("type", "restriction"), Member.way(10, "from"))));
  }

  @Test
  void testViaNode() {
    assertEquals(new Vias.ViaNodes(LongHashSet.from(5)), of(relation(1, Map.of("type", "restriction"),
      Member.way(10, "from"),
      Member.node(5, "via")
    )));
  }

  @Test
  void testViaWaysContributeTheirEnds() {
    assertEquals(new Vias.ViaNodes(LongHashSet.from(5, 7, 8)), of(relation(1, Map.of("type", "restriction"),
      Member.way(30, "via"),
      Member.way(31, "via")
    )));
  }

  @Test
  void testUnknownViaWayIsIgnored() {
    assertSame(Vias.NONE, of(relation(1, Map.of("type", "restriction"), Member.way(99, "via"))));
  }

  @Test
  void testDestinationSign() {
    var intersectionAndSign = relation(1, Map.of("type", "destination_sign"),
      Member.node(1, "intersection"),
      Member.node(2, "sign"),
      Member.node(3, "via")
    );
    assertEquals(new Vias.ViaNodes(LongHashSet.from(1)), of(intersectionAndSign));
    var onlySign = relation(1, Map.of("type", "destination_sign"), Member.node(2, "sign"));
    assertEquals(new Vias.ViaNodes(LongHashSet.from(2)), of(onlySign));
  }

  @Test
  void testTouchesEndOf() {
    var via = new Vias.ViaNodes(LongHashSet.from(3));
    assertTrue(via.touchesEndOf(way(1, 1, 2, 3)));
    assertTrue(via.touchesEndOf(way(1, 3, 4)));
    assertFalse(via.touchesEndOf(way(1, 2, 3, 4)));
  }
}
