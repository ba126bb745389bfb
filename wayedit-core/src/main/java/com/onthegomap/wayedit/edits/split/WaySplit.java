package com.onthegomap.wayedit.edits.split;

import com.onthegomap.wayedit.geo.LatLon;
import java.util.Comparator;

/**
 * A {@link SplitRequest} resolved against the node list of the way it applies to.
 */
public sealed interface WaySplit {

  /**
   * Orders splits from the start to the end of the way. A split at a node sorts before a new node inserted right after
   * it.
   */
  Comparator<WaySplit> FRONT_TO_BACK = Comparator
    .comparingInt(WaySplit::index)
    .thenComparingDouble(WaySplit::fraction)
    .thenComparingInt(split -> split instanceof AtIndex ? 0 : 1);

  /** Index of the node this split is at, or that starts the segment this split is on. */
  int index();

  /** Fraction along the segment that starts at {@link #index()}, 0 for splits at existing nodes. */
  double fraction();

  /** Split right at the existing node at {@code index}. */
  record AtIndex(int index) implements WaySplit {

    @Override
    public double fraction() {
      return 0;
    }
  }

  /** Insert a new node at {@code position} between node {@code index} and {@code index + 1}, and split there. */
  record AtLinePosition(int index, double fraction, LatLon position) implements WaySplit {

    /** Index the new node gets when inserted into the unmodified way. */
    int insertIndex() {
      return index + 1;
    }
  }
}
