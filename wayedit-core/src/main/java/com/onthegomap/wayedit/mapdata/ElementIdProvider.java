package com.onthegomap.wayedit.mapdata;

/**
 * Hands out IDs for elements that are created by an edit.
 * <p>
 * Each call must return an ID that has not been returned before and that does not collide with an ID of an existing
 * element of the same type.
 */
public interface ElementIdProvider {

  /**
   * Returns a provider that counts down from {@code start} independently for each element type, so with
   * {@code start = -1} the first new node is -1, the second -2, and so on.
   */
  static ElementIdProvider sequential(long start) {
    if (start >= 0) {
      throw new IllegalArgumentException("IDs for new elements must be negative, got " + start);
    }
    return new Sequential(start);
  }

  long nextNodeId();

  long nextWayId();

  long nextRelationId();

  class Sequential implements ElementIdProvider {

    private long nextNode;
    private long nextWay;
    private long nextRelation;

    private Sequential(long start) {
      this.nextNode = start;
      this.nextWay = start;
      this.nextRelation = start;
    }

    @Override
    public long nextNodeId() {
      return nextNode--;
    }

    @Override
    public long nextWayId() {
      return nextWay--;
    }

    @Override
    public long nextRelationId() {
      return nextRelation--;
    }
  }
}
