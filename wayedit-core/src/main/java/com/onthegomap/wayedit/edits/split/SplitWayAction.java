package com.onthegomap.wayedit.edits.split;

import com.onthegomap.wayedit.edits.ConflictException;
import com.onthegomap.wayedit.edits.ElementEditAction;
import com.onthegomap.wayedit.edits.ElementUpdates;
import com.onthegomap.wayedit.edits.NewElementsCount;
import com.onthegomap.wayedit.mapdata.ElementIdProvider;
import com.onthegomap.wayedit.mapdata.MapDataRepository;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Action that splits a way and updates every relation it is a member of.
 * <p>
 * The first and last node of the way at the time the split was made are kept to decide if the current version of
 * the way is still compatible with the split: if it was shortened or extended on either end it is not, since it may
 * already have been split at a similar spot. If it was just reversed, that's ok.
 *
 * @param splits                 where to split the way, at least one, at least two for a closed way
 * @param originalWayFirstNodeId first node of the way when the split was made
 * @param originalWayLastNodeId  last node of the way when the split was made
 */
public record SplitWayAction(
  List<SplitRequest> splits,
  long originalWayFirstNodeId,
  long originalWayLastNodeId
) implements ElementEditAction {

  private static final Logger LOGGER = LoggerFactory.getLogger(SplitWayAction.class);

  public SplitWayAction {
    if (splits == null || splits.isEmpty()) {
      throw new IllegalArgumentException("Must specify at least one split position");
    }
    splits = List.copyOf(splits);
  }

  @Override
  public NewElementsCount newElementsCount() {
    int nodes = (int) splits.stream().filter(SplitRequest::createsNode).count();
    return new NewElementsCount(nodes, splits.size() + 1, 0);
  }

  @Override
  public ElementUpdates createUpdates(long wayId, MapDataRepository mapData, ElementIdProvider idProvider)
    throws ConflictException {
    var completeWay = mapData.getWayComplete(wayId);
    if (completeWay == null) {
      throw new ConflictException("deleted", "Way #" + wayId + " has been deleted");
    }
    var way = completeWay.way();

    boolean sameEndpoints = way.firstNode() == originalWayFirstNodeId && way.lastNode() == originalWayLastNodeId;
    boolean reversed = way.firstNode() == originalWayLastNodeId && way.lastNode() == originalWayFirstNodeId;
    if (!sameEndpoints && !reversed) {
      throw new ConflictException("changed",
        "Way #" + wayId + " has been changed and the conflict cannot be solved automatically");
    }
    if (way.isClosed() && splits.size() < 2) {
      throw new ConflictException("closed_way", "Must specify at least two split positions for closed way #" + wayId);
    }

    var plan = SplitPositionResolver.resolve(way, SplitPositionResolver.positions(completeWay), splits);
    if (way.isClosed() && plan.size() < 2) {
      throw new ConflictException("closed_way", "Split positions of closed way #" + wayId + " are all the same");
    }
    var partition = WayPartitioner.split(way, plan, idProvider);
    var relations = RelationRepairer.repair(way, partition.ways(), mapData);

    LOGGER.debug("Way #{}: split into {} ways with {} new nodes, updated {} relations", wayId,
      partition.ways().size(), partition.createdNodes().size(), relations.size());
    return new ElementUpdates(partition.createdNodes(), partition.ways(), relations);
  }
}
