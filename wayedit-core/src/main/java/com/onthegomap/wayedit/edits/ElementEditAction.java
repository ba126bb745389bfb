package com.onthegomap.wayedit.edits;

import com.onthegomap.wayedit.mapdata.ElementIdProvider;
import com.onthegomap.wayedit.mapdata.MapDataRepository;

/** An edit to map data that is re-applied to the latest state of the data right before it gets uploaded. */
public interface ElementEditAction {

  /** How many elements of each type this action creates, so that IDs can be reserved up front. */
  NewElementsCount newElementsCount();

  /**
   * Applies this action to the current state of the element with {@code elementId} and returns the elements to
   * upload. Nothing is written to {@code mapData}.
   *
   * @throws ConflictException if the current state is incompatible with this action
   */
  ElementUpdates createUpdates(long elementId, MapDataRepository mapData, ElementIdProvider idProvider)
    throws ConflictException;
}
