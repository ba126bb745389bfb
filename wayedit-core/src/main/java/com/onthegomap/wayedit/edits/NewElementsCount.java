package com.onthegomap.wayedit.edits;

/** Upper bound of how many elements of each type an edit creates, known before the edit is applied. */
public record NewElementsCount(int nodes, int ways, int relations) {}
