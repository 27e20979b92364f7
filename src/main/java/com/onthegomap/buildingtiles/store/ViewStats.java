package com.onthegomap.buildingtiles.store;

/**
 * Aggregate statistics of the buildings whose bounding box overlaps a region.
 *
 * @param count number of buildings
 * @param area  sum of the building footprint areas in EPSG:3857 square meters
 */
public record ViewStats(long count, double area) {

  public static final ViewStats EMPTY = new ViewStats(0, 0);
}
