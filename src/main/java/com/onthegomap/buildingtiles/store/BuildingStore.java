package com.onthegomap.buildingtiles.store;

import java.util.List;
import org.locationtech.jts.geom.Envelope;

/**
 * A read-only source of building footprints that can be filtered by bounding box.
 * <p>
 * Each thread queries through its own {@link Handle} obtained from {@link #handle()}.
 */
public interface BuildingStore extends AutoCloseable {

  /** Returns the query handle owned by the calling thread, creating it on first use. */
  Handle handle();

  @Override
  void close();

  /** Queries issued from a single thread. */
  interface Handle {

    /**
     * Returns every building whose bounding box overlaps {@code lonLatBounds}, where {@code minX/maxX} are longitudes
     * and {@code minY/maxY} are latitudes.
     * <p>
     * This is a bounding box prefilter, geometries are not tested against the envelope.
     *
     * @throws StoreException if the query fails
     */
    List<Building> queryInBBox(Envelope lonLatBounds);

    /**
     * Returns the count and total web mercator area of the buildings that {@link #queryInBBox(Envelope)} would
     * return.
     *
     * @throws StoreException if the query fails
     */
    ViewStats aggregateInBBox(Envelope lonLatBounds);
  }
}
