package com.onthegomap.buildingtiles.view;

import net.jcip.annotations.Immutable;
import org.locationtech.jts.geom.Envelope;

/**
 * The region of the map a client is looking at.
 *
 * @param north northern latitude
 * @param south southern latitude
 * @param east  eastern longitude
 * @param west  western longitude
 * @param zoom  map zoom level, or {@code null} if the client did not send one
 */
@Immutable
public record Viewport(double north, double south, double east, double west, Double zoom) {

  /**
   * Returns the viewport as an envelope where {@code minX/maxX} are longitudes and {@code minY/maxY} latitudes.
   * <p>
   * Expects {@code west <= east}. The update-view endpoint rejects views that cross the antimeridian.
   */
  public Envelope lonLatBounds() {
    return new Envelope(west, east, south, north);
  }
}
