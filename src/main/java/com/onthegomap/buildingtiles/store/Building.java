package com.onthegomap.buildingtiles.store;

import java.util.LinkedHashMap;
import java.util.Map;
import org.locationtech.jts.geom.Geometry;

/**
 * A building footprint read from the store.
 *
 * @param id            stable identifier of the building
 * @param geometry      polygon or multipolygon in latitude/longitude coordinates
 * @param name          display name, or {@code null}
 * @param height        height in meters, or {@code null}
 * @param buildingClass building class like {@code residential}, or {@code null}
 * @param subtype       building subtype, or {@code null}
 * @param numFloors     number of floors, or {@code null}
 */
public record Building(
  String id,
  Geometry geometry,
  String name,
  Double height,
  String buildingClass,
  String subtype,
  Integer numFloors
) {

  /** Returns the attributes written to vector tiles in a stable order, leaving out the ones that are missing. */
  public Map<String, Object> tileAttrs() {
    Map<String, Object> attrs = new LinkedHashMap<>();
    putIfPresent(attrs, "id", id);
    putIfPresent(attrs, "name", name);
    putIfPresent(attrs, "height", height);
    putIfPresent(attrs, "class", buildingClass);
    return attrs;
  }

  private static void putIfPresent(Map<String, Object> attrs, String key, Object value) {
    if (value != null) {
      attrs.put(key, value);
    }
  }
}
