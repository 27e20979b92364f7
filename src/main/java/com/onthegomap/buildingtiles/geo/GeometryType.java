package com.onthegomap.buildingtiles.geo;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Lineal;
import org.locationtech.jts.geom.Polygonal;
import org.locationtech.jts.geom.Puntal;
import vector_tile.VectorTileProto.Tile.GeomType;

/**
 * Geometry kinds of a vector tile feature.
 * <p>
 * Buildings are always {@link #POLYGON}, the other kinds exist so tiles from elsewhere can be decoded and rejected.
 */
public enum GeometryType {
  UNKNOWN(GeomType.UNKNOWN),
  POINT(GeomType.POINT),
  LINE(GeomType.LINESTRING),
  POLYGON(GeomType.POLYGON);

  private final GeomType wireType;

  GeometryType(GeomType wireType) {
    this.wireType = wireType;
  }

  public static GeometryType typeOf(Geometry geom) {
    if (geom instanceof Polygonal) {
      return POLYGON;
    } else if (geom instanceof Lineal) {
      return LINE;
    } else if (geom instanceof Puntal) {
      return POINT;
    }
    return UNKNOWN;
  }

  public static GeometryType valueOf(GeomType wireType) {
    for (GeometryType type : values()) {
      if (type.wireType == wireType) {
        return type;
      }
    }
    return UNKNOWN;
  }

  public GeomType asProtobufType() {
    return wireType;
  }
}
