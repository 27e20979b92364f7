package com.onthegomap.buildingtiles.geo;

import com.onthegomap.buildingtiles.VectorTile;
import com.onthegomap.buildingtiles.stats.Stats;
import java.util.ArrayList;
import java.util.List;
import net.jcip.annotations.ThreadSafe;
import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.Polygonal;
import org.locationtech.jts.geom.TopologyException;
import org.locationtech.jts.geom.util.GeometryFixer;
import org.locationtech.jts.operation.overlayng.OverlayNG;
import org.locationtech.jts.operation.overlayng.OverlayNGRobust;

/**
 * Turns a latitude/longitude building footprint into the pixel-space polygon that gets encoded into one tile.
 * <p>
 * The geometry is projected to web mercator, moved into the tile's 256x256 pixel space, clipped to the tile square
 * grown by a buffer, snapped to the 4096 grid of the encoded tile and oriented so that outer rings are
 * counter-clockwise and holes clockwise.
 */
@ThreadSafe
public class TileGeometryClipper {

  private final TileCoord tile;
  private final Envelope clipBounds;
  private final Geometry clipPolygon;
  private final Stats stats;

  /**
   * @param tile   the tile to clip to
   * @param buffer how far past the tile edge to keep geometries, in units of the 4096 tile extent
   * @param stats  where to record repaired or dropped geometries
   */
  public TileGeometryClipper(TileCoord tile, int buffer, Stats stats) {
    this.tile = tile;
    this.stats = stats;
    double pixels = buffer * 256d / VectorTile.EXTENT;
    this.clipBounds = new Envelope(-pixels, 256 + pixels, -pixels, 256 + pixels);
    this.clipPolygon = GeoUtils.JTS_FACTORY.toGeometry(clipBounds);
  }

  public TileCoord tile() {
    return tile;
  }

  /** Returns the clip rectangle in tile pixel coordinates. */
  public Envelope clipBounds() {
    return clipBounds;
  }

  /**
   * Returns {@code lonLatGeometry} clipped and snapped to this tile, or an empty polygon if nothing with a positive area
   * remains.
   *
   * @throws GeometryException if the input is not polygonal or cannot be repaired
   */
  public Geometry clip(Geometry lonLatGeometry) throws GeometryException {
    if (!(lonLatGeometry instanceof Polygonal)) {
      throw new GeometryException("not_polygon", "Expected a polygon but got " + lonLatGeometry.getGeometryType());
    }
    if (lonLatGeometry.isEmpty()) {
      return GeoUtils.EMPTY_POLYGON;
    }
    Geometry pixels = GeoUtils.worldToTileCoords(GeoUtils.latLonToWorldCoords(lonLatGeometry), tile);
    Envelope envelope = pixels.getEnvelopeInternal();
    if (!envelope.intersects(clipBounds)) {
      return GeoUtils.EMPTY_POLYGON;
    }
    Geometry clipped = clipBounds.contains(envelope) ? pixels : intersect(pixels);
    Geometry snapped = GeoUtils.snapAndFixPolygon(clipped, stats, "clip");

    List<Polygon> result = new ArrayList<>();
    for (Polygon part : GeoUtils.polygons(snapped)) {
      if (part.getArea() > 0) {
        result.add(orient(part));
      }
    }
    return GeoUtils.combinePolygons(result);
  }

  private Geometry intersect(Geometry pixels) throws GeometryException {
    try {
      return OverlayNGRobust.overlay(pixels, clipPolygon, OverlayNG.INTERSECTION);
    } catch (TopologyException e) {
      stats.dataError("clip_fix_input");
      try {
        return OverlayNGRobust.overlay(GeometryFixer.fix(pixels), clipPolygon, OverlayNG.INTERSECTION);
      } catch (TopologyException e2) {
        throw new GeometryException("clip_failed", "Unable to clip geometry to " + tile, e2);
      }
    }
  }

  /** Returns a copy of {@code polygon} with a counter-clockwise shell and clockwise holes. */
  static Polygon orient(Polygon polygon) {
    LinearRing shell = orient(polygon.getExteriorRing(), true);
    LinearRing[] holes = new LinearRing[polygon.getNumInteriorRing()];
    for (int i = 0; i < holes.length; i++) {
      holes[i] = orient(polygon.getInteriorRingN(i), false);
    }
    return GeoUtils.JTS_FACTORY.createPolygon(shell, holes);
  }

  private static LinearRing orient(LinearRing ring, boolean ccw) {
    return Orientation.isCCW(ring.getCoordinateSequence()) == ccw ? ring : (LinearRing) ring.reverse();
  }
}
