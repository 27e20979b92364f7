package com.onthegomap.buildingtiles.geo;

import com.onthegomap.buildingtiles.stats.Stats;
import java.util.ArrayList;
import java.util.List;
import java.util.function.DoubleUnaryOperator;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryCollection;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.geom.TopologyException;
import org.locationtech.jts.geom.impl.PackedCoordinateSequence;
import org.locationtech.jts.geom.impl.PackedCoordinateSequenceFactory;
import org.locationtech.jts.geom.util.GeometryFixer;
import org.locationtech.jts.geom.util.GeometryTransformer;
import org.locationtech.jts.io.WKBReader;
import org.locationtech.jts.precision.GeometryPrecisionReducer;

/**
 * Projection and geometry helpers shared by the store and the tile encoder.
 * <p>
 * "World" coordinates are Web Mercator scaled to the unit square: {@code (0, 0)} is the north-west corner of the map
 * and {@code (1, 1)} the south-east corner.
 */
public class GeoUtils {

  /** Grid of a 256 pixel tile with 4096 extent, 1/16 pixel per step. */
  public static final PrecisionModel TILE_PRECISION = new PrecisionModel(4096d / 256d);
  public static final GeometryFactory JTS_FACTORY = new GeometryFactory(PackedCoordinateSequenceFactory.DOUBLE_FACTORY);
  public static final Geometry EMPTY_GEOMETRY = JTS_FACTORY.createGeometryCollection();
  public static final Polygon EMPTY_POLYGON = JTS_FACTORY.createPolygon();

  /** EPSG:3857 semi-major axis. */
  private static final double EARTH_RADIUS_METERS = 6_378_137;
  private static final double WORLD_SIZE_METERS = 2 * Math.PI * EARTH_RADIUS_METERS;
  // latitudes beyond the mercator limit map slightly outside the unit square instead of to infinity
  private static final double NORTH_LIMIT = getWorldLat(-0.1);
  private static final double SOUTH_LIMIT = getWorldLat(1.1);

  private static final GeometryTransformer LON_LAT_TO_WORLD = new PerAxisTransformer(
    GeoUtils::getWorldX,
    GeoUtils::getWorldY
  );

  private GeoUtils() {}

  /** Applies one function to every x and another to every y, producing 2D packed coordinates. */
  private static class PerAxisTransformer extends GeometryTransformer {

    private final DoubleUnaryOperator xFn;
    private final DoubleUnaryOperator yFn;

    PerAxisTransformer(DoubleUnaryOperator xFn, DoubleUnaryOperator yFn) {
      this.xFn = xFn;
      this.yFn = yFn;
    }

    @Override
    protected CoordinateSequence transformCoordinates(CoordinateSequence coords, Geometry parent) {
      int size = coords.size();
      double[] packed = new double[size * 2];
      for (int i = 0; i < size; i++) {
        packed[i * 2] = xFn.applyAsDouble(coords.getX(i));
        packed[i * 2 + 1] = yFn.applyAsDouble(coords.getY(i));
      }
      return new PackedCoordinateSequence.Double(packed, 2, 0);
    }
  }

  /** Returns {@code geom} projected from lon/lat degrees to world coordinates. */
  public static Geometry latLonToWorldCoords(Geometry geom) {
    return LON_LAT_TO_WORLD.transform(geom);
  }

  /** Returns {@code worldGeom} in pixels of {@code tile}, {@code (0, 0)} top-left to {@code (256, 256)}. */
  public static Geometry worldToTileCoords(Geometry worldGeom, TileCoord tile) {
    double tiles = tile.tilesPerAxis();
    double originX = tile.x();
    double originY = tile.y();
    return new PerAxisTransformer(
      x -> (x * tiles - originX) * 256d,
      y -> (y * tiles - originY) * 256d
    ).transform(worldGeom);
  }

  /** Longitude of world {@code x}, 0 and 1 being the antimeridian. */
  public static double getWorldLon(double x) {
    return x * 360 - 180;
  }

  /** Latitude of world {@code y}, 0 being the north edge of the map and 0.5 the equator. */
  public static double getWorldLat(double y) {
    return Math.toDegrees(Math.atan(Math.sinh(Math.PI * (1 - 2 * y))));
  }

  public static double getWorldX(double longitude) {
    return (longitude + 180) / 360;
  }

  /** World y of {@code latitude}, clamped to {@code [-0.1, 1.1]} near the poles. */
  public static double getWorldY(double latitude) {
    if (latitude >= NORTH_LIMIT) {
      return -0.1;
    } else if (latitude <= SOUTH_LIMIT) {
      return 1.1;
    }
    double sin = Math.sin(Math.toRadians(latitude));
    return 0.5 - Math.log((1 + sin) / (1 - sin)) / (4 * Math.PI);
  }

  /** Returns the EPSG:3857 area in square meters of a lon/lat geometry. */
  public static double webMercatorArea(Geometry lonLatGeom) {
    return latLonToWorldCoords(lonLatGeom).getArea() * WORLD_SIZE_METERS * WORLD_SIZE_METERS;
  }

  /** Returns a WKB reader producing geometries from {@link #JTS_FACTORY}. Readers are not thread-safe. */
  public static WKBReader wkbReader() {
    return new WKBReader(JTS_FACTORY);
  }

  /**
   * Rounds a pixel geometry to {@link #TILE_PRECISION}, repairing it first if it is invalid.
   * <p>
   * Repairs are counted as {@code <stage>_snap_fix_input}.
   *
   * @throws GeometryException if the geometry still can not be rounded after repair
   */
  public static Geometry snapAndFixPolygon(Geometry geom, Stats stats, String stage) throws GeometryException {
    Geometry input = geom;
    if (!input.isValid()) {
      stats.dataError(stage + "_snap_fix_input");
      input = GeometryFixer.fix(input);
    }
    try {
      return GeometryPrecisionReducer.reduce(input, TILE_PRECISION);
    } catch (TopologyException | IllegalArgumentException e) {
      stats.dataError(stage + "_snap_retry");
      try {
        return GeometryPrecisionReducer.reduce(GeometryFixer.fix(input), TILE_PRECISION);
      } catch (TopologyException | IllegalArgumentException retryError) {
        throw new GeometryException("snap_failed", "Unable to snap geometry to the tile grid", retryError);
      }
    }
  }

  /** Returns the non-empty polygons in {@code geom}, looking inside collections. */
  public static List<Polygon> polygons(Geometry geom) {
    List<Polygon> result = new ArrayList<>();
    addPolygons(geom, result);
    return result;
  }

  private static void addPolygons(Geometry geom, List<Polygon> into) {
    if (geom instanceof GeometryCollection collection) {
      for (int i = 0; i < collection.getNumGeometries(); i++) {
        addPolygons(collection.getGeometryN(i), into);
      }
    } else if (geom instanceof Polygon polygon && !polygon.isEmpty()) {
      into.add(polygon);
    }
  }

  /** Returns an empty polygon, the single polygon, or a multipolygon of {@code polys}. */
  public static Geometry combinePolygons(List<Polygon> polys) {
    return switch (polys.size()) {
      case 0 -> EMPTY_POLYGON;
      case 1 -> polys.get(0);
      default -> JTS_FACTORY.createMultiPolygon(polys.toArray(Polygon[]::new));
    };
  }
}
