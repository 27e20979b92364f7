/* ****************************************************************
 *  Licensed to the Apache Software Foundation (ASF) under one
 *  or more contributor license agreements.  See the NOTICE file
 *  distributed with this work for additional information
 *  regarding copyright ownership.  The ASF licenses this file
 *  to you under the Apache License, Version 2.0 (the
 *  "License"); you may not use this file except in compliance
 *  with the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing,
 *  software distributed under the License is distributed on an
 *  "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 *  KIND, either express or implied.  See the License for the
 *  specific language governing permissions and limitations
 *  under the License.
 ****************************************************************/
package com.onthegomap.buildingtiles;

import com.carrotsearch.hppc.IntArrayList;
import com.google.common.primitives.Ints;
import com.google.protobuf.InvalidProtocolBufferException;
import com.onthegomap.buildingtiles.geo.GeoUtils;
import com.onthegomap.buildingtiles.geo.GeometryException;
import com.onthegomap.buildingtiles.geo.GeometryType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import net.jcip.annotations.NotThreadSafe;
import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateList;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Polygon;
import vector_tile.VectorTileProto;

/**
 * Builds the Mapbox Vector Tile for one tile of buildings.
 * <p>
 * Geometries passed to {@link #encodeGeometry(Geometry)} are in tile pixels, {@code (0, 0)} top-left to
 * {@code (256, 256)} bottom-right, and get scaled to a {@value #EXTENT} extent.
 *
 * @see <a href="https://github.com/mapbox/vector-tile-spec/tree/master/2.1">Mapbox Vector Tile Specification</a>
 */
@NotThreadSafe
public class VectorTile {

  public static final long NO_FEATURE_ID = 0;
  public static final int EXTENT = 4096;
  private static final double SCALE = EXTENT / 256d;

  private static final int MOVE_TO = 1;
  private static final int LINE_TO = 2;
  private static final int CLOSE_PATH = 7;

  // sorted so output bytes do not depend on insertion order of layers
  private final Map<String, LayerBuilder> layers = new TreeMap<>();

  static int zigZagEncode(int n) {
    return (n << 1) ^ (n >> 31);
  }

  private static int zigZagDecode(int n) {
    return (n >>> 1) ^ -(n & 1);
  }

  private static int command(int id, int count) {
    return (count << 3) | id;
  }

  /**
   * Returns the command array for a polygon or multipolygon in tile pixels.
   * <p>
   * Shells must wind counter-clockwise and holes clockwise with y pointing down, the way
   * {@link com.onthegomap.buildingtiles.geo.TileGeometryClipper} leaves them. Rings that collapse to fewer than 3
   * points on the 4096 grid are dropped, along with the holes of a dropped shell.
   *
   * @throws IllegalArgumentException if {@code geometry} is not polygonal
   */
  public static VectorGeometry encodeGeometry(Geometry geometry) {
    RingWriter writer = new RingWriter();
    if (geometry instanceof MultiPolygon multiPolygon) {
      for (int i = 0; i < multiPolygon.getNumGeometries(); i++) {
        writer.writePolygon((Polygon) multiPolygon.getGeometryN(i));
      }
    } else if (geometry instanceof Polygon polygon) {
      writer.writePolygon(polygon);
    } else {
      throw new IllegalArgumentException("Unsupported geometry type: " + geometry.getGeometryType());
    }
    return new VectorGeometry(writer.commands.toArray(), GeometryType.typeOf(geometry));
  }

  /**
   * Parses an encoded tile into its features. Geometries stay encoded until {@link VectorGeometry#decode()}.
   *
   * @throws IllegalStateException if {@code encoded} is not a vector tile protobuf
   */
  public static List<Feature> decode(byte[] encoded) {
    VectorTileProto.Tile tile;
    try {
      tile = VectorTileProto.Tile.parseFrom(encoded);
    } catch (InvalidProtocolBufferException e) {
      throw new IllegalStateException("Invalid vector tile", e);
    }
    List<Feature> result = new ArrayList<>();
    for (VectorTileProto.Tile.Layer layer : tile.getLayersList()) {
      List<Object> values = layer.getValuesList().stream().map(VectorTile::decodeValue).toList();
      for (VectorTileProto.Tile.Feature feature : layer.getFeaturesList()) {
        Map<String, Object> tags = new HashMap<>();
        for (int i = 0; i + 1 < feature.getTagsCount(); i += 2) {
          tags.put(layer.getKeys(feature.getTags(i)), values.get(feature.getTags(i + 1)));
        }
        VectorGeometry geometry = new VectorGeometry(
          Ints.toArray(feature.getGeometryList()),
          GeometryType.valueOf(feature.getType())
        );
        result.add(new Feature(layer.getName(), feature.getId(), geometry, tags));
      }
    }
    return result;
  }

  private static Object decodeValue(VectorTileProto.Tile.Value value) {
    if (value.hasStringValue()) {
      return value.getStringValue();
    } else if (value.hasDoubleValue()) {
      return value.getDoubleValue();
    } else if (value.hasFloatValue()) {
      return value.getFloatValue();
    } else if (value.hasSintValue()) {
      return value.getSintValue();
    } else if (value.hasIntValue()) {
      return value.getIntValue();
    } else if (value.hasUintValue()) {
      return value.getUintValue();
    } else if (value.hasBoolValue()) {
      return value.getBoolValue();
    }
    return null;
  }

  private static VectorTileProto.Tile.Value encodeValue(Object value) {
    var builder = VectorTileProto.Tile.Value.newBuilder();
    if (value instanceof Double d) {
      builder.setDoubleValue(d);
    } else if (value instanceof Float f) {
      builder.setFloatValue(f);
    } else if (value instanceof Integer || value instanceof Long) {
      builder.setSintValue(((Number) value).longValue());
    } else if (value instanceof Boolean b) {
      builder.setBoolValue(b);
    } else {
      builder.setStringValue(value.toString());
    }
    return builder.build();
  }

  /**
   * Appends {@code features} to the layer named {@code layerName}. Features without geometry are skipped, and so are
   * attributes with a null value.
   *
   * @return this tile for chaining
   */
  public VectorTile addLayerFeatures(String layerName, List<Feature> features) {
    for (Feature feature : features) {
      if (feature != null && !feature.geometry().isEmpty()) {
        layers.computeIfAbsent(layerName, name -> new LayerBuilder()).add(feature);
      }
    }
    return this;
  }

  public VectorTileProto.Tile toProto() {
    var tile = VectorTileProto.Tile.newBuilder();
    layers.forEach((name, layer) -> tile.addLayers(layer.build(name)));
    return tile.build();
  }

  /** Returns the uncompressed protobuf bytes, which are empty when the tile has no features. */
  public byte[] encode() {
    return toProto().toByteArray();
  }

  public boolean isEmpty() {
    return layers.isEmpty();
  }

  /**
   * A geometry as MVT commands.
   *
   * @see <a href="https://github.com/mapbox/vector-tile-spec/tree/master/2.1#43-geometry-encoding">Geometry
   *      Encoding</a>
   */
  public record VectorGeometry(int[] commands, GeometryType geomType) {

    /**
     * Returns the polygons in tile pixels. A ring winding the same way as the first ring starts a new polygon, the
     * others are holes of the polygon before them.
     *
     * @throws GeometryException if this is not a polygon or the commands are malformed
     */
    public Geometry decode() throws GeometryException {
      if (geomType != GeometryType.POLYGON) {
        throw new GeometryException("decode_unsupported_type", "Only polygons can be decoded, got " + geomType);
      }
      List<Coordinate[]> rings = readRings(commands);
      List<Polygon> polygons = new ArrayList<>();
      LinearRing shell = null;
      List<LinearRing> holes = new ArrayList<>();
      Boolean shellCcw = null;
      try {
        for (Coordinate[] ring : rings) {
          boolean ccw = Orientation.isCCW(ring);
          if (shellCcw == null) {
            shellCcw = ccw;
          }
          if (ccw == shellCcw) {
            if (shell != null) {
              polygons.add(GeoUtils.JTS_FACTORY.createPolygon(shell, holes.toArray(LinearRing[]::new)));
            }
            shell = GeoUtils.JTS_FACTORY.createLinearRing(ring);
            holes.clear();
          } else {
            holes.add(GeoUtils.JTS_FACTORY.createLinearRing(ring));
          }
        }
        if (shell != null) {
          polygons.add(GeoUtils.JTS_FACTORY.createPolygon(shell, holes.toArray(LinearRing[]::new)));
        }
      } catch (IllegalArgumentException e) {
        throw new GeometryException("decode_vector_tile", "Invalid ring in encoded polygon", e);
      }
      return polygons.isEmpty() ? GeoUtils.EMPTY_GEOMETRY : GeoUtils.combinePolygons(polygons);
    }

    private static List<Coordinate[]> readRings(int[] commands) throws GeometryException {
      List<Coordinate[]> rings = new ArrayList<>();
      CoordinateList ring = null;
      int x = 0, y = 0;
      int i = 0;
      while (i < commands.length) {
        int id = commands[i] & 0x7;
        int count = commands[i] >>> 3;
        i++;
        if (id == CLOSE_PATH) {
          if (ring == null) {
            throw new GeometryException("decode_vector_tile", "ClosePath before MoveTo");
          }
          ring.closeRing();
          if (ring.size() >= 4) {
            rings.add(ring.toCoordinateArray());
          }
          ring = null;
          continue;
        }
        if (id != MOVE_TO && id != LINE_TO) {
          throw new GeometryException("decode_vector_tile", "Unknown command " + id);
        }
        if (id == MOVE_TO) {
          ring = new CoordinateList();
        } else if (ring == null) {
          throw new GeometryException("decode_vector_tile", "LineTo before MoveTo");
        }
        if (i + count * 2 > commands.length) {
          throw new GeometryException("decode_vector_tile", "Truncated command at index " + (i - 1));
        }
        for (int n = 0; n < count; n++) {
          x += zigZagDecode(commands[i++]);
          y += zigZagDecode(commands[i++]);
          ring.add(new Coordinate(x / SCALE, y / SCALE), true);
        }
      }
      return rings;
    }

    public boolean isEmpty() {
      return commands.length == 0;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof VectorGeometry other && geomType == other.geomType &&
        Arrays.equals(commands, other.commands);
    }

    @Override
    public int hashCode() {
      return 31 * Arrays.hashCode(commands) + geomType.hashCode();
    }

    @Override
    public String toString() {
      return "VectorGeometry[" + geomType + ", " + commands.length + " commands]";
    }
  }

  /**
   * A feature in a vector tile.
   *
   * @param layer    name of the layer the feature is in
   * @param id       feature id, {@link #NO_FEATURE_ID} leaves it out of the tile
   * @param geometry the encoded geometry
   * @param tags     attributes to write, in order
   */
  public record Feature(
    String layer,
    long id,
    VectorGeometry geometry,
    Map<String, Object> tags
  ) {}

  /** Writes polygon rings as MVT commands, with a cursor that carries over from one ring to the next. */
  private static class RingWriter {

    private final IntArrayList commands = new IntArrayList();
    private final IntArrayList points = new IntArrayList();
    private int cursorX = 0;
    private int cursorY = 0;

    void writePolygon(Polygon polygon) {
      if (polygon.isEmpty() || !writeRing(polygon.getExteriorRing().getCoordinateSequence())) {
        return;
      }
      for (int i = 0; i < polygon.getNumInteriorRing(); i++) {
        writeRing(polygon.getInteriorRingN(i).getCoordinateSequence());
      }
    }

    /** Returns false if the ring had fewer than 3 distinct points on the grid and nothing was written. */
    boolean writeRing(CoordinateSequence ring) {
      points.clear();
      for (int i = 0; i < ring.size(); i++) {
        int px = (int) Math.round(ring.getX(i) * SCALE);
        int py = (int) Math.round(ring.getY(i) * SCALE);
        int n = points.size();
        if (n == 0 || points.get(n - 2) != px || points.get(n - 1) != py) {
          points.add(px, py);
        }
      }
      // ClosePath returns to the first point so it is not written again
      int n = points.size();
      if (n >= 4 && points.get(0) == points.get(n - 2) && points.get(1) == points.get(n - 1)) {
        points.elementsCount -= 2;
      }
      int numPoints = points.size() / 2;
      if (numPoints < 3) {
        return false;
      }
      commands.add(command(MOVE_TO, 1));
      writePoint(0);
      commands.add(command(LINE_TO, numPoints - 1));
      for (int p = 1; p < numPoints; p++) {
        writePoint(p);
      }
      commands.add(command(CLOSE_PATH, 1));
      return true;
    }

    private void writePoint(int index) {
      int px = points.get(index * 2);
      int py = points.get(index * 2 + 1);
      commands.add(zigZagEncode(px - cursorX), zigZagEncode(py - cursorY));
      cursorX = px;
      cursorY = py;
    }
  }

  /** Features of one layer with their shared key and value tables. */
  private static final class LayerBuilder {

    private final Map<String, Integer> keyIndex = new HashMap<>();
    private final Map<Object, Integer> valueIndex = new HashMap<>();
    private final VectorTileProto.Tile.Layer.Builder layer = VectorTileProto.Tile.Layer.newBuilder()
      .setVersion(2)
      .setExtent(EXTENT);

    void add(Feature feature) {
      var builder = VectorTileProto.Tile.Feature.newBuilder()
        .setType(feature.geometry().geomType().asProtobufType())
        .addAllGeometry(Ints.asList(feature.geometry().commands()));
      if (feature.id() != NO_FEATURE_ID) {
        builder.setId(feature.id());
      }
      feature.tags().forEach((key, value) -> {
        if (value != null) {
          builder.addTags(keyIndex.computeIfAbsent(key, this::newKey));
          builder.addTags(valueIndex.computeIfAbsent(value, this::newValue));
        }
      });
      layer.addFeatures(builder);
    }

    private int newKey(String key) {
      layer.addKeys(key);
      return layer.getKeysCount() - 1;
    }

    private int newValue(Object value) {
      layer.addValues(encodeValue(value));
      return layer.getValuesCount() - 1;
    }

    VectorTileProto.Tile.Layer build(String name) {
      return layer.setName(name).build();
    }
  }
}
