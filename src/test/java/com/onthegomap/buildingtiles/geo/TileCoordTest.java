package com.onthegomap.buildingtiles.geo;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.locationtech.jts.geom.Envelope;

class TileCoordTest {

  private static final double MAX_LAT = 85.0511287798066;

  @Test
  void testWholeWorld() {
    Envelope bounds = TileCoord.ofXYZ(0, 0, 0).lonLatBounds();
    assertEquals(-180, bounds.getMinX(), 1e-9);
    assertEquals(180, bounds.getMaxX(), 1e-9);
    assertEquals(-MAX_LAT, bounds.getMinY(), 1e-9);
    assertEquals(MAX_LAT, bounds.getMaxY(), 1e-9);
  }

  @ParameterizedTest
  @CsvSource({
    "0,0,1, -180,0, 0,85.0511287798066",
    "1,0,1, 0,180, 0,85.0511287798066",
    "0,1,1, -180,0, -85.0511287798066,0",
    "1,1,1, 0,180, -85.0511287798066,0",
    "2,1,2, 0,90, 0,66.51326044311186",
  })
  void testLonLatBounds(int x, int y, int z, double minLon, double maxLon, double minLat, double maxLat) {
    Envelope bounds = TileCoord.ofXYZ(x, y, z).lonLatBounds();
    assertEquals(minLon, bounds.getMinX(), 1e-9, "minLon");
    assertEquals(maxLon, bounds.getMaxX(), 1e-9, "maxLon");
    assertEquals(minLat, bounds.getMinY(), 1e-9, "minLat");
    assertEquals(maxLat, bounds.getMaxY(), 1e-9, "maxLat");
  }

  @Test
  void testNeighborsShareEdges() {
    TileCoord tile = TileCoord.ofXYZ(8414, 5384, 14);
    Envelope bounds = tile.lonLatBounds();
    Envelope east = TileCoord.ofXYZ(8415, 5384, 14).lonLatBounds();
    Envelope south = TileCoord.ofXYZ(8414, 5385, 14).lonLatBounds();
    assertEquals(bounds.getMaxX(), east.getMinX(), 0d);
    assertEquals(bounds.getMinY(), south.getMaxY(), 0d);
  }

  @Test
  void testContainsUtrecht() {
    Envelope bounds = TileCoord.ofXYZ(8425, 5405, 14).lonLatBounds();
    assertTrue(bounds.contains(5.12, 52.09), bounds.toString());
  }

  @Test
  void testWorldBounds() {
    assertEquals(new Envelope(0.5, 0.75, 0.25, 0.5), TileCoord.ofXYZ(2, 1, 2).worldBounds());
  }

  @ParameterizedTest
  @CsvSource({
    "0,0,0,true",
    "1,1,1,true",
    "2,0,1,false",
    "0,2,1,false",
    "-1,0,1,false",
    "0,-1,1,false",
    "0,0,-1,false",
    "0,0,31,false",
    "1073741823,1073741823,30,true",
  })
  void testIsValid(int x, int y, int z, boolean valid) {
    assertEquals(valid, TileCoord.ofXYZ(x, y, z).isValid());
  }

  @Test
  void testToString() {
    assertEquals("14/8424/5394", TileCoord.ofXYZ(8424, 5394, 14).toString());
    assertFalse(TileCoord.ofXYZ(0, 0, 0).toString().isEmpty());
  }
}
