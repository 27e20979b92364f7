package com.onthegomap.buildingtiles.geo;

import net.jcip.annotations.Immutable;
import org.locationtech.jts.geom.Envelope;

/**
 * The coordinate of a <a href="https://wiki.openstreetmap.org/wiki/Slippy_map_tilenames">slippy map tile</a>.
 *
 * @param x x coordinate of the tile where 0 is the western-most tile just to the east the international date line
 *          and 2^z-1 is the eastern-most tile
 * @param y y coordinate of the tile where 0 is the northern-most tile and 2^z-1 is the southern-most tile
 * @param z zoom level
 */
@Immutable
public record TileCoord(int x, int y, int z) {

  /** Highest zoom level where the number of tiles along an axis still fits in an {@code int}. */
  public static final int MAX_ZOOM = 30;

  public static TileCoord ofXYZ(int x, int y, int z) {
    return new TileCoord(x, y, z);
  }

  /** Returns the number of tiles along each axis at this zoom level. */
  public int tilesPerAxis() {
    return 1 << z;
  }

  /** Returns true if {@code x} and {@code y} both fall inside {@code [0, 2^z)}. */
  public boolean isValid() {
    if (z < 0 || z > MAX_ZOOM) {
      return false;
    }
    int n = tilesPerAxis();
    return x >= 0 && y >= 0 && x < n && y < n;
  }

  /**
   * Returns the longitude/latitude bounding box of this tile where {@code minX/maxX} are longitudes and
   * {@code minY/maxY} are latitudes.
   * <p>
   * Rows increase southward so the northern edge comes from row {@code y} and the southern edge from {@code y + 1}.
   * Neighboring tiles evaluate the same expression for a shared edge, so their bounds meet exactly.
   */
  public Envelope lonLatBounds() {
    double n = tilesPerAxis();
    return new Envelope(
      GeoUtils.getWorldLon(x / n),
      GeoUtils.getWorldLon((x + 1) / n),
      GeoUtils.getWorldLat((y + 1) / n),
      GeoUtils.getWorldLat(y / n)
    );
  }

  /** Returns the web mercator bounds of this tile where the whole world spans (0,0) at the top-left to (1,1). */
  public Envelope worldBounds() {
    double n = tilesPerAxis();
    return new Envelope(x / n, (x + 1) / n, y / n, (y + 1) / n);
  }

  @Override
  public String toString() {
    return z + "/" + x + "/" + y;
  }
}
