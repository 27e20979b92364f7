package com.onthegomap.buildingtiles;

import com.onthegomap.buildingtiles.geo.GeometryException;
import com.onthegomap.buildingtiles.geo.TileCoord;
import com.onthegomap.buildingtiles.geo.TileGeometryClipper;
import com.onthegomap.buildingtiles.stats.Stats;
import com.onthegomap.buildingtiles.store.Building;
import com.onthegomap.buildingtiles.store.BuildingStore;
import com.onthegomap.buildingtiles.store.StoreException;
import com.onthegomap.buildingtiles.view.ViewStateRegister;
import com.onthegomap.buildingtiles.view.ViewStatsTracker;
import com.onthegomap.buildingtiles.view.Viewport;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.jcip.annotations.ThreadSafe;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes building tiles on demand and keeps track of the region clients are viewing.
 * <p>
 * Every tile is queried from the {@link BuildingStore} through the calling thread's own handle, then clipped and
 * encoded. Failures never reach the client: they produce an empty tile and a log line.
 */
@ThreadSafe
public class TileService {

  private static final Logger LOGGER = LoggerFactory.getLogger(TileService.class);
  private static final byte[] EMPTY = new byte[0];

  private final BuildingStore store;
  private final ViewStateRegister register;
  private final ViewStatsTracker statsTracker;
  private final Stats stats;
  private final String layerName;
  private final int minZoom;
  private final int maxZoom;
  private final int tileBuffer;

  public TileService(BuildingStore store, ViewStateRegister register, ViewStatsTracker statsTracker, Stats stats,
    String layerName, int minZoom, int maxZoom, int tileBuffer) {
    this.store = store;
    this.register = register;
    this.statsTracker = statsTracker;
    this.stats = stats;
    this.layerName = layerName;
    this.minZoom = minZoom;
    this.maxZoom = maxZoom;
    this.tileBuffer = tileBuffer;
  }

  /** How a tile request was answered. */
  public enum TileStatus {
    /** The tile was computed from the store, possibly with no features in it. */
    RENDERED,
    /** The zoom is below the minimum zoom so the store was not queried. */
    BELOW_MIN_ZOOM,
    /** Querying or encoding failed, the client gets an empty tile. */
    FAILED
  }

  /** The encoded tile bytes, empty unless {@code status} is {@link TileStatus#RENDERED}. */
  public record TileResult(byte[] data, TileStatus status) {}

  private record Rendered(byte[] data, long queryNanos, int features) {}

  /**
   * Returns the encoded building tile at {@code coord}.
   *
   * @throws IllegalArgumentException if {@code coord} is outside the tile grid
   */
  public TileResult getTile(TileCoord coord) {
    if (!coord.isValid()) {
      throw new IllegalArgumentException("Invalid tile " + coord);
    }
    if (coord.z() < minZoom) {
      return new TileResult(EMPTY, TileStatus.BELOW_MIN_ZOOM);
    }
    long start = System.nanoTime();
    Rendered rendered;
    try {
      rendered = render(coord);
    } catch (StoreException e) {
      stats.storeError("tile");
      LOGGER.warn("Error querying tile {}: {}", coord, e.getMessage(), e.getCause());
      return new TileResult(EMPTY, TileStatus.FAILED);
    } catch (RuntimeException e) {
      stats.dataError("tile_failed");
      LOGGER.error("Error generating tile {}", coord, e);
      return new TileResult(EMPTY, TileStatus.FAILED);
    }
    Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
    stats.servedTile(coord.z(), rendered.data().length, elapsed);
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("Tile {}: total={}ms query={}ms features={} size={}bytes", coord, elapsed.toMillis(),
        Duration.ofNanos(rendered.queryNanos()).toMillis(), rendered.features(), rendered.data().length);
    }
    return new TileResult(rendered.data(), TileStatus.RENDERED);
  }

  private Rendered render(TileCoord coord) {
    long start = System.nanoTime();
    List<Building> buildings = store.handle().queryInBBox(coord.lonLatBounds());
    long queryNanos = System.nanoTime() - start;

    TileGeometryClipper clipper = new TileGeometryClipper(coord, tileBuffer, stats);
    List<VectorTile.Feature> features = new ArrayList<>(buildings.size());
    for (Building building : buildings) {
      try {
        Geometry clipped = clipper.clip(building.geometry());
        if (!clipped.isEmpty()) {
          VectorTile.VectorGeometry encoded = VectorTile.encodeGeometry(clipped);
          if (!encoded.isEmpty()) {
            features.add(new VectorTile.Feature(layerName, VectorTile.NO_FEATURE_ID, encoded, building.tileAttrs()));
          }
        }
      } catch (GeometryException e) {
        e.log(stats, "tile", "Error encoding building " + building.id() + " in tile " + coord);
      }
    }
    byte[] data = new VectorTile().addLayerFeatures(layerName, features).encode();
    return new Rendered(data, queryNanos, features.size());
  }

  /** Replaces the current view with {@code view}. */
  public void updateView(Viewport view) {
    register.setView(view);
    stats.viewUpdated();
  }

  /** Returns the most recent view reported by a client, if any. */
  public Optional<Viewport> currentView() {
    return register.getView();
  }

  /** Returns building stats for the current view, recomputed only if the view changed since the last call. */
  public ViewStatsTracker.Result viewStats() {
    return statsTracker.poll();
  }

  /**
   * Returns a <a href="https://github.com/mapbox/tilejson-spec/tree/master/3.0.0">TileJSON</a> document that points
   * clients at the tile endpoint under {@code baseUrl}.
   */
  public Map<String, Object> tileJson(String baseUrl) {
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("tilejson", "3.0.0");
    result.put("name", layerName);
    result.put("scheme", "xyz");
    result.put("tiles", List.of(baseUrl + "/tiles/{z}/{x}/{y}.pbf"));
    result.put("minzoom", minZoom);
    result.put("maxzoom", maxZoom);
    Map<String, Object> layer = new LinkedHashMap<>();
    layer.put("id", layerName);
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("id", "String");
    fields.put("name", "String");
    fields.put("height", "Number");
    fields.put("class", "String");
    layer.put("fields", fields);
    layer.put("minzoom", minZoom);
    layer.put("maxzoom", maxZoom);
    result.put("vector_layers", List.of(layer));
    return result;
  }

  public int minZoom() {
    return minZoom;
  }

  public String layerName() {
    return layerName;
  }
}
